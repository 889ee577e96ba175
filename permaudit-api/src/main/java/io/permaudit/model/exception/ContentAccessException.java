/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package io.permaudit.model.exception;

/** Exception thrown when the content service cannot serve a site, list, item or group request. */
public class ContentAccessException extends InternalException {
  public ContentAccessException(ErrorCode errorCode, String message, Throwable e) {
    super(errorCode, message, e);
  }

  public ContentAccessException(ErrorCode errorCode, String message) {
    super(errorCode, message);
  }

  public ContentAccessException(String message, Throwable e) {
    super(ErrorCode.CONTENT_ACCESS, message, e);
  }

  public static ContentAccessException notFound(String url) {
    return new ContentAccessException(ErrorCode.NOT_FOUND, "Not found: " + url);
  }

  public static ContentAccessException accessDenied(String url) {
    return new ContentAccessException(ErrorCode.ACCESS_DENIED, "Access denied: " + url);
  }
}
