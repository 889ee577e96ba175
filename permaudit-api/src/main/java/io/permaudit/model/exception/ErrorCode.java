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

public enum ErrorCode {
  INVALID_CONFIGURATION(10001),
  INVALID_URL(10002),
  NOT_FOUND(10003),
  ACCESS_DENIED(10004),
  CONTENT_ACCESS(10005),
  RESOLUTION(10006),
  SINK(10007),
  CHECKPOINT(10008),
  PARSE_EXCEPTION(10009),
  TIMEOUT(10010);

  private final int errorCode;

  ErrorCode(int errorCode) {
    this.errorCode = errorCode;
  }

  public int getErrorCode() {
    return errorCode;
  }

  /** Errors that a retry cannot fix: the resource is missing or the caller is not allowed in. */
  public boolean isPermanent() {
    return this == NOT_FOUND || this == ACCESS_DENIED || this == INVALID_URL;
  }
}
