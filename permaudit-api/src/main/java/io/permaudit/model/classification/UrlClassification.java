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
 
package io.permaudit.model.classification;

import lombok.Builder;
import lombok.Value;

import io.permaudit.model.exception.ErrorCode;

/**
 * Result of classifying an input URL. For libraries and folders {@code listRootFolderUrl} names the
 * list to scan and, for folders, {@code folderUrl} the server-relative folder to restrict items to.
 */
@Value
@Builder
public class UrlClassification {
  String inputUrl;
  UrlKind kind;
  /** Normalized absolute URL of the site owning the target. */
  String siteUrl;
  /** Path of the target relative to {@code siteUrl}, empty for sites. */
  String relativePath;

  String listRootFolderUrl;
  String folderUrl;
  ErrorCode errorCode;
  String errorMessage;

  public boolean isError() {
    return kind == UrlKind.ERROR;
  }

  public static UrlClassification error(String inputUrl, ErrorCode errorCode, String message) {
    return UrlClassification.builder()
        .inputUrl(inputUrl)
        .kind(UrlKind.ERROR)
        .errorCode(errorCode)
        .errorMessage(message)
        .build();
  }
}
