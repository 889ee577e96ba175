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
 
package io.permaudit.model.resource;

import java.util.Collections;
import java.util.Map;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A list item, file or folder. Items are paged by ascending {@code id}. */
@Value
@Builder
@Jacksonized
public class ItemInfo {
  long id;
  /** Server-relative URL of the item. */
  String fileRef;

  String fileLeafRef;
  boolean folder;
  boolean uniqueRoleAssignments;
  /** Share metadata keyed by the login name of the account the item was shared with. */
  @Builder.Default Map<String, ShareInfo> sharedWith = Collections.emptyMap();
}
