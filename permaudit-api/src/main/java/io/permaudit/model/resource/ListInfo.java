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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A list or library of a site. */
@Value
@Builder
@Jacksonized
public class ListInfo {
  String id;
  String title;
  /** Platform template id, e.g. 100 for a generic list or 101 for a document library. */
  int baseTemplate;

  boolean hidden;
  /** Server-relative URL of the list's root folder, e.g. {@code /sites/A/Shared Documents}. */
  String rootFolderUrl;

  boolean uniqueRoleAssignments;
}
