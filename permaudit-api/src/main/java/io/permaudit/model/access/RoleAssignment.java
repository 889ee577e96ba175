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
 
package io.permaudit.model.access;

import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import io.permaudit.model.principal.Principal;

/** A principal and the permission levels it holds on one node. */
@Value
@Builder
@Jacksonized
public class RoleAssignment {
  Principal principal;
  @Builder.Default List<String> permissionLevels = Collections.emptyList();
  /** True when the principal was created for a sharing link rather than granted explicitly. */
  boolean sharingLink;
}
