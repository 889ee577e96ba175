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

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

import io.permaudit.model.principal.Principal;
import io.permaudit.model.principal.PrincipalKind;
import io.permaudit.model.resource.AuditResource;

/**
 * One flattened access row: a resolved principal holding a permission level on a resource, with
 * the group chain that granted it.
 */
@Value
@Builder(toBuilder = true)
public class AccessEntry {
  AuditResource resource;
  // Leaf account, or the group itself for a placeholder row.
  Principal principal;
  String permissionLevel;
  // Group whose membership contained the principal, empty for direct grants.
  String viaGroup;
  String viaGroupId;
  PrincipalKind viaGroupKind;
  int nestingLevel;
  // Group that contained viaGroup, empty at the first level.
  String parentGroup;
  AssignmentType assignmentType;
  Instant sharedAt;
  String sharedByLogin;
  String sharedByDisplayName;
  // Set only on placeholder rows.
  UnresolvedReason unresolvedReason;

  public boolean isPlaceholder() {
    return unresolvedReason != null;
  }
}
