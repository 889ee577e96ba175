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
 
package io.permaudit.resolve;

import lombok.Builder;
import lombok.Value;

import io.permaudit.model.access.AssignmentType;
import io.permaudit.model.access.UnresolvedReason;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.principal.PrincipalKind;

/** A leaf account, or an unexpanded group placeholder, produced by resolving a group. */
@Value
@Builder
public class ResolvedAccess {
  Principal principal;
  String viaGroup;
  String viaGroupId;
  PrincipalKind viaGroupKind;
  int nestingLevel;
  String parentGroup;
  AssignmentType assignmentType;
  UnresolvedReason unresolvedReason;

  public boolean isPlaceholder() {
    return unresolvedReason != null;
  }
}
