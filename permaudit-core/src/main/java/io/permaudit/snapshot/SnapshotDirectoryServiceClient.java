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
 
package io.permaudit.snapshot;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.NonNull;

import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.exception.ResolutionException;
import io.permaudit.model.principal.Principal;
import io.permaudit.spi.directory.DirectoryServiceClient;

/** Serves the directory groups of a {@link TenantSnapshot}. */
public class SnapshotDirectoryServiceClient implements DirectoryServiceClient {
  private final Map<String, TenantSnapshot.DirectoryGroup> groups = new HashMap<>();

  public SnapshotDirectoryServiceClient(@NonNull TenantSnapshot snapshot) {
    snapshot.getDirectoryGroups().forEach(group -> groups.put(group.getId(), group));
  }

  @Override
  public Optional<Principal> getGroup(String groupId) {
    return Optional.ofNullable(groups.get(groupId))
        .map(
            group ->
                Principal.builder()
                    .id(group.getId())
                    .kind(group.getKind())
                    .displayName(group.getDisplayName())
                    .email(group.getEmail())
                    .build());
  }

  @Override
  public List<Principal> getGroupMembers(String groupId) {
    TenantSnapshot.DirectoryGroup group = groups.get(groupId);
    if (group == null) {
      throw new ResolutionException(ErrorCode.NOT_FOUND, "Unknown directory group " + groupId);
    }
    return group.getMembers();
  }
}
