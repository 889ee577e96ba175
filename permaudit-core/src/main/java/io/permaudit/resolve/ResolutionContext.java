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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.NonNull;

import io.permaudit.model.principal.Principal;

/**
 * Lookup caches scoped to one job. Site group members, user display names and group objects are
 * only valid for the sites of the current job; the orchestrator creates a new context for every
 * job. Directory group members are tenant-global and delegated to the shared {@link
 * DirectoryGroupCache}.
 *
 * <p>A loader that throws leaves nothing cached, so a failed lookup is retried the next time the
 * group is referenced.
 */
public class ResolutionContext {
  @Getter private final DirectoryGroupCache directoryGroupCache;
  private final Map<String, List<Principal>> siteGroupMembers = new HashMap<>();
  private final Map<String, Optional<String>> userDisplayNames = new HashMap<>();
  private final Map<String, Optional<Principal>> groupObjects = new HashMap<>();

  public ResolutionContext(@NonNull DirectoryGroupCache directoryGroupCache) {
    this.directoryGroupCache = directoryGroupCache;
  }

  public List<Principal> getSiteGroupMembers(
      String siteUrl, String groupId, Supplier<List<Principal>> loader) {
    return siteGroupMembers.computeIfAbsent(siteUrl + "|" + groupId, key -> loader.get());
  }

  public List<Principal> getDirectoryGroupMembers(
      String groupId, Supplier<List<Principal>> loader) {
    return directoryGroupCache.getMembers(groupId, loader);
  }

  public Optional<String> getUserDisplayName(String loginName, Supplier<Optional<String>> loader) {
    return userDisplayNames.computeIfAbsent(loginName, key -> loader.get());
  }

  public Optional<Principal> getGroupObject(String groupId, Supplier<Optional<Principal>> loader) {
    return groupObjects.computeIfAbsent(groupId, key -> loader.get());
  }

  public int getSiteGroupMemberCacheSize() {
    return siteGroupMembers.size();
  }
}
