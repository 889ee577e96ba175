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
 
package io.permaudit.spi.directory;

import java.util.List;
import java.util.Optional;

import io.permaudit.model.principal.Principal;

/**
 * Read access to the tenant directory. Implementations raise {@link
 * io.permaudit.model.exception.ResolutionException} on failure.
 */
public interface DirectoryServiceClient {
  /**
   * Fetches the properties of a directory group.
   *
   * @param groupId opaque directory object id
   * @return the group, empty if the directory does not know it
   */
  Optional<Principal> getGroup(String groupId);

  /**
   * Fetches the direct members of a directory group. Nested groups are returned as group
   * principals, not expanded.
   *
   * @param groupId opaque directory object id
   * @return direct members, typed by {@link io.permaudit.model.principal.PrincipalKind}
   */
  List<Principal> getGroupMembers(String groupId);
}
