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
 
package io.permaudit.spi.content;

import java.util.List;
import java.util.Optional;

import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.ItemInfo;
import io.permaudit.model.resource.ListInfo;
import io.permaudit.model.resource.SiteGroup;
import io.permaudit.model.resource.SiteInfo;

/**
 * Read access to the content hierarchy of the collaboration platform. Implementations raise {@link
 * io.permaudit.model.exception.ContentAccessException} on failure, using {@code NOT_FOUND} and
 * {@code ACCESS_DENIED} error codes where the service reports them.
 *
 * <p>URLs and server-relative paths are exchanged in decoded form in both directions: callers pass
 * them without percent-encoding and implementations report root folders and file refs the same way.
 */
public interface ContentServiceClient {
  /**
   * Connects to the site at the given absolute URL.
   *
   * @param siteUrl absolute URL of a site or subsite
   * @return the site
   */
  SiteInfo connect(String siteUrl);

  /** Direct child sites of a site. */
  List<SiteInfo> getSubsites(String siteUrl);

  /** All lists of a site, hidden and system lists included. */
  List<ListInfo> getLists(String siteUrl);

  /**
   * Returns a page of items of a list ordered by ascending id.
   *
   * @param siteUrl the owning site
   * @param listId the list to read
   * @param afterItemId only items with an id greater than this one are returned
   * @param pageSize maximum number of items to return
   * @return the page, shorter than {@code pageSize} when the list is exhausted
   */
  List<ItemInfo> getItems(String siteUrl, String listId, long afterItemId, int pageSize);

  boolean folderExists(String siteUrl, String serverRelativeUrl);

  /** Role assignments of a site, list or item. */
  List<RoleAssignment> getRoleAssignments(AuditResource resource);

  List<SiteGroup> getSiteGroups(String siteUrl);

  /** Direct members of a site group, typed by {@link io.permaudit.model.principal.PrincipalKind}. */
  List<Principal> getSiteGroupMembers(String siteUrl, String groupId);

  Optional<String> getUserDisplayName(String siteUrl, String loginName);
}
