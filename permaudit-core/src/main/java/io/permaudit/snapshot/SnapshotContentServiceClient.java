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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;

import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.ItemInfo;
import io.permaudit.model.resource.ListInfo;
import io.permaudit.model.resource.SiteGroup;
import io.permaudit.model.resource.SiteInfo;
import io.permaudit.paths.UrlPathUtils;
import io.permaudit.spi.content.ContentServiceClient;

/** Serves the content hierarchy of a {@link TenantSnapshot}. */
public class SnapshotContentServiceClient implements ContentServiceClient {
  private final TenantSnapshot snapshot;
  private final Map<String, TenantSnapshot.Site> sitesByUrl = new HashMap<>();
  private final Set<String> deniedUrls = new HashSet<>();

  public SnapshotContentServiceClient(@NonNull TenantSnapshot snapshot) {
    this.snapshot = snapshot;
    snapshot.getSites().forEach(this::index);
    snapshot.getDeniedUrls().forEach(url -> deniedUrls.add(key(url)));
  }

  private void index(TenantSnapshot.Site site) {
    sitesByUrl.put(key(site.getUrl()), site);
    site.getSubsites().forEach(this::index);
  }

  @Override
  public SiteInfo connect(String siteUrl) {
    return toSiteInfo(site(siteUrl));
  }

  @Override
  public List<SiteInfo> getSubsites(String siteUrl) {
    return site(siteUrl).getSubsites().stream()
        .map(SnapshotContentServiceClient::toSiteInfo)
        .collect(Collectors.toList());
  }

  @Override
  public List<ListInfo> getLists(String siteUrl) {
    return site(siteUrl).getLists().stream()
        .map(
            list ->
                ListInfo.builder()
                    .id(list.getId())
                    .title(list.getTitle())
                    .baseTemplate(list.getBaseTemplate())
                    .hidden(list.isHidden())
                    .rootFolderUrl(list.getRootFolderUrl())
                    .uniqueRoleAssignments(list.isUniqueRoleAssignments())
                    .build())
        .collect(Collectors.toList());
  }

  @Override
  public List<ItemInfo> getItems(String siteUrl, String listId, long afterItemId, int pageSize) {
    return list(siteUrl, listId).getItems().stream()
        .filter(item -> item.getId() > afterItemId)
        .sorted(Comparator.comparingLong(TenantSnapshot.Item::getId))
        .limit(pageSize)
        .map(
            item ->
                ItemInfo.builder()
                    .id(item.getId())
                    .fileRef(item.getFileRef())
                    .fileLeafRef(item.getFileLeafRef())
                    .folder(item.isFolder())
                    .uniqueRoleAssignments(item.isUniqueRoleAssignments())
                    .sharedWith(item.getSharedWith())
                    .build())
        .collect(Collectors.toList());
  }

  @Override
  public boolean folderExists(String siteUrl, String serverRelativeUrl) {
    String folder = UrlPathUtils.cleanPath(serverRelativeUrl);
    return site(siteUrl).getLists().stream()
        .flatMap(list -> list.getItems().stream())
        .anyMatch(
            item ->
                item.isFolder()
                    && item.getFileRef() != null
                    && UrlPathUtils.cleanPath(item.getFileRef()).equalsIgnoreCase(folder));
  }

  @Override
  public List<RoleAssignment> getRoleAssignments(AuditResource resource) {
    switch (resource.getKind()) {
      case SITE:
      case SUBSITE:
        return site(resource.getSiteUrl()).getRoleAssignments();
      case LIST:
      case LIBRARY:
      case SITE_PAGES:
        return list(resource.getSiteUrl(), resource.getListId()).getRoleAssignments();
      default:
        long itemId = Long.parseLong(resource.getId());
        return list(resource.getSiteUrl(), resource.getListId()).getItems().stream()
            .filter(item -> item.getId() == itemId)
            .findFirst()
            .orElseThrow(() -> ContentAccessException.notFound(resource.getUrl()))
            .getRoleAssignments();
    }
  }

  @Override
  public List<SiteGroup> getSiteGroups(String siteUrl) {
    List<SiteGroup> groups = new ArrayList<>();
    for (TenantSnapshot.SiteGroup group : site(siteUrl).getSiteGroups()) {
      groups.add(
          SiteGroup.builder()
              .id(group.getId())
              .title(group.getTitle())
              .loginName(group.getLoginName())
              .ownerTitle(group.getOwnerTitle())
              .build());
    }
    return groups;
  }

  @Override
  public List<Principal> getSiteGroupMembers(String siteUrl, String groupId) {
    return site(siteUrl).getSiteGroups().stream()
        .filter(group -> group.getId().equals(groupId))
        .findFirst()
        .orElseThrow(
            () -> ContentAccessException.notFound("site group " + groupId + " on " + siteUrl))
        .getMembers();
  }

  @Override
  public Optional<String> getUserDisplayName(String siteUrl, String loginName) {
    return Optional.ofNullable(snapshot.getUsers().get(loginName));
  }

  private TenantSnapshot.Site site(String siteUrl) {
    String key = key(siteUrl);
    if (deniedUrls.contains(key)) {
      throw ContentAccessException.accessDenied(siteUrl);
    }
    TenantSnapshot.Site site = sitesByUrl.get(key);
    if (site == null) {
      throw ContentAccessException.notFound(siteUrl);
    }
    return site;
  }

  private TenantSnapshot.SiteList list(String siteUrl, String listId) {
    return site(siteUrl).getLists().stream()
        .filter(list -> list.getId().equals(listId))
        .findFirst()
        .orElseThrow(() -> ContentAccessException.notFound("list " + listId + " on " + siteUrl));
  }

  private static SiteInfo toSiteInfo(TenantSnapshot.Site site) {
    return SiteInfo.builder()
        .id(site.getId())
        .title(site.getTitle())
        .url(UrlPathUtils.cleanUrl(site.getUrl()))
        .rootWeb(site.isRootWeb())
        .uniqueRoleAssignments(site.isUniqueRoleAssignments())
        .build();
  }

  private static String key(String url) {
    return UrlPathUtils.cleanUrl(url).toLowerCase(Locale.ROOT);
  }
}
