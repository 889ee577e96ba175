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

/**
 * A node of the content tree as read during a walk: a site, subsite, list or item. Immutable once
 * read. {@code id} is unique within the site; rows of all output streams are joined on it.
 */
@Value
@Builder(toBuilder = true)
public class AuditResource {
  String id;
  ResourceKind kind;
  String title;
  /** Absolute URL for sites, server-relative URL for lists and items. */
  String url;
  /** Absolute URL of the site owning this node. */
  String siteUrl;
  /** Owning list for lists and items, null for sites. */
  String listId;

  boolean uniqueRoleAssignments;
  @Builder.Default Map<String, ShareInfo> sharedWith = Collections.emptyMap();

  public static AuditResource forSite(SiteInfo site) {
    return AuditResource.builder()
        .id(site.getId())
        .kind(site.isRootWeb() ? ResourceKind.SITE : ResourceKind.SUBSITE)
        .title(site.getTitle())
        .url(site.getUrl())
        .siteUrl(site.getUrl())
        .uniqueRoleAssignments(site.isUniqueRoleAssignments())
        .build();
  }

  public static AuditResource forList(String siteUrl, ListInfo list, ResourceKind kind) {
    return AuditResource.builder()
        .id(list.getId())
        .kind(kind)
        .title(list.getTitle())
        .url(list.getRootFolderUrl())
        .siteUrl(siteUrl)
        .listId(list.getId())
        .uniqueRoleAssignments(list.isUniqueRoleAssignments())
        .build();
  }

  public static AuditResource forItem(String siteUrl, ListInfo list, ItemInfo item) {
    return AuditResource.builder()
        .id(String.valueOf(item.getId()))
        .kind(item.isFolder() ? ResourceKind.FOLDER : ResourceKind.ITEM)
        .title(item.getFileLeafRef())
        .url(item.getFileRef())
        .siteUrl(siteUrl)
        .listId(list.getId())
        .uniqueRoleAssignments(item.isUniqueRoleAssignments())
        .sharedWith(item.getSharedWith() == null ? Collections.emptyMap() : item.getSharedWith())
        .build();
  }
}
