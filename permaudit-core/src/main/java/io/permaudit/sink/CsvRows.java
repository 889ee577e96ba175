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
 
package io.permaudit.sink;

import java.time.Instant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.Value;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.SiteGroupEntry;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.resource.AuditResource;

/** Row layouts of the CSV files. Column order follows {@link JsonPropertyOrder}. */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class CsvRows {

  @Value
  @JsonPropertyOrder({"Id", "Type", "Title", "Url", "SiteUrl"})
  static class ResourceRow {
    @JsonProperty("Id")
    String id;

    @JsonProperty("Type")
    String type;

    @JsonProperty("Title")
    String title;

    @JsonProperty("Url")
    String url;

    @JsonProperty("SiteUrl")
    String siteUrl;

    static ResourceRow of(AuditResource resource) {
      return new ResourceRow(
          resource.getId(),
          name(resource.getKind()),
          resource.getTitle(),
          resource.getUrl(),
          resource.getSiteUrl());
    }
  }

  @Value
  @JsonPropertyOrder({"Id", "Role", "Title", "PermissionLevel", "Owner", "SiteUrl"})
  static class SiteGroupRow {
    @JsonProperty("Id")
    String id;

    @JsonProperty("Role")
    String role;

    @JsonProperty("Title")
    String title;

    @JsonProperty("PermissionLevel")
    String permissionLevel;

    @JsonProperty("Owner")
    String owner;

    @JsonProperty("SiteUrl")
    String siteUrl;

    static SiteGroupRow of(SiteGroupEntry entry) {
      return new SiteGroupRow(
          entry.getGroupId(),
          name(entry.getRole()),
          entry.getTitle(),
          entry.getPermissionLevel(),
          entry.getOwner(),
          entry.getSiteUrl());
    }
  }

  @Value
  @JsonPropertyOrder({
    "Id",
    "LoginName",
    "DisplayName",
    "Email",
    "PermissionLevel",
    "ViaGroup",
    "ViaGroupId",
    "ViaGroupType",
    "AssignmentType",
    "NestingLevel",
    "ParentGroup",
    "Unresolved",
    "SiteUrl"
  })
  static class SiteUserRow {
    @JsonProperty("Id")
    String id;

    @JsonProperty("LoginName")
    String loginName;

    @JsonProperty("DisplayName")
    String displayName;

    @JsonProperty("Email")
    String email;

    @JsonProperty("PermissionLevel")
    String permissionLevel;

    @JsonProperty("ViaGroup")
    String viaGroup;

    @JsonProperty("ViaGroupId")
    String viaGroupId;

    @JsonProperty("ViaGroupType")
    String viaGroupType;

    @JsonProperty("AssignmentType")
    String assignmentType;

    @JsonProperty("NestingLevel")
    int nestingLevel;

    @JsonProperty("ParentGroup")
    String parentGroup;

    @JsonProperty("Unresolved")
    String unresolved;

    @JsonProperty("SiteUrl")
    String siteUrl;

    static SiteUserRow of(AccessEntry entry) {
      Principal principal = entry.getPrincipal();
      return new SiteUserRow(
          principal.getId(),
          principal.getLoginName(),
          principal.getDisplayName(),
          principal.getEmail(),
          entry.getPermissionLevel(),
          entry.getViaGroup(),
          entry.getViaGroupId(),
          name(entry.getViaGroupKind()),
          name(entry.getAssignmentType()),
          entry.getNestingLevel(),
          entry.getParentGroup(),
          name(entry.getUnresolvedReason()),
          entry.getResource().getSiteUrl());
    }
  }

  @Value
  @JsonPropertyOrder({
    "Id",
    "Type",
    "Url",
    "LoginName",
    "DisplayName",
    "Email",
    "PermissionLevel",
    "SharedDateTime",
    "SharedByDisplayName",
    "SharedByLoginName",
    "ViaGroup",
    "ViaGroupId",
    "ViaGroupType",
    "AssignmentType",
    "NestingLevel",
    "ParentGroup",
    "Unresolved"
  })
  static class AccessRow {
    @JsonProperty("Id")
    String id;

    @JsonProperty("Type")
    String type;

    @JsonProperty("Url")
    String url;

    @JsonProperty("LoginName")
    String loginName;

    @JsonProperty("DisplayName")
    String displayName;

    @JsonProperty("Email")
    String email;

    @JsonProperty("PermissionLevel")
    String permissionLevel;

    @JsonProperty("SharedDateTime")
    String sharedDateTime;

    @JsonProperty("SharedByDisplayName")
    String sharedByDisplayName;

    @JsonProperty("SharedByLoginName")
    String sharedByLoginName;

    @JsonProperty("ViaGroup")
    String viaGroup;

    @JsonProperty("ViaGroupId")
    String viaGroupId;

    @JsonProperty("ViaGroupType")
    String viaGroupType;

    @JsonProperty("AssignmentType")
    String assignmentType;

    @JsonProperty("NestingLevel")
    int nestingLevel;

    @JsonProperty("ParentGroup")
    String parentGroup;

    @JsonProperty("Unresolved")
    String unresolved;

    static AccessRow of(AccessEntry entry) {
      Principal principal = entry.getPrincipal();
      AuditResource resource = entry.getResource();
      Instant sharedAt = entry.getSharedAt();
      return new AccessRow(
          resource.getId(),
          name(resource.getKind()),
          resource.getUrl(),
          principal.getLoginName(),
          principal.getDisplayName(),
          principal.getEmail(),
          entry.getPermissionLevel(),
          sharedAt == null ? null : sharedAt.toString(),
          entry.getSharedByDisplayName(),
          entry.getSharedByLogin(),
          entry.getViaGroup(),
          entry.getViaGroupId(),
          name(entry.getViaGroupKind()),
          name(entry.getAssignmentType()),
          entry.getNestingLevel(),
          entry.getParentGroup(),
          name(entry.getUnresolvedReason()));
    }
  }

  private static String name(Enum<?> value) {
    return value == null ? null : value.name();
  }
}
