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
 
package io.permaudit.access;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.AssignmentType;
import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.access.UnresolvedReason;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.ShareInfo;
import io.permaudit.resolve.GroupResolver;
import io.permaudit.resolve.ResolutionContext;
import io.permaudit.resolve.ResolvedAccess;
import io.permaudit.spi.content.ContentServiceClient;

/**
 * Reads the role assignments of a node with unique permissions and flattens them into access
 * rows, one per resolved account and permission level.
 */
@Log4j2
public class PermissionAccessor {
  /** Rows are ordered by display name, then login name. */
  static final Comparator<AccessEntry> ENTRY_ORDER =
      Comparator.comparing(
              (AccessEntry entry) -> entry.getPrincipal().getLabel(), String.CASE_INSENSITIVE_ORDER)
          .thenComparing(
              entry -> entry.getPrincipal().getLoginName(),
              Comparator.nullsFirst(Comparator.<String>naturalOrder()));

  private final ContentServiceClient contentClient;
  private final GroupResolver groupResolver;
  private final Set<String> ignoredPermissionLevels;

  public PermissionAccessor(
      @NonNull ContentServiceClient contentClient,
      @NonNull GroupResolver groupResolver,
      @NonNull AuditSettings settings) {
    this.contentClient = contentClient;
    this.groupResolver = groupResolver;
    this.ignoredPermissionLevels =
        settings.getIgnorePermissionLevels().stream()
            .map(level -> level.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
  }

  /**
   * Returns the access rows of a node.
   *
   * @throws ContentAccessException if the role assignments of the node cannot be read
   */
  public List<AccessEntry> getAccessEntries(ResolutionContext context, AuditResource resource) {
    List<AccessEntry> entries = new ArrayList<>();
    Map<String, ShareInfo> shares = sharesByLogin(resource);
    for (RoleAssignment assignment : contentClient.getRoleAssignments(resource)) {
      List<String> levels = substantiveLevels(assignment);
      if (levels.isEmpty()) {
        continue;
      }
      for (ResolvedAccess access : resolve(context, resource.getSiteUrl(), assignment)) {
        ShareInfo share =
            access.getPrincipal().getLoginName() == null
                ? null
                : shares.get(access.getPrincipal().getLoginName().toLowerCase(Locale.ROOT));
        if (share != null) {
          share = withSharerName(context, resource.getSiteUrl(), share);
        }
        for (String level : levels) {
          AccessEntry entry =
              toEntry(
                  resource,
                  access,
                  level,
                  assignment.isSharingLink()
                      ? AssignmentType.SHARING_LINK
                      : access.getAssignmentType());
          if (share != null) {
            entry =
                entry.toBuilder()
                    .sharedAt(share.getSharedAt())
                    .sharedByLogin(share.getSharedByLogin())
                    .sharedByDisplayName(share.getSharedByDisplayName())
                    .build();
          }
          entries.add(entry);
        }
      }
    }
    entries.sort(ENTRY_ORDER);
    return entries;
  }

  /** Permission levels of the assignment without the ignored ones, in assignment order. */
  List<String> substantiveLevels(RoleAssignment assignment) {
    return assignment.getPermissionLevels().stream()
        .filter(level -> !ignoredPermissionLevels.contains(level.toLowerCase(Locale.ROOT)))
        .collect(Collectors.toList());
  }

  /** Resolves the principal of an assignment: groups through the resolver, accounts directly. */
  List<ResolvedAccess> resolve(
      ResolutionContext context, String siteUrl, RoleAssignment assignment) {
    Principal principal = assignment.getPrincipal();
    if (principal.isGroup()) {
      return groupResolver.resolve(context, siteUrl, principal);
    }
    if (groupResolver.isIgnoredAccount(principal)) {
      return List.of();
    }
    return List.of(
        ResolvedAccess.builder()
            .principal(principal)
            .nestingLevel(0)
            .assignmentType(AssignmentType.DIRECT)
            .build());
  }

  /**
   * The single row reported for a node whose role assignments cannot be read. It names the node
   * and carries no principal details.
   */
  public static AccessEntry unreadableEntry(AuditResource resource) {
    return AccessEntry.builder()
        .resource(resource)
        .principal(Principal.builder().build())
        .unresolvedReason(UnresolvedReason.ASSIGNMENTS_UNREADABLE)
        .build();
  }

  static AccessEntry toEntry(
      AuditResource resource, ResolvedAccess access, String level, AssignmentType type) {
    return AccessEntry.builder()
        .resource(resource)
        .principal(access.getPrincipal())
        .permissionLevel(level)
        .viaGroup(access.getViaGroup())
        .viaGroupId(access.getViaGroupId())
        .viaGroupKind(access.getViaGroupKind())
        .nestingLevel(access.getNestingLevel())
        .parentGroup(access.getParentGroup())
        .assignmentType(type)
        .unresolvedReason(access.getUnresolvedReason())
        .build();
  }

  private static Map<String, ShareInfo> sharesByLogin(AuditResource resource) {
    Map<String, ShareInfo> shares = new HashMap<>();
    resource
        .getSharedWith()
        .forEach((login, share) -> shares.put(login.toLowerCase(Locale.ROOT), share));
    return shares;
  }

  private ShareInfo withSharerName(ResolutionContext context, String siteUrl, ShareInfo share) {
    if (share.getSharedByDisplayName() != null || share.getSharedByLogin() == null) {
      return share;
    }
    String login = share.getSharedByLogin();
    try {
      Optional<String> name =
          context.getUserDisplayName(login, () -> contentClient.getUserDisplayName(siteUrl, login));
      return name.map(n -> share.toBuilder().sharedByDisplayName(n).build()).orElse(share);
    } catch (ContentAccessException e) {
      log.warn("Unable to look up display name of {} on {}", login, siteUrl, e);
      return share;
    }
  }
}
