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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.access.SiteGroupEntry;
import io.permaudit.model.access.SiteGroupRole;
import io.permaudit.model.principal.PrincipalKind;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.SiteGroup;
import io.permaudit.resolve.ResolutionContext;
import io.permaudit.resolve.ResolvedAccess;
import io.permaudit.spi.content.ContentServiceClient;

/**
 * Reads the role assignments of a site. Site groups holding a substantive permission level are
 * reported as site groups; accounts assigned directly and the resolved members of every assigned
 * group are reported as site users.
 */
@Log4j2
public class SiteSecurityScanner {
  private final ContentServiceClient contentClient;
  private final PermissionAccessor permissionAccessor;
  private final Set<String> ignoredSiteGroups;

  public SiteSecurityScanner(
      @NonNull ContentServiceClient contentClient,
      @NonNull PermissionAccessor permissionAccessor,
      @NonNull AuditSettings settings) {
    this.contentClient = contentClient;
    this.permissionAccessor = permissionAccessor;
    this.ignoredSiteGroups =
        settings.getIgnoreSiteGroups().stream()
            .map(title -> title.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
  }

  public SiteSecurity scan(ResolutionContext context, AuditResource site) {
    String siteUrl = site.getSiteUrl();
    List<RoleAssignment> assignments = contentClient.getRoleAssignments(site);
    log.info("{} role assignments found on site {}", assignments.size(), siteUrl);

    Map<String, List<String>> siteGroupLevels = new LinkedHashMap<>();
    List<AccessEntry> users = new ArrayList<>();
    for (RoleAssignment assignment : assignments) {
      List<String> levels = permissionAccessor.substantiveLevels(assignment);
      if (levels.isEmpty()) {
        continue;
      }
      if (assignment.getPrincipal().getKind() == PrincipalKind.SITE_GROUP) {
        // members are added below, for the groups that are not ignored
        siteGroupLevels.put(assignment.getPrincipal().getId(), levels);
      } else {
        users.addAll(toSiteUsers(context, site, assignment, levels));
      }
    }

    List<SiteGroupEntry> groups = new ArrayList<>();
    for (SiteGroup group : contentClient.getSiteGroups(siteUrl)) {
      List<String> levels = siteGroupLevels.get(group.getId());
      if (levels == null
          || (group.getTitle() != null
              && ignoredSiteGroups.contains(group.getTitle().toLowerCase(Locale.ROOT)))) {
        continue;
      }
      for (String level : levels) {
        groups.add(
            SiteGroupEntry.builder()
                .siteUrl(siteUrl)
                .groupId(group.getId())
                .role(SiteGroupRole.fromTitle(group.getTitle()))
                .title(group.getTitle())
                .permissionLevel(level)
                .owner(group.getOwnerTitle())
                .build());
      }
      RoleAssignment groupAssignment =
          RoleAssignment.builder().principal(group.toPrincipal()).permissionLevels(levels).build();
      users.addAll(toSiteUsers(context, site, groupAssignment, levels));
    }
    log.info("{} site groups and {} site users found on site {}", groups.size(), users.size(), siteUrl);
    return SiteSecurity.builder().siteGroups(groups).siteUsers(users).build();
  }

  private List<AccessEntry> toSiteUsers(
      ResolutionContext context, AuditResource site, RoleAssignment assignment, List<String> levels) {
    List<AccessEntry> rows = new ArrayList<>();
    for (ResolvedAccess access : permissionAccessor.resolve(context, site.getSiteUrl(), assignment)) {
      for (String level : levels) {
        rows.add(PermissionAccessor.toEntry(site, access, level, access.getAssignmentType()));
      }
    }
    return rows;
  }
}
