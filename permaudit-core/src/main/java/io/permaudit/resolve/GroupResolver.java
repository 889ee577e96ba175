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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import lombok.NonNull;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.access.AssignmentType;
import io.permaudit.model.access.UnresolvedReason;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.exception.ResolutionException;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.principal.PrincipalKind;
import io.permaudit.spi.content.ContentServiceClient;
import io.permaudit.spi.directory.DirectoryServiceClient;

/**
 * Flattens a group principal into the accounts it grants access to, following site groups and
 * nested directory groups.
 *
 * <p>Resolution works off an explicit stack of frames. Members of the assigned group itself are
 * reported at nesting level 0 with assignment type {@link AssignmentType#DIRECT}; members of a
 * nested group are reported at the nesting level of that group with type {@link
 * AssignmentType#GROUP}. A group is never silently dropped: groups listed in {@code
 * doNotResolveGroups}, groups deeper than {@code maxGroupNestingLevel} and groups whose members
 * cannot be read each yield exactly one placeholder naming the group.
 */
@Log4j2
public class GroupResolver {
  private final ContentServiceClient contentClient;
  private final DirectoryServiceClient directoryClient;
  private final int maxNestingLevel;
  private final Set<String> doNotResolve;
  private final List<String> ignoredAccounts;

  public GroupResolver(
      @NonNull ContentServiceClient contentClient,
      @NonNull DirectoryServiceClient directoryClient,
      @NonNull AuditSettings settings) {
    this.contentClient = contentClient;
    this.directoryClient = directoryClient;
    this.maxNestingLevel = settings.getMaxGroupNestingLevel();
    this.doNotResolve = new HashSet<>();
    settings.getDoNotResolveGroups().forEach(name -> doNotResolve.add(name.toLowerCase(Locale.ROOT)));
    this.ignoredAccounts = new ArrayList<>();
    settings
        .getIgnoreAccounts()
        .forEach(account -> ignoredAccounts.add(account.toLowerCase(Locale.ROOT)));
  }

  @Value
  private static class Frame {
    String groupId;
    String displayName;
    PrincipalKind kind;
    int nestingLevel;
    String parentGroup;
  }

  /**
   * Resolves a group assigned on a resource of {@code siteUrl}.
   *
   * @param context caches of the current job
   * @param siteUrl site the assignment was read from, scopes site group lookups
   * @param group a principal of a group kind
   * @return accounts and placeholders in depth-first order
   */
  public List<ResolvedAccess> resolve(ResolutionContext context, String siteUrl, Principal group) {
    if (!group.isGroup()) {
      throw new IllegalArgumentException("Not a group: " + group.getLabel());
    }
    List<ResolvedAccess> result = new ArrayList<>();
    Set<String> expanded = new HashSet<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(group.getId(), group.getDisplayName(), group.getKind(), 0, null));

    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      String groupName = displayNameOf(context, frame);
      if (isExcluded(frame, groupName)) {
        log.debug("Not resolving excluded group {} ({})", groupName, frame.getGroupId());
        result.add(placeholder(frame, groupName, UnresolvedReason.EXCLUDED));
        continue;
      }
      if (frame.getNestingLevel() > maxNestingLevel) {
        log.debug(
            "Group {} ({}) is nested deeper than {}",
            groupName,
            frame.getGroupId(),
            maxNestingLevel);
        result.add(placeholder(frame, groupName, UnresolvedReason.DEPTH_LIMIT));
        continue;
      }
      if (!expanded.add(frame.getKind() + ":" + frame.getGroupId())) {
        log.info(
            "Group {} ({}) was already expanded while resolving {}, skipping",
            groupName,
            frame.getGroupId(),
            group.getLabel());
        continue;
      }

      List<Principal> members;
      try {
        members = loadMembers(context, siteUrl, frame);
      } catch (ResolutionException | ContentAccessException e) {
        log.warn(
            "Unable to read members of group {} ({}) on site {}",
            groupName,
            frame.getGroupId(),
            siteUrl,
            e);
        result.add(placeholder(frame, groupName, UnresolvedReason.LOOKUP_FAILED));
        continue;
      }

      List<Frame> nested = new ArrayList<>();
      for (Principal member : members) {
        if (member.isGroup()) {
          nested.add(
              new Frame(
                  member.getId(),
                  member.getDisplayName(),
                  member.getKind(),
                  frame.getNestingLevel() + 1,
                  groupName));
        } else if (!isIgnoredAccount(member)) {
          result.add(
              ResolvedAccess.builder()
                  .principal(member)
                  .viaGroup(groupName)
                  .viaGroupId(frame.getGroupId())
                  .viaGroupKind(frame.getKind())
                  .nestingLevel(frame.getNestingLevel())
                  .parentGroup(frame.getParentGroup())
                  .assignmentType(
                      frame.getNestingLevel() == 0 ? AssignmentType.DIRECT : AssignmentType.GROUP)
                  .build());
        }
      }
      // reversed, so nested groups are expanded in member order
      for (int i = nested.size() - 1; i >= 0; i--) {
        stack.push(nested.get(i));
      }
    }
    return result;
  }

  /** True when the login name contains one of the ignored account patterns. */
  public boolean isIgnoredAccount(Principal principal) {
    String login = principal.getLoginName();
    if (login == null) {
      return false;
    }
    String lowerLogin = login.toLowerCase(Locale.ROOT);
    return ignoredAccounts.stream().anyMatch(lowerLogin::contains);
  }

  private List<Principal> loadMembers(ResolutionContext context, String siteUrl, Frame frame) {
    if (frame.getKind() == PrincipalKind.SITE_GROUP) {
      return context.getSiteGroupMembers(
          siteUrl,
          frame.getGroupId(),
          () -> contentClient.getSiteGroupMembers(siteUrl, frame.getGroupId()));
    }
    return context.getDirectoryGroupMembers(
        frame.getGroupId(), () -> directoryClient.getGroupMembers(frame.getGroupId()));
  }

  private String displayNameOf(ResolutionContext context, Frame frame) {
    if (frame.getDisplayName() != null && !frame.getDisplayName().isEmpty()) {
      return frame.getDisplayName();
    }
    if (frame.getKind() != null && frame.getKind().isDirectoryGroup()) {
      try {
        Optional<Principal> groupObject =
            context.getGroupObject(
                frame.getGroupId(), () -> directoryClient.getGroup(frame.getGroupId()));
        if (groupObject.isPresent()) {
          return groupObject.get().getLabel();
        }
      } catch (ResolutionException | ContentAccessException e) {
        log.warn("Unable to read properties of group {}", frame.getGroupId(), e);
      }
    }
    return frame.getGroupId();
  }

  private boolean isExcluded(Frame frame, String groupName) {
    return (groupName != null && doNotResolve.contains(groupName.toLowerCase(Locale.ROOT)))
        || (frame.getGroupId() != null
            && doNotResolve.contains(frame.getGroupId().toLowerCase(Locale.ROOT)));
  }

  private static ResolvedAccess placeholder(
      Frame frame, String groupName, UnresolvedReason reason) {
    return ResolvedAccess.builder()
        .principal(
            Principal.builder()
                .id(frame.getGroupId())
                .kind(frame.getKind())
                .displayName(groupName)
                .build())
        .viaGroup(groupName)
        .viaGroupId(frame.getGroupId())
        .viaGroupKind(frame.getKind())
        .nestingLevel(frame.getNestingLevel())
        .parentGroup(frame.getParentGroup())
        .assignmentType(frame.getNestingLevel() == 0 ? AssignmentType.DIRECT : AssignmentType.GROUP)
        .unresolvedReason(reason)
        .build();
  }
}
