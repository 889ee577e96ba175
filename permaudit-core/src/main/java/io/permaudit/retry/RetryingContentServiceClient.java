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
 
package io.permaudit.retry;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;

import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.ItemInfo;
import io.permaudit.model.resource.ListInfo;
import io.permaudit.model.resource.SiteGroup;
import io.permaudit.model.resource.SiteInfo;
import io.permaudit.spi.content.ContentServiceClient;

/**
 * Applies a {@link ServiceCallPolicy} to every call of a {@link ContentServiceClient}. Calls that
 * fail for good raise {@link ContentAccessException}.
 */
public class RetryingContentServiceClient implements ContentServiceClient {
  private static final ServiceCallPolicy.FailureFactory FAILURE =
      (errorCode, message, cause) ->
          new ContentAccessException(
              errorCode == null ? ErrorCode.CONTENT_ACCESS : errorCode, message, cause);

  private final ContentServiceClient delegate;
  private final ServiceCallPolicy policy;

  public RetryingContentServiceClient(
      @NonNull ContentServiceClient delegate, @NonNull ServiceCallPolicy policy) {
    this.delegate = delegate;
    this.policy = policy;
  }

  @Override
  public SiteInfo connect(String siteUrl) {
    return policy.execute("connect " + siteUrl, () -> delegate.connect(siteUrl), FAILURE);
  }

  @Override
  public List<SiteInfo> getSubsites(String siteUrl) {
    return policy.execute(
        "read subsites of " + siteUrl, () -> delegate.getSubsites(siteUrl), FAILURE);
  }

  @Override
  public List<ListInfo> getLists(String siteUrl) {
    return policy.execute("read lists of " + siteUrl, () -> delegate.getLists(siteUrl), FAILURE);
  }

  @Override
  public List<ItemInfo> getItems(String siteUrl, String listId, long afterItemId, int pageSize) {
    return policy.execute(
        String.format("read items of list %s on %s after %d", listId, siteUrl, afterItemId),
        () -> delegate.getItems(siteUrl, listId, afterItemId, pageSize),
        FAILURE);
  }

  @Override
  public boolean folderExists(String siteUrl, String serverRelativeUrl) {
    return policy.execute(
        "check folder " + serverRelativeUrl,
        () -> delegate.folderExists(siteUrl, serverRelativeUrl),
        FAILURE);
  }

  @Override
  public List<RoleAssignment> getRoleAssignments(AuditResource resource) {
    return policy.execute(
        String.format("read role assignments of %s %s", resource.getKind(), resource.getUrl()),
        () -> delegate.getRoleAssignments(resource),
        FAILURE);
  }

  @Override
  public List<SiteGroup> getSiteGroups(String siteUrl) {
    return policy.execute(
        "read site groups of " + siteUrl, () -> delegate.getSiteGroups(siteUrl), FAILURE);
  }

  @Override
  public List<Principal> getSiteGroupMembers(String siteUrl, String groupId) {
    return policy.execute(
        String.format("read members of site group %s on %s", groupId, siteUrl),
        () -> delegate.getSiteGroupMembers(siteUrl, groupId),
        FAILURE);
  }

  @Override
  public Optional<String> getUserDisplayName(String siteUrl, String loginName) {
    return policy.execute(
        "look up user " + loginName,
        () -> delegate.getUserDisplayName(siteUrl, loginName),
        FAILURE);
  }
}
