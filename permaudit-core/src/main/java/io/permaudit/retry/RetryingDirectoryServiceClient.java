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

import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.exception.ResolutionException;
import io.permaudit.model.principal.Principal;
import io.permaudit.spi.directory.DirectoryServiceClient;

/** Directory calls under a {@link ServiceCallPolicy}, failing with {@link ResolutionException}. */
public class RetryingDirectoryServiceClient implements DirectoryServiceClient {
  private static final ServiceCallPolicy.FailureFactory FAILURE =
      (errorCode, message, cause) ->
          new ResolutionException(
              errorCode == null ? ErrorCode.RESOLUTION : errorCode, message, cause);

  private final DirectoryServiceClient delegate;
  private final ServiceCallPolicy policy;

  public RetryingDirectoryServiceClient(
      @NonNull DirectoryServiceClient delegate, @NonNull ServiceCallPolicy policy) {
    this.delegate = delegate;
    this.policy = policy;
  }

  @Override
  public Optional<Principal> getGroup(String groupId) {
    return policy.execute("read group " + groupId, () -> delegate.getGroup(groupId), FAILURE);
  }

  @Override
  public List<Principal> getGroupMembers(String groupId) {
    return policy.execute(
        "read members of group " + groupId, () -> delegate.getGroupMembers(groupId), FAILURE);
  }
}
