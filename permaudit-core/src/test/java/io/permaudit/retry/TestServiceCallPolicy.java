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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.exception.ResolutionException;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.resource.SiteInfo;
import io.permaudit.spi.content.ContentServiceClient;
import io.permaudit.spi.directory.DirectoryServiceClient;

public class TestServiceCallPolicy {
  private static final ServiceCallPolicy.FailureFactory FAILURE =
      (errorCode, message, cause) ->
          new ContentAccessException(
              errorCode == null ? ErrorCode.CONTENT_ACCESS : errorCode, message, cause);

  private ServiceCallPolicy policy;

  @BeforeEach
  void setup() {
    policy = new ServiceCallPolicy("test", retrySettings(3, 1));
  }

  @AfterEach
  void tearDown() {
    policy.close();
  }

  private static AuditSettings.RetrySettings retrySettings(int maxAttempts, long timeoutSeconds) {
    AuditSettings.RetrySettings settings = new AuditSettings.RetrySettings();
    settings.setMaxAttempts(maxAttempts);
    settings.setInitialBackoffMillis(1);
    settings.setBackoffMultiplier(2.0);
    settings.setTimeoutSeconds(timeoutSeconds);
    return settings;
  }

  @Test
  void transientFailuresAreRetried() {
    AtomicInteger calls = new AtomicInteger();
    String result =
        policy.execute(
            "flaky call",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new ContentAccessException("throttled", null);
              }
              return "ok";
            },
            FAILURE);

    assertEquals("ok", result);
    assertEquals(3, calls.get());
  }

  @Test
  void permanentFailuresAreNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    ContentAccessException notFound = ContentAccessException.notFound("/sites/Gone");

    ContentAccessException thrown =
        assertThrows(
            ContentAccessException.class,
            () ->
                policy.execute(
                    "missing site",
                    () -> {
                      calls.incrementAndGet();
                      throw notFound;
                    },
                    FAILURE));

    assertSame(notFound, thrown);
    assertEquals(1, calls.get());
  }

  @Test
  void exhaustedAttemptsAreMappedByFailureFactory() {
    AtomicInteger calls = new AtomicInteger();

    ContentAccessException thrown =
        assertThrows(
            ContentAccessException.class,
            () ->
                policy.execute(
                    "broken call",
                    () -> {
                      calls.incrementAndGet();
                      throw new IllegalStateException("connection reset");
                    },
                    FAILURE));

    assertEquals(3, calls.get());
    assertEquals(ErrorCode.CONTENT_ACCESS, thrown.getErrorCode());
    assertEquals("broken call failed after 3 attempts", thrown.getMessage());
    assertInstanceOf(IllegalStateException.class, thrown.getCause());
  }

  @Test
  void slowCallsTimeOut() {
    policy.close();
    policy = new ServiceCallPolicy("slow", retrySettings(2, 1));
    AtomicInteger calls = new AtomicInteger();

    ContentAccessException thrown =
        assertThrows(
            ContentAccessException.class,
            () ->
                policy.execute(
                    "slow call",
                    () -> {
                      calls.incrementAndGet();
                      try {
                        Thread.sleep(10_000);
                      } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                      }
                      return "late";
                    },
                    FAILURE));

    assertEquals(ErrorCode.TIMEOUT, thrown.getErrorCode());
    assertInstanceOf(TimeoutException.class, thrown.getCause());
    assertEquals(2, calls.get());
  }

  @Test
  void retryableFailures() {
    assertTrue(ServiceCallPolicy.isRetryable(new IllegalStateException()));
    assertTrue(ServiceCallPolicy.isRetryable(new ResolutionException("busy")));
    assertFalse(ServiceCallPolicy.isRetryable(ContentAccessException.accessDenied("/sites/A")));
    assertFalse(
        ServiceCallPolicy.isRetryable(new ResolutionException(ErrorCode.NOT_FOUND, "no group")));
  }

  @Test
  void retryingClientsDelegate() {
    ContentServiceClient content = mock(ContentServiceClient.class);
    SiteInfo site = SiteInfo.builder().id("web").url("https://contoso.sharepoint.com/sites/A").build();
    when(content.connect("https://contoso.sharepoint.com/sites/A"))
        .thenThrow(new ContentAccessException("throttled", null))
        .thenReturn(site);

    assertSame(
        site,
        new RetryingContentServiceClient(content, policy).connect("https://contoso.sharepoint.com/sites/A"));
    verify(content, times(2)).connect("https://contoso.sharepoint.com/sites/A");
  }

  @Test
  void retryingDirectoryClientFailsWithResolutionException() {
    DirectoryServiceClient directory = mock(DirectoryServiceClient.class);
    when(directory.getGroupMembers("g-1")).thenThrow(new IllegalStateException("socket closed"));

    ResolutionException thrown =
        assertThrows(
            ResolutionException.class,
            () -> new RetryingDirectoryServiceClient(directory, policy).getGroupMembers("g-1"));
    assertEquals(ErrorCode.RESOLUTION, thrown.getErrorCode());
    verify(directory, times(3)).getGroupMembers("g-1");

    List<Principal> members = Collections.emptyList();
    when(directory.getGroupMembers("g-2")).thenReturn(members);
    assertSame(members, new RetryingDirectoryServiceClient(directory, policy).getGroupMembers("g-2"));
  }
}
