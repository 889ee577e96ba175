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
 
package io.permaudit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import io.permaudit.model.exception.ConfigurationException;
import io.permaudit.model.resource.ResourceKind;

class TestAuditSettings {

  @Test
  void defaultsAreLoadedFromClasspath() {
    AuditSettings settings = AuditSettings.defaults();
    assertEquals(5, settings.getMaxGroupNestingLevel());
    assertEquals(5000, settings.getBatchSize());
    assertTrue(settings.isIncludeSubsites());
    assertEquals(
        Arrays.asList("Limited Access", "Web-Only Limited Access"),
        settings.getIgnorePermissionLevels());
    assertEquals(ResourceKind.LIBRARY, settings.getListTemplates().get(101));
    assertEquals(ResourceKind.SITE_PAGES, settings.getListTemplates().get(119));
    assertTrue(settings.getSystemLists().contains("Style Library"));
    assertEquals(3, settings.getRetry().getMaxAttempts());
    assertEquals(
        "io.permaudit.snapshot.SnapshotClientProvider",
        settings.getClientProvider().getProviderClass());
    assertNull(settings.getDirectoryCacheFolder());
  }

  @Test
  void customSettingsAreMergedOnTop() throws Exception {
    String custom =
        "maxGroupNestingLevel: 2\n"
            + "ignoreAccounts: []\n"
            + "listTemplates:\n"
            + "  107: LIST\n"
            + "retry:\n"
            + "  maxAttempts: 5\n"
            + "clientProvider:\n"
            + "  configuration:\n"
            + "    snapshotPath: /tmp/tenant.yaml\n";
    AuditSettings settings = AuditSettings.load(custom.getBytes(StandardCharsets.UTF_8));

    assertEquals(2, settings.getMaxGroupNestingLevel());
    // lists replace the defaults
    assertEquals(Collections.emptyList(), settings.getIgnoreAccounts());
    // maps and sections are merged
    assertEquals(ResourceKind.LIST, settings.getListTemplates().get(107));
    assertEquals(ResourceKind.LIBRARY, settings.getListTemplates().get(101));
    assertEquals(5, settings.getRetry().getMaxAttempts());
    assertEquals(500L, settings.getRetry().getInitialBackoffMillis());
    assertEquals(
        "io.permaudit.snapshot.SnapshotClientProvider",
        settings.getClientProvider().getProviderClass());
    assertEquals(
        "/tmp/tenant.yaml", settings.getClientProvider().getConfiguration().get("snapshotPath"));
    assertFalse(settings.getDoNotResolveGroups().isEmpty());
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThrows(
        ConfigurationException.class,
        () -> AuditSettings.load("batchSize: 0\n".getBytes(StandardCharsets.UTF_8)));
    assertThrows(
        ConfigurationException.class,
        () ->
            AuditSettings.load("maxGroupNestingLevel: -1\n".getBytes(StandardCharsets.UTF_8)));
    assertThrows(
        ConfigurationException.class,
        () ->
            AuditSettings.load(
                "retry:\n  maxAttempts: 0\n".getBytes(StandardCharsets.UTF_8)));
  }
}
