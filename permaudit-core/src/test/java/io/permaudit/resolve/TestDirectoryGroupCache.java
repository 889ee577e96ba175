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

import static io.permaudit.testutil.TenantFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.permaudit.model.exception.ParseException;
import io.permaudit.model.principal.Principal;

public class TestDirectoryGroupCache {
  @TempDir Path tempDir;

  private final List<Principal> members = Arrays.asList(user("u-1", "Ann Lee"), user("u-2", "Ben Ode"));

  @Test
  void loaderIsCalledOncePerGroup() {
    AtomicInteger calls = new AtomicInteger();
    DirectoryGroupCache cache = new DirectoryGroupCache();
    for (int i = 0; i < 3; i++) {
      assertEquals(
          members,
          cache.getMembers(
              "g-1",
              () -> {
                calls.incrementAndGet();
                return members;
              }));
    }
    assertEquals(1, calls.get());
    assertEquals(1, cache.size());
  }

  @Test
  void entriesArePersistedForLaterRuns() {
    new DirectoryGroupCache(tempDir).getMembers("c:0t.c|tenant|g-1", () -> members);
    assertTrue(Files.exists(tempDir.resolve("c_0t.c_tenant_g-1.json")));

    DirectoryGroupCache nextRun = new DirectoryGroupCache(tempDir);
    List<Principal> restored =
        nextRun.getMembers(
            "c:0t.c|tenant|g-1",
            () -> fail("persisted entry should be used"));
    assertEquals(members, restored);
  }

  @Test
  void unreadableEntryFallsBackToLoader() throws Exception {
    Files.write(tempDir.resolve("g-1.json"), "{ not json".getBytes(StandardCharsets.UTF_8));
    DirectoryGroupCache cache = new DirectoryGroupCache(tempDir);
    assertEquals(members, cache.getMembers("g-1", () -> members));
    // rewritten with the loaded members
    assertEquals(members, DirectoryGroupCache.parse(Files.readString(tempDir.resolve("g-1.json"))).getMembers());
  }

  @Test
  void clearRemovesPersistedEntries() throws Exception {
    DirectoryGroupCache cache = new DirectoryGroupCache(tempDir);
    cache.getMembers("g-1", () -> members);
    cache.getMembers("g-2", Collections::emptyList);
    Files.write(tempDir.resolve("notes.txt"), "keep".getBytes(StandardCharsets.UTF_8));

    cache.clear();

    assertEquals(0, cache.size());
    assertFalse(cache.contains("g-1"));
    assertFalse(Files.exists(tempDir.resolve("g-1.json")));
    assertFalse(Files.exists(tempDir.resolve("g-2.json")));
    assertTrue(Files.exists(tempDir.resolve("notes.txt")));
  }

  @Test
  void parseRejectsNewerVersionsAndMissingMembers() {
    assertThrows(
        ParseException.class,
        () -> DirectoryGroupCache.parse("{\"groupId\":\"g\",\"members\":[],\"version\":1}"));
    assertThrows(ParseException.class, () -> DirectoryGroupCache.parse("{\"groupId\":\"g\"}"));
    assertThrows(ParseException.class, () -> DirectoryGroupCache.parse("[]"));
  }
}
