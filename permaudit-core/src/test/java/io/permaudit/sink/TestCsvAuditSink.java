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

import static io.permaudit.testutil.TenantFixtures.TENANT;
import static io.permaudit.testutil.TenantFixtures.securityGroup;
import static io.permaudit.testutil.TenantFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.AssignmentType;
import io.permaudit.model.access.SiteGroupEntry;
import io.permaudit.model.access.SiteGroupRole;
import io.permaudit.model.access.UnresolvedReason;
import io.permaudit.model.principal.PrincipalKind;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.ResourceKind;

public class TestCsvAuditSink {
  private static final String SITE_URL = TENANT + "/sites/A";

  @TempDir Path tempDir;

  private static AuditResource document(long id) {
    return AuditResource.builder()
        .id(String.valueOf(id))
        .kind(ResourceKind.ITEM)
        .title("doc" + id + ".docx")
        .url("/sites/A/Shared Documents/doc" + id + ".docx")
        .siteUrl(SITE_URL)
        .listId("docs")
        .build();
  }

  private static List<Map<String, String>> readRows(Path file) throws IOException {
    CsvMapper mapper = new CsvMapper();
    try (MappingIterator<Map<String, String>> rows =
        mapper
            .readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader())
            .readValues(file.toFile())) {
      return rows.readAll();
    }
  }

  private static String firstLine(Path file) throws IOException {
    return Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
  }

  @Test
  void flushAppendsRowsAndWritesHeaderOnce() throws Exception {
    CsvAuditSink sink = new CsvAuditSink(tempDir);
    sink.writeBrokenPermissionNodes(Arrays.asList(document(1), document(2)));
    assertEquals(2, sink.getPendingRows());
    sink.flush();
    assertEquals(0, sink.getPendingRows());
    sink.writeBrokenPermissionNodes(Collections.singletonList(document(3)));
    sink.flush();
    sink.close();

    Path file = tempDir.resolve(CsvAuditSink.BROKEN_PERMISSION_NODES_FILE);
    assertEquals("Id,Type,Title,Url,SiteUrl", firstLine(file));
    List<Map<String, String>> rows = readRows(file);
    assertEquals(3, rows.size());
    assertEquals("3", rows.get(2).get("Id"));
    assertEquals("ITEM", rows.get(0).get("Type"));
    assertEquals("/sites/A/Shared Documents/doc1.docx", rows.get(0).get("Url"));
    assertEquals(SITE_URL, rows.get(0).get("SiteUrl"));
  }

  @Test
  void emptyStreamsGetHeaderOnly() throws Exception {
    CsvAuditSink sink = new CsvAuditSink(tempDir.resolve("job"));
    sink.flush();
    sink.flush();

    Path folder = tempDir.resolve("job");
    for (String name :
        Arrays.asList(
            CsvAuditSink.SITE_CONTENTS_FILE,
            CsvAuditSink.SITE_GROUPS_FILE,
            CsvAuditSink.SITE_USERS_FILE,
            CsvAuditSink.BROKEN_PERMISSION_NODES_FILE,
            CsvAuditSink.ACCESS_ENTRIES_FILE)) {
      List<String> lines = Files.readAllLines(folder.resolve(name), StandardCharsets.UTF_8);
      assertEquals(1, lines.size(), name);
      assertTrue(lines.get(0).startsWith("Id,"), name);
    }
    assertEquals(
        "Id,Role,Title,PermissionLevel,Owner,SiteUrl",
        firstLine(folder.resolve(CsvAuditSink.SITE_GROUPS_FILE)));
  }

  @Test
  void closeDropsUnflushedRows() throws Exception {
    CsvAuditSink sink = new CsvAuditSink(tempDir);
    sink.writeSiteContents(Collections.singletonList(document(1)));
    sink.flush();
    sink.writeSiteContents(Collections.singletonList(document(2)));
    sink.writeSiteGroups(
        Collections.singletonList(
            SiteGroupEntry.builder()
                .siteUrl(SITE_URL)
                .groupId("3")
                .role(SiteGroupRole.SITE_OWNERS)
                .title("A Owners")
                .permissionLevel("Full Control")
                .build()));
    sink.close();

    assertEquals(1, readRows(tempDir.resolve(CsvAuditSink.SITE_CONTENTS_FILE)).size());
    assertEquals(0, readRows(tempDir.resolve(CsvAuditSink.SITE_GROUPS_FILE)).size());
    assertEquals(0, sink.getPendingRows());
  }

  @Test
  void neverFlushedSinkWritesNothing() {
    CsvAuditSink sink = new CsvAuditSink(tempDir);
    sink.writeSiteContents(Collections.singletonList(document(1)));
    sink.close();
    assertFalse(Files.exists(tempDir.resolve(CsvAuditSink.SITE_CONTENTS_FILE)));
  }

  @Test
  void accessRowsCarryGroupChainAndShareMetadata() throws Exception {
    Instant sharedAt = Instant.parse("2024-03-01T10:15:30Z");
    AccessEntry member =
        AccessEntry.builder()
            .resource(document(4))
            .principal(user("u-b", "Bob Brown"))
            .permissionLevel("Read")
            .viaGroup("Eng-Leads")
            .viaGroupId("g-leads")
            .viaGroupKind(PrincipalKind.SECURITY_GROUP)
            .nestingLevel(1)
            .parentGroup("Engineering")
            .assignmentType(AssignmentType.GROUP)
            .sharedAt(sharedAt)
            .sharedByLogin("i:0#.f|membership|ann.lee@contoso.com")
            .sharedByDisplayName("Ann Lee")
            .build();
    AccessEntry placeholder =
        AccessEntry.builder()
            .resource(document(4))
            .principal(securityGroup("g-all", "Everyone"))
            .permissionLevel("Read")
            .viaGroup("Everyone")
            .viaGroupId("g-all")
            .viaGroupKind(PrincipalKind.SECURITY_GROUP)
            .assignmentType(AssignmentType.DIRECT)
            .unresolvedReason(UnresolvedReason.EXCLUDED)
            .build();

    CsvAuditSink sink = new CsvAuditSink(tempDir);
    sink.writeAccessEntries(Arrays.asList(member, placeholder));
    sink.writeSiteUsers(Collections.singletonList(member));
    sink.flush();
    sink.close();

    List<Map<String, String>> rows = readRows(tempDir.resolve(CsvAuditSink.ACCESS_ENTRIES_FILE));
    assertEquals(2, rows.size());
    Map<String, String> bob = rows.get(0);
    assertEquals("4", bob.get("Id"));
    assertEquals("Bob Brown", bob.get("DisplayName"));
    assertEquals("bob.brown@contoso.com", bob.get("Email"));
    assertEquals("2024-03-01T10:15:30Z", bob.get("SharedDateTime"));
    assertEquals("Ann Lee", bob.get("SharedByDisplayName"));
    assertEquals("Eng-Leads", bob.get("ViaGroup"));
    assertEquals("SECURITY_GROUP", bob.get("ViaGroupType"));
    assertEquals("GROUP", bob.get("AssignmentType"));
    assertEquals("1", bob.get("NestingLevel"));
    assertEquals("Engineering", bob.get("ParentGroup"));
    assertEquals("", bob.get("Unresolved"));
    assertEquals("EXCLUDED", rows.get(1).get("Unresolved"));
    assertEquals("c:0t.c|tenant|g-all", rows.get(1).get("LoginName"));

    List<Map<String, String>> users = readRows(tempDir.resolve(CsvAuditSink.SITE_USERS_FILE));
    assertEquals("u-b", users.get(0).get("Id"));
    assertEquals(SITE_URL, users.get(0).get("SiteUrl"));
  }
}
