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
 
package io.permaudit.walk;

import static io.permaudit.testutil.TenantFixtures.TENANT;
import static io.permaudit.testutil.TenantFixtures.assignment;
import static io.permaudit.testutil.TenantFixtures.folder;
import static io.permaudit.testutil.TenantFixtures.item;
import static io.permaudit.testutil.TenantFixtures.list;
import static io.permaudit.testutil.TenantFixtures.site;
import static io.permaudit.testutil.TenantFixtures.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.classification.UrlClassification;
import io.permaudit.model.classification.UrlKind;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.snapshot.SnapshotContentServiceClient;
import io.permaudit.snapshot.TenantSnapshot;

public class TestContentTreeWalker {
  private static final String SITE_A = TENANT + "/sites/A";
  private static final String DOCS = "/sites/A/Shared Documents";

  private AuditSettings settings;
  private SnapshotContentServiceClient contentClient;
  private RecordingListener listener;

  @BeforeEach
  void setup() {
    RoleAssignment grant = assignment(user("u-1", "Ann Lee"), "Read");
    TenantSnapshot.Site siteA = site("/sites/A", true);
    siteA.setUniqueRoleAssignments(true);

    TenantSnapshot.SiteList documents = list("docs", "Documents", 101, DOCS);
    documents.setUniqueRoleAssignments(true);
    documents.getItems().add(item(1, DOCS + "/a.docx", grant));
    documents.getItems().add(item(2, DOCS + "/b.docx"));
    TenantSnapshot.Item reports = folder(3, DOCS + "/Reports");
    reports.setUniqueRoleAssignments(true);
    documents.getItems().add(reports);
    documents.getItems().add(item(4, DOCS + "/Reports/q1.xlsx", grant));
    siteA.getLists().add(documents);

    siteA.getLists().add(list("tasks", "Tasks", 107, "/sites/A/Lists/Tasks"));
    TenantSnapshot.SiteList style = list("style", "Style Library", 101, "/sites/A/Style Library");
    style.getItems().add(item(1, "/sites/A/Style Library/theme.css", grant));
    siteA.getLists().add(style);
    TenantSnapshot.SiteList hidden = list("hidden", "Hidden", 101, "/sites/A/Hidden");
    hidden.setHidden(true);
    siteA.getLists().add(hidden);
    TenantSnapshot.SiteList pages = list("pages", "Site Pages", 119, "/sites/A/SitePages");
    pages.getItems().add(item(1, "/sites/A/SitePages/Home.aspx"));
    siteA.getLists().add(pages);

    TenantSnapshot.Site subsite = site("/sites/A/sub", false);
    subsite.setUniqueRoleAssignments(true);
    TenantSnapshot.SiteList subDocs = list("sub-docs", "Sub Docs", 101, "/sites/A/sub/Sub Docs");
    subDocs.getItems().add(item(7, "/sites/A/sub/Sub Docs/c.docx", grant));
    subsite.getLists().add(subDocs);
    siteA.getSubsites().add(subsite);

    TenantSnapshot snapshot = new TenantSnapshot();
    snapshot.getSites().add(siteA);

    settings = AuditSettings.defaults();
    settings.setItemPageSize(2);
    contentClient = spy(new SnapshotContentServiceClient(snapshot));
    listener = new RecordingListener();
  }

  private void walk(UrlClassification target, WalkPosition resumeFrom) {
    new ContentTreeWalker(contentClient, settings).walk(target, resumeFrom, listener);
  }

  private static UrlClassification siteTarget() {
    return UrlClassification.builder()
        .inputUrl(SITE_A)
        .kind(UrlKind.SITE)
        .siteUrl(SITE_A)
        .relativePath("")
        .build();
  }

  @Test
  void walksSiteListsAndSubsitesInOrder() {
    walk(siteTarget(), WalkPosition.START);

    assertEquals(
        Arrays.asList(
            "site A [Documents, Site Pages, sub]",
            "siteDone 1/0/0",
            "broken LIBRARY docs",
            "broken ITEM 1",
            "item 1 1/0/1",
            "item 2 1/0/2",
            "broken FOLDER 3",
            "item 3 1/0/3",
            "broken ITEM 4",
            "item 4 1/0/4",
            "listDone Documents 1/1/0",
            "item 1 1/1/1",
            "listDone Site Pages 1/2/0",
            "site sub [Sub Docs]",
            "broken SUBSITE web-sites-A-sub",
            "siteDone 2/2/0",
            "broken ITEM 7",
            "item 7 2/2/7",
            "listDone Sub Docs 2/3/0"),
        listener.events);
  }

  @Test
  void resumesAfterLastCompletedList() {
    walk(siteTarget(), new WalkPosition(1, 1, 0L));

    assertEquals(
        Arrays.asList(
            "item 1 1/1/1",
            "listDone Site Pages 1/2/0",
            "site sub [Sub Docs]",
            "broken SUBSITE web-sites-A-sub",
            "siteDone 2/2/0",
            "broken ITEM 7",
            "item 7 2/2/7",
            "listDone Sub Docs 2/3/0"),
        listener.events);
    verify(contentClient, never()).getItems(eq(SITE_A), eq("docs"), anyLong(), anyInt());
  }

  @Test
  void resumesInsideListAfterLastItem() {
    walk(siteTarget(), new WalkPosition(1, 0, 2L));

    assertEquals(
        Arrays.asList(
            "broken FOLDER 3",
            "item 3 1/0/3",
            "broken ITEM 4",
            "item 4 1/0/4",
            "listDone Documents 1/1/0"),
        listener.events.subList(0, 5));
    verify(contentClient).getItems(SITE_A, "docs", 2L, 2);
    verify(contentClient, never()).getItems(SITE_A, "docs", 0L, 2);
  }

  @Test
  void resumedWalkIsEmptyOnceEverythingIsDone() {
    walk(siteTarget(), new WalkPosition(2, 3, 0L));
    assertEquals(Collections.emptyList(), listener.events);
  }

  @Test
  void subsitesAreSkippedWhenExcluded() {
    settings.setSubsiteTraversalExclusions(Collections.singletonList(SITE_A + "/"));
    walk(siteTarget(), WalkPosition.START);

    assertEquals("site A [Documents, Site Pages]", listener.events.get(0));
    assertEquals("listDone Site Pages 1/2/0", listener.events.get(listener.events.size() - 1));
    verify(contentClient, never()).getSubsites(anyString());
  }

  @Test
  void subsitesAreSkippedWhenDisabled() {
    settings.setIncludeSubsites(false);
    walk(siteTarget(), WalkPosition.START);

    assertEquals("listDone Site Pages 1/2/0", listener.events.get(listener.events.size() - 1));
  }

  @Test
  void unreadableListIsSkipped() {
    doThrow(ContentAccessException.accessDenied(DOCS))
        .when(contentClient)
        .getItems(eq(SITE_A), eq("docs"), anyLong(), anyInt());

    walk(siteTarget(), WalkPosition.START);

    List<String> listsDone =
        listener.events.stream().filter(e -> e.startsWith("listDone")).collect(Collectors.toList());
    assertEquals(Arrays.asList("listDone Site Pages 1/2/0", "listDone Sub Docs 2/3/0"), listsDone);
  }

  @Test
  void folderScopeOnlyCoversItemsBelowFolder() {
    UrlClassification target =
        UrlClassification.builder()
            .inputUrl(SITE_A + "/Shared Documents/Reports")
            .kind(UrlKind.FOLDER)
            .siteUrl(SITE_A)
            .relativePath("Shared Documents/Reports")
            .listRootFolderUrl(DOCS)
            .folderUrl(DOCS + "/Reports")
            .build();

    walk(target, WalkPosition.START);

    assertEquals(
        Arrays.asList(
            "broken FOLDER 3",
            "item 3 0/0/3",
            "broken ITEM 4",
            "item 4 0/0/4",
            "listDone Documents 0/1/0"),
        listener.events);
  }

  @Test
  void libraryScopeAuditsExplicitlyTargetedSystemList() {
    UrlClassification target =
        UrlClassification.builder()
            .inputUrl(SITE_A + "/Style Library")
            .kind(UrlKind.LIBRARY)
            .siteUrl(SITE_A)
            .relativePath("Style Library")
            .listRootFolderUrl("/sites/A/Style Library")
            .build();

    walk(target, WalkPosition.START);

    assertEquals(
        Arrays.asList("broken ITEM 1", "item 1 0/0/1", "listDone Style Library 0/1/0"),
        listener.events);
  }

  @Test
  void missingTargetListFails() {
    UrlClassification target =
        UrlClassification.builder()
            .inputUrl(SITE_A + "/Gone")
            .kind(UrlKind.LIBRARY)
            .siteUrl(SITE_A)
            .listRootFolderUrl("/sites/A/Gone")
            .build();

    ContentAccessException e =
        assertThrows(ContentAccessException.class, () -> walk(target, WalkPosition.START));
    assertEquals(ErrorCode.NOT_FOUND, e.getErrorCode());
  }

  private static String position(WalkPosition position) {
    return position.getSiteIndex() + "/" + position.getListIndex() + "/" + position.getItemId();
  }

  private static class RecordingListener implements WalkListener {
    private final List<String> events = new ArrayList<>();

    @Override
    public void onSite(AuditResource site, List<AuditResource> contents) {
      events.add(
          "site "
              + site.getTitle()
              + " "
              + contents.stream().map(AuditResource::getTitle).collect(Collectors.toList()));
    }

    @Override
    public void onSiteCompleted(WalkPosition position) {
      events.add("siteDone " + position(position));
    }

    @Override
    public void onBrokenInheritance(AuditResource resource) {
      events.add("broken " + resource.getKind() + " " + resource.getId());
    }

    @Override
    public void onItemProcessed(AuditResource item, WalkPosition position) {
      events.add("item " + item.getId() + " " + position(position));
    }

    @Override
    public void onListCompleted(AuditResource list, WalkPosition position) {
      events.add("listDone " + list.getTitle() + " " + position(position));
    }
  }
}
