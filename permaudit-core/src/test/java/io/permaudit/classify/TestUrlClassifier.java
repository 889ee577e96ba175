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
 
package io.permaudit.classify;

import static io.permaudit.testutil.TenantFixtures.TENANT;
import static io.permaudit.testutil.TenantFixtures.folder;
import static io.permaudit.testutil.TenantFixtures.list;
import static io.permaudit.testutil.TenantFixtures.site;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.classification.UrlClassification;
import io.permaudit.model.classification.UrlKind;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.snapshot.SnapshotContentServiceClient;
import io.permaudit.snapshot.TenantSnapshot;
import io.permaudit.spi.content.ContentServiceClient;

class TestUrlClassifier {
  private UrlClassifier classifier;

  @BeforeEach
  void setup() {
    TenantSnapshot snapshot = new TenantSnapshot();
    TenantSnapshot.Site siteA = site("/sites/A", true);
    TenantSnapshot.SiteList documents =
        list("docs", "Documents", 101, "/sites/A/Shared Documents");
    documents.getItems().add(folder(1, "/sites/A/Shared Documents/Reports"));
    documents.getItems().add(folder(2, "/sites/A/Shared Documents/Reports/2024"));
    siteA.getLists().add(documents);
    siteA.getLists().add(list("shared", "Shared", 101, "/sites/A/Shared"));
    TenantSnapshot.SiteList budget = list("budget", "Budget 100%", 101, "/sites/A/Budget 100%");
    budget.getItems().add(folder(1, "/sites/A/Budget 100%/Q1 #2"));
    siteA.getLists().add(budget);
    siteA.getLists().add(list("rnd", "R&D #1", 101, "/sites/A/R&D #1"));
    TenantSnapshot.Site subsite = site("/sites/A/sub", false);
    subsite.getLists().add(list("sub-docs", "Documents", 101, "/sites/A/sub/Documents"));
    siteA.getSubsites().add(subsite);
    snapshot.getSites().add(siteA);
    snapshot.getSites().add(site("/sites/Secret", true));
    snapshot.getDeniedUrls().add(TENANT + "/sites/Secret");

    classifier =
        new UrlClassifier(
            new SnapshotContentServiceClient(snapshot), AuditSettings.defaults(), TENANT);
  }

  private static Stream<Arguments> classifiedUrls() {
    return Stream.of(
        Arguments.of(TENANT + "/sites/A", UrlKind.SITE, TENANT + "/sites/A", ""),
        Arguments.of(TENANT + "/sites/A/", UrlKind.SITE, TENANT + "/sites/A", ""),
        Arguments.of(TENANT + "/sites/A/sub", UrlKind.SUBSITE, TENANT + "/sites/A/sub", ""),
        Arguments.of(
            TENANT + "/sites/A/Shared%20Documents",
            UrlKind.LIBRARY,
            TENANT + "/sites/A",
            "Shared Documents"),
        Arguments.of(
            TENANT + "/sites/A/Shared Documents/Forms/AllItems.aspx?viewid=1",
            UrlKind.LIBRARY,
            TENANT + "/sites/A",
            "Shared Documents"),
        Arguments.of(TENANT + "/sites/A/Shared", UrlKind.LIBRARY, TENANT + "/sites/A", "Shared"),
        Arguments.of(
            TENANT + "/sites/A/Shared Documents/Reports/2024",
            UrlKind.FOLDER,
            TENANT + "/sites/A",
            "Shared Documents/Reports/2024"),
        Arguments.of(
            TENANT + "/sites/A/Budget%20100%25",
            UrlKind.LIBRARY,
            TENANT + "/sites/A",
            "Budget 100%"),
        Arguments.of(
            TENANT + "/sites/A/Budget%20100%25/Q1%20%232",
            UrlKind.FOLDER,
            TENANT + "/sites/A",
            "Budget 100%/Q1 #2"),
        Arguments.of(
            TENANT + "/sites/A/R%26D%20%231/Forms/AllItems.aspx",
            UrlKind.LIBRARY,
            TENANT + "/sites/A",
            "R&D #1"),
        Arguments.of(
            TENANT + "/sites/A/sub/Documents",
            UrlKind.LIBRARY,
            TENANT + "/sites/A/sub",
            "Documents"));
  }

  @ParameterizedTest
  @MethodSource("classifiedUrls")
  void classifiesUrl(String url, UrlKind kind, String siteUrl, String relativePath) {
    UrlClassification classification = classifier.classify(url);
    assertEquals(kind, classification.getKind(), () -> String.valueOf(classification));
    assertEquals(url, classification.getInputUrl());
    assertEquals(siteUrl, classification.getSiteUrl());
    assertEquals(relativePath, classification.getRelativePath());
  }

  @Test
  void libraryAndFolderNameTheirList() {
    UrlClassification library = classifier.classify(TENANT + "/sites/A/Shared Documents");
    assertEquals("/sites/A/Shared Documents", library.getListRootFolderUrl());
    assertNull(library.getFolderUrl());

    UrlClassification folder = classifier.classify(TENANT + "/sites/A/Shared Documents/Reports");
    assertEquals("/sites/A/Shared Documents", folder.getListRootFolderUrl());
    assertEquals("/sites/A/Shared Documents/Reports", folder.getFolderUrl());

    UrlClassification percentFolder =
        classifier.classify(TENANT + "/sites/A/Budget%20100%25/Q1%20%232");
    assertEquals("/sites/A/Budget 100%", percentFolder.getListRootFolderUrl());
    assertEquals("/sites/A/Budget 100%/Q1 #2", percentFolder.getFolderUrl());
  }

  @Test
  void unexpectedClientFailureIsReportedAsErrorKind() {
    ContentServiceClient client = mock(ContentServiceClient.class);
    when(client.connect(anyString())).thenThrow(new IllegalStateException("connection reset"));
    UrlClassifier failing = new UrlClassifier(client, AuditSettings.defaults(), TENANT);

    UrlClassification classification = failing.classify(TENANT + "/sites/A");
    assertTrue(classification.isError());
    assertEquals(ErrorCode.CONTENT_ACCESS, classification.getErrorCode());
    assertEquals("connection reset", classification.getErrorMessage());
  }

  private static Stream<Arguments> failingUrls() {
    return Stream.of(
        Arguments.of(TENANT + "/sites/DoesNotExist", ErrorCode.NOT_FOUND),
        Arguments.of(TENANT + "/sites/A/Shared Documents/Missing", ErrorCode.NOT_FOUND),
        Arguments.of(TENANT + "/sites/A/NoSuchList", ErrorCode.NOT_FOUND),
        Arguments.of(TENANT + "/sites/Secret", ErrorCode.ACCESS_DENIED),
        Arguments.of("https://fabrikam.sharepoint.com/sites/A", ErrorCode.INVALID_URL),
        Arguments.of("not a url", ErrorCode.INVALID_URL),
        Arguments.of(TENANT + "/sites/A/Budget 100%", ErrorCode.INVALID_URL),
        Arguments.of("", ErrorCode.INVALID_URL));
  }

  @ParameterizedTest
  @MethodSource("failingUrls")
  void failuresAreReportedAsErrorKind(String url, ErrorCode errorCode) {
    UrlClassification classification = classifier.classify(url);
    assertTrue(classification.isError());
    assertEquals(errorCode, classification.getErrorCode());
    assertEquals(url, classification.getInputUrl());
    assertNull(classification.getSiteUrl());
  }
}
