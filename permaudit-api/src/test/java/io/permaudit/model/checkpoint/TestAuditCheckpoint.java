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
 
package io.permaudit.model.checkpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.permaudit.model.exception.ParseException;
import io.permaudit.model.stats.ScanCounts;

class TestAuditCheckpoint {

  @ParameterizedTest
  @MethodSource("provideCheckpoints")
  void jsonRoundTrip(AuditCheckpoint checkpoint) {
    assertEquals(checkpoint, AuditCheckpoint.fromJson(checkpoint.toJson()).get());
  }

  private static Stream<Arguments> provideCheckpoints() {
    return Stream.of(
        Arguments.of(AuditCheckpoint.start(1, "https://contoso.sharepoint.com/sites/A")),
        Arguments.of(
            AuditCheckpoint.start(3, "https://contoso.sharepoint.com/sites/C").toBuilder()
                .lastSiteIndex(2)
                .lastListIndex(7)
                .lastItemId(4711L)
                .counts(
                    ScanCounts.builder()
                        .sitesScanned(2)
                        .listsScanned(7)
                        .itemsScanned(12000)
                        .accessRows(31)
                        .build())
                .build()),
        Arguments.of(
            AuditCheckpoint.start(4, "https://contoso.sharepoint.com/sites/D").toBuilder()
                .status(CheckpointStatus.COMPLETED)
                .build()));
  }

  @Test
  void newCheckpointIsInProgress() {
    AuditCheckpoint checkpoint = AuditCheckpoint.start(2, "https://contoso.sharepoint.com/sites/B");
    assertEquals(CheckpointStatus.IN_PROGRESS, checkpoint.getStatus());
    assertEquals(0, checkpoint.getLastListIndex());
    assertEquals(0L, checkpoint.getLastItemId());
    assertFalse(checkpoint.getStatus().isTerminal());
    assertTrue(checkpoint.toJson().contains("\"jobUrl\":\"https://contoso.sharepoint.com/sites/B\""));
  }

  @Test
  void emptyJsonHasNoCheckpoint() {
    assertFalse(AuditCheckpoint.fromJson("").isPresent());
    assertFalse(AuditCheckpoint.fromJson(null).isPresent());
  }

  @Test
  void failToParseJsonFromNewerVersion() {
    assertThrows(
        ParseException.class,
        () ->
            AuditCheckpoint.fromJson(
                "{\"jobIndex\":1,\"jobUrl\":\"https://contoso.sharepoint.com/sites/A\",\"status\":\"IN_PROGRESS\",\"version\":1}"));
  }

  @Test
  void failToParseJsonWithMissingStatus() {
    assertThrows(
        ParseException.class,
        () ->
            AuditCheckpoint.fromJson(
                "{\"jobIndex\":1,\"jobUrl\":\"https://contoso.sharepoint.com/sites/A\",\"version\":0}"));
  }

  @Test
  void failToParseMalformedJson() {
    assertThrows(ParseException.class, () -> AuditCheckpoint.fromJson("{\"jobIndex\":"));
  }
}
