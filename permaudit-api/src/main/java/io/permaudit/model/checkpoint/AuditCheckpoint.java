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

import java.io.IOException;
import java.util.Optional;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.permaudit.model.exception.ParseException;
import io.permaudit.model.stats.ScanCounts;

/**
 * Resume state of one job. Sites and lists are numbered in walk order starting at 1; {@code
 * lastSiteIndex} and {@code lastListIndex} name the last fully flushed site level and list, {@code
 * lastItemId} the last flushed item of list {@code lastListIndex + 1} (0 when that list has not
 * been started).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AuditCheckpoint {
  private static final int CURRENT_VERSION = 0;
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .configure(SerializationFeature.INDENT_OUTPUT, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  int jobIndex;
  String jobUrl;
  int lastSiteIndex;
  int lastListIndex;
  long lastItemId;
  ScanCounts counts;
  CheckpointStatus status;
  int version;

  public static AuditCheckpoint start(int jobIndex, String jobUrl) {
    return AuditCheckpoint.builder()
        .jobIndex(jobIndex)
        .jobUrl(jobUrl)
        .counts(new ScanCounts())
        .status(CheckpointStatus.IN_PROGRESS)
        .version(CURRENT_VERSION)
        .build();
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (IOException e) {
      throw new ParseException("Failed to serialize AuditCheckpoint", e);
    }
  }

  public static Optional<AuditCheckpoint> fromJson(String json) {
    if (json == null || json.isEmpty()) {
      return Optional.empty();
    }
    try {
      AuditCheckpoint parsed = MAPPER.readValue(json, AuditCheckpoint.class);
      if (parsed.getJobUrl() == null || parsed.getStatus() == null) {
        throw new ParseException("jobUrl and status are required in AuditCheckpoint");
      }
      if (parsed.getVersion() > CURRENT_VERSION) {
        throw new ParseException(
            "Unable handle checkpoint version: "
                + parsed.getVersion()
                + " max supported version: "
                + CURRENT_VERSION);
      }
      return Optional.of(parsed);
    } catch (IOException e) {
      throw new ParseException("Failed to deserialize AuditCheckpoint", e);
    }
  }
}
