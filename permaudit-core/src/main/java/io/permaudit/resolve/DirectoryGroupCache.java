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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.log4j.Log4j2;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.permaudit.model.exception.ParseException;
import io.permaudit.model.principal.Principal;

/**
 * Direct members of directory groups, kept for the lifetime of the process. Directory groups are
 * tenant-global, so entries stay valid across jobs. When a folder is configured every entry is
 * also stored as {@code <folder>/<groupId>.json} and read back by later runs.
 */
@Log4j2
public class DirectoryGroupCache {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private static final int CURRENT_VERSION = 0;

  private final Map<String, List<Principal>> members = new HashMap<>();
  private final Path folder;

  /** Creates a cache that is held in memory only. */
  public DirectoryGroupCache() {
    this(null);
  }

  public DirectoryGroupCache(Path folder) {
    this.folder = folder;
  }

  @Value
  @Builder
  @Jacksonized
  static class CachedGroup {
    String groupId;
    List<Principal> members;
    int version;
  }

  /**
   * Returns the cached members of a group, reading the persisted entry or calling {@code loader}
   * when the group has not been seen yet.
   */
  public List<Principal> getMembers(String groupId, Supplier<List<Principal>> loader) {
    List<Principal> cached = members.get(groupId);
    if (cached != null) {
      return cached;
    }
    Optional<List<Principal>> persisted = readPersisted(groupId);
    if (persisted.isPresent()) {
      members.put(groupId, persisted.get());
      return persisted.get();
    }
    List<Principal> loaded = Collections.unmodifiableList(new ArrayList<>(loader.get()));
    members.put(groupId, loaded);
    persist(groupId, loaded);
    return loaded;
  }

  public boolean contains(String groupId) {
    return members.containsKey(groupId);
  }

  public int size() {
    return members.size();
  }

  /** Drops all entries, including the persisted ones. */
  public void clear() {
    members.clear();
    if (folder == null || !Files.isDirectory(folder)) {
      return;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(folder, "*.json")) {
      for (Path file : files) {
        Files.delete(file);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to clear directory group cache in " + folder, e);
    }
    log.info("Cleared directory group cache in {}", folder);
  }

  private Optional<List<Principal>> readPersisted(String groupId) {
    if (folder == null) {
      return Optional.empty();
    }
    Path file = fileFor(groupId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(parse(Files.readString(file, StandardCharsets.UTF_8)).getMembers());
    } catch (IOException | ParseException e) {
      log.warn("Ignoring unreadable cache entry {} for group {}", file, groupId, e);
      return Optional.empty();
    }
  }

  static CachedGroup parse(String json) {
    CachedGroup entry;
    try {
      entry = MAPPER.readValue(json, CachedGroup.class);
    } catch (JsonProcessingException e) {
      throw new ParseException("Failed to deserialize directory group cache entry", e);
    }
    if (entry.getVersion() > CURRENT_VERSION) {
      throw new ParseException(
          "Unable to read directory group cache entry version " + entry.getVersion());
    }
    if (entry.getMembers() == null) {
      throw new ParseException("Directory group cache entry has no members");
    }
    return entry;
  }

  private void persist(String groupId, List<Principal> groupMembers) {
    if (folder == null) {
      return;
    }
    CachedGroup entry =
        CachedGroup.builder()
            .groupId(groupId)
            .members(groupMembers)
            .version(CURRENT_VERSION)
            .build();
    try {
      Files.createDirectories(folder);
      Files.writeString(fileFor(groupId), MAPPER.writeValueAsString(entry), StandardCharsets.UTF_8);
    } catch (IOException e) {
      // the in-memory entry is still used for this run
      log.warn("Unable to persist members of group {} to {}", groupId, folder, e);
    }
  }

  private Path fileFor(String groupId) {
    return folder.resolve(groupId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
  }
}
