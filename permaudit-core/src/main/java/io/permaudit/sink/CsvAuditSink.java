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

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.SiteGroupEntry;
import io.permaudit.model.exception.SinkException;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.spi.sink.AuditSink;

/**
 * Writes the five streams of a job to CSV files in one folder. Rows are buffered in memory and
 * appended on {@link #flush()}; the header is written when a file is created. Rows still buffered
 * when the sink is closed are dropped, the next run resumes from the last checkpoint and writes
 * them again.
 */
@Log4j2
public class CsvAuditSink implements AuditSink {
  public static final String SITE_CONTENTS_FILE = "01_SiteContents.csv";
  public static final String SITE_GROUPS_FILE = "02_SiteGroups.csv";
  public static final String SITE_USERS_FILE = "03_SiteUsers.csv";
  public static final String BROKEN_PERMISSION_NODES_FILE = "04_IndividualPermissionItems.csv";
  public static final String ACCESS_ENTRIES_FILE = "05_IndividualPermissionItemAccess.csv";

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  @Getter private final Path folder;
  private final CsvFile<AuditResource, CsvRows.ResourceRow> siteContents;
  private final CsvFile<SiteGroupEntry, CsvRows.SiteGroupRow> siteGroups;
  private final CsvFile<AccessEntry, CsvRows.SiteUserRow> siteUsers;
  private final CsvFile<AuditResource, CsvRows.ResourceRow> brokenPermissionNodes;
  private final CsvFile<AccessEntry, CsvRows.AccessRow> accessEntries;

  public CsvAuditSink(@NonNull Path folder) {
    this.folder = folder;
    this.siteContents =
        new CsvFile<>(SITE_CONTENTS_FILE, CsvRows.ResourceRow.class, CsvRows.ResourceRow::of);
    this.siteGroups =
        new CsvFile<>(SITE_GROUPS_FILE, CsvRows.SiteGroupRow.class, CsvRows.SiteGroupRow::of);
    this.siteUsers =
        new CsvFile<>(SITE_USERS_FILE, CsvRows.SiteUserRow.class, CsvRows.SiteUserRow::of);
    this.brokenPermissionNodes =
        new CsvFile<>(
            BROKEN_PERMISSION_NODES_FILE, CsvRows.ResourceRow.class, CsvRows.ResourceRow::of);
    this.accessEntries =
        new CsvFile<>(ACCESS_ENTRIES_FILE, CsvRows.AccessRow.class, CsvRows.AccessRow::of);
    try {
      Files.createDirectories(folder);
    } catch (IOException e) {
      throw new SinkException("Unable to create output folder " + folder, e);
    }
  }

  @Override
  public void writeSiteContents(List<AuditResource> rows) {
    siteContents.add(rows);
  }

  @Override
  public void writeSiteGroups(List<SiteGroupEntry> rows) {
    siteGroups.add(rows);
  }

  @Override
  public void writeSiteUsers(List<AccessEntry> rows) {
    siteUsers.add(rows);
  }

  @Override
  public void writeBrokenPermissionNodes(List<AuditResource> rows) {
    brokenPermissionNodes.add(rows);
  }

  @Override
  public void writeAccessEntries(List<AccessEntry> rows) {
    accessEntries.add(rows);
  }

  @Override
  public int getPendingRows() {
    return files().stream().mapToInt(CsvFile::pending).sum();
  }

  @Override
  public void flush() {
    for (CsvFile<?, ?> file : files()) {
      file.flush();
    }
  }

  @Override
  public void close() {
    int pending = getPendingRows();
    if (pending > 0) {
      log.warn("Dropping {} unflushed rows for {}", pending, folder);
    }
    files().forEach(CsvFile::discard);
  }

  private List<CsvFile<?, ?>> files() {
    return Arrays.asList(
        siteContents, siteGroups, siteUsers, brokenPermissionNodes, accessEntries);
  }

  /** One output file and the rows buffered for it. */
  private class CsvFile<T, R> {
    private final String fileName;
    private final CsvSchema schema;
    private final Function<T, R> toRow;
    private final List<R> buffer = new ArrayList<>();

    CsvFile(String fileName, Class<R> rowClass, Function<T, R> toRow) {
      this.fileName = fileName;
      this.schema = CSV_MAPPER.schemaFor(rowClass);
      this.toRow = toRow;
    }

    void add(List<T> rows) {
      buffer.addAll(rows.stream().map(toRow).collect(Collectors.toList()));
    }

    int pending() {
      return buffer.size();
    }

    void discard() {
      buffer.clear();
    }

    private String headerLine() {
      List<String> names = new ArrayList<>();
      schema.forEach(column -> names.add(column.getName()));
      return String.join(",", names) + "\n";
    }

    void flush() {
      Path file = folder.resolve(fileName);
      boolean newFile;
      try {
        newFile = !Files.exists(file) || Files.size(file) == 0;
      } catch (IOException e) {
        throw new SinkException("Unable to inspect " + file, e);
      }
      if (buffer.isEmpty() && !newFile) {
        return;
      }
      try (OutputStream out =
              Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
          Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
        if (buffer.isEmpty()) {
          // an empty stream still gets its header
          writer.write(headerLine());
        } else {
          try (SequenceWriter rows =
              CSV_MAPPER
                  .writer(newFile ? schema.withHeader() : schema.withoutHeader())
                  .writeValues(writer)) {
            rows.writeAll(buffer);
          }
        }
      } catch (IOException e) {
        throw new SinkException("Unable to write " + file, e);
      }
      buffer.clear();
    }
  }
}
