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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;

import io.permaudit.model.exception.SinkException;
import io.permaudit.model.job.AuditJob;
import io.permaudit.spi.sink.AuditSink;
import io.permaudit.spi.sink.AuditSinkProvider;

/**
 * Opens a {@link CsvAuditSink} per job in {@code <outputFolder>/<jobIndex>_<slug>}, where the slug
 * is derived from the path of the job URL. A job that is not resumed starts with an empty folder.
 */
@Log4j2
public class CsvAuditSinkProvider implements AuditSinkProvider {
  private static final int MAX_SLUG_LENGTH = 60;

  private final Path outputFolder;

  public CsvAuditSinkProvider(@NonNull Path outputFolder) {
    this.outputFolder = outputFolder;
  }

  @Override
  public AuditSink open(AuditJob job, boolean resume) {
    Path folder = folderFor(job);
    if (!resume) {
      deleteCsvFiles(folder);
    }
    log.info("Writing output of job {} to {}", job.getJobIndex(), folder);
    return new CsvAuditSink(folder);
  }

  public Path folderFor(AuditJob job) {
    return outputFolder.resolve(job.getJobIndex() + "_" + slug(job.getUrl()));
  }

  @VisibleForTesting
  static String slug(String url) {
    String withoutScheme = url.replaceFirst("^[a-zA-Z]+://", "");
    int pathStart = withoutScheme.indexOf('/');
    String path = pathStart < 0 ? "" : withoutScheme.substring(pathStart + 1);
    String slug =
        path.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    if (slug.isEmpty()) {
      slug = "root";
    }
    return slug.length() > MAX_SLUG_LENGTH ? slug.substring(0, MAX_SLUG_LENGTH) : slug;
  }

  private static void deleteCsvFiles(Path folder) {
    if (!Files.isDirectory(folder)) {
      return;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(folder, "*.csv")) {
      for (Path file : files) {
        Files.delete(file);
      }
    } catch (IOException e) {
      throw new SinkException("Unable to clear output folder " + folder, e);
    }
  }
}
