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
 
package io.permaudit.checkpoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.permaudit.model.checkpoint.AuditCheckpoint;
import io.permaudit.model.exception.CheckpointException;
import io.permaudit.model.exception.ParseException;
import io.permaudit.spi.checkpoint.CheckpointStore;

/**
 * Stores each checkpoint as {@code job-<index>.checkpoint.json} in a folder. A write goes to a
 * temporary file first which is then moved over the previous record, so a reader sees either the
 * old or the new checkpoint, never a partial one.
 */
@Log4j2
public class FileCheckpointStore implements CheckpointStore {
  private static final String SUFFIX = ".checkpoint.json";

  private final Path folder;

  public FileCheckpointStore(@NonNull Path folder) {
    this.folder = folder;
  }

  @Override
  public Optional<AuditCheckpoint> read(int jobIndex) {
    Path file = fileFor(jobIndex);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return AuditCheckpoint.fromJson(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException | ParseException e) {
      throw new CheckpointException("Unable to read checkpoint " + file, e);
    }
  }

  @Override
  public void write(AuditCheckpoint checkpoint) {
    Path file = fileFor(checkpoint.getJobIndex());
    Path temp = folder.resolve(file.getFileName() + ".tmp");
    try {
      Files.createDirectories(folder);
      Files.writeString(temp, checkpoint.toJson(), StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported in {}, replacing {}", folder, file);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new CheckpointException("Unable to write checkpoint " + file, e);
    }
  }

  @Override
  public void clear() {
    if (!Files.isDirectory(folder)) {
      return;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(folder, "job-*" + SUFFIX)) {
      for (Path file : files) {
        Files.delete(file);
      }
    } catch (IOException e) {
      throw new CheckpointException("Unable to clear checkpoints in " + folder, e);
    }
    log.info("Cleared checkpoints in {}", folder);
  }

  Path fileFor(int jobIndex) {
    return folder.resolve("job-" + jobIndex + SUFFIX);
  }
}
