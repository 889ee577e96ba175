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
 
package io.permaudit.snapshot;

import java.nio.file.Paths;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

import io.permaudit.model.exception.ConfigurationException;
import io.permaudit.spi.client.AuditClientProvider;
import io.permaudit.spi.content.ContentServiceClient;
import io.permaudit.spi.directory.DirectoryServiceClient;

/**
 * Provides clients reading a {@link TenantSnapshot}. The snapshot file is named by the {@value
 * #SNAPSHOT_PATH} configuration key.
 */
@Log4j2
public class SnapshotClientProvider implements AuditClientProvider {
  public static final String SNAPSHOT_PATH = "snapshotPath";

  private TenantSnapshot snapshot;

  @Override
  public void init(Map<String, String> configuration) {
    String path = configuration == null ? null : configuration.get(SNAPSHOT_PATH);
    if (path == null || path.isEmpty()) {
      throw new ConfigurationException(
          "clientProvider.configuration." + SNAPSHOT_PATH + " is required");
    }
    snapshot = TenantSnapshot.load(Paths.get(path));
    log.info("Loaded tenant snapshot {} with {} site collections", path, snapshot.getSites().size());
  }

  @Override
  public ContentServiceClient getContentServiceClient() {
    return new SnapshotContentServiceClient(initialized());
  }

  @Override
  public DirectoryServiceClient getDirectoryServiceClient() {
    return new SnapshotDirectoryServiceClient(initialized());
  }

  private TenantSnapshot initialized() {
    if (snapshot == null) {
      throw new IllegalStateException("SnapshotClientProvider has not been initialized");
    }
    return snapshot;
  }
}
