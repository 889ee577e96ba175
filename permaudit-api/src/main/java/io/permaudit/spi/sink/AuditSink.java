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
 
package io.permaudit.spi.sink;

import java.io.Closeable;
import java.util.List;

import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.SiteGroupEntry;
import io.permaudit.model.resource.AuditResource;

/**
 * Append-only, buffered writer for the five output streams of a job. Rows become durable only
 * after {@link #flush()}. Failures are raised as {@link
 * io.permaudit.model.exception.SinkException}.
 */
public interface AuditSink extends Closeable {
  void writeSiteContents(List<AuditResource> rows);

  void writeSiteGroups(List<SiteGroupEntry> rows);

  void writeSiteUsers(List<AccessEntry> rows);

  void writeBrokenPermissionNodes(List<AuditResource> rows);

  void writeAccessEntries(List<AccessEntry> rows);

  /** Number of rows buffered since the last flush, across all streams. */
  int getPendingRows();

  void flush();

  @Override
  void close();
}
