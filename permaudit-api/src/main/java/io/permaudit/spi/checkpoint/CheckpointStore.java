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
 
package io.permaudit.spi.checkpoint;

import java.util.Optional;

import io.permaudit.model.checkpoint.AuditCheckpoint;

/**
 * Durable storage of one {@link AuditCheckpoint} per job. Writes replace the previous record of the
 * job atomically. Failures are raised as {@link io.permaudit.model.exception.CheckpointException}.
 */
public interface CheckpointStore {
  Optional<AuditCheckpoint> read(int jobIndex);

  void write(AuditCheckpoint checkpoint);

  /** Removes all records, used to force a fresh run. */
  void clear();
}
