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
 
package io.permaudit.walk;

import lombok.Value;

import io.permaudit.model.checkpoint.AuditCheckpoint;

/**
 * Progress of a walk. {@code siteIndex} is the ordinal of the last site whose site level output is
 * complete, {@code listIndex} the ordinal of the last completed list and {@code itemId} the last
 * processed item of the list after it, 0 when that list has not been started. Ordinals start at 1
 * and count sites and lists in walk order across the whole job.
 */
@Value
public class WalkPosition {
  public static final WalkPosition START = new WalkPosition(0, 0, 0L);

  int siteIndex;
  int listIndex;
  long itemId;

  public static WalkPosition of(AuditCheckpoint checkpoint) {
    return new WalkPosition(
        checkpoint.getLastSiteIndex(), checkpoint.getLastListIndex(), checkpoint.getLastItemId());
  }
}
