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
 
package io.permaudit.model.access;

/** Why a placeholder row was reported instead of rows for resolved accounts. */
public enum UnresolvedReason {
  /** Listed in the do-not-resolve settings. */
  EXCLUDED,
  /** Deeper than the configured maximum nesting level. */
  DEPTH_LIMIT,
  /** The membership lookup failed. */
  LOOKUP_FAILED,
  /** The role assignments of the node itself could not be read, so no principal is known. */
  ASSIGNMENTS_UNREADABLE
}
