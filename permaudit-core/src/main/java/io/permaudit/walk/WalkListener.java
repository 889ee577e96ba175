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

import java.util.List;

import io.permaudit.model.resource.AuditResource;

/** Callbacks of {@link ContentTreeWalker}, invoked in walk order on the calling thread. */
public interface WalkListener {

  /**
   * A site or subsite is entered whose site level output was not produced yet. Only called when
   * the walk covers whole sites.
   *
   * @param site the site
   * @param contents the audited lists and the subsites of the site
   */
  void onSite(AuditResource site, List<AuditResource> contents);

  /** The site level output of the site at {@code position.getSiteIndex()} is complete. */
  void onSiteCompleted(WalkPosition position);

  /** A site, list, folder or item defines its own role assignments. */
  void onBrokenInheritance(AuditResource resource);

  void onItemProcessed(AuditResource item, WalkPosition position);

  void onListCompleted(AuditResource list, WalkPosition position);
}
