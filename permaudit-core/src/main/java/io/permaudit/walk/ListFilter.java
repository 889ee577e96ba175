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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.resource.ListInfo;
import io.permaudit.model.resource.ResourceKind;

/** Decides which lists of a site are audited and what kind they are reported as. */
public class ListFilter {
  private final Map<Integer, ResourceKind> listTemplates;
  private final Set<String> ignoredLists;
  private final Set<String> systemLists;
  private final Set<String> allowedSystemLists;

  public ListFilter(AuditSettings settings) {
    this.listTemplates = settings.getListTemplates();
    this.ignoredLists = lowerCase(settings.getIgnoreLists());
    this.systemLists = lowerCase(settings.getSystemLists());
    this.allowedSystemLists = lowerCase(settings.getAllowedSystemLists());
  }

  /**
   * Returns the kind of the list, or empty when the list is skipped: its template is not audited,
   * it is hidden, its title is ignored or it is a system list that was not explicitly allowed.
   */
  public Optional<ResourceKind> kindOf(ListInfo list) {
    ResourceKind kind = listTemplates.get(list.getBaseTemplate());
    if (kind == null || list.isHidden()) {
      return Optional.empty();
    }
    String title = list.getTitle() == null ? "" : list.getTitle().toLowerCase(Locale.ROOT);
    if (ignoredLists.contains(title)) {
      return Optional.empty();
    }
    if (systemLists.contains(title) && !allowedSystemLists.contains(title)) {
      return Optional.empty();
    }
    return Optional.of(kind);
  }

  /** Kind of an explicitly targeted list, which is audited even when {@link #kindOf} skips it. */
  public ResourceKind templateKind(ListInfo list) {
    return listTemplates.getOrDefault(list.getBaseTemplate(), ResourceKind.LIST);
  }

  private static Set<String> lowerCase(List<String> values) {
    return values == null
        ? Set.of()
        : values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
  }
}
