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

import java.util.Locale;

/** Conventional role of a site group, derived from its title. */
public enum SiteGroupRole {
  SITE_OWNERS,
  SITE_MEMBERS,
  SITE_VISITORS,
  CUSTOM;

  public static SiteGroupRole fromTitle(String title) {
    String lower = title == null ? "" : title.toLowerCase(Locale.ROOT);
    if (lower.contains("owner")) {
      return SITE_OWNERS;
    } else if (lower.contains("member")) {
      return SITE_MEMBERS;
    } else if (lower.contains("visitor")) {
      return SITE_VISITORS;
    }
    return CUSTOM;
  }
}
