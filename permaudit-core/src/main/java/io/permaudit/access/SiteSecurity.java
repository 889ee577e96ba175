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
 
package io.permaudit.access;

import java.util.List;

import lombok.Builder;
import lombok.Value;

import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.SiteGroupEntry;

/** Site groups and flattened site users of one site. */
@Value
@Builder
public class SiteSecurity {
  List<SiteGroupEntry> siteGroups;
  List<AccessEntry> siteUsers;
}
