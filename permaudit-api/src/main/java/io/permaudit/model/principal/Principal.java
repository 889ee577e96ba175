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
 
package io.permaudit.model.principal;

import java.util.Locale;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An account or group that can be granted access. For site groups {@code id} is the site-scoped
 * group id, for directory groups it is the opaque directory object id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Principal {
  String id;
  PrincipalKind kind;
  String loginName;
  String displayName;
  String email;

  @JsonIgnore
  public boolean isGroup() {
    return kind != null && kind.isGroup();
  }

  /** Display name, falling back to login name and then id. */
  @JsonIgnore
  public String getLabel() {
    if (displayName != null && !displayName.isEmpty()) {
      return displayName;
    }
    if (loginName != null && !loginName.isEmpty()) {
      return loginName;
    }
    return id == null ? "" : id;
  }

  /** Guest accounts carry the {@code #ext#} marker in their login name. */
  @JsonIgnore
  public boolean isExternal() {
    return loginName != null && loginName.toLowerCase(Locale.ROOT).contains("#ext#");
  }
}
