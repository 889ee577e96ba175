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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.permaudit.model.access.RoleAssignment;
import io.permaudit.model.exception.ConfigurationException;
import io.permaudit.model.principal.Principal;
import io.permaudit.model.principal.PrincipalKind;
import io.permaudit.model.resource.ShareInfo;

/**
 * Export of a tenant's sites, permissions and directory groups, read from YAML. Backs {@link
 * SnapshotContentServiceClient} and {@link SnapshotDirectoryServiceClient} for offline audits.
 */
@Data
public class TenantSnapshot {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private List<Site> sites = new ArrayList<>();
  private List<DirectoryGroup> directoryGroups = new ArrayList<>();
  /** Display names keyed by login name. */
  private Map<String, String> users = Collections.emptyMap();
  /** URLs the caller is not allowed to read. */
  private List<String> deniedUrls = new ArrayList<>();

  @Data
  public static class Site {
    private String id;
    private String title;
    private String url;
    private boolean rootWeb;
    private boolean uniqueRoleAssignments;
    private List<RoleAssignment> roleAssignments = new ArrayList<>();
    private List<SiteGroup> siteGroups = new ArrayList<>();
    private List<SiteList> lists = new ArrayList<>();
    private List<Site> subsites = new ArrayList<>();
  }

  @Data
  public static class SiteGroup {
    private String id;
    private String title;
    private String loginName;
    private String ownerTitle;
    private List<Principal> members = new ArrayList<>();
  }

  @Data
  public static class SiteList {
    private String id;
    private String title;
    private int baseTemplate;
    private boolean hidden;
    private String rootFolderUrl;
    private boolean uniqueRoleAssignments;
    private List<RoleAssignment> roleAssignments = new ArrayList<>();
    private List<Item> items = new ArrayList<>();
  }

  @Data
  public static class Item {
    private long id;
    private String fileRef;
    private String fileLeafRef;
    private boolean folder;
    private boolean uniqueRoleAssignments;
    private Map<String, ShareInfo> sharedWith = Collections.emptyMap();
    private List<RoleAssignment> roleAssignments = new ArrayList<>();
  }

  @Data
  public static class DirectoryGroup {
    private String id;
    private String displayName;
    private PrincipalKind kind = PrincipalKind.SECURITY_GROUP;
    private String email;
    private List<Principal> members = new ArrayList<>();
  }

  public static TenantSnapshot load(Path path) {
    try (InputStream inputStream = Files.newInputStream(path)) {
      return load(inputStream);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read tenant snapshot " + path, e);
    }
  }

  public static TenantSnapshot load(InputStream inputStream) throws IOException {
    return YAML_MAPPER.readValue(inputStream, TenantSnapshot.class);
  }
}
