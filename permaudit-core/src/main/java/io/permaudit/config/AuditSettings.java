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
 
package io.permaudit.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;

import io.permaudit.model.exception.ConfigurationException;
import io.permaudit.model.resource.ResourceKind;

/**
 * Scanner settings. The defaults are read from {@value #DEFAULTS_RESOURCE} on the classpath and
 * custom settings are merged on top: scalar values and lists replace the defaults, maps and nested
 * sections are merged key by key.
 */
@Data
public class AuditSettings {
  public static final String DEFAULTS_RESOURCE = "permaudit-defaults.yaml";
  public static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private int maxGroupNestingLevel;
  private int batchSize;
  private int itemPageSize;
  private boolean includeSubsites;
  private int maxSubsiteDepth;
  private List<String> subsiteTraversalExclusions;
  private List<String> ignorePermissionLevels;
  private List<String> ignoreAccounts;
  private List<String> ignoreSiteGroups;
  private List<String> doNotResolveGroups;
  private List<String> ignoreLists;

  /** Map of list base template id to the kind it is reported as. Other templates are skipped. */
  @JsonMerge private Map<Integer, ResourceKind> listTemplates;

  private List<String> systemLists;
  private List<String> allowedSystemLists;
  private List<String> managedPaths;
  @JsonMerge private RetrySettings retry;
  @JsonMerge private ClientProviderSettings clientProvider;
  private String directoryCacheFolder;

  @Data
  public static class RetrySettings {
    private int maxAttempts;
    private long initialBackoffMillis;
    private double backoffMultiplier;
    private long timeoutSeconds;
  }

  @Data
  public static class ClientProviderSettings {
    /** The class name of the {@link io.permaudit.spi.client.AuditClientProvider}. */
    private String providerClass;

    /** the configuration handed to the provider on init. */
    @JsonMerge private Map<String, String> configuration;
  }

  public static AuditSettings defaults() {
    try {
      return load(null);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read " + DEFAULTS_RESOURCE, e);
    }
  }

  /**
   * Loads the settings. The method first loads the defaults and then merges any custom settings
   * provided by the user.
   *
   * @param customSettings the custom settings yaml provided by the user, may be null
   * @return the merged settings
   */
  public static AuditSettings load(byte[] customSettings) throws IOException {
    try (InputStream inputStream =
        AuditSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (inputStream == null) {
        throw new ConfigurationException("Missing " + DEFAULTS_RESOURCE + " on the classpath");
      }
      AuditSettings settings = YAML_MAPPER.readValue(inputStream, AuditSettings.class);
      if (customSettings != null) {
        YAML_MAPPER.readerForUpdating(settings).readValue(customSettings);
      }
      validate(settings);
      return settings;
    }
  }

  @VisibleForTesting
  static void validate(AuditSettings settings) {
    if (settings.getMaxGroupNestingLevel() < 0) {
      throw new ConfigurationException("maxGroupNestingLevel must not be negative");
    }
    if (settings.getBatchSize() <= 0 || settings.getItemPageSize() <= 0) {
      throw new ConfigurationException("batchSize and itemPageSize must be positive");
    }
    if (settings.getRetry() == null || settings.getRetry().getMaxAttempts() < 1) {
      throw new ConfigurationException("retry.maxAttempts must be at least 1");
    }
    if (settings.getClientProvider() == null
        || settings.getClientProvider().getProviderClass() == null) {
      throw new ConfigurationException("clientProvider.providerClass is required");
    }
  }
}
