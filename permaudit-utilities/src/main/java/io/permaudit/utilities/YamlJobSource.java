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
 
package io.permaudit.utilities;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Data;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.exception.ConfigurationException;
import io.permaudit.model.job.AuditJob;
import io.permaudit.spi.job.JobSource;

/**
 * Reads the jobs of a run from a YAML file:
 *
 * <pre>
 * tenantRoot: https://contoso.sharepoint.com
 * jobs:
 *   - https://contoso.sharepoint.com/sites/A
 *   - https://contoso.sharepoint.com/sites/B/Shared Documents
 * </pre>
 *
 * Jobs are numbered from 1 in file order. Blank entries are rejected; a URL listed twice is only
 * audited once.
 */
@Log4j2
public class YamlJobSource implements JobSource {
  @Getter private final String tenantRoot;
  private final List<AuditJob> jobs;

  @Data
  public static class JobConfig {
    private String tenantRoot;
    private List<String> jobs;
  }

  public YamlJobSource(Path path) throws IOException {
    JobConfig config;
    try (InputStream inputStream = Files.newInputStream(path)) {
      config = AuditSettings.YAML_MAPPER.readValue(inputStream, JobConfig.class);
    }
    if (config == null || config.getJobs() == null || config.getJobs().isEmpty()) {
      throw new ConfigurationException("No jobs defined in " + path);
    }
    this.tenantRoot = config.getTenantRoot();
    this.jobs = toJobs(config.getJobs());
  }

  @Override
  public List<AuditJob> getJobs() {
    return jobs;
  }

  private static List<AuditJob> toJobs(List<String> urls) {
    Set<String> seen = new LinkedHashSet<>();
    List<AuditJob> result = new ArrayList<>();
    for (String url : urls) {
      if (url == null || url.trim().isEmpty()) {
        throw new ConfigurationException("Job URLs must not be blank");
      }
      String trimmed = url.trim();
      if (!seen.add(trimmed)) {
        log.warn("Ignoring duplicate job {}", trimmed);
        continue;
      }
      result.add(AuditJob.builder().url(trimmed).jobIndex(result.size() + 1).build());
    }
    return result;
  }
}
