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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.common.annotations.VisibleForTesting;

import io.permaudit.checkpoint.FileCheckpointStore;
import io.permaudit.config.AuditSettings;
import io.permaudit.model.job.AuditJob;
import io.permaudit.model.sync.JobResult;
import io.permaudit.orchestration.AuditController;
import io.permaudit.reflection.ReflectionUtils;
import io.permaudit.resolve.DirectoryGroupCache;
import io.permaudit.retry.RetryingContentServiceClient;
import io.permaudit.retry.RetryingDirectoryServiceClient;
import io.permaudit.retry.ServiceCallPolicy;
import io.permaudit.sink.CsvAuditSinkProvider;
import io.permaudit.spi.checkpoint.CheckpointStore;
import io.permaudit.spi.client.AuditClientProvider;

/** Provides a standalone runner for a permission audit over a list of URLs. */
@Log4j2
public class RunAudit {
  private static final String JOBS_OPTION = "j";
  private static final String SETTINGS_OPTION = "s";
  private static final String OUTPUT_OPTION = "o";
  private static final String CHECKPOINT_OPTION = "k";
  private static final String FRESH_OPTION = "f";
  private static final String CLEAR_CACHE_OPTION = "x";
  private static final String HELP_OPTION = "h";

  @VisibleForTesting
  static final Options OPTIONS =
      new Options()
          .addRequiredOption(
              JOBS_OPTION, "jobs", true, "The path to a yaml file containing the URLs to audit")
          .addOption(
              SETTINGS_OPTION,
              "settings",
              true,
              "The path to a yaml file with scanner settings. These settings override the defaults")
          .addOption(
              OUTPUT_OPTION,
              "output",
              true,
              "The folder the CSV files are written to, one sub folder per job. Defaults to ./output")
          .addOption(
              CHECKPOINT_OPTION,
              "checkpoints",
              true,
              "The folder checkpoints are kept in. Defaults to <output>/checkpoints")
          .addOption(
              FRESH_OPTION,
              "fresh",
              false,
              "Discards existing checkpoints and audits every job from the start")
          .addOption(
              CLEAR_CACHE_OPTION,
              "clearCache",
              false,
              "Clears the persistent directory group cache before the run")
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  public static void main(String[] args) throws IOException {
    CommandLineParser parser = new DefaultParser();

    CommandLine cmd;
    try {
      cmd = parser.parse(OPTIONS, args);
    } catch (ParseException e) {
      new HelpFormatter().printHelp("permaudit.jar", OPTIONS, true);
      return;
    }

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp("RunAudit", OPTIONS);
      return;
    }
    runAudit(cmd);
  }

  @VisibleForTesting
  static List<JobResult> runAudit(CommandLine cmd) throws IOException {
    AuditSettings settings = AuditSettings.load(getCustomConfigurations(cmd, SETTINGS_OPTION));
    YamlJobSource jobSource = new YamlJobSource(Paths.get(cmd.getOptionValue(JOBS_OPTION)));
    List<AuditJob> jobs = jobSource.getJobs();

    Path outputFolder = Paths.get(cmd.getOptionValue(OUTPUT_OPTION, "output"));
    Path checkpointFolder =
        cmd.hasOption(CHECKPOINT_OPTION)
            ? Paths.get(cmd.getOptionValue(CHECKPOINT_OPTION))
            : outputFolder.resolve("checkpoints");
    CheckpointStore checkpointStore = new FileCheckpointStore(checkpointFolder);
    if (cmd.hasOption(FRESH_OPTION)) {
      checkpointStore.clear();
    }
    DirectoryGroupCache directoryGroupCache =
        settings.getDirectoryCacheFolder() == null
            ? new DirectoryGroupCache()
            : new DirectoryGroupCache(Paths.get(settings.getDirectoryCacheFolder()));
    if (cmd.hasOption(CLEAR_CACHE_OPTION)) {
      directoryGroupCache.clear();
    }

    AuditClientProvider clientProvider =
        ReflectionUtils.createInstanceOfClass(
            settings.getClientProvider().getProviderClass(), AuditClientProvider.class);
    clientProvider.init(settings.getClientProvider().getConfiguration());

    try (ServiceCallPolicy contentPolicy = new ServiceCallPolicy("content", settings.getRetry());
        ServiceCallPolicy directoryPolicy =
            new ServiceCallPolicy("directory", settings.getRetry())) {
      AuditController controller =
          AuditController.builder()
              .settings(settings)
              .contentClient(
                  new RetryingContentServiceClient(
                      clientProvider.getContentServiceClient(), contentPolicy))
              .directoryClient(
                  new RetryingDirectoryServiceClient(
                      clientProvider.getDirectoryServiceClient(), directoryPolicy))
              .sinkProvider(new CsvAuditSinkProvider(outputFolder))
              .checkpointStore(checkpointStore)
              .directoryGroupCache(directoryGroupCache)
              .tenantRoot(jobSource.getTenantRoot())
              .build();
      log.info("Running audit of {} jobs, writing to {}", jobs.size(), outputFolder);
      return controller.run(jobs);
    }
  }

  static byte[] getCustomConfigurations(CommandLine cmd, String option) throws IOException {
    byte[] customConfig = null;
    if (cmd.hasOption(option)) {
      customConfig = Files.readAllBytes(Paths.get(cmd.getOptionValue(option)));
    }
    return customConfig;
  }
}
