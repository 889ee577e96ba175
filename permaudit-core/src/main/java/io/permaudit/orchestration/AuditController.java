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
 
package io.permaudit.orchestration;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.permaudit.access.PermissionAccessor;
import io.permaudit.access.SiteSecurityScanner;
import io.permaudit.classify.UrlClassifier;
import io.permaudit.config.AuditSettings;
import io.permaudit.model.checkpoint.AuditCheckpoint;
import io.permaudit.model.checkpoint.CheckpointStatus;
import io.permaudit.model.classification.UrlClassification;
import io.permaudit.model.exception.CheckpointException;
import io.permaudit.model.exception.SinkException;
import io.permaudit.model.job.AuditJob;
import io.permaudit.model.stats.ScanCounts;
import io.permaudit.model.sync.ErrorDetails;
import io.permaudit.model.sync.JobResult;
import io.permaudit.model.sync.JobStatus;
import io.permaudit.resolve.DirectoryGroupCache;
import io.permaudit.resolve.GroupResolver;
import io.permaudit.resolve.ResolutionContext;
import io.permaudit.spi.checkpoint.CheckpointStore;
import io.permaudit.spi.content.ContentServiceClient;
import io.permaudit.spi.directory.DirectoryServiceClient;
import io.permaudit.spi.sink.AuditSink;
import io.permaudit.spi.sink.AuditSinkProvider;
import io.permaudit.walk.ContentTreeWalker;
import io.permaudit.walk.WalkPosition;

/**
 * Runs a list of audit jobs one after the other. For each job the URL is classified, the content in
 * scope is walked and the permissions of every node with unique role assignments are resolved and
 * written to the job's sink.
 *
 * <ul>
 *   <li>Site group members, user names and group properties are cached per job; directory group
 *       members are cached in the {@link DirectoryGroupCache} shared by all jobs.
 *   <li>A job whose checkpoint is in progress resumes after its last checkpoint; a completed job is
 *       not run again.
 *   <li>A job whose URL cannot be classified is recorded and skipped. A job failing while it is
 *       walked is reported as {@link JobStatus#ERROR}. Sink and checkpoint failures stop the run.
 * </ul>
 */
@Log4j2
public class AuditController {
  private final AuditSettings settings;
  private final AuditSinkProvider sinkProvider;
  private final CheckpointStore checkpointStore;
  private final DirectoryGroupCache directoryGroupCache;
  private final UrlClassifier classifier;
  private final ContentTreeWalker walker;
  private final PermissionAccessor permissionAccessor;
  private final SiteSecurityScanner siteSecurityScanner;

  @Builder
  public AuditController(
      @NonNull AuditSettings settings,
      @NonNull ContentServiceClient contentClient,
      @NonNull DirectoryServiceClient directoryClient,
      @NonNull AuditSinkProvider sinkProvider,
      @NonNull CheckpointStore checkpointStore,
      DirectoryGroupCache directoryGroupCache,
      String tenantRoot) {
    this.settings = settings;
    this.sinkProvider = sinkProvider;
    this.checkpointStore = checkpointStore;
    this.directoryGroupCache =
        directoryGroupCache == null ? new DirectoryGroupCache() : directoryGroupCache;
    this.classifier = new UrlClassifier(contentClient, settings, tenantRoot);
    this.walker = new ContentTreeWalker(contentClient, settings);
    GroupResolver groupResolver = new GroupResolver(contentClient, directoryClient, settings);
    this.permissionAccessor = new PermissionAccessor(contentClient, groupResolver, settings);
    this.siteSecurityScanner =
        new SiteSecurityScanner(contentClient, permissionAccessor, settings);
  }

  /**
   * Runs the jobs in order.
   *
   * @param jobs jobs with ascending job indexes
   * @return one result per job
   * @throws SinkException if output cannot be written
   * @throws CheckpointException if a checkpoint cannot be read or written
   */
  public List<JobResult> run(List<AuditJob> jobs) {
    List<JobResult> results = new ArrayList<>();
    for (AuditJob job : jobs) {
      results.add(runJob(job));
    }
    logSummary(results);
    return results;
  }

  JobResult runJob(AuditJob job) {
    Instant startTime = Instant.now();
    Optional<AuditCheckpoint> existing =
        checkpointStore
            .read(job.getJobIndex())
            .filter(
                checkpoint -> {
                  if (!job.getUrl().equals(checkpoint.getJobUrl())) {
                    log.warn(
                        "Ignoring checkpoint of job {} recorded for {}",
                        job.getJobIndex(),
                        checkpoint.getJobUrl());
                    return false;
                  }
                  return true;
                });
    if (existing.isPresent() && existing.get().getStatus().isTerminal()) {
      log.info("Job {} ({}) was already completed", job.getJobIndex(), job.getUrl());
      return result(job, JobStatus.ALREADY_COMPLETED, null, existing.get().getCounts(), startTime)
          .build();
    }

    // site scoped caches are only valid within one job
    ResolutionContext context = new ResolutionContext(directoryGroupCache);
    UrlClassification classification = classifier.classify(job.getUrl());
    if (classification.isError()) {
      log.error(
          "Skipping job {}: unable to classify {}: {}",
          job.getJobIndex(),
          job.getUrl(),
          classification.getErrorMessage());
      AuditCheckpoint checkpoint =
          AuditCheckpoint.start(job.getJobIndex(), job.getUrl()).toBuilder()
              .status(CheckpointStatus.CLASSIFICATION_ERROR)
              .build();
      checkpointStore.write(checkpoint);
      return result(
              job, JobStatus.CLASSIFICATION_ERROR, classification, checkpoint.getCounts(), startTime)
          .errorDetails(
              ErrorDetails.builder()
                  .errorMessage(classification.getErrorMessage())
                  .errorDescription("Unable to classify " + job.getUrl())
                  .errorCode(classification.getErrorCode())
                  .canRetryOnFailure(false)
                  .build())
          .build();
    }

    boolean resume = existing.isPresent();
    AuditCheckpoint checkpoint =
        existing.orElseGet(() -> AuditCheckpoint.start(job.getJobIndex(), job.getUrl()));
    if (resume) {
      log.info(
          "Resuming job {} after site {}, list {}, item {}",
          job.getJobIndex(),
          checkpoint.getLastSiteIndex(),
          checkpoint.getLastListIndex(),
          checkpoint.getLastItemId());
    }
    JobScanner scanner = null;
    try (AuditSink sink = sinkProvider.open(job, resume)) {
      scanner =
          new JobScanner(
              job,
              context,
              sink,
              checkpointStore,
              checkpoint,
              permissionAccessor,
              siteSecurityScanner,
              settings.getBatchSize());
      walker.walk(classification, WalkPosition.of(checkpoint), scanner);
      AuditCheckpoint completed = scanner.complete();
      log.info("Job {} ({}) completed: {}", job.getJobIndex(), job.getUrl(), completed.getCounts());
      return result(job, JobStatus.SUCCESS, classification, completed.getCounts(), startTime)
          .build();
    } catch (SinkException | CheckpointException e) {
      throw e;
    } catch (Exception e) {
      log.error("Audit of job {} ({}) failed", job.getJobIndex(), job.getUrl(), e);
      return result(
              job,
              JobStatus.ERROR,
              classification,
              scanner == null ? checkpoint.getCounts() : scanner.getCounts().copy(),
              startTime)
          .errorDetails(ErrorDetails.create(e, "Failed to audit " + job.getUrl()))
          .build();
    }
  }

  private static JobResult.JobResultBuilder result(
      AuditJob job,
      JobStatus status,
      UrlClassification classification,
      ScanCounts counts,
      Instant startTime) {
    return JobResult.builder()
        .job(job)
        .status(status)
        .classification(classification)
        .counts(counts)
        .startTime(startTime)
        .duration(Duration.between(startTime, Instant.now()));
  }

  private static void logSummary(List<JobResult> results) {
    Map<JobStatus, Long> byStatus =
        results.stream()
            .collect(Collectors.groupingBy(JobResult::getStatus, Collectors.counting()));
    log.info("Audit finished for {} jobs: {}", results.size(), byStatus);
    results.stream()
        .filter(result -> result.getStatus() == JobStatus.ERROR)
        .forEach(
            result ->
                log.error(
                    "Job {} ({}) failed: {}",
                    result.getJob().getJobIndex(),
                    result.getJob().getUrl(),
                    result.getErrorDetails().getErrorMessage()));
  }
}
