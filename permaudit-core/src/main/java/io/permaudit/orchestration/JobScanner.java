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

import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import io.permaudit.access.PermissionAccessor;
import io.permaudit.access.SiteSecurity;
import io.permaudit.access.SiteSecurityScanner;
import io.permaudit.model.access.AccessEntry;
import io.permaudit.model.access.UnresolvedReason;
import io.permaudit.model.checkpoint.AuditCheckpoint;
import io.permaudit.model.checkpoint.CheckpointStatus;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.job.AuditJob;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.stats.ScanCounts;
import io.permaudit.resolve.ResolutionContext;
import io.permaudit.spi.checkpoint.CheckpointStore;
import io.permaudit.spi.sink.AuditSink;
import io.permaudit.walk.WalkListener;
import io.permaudit.walk.WalkPosition;

/**
 * Turns the walk of one job into output rows. Rows are flushed when {@code batchSize} rows are
 * pending and at every site and list boundary; a checkpoint is written after every flush, never
 * before, so that a resumed job does not repeat rows.
 */
@Log4j2
class JobScanner implements WalkListener {
  private final AuditJob job;
  private final ResolutionContext context;
  private final AuditSink sink;
  private final CheckpointStore checkpointStore;
  private final PermissionAccessor permissionAccessor;
  private final SiteSecurityScanner siteSecurityScanner;
  private final int batchSize;
  @Getter private final ScanCounts counts;
  private AuditCheckpoint checkpoint;

  JobScanner(
      AuditJob job,
      ResolutionContext context,
      AuditSink sink,
      CheckpointStore checkpointStore,
      AuditCheckpoint checkpoint,
      PermissionAccessor permissionAccessor,
      SiteSecurityScanner siteSecurityScanner,
      int batchSize) {
    this.job = job;
    this.context = context;
    this.sink = sink;
    this.checkpointStore = checkpointStore;
    this.checkpoint = checkpoint;
    this.counts = checkpoint.getCounts() == null ? new ScanCounts() : checkpoint.getCounts().copy();
    this.permissionAccessor = permissionAccessor;
    this.siteSecurityScanner = siteSecurityScanner;
    this.batchSize = batchSize;
  }

  @Override
  public void onSite(AuditResource site, List<AuditResource> contents) {
    log.info("Job {}: scanning site {}", job.getJobIndex(), site.getUrl());
    counts.setSitesScanned(counts.getSitesScanned() + 1);
    sink.writeSiteContents(contents);
    SiteSecurity security;
    try {
      security = siteSecurityScanner.scan(context, site);
    } catch (ContentAccessException e) {
      log.error("Job {}: unable to scan security of site {}", job.getJobIndex(), site.getUrl(), e);
      return;
    }
    sink.writeSiteGroups(security.getSiteGroups());
    sink.writeSiteUsers(security.getSiteUsers());
    counts.setSiteGroups(counts.getSiteGroups() + security.getSiteGroups().size());
    counts.setSiteUsers(counts.getSiteUsers() + security.getSiteUsers().size());
    countPrincipals(security.getSiteUsers());
  }

  @Override
  public void onSiteCompleted(WalkPosition position) {
    flushAndCheckpoint(position);
  }

  @Override
  public void onBrokenInheritance(AuditResource resource) {
    counts.setBrokenInheritanceNodes(counts.getBrokenInheritanceNodes() + 1);
    sink.writeBrokenPermissionNodes(Collections.singletonList(resource));
    List<AccessEntry> entries;
    try {
      entries = permissionAccessor.getAccessEntries(context, resource);
    } catch (ContentAccessException e) {
      log.error(
          "Job {}: unable to read permissions of {} {} ({})",
          job.getJobIndex(),
          resource.getKind(),
          resource.getUrl(),
          resource.getId(),
          e);
      counts.setUnreadableNodes(counts.getUnreadableNodes() + 1);
      entries = Collections.singletonList(PermissionAccessor.unreadableEntry(resource));
    }
    sink.writeAccessEntries(entries);
    counts.setAccessRows(counts.getAccessRows() + entries.size());
    countPrincipals(entries);
  }

  @Override
  public void onItemProcessed(AuditResource item, WalkPosition position) {
    counts.setItemsScanned(counts.getItemsScanned() + 1);
    if (sink.getPendingRows() >= batchSize) {
      flushAndCheckpoint(position);
    }
  }

  @Override
  public void onListCompleted(AuditResource list, WalkPosition position) {
    log.info("Job {}: list {} of {} completed", job.getJobIndex(), list.getTitle(), list.getSiteUrl());
    counts.setListsScanned(counts.getListsScanned() + 1);
    flushAndCheckpoint(position);
  }

  /** Flushes the remaining rows and marks the job completed. */
  AuditCheckpoint complete() {
    sink.flush();
    checkpoint =
        checkpoint.toBuilder().status(CheckpointStatus.COMPLETED).counts(counts.copy()).build();
    checkpointStore.write(checkpoint);
    return checkpoint;
  }

  private void flushAndCheckpoint(WalkPosition position) {
    sink.flush();
    checkpoint =
        checkpoint.toBuilder()
            .lastSiteIndex(position.getSiteIndex())
            .lastListIndex(position.getListIndex())
            .lastItemId(position.getItemId())
            .counts(counts.copy())
            .build();
    checkpointStore.write(checkpoint);
  }

  private void countPrincipals(List<AccessEntry> entries) {
    for (AccessEntry entry : entries) {
      if (entry.getUnresolvedReason() == UnresolvedReason.ASSIGNMENTS_UNREADABLE) {
        continue;
      }
      if (entry.isPlaceholder()) {
        counts.setUnresolvedGroups(counts.getUnresolvedGroups() + 1);
      } else if (entry.getPrincipal().isExternal()) {
        counts.setExternalUsers(counts.getExternalUsers() + 1);
      }
    }
  }
}
