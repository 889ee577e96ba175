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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.classification.UrlClassification;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.resource.AuditResource;
import io.permaudit.model.resource.ItemInfo;
import io.permaudit.model.resource.ListInfo;
import io.permaudit.model.resource.ResourceKind;
import io.permaudit.model.resource.SiteInfo;
import io.permaudit.paths.UrlPathUtils;
import io.permaudit.spi.content.ContentServiceClient;

/**
 * Enumerates the sites, lists and items in scope of a classified URL and reports the nodes with
 * unique role assignments.
 *
 * <p>A site scope covers the site, its audited lists and, depth first, its subsites. A library
 * scope covers one list and a folder scope the items of one folder. Items are read in pages of
 * ascending item id.
 *
 * <p>Sites and lists are numbered in walk order. A walk started from a {@link WalkPosition} skips
 * the site level output of sites up to {@code siteIndex}, skips lists up to {@code listIndex} and
 * continues the next list after {@code itemId}.
 */
@Log4j2
public class ContentTreeWalker {
  private final ContentServiceClient contentClient;
  private final ListFilter listFilter;
  private final boolean includeSubsites;
  private final int maxSubsiteDepth;
  private final Set<String> subsiteExclusions;
  private final int pageSize;

  public ContentTreeWalker(
      @NonNull ContentServiceClient contentClient, @NonNull AuditSettings settings) {
    this.contentClient = contentClient;
    this.listFilter = new ListFilter(settings);
    this.includeSubsites = settings.isIncludeSubsites();
    this.maxSubsiteDepth = settings.getMaxSubsiteDepth();
    this.subsiteExclusions =
        settings.getSubsiteTraversalExclusions() == null
            ? Collections.emptySet()
            : settings.getSubsiteTraversalExclusions().stream()
                .map(url -> UrlPathUtils.normalizeUrl(url).toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    this.pageSize = settings.getItemPageSize();
  }

  /**
   * Walks the scope of {@code target}.
   *
   * @throws ContentAccessException when the target site or list cannot be read; failures below a
   *     site are logged and skipped
   */
  public void walk(UrlClassification target, WalkPosition resumeFrom, WalkListener listener) {
    Walk walk = new Walk(resumeFrom, listener);
    switch (target.getKind()) {
      case SITE:
      case SUBSITE:
        walk.site(target.getSiteUrl(), 0);
        break;
      case LIBRARY:
      case FOLDER:
        walk.targetList(target);
        break;
      default:
        throw new IllegalArgumentException("Unable to walk " + target.getKind() + " target");
    }
  }

  /** State of one walk. */
  private class Walk {
    private final WalkPosition resumeFrom;
    private final WalkListener listener;
    private int siteCount;
    private int listCount;
    private int completedSites;

    Walk(WalkPosition resumeFrom, WalkListener listener) {
      this.resumeFrom = resumeFrom == null ? WalkPosition.START : resumeFrom;
      this.listener = listener;
      this.completedSites = this.resumeFrom.getSiteIndex();
    }

    void site(String siteUrl, int depth) {
      int siteIndex = ++siteCount;
      SiteInfo site = contentClient.connect(siteUrl);
      String url = site.getUrl() == null ? siteUrl : site.getUrl();
      AuditResource siteResource = AuditResource.forSite(site);

      List<AuditResource> lists = new ArrayList<>();
      List<ListInfo> listInfos = new ArrayList<>();
      for (ListInfo list : contentClient.getLists(url)) {
        Optional<ResourceKind> kind = listFilter.kindOf(list);
        if (kind.isPresent()) {
          listInfos.add(list);
          lists.add(AuditResource.forList(url, list, kind.get()));
        }
      }
      List<SiteInfo> subsites =
          descendInto(url, depth) ? contentClient.getSubsites(url) : Collections.emptyList();

      if (siteIndex > resumeFrom.getSiteIndex()) {
        List<AuditResource> contents = new ArrayList<>(lists);
        subsites.forEach(subsite -> contents.add(AuditResource.forSite(subsite)));
        listener.onSite(siteResource, contents);
        if (!site.isRootWeb() && site.isUniqueRoleAssignments()) {
          listener.onBrokenInheritance(siteResource);
        }
        completedSites = siteIndex;
        listener.onSiteCompleted(new WalkPosition(completedSites, listCount, 0L));
      } else {
        log.debug("Site level output of {} already written", url);
      }

      for (int i = 0; i < listInfos.size(); i++) {
        ListInfo list = listInfos.get(i);
        try {
          list(url, list, lists.get(i), null, true);
        } catch (ContentAccessException e) {
          log.error("Unable to read list {} ({}) of site {}", list.getTitle(), list.getId(), url, e);
        }
      }
      for (SiteInfo subsite : subsites) {
        try {
          site(subsite.getUrl(), depth + 1);
        } catch (ContentAccessException e) {
          log.error("Unable to read subsite {} of site {}", subsite.getUrl(), url, e);
        }
      }
    }

    void targetList(UrlClassification target) {
      String siteUrl = target.getSiteUrl();
      ListInfo list =
          contentClient.getLists(siteUrl).stream()
              .filter(
                  candidate ->
                      candidate.getRootFolderUrl() != null
                          && UrlPathUtils.cleanPath(candidate.getRootFolderUrl())
                              .equalsIgnoreCase(target.getListRootFolderUrl()))
              .findFirst()
              .orElseThrow(
                  () ->
                      new ContentAccessException(
                          ErrorCode.NOT_FOUND,
                          String.format(
                              "List %s not found in site %s",
                              target.getListRootFolderUrl(),
                              siteUrl)));
      AuditResource listResource =
          AuditResource.forList(siteUrl, list, listFilter.templateKind(list));
      // in a folder scope only the items below the folder are audited
      list(siteUrl, list, listResource, target.getFolderUrl(), target.getFolderUrl() == null);
    }

    private void list(
        String siteUrl,
        ListInfo list,
        AuditResource listResource,
        String folderUrl,
        boolean auditListNode) {
      int listIndex = ++listCount;
      if (listIndex <= resumeFrom.getListIndex()) {
        log.debug("List {} of {} already audited", list.getTitle(), siteUrl);
        return;
      }
      long afterId = listIndex == resumeFrom.getListIndex() + 1 ? resumeFrom.getItemId() : 0L;
      if (afterId > 0) {
        log.info("Resuming list {} of {} after item {}", list.getTitle(), siteUrl, afterId);
      } else if (auditListNode && list.isUniqueRoleAssignments()) {
        listener.onBrokenInheritance(listResource);
      }

      while (true) {
        List<ItemInfo> page = contentClient.getItems(siteUrl, list.getId(), afterId, pageSize);
        for (ItemInfo item : page) {
          afterId = Math.max(afterId, item.getId());
          if (folderUrl != null && !isInFolder(item, folderUrl)) {
            continue;
          }
          AuditResource itemResource = AuditResource.forItem(siteUrl, list, item);
          if (item.isUniqueRoleAssignments()) {
            listener.onBrokenInheritance(itemResource);
          }
          listener.onItemProcessed(
              itemResource, new WalkPosition(completedSites, listIndex - 1, item.getId()));
        }
        if (page.size() < pageSize) {
          break;
        }
      }
      listener.onListCompleted(listResource, new WalkPosition(completedSites, listIndex, 0L));
    }

    private boolean descendInto(String siteUrl, int depth) {
      if (!includeSubsites || depth >= maxSubsiteDepth) {
        return false;
      }
      return !subsiteExclusions.contains(UrlPathUtils.cleanUrl(siteUrl).toLowerCase(Locale.ROOT));
    }

    private boolean isInFolder(ItemInfo item, String folderUrl) {
      return item.getFileRef() != null
          && UrlPathUtils.isSameOrDescendant(UrlPathUtils.cleanPath(item.getFileRef()), folderUrl);
    }
  }
}
