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
 
package io.permaudit.classify;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.classification.UrlClassification;
import io.permaudit.model.classification.UrlKind;
import io.permaudit.model.exception.ClassificationException;
import io.permaudit.model.exception.ContentAccessException;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.resource.ListInfo;
import io.permaudit.model.resource.SiteInfo;
import io.permaudit.paths.UrlPathUtils;
import io.permaudit.spi.content.ContentServiceClient;

/**
 * Maps an input URL to the kind of node it addresses. The full URL is tried as a site first; when
 * that is not found, shorter path prefixes are probed until one connects, and the remainder is
 * matched against the root folders of that site's lists.
 *
 * <p>Classification never throws. Every failure is reported as a {@link UrlKind#ERROR} result
 * carrying the error code and message.
 */
@Log4j2
public class UrlClassifier {
  private final ContentServiceClient contentClient;
  private final String tenantRoot;
  private final Set<String> managedPaths;

  public UrlClassifier(
      @NonNull ContentServiceClient contentClient, AuditSettings settings, String tenantRoot) {
    this.contentClient = contentClient;
    this.tenantRoot = tenantRoot == null ? null : UrlPathUtils.normalizeUrl(tenantRoot);
    this.managedPaths =
        settings.getManagedPaths().stream()
            .map(path -> path.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
  }

  public UrlClassification classify(String inputUrl) {
    try {
      UrlClassification classification = doClassify(inputUrl);
      log.info(
          "Classified {} as {} (site {})",
          inputUrl,
          classification.getKind(),
          classification.getSiteUrl());
      return classification;
    } catch (ClassificationException | ContentAccessException e) {
      log.warn("Unable to classify {}: {}", inputUrl, e.getMessage());
      return UrlClassification.error(inputUrl, e.getErrorCode(), e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected failure while classifying {}", inputUrl, e);
      return UrlClassification.error(inputUrl, ErrorCode.CONTENT_ACCESS, e.getMessage());
    }
  }

  private UrlClassification doClassify(String inputUrl) {
    String url = UrlPathUtils.normalizeUrl(inputUrl);
    if (tenantRoot != null
        && !UrlPathUtils.isSameOrDescendant(url.toLowerCase(Locale.ROOT), tenantRoot)) {
      throw new ClassificationException(
          ErrorCode.INVALID_URL, String.format("%s is outside tenant %s", url, tenantRoot));
    }
    String origin = UrlPathUtils.getOrigin(url);
    String path = UrlPathUtils.getPath(url);

    SiteInfo site = tryConnect(url);
    if (site != null) {
      return UrlClassification.builder()
          .inputUrl(inputUrl)
          .kind(site.isRootWeb() ? UrlKind.SITE : UrlKind.SUBSITE)
          .siteUrl(siteUrlOf(site, url))
          .relativePath("")
          .build();
    }

    String sitePath = UrlPathUtils.getParentPath(path);
    while (site == null) {
      if (!sitePath.isEmpty() && isManagedPath(sitePath)) {
        sitePath = UrlPathUtils.getParentPath(sitePath);
        continue;
      }
      site = tryConnect(origin + sitePath);
      if (site == null) {
        if (sitePath.isEmpty()) {
          throw new ClassificationException(ErrorCode.NOT_FOUND, "No site found for " + url);
        }
        sitePath = UrlPathUtils.getParentPath(sitePath);
      }
    }
    String siteUrl = siteUrlOf(site, origin + sitePath);
    return classifyBelowSite(inputUrl, siteUrl, sitePath, path);
  }

  private UrlClassification classifyBelowSite(
      String inputUrl, String siteUrl, String sitePath, String path) {
    List<ListInfo> lists = contentClient.getLists(siteUrl);
    ListInfo owningList = null;
    String owningRoot = null;
    for (ListInfo list : lists) {
      if (list.getRootFolderUrl() == null) {
        continue;
      }
      String root = UrlPathUtils.cleanPath(list.getRootFolderUrl());
      if (UrlPathUtils.isSameOrDescendant(path, root)
          && (owningRoot == null || root.length() > owningRoot.length())) {
        owningList = list;
        owningRoot = root;
      }
    }
    if (owningList == null) {
      throw new ClassificationException(
          ErrorCode.NOT_FOUND,
          String.format("%s is below site %s but matches none of its lists", path, siteUrl));
    }
    UrlClassification.UrlClassificationBuilder builder =
        UrlClassification.builder()
            .inputUrl(inputUrl)
            .siteUrl(siteUrl)
            .relativePath(UrlPathUtils.getRelativePath(path, sitePath))
            .listRootFolderUrl(owningRoot);
    if (path.equalsIgnoreCase(owningRoot)) {
      return builder.kind(UrlKind.LIBRARY).build();
    }
    if (!contentClient.folderExists(siteUrl, path)) {
      throw new ClassificationException(
          ErrorCode.NOT_FOUND,
          String.format("Folder %s does not exist in list %s", path, owningList.getTitle()));
    }
    return builder.kind(UrlKind.FOLDER).folderUrl(path).build();
  }

  /** Returns the site, or null when nothing exists at the URL. Other failures propagate. */
  private SiteInfo tryConnect(String url) {
    try {
      return contentClient.connect(url);
    } catch (ContentAccessException e) {
      if (e.getErrorCode() == ErrorCode.NOT_FOUND) {
        log.debug("No site at {}", url);
        return null;
      }
      throw e;
    }
  }

  private boolean isManagedPath(String path) {
    // only a single segment such as /sites or /teams
    return path.lastIndexOf('/') == 0
        && managedPaths.contains(path.substring(1).toLowerCase(Locale.ROOT));
  }

  private static String siteUrlOf(SiteInfo site, String fallback) {
    return site.getUrl() == null ? fallback : UrlPathUtils.cleanUrl(site.getUrl());
  }
}
