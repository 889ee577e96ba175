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
 
package io.permaudit.paths;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import io.permaudit.model.exception.ClassificationException;
import io.permaudit.model.exception.ErrorCode;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class UrlPathUtils {
  private static final Pattern VIEW_PAGE = Pattern.compile("(?i)/Forms/[^/]+\\.aspx$");
  private static final Pattern DUPLICATE_SLASHES = Pattern.compile("/{2,}");

  /**
   * Normalizes an input URL for comparison: drops query and fragment, decodes percent-encoded
   * characters exactly once, collapses duplicate slashes and removes a trailing list view page and
   * trailing slashes. Scheme and host are lower-cased, the path keeps its case. The result is in
   * decoded form and must only be cleaned again with {@link #cleanUrl}.
   *
   * @param url the absolute URL, may be percent-encoded
   * @return the normalized URL, e.g. {@code https://contoso.sharepoint.com/sites/A/Shared
   *     Documents}
   */
  public static String normalizeUrl(String url) {
    if (url == null || url.trim().isEmpty()) {
      throw new ClassificationException(ErrorCode.INVALID_URL, "URL is empty");
    }
    String trimmed = url.trim();
    int cut = indexOfAny(trimmed, '?', '#');
    if (cut >= 0) {
      trimmed = trimmed.substring(0, cut);
    }
    URI uri;
    try {
      // Spaces and other unencoded characters are common in pasted URLs.
      uri = new URI(trimmed.replace(" ", "%20"));
    } catch (URISyntaxException e) {
      throw new ClassificationException(ErrorCode.INVALID_URL, "Malformed URL: " + url, e);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new ClassificationException(ErrorCode.INVALID_URL, "URL is not absolute: " + url);
    }
    String path = normalizePath(uri.getRawPath());
    String authority =
        uri.getHost().toLowerCase(Locale.ROOT) + (uri.getPort() == -1 ? "" : ":" + uri.getPort());
    return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + authority + path;
  }

  /**
   * Normalizes a raw, percent-encoded path: decodes it once and then applies {@link #cleanPath}.
   * The root path is returned as the empty string.
   */
  public static String normalizePath(String rawPath) {
    if (rawPath == null) {
      return "";
    }
    return cleanPath(decode(rawPath));
  }

  /**
   * Cleans a path that is already decoded, such as a server-relative URL reported by the content
   * service: collapses duplicate slashes, strips a trailing view page and trailing slashes. No
   * character is decoded, so {@code %}, {@code #} and {@code ?} stay part of the path and the
   * result can be cleaned again without change.
   */
  public static String cleanPath(String decodedPath) {
    if (decodedPath == null) {
      return "";
    }
    String path = DUPLICATE_SLASHES.matcher(decodedPath).replaceAll("/");
    path = VIEW_PAGE.matcher(path).replaceAll("");
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    if (!path.isEmpty() && !path.startsWith("/")) {
      path = "/" + path;
    }
    return path;
  }

  /**
   * Cleans an absolute URL whose path is already decoded, such as one returned by {@link
   * #normalizeUrl} or reported by the content service. Scheme and host are lower-cased and the path
   * goes through {@link #cleanPath}; nothing is decoded and no query or fragment is stripped.
   */
  public static String cleanUrl(String decodedUrl) {
    if (decodedUrl == null || decodedUrl.trim().isEmpty()) {
      throw new ClassificationException(ErrorCode.INVALID_URL, "URL is empty");
    }
    String trimmed = decodedUrl.trim();
    int schemeEnd = trimmed.indexOf("://");
    if (schemeEnd <= 0) {
      throw new ClassificationException(
          ErrorCode.INVALID_URL, "URL is not absolute: " + decodedUrl);
    }
    int pathStart = trimmed.indexOf('/', schemeEnd + 3);
    String origin = pathStart < 0 ? trimmed : trimmed.substring(0, pathStart);
    if (origin.length() == schemeEnd + 3) {
      throw new ClassificationException(
          ErrorCode.INVALID_URL, "URL is not absolute: " + decodedUrl);
    }
    String path = pathStart < 0 ? "" : trimmed.substring(pathStart);
    return origin.toLowerCase(Locale.ROOT) + cleanPath(path);
  }

  /** Returns the path part of a normalized URL, empty for the host root. */
  public static String getPath(String normalizedUrl) {
    int schemeEnd = normalizedUrl.indexOf("://");
    int pathStart = normalizedUrl.indexOf('/', schemeEnd < 0 ? 0 : schemeEnd + 3);
    return pathStart < 0 ? "" : normalizedUrl.substring(pathStart);
  }

  /** Returns scheme and host of a normalized URL. */
  public static String getOrigin(String normalizedUrl) {
    String path = getPath(normalizedUrl);
    return normalizedUrl.substring(0, normalizedUrl.length() - path.length());
  }

  /** Returns the path without its last segment, empty when only one segment is left. */
  public static String getParentPath(String path) {
    int lastSlash = path.lastIndexOf('/');
    return lastSlash <= 0 ? "" : path.substring(0, lastSlash);
  }

  /**
   * Constructs the path relative to a base path.
   *
   * @param path the full path
   * @param basePath a prefix of {@code path}
   * @return the relative path without leading slash
   */
  public static String getRelativePath(String path, String basePath) {
    String result = path;
    if (isSameOrDescendant(path, basePath)) {
      result = path.substring(basePath.length());
    }
    // trim leading slash
    return result.startsWith("/") ? result.substring(1) : result;
  }

  /** True when {@code path} equals {@code basePath} or lies below it, ignoring case. */
  public static boolean isSameOrDescendant(String path, String basePath) {
    if (path == null || basePath == null) {
      return false;
    }
    String lowerPath = path.toLowerCase(Locale.ROOT);
    String lowerBase = basePath.toLowerCase(Locale.ROOT);
    if (lowerBase.isEmpty()) {
      return true;
    }
    return lowerPath.equals(lowerBase) || lowerPath.startsWith(lowerBase + "/");
  }

  private static String decode(String value) {
    try {
      // '+' is a literal character in paths.
      return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new ClassificationException(
          ErrorCode.INVALID_URL, "Malformed escape sequence in " + value, e);
    }
  }

  private static int indexOfAny(String value, char... chars) {
    int result = -1;
    for (char c : chars) {
      int index = value.indexOf(c);
      if (index >= 0 && (result < 0 || index < result)) {
        result = index;
      }
    }
    return result;
  }
}
