/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.ozone.linkshare.routing;

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INTERNAL_FAILURE;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INVALID_HOST;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.METHOD_NOT_ALLOWED;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.MISSING_BUCKET;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.OBJECT_NOT_FOUND;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.auth.AccessParser;
import org.apache.ozone.linkshare.dns.CustomDomainResolver;
import org.apache.ozone.linkshare.dns.TxtRecordCache;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.storage.AccessGrant;
import org.apache.ozone.linkshare.storage.ObjectInfo;
import org.apache.ozone.linkshare.storage.StorageClient;
import org.apache.ozone.linkshare.storage.StorageProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, for every request, which grant, bucket and key it addresses.
 *
 * Requests for the gateway's own host carry their credential in the path
 * ({@code /<access>/<bucket>/<key>}, optionally under {@code /raw}).
 * Requests for any other host are custom domains whose access and storage
 * root come from DNS:
 * <ul>
 *   <li>an existing key is served as is;</li>
 *   <li>a key ending in {@code /} falls back to its {@code index.html};</li>
 *   <li>failing that, the key is listed as a prefix.</li>
 * </ul>
 */
public class LinkShareRouter {

  private static final Logger LOG =
      LoggerFactory.getLogger(LinkShareRouter.class);

  static final String INDEX_PAGE = "index.html";

  private final URI urlBase;
  private final StorageClient storageClient;
  private final AccessParser accessParser;
  private final CustomDomainResolver customDomains;

  public LinkShareRouter(URI urlBase, StorageClient storageClient,
      AccessParser accessParser, CustomDomainResolver customDomains) {
    this.urlBase = urlBase;
    this.storageClient = storageClient;
    this.accessParser = accessParser;
    this.customDomains = customDomains;
  }

  /**
   * Routes one request. The caller owns the returned result and must
   * close it.
   */
  public RoutingResult route(RouteRequest request, Deadline deadline)
      throws LinkShareException {
    String host = request.getHost();
    if (Strings.isNullOrEmpty(host)) {
      throw new LinkShareException("request without host", INVALID_HOST);
    }
    if (HostComparator.compareHosts(host, urlBase.getRawAuthority())) {
      return routeTraditional(request, deadline);
    }
    return routeHostingService(request, deadline);
  }

  private RoutingResult routeTraditional(RouteRequest request,
      Deadline deadline) throws LinkShareException {
    boolean locationOnly;
    switch (request.getMethod()) {
    case "HEAD":
      locationOnly = true;
      break;
    case "GET":
      locationOnly = false;
      break;
    default:
      throw new LinkShareException("method not allowed: "
          + request.getMethod(), METHOD_NOT_ALLOWED);
    }

    String path = request.getPath();
    ParsedRequestPath parsed = RequestPathParser.parse(path);
    if (parsed.getBucket().isEmpty()) {
      throw new LinkShareException("missing bucket", MISSING_BUCKET);
    }
    AccessGrant access = accessParser.parseAccess(
        parsed.getSerializedAccess(), deadline, true);
    RoutingMode mode = parsed.isRaw() ? RoutingMode.RAW
        : RoutingMode.TRADITIONAL;
    String bucket = parsed.getBucket();
    String key = parsed.getKey();

    if (key.isEmpty() || key.endsWith("/")) {
      if (!path.endsWith("/")) {
        // listings link relative to the directory, so it needs the slash
        return RoutingResult.newBuilder(mode,
                RoutingAction.REDIRECT_TRAILING_SLASH)
            .setAccess(access)
            .setBucket(bucket)
            .setKey(key)
            .setLocation(encodePath(path + "/"))
            .build();
      }
      StorageProject project = openProject(access, deadline);
      return RoutingResult.newBuilder(mode, RoutingAction.LIST_PREFIX)
          .setAccess(access)
          .setBucket(bucket)
          .setKey(key)
          .setProject(project)
          .setListing(bucket, bucket,
              "/" + parsed.getSerializedAccess() + "/" + bucket + "/", key)
          .build();
    }

    StorageProject project = openProject(access, deadline);
    try {
      ObjectInfo object = statObject(project, bucket, key, deadline);
      if (locationOnly) {
        closeProject(project);
        return RoutingResult.newBuilder(mode,
                RoutingAction.REDIRECT_LOCATION)
            .setAccess(access)
            .setBucket(bucket)
            .setKey(key)
            .setObject(object)
            .setLocation(makeLocation(urlBase, path))
            .build();
      }
      return RoutingResult.newBuilder(mode, RoutingAction.SERVE_OBJECT)
          .setAccess(access)
          .setBucket(bucket)
          .setKey(key)
          .setObject(object)
          .setProject(project)
          .build();
    } catch (LinkShareException | RuntimeException e) {
      closeProject(project);
      throw e;
    }
  }

  private RoutingResult routeHostingService(RouteRequest request,
      Deadline deadline) throws LinkShareException {
    String method = request.getMethod();
    if (!"GET".equals(method) && !"HEAD".equals(method)) {
      throw new LinkShareException("method not allowed: " + method,
          METHOD_NOT_ALLOWED);
    }

    String host = HostComparator.stripPort(request.getHost());
    if (host.isEmpty()) {
      throw new LinkShareException("empty host in " + request.getHost(),
          INVALID_HOST);
    }
    TxtRecordCache.Entry entry =
        customDomains.fetchAccessForHost(host, deadline);
    ObjectKeyMapper.BucketAndKey target =
        ObjectKeyMapper.map(entry.getRoot(), request.getPath());
    String bucket = target.getBucket();
    String key = target.getKey();

    StorageProject project = openProject(entry.getAccess(), deadline);
    try {
      if (!key.isEmpty()) {
        try {
          ObjectInfo object = statObject(project, bucket, key, deadline);
          return serveCustomDomain(entry, bucket, key, object, project);
        } catch (LinkShareException e) {
          if (!key.endsWith("/") || e.getResult() != OBJECT_NOT_FOUND) {
            throw e;
          }
        }
      }

      // key is now either empty or ends in a slash
      String indexKey = key + INDEX_PAGE;
      try {
        ObjectInfo object = statObject(project, bucket, indexKey, deadline);
        return serveCustomDomain(entry, bucket, indexKey, object, project);
      } catch (LinkShareException e) {
        if (e.getResult() != OBJECT_NOT_FOUND) {
          throw e;
        }
      }

      String path = request.getPath();
      return RoutingResult.newBuilder(RoutingMode.CUSTOM_DOMAIN,
              RoutingAction.LIST_PREFIX)
          .setAccess(entry.getAccess())
          .setBucket(bucket)
          .setKey(key)
          .setProject(project)
          .setListing(host, host, "/",
              path.startsWith("/") ? path.substring(1) : path)
          .build();
    } catch (LinkShareException | RuntimeException e) {
      closeProject(project);
      throw e;
    }
  }

  private static RoutingResult serveCustomDomain(TxtRecordCache.Entry entry,
      String bucket, String key, ObjectInfo object, StorageProject project) {
    return RoutingResult.newBuilder(RoutingMode.CUSTOM_DOMAIN,
            RoutingAction.SERVE_OBJECT)
        .setAccess(entry.getAccess())
        .setBucket(bucket)
        .setKey(key)
        .setObject(object)
        .setProject(project)
        .build();
  }

  private StorageProject openProject(AccessGrant access, Deadline deadline)
      throws LinkShareException {
    deadline.check("open project");
    try {
      return storageClient.openProject(access, deadline);
    } catch (IOException e) {
      throw StorageErrors.translate("open project", e);
    }
  }

  private static ObjectInfo statObject(StorageProject project, String bucket,
      String key, Deadline deadline) throws LinkShareException {
    deadline.check("stat object");
    try {
      return project.statObject(bucket, key, deadline);
    } catch (IOException e) {
      throw StorageErrors.translate("stat object", e);
    }
  }

  private static void closeProject(StorageProject project) {
    try {
      project.close();
    } catch (IOException e) {
      LOG.warn("unable to close project", e);
    }
  }

  /**
   * Absolute URL of {@code requestPath} under the gateway's base URL, with
   * the joined path cleaned of empty, {@code .} and {@code ..} segments.
   */
  @VisibleForTesting
  static String makeLocation(URI base, String requestPath)
      throws LinkShareException {
    String joined = cleanPath(Strings.nullToEmpty(base.getPath()) + "/"
        + requestPath);
    try {
      return new URI(base.getScheme(), base.getAuthority(), joined, null,
          null).toASCIIString();
    } catch (URISyntaxException e) {
      throw new LinkShareException("cannot build location for "
          + requestPath, e, INTERNAL_FAILURE);
    }
  }

  @VisibleForTesting
  static String cleanPath(String path) {
    Deque<String> kept = new ArrayDeque<>();
    for (String segment : path.split("/")) {
      if (segment.isEmpty() || ".".equals(segment)) {
        continue;
      }
      if ("..".equals(segment)) {
        kept.pollLast();
      } else {
        kept.addLast(segment);
      }
    }
    return "/" + String.join("/", kept);
  }

  private static String encodePath(String path) throws LinkShareException {
    try {
      return new URI(null, null, path, null).toASCIIString();
    } catch (URISyntaxException e) {
      throw new LinkShareException("cannot encode " + path, e,
          INTERNAL_FAILURE);
    }
  }
}
