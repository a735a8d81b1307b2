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

package org.apache.ozone.linkshare.listing;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.routing.RoutingAction;
import org.apache.ozone.linkshare.routing.RoutingResult;
import org.apache.ozone.linkshare.routing.StorageErrors;
import org.apache.ozone.linkshare.storage.ObjectListItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the direct children of a routed prefix.
 */
public class PrefixLister {

  private static final Logger LOG =
      LoggerFactory.getLogger(PrefixLister.class);
  private static final Escaper PATH_SEGMENT =
      UrlEscapers.urlPathSegmentEscaper();

  public PrefixListing list(RoutingResult result, Deadline deadline)
      throws LinkShareException {
    if (result.getAction() != RoutingAction.LIST_PREFIX) {
      throw new IllegalArgumentException("not a listing: " + result);
    }
    String bucket = result.getBucket();
    String prefix = result.getKey();
    deadline.check("list objects");

    List<PrefixListing.Entry> entries = new ArrayList<>();
    try {
      Iterator<ObjectListItem> it =
          result.getProject().listObjects(bucket, prefix, deadline);
      while (it.hasNext()) {
        ObjectListItem item = it.next();
        String name = item.getKey().substring(prefix.length());
        if (name.isEmpty()) {
          // the prefix marker object itself
          continue;
        }
        entries.add(new PrefixListing.Entry(name, item.isPrefix(),
            item.getContentLength()));
      }
    } catch (UncheckedIOException e) {
      throw StorageErrors.translate("list objects", e.getCause());
    } catch (IOException e) {
      throw StorageErrors.translate("list objects", e);
    }
    LOG.debug("Listed {} entries under {}/{}", entries.size(), bucket, prefix);

    return new PrefixListing(result.getListingTitle(),
        breadcrumbs(result.getRootLabel(), result.getRootUrl(),
            result.getVisiblePrefix()),
        entries);
  }

  /**
   * First crumb links to the root, one more per non-empty segment of the
   * visible prefix. Segments are percent-escaped in the URL only.
   */
  @VisibleForTesting
  static List<PrefixListing.Breadcrumb> breadcrumbs(String rootLabel,
      String rootUrl, String visiblePrefix) {
    List<PrefixListing.Breadcrumb> crumbs = new ArrayList<>();
    crumbs.add(new PrefixListing.Breadcrumb(rootLabel, rootUrl));
    String url = rootUrl;
    for (String component : visiblePrefix.split("/")) {
      if (component.isEmpty()) {
        continue;
      }
      url += PATH_SEGMENT.escape(component) + "/";
      crumbs.add(new PrefixListing.Breadcrumb(component, url));
    }
    return crumbs;
  }
}
