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

package org.apache.ozone.linkshare.netty;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.google.common.net.UrlEscapers;
import java.util.Locale;
import org.apache.ozone.linkshare.listing.PrefixListing;

/**
 * {@link PageRenderer} producing plain HTML built in code.
 */
public class SimplePageRenderer implements PageRenderer {

  private static final Escaper HTML = HtmlEscapers.htmlEscaper();
  private static final Escaper PATH_SEGMENT =
      UrlEscapers.urlPathSegmentEscaper();

  private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB",
      "EB"};

  @Override
  public String listingPage(PrefixListing listing) {
    StringBuilder sb = header(listing.getTitle());
    sb.append("<nav>");
    boolean first = true;
    for (PrefixListing.Breadcrumb crumb : listing.getBreadcrumbs()) {
      if (!first) {
        sb.append(" / ");
      }
      first = false;
      sb.append("<a href=\"").append(HTML.escape(crumb.getUrl())).append("\">")
          .append(HTML.escape(crumb.getLabel())).append("</a>");
    }
    sb.append("</nav>\n<table>\n");
    for (PrefixListing.Entry entry : listing.getEntries()) {
      sb.append("<tr><td><a href=\"")
          .append(HTML.escape(entryLink(entry)))
          .append("\">").append(HTML.escape(entry.getName()))
          .append("</a></td><td>")
          .append(entry.isPrefix() ? "" : formatSize(entry.getSize()))
          .append("</td></tr>\n");
    }
    sb.append("</table>\n");
    return footer(sb);
  }

  @Override
  public String objectPage(String bucket, String key, long size) {
    StringBuilder sb = header(key);
    sb.append("<h1>").append(HTML.escape(key)).append("</h1>\n")
        .append("<p>").append(HTML.escape(bucket)).append(" &middot; ")
        .append(formatSize(size)).append("</p>\n")
        .append("<p><a href=\"?view\">View</a> ")
        .append("<a href=\"?download\">Download</a></p>\n");
    return footer(sb);
  }

  @Override
  public String notFoundPage(String message) {
    StringBuilder sb = header("Not found");
    sb.append("<h1>").append(HTML.escape(message)).append("</h1>\n");
    return footer(sb);
  }

  /**
   * Size in base-10 units, e.g. {@code 999 B}, {@code 1.5 KB}.
   */
  static String formatSize(long size) {
    if (size < 1000) {
      return size + " B";
    }
    double value = size;
    int unit = 0;
    while (value >= 1000 && unit < UNITS.length - 1) {
      value /= 1000;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
  }

  private static String entryLink(PrefixListing.Entry entry) {
    String name = entry.getName();
    if (entry.isPrefix() && name.endsWith("/")) {
      return PATH_SEGMENT.escape(name.substring(0, name.length() - 1)) + "/";
    }
    return PATH_SEGMENT.escape(name);
  }

  private static StringBuilder header(String title) {
    return new StringBuilder()
        .append("<!DOCTYPE html>\n<html>\n<head><meta charset=\"utf-8\">")
        .append("<title>").append(HTML.escape(title)).append("</title>")
        .append("</head>\n<body>\n");
  }

  private static String footer(StringBuilder sb) {
    return sb.append("</body>\n</html>\n").toString();
  }
}
