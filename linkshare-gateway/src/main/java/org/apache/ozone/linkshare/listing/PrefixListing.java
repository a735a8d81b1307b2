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

import java.util.Collections;
import java.util.List;

/**
 * One rendered directory view: a title, the breadcrumb trail leading to the
 * listed prefix, and the direct children of that prefix.
 */
public final class PrefixListing {

  private final String title;
  private final List<Breadcrumb> breadcrumbs;
  private final List<Entry> entries;

  public PrefixListing(String title, List<Breadcrumb> breadcrumbs,
      List<Entry> entries) {
    this.title = title;
    this.breadcrumbs = Collections.unmodifiableList(breadcrumbs);
    this.entries = Collections.unmodifiableList(entries);
  }

  public String getTitle() {
    return title;
  }

  public List<Breadcrumb> getBreadcrumbs() {
    return breadcrumbs;
  }

  public List<Entry> getEntries() {
    return entries;
  }

  /**
   * Link to one level of the listed prefix.
   */
  public static final class Breadcrumb {
    private final String label;
    private final String url;

    public Breadcrumb(String label, String url) {
      this.label = label;
      this.url = url;
    }

    public String getLabel() {
      return label;
    }

    public String getUrl() {
      return url;
    }

    @Override
    public String toString() {
      return label + " -> " + url;
    }
  }

  /**
   * Child of the listed prefix. Names are relative to the prefix; nested
   * prefixes keep their trailing slash.
   */
  public static final class Entry {
    private final String name;
    private final boolean prefix;
    private final long size;

    public Entry(String name, boolean prefix, long size) {
      this.name = name;
      this.prefix = prefix;
      this.size = size;
    }

    public String getName() {
      return name;
    }

    public boolean isPrefix() {
      return prefix;
    }

    public long getSize() {
      return size;
    }

    @Override
    public String toString() {
      return prefix ? name : name + " (" + size + ")";
    }
  }
}
