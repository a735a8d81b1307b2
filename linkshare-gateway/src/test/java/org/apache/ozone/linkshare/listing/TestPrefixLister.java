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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.TestClock;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.routing.RoutingAction;
import org.apache.ozone.linkshare.routing.RoutingMode;
import org.apache.ozone.linkshare.routing.RoutingResult;
import org.apache.ozone.linkshare.storage.StorageClientStub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PrefixLister}.
 */
public class TestPrefixLister {

  private TestClock clock;
  private StorageClientStub storage;
  private final PrefixLister lister = new PrefixLister();

  @BeforeEach
  public void setUp() {
    clock = TestClock.newInstance();
    storage = new StorageClientStub()
        .putObject("bucket", "a.txt", "a")
        .putObject("bucket", "docs/", "")
        .putObject("bucket", "docs/guide.txt", "guide")
        .putObject("bucket", "docs/img/logo.png", "png")
        .putObject("bucket", "docs/img/icon.png", "png")
        .putObject("bucket", "docsx/other.txt", "x");
  }

  @Test
  public void testListNestedPrefix() throws Exception {
    PrefixListing listing = lister.list(
        listingResult("docs/", "/access/bucket/", "docs/"), deadline());

    List<String> names = listing.getEntries().stream()
        .map(PrefixListing.Entry::getName).collect(Collectors.toList());
    assertThat(names).containsExactly("guide.txt", "img/");
    assertThat(listing.getEntries().get(0).getSize()).isEqualTo(5);
    assertThat(listing.getEntries().get(1).isPrefix()).isTrue();
    assertEquals("bucket", listing.getTitle());
  }

  @Test
  public void testListBucketRoot() throws Exception {
    PrefixListing listing = lister.list(
        listingResult("", "/access/bucket/", ""), deadline());
    assertThat(listing.getEntries()).extracting(PrefixListing.Entry::getName)
        .containsExactly("a.txt", "docs/", "docsx/");
    assertThat(listing.getBreadcrumbs()).hasSize(1);
  }

  @Test
  public void testBreadcrumbs() {
    List<PrefixListing.Breadcrumb> crumbs =
        PrefixLister.breadcrumbs("bucket", "/access/bucket/", "docs/img/");
    assertThat(crumbs).extracting(PrefixListing.Breadcrumb::getLabel)
        .containsExactly("bucket", "docs", "img");
    assertThat(crumbs).extracting(PrefixListing.Breadcrumb::getUrl)
        .containsExactly("/access/bucket/", "/access/bucket/docs/",
            "/access/bucket/docs/img/");
  }

  @Test
  public void testBreadcrumbUrlsEscapeSegments() {
    List<PrefixListing.Breadcrumb> crumbs =
        PrefixLister.breadcrumbs("host", "/", "q?x/h#y/a b/");
    assertThat(crumbs).extracting(PrefixListing.Breadcrumb::getLabel)
        .containsExactly("host", "q?x", "h#y", "a b");
    assertThat(crumbs).extracting(PrefixListing.Breadcrumb::getUrl)
        .containsExactly("/", "/q%3Fx/", "/q%3Fx/h%23y/",
            "/q%3Fx/h%23y/a%20b/");
  }

  @Test
  public void testMissingBucket() throws IOException {
    RoutingResult result = RoutingResult.newBuilder(RoutingMode.CUSTOM_DOMAIN,
            RoutingAction.LIST_PREFIX)
        .setBucket("nobucket")
        .setKey("")
        .setProject(storage.openProject(null, deadline()))
        .setListing("host", "host", "/", "")
        .build();
    assertEquals(LinkShareException.ResultCodes.BUCKET_NOT_FOUND,
        assertThrows(LinkShareException.class,
            () -> lister.list(result, deadline())).getResult());
  }

  private RoutingResult listingResult(String prefix, String rootUrl,
      String visible) {
    return RoutingResult.newBuilder(RoutingMode.TRADITIONAL,
            RoutingAction.LIST_PREFIX)
        .setBucket("bucket")
        .setKey(prefix)
        .setProject(storage.openProject(null, deadline()))
        .setListing("bucket", "bucket", rootUrl, visible)
        .build();
  }

  private Deadline deadline() {
    return Deadline.after(clock, Duration.ofSeconds(30));
  }
}
