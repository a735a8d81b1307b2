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

package org.apache.ozone.linkshare.dns;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Duration;
import org.apache.ozone.linkshare.TestClock;
import org.apache.ozone.linkshare.storage.AccessGrant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TxtRecordCache}.
 */
public class TestTxtRecordCache {

  private static final AccessGrant GRANT = () -> "grant";

  private TestClock clock;
  private TxtRecordCache cache;

  @BeforeEach
  public void setUp() {
    clock = TestClock.newInstance();
    cache = new TxtRecordCache(Duration.ofMinutes(10), 2, clock);
  }

  @Test
  public void testEntryLivesUntilTtl() {
    TxtRecordCache.Entry entry = cache.put("a.example", GRANT, "bucket");
    assertEquals(clock.instant(), entry.getFetchedAt());

    clock.fastForward(Duration.ofMinutes(10).minusMillis(1));
    assertSame(entry, cache.getIfLive("a.example"));

    clock.fastForward(1);
    assertNull(cache.getIfLive("a.example"));
  }

  @Test
  public void testPutReplacesEntry() {
    cache.put("a.example", GRANT, "bucket");
    clock.fastForward(Duration.ofMinutes(9));
    TxtRecordCache.Entry fresh = cache.put("a.example", GRANT, "other");

    clock.fastForward(Duration.ofMinutes(5));
    TxtRecordCache.Entry live = cache.getIfLive("a.example");
    assertNotNull(live);
    assertSame(fresh, live);
    assertEquals("other", live.getRoot());
  }

  @Test
  public void testSizeIsBounded() {
    cache.put("a.example", GRANT, "a");
    cache.put("b.example", GRANT, "b");
    cache.put("c.example", GRANT, "c");
    assertEquals(2, cache.size());
  }

  @Test
  public void testMissingHost() {
    assertNull(cache.getIfLive("unknown.example"));
  }
}
