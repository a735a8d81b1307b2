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

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.apache.ozone.linkshare.storage.AccessGrant;

/**
 * Time-bounded cache of the access and storage root resolved for each
 * custom hostname.
 *
 * An entry fetched at {@code T} is served until {@code T + ttl}; from then
 * on the host is looked up again. Entries are immutable and replaced as a
 * whole, so a reader sees either the old or the new entry. The cache is
 * also bounded in size.
 */
public class TxtRecordCache {

  private final Cache<String, Entry> cache;
  private final Duration ttl;
  private final Clock clock;

  public TxtRecordCache(Duration ttl, long maxEntries, Clock clock) {
    Preconditions.checkArgument(!ttl.isNegative(), "negative ttl: %s", ttl);
    this.ttl = ttl;
    this.clock = clock;
    this.cache = CacheBuilder.newBuilder()
        .maximumSize(maxEntries)
        .expireAfterWrite(ttl.toNanos(), TimeUnit.NANOSECONDS)
        .ticker(new ClockTicker(clock))
        .build();
  }

  /**
   * @return the live entry for {@code host}, or null if there is none or
   *     it has expired
   */
  public Entry getIfLive(String host) {
    Entry entry = cache.getIfPresent(host);
    if (entry == null || isExpired(entry)) {
      return null;
    }
    return entry;
  }

  /**
   * Stores a freshly resolved entry, replacing any previous one.
   */
  public Entry put(String host, AccessGrant access, String root) {
    Entry entry = new Entry(access, root, clock.instant());
    cache.put(host, entry);
    return entry;
  }

  public long size() {
    return cache.size();
  }

  public Duration getTtl() {
    return ttl;
  }

  private boolean isExpired(Entry entry) {
    return !clock.instant().isBefore(entry.getFetchedAt().plus(ttl));
  }

  /**
   * Resolved access and storage root of one host.
   */
  public static final class Entry {
    private final AccessGrant access;
    private final String root;
    private final Instant fetchedAt;

    Entry(AccessGrant access, String root, Instant fetchedAt) {
      this.access = access;
      this.root = root;
      this.fetchedAt = fetchedAt;
    }

    public AccessGrant getAccess() {
      return access;
    }

    /**
     * {@code bucket} or {@code bucket/prefix}.
     */
    public String getRoot() {
      return root;
    }

    public Instant getFetchedAt() {
      return fetchedAt;
    }
  }

  private static final class ClockTicker extends Ticker {
    private final Clock clock;

    ClockTicker(Clock clock) {
      this.clock = clock;
    }

    @Override
    public long read() {
      return TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
  }
}
