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

package org.apache.ozone.linkshare;

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.TIMEOUT;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.apache.ozone.linkshare.exception.LinkShareException;

/**
 * Point in time after which the work done for a request is abandoned.
 *
 * One instance is created per inbound request and threaded through every
 * step that leaves the process (DNS, the auth service, storage).
 */
public final class Deadline {

  private final Clock clock;
  private final Instant expiresAt;

  private Deadline(Clock clock, Instant expiresAt) {
    this.clock = clock;
    this.expiresAt = expiresAt;
  }

  public static Deadline after(Clock clock, Duration timeout) {
    Preconditions.checkNotNull(clock, "clock == null");
    Preconditions.checkArgument(!timeout.isNegative(),
        "timeout must not be negative: %s", timeout);
    return new Deadline(clock, clock.instant().plus(timeout));
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(expiresAt);
  }

  /**
   * Time left before expiry, never negative.
   */
  public Duration remaining() {
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  /**
   * Fails with {@code TIMEOUT} once the deadline has passed.
   * @param action what was about to happen, for the log
   */
  public void check(String action) throws LinkShareException {
    if (isExpired()) {
      throw new LinkShareException("deadline exceeded before " + action,
          TIMEOUT);
    }
  }

  @Override
  public String toString() {
    return "Deadline{expiresAt=" + expiresAt + '}';
  }
}
