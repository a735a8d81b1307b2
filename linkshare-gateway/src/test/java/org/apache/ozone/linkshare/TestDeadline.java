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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Deadline}.
 */
public class TestDeadline {

  @Test
  public void testExpiry() {
    TestClock clock = TestClock.newInstance();
    Deadline deadline = Deadline.after(clock, Duration.ofSeconds(2));

    assertFalse(deadline.isExpired());
    assertEquals(Duration.ofSeconds(2), deadline.remaining());
    assertDoesNotThrow(() -> deadline.check("work"));

    clock.fastForward(Duration.ofMillis(1999));
    assertEquals(Duration.ofMillis(1), deadline.remaining());

    clock.fastForward(1);
    assertTrue(deadline.isExpired());
    assertEquals(Duration.ZERO, deadline.remaining());
    LinkShareException e = assertThrows(LinkShareException.class,
        () -> deadline.check("work"));
    assertEquals(LinkShareException.ResultCodes.TIMEOUT, e.getResult());
    assertEquals(504, e.getResult().getHttpCode());

    clock.fastForward(Duration.ofMinutes(1));
    assertEquals(Duration.ZERO, deadline.remaining());
  }

  @Test
  public void testNegativeTimeoutIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Deadline.after(TestClock.newInstance(), Duration.ofSeconds(-1)));
  }
}
