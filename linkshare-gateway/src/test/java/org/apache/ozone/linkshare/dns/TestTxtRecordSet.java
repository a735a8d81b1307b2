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
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TxtRecordSet}.
 */
public class TestTxtRecordSet {

  @Test
  public void testColonAndEqualsSeparators() {
    TxtRecordSet set = TxtRecordSet.parse(Arrays.asList(
        "storj-access:abc", "storj-root=bucket/prefix"));
    assertEquals("abc", set.lookup("storj-access"));
    assertEquals("bucket/prefix", set.lookup("storj-root"));
  }

  @Test
  public void testFirstSeparatorWins() {
    TxtRecordSet set = TxtRecordSet.parse(Arrays.asList(
        "a:b=c", "d=e:f"));
    assertEquals("b=c", set.lookup("a"));
    assertEquals("e:f", set.lookup("d"));
  }

  @Test
  public void testNamesAreCaseInsensitiveAndTrimmed() {
    TxtRecordSet set = TxtRecordSet.parse(Arrays.asList(
        "  Storj-Root : bucket  "));
    assertEquals("bucket", set.lookup("storj-root"));
    assertEquals("bucket", set.lookup("STORJ-ROOT"));
  }

  @Test
  public void testSegmentsAreJoinedInNumericOrder() {
    TxtRecordSet set = TxtRecordSet.parse(Arrays.asList(
        "storj-access-10:k", "storj-access-2:b", "storj-access-1:a",
        "storj-access-3:c"));
    assertEquals("abck", set.lookup("storj-access"));
  }

  @Test
  public void testWholeValueBeatsSegments() {
    TxtRecordSet set = TxtRecordSet.parse(Arrays.asList(
        "storj-access-1:segment", "storj-access:whole"));
    assertEquals("whole", set.lookup("storj-access"));
  }

  @Test
  public void testUnknownAndMalformed() {
    TxtRecordSet set = TxtRecordSet.parse(Arrays.asList(
        "v=spf1 -all", "no separator here"));
    assertNull(set.lookup("storj-access"));
    assertNull(set.lookup("no separator here"));
    assertEquals("spf1 -all", set.lookup("v"));
  }
}
