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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link RequestPathParser}.
 */
public class TestRequestPathParser {

  @ParameterizedTest
  @CsvSource({
      "/access/bucket, access, bucket, ''",
      "/access/bucket/, access, bucket, ''",
      "/access/bucket/key, access, bucket, key",
      "/access/bucket/dir/, access, bucket, dir/",
      "/access/bucket/dir/sub/file.txt, access, bucket, dir/sub/file.txt",
      "access/bucket/key, access, bucket, key",
      "/access//key, access, '', key"
  })
  public void testParse(String path, String access, String bucket,
      String key) throws Exception {
    ParsedRequestPath parsed = RequestPathParser.parse(path);
    assertFalse(parsed.isRaw());
    assertEquals(access, parsed.getSerializedAccess());
    assertEquals(bucket, parsed.getBucket());
    assertEquals(key, parsed.getKey());
  }

  @Test
  public void testRawPrefixIsDropped() throws Exception {
    ParsedRequestPath parsed =
        RequestPathParser.parse("/raw/access/bucket/dir/file.txt");
    assertTrue(parsed.isRaw());
    assertEquals("access", parsed.getSerializedAccess());
    assertEquals("bucket", parsed.getBucket());
    assertEquals("dir/file.txt", parsed.getKey());
  }

  @Test
  public void testRawNeedsFourSegments() throws Exception {
    // with three segments "raw" is the access itself
    ParsedRequestPath parsed = RequestPathParser.parse("/raw/access/bucket");
    assertFalse(parsed.isRaw());
    assertEquals("raw", parsed.getSerializedAccess());
    assertEquals("access", parsed.getBucket());
    assertEquals("bucket", parsed.getKey());
  }

  @Test
  public void testMissingAccess() {
    assertEquals(ResultCodes.MISSING_CREDENTIAL, parseFailure("/"));
    assertEquals(ResultCodes.MISSING_CREDENTIAL, parseFailure(""));
  }

  @Test
  public void testMissingBucket() {
    assertEquals(ResultCodes.MISSING_BUCKET, parseFailure("/access"));
  }

  private static ResultCodes parseFailure(String path) {
    return assertThrows(LinkShareException.class,
        () -> RequestPathParser.parse(path)).getResult();
  }
}
