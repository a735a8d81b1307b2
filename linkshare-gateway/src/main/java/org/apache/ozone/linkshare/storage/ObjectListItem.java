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

package org.apache.ozone.linkshare.storage;

/**
 * One entry of a prefix listing: either an object or a collapsed prefix.
 */
public final class ObjectListItem {

  private final String key;
  private final boolean prefix;
  private final long contentLength;

  public ObjectListItem(String key, boolean prefix, long contentLength) {
    this.key = key;
    this.prefix = prefix;
    this.contentLength = contentLength;
  }

  public static ObjectListItem object(String key, long contentLength) {
    return new ObjectListItem(key, false, contentLength);
  }

  public static ObjectListItem prefix(String key) {
    return new ObjectListItem(key, true, 0);
  }

  /**
   * Full key in the bucket, including the listed prefix.
   */
  public String getKey() {
    return key;
  }

  public boolean isPrefix() {
    return prefix;
  }

  public long getContentLength() {
    return contentLength;
  }
}
