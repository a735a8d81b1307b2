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

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata returned by a stat of a single object.
 */
public final class ObjectInfo {

  private final String key;
  private final long contentLength;
  private final Instant created;
  private final String contentType;

  public ObjectInfo(String key, long contentLength, Instant created,
      String contentType) {
    this.key = Objects.requireNonNull(key, "key == null");
    this.contentLength = contentLength;
    this.created = created;
    this.contentType = contentType;
  }

  public String getKey() {
    return key;
  }

  public long getContentLength() {
    return contentLength;
  }

  public Instant getCreated() {
    return created;
  }

  /**
   * @return the content type recorded with the object, or null
   */
  public String getContentType() {
    return contentType;
  }

  @Override
  public String toString() {
    return "ObjectInfo{key='" + key + "', contentLength=" + contentLength
        + ", created=" + created + '}';
  }
}
