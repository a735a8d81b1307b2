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

/**
 * Segments of a traditional link sharing path,
 * {@code [/raw]/{access}/{bucket}[/{key}]}.
 */
public final class ParsedRequestPath {

  private final boolean raw;
  private final String serializedAccess;
  private final String bucket;
  private final String key;

  ParsedRequestPath(boolean raw, String serializedAccess, String bucket,
      String key) {
    this.raw = raw;
    this.serializedAccess = serializedAccess;
    this.bucket = bucket;
    this.key = key;
  }

  public boolean isRaw() {
    return raw;
  }

  /**
   * The credential token exactly as it appeared in the path.
   */
  public String getSerializedAccess() {
    return serializedAccess;
  }

  public String getBucket() {
    return bucket;
  }

  /**
   * @return the object key, empty for the bucket root
   */
  public String getKey() {
    return key;
  }

  @Override
  public String toString() {
    return "ParsedRequestPath{raw=" + raw + ", bucket='" + bucket
        + "', key='" + key + "'}";
  }
}
