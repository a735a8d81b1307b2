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

import java.util.Objects;

/**
 * Maps the storage root of a custom domain and a URL path to the bucket
 * and object key to serve.
 *
 * For {@code http://mydomain.test/prefix2/index.html} with the root
 * {@code bucket1/prefix1} the result is bucket {@code bucket1} and key
 * {@code prefix1/prefix2/index.html}. Only the first slash of the URL path
 * is dropped, and a non-empty root prefix always ends up with a trailing
 * slash so a domain cannot reach keys that merely share its prefix.
 * Doubled slashes anywhere else are kept as they are.
 */
public final class ObjectKeyMapper {

  private ObjectKeyMapper() {
  }

  public static BucketAndKey map(String root, String urlPath) {
    int slash = root.indexOf('/');
    String bucket = slash < 0 ? root : root.substring(0, slash);
    String prefix = slash < 0 ? "" : root.substring(slash + 1);
    if (!prefix.isEmpty() && !prefix.endsWith("/")) {
      prefix += "/";
    }
    String suffix = urlPath.startsWith("/") ? urlPath.substring(1) : urlPath;
    return new BucketAndKey(bucket, prefix + suffix);
  }

  /**
   * Bucket and object key pair.
   */
  public static final class BucketAndKey {
    private final String bucket;
    private final String key;

    public BucketAndKey(String bucket, String key) {
      this.bucket = bucket;
      this.key = key;
    }

    public String getBucket() {
      return bucket;
    }

    public String getKey() {
      return key;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      BucketAndKey that = (BucketAndKey) o;
      return bucket.equals(that.bucket) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
      return Objects.hash(bucket, key);
    }

    @Override
    public String toString() {
      return bucket + "/" + key;
    }
  }
}
