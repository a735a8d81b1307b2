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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.ozone.linkshare.Deadline;

/**
 * In-memory {@link StorageClient}. Grants are plain strings registered
 * with {@link #addGrant(String)}; every grant sees every bucket.
 */
public class StorageClientStub implements StorageClient {

  private final Set<String> grants = new HashSet<>();
  private final Map<String, TreeMap<String, StoredObject>> buckets =
      new HashMap<>();
  private final AtomicInteger openProjects = new AtomicInteger();
  private final AtomicInteger closedProjects = new AtomicInteger();

  public StorageClientStub addGrant(String serialized) {
    grants.add(serialized);
    return this;
  }

  public StorageClientStub createBucket(String bucket) {
    buckets.computeIfAbsent(bucket, b -> new TreeMap<>());
    return this;
  }

  public StorageClientStub putObject(String bucket, String key,
      String content) {
    return putObject(bucket, key, content.getBytes(StandardCharsets.UTF_8),
        null);
  }

  public StorageClientStub putObject(String bucket, String key, byte[] data,
      String contentType) {
    createBucket(bucket);
    buckets.get(bucket).put(key, new StoredObject(data, contentType,
        Instant.parse("2024-01-01T00:00:00Z")));
    return this;
  }

  public int getOpenProjects() {
    return openProjects.get();
  }

  public int getClosedProjects() {
    return closedProjects.get();
  }

  @Override
  public AccessGrant parseAccess(String serialized) throws StorageException {
    if (!grants.contains(serialized)) {
      throw new StorageException("unknown grant",
          StorageException.ResultCodes.INVALID_ACCESS);
    }
    return new GrantStub(serialized);
  }

  @Override
  public StorageProject openProject(AccessGrant access, Deadline deadline) {
    openProjects.incrementAndGet();
    return new ProjectStub();
  }

  /**
   * Grant carrying its serialized form.
   */
  public static final class GrantStub implements AccessGrant {
    private final String serialized;

    GrantStub(String serialized) {
      this.serialized = serialized;
    }

    @Override
    public String serialize() {
      return serialized;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof GrantStub
          && serialized.equals(((GrantStub) o).serialized);
    }

    @Override
    public int hashCode() {
      return serialized.hashCode();
    }
  }

  private static final class StoredObject {
    private final byte[] data;
    private final String contentType;
    private final Instant created;

    StoredObject(byte[] data, String contentType, Instant created) {
      this.data = data;
      this.contentType = contentType;
      this.created = created;
    }
  }

  private final class ProjectStub implements StorageProject {

    private boolean closed;

    @Override
    public ObjectInfo statObject(String bucket, String key,
        Deadline deadline) throws IOException {
      StoredObject object = get(bucket, key);
      return new ObjectInfo(key, object.data.length, object.created,
          object.contentType);
    }

    @Override
    public Iterator<ObjectListItem> listObjects(String bucket, String prefix,
        Deadline deadline) throws IOException {
      TreeMap<String, StoredObject> objects = bucket(bucket);
      Set<String> prefixes = new LinkedHashSet<>();
      List<ObjectListItem> items = new ArrayList<>();
      for (Map.Entry<String, StoredObject> e
          : objects.tailMap(prefix, true).entrySet()) {
        String key = e.getKey();
        if (!key.startsWith(prefix)) {
          break;
        }
        int slash = key.indexOf('/', prefix.length());
        if (slash >= 0) {
          String child = key.substring(0, slash + 1);
          if (prefixes.add(child)) {
            items.add(ObjectListItem.prefix(child));
          }
        } else {
          items.add(ObjectListItem.object(key, e.getValue().data.length));
        }
      }
      return items.iterator();
    }

    @Override
    public InputStream download(String bucket, String key, Deadline deadline)
        throws IOException {
      return new ByteArrayInputStream(get(bucket, key).data);
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        closedProjects.incrementAndGet();
      }
    }

    private TreeMap<String, StoredObject> bucket(String bucket)
        throws StorageException {
      TreeMap<String, StoredObject> objects = buckets.get(bucket);
      if (objects == null) {
        throw new StorageException("bucket not found: " + bucket,
            StorageException.ResultCodes.BUCKET_NOT_FOUND);
      }
      return objects;
    }

    private StoredObject get(String bucket, String key)
        throws StorageException {
      StoredObject object = bucket(bucket).get(key);
      if (object == null) {
        throw new StorageException("object not found: " + key,
            StorageException.ResultCodes.OBJECT_NOT_FOUND);
      }
      return object;
    }
  }
}
