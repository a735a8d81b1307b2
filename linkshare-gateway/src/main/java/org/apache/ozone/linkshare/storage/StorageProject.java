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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import org.apache.ozone.linkshare.Deadline;

/**
 * Handle to the storage network opened with one access grant.
 *
 * A project must be closed by whoever ends up owning it.
 */
public interface StorageProject extends Closeable {

  /**
   * @throws StorageException with {@code OBJECT_NOT_FOUND} or
   *     {@code BUCKET_NOT_FOUND} when nothing exists at the location
   */
  ObjectInfo statObject(String bucket, String key, Deadline deadline)
      throws IOException;

  /**
   * Lists the direct children of {@code prefix}. The iterator is lazy;
   * failures while iterating surface as
   * {@link java.io.UncheckedIOException}.
   */
  Iterator<ObjectListItem> listObjects(String bucket, String prefix,
      Deadline deadline) throws IOException;

  InputStream download(String bucket, String key, Deadline deadline)
      throws IOException;
}
