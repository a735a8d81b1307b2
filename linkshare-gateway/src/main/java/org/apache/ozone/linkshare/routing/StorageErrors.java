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

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.BUCKET_NOT_FOUND;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INTERNAL_FAILURE;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INVALID_CREDENTIAL;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.OBJECT_NOT_FOUND;

import java.io.IOException;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.storage.StorageException;

/**
 * Maps storage SDK failures onto routing result codes.
 */
public final class StorageErrors {

  private StorageErrors() {
  }

  public static LinkShareException translate(String action, IOException e) {
    if (e instanceof LinkShareException) {
      return (LinkShareException) e;
    }
    String message = action + ": " + e.getMessage();
    if (e instanceof StorageException) {
      switch (((StorageException) e).getResult()) {
      case OBJECT_NOT_FOUND:
        return new LinkShareException(message, e, OBJECT_NOT_FOUND);
      case BUCKET_NOT_FOUND:
        return new LinkShareException(message, e, BUCKET_NOT_FOUND);
      case INVALID_ACCESS:
        return new LinkShareException(message, e, INVALID_CREDENTIAL);
      default:
        break;
      }
    }
    return new LinkShareException(message, e, INTERNAL_FAILURE);
  }
}
