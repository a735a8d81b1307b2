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

package org.apache.ozone.linkshare.auth;

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INTERNAL_FAILURE;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INVALID_CREDENTIAL;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.NON_PUBLIC_CREDENTIAL;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.UNSUPPORTED_CREDENTIAL_VERSION;

import java.io.IOException;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.codec.Base58Check;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.storage.AccessGrant;
import org.apache.ozone.linkshare.storage.StorageClient;
import org.apache.ozone.linkshare.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a credential token into an {@link AccessGrant}.
 *
 * A token is either a serialized access grant (version byte 0) or an
 * access key id (version byte 1) which is first exchanged for a grant at
 * the authorization service.
 */
public class AccessParser {

  private static final Logger LOG =
      LoggerFactory.getLogger(AccessParser.class);

  public static final int VERSION_ACCESS_GRANT = 0;
  public static final int VERSION_ACCESS_KEY_ID = 1;

  private final StorageClient storageClient;
  private final AuthorizationResolver resolver;

  public AccessParser(StorageClient storageClient,
      AuthorizationResolver resolver) {
    this.storageClient = storageClient;
    this.resolver = resolver;
  }

  /**
   * @param token serialized access grant or access key id
   * @param requirePublic reject access key ids registered as private
   */
  public AccessGrant parseAccess(String token, Deadline deadline,
      boolean requirePublic) throws LinkShareException {
    int version;
    try {
      version = Base58Check.decode(token).getVersion();
    } catch (IllegalArgumentException e) {
      throw new LinkShareException("invalid access: " + e.getMessage(), e,
          INVALID_CREDENTIAL);
    }

    String serializedAccess;
    if (version == VERSION_ACCESS_KEY_ID) {
      AuthorizationResponse response = resolve(token, deadline);
      if (requirePublic && !response.isPublic()) {
        throw new LinkShareException("non-public access key id",
            NON_PUBLIC_CREDENTIAL);
      }
      serializedAccess = response.getAccessGrant();
    } else if (version == VERSION_ACCESS_GRANT) {
      // 0 is also the unset version, anything may hide behind it
      serializedAccess = token;
    } else {
      throw new LinkShareException("invalid access version " + version,
          UNSUPPORTED_CREDENTIAL_VERSION);
    }

    try {
      return storageClient.parseAccess(serializedAccess);
    } catch (StorageException e) {
      throw new LinkShareException("invalid access: " + e.getMessage(), e,
          INVALID_CREDENTIAL);
    }
  }

  private AuthorizationResponse resolve(String accessKeyId,
      Deadline deadline) throws LinkShareException {
    try {
      return resolver.resolve(accessKeyId, deadline);
    } catch (LinkShareException e) {
      throw e;
    } catch (IOException e) {
      LOG.debug("Authorization service failed to resolve access key id", e);
      throw new LinkShareException("unable to resolve access key id: "
          + e.getMessage(), e, INTERNAL_FAILURE);
    }
  }
}
