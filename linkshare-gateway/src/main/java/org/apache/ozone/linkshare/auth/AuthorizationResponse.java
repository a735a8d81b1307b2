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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer of the authorization service for one access key id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AuthorizationResponse {

  private final String accessGrant;
  private final String secretKey;
  private final boolean isPublic;

  @JsonCreator
  public AuthorizationResponse(
      @JsonProperty("access_grant") String accessGrant,
      @JsonProperty("secret_key") String secretKey,
      @JsonProperty("public") boolean isPublic) {
    this.accessGrant = accessGrant;
    this.secretKey = secretKey;
    this.isPublic = isPublic;
  }

  public String getAccessGrant() {
    return accessGrant;
  }

  public String getSecretKey() {
    return secretKey;
  }

  /**
   * Only grants registered as public may be served to anonymous clients.
   */
  public boolean isPublic() {
    return isPublic;
  }

  @Override
  public String toString() {
    // the grant and secret are credentials
    return "AuthorizationResponse{public=" + isPublic + '}';
  }
}
