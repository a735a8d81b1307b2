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
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.TIMEOUT;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuthorizationResolver} backed by the authorization service's
 * HTTP API.
 *
 * <pre>
 *   GET {baseUrl}/v1/access/{accessKeyId}
 *   Authorization: Bearer {token}
 * </pre>
 */
public class AuthServiceClient implements AuthorizationResolver {

  private static final Logger LOG =
      LoggerFactory.getLogger(AuthServiceClient.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final URI baseUri;
  private final String token;
  private final HttpClient httpClient;

  public AuthServiceClient(String baseUrl, String token) {
    this(baseUrl, token, HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  @VisibleForTesting
  AuthServiceClient(String baseUrl, String token, HttpClient httpClient) {
    this.baseUri = Strings.isNullOrEmpty(baseUrl) ? null : URI.create(
        baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    this.token = Strings.nullToEmpty(token);
    this.httpClient = httpClient;
  }

  @Override
  public AuthorizationResponse resolve(String accessKeyId, Deadline deadline)
      throws IOException {
    if (baseUri == null) {
      throw new LinkShareException("access key id given but no "
          + "authorization service is configured", INTERNAL_FAILURE);
    }
    deadline.check("resolving access key id");
    Duration timeout = deadline.remaining();
    if (timeout.isZero()) {
      throw new LinkShareException("deadline exceeded before resolving "
          + "access key id", TIMEOUT);
    }

    HttpRequest request = HttpRequest.newBuilder()
        .uri(accessUri(accessKeyId))
        .header("Authorization", "Bearer " + token)
        .timeout(timeout)
        .GET()
        .build();

    HttpResponse<InputStream> response;
    try {
      response = httpClient.send(request,
          HttpResponse.BodyHandlers.ofInputStream());
    } catch (HttpTimeoutException e) {
      throw new LinkShareException("authorization service timed out", e,
          TIMEOUT);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LinkShareException("interrupted while resolving access key "
          + "id", e, TIMEOUT);
    }

    try (InputStream body = response.body()) {
      if (response.statusCode() != 200) {
        throw new LinkShareException("invalid status code from "
            + "authorization service: " + response.statusCode(),
            INTERNAL_FAILURE);
      }
      AuthorizationResponse resolved =
          MAPPER.readValue(body, AuthorizationResponse.class);
      if (Strings.isNullOrEmpty(resolved.getAccessGrant())) {
        throw new LinkShareException(
            "authorization service returned no access grant",
            INTERNAL_FAILURE);
      }
      LOG.debug("Resolved access key id, public={}", resolved.isPublic());
      return resolved;
    }
  }

  @VisibleForTesting
  URI accessUri(String accessKeyId) {
    return baseUri.resolve("v1/access/"
        + URLEncoder.encode(accessKeyId, StandardCharsets.UTF_8));
  }
}
