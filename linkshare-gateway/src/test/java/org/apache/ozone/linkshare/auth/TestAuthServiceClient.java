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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.TestClock;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AuthServiceClient} against a local HTTP server.
 */
public class TestAuthServiceClient {

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<String> authorization =
      new AtomicReference<>();
  private final AtomicReference<String> requestPath = new AtomicReference<>();

  @BeforeEach
  public void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/v1/access/", exchange -> {
      authorization.set(exchange.getRequestHeaders()
          .getFirst("Authorization"));
      requestPath.set(exchange.getRequestURI().getRawPath());
      String id = exchange.getRequestURI().getPath()
          .substring("/v1/access/".length());
      int status;
      String body;
      if ("public-id".equals(id)) {
        status = 200;
        body = "{\"access_grant\":\"grant-1\",\"secret_key\":\"s3cr3t\","
            + "\"public\":true,\"extra\":1}";
      } else if ("empty-id".equals(id)) {
        status = 200;
        body = "{\"access_grant\":\"\",\"public\":true}";
      } else {
        status = 404;
        body = "{\"error\":\"not found\"}";
      }
      byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  public void tearDown() {
    server.stop(0);
  }

  @Test
  public void testResolve() throws Exception {
    AuthServiceClient client = new AuthServiceClient(baseUrl, "token-1");
    AuthorizationResponse response = client.resolve("public-id", deadline());

    assertEquals("grant-1", response.getAccessGrant());
    assertEquals("s3cr3t", response.getSecretKey());
    assertTrue(response.isPublic());
    assertEquals("Bearer token-1", authorization.get());
    assertEquals("/v1/access/public-id", requestPath.get());
  }

  @Test
  public void testUnknownId() {
    AuthServiceClient client = new AuthServiceClient(baseUrl + "/", "t");
    LinkShareException e = assertThrows(LinkShareException.class,
        () -> client.resolve("unknown-id", deadline()));
    assertEquals(ResultCodes.INTERNAL_FAILURE, e.getResult());
    assertTrue(e.getMessage().contains("404"), e.getMessage());
  }

  @Test
  public void testEmptyGrant() {
    AuthServiceClient client = new AuthServiceClient(baseUrl, "t");
    assertEquals(ResultCodes.INTERNAL_FAILURE,
        assertThrows(LinkShareException.class,
            () -> client.resolve("empty-id", deadline())).getResult());
  }

  @Test
  public void testNotConfigured() {
    AuthServiceClient client = new AuthServiceClient(null, null);
    assertEquals(ResultCodes.INTERNAL_FAILURE,
        assertThrows(LinkShareException.class,
            () -> client.resolve("public-id", deadline())).getResult());
  }

  @Test
  public void testExpiredDeadline() {
    AuthServiceClient client = new AuthServiceClient(baseUrl, "t");
    Deadline expired = Deadline.after(TestClock.newInstance(), Duration.ZERO);
    assertEquals(ResultCodes.TIMEOUT,
        assertThrows(LinkShareException.class,
            () -> client.resolve("public-id", expired)).getResult());
    assertNull(authorization.get());
  }

  @Test
  public void testAccessUri() {
    AuthServiceClient client =
        new AuthServiceClient("https://auth.example.com/api", "t");
    assertEquals("https://auth.example.com/api/v1/access/a%2Fb",
        client.accessUri("a/b").toString());
  }

  private static Deadline deadline() {
    return Deadline.after(Clock.systemUTC(), Duration.ofSeconds(10));
  }
}
