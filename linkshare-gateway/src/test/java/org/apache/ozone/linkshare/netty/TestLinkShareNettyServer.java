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

package org.apache.ozone.linkshare.netty;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.apache.hadoop.conf.Configuration;
import org.apache.ozone.linkshare.LinkShareConfig;
import org.apache.ozone.linkshare.LinkShareConfigKeys;
import org.apache.ozone.linkshare.LinkShareConfiguration;
import org.apache.ozone.linkshare.auth.AccessParser;
import org.apache.ozone.linkshare.auth.AuthorizationResolver;
import org.apache.ozone.linkshare.codec.Base58Check;
import org.apache.ozone.linkshare.dns.CustomDomainResolver;
import org.apache.ozone.linkshare.dns.DnsClient;
import org.apache.ozone.linkshare.dns.TxtRecordCache;
import org.apache.ozone.linkshare.routing.LinkShareRouter;
import org.apache.ozone.linkshare.storage.StorageClientStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs {@link LinkShareNettyServer} on a loopback port.
 */
public class TestLinkShareNettyServer {

  private static final String ACCESS = Base58Check.encode(0,
      "grant".getBytes(StandardCharsets.UTF_8));

  private LinkShareNettyServer server;
  private HttpClient client;
  private String baseUrl;

  @BeforeEach
  public void setUp() throws Exception {
    Configuration conf = new LinkShareConfiguration();
    conf.set(LinkShareConfigKeys.LINKSHARE_URL_BASE_KEY, "http://127.0.0.1");
    conf.set(LinkShareConfigKeys.LINKSHARE_HTTP_BIND_HOST_KEY, "127.0.0.1");
    conf.set(LinkShareConfigKeys.LINKSHARE_HTTP_ADDRESS_KEY, "127.0.0.1:0");
    conf.setInt(LinkShareConfigKeys.LINKSHARE_HANDLER_THREADS_KEY, 2);
    LinkShareConfig config = LinkShareConfig.from(conf);

    StorageClientStub storage = new StorageClientStub()
        .addGrant(ACCESS)
        .putObject("bucket", "dir/file.txt", "hello");
    AccessParser accessParser =
        new AccessParser(storage, mock(AuthorizationResolver.class));
    CustomDomainResolver customDomains = new CustomDomainResolver(
        mock(DnsClient.class), accessParser,
        new TxtRecordCache(Duration.ofMinutes(1), 10, Clock.systemUTC()),
        "txt-", false);
    LinkShareRouter router = new LinkShareRouter(config.getUrlBase(), storage,
        accessParser, customDomains);

    server = new LinkShareNettyServer(config, router);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getHttpAddress().getPort();
    client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  @AfterEach
  public void tearDown() throws Exception {
    server.close();
  }

  @Test
  public void testDownload() throws Exception {
    HttpResponse<String> response = client.send(HttpRequest.newBuilder(
            URI.create(baseUrl + "/" + ACCESS + "/bucket/dir/file.txt"
                + "?download")).GET().build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(200, response.statusCode());
    assertEquals("hello", response.body());
    assertEquals(Optional.of(LinkShareResponseHelper.SERVER_NAME),
        response.headers().firstValue("server"));
  }

  @Test
  public void testHeadRedirect() throws Exception {
    HttpResponse<Void> response = client.send(HttpRequest.newBuilder(
            URI.create(baseUrl + "/" + ACCESS + "/bucket/dir/file.txt"))
            .method("HEAD", HttpRequest.BodyPublishers.noBody()).build(),
        HttpResponse.BodyHandlers.discarding());

    assertEquals(302, response.statusCode());
    assertEquals(Optional.of("http://127.0.0.1/" + ACCESS
            + "/bucket/dir/file.txt"),
        response.headers().firstValue("location"));
  }

  @Test
  public void testListing() throws Exception {
    HttpResponse<String> response = client.send(HttpRequest.newBuilder(
            URI.create(baseUrl + "/" + ACCESS + "/bucket/")).GET().build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(200, response.statusCode());
    assertTrue(response.body().contains("dir/"), response.body());
  }
}
