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

package org.apache.ozone.linkshare;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.Iterator;
import java.util.ServiceLoader;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.GenericOptionsParser;
import org.apache.hadoop.util.ShutdownHookManager;
import org.apache.hadoop.util.StringUtils;
import org.apache.ozone.linkshare.auth.AccessParser;
import org.apache.ozone.linkshare.auth.AuthServiceClient;
import org.apache.ozone.linkshare.dns.CustomDomainResolver;
import org.apache.ozone.linkshare.dns.NettyDnsClient;
import org.apache.ozone.linkshare.dns.TxtRecordCache;
import org.apache.ozone.linkshare.netty.LinkShareNettyServer;
import org.apache.ozone.linkshare.routing.LinkShareRouter;
import org.apache.ozone.linkshare.storage.StorageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Link sharing gateway process.
 */
public class LinkShareGateway implements Closeable {

  private static final Logger LOG =
      LoggerFactory.getLogger(LinkShareGateway.class);

  public static final int SHUTDOWN_HOOK_PRIORITY = 30;

  private final LinkShareConfig config;
  private final NettyDnsClient dnsClient;
  private final LinkShareNettyServer server;

  public LinkShareGateway(LinkShareConfig config,
      StorageClient storageClient) {
    this.config = config;
    AccessParser accessParser = new AccessParser(storageClient,
        new AuthServiceClient(config.getAuthServiceBaseUrl(),
            config.getAuthServiceToken()));
    this.dnsClient = new NettyDnsClient(config.getDnsServer(),
        config.getDnsQueryTimeout());
    TxtRecordCache cache = new TxtRecordCache(config.getTxtRecordTtl(),
        config.getTxtRecordCacheMaxEntries(), Clock.systemUTC());
    CustomDomainResolver customDomains = new CustomDomainResolver(dnsClient,
        accessParser, cache, config.getTxtRecordNamePrefix(),
        config.isCustomDomainRequirePublic());
    LinkShareRouter router = new LinkShareRouter(config.getUrlBase(),
        storageClient, accessParser, customDomains);
    this.server = new LinkShareNettyServer(config, router);
  }

  public static void main(String[] args) throws Exception {
    StringUtils.startupShutdownMessage(LinkShareGateway.class, args, LOG);
    Configuration conf = new LinkShareConfiguration();
    new GenericOptionsParser(conf, args);

    LinkShareGateway gateway = new LinkShareGateway(
        LinkShareConfig.from(conf), loadStorageClient());
    ShutdownHookManager.get().addShutdownHook(() -> {
      try {
        gateway.close();
      } catch (IOException e) {
        LOG.error("Error stopping link sharing gateway", e);
      }
    }, SHUTDOWN_HOOK_PRIORITY);

    gateway.start();
    gateway.join();
  }

  static StorageClient loadStorageClient() {
    Iterator<StorageClient> clients =
        ServiceLoader.load(StorageClient.class).iterator();
    if (!clients.hasNext()) {
      throw new IllegalStateException("No " + StorageClient.class.getName()
          + " implementation found on the classpath");
    }
    StorageClient client = clients.next();
    LOG.info("Using storage client {}", client.getClass().getName());
    return client;
  }

  public void start() throws InterruptedException {
    LOG.info("Starting link sharing gateway for {}", config.getUrlBase());
    server.start();
  }

  public void join() throws InterruptedException {
    server.join();
  }

  @Override
  public void close() throws IOException {
    try {
      server.close();
    } finally {
      dnsClient.close();
    }
  }
}
