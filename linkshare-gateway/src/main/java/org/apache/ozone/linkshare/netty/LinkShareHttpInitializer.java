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

import com.google.common.annotations.VisibleForTesting;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.EventExecutorGroup;
import java.time.Clock;
import org.apache.ozone.linkshare.LinkShareConfig;
import org.apache.ozone.linkshare.listing.PrefixLister;
import org.apache.ozone.linkshare.routing.LinkShareRouter;

/**
 * Initializes the Netty channel pipeline for link sharing requests.
 *
 * Routing blocks on DNS, the authorization service and storage, so the
 * request handler runs on {@code handlerGroup} rather than the I/O loop.
 */
public class LinkShareHttpInitializer
    extends ChannelInitializer<SocketChannel> {

  private final LinkShareConfig config;
  private final LinkShareRouter router;
  private final EventExecutorGroup handlerGroup;
  private final PrefixLister prefixLister = new PrefixLister();
  private final ContentServer contentServer = new FullObjectContentServer();
  private final PageRenderer pageRenderer = new SimplePageRenderer();

  public LinkShareHttpInitializer(LinkShareConfig config,
      LinkShareRouter router, EventExecutorGroup handlerGroup) {
    this.config = config;
    this.router = router;
    this.handlerGroup = handlerGroup;
  }

  @Override
  protected void initChannel(SocketChannel ch) {
    configure(ch.pipeline());
  }

  /**
   * Responses are written as whole {@code FullHttpResponse} messages, so
   * the pipeline carries no chunked writer.
   */
  @VisibleForTesting
  void configure(ChannelPipeline p) {
    p.addLast("codec", new HttpServerCodec());
    p.addLast("aggregator",
        new HttpObjectAggregator(config.getMaxContentLength()));
    p.addLast(handlerGroup, "linkshare-handler", new LinkShareRequestHandler(
        router, prefixLister, contentServer, pageRenderer,
        Clock.systemUTC(), config.getRequestTimeout()));
  }
}
