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

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import org.apache.hadoop.net.NetUtils;
import org.apache.ozone.linkshare.LinkShareConfig;
import org.apache.ozone.linkshare.routing.LinkShareRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty HTTP server of the link sharing gateway.
 */
public class LinkShareNettyServer implements Closeable {

  private static final Logger LOG =
      LoggerFactory.getLogger(LinkShareNettyServer.class);

  private final LinkShareConfig config;
  private final LinkShareRouter router;

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private EventExecutorGroup handlerGroup;
  private Channel serverChannel;
  private InetSocketAddress httpAddress;

  public LinkShareNettyServer(LinkShareConfig config, LinkShareRouter router) {
    this.config = config;
    this.router = router;
    this.httpAddress = config.getHttpBindAddress();
  }

  public void start() throws InterruptedException {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    handlerGroup = new DefaultEventExecutorGroup(config.getHandlerThreads());

    ServerBootstrap bootstrap = new ServerBootstrap();
    bootstrap.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new LinkShareHttpInitializer(config, router,
            handlerGroup))
        .childOption(ChannelOption.SO_KEEPALIVE, true)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .option(ChannelOption.SO_BACKLOG, 1024);

    serverChannel = bootstrap.bind(httpAddress).sync().channel();

    InetSocketAddress boundAddress =
        (InetSocketAddress) serverChannel.localAddress();
    if (boundAddress != null) {
      httpAddress = boundAddress;
    }

    String realAddress = NetUtils.getHostPortString(
        NetUtils.getConnectAddress(httpAddress));
    LOG.info("Link sharing gateway listening at http://{}, serving {}",
        realAddress, config.getUrlBase());
  }

  /**
   * Blocks until the server channel is closed.
   */
  public void join() throws InterruptedException {
    if (serverChannel != null) {
      serverChannel.closeFuture().sync();
    }
  }

  public void stop() throws InterruptedException {
    LOG.info("Stopping link sharing gateway");
    if (serverChannel != null) {
      serverChannel.close().sync();
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully().sync();
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully().sync();
    }
    if (handlerGroup != null) {
      handlerGroup.shutdownGracefully().sync();
    }
  }

  @Override
  public void close() throws IOException {
    try {
      stop();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while stopping link sharing server",
          e);
    }
  }

  public InetSocketAddress getHttpAddress() {
    return httpAddress;
  }
}
