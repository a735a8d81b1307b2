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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.ozone.linkshare.LinkShareConfig;
import org.apache.ozone.linkshare.LinkShareConfigKeys;
import org.apache.ozone.linkshare.LinkShareConfiguration;
import org.apache.ozone.linkshare.routing.LinkShareRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LinkShareHttpInitializer}.
 */
public class TestLinkShareHttpInitializer {

  private DefaultEventExecutorGroup handlerGroup;
  private EmbeddedChannel channel;

  @BeforeEach
  public void setUp() {
    handlerGroup = new DefaultEventExecutorGroup(1);
    channel = new EmbeddedChannel();
  }

  @AfterEach
  public void tearDown() throws Exception {
    channel.finishAndReleaseAll();
    handlerGroup.shutdownGracefully().sync();
  }

  @Test
  public void testPipelineOrder() {
    Configuration conf = new LinkShareConfiguration();
    conf.set(LinkShareConfigKeys.LINKSHARE_URL_BASE_KEY,
        "https://link.example.com");
    LinkShareHttpInitializer initializer = new LinkShareHttpInitializer(
        LinkShareConfig.from(conf), mock(LinkShareRouter.class),
        handlerGroup);

    ChannelPipeline pipeline = channel.pipeline();
    initializer.configure(pipeline);

    List<String> names = new ArrayList<>();
    for (Map.Entry<String, ChannelHandler> e : pipeline) {
      names.add(e.getKey());
    }
    assertEquals(Arrays.asList("codec", "aggregator", "linkshare-handler"),
        names);
    assertNotNull(pipeline.get(LinkShareRequestHandler.class));
  }
}
