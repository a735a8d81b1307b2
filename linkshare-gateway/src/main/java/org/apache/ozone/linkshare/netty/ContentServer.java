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

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import java.io.IOException;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.routing.RoutingResult;

/**
 * Writes the bytes of a routed object to the client.
 */
public interface ContentServer {

  /**
   * Writes a complete response for {@code result}, whose action is
   * {@code SERVE_OBJECT}. The project it carries stays open until this
   * method returns.
   *
   * @param download whether the client asked for an attachment
   */
  void serve(ChannelHandlerContext ctx, FullHttpRequest request,
      RoutingResult result, boolean download, Deadline deadline)
      throws IOException;
}
