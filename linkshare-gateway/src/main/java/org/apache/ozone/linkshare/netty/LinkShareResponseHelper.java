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

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.nio.charset.StandardCharsets;

/**
 * Utility methods for building link sharing HTTP responses.
 *
 * Responses to HEAD requests keep their {@code Content-Length} but carry
 * no body.
 */
public final class LinkShareResponseHelper {

  static final String SERVER_NAME = "linkshare";
  static final String HTML_TYPE = "text/html; charset=utf-8";
  static final String TEXT_TYPE = "text/plain; charset=utf-8";

  private LinkShareResponseHelper() {
  }

  public static FullHttpResponse htmlResponse(HttpResponseStatus status,
      String html, boolean headOnly) {
    return textualResponse(status, html, HTML_TYPE, headOnly);
  }

  public static FullHttpResponse textResponse(HttpResponseStatus status,
      String text, boolean headOnly) {
    return textualResponse(status, text, TEXT_TYPE, headOnly);
  }

  public static FullHttpResponse emptyResponse(HttpResponseStatus status) {
    FullHttpResponse response = new DefaultFullHttpResponse(
        HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
    response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
    setCommonHeaders(response);
    return response;
  }

  public static FullHttpResponse binaryResponse(HttpResponseStatus status,
      byte[] data, String contentType) {
    FullHttpResponse response = new DefaultFullHttpResponse(
        HTTP_1_1, status, Unpooled.wrappedBuffer(data));
    response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
    response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, data.length);
    setCommonHeaders(response);
    return response;
  }

  public static FullHttpResponse redirect(HttpResponseStatus status,
      String location) {
    FullHttpResponse response = emptyResponse(status);
    response.headers().set(HttpHeaderNames.LOCATION, location);
    return response;
  }

  /**
   * Writes the response and closes the connection unless the client asked
   * to keep it open.
   */
  public static void send(ChannelHandlerContext ctx,
      FullHttpResponse response, boolean keepAlive) {
    if (keepAlive) {
      ctx.writeAndFlush(response);
    } else {
      response.headers().set(HttpHeaderNames.CONNECTION, "close");
      ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
  }

  public static void sendError(ChannelHandlerContext ctx,
      HttpResponseStatus status, String message, boolean headOnly) {
    FullHttpResponse response = textResponse(status, message + "\n",
        headOnly);
    response.headers().set(HttpHeaderNames.CONNECTION, "close");
    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private static FullHttpResponse textualResponse(HttpResponseStatus status,
      String body, String contentType, boolean headOnly) {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status,
        headOnly ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(bytes));
    response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
    response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
    setCommonHeaders(response);
    return response;
  }

  private static void setCommonHeaders(FullHttpResponse response) {
    response.headers().set(HttpHeaderNames.SERVER, SERVER_NAME);
    response.headers().set(HttpHeaderNames.CONNECTION, "keep-alive");
  }
}
