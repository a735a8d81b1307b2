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

import static io.netty.handler.codec.http.HttpResponseStatus.FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.MOVED_PERMANENTLY;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;

import com.google.common.annotations.VisibleForTesting;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.listing.PrefixLister;
import org.apache.ozone.linkshare.listing.PrefixListing;
import org.apache.ozone.linkshare.routing.LinkShareRouter;
import org.apache.ozone.linkshare.routing.RouteRequest;
import org.apache.ozone.linkshare.routing.RoutingMode;
import org.apache.ozone.linkshare.routing.RoutingResult;
import org.apache.ozone.linkshare.routing.StorageErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of every HTTP request: routes it, then answers with a
 * redirect, a listing, an object page or the object itself.
 *
 * Query flags on object URLs:
 * <ul>
 *   <li>{@code ?download} - serve the bytes as an attachment</li>
 *   <li>{@code ?view} - serve the bytes inline</li>
 * </ul>
 * Without either flag, traditional links show a landing page; raw and
 * custom-domain links serve the bytes inline.
 */
public class LinkShareRequestHandler
    extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger LOG =
      LoggerFactory.getLogger(LinkShareRequestHandler.class);

  private final LinkShareRouter router;
  private final PrefixLister prefixLister;
  private final ContentServer contentServer;
  private final PageRenderer pageRenderer;
  private final Clock clock;
  private final Duration requestTimeout;

  public LinkShareRequestHandler(LinkShareRouter router,
      PrefixLister prefixLister, ContentServer contentServer,
      PageRenderer pageRenderer, Clock clock, Duration requestTimeout) {
    this.router = router;
    this.prefixLister = prefixLister;
    this.contentServer = contentServer;
    this.pageRenderer = pageRenderer;
    this.clock = clock;
    this.requestTimeout = requestTimeout;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx,
      FullHttpRequest request) {
    QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
    String path = decoder.path();
    HttpMethod method = request.method();
    String host = request.headers().get(HttpHeaderNames.HOST);
    boolean headOnly = HttpMethod.HEAD.equals(method);

    LOG.debug("{} {} (host {})", method, path, host);

    Deadline deadline = Deadline.after(clock, requestTimeout);
    try (RoutingResult result = router.route(
        new RouteRequest(method.name(), host, path), deadline)) {
      LOG.debug("Routed {} {} to {}", method, path, result);
      switch (result.getAction()) {
      case REDIRECT_TRAILING_SLASH:
        LinkShareResponseHelper.send(ctx, LinkShareResponseHelper.redirect(
            MOVED_PERMANENTLY, result.getLocation()),
            HttpUtil.isKeepAlive(request));
        break;
      case REDIRECT_LOCATION:
        LinkShareResponseHelper.send(ctx, LinkShareResponseHelper.redirect(
            FOUND, result.getLocation()), HttpUtil.isKeepAlive(request));
        break;
      case LIST_PREFIX:
        PrefixListing listing = prefixLister.list(result, deadline);
        LinkShareResponseHelper.send(ctx, LinkShareResponseHelper.htmlResponse(
            OK, pageRenderer.listingPage(listing), headOnly),
            HttpUtil.isKeepAlive(request));
        break;
      case SERVE_OBJECT:
        serveObject(ctx, request, decoder.parameters(), result, deadline);
        break;
      default:
        throw new IllegalStateException("unknown action "
            + result.getAction());
      }
    } catch (LinkShareException e) {
      sendFailure(ctx, request, path, e);
    } catch (Exception e) {
      LOG.error("Error processing {} {}", method, path, e);
      LinkShareResponseHelper.sendError(ctx, INTERNAL_SERVER_ERROR,
          LinkShareException.ResultCodes.INTERNAL_FAILURE.getPublicMessage(),
          headOnly);
    }
  }

  private void serveObject(ChannelHandlerContext ctx, FullHttpRequest request,
      Map<String, List<String>> params, RoutingResult result,
      Deadline deadline) throws LinkShareException {
    boolean download = queryFlag(params, "download");
    boolean view = queryFlag(params, "view");
    if (result.getMode() == RoutingMode.TRADITIONAL && !download && !view) {
      String page = pageRenderer.objectPage(result.getBucket(),
          result.getKey(), result.getObject().getContentLength());
      LinkShareResponseHelper.send(ctx, LinkShareResponseHelper.htmlResponse(
          OK, page, HttpMethod.HEAD.equals(request.method())),
          HttpUtil.isKeepAlive(request));
      return;
    }
    try {
      contentServer.serve(ctx, request, result, download, deadline);
    } catch (IOException e) {
      throw StorageErrors.translate("serve object", e);
    }
  }

  private void sendFailure(ChannelHandlerContext ctx, FullHttpRequest request,
      String path, LinkShareException e) {
    LinkShareException.ResultCodes code = e.getResult();
    HttpResponseStatus status = HttpResponseStatus.valueOf(code.getHttpCode());
    boolean headOnly = HttpMethod.HEAD.equals(request.method());
    if (code.isClientError()) {
      LOG.debug("Rejected {} {}: {}", request.method(), path, e.toString());
    } else {
      LOG.error("Failed {} {}", request.method(), path, e);
    }
    if (code.isNotFound()) {
      LinkShareResponseHelper.send(ctx, LinkShareResponseHelper.htmlResponse(
          status, pageRenderer.notFoundPage(code.getPublicMessage()),
          headOnly), HttpUtil.isKeepAlive(request));
      return;
    }
    LinkShareResponseHelper.sendError(ctx, status, code.getPublicMessage(),
        headOnly);
  }

  /**
   * A flag is set when present with no value or with any value other than
   * an explicit false.
   */
  @VisibleForTesting
  static boolean queryFlag(Map<String, List<String>> params, String name) {
    List<String> values = params.get(name);
    if (values == null) {
      return false;
    }
    if (values.isEmpty()) {
      return true;
    }
    switch (values.get(0).toLowerCase(Locale.ROOT)) {
    case "0":
    case "false":
    case "no":
    case "off":
      return false;
    default:
      return true;
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    LOG.error("Unhandled exception in link sharing pipeline", cause);
    if (ctx.channel().isActive()) {
      LinkShareResponseHelper.sendError(ctx, INTERNAL_SERVER_ERROR,
          LinkShareException.ResultCodes.INTERNAL_FAILURE.getPublicMessage(),
          false);
    }
  }
}
