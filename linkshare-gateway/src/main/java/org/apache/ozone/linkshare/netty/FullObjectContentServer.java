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

import static io.netty.handler.codec.http.HttpResponseStatus.OK;

import com.google.common.base.Strings;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpUtil;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.apache.commons.io.IOUtils;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.routing.RoutingResult;
import org.apache.ozone.linkshare.routing.StorageErrors;
import org.apache.ozone.linkshare.storage.ObjectInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the whole object into memory and writes it as one response.
 */
public class FullObjectContentServer implements ContentServer {

  private static final Logger LOG =
      LoggerFactory.getLogger(FullObjectContentServer.class);

  static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private static final int MAX_INITIAL_BUFFER = 8 * 1024 * 1024;

  @Override
  public void serve(ChannelHandlerContext ctx, FullHttpRequest request,
      RoutingResult result, boolean download, Deadline deadline)
      throws IOException {
    ObjectInfo object = result.getObject();
    String contentType = Strings.isNullOrEmpty(object.getContentType())
        ? DEFAULT_CONTENT_TYPE : object.getContentType();
    boolean keepAlive = HttpUtil.isKeepAlive(request);

    FullHttpResponse response;
    if (HttpMethod.HEAD.equals(request.method())) {
      response = LinkShareResponseHelper.emptyResponse(OK);
      response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
      response.headers().set(HttpHeaderNames.CONTENT_LENGTH,
          Long.toString(object.getContentLength()));
    } else {
      deadline.check("download object");
      byte[] data;
      try (InputStream in = result.getProject().download(result.getBucket(),
          result.getKey(), deadline)) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(
            (int) Math.min(object.getContentLength(), MAX_INITIAL_BUFFER));
        IOUtils.copy(in, out);
        data = out.toByteArray();
      } catch (IOException e) {
        throw StorageErrors.translate("download object", e);
      }
      LOG.debug("Serving {}/{} ({} bytes)", result.getBucket(),
          result.getKey(), data.length);
      response = LinkShareResponseHelper.binaryResponse(OK, data,
          contentType);
    }

    response.headers().set(HttpHeaderNames.ACCEPT_RANGES, "none");
    if (object.getCreated() != null) {
      response.headers().set(HttpHeaderNames.LAST_MODIFIED,
          DateTimeFormatter.RFC_1123_DATE_TIME.format(
              object.getCreated().atZone(ZoneOffset.UTC)));
    }
    if (download) {
      response.headers().set(HttpHeaderNames.CONTENT_DISPOSITION,
          "attachment; filename=\"" + fileName(result.getKey()) + "\"");
    }
    LinkShareResponseHelper.send(ctx, response, keepAlive);
  }

  static String fileName(String key) {
    String name = key.substring(key.lastIndexOf('/') + 1);
    return name.replace("\"", "");
  }
}
