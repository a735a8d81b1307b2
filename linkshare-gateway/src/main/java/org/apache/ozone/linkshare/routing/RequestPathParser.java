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

package org.apache.ozone.linkshare.routing;

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.MISSING_BUCKET;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.MISSING_CREDENTIAL;

import org.apache.ozone.linkshare.exception.LinkShareException;

/**
 * Splits a traditional request path into credential, bucket and key.
 *
 * Supported shapes:
 * <ul>
 *   <li>{@code /<access>/<bucket>}</li>
 *   <li>{@code /<access>/<bucket>/<key...>}</li>
 *   <li>{@code /raw/<access>/<bucket>/<key...>}</li>
 * </ul>
 */
public final class RequestPathParser {

  static final String RAW_SEGMENT = "raw";

  private RequestPathParser() {
  }

  public static ParsedRequestPath parse(String path)
      throws LinkShareException {
    String p = path.startsWith("/") ? path.substring(1) : path;

    String[] segments = p.split("/", 4);
    boolean raw = false;
    if (segments.length == 4) {
      if (RAW_SEGMENT.equals(segments[0])) {
        raw = true;
        segments = new String[] {segments[1], segments[2], segments[3]};
      } else {
        // the last two hold one key with a slash in it
        segments = new String[] {segments[0], segments[1],
            segments[2] + "/" + segments[3]};
      }
    }
    if (segments.length == 1) {
      if (segments[0].isEmpty()) {
        throw new LinkShareException("missing access", MISSING_CREDENTIAL);
      }
      throw new LinkShareException("missing bucket", MISSING_BUCKET);
    }

    String key = segments.length == 3 ? segments[2] : "";
    return new ParsedRequestPath(raw, segments[0], segments[1], key);
  }
}
