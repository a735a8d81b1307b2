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

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.INVALID_HOST;

import org.apache.ozone.linkshare.exception.LinkShareException;

/**
 * Decides whether a request's {@code Host} names the gateway itself.
 *
 * Ports never take part in the comparison and IPv6 literals compare the
 * same with or without brackets. No other normalization is done, so the
 * comparison is case-sensitive.
 */
public final class HostComparator {

  private static final String MISSING_PORT = "missing port in address";

  private HostComparator() {
  }

  /**
   * @return true if both values name the same host
   * @throws LinkShareException {@code INVALID_HOST} if either value is
   *     malformed for a reason other than not having a port
   */
  public static boolean compareHosts(String host1, String host2)
      throws LinkShareException {
    return stripPort(host1).equals(stripPort(host2));
  }

  /**
   * Removes an optional {@code :port} suffix and IPv6 brackets.
   */
  public static String stripPort(String hostPort) throws LinkShareException {
    try {
      return splitHost(hostPort);
    } catch (IllegalArgumentException e) {
      if (!MISSING_PORT.equals(e.getMessage())) {
        throw new LinkShareException(e.getMessage() + ": " + hostPort,
            INVALID_HOST);
      }
    }
    if (hostPort.length() > 1 && hostPort.charAt(0) == '['
        && hostPort.charAt(hostPort.length() - 1) == ']') {
      return hostPort.substring(1, hostPort.length() - 1);
    }
    return hostPort;
  }

  /**
   * Host part of {@code host:port}, {@code [ipv6]:port}.
   * @throws IllegalArgumentException with {@value #MISSING_PORT} when the
   *     value carries no port, or with a description of the syntax error
   */
  static String splitHost(String hostPort) {
    int colon = hostPort.lastIndexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException(MISSING_PORT);
    }
    String host;
    int hostStart = 0;
    int afterHost = 0;
    if (hostPort.charAt(0) == '[') {
      int end = hostPort.indexOf(']');
      if (end < 0) {
        throw new IllegalArgumentException("missing ']' in address");
      }
      if (end + 1 == hostPort.length()) {
        throw new IllegalArgumentException(MISSING_PORT);
      } else if (end + 1 != colon) {
        if (hostPort.charAt(end + 1) == ':') {
          throw new IllegalArgumentException("too many colons in address");
        }
        throw new IllegalArgumentException(MISSING_PORT);
      }
      host = hostPort.substring(1, end);
      hostStart = 1;
      afterHost = end + 1;
    } else {
      host = hostPort.substring(0, colon);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("too many colons in address");
      }
    }
    if (hostPort.indexOf('[', hostStart) >= 0) {
      throw new IllegalArgumentException("unexpected '[' in address");
    }
    if (hostPort.indexOf(']', afterHost) >= 0) {
      throw new IllegalArgumentException("unexpected ']' in address");
    }
    return host;
  }
}
