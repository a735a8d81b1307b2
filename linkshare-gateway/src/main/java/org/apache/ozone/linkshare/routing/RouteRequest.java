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

/**
 * The parts of an HTTP request that decide its routing.
 */
public final class RouteRequest {

  private final String method;
  private final String host;
  private final String path;

  /**
   * @param method HTTP method name
   * @param host value of the {@code Host} header, may be null
   * @param path decoded URL path without the query string
   */
  public RouteRequest(String method, String host, String path) {
    this.method = method;
    this.host = host;
    this.path = path;
  }

  public String getMethod() {
    return method;
  }

  public String getHost() {
    return host;
  }

  public String getPath() {
    return path;
  }

  @Override
  public String toString() {
    return method + " " + host + path;
  }
}
