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
 * What the HTTP layer has to do with a routed request.
 */
public enum RoutingAction {

  /** Serve the stat'ed object. */
  SERVE_OBJECT,

  /** Render a listing of the key as a prefix. */
  LIST_PREFIX,

  /** 301 to the same path with a trailing slash. */
  REDIRECT_TRAILING_SLASH,

  /** 302 to the canonical location, no body (HEAD requests). */
  REDIRECT_LOCATION
}
