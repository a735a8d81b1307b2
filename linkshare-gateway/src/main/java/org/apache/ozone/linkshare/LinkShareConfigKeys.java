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

package org.apache.ozone.linkshare;

/**
 * Configuration keys of the link sharing gateway. Defaults are documented
 * in {@code linkshare-default.xml}.
 */
public final class LinkShareConfigKeys {

  public static final String LINKSHARE_URL_BASE_KEY = "linkshare.url-base";

  public static final String LINKSHARE_HTTP_BIND_HOST_KEY =
      "linkshare.http-bind-host";
  public static final String LINKSHARE_HTTP_BIND_HOST_DEFAULT = "0.0.0.0";
  public static final String LINKSHARE_HTTP_ADDRESS_KEY =
      "linkshare.http-address";
  public static final int LINKSHARE_HTTP_BIND_PORT_DEFAULT = 20020;

  public static final String LINKSHARE_TXT_RECORD_TTL_KEY =
      "linkshare.txt-record.ttl";
  public static final String LINKSHARE_TXT_RECORD_TTL_DEFAULT = "1h";
  public static final String LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_KEY =
      "linkshare.txt-record.cache.max-entries";
  public static final long LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_DEFAULT =
      10_000L;
  public static final String LINKSHARE_TXT_RECORD_NAME_PREFIX_KEY =
      "linkshare.txt-record.name-prefix";
  public static final String LINKSHARE_TXT_RECORD_NAME_PREFIX_DEFAULT =
      "txt-";

  public static final String LINKSHARE_CUSTOM_DOMAIN_REQUIRE_PUBLIC_KEY =
      "linkshare.custom-domain.require-public-access";
  public static final boolean LINKSHARE_CUSTOM_DOMAIN_REQUIRE_PUBLIC_DEFAULT =
      false;

  public static final String LINKSHARE_AUTH_SERVICE_BASE_URL_KEY =
      "linkshare.auth-service.base-url";
  public static final String LINKSHARE_AUTH_SERVICE_TOKEN_KEY =
      "linkshare.auth-service.token";

  public static final String LINKSHARE_DNS_SERVER_KEY = "linkshare.dns-server";
  public static final String LINKSHARE_DNS_SERVER_DEFAULT = "1.1.1.1:53";
  public static final String LINKSHARE_DNS_QUERY_TIMEOUT_KEY =
      "linkshare.dns.query-timeout";
  public static final String LINKSHARE_DNS_QUERY_TIMEOUT_DEFAULT = "5s";

  public static final String LINKSHARE_REQUEST_TIMEOUT_KEY =
      "linkshare.request.timeout";
  public static final String LINKSHARE_REQUEST_TIMEOUT_DEFAULT = "30s";

  public static final String LINKSHARE_HANDLER_THREADS_KEY =
      "linkshare.handler.threads";
  public static final int LINKSHARE_HANDLER_THREADS_DEFAULT = 32;

  public static final String LINKSHARE_HTTP_MAX_CONTENT_LENGTH_KEY =
      "linkshare.http.max-content-length";
  public static final int LINKSHARE_HTTP_MAX_CONTENT_LENGTH_DEFAULT =
      1024 * 1024;

  private LinkShareConfigKeys() {
  }
}
