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

import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_AUTH_SERVICE_BASE_URL_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_AUTH_SERVICE_TOKEN_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_CUSTOM_DOMAIN_REQUIRE_PUBLIC_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_CUSTOM_DOMAIN_REQUIRE_PUBLIC_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_DNS_QUERY_TIMEOUT_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_DNS_QUERY_TIMEOUT_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_DNS_SERVER_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_DNS_SERVER_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HANDLER_THREADS_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HANDLER_THREADS_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HTTP_ADDRESS_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HTTP_BIND_HOST_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HTTP_BIND_HOST_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HTTP_BIND_PORT_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HTTP_MAX_CONTENT_LENGTH_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_HTTP_MAX_CONTENT_LENGTH_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_REQUEST_TIMEOUT_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_REQUEST_TIMEOUT_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_TXT_RECORD_NAME_PREFIX_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_TXT_RECORD_NAME_PREFIX_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_TXT_RECORD_TTL_DEFAULT;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_TXT_RECORD_TTL_KEY;
import static org.apache.ozone.linkshare.LinkShareConfigKeys.LINKSHARE_URL_BASE_KEY;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.net.NetUtils;

/**
 * Validated, typed view of the gateway configuration.
 */
public final class LinkShareConfig {

  private final URI urlBase;
  private final InetSocketAddress httpBindAddress;
  private final Duration txtRecordTtl;
  private final long txtRecordCacheMaxEntries;
  private final String txtRecordNamePrefix;
  private final boolean customDomainRequirePublic;
  private final String authServiceBaseUrl;
  private final String authServiceToken;
  private final String dnsServer;
  private final Duration dnsQueryTimeout;
  private final Duration requestTimeout;
  private final int handlerThreads;
  private final int maxContentLength;

  private LinkShareConfig(Configuration conf) {
    this.urlBase = parseUrlBase(conf.getTrimmed(LINKSHARE_URL_BASE_KEY));
    this.httpBindAddress = getHttpBindAddress(conf);
    this.txtRecordTtl = getDuration(conf, LINKSHARE_TXT_RECORD_TTL_KEY,
        LINKSHARE_TXT_RECORD_TTL_DEFAULT);
    this.txtRecordCacheMaxEntries = conf.getLong(
        LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_KEY,
        LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_DEFAULT);
    this.txtRecordNamePrefix = conf.getTrimmed(
        LINKSHARE_TXT_RECORD_NAME_PREFIX_KEY,
        LINKSHARE_TXT_RECORD_NAME_PREFIX_DEFAULT);
    this.customDomainRequirePublic = conf.getBoolean(
        LINKSHARE_CUSTOM_DOMAIN_REQUIRE_PUBLIC_KEY,
        LINKSHARE_CUSTOM_DOMAIN_REQUIRE_PUBLIC_DEFAULT);
    this.authServiceBaseUrl = Strings.emptyToNull(
        conf.getTrimmed(LINKSHARE_AUTH_SERVICE_BASE_URL_KEY));
    this.authServiceToken = conf.getTrimmed(LINKSHARE_AUTH_SERVICE_TOKEN_KEY,
        "");
    this.dnsServer = conf.getTrimmed(LINKSHARE_DNS_SERVER_KEY,
        LINKSHARE_DNS_SERVER_DEFAULT);
    this.dnsQueryTimeout = getDuration(conf, LINKSHARE_DNS_QUERY_TIMEOUT_KEY,
        LINKSHARE_DNS_QUERY_TIMEOUT_DEFAULT);
    this.requestTimeout = getDuration(conf, LINKSHARE_REQUEST_TIMEOUT_KEY,
        LINKSHARE_REQUEST_TIMEOUT_DEFAULT);
    this.handlerThreads = conf.getInt(LINKSHARE_HANDLER_THREADS_KEY,
        LINKSHARE_HANDLER_THREADS_DEFAULT);
    this.maxContentLength = conf.getInt(LINKSHARE_HTTP_MAX_CONTENT_LENGTH_KEY,
        LINKSHARE_HTTP_MAX_CONTENT_LENGTH_DEFAULT);

    Preconditions.checkArgument(!txtRecordTtl.isZero(),
        "%s must be positive", LINKSHARE_TXT_RECORD_TTL_KEY);
    Preconditions.checkArgument(txtRecordCacheMaxEntries > 0,
        "%s must be positive", LINKSHARE_TXT_RECORD_CACHE_MAX_ENTRIES_KEY);
    Preconditions.checkArgument(!requestTimeout.isZero(),
        "%s must be positive", LINKSHARE_REQUEST_TIMEOUT_KEY);
    Preconditions.checkArgument(handlerThreads > 0,
        "%s must be positive", LINKSHARE_HANDLER_THREADS_KEY);
  }

  /**
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static LinkShareConfig from(Configuration conf) {
    return new LinkShareConfig(conf);
  }

  /**
   * Public base URL of the gateway. Requests whose host matches it are
   * routed the traditional way.
   */
  @VisibleForTesting
  static URI parseUrlBase(String value) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(value),
        "%s is not set", LINKSHARE_URL_BASE_KEY);
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("invalid URL base: " + value, e);
    }
    Preconditions.checkArgument("http".equals(uri.getScheme())
            || "https".equals(uri.getScheme()),
        "URL base must be http:// or https://");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(uri.getRawAuthority()),
        "URL base must contain host");
    Preconditions.checkArgument(uri.getRawUserInfo() == null,
        "URL base must not contain user info");
    Preconditions.checkArgument(Strings.isNullOrEmpty(uri.getRawQuery()),
        "URL base must not contain query values");
    Preconditions.checkArgument(uri.getRawFragment() == null,
        "URL base must not contain a fragment");
    return uri;
  }

  private static InetSocketAddress getHttpBindAddress(Configuration conf) {
    String address = conf.getTrimmed(LINKSHARE_HTTP_ADDRESS_KEY,
        LINKSHARE_HTTP_BIND_HOST_DEFAULT + ":"
            + LINKSHARE_HTTP_BIND_PORT_DEFAULT);
    InetSocketAddress configured = NetUtils.createSocketAddr(address,
        LINKSHARE_HTTP_BIND_PORT_DEFAULT, LINKSHARE_HTTP_ADDRESS_KEY);
    String bindHost = conf.getTrimmed(LINKSHARE_HTTP_BIND_HOST_KEY,
        configured.getHostString());
    return NetUtils.createSocketAddr(bindHost + ":" + configured.getPort());
  }

  private static Duration getDuration(Configuration conf, String key,
      String defaultValue) {
    long millis = conf.getTimeDuration(key, defaultValue,
        TimeUnit.MILLISECONDS);
    Preconditions.checkArgument(millis >= 0, "%s must not be negative", key);
    return Duration.ofMillis(millis);
  }

  public URI getUrlBase() {
    return urlBase;
  }

  public InetSocketAddress getHttpBindAddress() {
    return httpBindAddress;
  }

  public Duration getTxtRecordTtl() {
    return txtRecordTtl;
  }

  public long getTxtRecordCacheMaxEntries() {
    return txtRecordCacheMaxEntries;
  }

  public String getTxtRecordNamePrefix() {
    return txtRecordNamePrefix;
  }

  public boolean isCustomDomainRequirePublic() {
    return customDomainRequirePublic;
  }

  /**
   * @return base URL of the authorization service, or null when access
   *     key ids cannot be resolved
   */
  public String getAuthServiceBaseUrl() {
    return authServiceBaseUrl;
  }

  public String getAuthServiceToken() {
    return authServiceToken;
  }

  public String getDnsServer() {
    return dnsServer;
  }

  public Duration getDnsQueryTimeout() {
    return dnsQueryTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public int getHandlerThreads() {
    return handlerThreads;
  }

  public int getMaxContentLength() {
    return maxContentLength;
  }
}
