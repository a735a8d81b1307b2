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

package org.apache.ozone.linkshare.dns;

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.CUSTOM_DOMAIN_NOT_CONFIGURED;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.DNS_RESOLUTION_FAILED;

import com.google.common.base.Strings;
import java.io.IOException;
import java.util.List;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.auth.AccessParser;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.apache.ozone.linkshare.storage.AccessGrant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the access grant and storage root configured for a custom
 * hostname in its DNS TXT records.
 *
 * Concurrent misses for one host may each query DNS; the last one to
 * finish wins the cache slot.
 */
public class CustomDomainResolver {

  private static final Logger LOG =
      LoggerFactory.getLogger(CustomDomainResolver.class);

  public static final String ACCESS_RECORD = "storj-access";
  public static final String ROOT_RECORD = "storj-root";

  private final DnsClient dnsClient;
  private final AccessParser accessParser;
  private final TxtRecordCache cache;
  private final String namePrefix;
  private final boolean requirePublic;

  /**
   * @param namePrefix prepended to the host to form the queried name
   * @param requirePublic reject access key ids registered as private
   */
  public CustomDomainResolver(DnsClient dnsClient, AccessParser accessParser,
      TxtRecordCache cache, String namePrefix, boolean requirePublic) {
    this.dnsClient = dnsClient;
    this.accessParser = accessParser;
    this.cache = cache;
    this.namePrefix = Strings.nullToEmpty(namePrefix);
    this.requirePublic = requirePublic;
  }

  /**
   * @param host request host without port
   */
  public TxtRecordCache.Entry fetchAccessForHost(String host,
      Deadline deadline) throws LinkShareException {
    TxtRecordCache.Entry cached = cache.getIfLive(host);
    if (cached != null) {
      LOG.debug("TXT record cache hit for {}", host);
      return cached;
    }

    deadline.check("TXT lookup");
    String name = namePrefix + host;
    List<String> records;
    try {
      records = dnsClient.lookupTxt(name, deadline);
    } catch (LinkShareException e) {
      throw e;
    } catch (IOException e) {
      throw new LinkShareException("TXT lookup for " + name + " failed: "
          + e.getMessage(), e, DNS_RESOLUTION_FAILED);
    }

    TxtRecordSet set = TxtRecordSet.parse(records);
    String serializedAccess = set.lookup(ACCESS_RECORD);
    String root = set.lookup(ROOT_RECORD);
    if (Strings.isNullOrEmpty(serializedAccess)) {
      throw new LinkShareException("no " + ACCESS_RECORD + " TXT record for "
          + name, CUSTOM_DOMAIN_NOT_CONFIGURED);
    }
    if (Strings.isNullOrEmpty(root) || root.startsWith("/")) {
      throw new LinkShareException("no usable " + ROOT_RECORD
          + " TXT record for " + name, CUSTOM_DOMAIN_NOT_CONFIGURED);
    }

    AccessGrant access =
        accessParser.parseAccess(serializedAccess, deadline, requirePublic);
    LOG.debug("Resolved custom domain {} to root {}", host, root);
    return cache.put(host, access, root);
  }
}
