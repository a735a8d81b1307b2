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

import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.DNS_RESOLUTION_FAILED;
import static org.apache.ozone.linkshare.exception.LinkShareException.ResultCodes.TIMEOUT;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import io.netty.buffer.ByteBuf;
import io.netty.channel.AddressedEnvelope;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsResponseCode;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.resolver.dns.DnsServerAddressStreamProviders;
import io.netty.resolver.dns.SingletonDnsServerAddressStreamProvider;
import io.netty.util.concurrent.Future;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.hadoop.net.NetUtils;
import org.apache.ozone.linkshare.Deadline;
import org.apache.ozone.linkshare.exception.LinkShareException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DnsClient} on top of Netty's asynchronous DNS resolver.
 */
public class NettyDnsClient implements DnsClient, Closeable {

  private static final Logger LOG =
      LoggerFactory.getLogger(NettyDnsClient.class);

  private static final int DNS_PORT = 53;

  private final EventLoopGroup group;
  private final DnsNameResolver resolver;

  /**
   * @param dnsServer {@code host[:port]} of the server to ask, or empty
   *     for the platform's resolvers
   */
  public NettyDnsClient(String dnsServer, Duration queryTimeout) {
    this.group = new NioEventLoopGroup(1);
    DnsNameResolverBuilder builder = new DnsNameResolverBuilder(group.next())
        .channelType(NioDatagramChannel.class)
        .queryTimeoutMillis(queryTimeout.toMillis())
        .recursionDesired(true);
    if (Strings.isNullOrEmpty(dnsServer)) {
      builder.nameServerProvider(
          DnsServerAddressStreamProviders.platformDefault());
    } else {
      InetSocketAddress server = NetUtils.createSocketAddr(dnsServer,
          DNS_PORT);
      builder.nameServerProvider(
          new SingletonDnsServerAddressStreamProvider(server));
      LOG.info("Resolving TXT records through {}", server);
    }
    this.resolver = builder.build();
  }

  @Override
  public List<String> lookupTxt(String name, Deadline deadline)
      throws IOException {
    deadline.check("TXT lookup of " + name);
    Future<AddressedEnvelope<DnsResponse, InetSocketAddress>> future =
        resolver.query(new DefaultDnsQuestion(name, DnsRecordType.TXT));

    AddressedEnvelope<DnsResponse, InetSocketAddress> envelope;
    try {
      envelope = future.get(deadline.remaining().toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new LinkShareException("TXT lookup of " + name + " timed out", e,
          TIMEOUT);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new LinkShareException("interrupted during TXT lookup of " + name,
          e, TIMEOUT);
    } catch (ExecutionException e) {
      throw new LinkShareException("TXT lookup of " + name + " failed",
          e.getCause(), DNS_RESOLUTION_FAILED);
    }

    try {
      DnsResponse response = envelope.content();
      if (!DnsResponseCode.NOERROR.equals(response.code())) {
        throw new LinkShareException("TXT lookup of " + name + " returned "
            + response.code(), DNS_RESOLUTION_FAILED);
      }
      List<String> records = new ArrayList<>();
      int count = response.count(DnsSection.ANSWER);
      for (int i = 0; i < count; i++) {
        DnsRecord record = response.recordAt(DnsSection.ANSWER, i);
        if (record.type() == DnsRecordType.TXT
            && record instanceof DnsRawRecord) {
          records.add(decodeTxt(((DnsRawRecord) record).content()));
        }
      }
      LOG.debug("TXT lookup of {} returned {} records", name, records.size());
      return records;
    } catch (IllegalArgumentException e) {
      throw new LinkShareException("malformed TXT record for " + name, e,
          DNS_RESOLUTION_FAILED);
    } finally {
      envelope.release();
    }
  }

  /**
   * Joins the length-prefixed character strings of one TXT RDATA.
   */
  @VisibleForTesting
  static String decodeTxt(ByteBuf rdata) {
    ByteBuf buf = rdata.duplicate();
    StringBuilder text = new StringBuilder();
    while (buf.isReadable()) {
      int length = buf.readUnsignedByte();
      if (length > buf.readableBytes()) {
        throw new IllegalArgumentException("character string of " + length
            + " bytes overruns the record");
      }
      text.append(buf.toString(buf.readerIndex(), length,
          StandardCharsets.UTF_8));
      buf.skipBytes(length);
    }
    return text.toString();
  }

  @Override
  public void close() {
    resolver.close();
    group.shutdownGracefully();
  }
}
