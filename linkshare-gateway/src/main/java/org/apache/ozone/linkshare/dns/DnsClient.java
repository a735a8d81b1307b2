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

import java.io.IOException;
import java.util.List;
import org.apache.ozone.linkshare.Deadline;

/**
 * Looks up DNS TXT records.
 */
@FunctionalInterface
public interface DnsClient {

  /**
   * @return the text of every TXT record of {@code name}, the character
   *     strings of one record joined together; empty if there are none
   * @throws IOException if the lookup fails, including NXDOMAIN
   */
  List<String> lookupTxt(String name, Deadline deadline) throws IOException;
}
