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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Named values published in the TXT records of a domain.
 *
 * Each record is {@code name:value} or {@code name=value}; whichever
 * separator comes first splits it. Names are matched case-insensitively.
 * A value too long for one record may be published as {@code name-1},
 * {@code name-2}, ... and is put back together in numeric order.
 * Records without a separator are ignored.
 */
public final class TxtRecordSet {

  private final Map<String, String> values = new HashMap<>();
  private final Map<String, SortedMap<Integer, String>> segments =
      new HashMap<>();

  public static TxtRecordSet parse(Iterable<String> records) {
    TxtRecordSet set = new TxtRecordSet();
    for (String record : records) {
      set.add(record);
    }
    return set;
  }

  public void add(String record) {
    int separator = separatorIndex(record);
    if (separator < 0) {
      return;
    }
    String name = record.substring(0, separator).trim()
        .toLowerCase(Locale.ROOT);
    String value = record.substring(separator + 1).trim();

    int dash = name.lastIndexOf('-');
    if (dash > 0 && dash < name.length() - 1) {
      Integer index = parseIndex(name.substring(dash + 1));
      if (index != null) {
        segments.computeIfAbsent(name.substring(0, dash),
            k -> new TreeMap<>()).put(index, value);
        return;
      }
    }
    values.put(name, value);
  }

  /**
   * @return the value published under {@code name}, or null
   */
  public String lookup(String name) {
    String key = name.toLowerCase(Locale.ROOT);
    String value = values.get(key);
    if (value != null) {
      return value;
    }
    SortedMap<Integer, String> parts = segments.get(key);
    if (parts == null) {
      return null;
    }
    return String.join("", parts.values());
  }

  private static int separatorIndex(String record) {
    int colon = record.indexOf(':');
    int equals = record.indexOf('=');
    if (colon < 0) {
      return equals;
    }
    if (equals < 0) {
      return colon;
    }
    return Math.min(colon, equals);
  }

  private static Integer parseIndex(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return null;
      }
    }
    try {
      return Integer.valueOf(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
