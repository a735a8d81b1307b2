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

package org.apache.ozone.linkshare.codec;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import java.util.Arrays;

/**
 * Base-58 encoding with a leading version byte and a trailing four byte
 * double SHA-256 checksum, the format of serialized access grants and
 * access key ids.
 *
 * Decoding failures are reported with {@link IllegalArgumentException},
 * the same way Guava's {@code BaseEncoding} reports them.
 */
public final class Base58Check {

  private static final char[] ALPHABET =
      "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz"
          .toCharArray();
  private static final char ENCODED_ZERO = ALPHABET[0];
  private static final int[] INDEXES = new int[128];
  private static final int CHECKSUM_LENGTH = 4;

  static {
    Arrays.fill(INDEXES, -1);
    for (int i = 0; i < ALPHABET.length; i++) {
      INDEXES[ALPHABET[i]] = i;
    }
  }

  private Base58Check() {
  }

  /**
   * Result of a check-decode.
   */
  public static final class Decoded {
    private final int version;
    private final byte[] payload;

    Decoded(int version, byte[] payload) {
      this.version = version;
      this.payload = payload;
    }

    /**
     * @return the version byte, 0 to 255
     */
    public int getVersion() {
      return version;
    }

    public byte[] getPayload() {
      return payload.clone();
    }
  }

  /**
   * Decodes {@code input} and verifies its checksum.
   * @throws IllegalArgumentException if the input is not base-58, is too
   *     short to hold a version and a checksum, or the checksum is wrong
   */
  public static Decoded decode(String input) {
    byte[] decoded = decodeRaw(input);
    if (decoded.length < 1 + CHECKSUM_LENGTH) {
      throw new IllegalArgumentException("invalid format: version and/or "
          + "checksum bytes missing");
    }
    int dataLength = decoded.length - CHECKSUM_LENGTH;
    byte[] data = Arrays.copyOfRange(decoded, 0, dataLength);
    byte[] expected = checksum(data);
    byte[] actual = Arrays.copyOfRange(decoded, dataLength, decoded.length);
    if (!Arrays.equals(expected, actual)) {
      throw new IllegalArgumentException("checksum error");
    }
    return new Decoded(data[0] & 0xFF,
        Arrays.copyOfRange(data, 1, data.length));
  }

  /**
   * Prepends {@code version}, appends the checksum and encodes.
   */
  public static String encode(int version, byte[] payload) {
    Preconditions.checkArgument(version >= 0 && version <= 0xFF,
        "version out of range: %s", version);
    byte[] data = new byte[payload.length + 1];
    data[0] = (byte) version;
    System.arraycopy(payload, 0, data, 1, payload.length);
    byte[] sum = checksum(data);
    byte[] full = Arrays.copyOf(data, data.length + CHECKSUM_LENGTH);
    System.arraycopy(sum, 0, full, data.length, CHECKSUM_LENGTH);
    return encodeRaw(full);
  }

  static byte[] decodeRaw(String input) {
    if (input.isEmpty()) {
      return new byte[0];
    }
    byte[] input58 = new byte[input.length()];
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      int digit = c < 128 ? INDEXES[c] : -1;
      if (digit < 0) {
        throw new IllegalArgumentException(
            "invalid base-58 character at position " + i);
      }
      input58[i] = (byte) digit;
    }
    int zeros = 0;
    while (zeros < input58.length && input58[zeros] == 0) {
      ++zeros;
    }
    byte[] decoded = new byte[input.length()];
    int outputStart = decoded.length;
    for (int inputStart = zeros; inputStart < input58.length;) {
      decoded[--outputStart] = divmod(input58, inputStart, 58, 256);
      if (input58[inputStart] == 0) {
        ++inputStart;
      }
    }
    while (outputStart < decoded.length && decoded[outputStart] == 0) {
      ++outputStart;
    }
    return Arrays.copyOfRange(decoded, outputStart - zeros, decoded.length);
  }

  static String encodeRaw(byte[] input) {
    if (input.length == 0) {
      return "";
    }
    int zeros = 0;
    while (zeros < input.length && input[zeros] == 0) {
      ++zeros;
    }
    byte[] number = Arrays.copyOf(input, input.length);
    char[] encoded = new char[number.length * 2];
    int outputStart = encoded.length;
    for (int inputStart = zeros; inputStart < number.length;) {
      encoded[--outputStart] = ALPHABET[divmod(number, inputStart, 256, 58)];
      if (number[inputStart] == 0) {
        ++inputStart;
      }
    }
    while (outputStart < encoded.length
        && encoded[outputStart] == ENCODED_ZERO) {
      ++outputStart;
    }
    while (--zeros >= 0) {
      encoded[--outputStart] = ENCODED_ZERO;
    }
    return new String(encoded, outputStart, encoded.length - outputStart);
  }

  /**
   * Divides the big-endian number held in {@code number} (digits in
   * {@code base}) by {@code divisor} in place and returns the remainder.
   */
  private static byte divmod(byte[] number, int firstDigit, int base,
      int divisor) {
    int remainder = 0;
    for (int i = firstDigit; i < number.length; i++) {
      int digit = number[i] & 0xFF;
      int temp = remainder * base + digit;
      number[i] = (byte) (temp / divisor);
      remainder = temp % divisor;
    }
    return (byte) remainder;
  }

  private static byte[] checksum(byte[] data) {
    byte[] first = Hashing.sha256().hashBytes(data).asBytes();
    byte[] second = Hashing.sha256().hashBytes(first).asBytes();
    return Arrays.copyOf(second, CHECKSUM_LENGTH);
  }
}
