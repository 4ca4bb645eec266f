// This file is part of OpenTSDB.
// Copyright (C) 2018 The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsgateway.utils;

import java.util.Arrays;

/**
 * Helpers for the little-endian fixed width fields of the storage row format
 * and for printing raw rows in log and exception messages.
 *
 * @since 3.0
 */
public final class Bytes {

  private static final byte[] HEX = {
    '0', '1', '2', '3', '4', '5', '6', '7',
    '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'
  };

  private Bytes() {
    // utility class
  }

  /**
   * Reads an unsigned little-endian 32 bit integer.
   * @param b The buffer.
   * @param offset Where the value starts.
   * @return The value, always positive.
   */
  public static long getUnsignedIntLE(final byte[] b, final int offset) {
    return (b[offset] & 0xFFL)
        | (b[offset + 1] & 0xFFL) << 8
        | (b[offset + 2] & 0xFFL) << 16
        | (b[offset + 3] & 0xFFL) << 24;
  }

  /**
   * Reads a little-endian 64 bit integer.
   * @param b The buffer.
   * @param offset Where the value starts.
   * @return The value.
   */
  public static long getLongLE(final byte[] b, final int offset) {
    long v = 0;
    for (int i = 7; i >= 0; i--) {
      v = (v << 8) | (b[offset + i] & 0xFFL);
    }
    return v;
  }

  /**
   * Writes the low 32 bits of the value little-endian.
   * @param b The buffer.
   * @param value The value to write.
   * @param offset Where to write.
   */
  public static void setIntLE(final byte[] b, final long value, final int offset) {
    b[offset] = (byte) value;
    b[offset + 1] = (byte) (value >>> 8);
    b[offset + 2] = (byte) (value >>> 16);
    b[offset + 3] = (byte) (value >>> 24);
  }

  /**
   * Writes a 64 bit value little-endian.
   * @param b The buffer.
   * @param value The value to write.
   * @param offset Where to write.
   */
  public static void setLongLE(final byte[] b, final long value, final int offset) {
    for (int i = 0; i < 8; i++) {
      b[offset + i] = (byte) (value >>> (8 * i));
    }
  }

  /**
   * Pretty-prints a byte array into a human-readable output buffer. Mostly
   * printable arrays are escaped, binary ones are written as a list of
   * numbers.
   * @param outbuf The buffer where to write the output.
   * @param array The (possibly {@code null}) array to pretty-print.
   */
  public static void pretty(final StringBuilder outbuf, final byte[] array) {
    if (array == null) {
      outbuf.append("null");
      return;
    }
    int ascii = 0;
    final int start_length = outbuf.length();
    final int n = array.length;
    outbuf.ensureCapacity(start_length + n + 2);
    for (int i = 0; i < n; i++) {
      final byte b = array[i];
      if (' ' <= b && b <= '~') {
        ascii++;
        outbuf.append((char) b);
      } else if (b == '\n') {
        outbuf.append("\\n");
      } else {
        outbuf.append("\\x")
          .append((char) HEX[(b >>> 4) & 0x0F])
          .append((char) HEX[b & 0x0F]);
      }
    }
    if (ascii < n / 2) {
      outbuf.setLength(start_length);
      outbuf.append(Arrays.toString(array));
    }
  }

  /**
   * Pretty-prints a byte array into a human-readable string.
   * @param array The (possibly {@code null}) array to pretty-print.
   * @return The array in a pretty-printed string.
   */
  public static String pretty(final byte[] array) {
    if (array == null) {
      return "null";
    }
    final StringBuilder buf = new StringBuilder(array.length + 2);
    pretty(buf, array);
    return buf.toString();
  }
}
