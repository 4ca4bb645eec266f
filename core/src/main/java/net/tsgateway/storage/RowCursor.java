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
package net.tsgateway.storage;

import java.util.Arrays;

import net.tsgateway.exceptions.MalformedResponseException;
import net.tsgateway.utils.Bytes;

/**
 * A bounds checked little endian reader over a window of a byte array.
 * Reading past the window throws a {@link MalformedResponseException}
 * carrying the window's bytes.
 *
 * @since 3.0
 */
public class RowCursor {
  private final byte[] buf;
  private final int start;
  private final int limit;
  private int position;

  /**
   * Default ctor.
   * @param buf The non-null buffer.
   * @param offset The first byte of the window.
   * @param length The window length.
   */
  public RowCursor(final byte[] buf, final int offset, final int length) {
    if (buf == null) {
      throw new IllegalArgumentException("Buffer cannot be null.");
    }
    if (offset < 0 || length < 0 || offset + length > buf.length) {
      throw new IllegalArgumentException("Window [" + offset + ", "
          + (offset + length) + ") is outside the buffer of " + buf.length);
    }
    this.buf = buf;
    start = offset;
    limit = offset + length;
    position = offset;
  }

  /** @return Bytes read so far. */
  public int position() {
    return position - start;
  }

  /** @return Bytes left in the window. */
  public int remaining() {
    return limit - position;
  }

  /** @return An unsigned LEB128 value. */
  public long readUvarint() {
    final VarInt.Result result = VarInt.read(buf, position, limit);
    if (!result.isOk()) {
      throw malformed("Unreadable varint (" + result.status() + ")");
    }
    position += result.length();
    return result.value();
  }

  /**
   * Reads a length prefix that must fit the remaining window given the
   * element width.
   * @param width The element width in bytes.
   * @return The element count.
   */
  public int readCount(final int width) {
    final long count = readUvarint();
    if (count < 0 || count > Integer.MAX_VALUE || count * width > remaining()) {
      throw malformed("Length " + count + " x " + width
          + " exceeds the remaining " + remaining() + " bytes");
    }
    return (int) count;
  }

  /** @return A copy of the next {@code length} bytes. */
  public byte[] readBytes(final int length) {
    ensure(length);
    final byte[] out = Arrays.copyOfRange(buf, position, position + length);
    position += length;
    return out;
  }

  /** @return A 4 byte little endian unsigned integer. */
  public long readUnsignedIntLE() {
    ensure(4);
    final long value = Bytes.getUnsignedIntLE(buf, position);
    position += 4;
    return value;
  }

  /** @return An 8 byte little endian IEEE 754 double. */
  public double readDoubleLE() {
    ensure(8);
    final double value = Double.longBitsToDouble(Bytes.getLongLE(buf, position));
    position += 8;
    return value;
  }

  /**
   * @param count The number of elements.
   * @return The unsigned integers.
   */
  public long[] readUnsignedIntsLE(final int count) {
    ensure((long) count * 4);
    final long[] out = new long[count];
    for (int i = 0; i < count; i++) {
      out[i] = Bytes.getUnsignedIntLE(buf, position);
      position += 4;
    }
    return out;
  }

  /**
   * @param count The number of elements.
   * @return The doubles.
   */
  public double[] readDoublesLE(final int count) {
    ensure((long) count * 8);
    final double[] out = new double[count];
    for (int i = 0; i < count; i++) {
      out[i] = Double.longBitsToDouble(Bytes.getLongLE(buf, position));
      position += 8;
    }
    return out;
  }

  private void ensure(final long length) {
    if (length < 0 || length > remaining()) {
      throw malformed("Read of " + length + " bytes at " + position()
          + " exceeds the remaining " + remaining() + " bytes");
    }
  }

  private MalformedResponseException malformed(final String msg) {
    return new MalformedResponseException(msg,
        Arrays.copyOfRange(buf, start, limit));
  }
}
