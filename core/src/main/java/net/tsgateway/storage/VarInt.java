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

import java.io.ByteArrayOutputStream;

/**
 * Unsigned LEB128 variable length integers: 7 data bits per byte, the high
 * bit set on every byte but the last. At most 10 bytes encode a 64 bit
 * value.
 *
 * @since 3.0
 */
public final class VarInt {
  /** The longest valid encoding. */
  public static final int MAX_LENGTH = 10;

  /** Status of a read. */
  public static enum Status {
    /** A complete value was read. */
    OK,
    /** The buffer ended before the last byte. */
    NEED_MORE,
    /** The encoding is longer than 64 bits. */
    OVERFLOW
  }

  /** The outcome of a read. */
  public static final class Result {
    static final Result NEED_MORE = new Result(Status.NEED_MORE, 0, 0);
    static final Result OVERFLOW = new Result(Status.OVERFLOW, 0, 0);

    private final Status status;
    private final long value;
    private final int length;

    private Result(final Status status, final long value, final int length) {
      this.status = status;
      this.value = value;
      this.length = length;
    }

    public Status status() {
      return status;
    }

    /** @return The unsigned value, only valid if the status is OK. */
    public long value() {
      return value;
    }

    /** @return The number of bytes consumed, only valid if OK. */
    public int length() {
      return length;
    }

    public boolean isOk() {
      return status == Status.OK;
    }
  }

  private VarInt() {
    // static helpers
  }

  /**
   * Reads a value.
   * @param buf The buffer.
   * @param offset The offset of the first byte.
   * @param limit The offset one past the last readable byte.
   * @return The result, never null.
   */
  public static Result read(final byte[] buf, final int offset, final int limit) {
    long value = 0;
    int shift = 0;
    for (int i = 0; ; i++) {
      if (offset + i >= limit) {
        return i >= MAX_LENGTH ? Result.OVERFLOW : Result.NEED_MORE;
      }
      final int b = buf[offset + i] & 0xFF;
      if (b < 0x80) {
        if (i > 9 || (i == 9 && b > 1)) {
          return Result.OVERFLOW;
        }
        return new Result(Status.OK, value | ((long) b << shift), i + 1);
      }
      if (i >= MAX_LENGTH - 1) {
        return Result.OVERFLOW;
      }
      value |= (long) (b & 0x7F) << shift;
      shift += 7;
    }
  }

  /**
   * @param value An unsigned value.
   * @return The encoded length of the value.
   */
  public static int length(long value) {
    int length = 1;
    while ((value & ~0x7FL) != 0) {
      value >>>= 7;
      length++;
    }
    return length;
  }

  /**
   * Writes a value.
   * @param out The destination.
   * @param value The value, treated as unsigned.
   */
  public static void write(final ByteArrayOutputStream out, long value) {
    while ((value & ~0x7FL) != 0) {
      out.write((int) ((value & 0x7F) | 0x80));
      value >>>= 7;
    }
    out.write((int) value);
  }

  /**
   * Writes a value into a buffer.
   * @param buf The destination with at least {@link #length(long)} bytes
   * from the offset.
   * @param offset Where to write.
   * @param value The value, treated as unsigned.
   * @return The number of bytes written.
   */
  public static int write(final byte[] buf, final int offset, long value) {
    int i = offset;
    while ((value & ~0x7FL) != 0) {
      buf[i++] = (byte) ((value & 0x7F) | 0x80);
      value >>>= 7;
    }
    buf[i++] = (byte) value;
    return i - offset;
  }
}
