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

/**
 * Finds row boundaries in a partially filled buffer of a RowBinary
 * response. A row is
 * <pre>
 * varint name_len, name
 * varint n, n x uint32 times
 * varint n, n x float64 values
 * [varint n, n x uint32 timestamps]   unaggregated only
 * </pre>
 * The splitter only measures; it never consumes.
 *
 * @since 3.0
 */
public final class RowSplitter {
  /** The buffer holds an incomplete row and the input isn't done. */
  public static final int NEED_MORE = -1;

  /** The input is done and the buffer is empty. */
  public static final int END = 0;

  private final boolean aggregated;

  /**
   * Default ctor.
   * @param aggregated Whether rows lack the timestamps array.
   */
  public RowSplitter(final boolean aggregated) {
    this.aggregated = aggregated;
  }

  public boolean aggregated() {
    return aggregated;
  }

  /**
   * Measures the next row.
   * @param buf The buffer.
   * @param offset The offset of the row start.
   * @param length The number of valid bytes from the offset.
   * @param at_eof Whether no more bytes will follow.
   * @return The row length if a complete row is present, {@link #NEED_MORE}
   * or {@link #END}.
   * @throws MalformedResponseException if the row is truncated at the end of
   * input, a varint is unreadable or the array lengths disagree.
   */
  public int split(final byte[] buf,
                   final int offset,
                   final int length,
                   final boolean at_eof) {
    if (length == 0 && at_eof) {
      return END;
    }
    final int limit = offset + length;
    long position = offset;

    // name
    VarInt.Result result = VarInt.read(buf, (int) position, limit);
    if (!result.isOk()) {
      return incomplete(result, buf, offset, length, at_eof);
    }
    position += result.length() + checkLength(result, buf, offset, length);
    if (position > limit) {
      return incomplete(null, buf, offset, length, at_eof);
    }

    // times
    result = VarInt.read(buf, (int) position, limit);
    if (!result.isOk()) {
      return incomplete(result, buf, offset, length, at_eof);
    }
    final long times = checkLength(result, buf, offset, length);
    position += result.length() + times * 4;
    if (position > limit) {
      return incomplete(null, buf, offset, length, at_eof);
    }

    // values
    result = VarInt.read(buf, (int) position, limit);
    if (!result.isOk()) {
      return incomplete(result, buf, offset, length, at_eof);
    }
    final long values = checkLength(result, buf, offset, length);
    if (values != times) {
      throw new MalformedResponseException("Different amount of times ("
          + times + ") and values (" + values + ")",
          copy(buf, offset, length));
    }
    position += result.length() + values * 8;
    if (position > limit) {
      return incomplete(null, buf, offset, length, at_eof);
    }

    if (!aggregated) {
      result = VarInt.read(buf, (int) position, limit);
      if (!result.isOk()) {
        return incomplete(result, buf, offset, length, at_eof);
      }
      final long timestamps = checkLength(result, buf, offset, length);
      if (timestamps != times) {
        throw new MalformedResponseException("Different amount of times ("
            + times + ") and timestamps (" + timestamps + ")",
            copy(buf, offset, length));
      }
      position += result.length() + timestamps * 4;
      if (position > limit) {
        return incomplete(null, buf, offset, length, at_eof);
      }
    }
    return (int) (position - offset);
  }

  /**
   * Decodes a complete row measured by {@link #split}.
   * @param buf The buffer.
   * @param offset The row start.
   * @param length The row length.
   * @return The row.
   */
  public RawRow decode(final byte[] buf, final int offset, final int length) {
    final RowCursor cursor = new RowCursor(buf, offset, length);
    final byte[] name = cursor.readBytes(cursor.readCount(1));
    final long[] times = cursor.readUnsignedIntsLE(cursor.readCount(4));
    final double[] values = cursor.readDoublesLE(cursor.readCount(8));
    final long[] timestamps = aggregated
        ? times : cursor.readUnsignedIntsLE(cursor.readCount(4));
    if (values.length != times.length || timestamps.length != times.length) {
      throw new MalformedResponseException("Array lengths differ",
          copy(buf, offset, length));
    }
    if (cursor.remaining() != 0) {
      throw new MalformedResponseException(cursor.remaining()
          + " trailing bytes in row", copy(buf, offset, length));
    }
    return new RawRow(name, times, values, timestamps);
  }

  private static long checkLength(final VarInt.Result result,
                                  final byte[] buf,
                                  final int offset,
                                  final int length) {
    if (result.value() < 0 || result.value() > Integer.MAX_VALUE) {
      throw new MalformedResponseException("Length out of range: "
          + Long.toUnsignedString(result.value()), copy(buf, offset, length));
    }
    return result.value();
  }

  private static int incomplete(final VarInt.Result result,
                                final byte[] buf,
                                final int offset,
                                final int length,
                                final boolean at_eof) {
    if (result != null && result.status() == VarInt.Status.OVERFLOW) {
      throw new MalformedResponseException("Varint overflow",
          copy(buf, offset, length));
    }
    if (at_eof) {
      throw new MalformedResponseException("Truncated row at end of response",
          copy(buf, offset, length));
    }
    return NEED_MORE;
  }

  private static byte[] copy(final byte[] buf, final int offset, final int length) {
    return Arrays.copyOfRange(buf, offset, offset + length);
  }
}
