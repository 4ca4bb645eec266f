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
package net.tsgateway.exceptions;

import net.tsgateway.utils.Bytes;

/**
 * Thrown when the storage row stream can't be decoded: a truncated final row,
 * an unreadable varint or arrays of different lengths. Fatal for the one
 * storage query that produced it. The raw bytes of the offending row are kept
 * for diagnostics.
 *
 * @since 3.0
 */
public class MalformedResponseException extends QueryExecutionException {
  private static final long serialVersionUID = 4455286913512300318L;

  /** Show at most this many bytes of the row in messages. */
  private static final int MAX_PRINTED = 256;

  /** The raw row, may be empty. */
  private final byte[] row;

  /**
   * Default ctor.
   * @param msg A non-null message.
   * @param row The raw bytes of the row being decoded. May be null.
   */
  public MalformedResponseException(final String msg, final byte[] row) {
    super(msg, 502);
    this.row = row == null ? new byte[0] : row;
  }

  /** @return The raw bytes of the row that failed to decode. */
  public byte[] getRow() {
    return row;
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.MALFORMED_UPSTREAM;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(super.toString())
        .append(" row=\"");
    if (row.length > MAX_PRINTED) {
      final byte[] head = new byte[MAX_PRINTED];
      System.arraycopy(row, 0, head, 0, MAX_PRINTED);
      Bytes.pretty(buf, head);
      buf.append("...(")
         .append(row.length)
         .append(" bytes)");
    } else {
      Bytes.pretty(buf, row);
    }
    return buf.append("\"").toString();
  }
}
