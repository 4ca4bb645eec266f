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
import java.nio.charset.StandardCharsets;

import net.tsgateway.utils.Bytes;

/**
 * Encodes RowBinary responses for tests.
 */
public class RowBinaryBuilder {
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final boolean aggregated;

  public RowBinaryBuilder(final boolean aggregated) {
    this.aggregated = aggregated;
  }

  /** Appends an aggregated row. */
  public RowBinaryBuilder row(final String name,
                              final long[] times,
                              final double[] values) {
    string(name);
    uint32s(times);
    doubles(values);
    return this;
  }

  /** Appends an unaggregated row. */
  public RowBinaryBuilder row(final String name,
                              final long[] times,
                              final double[] values,
                              final long[] timestamps) {
    string(name);
    uint32s(times);
    doubles(values);
    uint32s(timestamps);
    return this;
  }

  /** Appends a row of either shape, timestamps ignored when aggregated. */
  public RowBinaryBuilder row(final RawRow row) {
    if (aggregated) {
      return row(row.nameString(), row.times(), row.values());
    }
    return row(row.nameString(), row.times(), row.values(), row.timestamps());
  }

  public RowBinaryBuilder string(final String value) {
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    VarInt.write(out, bytes.length);
    out.write(bytes, 0, bytes.length);
    return this;
  }

  public RowBinaryBuilder uint32s(final long[] values) {
    VarInt.write(out, values.length);
    final byte[] buf = new byte[4];
    for (final long value : values) {
      Bytes.setIntLE(buf, value, 0);
      out.write(buf, 0, 4);
    }
    return this;
  }

  public RowBinaryBuilder doubles(final double[] values) {
    VarInt.write(out, values.length);
    final byte[] buf = new byte[8];
    for (final double value : values) {
      Bytes.setLongLE(buf, Double.doubleToRawLongBits(value), 0);
      out.write(buf, 0, 8);
    }
    return this;
  }

  public RowBinaryBuilder raw(final byte... bytes) {
    out.write(bytes, 0, bytes.length);
    return this;
  }

  public byte[] build() {
    return out.toByteArray();
  }
}
