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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * One decoded row of a storage response: a metric name and its parallel
 * arrays. In aggregated responses the timestamps are the times.
 *
 * @since 3.0
 */
public final class RawRow {
  private final byte[] name;
  private final long[] times;
  private final double[] values;
  private final long[] timestamps;

  /**
   * Default ctor. Arrays are not copied.
   * @param name The raw metric name.
   * @param times Times in epoch seconds.
   * @param values The values.
   * @param timestamps Ingest versions, same length as the times.
   */
  public RawRow(final byte[] name,
                final long[] times,
                final double[] values,
                final long[] timestamps) {
    this.name = name;
    this.times = times;
    this.values = values;
    this.timestamps = timestamps;
  }

  public byte[] name() {
    return name;
  }

  /** @return The name decoded as UTF-8. */
  public String nameString() {
    return new String(name, StandardCharsets.UTF_8);
  }

  public long[] times() {
    return times;
  }

  public double[] values() {
    return values;
  }

  public long[] timestamps() {
    return timestamps;
  }

  /** @return The number of points. */
  public int size() {
    return times.length;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawRow)) {
      return false;
    }
    final RawRow other = (RawRow) o;
    return Arrays.equals(name, other.name)
        && Arrays.equals(times, other.times)
        && Arrays.equals(values, other.values)
        && Arrays.equals(timestamps, other.timestamps);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(name) * 31 + Arrays.hashCode(times);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{name=")
        .append(nameString())
        .append(", times=")
        .append(Arrays.toString(times))
        .append(", values=")
        .append(Arrays.toString(values))
        .append(", timestamps=")
        .append(Arrays.toString(timestamps))
        .append("}")
        .toString();
  }
}
