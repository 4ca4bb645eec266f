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
package net.tsgateway.data;

import java.util.Objects;

/**
 * A snapshot of one point of a {@link PointStore}. The store itself keeps its
 * points in parallel arrays, this is only handed out for reading.
 *
 * @since 3.0
 */
public final class Point {
  private final int metric_id;
  private final double value;
  private final long time;
  private final long timestamp;

  /**
   * Default ctor.
   * @param metric_id The store specific metric ID, 1 based.
   * @param value The value.
   * @param time The bucket time in epoch seconds.
   * @param timestamp The ingest version of the point.
   */
  public Point(final int metric_id,
               final double value,
               final long time,
               final long timestamp) {
    this.metric_id = metric_id;
    this.value = value;
    this.time = time;
    this.timestamp = timestamp;
  }

  /** @return The store specific metric ID. */
  public int metricId() {
    return metric_id;
  }

  /** @return The value. */
  public double value() {
    return value;
  }

  /** @return The time in epoch seconds. */
  public long time() {
    return time;
  }

  /** @return The ingest version used as the dedup tie breaker. */
  public long timestamp() {
    return timestamp;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Point)) {
      return false;
    }
    final Point other = (Point) o;
    return metric_id == other.metric_id
        && Double.compare(value, other.value) == 0
        && time == other.time
        && timestamp == other.timestamp;
  }

  @Override
  public int hashCode() {
    return Objects.hash(metric_id, value, time, timestamp);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{metricId=")
        .append(metric_id)
        .append(", value=")
        .append(value)
        .append(", time=")
        .append(time)
        .append(", timestamp=")
        .append(timestamp)
        .append("}")
        .toString();
  }
}
