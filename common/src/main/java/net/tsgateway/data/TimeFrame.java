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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The time range and point budget of a render request. Target groups with an
 * equal time frame are fetched as one batch.
 *
 * @since 3.0
 */
public final class TimeFrame {
  private final long from;
  private final long until;
  private final long max_data_points;

  /**
   * Default ctor.
   * @param from The start in epoch seconds.
   * @param until The end in epoch seconds, not before {@code from}.
   * @param max_data_points The requested number of points, 0 for no limit.
   * @throws IllegalArgumentException if the values are negative or
   * {@code until < from}.
   */
  public TimeFrame(final long from,
                   final long until,
                   final long max_data_points) {
    Preconditions.checkArgument(from >= 0, "From cannot be negative.");
    Preconditions.checkArgument(until >= from, "Until cannot be before from.");
    Preconditions.checkArgument(max_data_points >= 0,
        "Max data points cannot be negative.");
    this.from = from;
    this.until = until;
    this.max_data_points = max_data_points;
  }

  /** @return The start in epoch seconds. */
  public long from() {
    return from;
  }

  /** @return The end in epoch seconds. */
  public long until() {
    return until;
  }

  /** @return The requested number of points. */
  public long maxDataPoints() {
    return max_data_points;
  }

  /**
   * @param max_data_points A new point budget.
   * @return A copy with the budget replaced.
   */
  public TimeFrame withMaxDataPoints(final long max_data_points) {
    return new TimeFrame(from, until, max_data_points);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeFrame)) {
      return false;
    }
    final TimeFrame other = (TimeFrame) o;
    return from == other.from
        && until == other.until
        && max_data_points == other.max_data_points;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(from, until, max_data_points);
  }

  @Override
  public String toString() {
    return "{from=" + from + ", until=" + until
        + ", maxDataPoints=" + max_data_points + "}";
  }
}
