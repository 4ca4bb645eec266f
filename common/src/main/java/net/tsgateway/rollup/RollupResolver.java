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
package net.tsgateway.rollup;

import net.tsgateway.data.AggregationFunction;

/**
 * Resolves the precision and aggregation function a metric is stored with
 * for data of a given age. Implementations must be safe for concurrent reads
 * and total: every name and age resolves to exactly one answer.
 *
 * @since 3.0
 */
public interface RollupResolver {

  /**
   * @param metric The metric name as stored, tagged or not.
   * @param age The age of the data, {@code now - from}, in seconds.
   * @return The resolution, never null.
   */
  public Resolution lookup(final String metric, final long age);

  /**
   * The precision and aggregation function for one metric and age.
   */
  public static final class Resolution {
    private final long precision;
    private final AggregationFunction function;

    /**
     * Default ctor.
     * @param precision The bucket width in seconds, positive.
     * @param function The non-null function.
     */
    public Resolution(final long precision, final AggregationFunction function) {
      this.precision = precision;
      this.function = function;
    }

    /** @return The bucket width in seconds. */
    public long precision() {
      return precision;
    }

    /** @return The aggregation function. */
    public AggregationFunction function() {
      return function;
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Resolution)) {
        return false;
      }
      final Resolution other = (Resolution) o;
      return precision == other.precision && function == other.function;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(precision) * 31 + function.hashCode();
    }

    @Override
    public String toString() {
      return "{precision=" + precision + ", function=" + function.name() + "}";
    }
  }
}
