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

/**
 * A reduction of a contiguous batch of values into one, used both to
 * consolidate points falling into the same time bucket and, by name, inside
 * storage queries that downsample on the server.
 * <p>
 * Implementations are stateless and shared.
 *
 * @since 3.0
 */
public interface AggregationFunction {

  /** @return The canonical name, also the storage side function prefix. */
  public String name();

  /** @return The consolidation name reported to Graphite clients. */
  public String graphiteName();

  /**
   * Reduces {@code values[start]} through {@code values[end - 1]}.
   * @param values The values array.
   * @param start The first index, inclusive.
   * @param end The last index, exclusive.
   * @return The reduced value.
   */
  public double apply(final double[] values, final int start, final int end);
}
