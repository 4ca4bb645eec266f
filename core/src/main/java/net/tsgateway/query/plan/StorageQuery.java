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
package net.tsgateway.query.plan;

import java.util.Collections;
import java.util.List;

import net.tsgateway.data.AggregationFunction;
import net.tsgateway.storage.ExternalTable;

/**
 * One storage round trip of a plan: the query text and the metric list it
 * scans.
 *
 * @since 3.0
 */
public final class StorageQuery {
  private final AggregationFunction function;
  private final List<String> metrics;
  private final String text;
  private final ExternalTable table;

  /**
   * Default ctor.
   * @param function The function storage reduces with, null when storage
   * returns raw points.
   * @param metrics The logical metric names covered.
   * @param text The query text.
   * @param table The metric list payload.
   */
  StorageQuery(final AggregationFunction function,
               final List<String> metrics,
               final String text,
               final ExternalTable table) {
    this.function = function;
    this.metrics = Collections.unmodifiableList(metrics);
    this.text = text;
    this.table = table;
  }

  /** @return The storage side function or null if unaggregated. */
  public AggregationFunction function() {
    return function;
  }

  /** @return The logical metric names covered. */
  public List<String> metrics() {
    return metrics;
  }

  /** @return The query text. */
  public String text() {
    return text;
  }

  /** @return The metric list payload. */
  public ExternalTable table() {
    return table;
  }

  @Override
  public String toString() {
    return "{function=" + (function == null ? "none" : function.name())
        + ", metrics=" + metrics.size() + ", query=" + text + "}";
  }
}
