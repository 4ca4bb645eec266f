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
import java.util.Map;

import net.tsgateway.data.AggregationFunction;
import net.tsgateway.data.PointStore;
import net.tsgateway.data.TargetGroup;
import net.tsgateway.data.TimeFrame;

/**
 * How one target group is fetched for one time frame: the storage queries,
 * the aligned bounds and step, and the step and function each metric ends
 * up with. Built by the {@link QueryPlanner} and discarded after the fetch.
 *
 * @since 3.0
 */
public final class QueryPlan {
  private final TimeFrame time_frame;
  private final TargetGroup group;
  private final boolean aggregated;
  private final long step;
  private final long from;
  private final long until;
  private final Map<String, Long> steps;
  private final Map<String, AggregationFunction> functions;
  private final Map<AggregationFunction, List<String>> aggregations;
  private final Map<String, List<String>> applied_functions;
  private final List<StorageQuery> queries;

  QueryPlan(final TimeFrame time_frame,
            final TargetGroup group,
            final boolean aggregated,
            final long step,
            final long from,
            final long until,
            final Map<String, Long> steps,
            final Map<String, AggregationFunction> functions,
            final Map<AggregationFunction, List<String>> aggregations,
            final Map<String, List<String>> applied_functions,
            final List<StorageQuery> queries) {
    this.time_frame = time_frame;
    this.group = group;
    this.aggregated = aggregated;
    this.step = step;
    this.from = from;
    this.until = until;
    this.steps = Collections.unmodifiableMap(steps);
    this.functions = Collections.unmodifiableMap(functions);
    this.aggregations = Collections.unmodifiableMap(aggregations);
    this.applied_functions = Collections.unmodifiableMap(applied_functions);
    this.queries = Collections.unmodifiableList(queries);
  }

  /**
   * @param time_frame The time frame.
   * @param group The group without metrics.
   * @param aggregated Whether storage downsamples.
   * @return A plan without queries.
   */
  static QueryPlan empty(final TimeFrame time_frame,
                         final TargetGroup group,
                         final boolean aggregated) {
    return new QueryPlan(time_frame, group, aggregated, 0, time_frame.from(),
        time_frame.until(), Collections.<String, Long>emptyMap(),
        Collections.<String, AggregationFunction>emptyMap(),
        Collections.<AggregationFunction, List<String>>emptyMap(),
        Collections.<String, List<String>>emptyMap(),
        Collections.<StorageQuery>emptyList());
  }

  /** @return Whether there's nothing to fetch. */
  public boolean isEmpty() {
    return queries.isEmpty();
  }

  /** @return The requested time frame. */
  public TimeFrame timeFrame() {
    return time_frame;
  }

  /** @return The target group. */
  public TargetGroup group() {
    return group;
  }

  /** @return Whether storage downsamples. */
  public boolean aggregated() {
    return aggregated;
  }

  /**
   * @return The step the bounds are aligned to: the common step when
   * aggregated, the largest metric step otherwise. 0 for empty plans.
   */
  public long step() {
    return step;
  }

  /** @return The aligned start in epoch seconds. */
  public long from() {
    return from;
  }

  /** @return The aligned, inclusive end in epoch seconds. */
  public long until() {
    return until;
  }

  /** @return Each metric's own precision. Empty when aggregated. */
  public Map<String, Long> steps() {
    return steps;
  }

  /** @return Each metric's function. */
  public Map<String, AggregationFunction> functions() {
    return functions;
  }

  /** @return Metrics grouped by function, in first seen order. */
  public Map<AggregationFunction, List<String>> aggregations() {
    return aggregations;
  }

  /**
   * @return Target expression to the functions applied on its behalf, for
   * targets that requested a consolidation.
   */
  public Map<String, List<String>> appliedFunctions() {
    return applied_functions;
  }

  /** @return The storage queries. */
  public List<StorageQuery> queries() {
    return queries;
  }

  /** @return All logical metric names of the plan. */
  public List<String> metrics() {
    return group.metricNames();
  }

  /**
   * Records the steps and functions of the plan in a store filled from it.
   * Metrics the plan doesn't know are left for the rollup rules.
   * @param store The non-null store.
   */
  public void assign(final PointStore store) {
    if (aggregated) {
      store.setCommonStep(step);
    }
    for (final String metric : store.metricNames()) {
      final int id = store.metricId(metric);
      final Long metric_step = steps.get(metric);
      if (metric_step != null) {
        store.setStep(id, metric_step);
      }
      final AggregationFunction function = functions.get(metric);
      if (function != null) {
        store.setAggregation(id, function);
      }
    }
  }

  @Override
  public String toString() {
    return "{timeFrame=" + time_frame + ", table=" + group.storageTable()
        + ", aggregated=" + aggregated + ", step=" + step + ", from=" + from
        + ", until=" + until + ", queries=" + queries.size() + "}";
  }
}
