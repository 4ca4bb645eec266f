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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.tsgateway.data.AggregationFunction;
import net.tsgateway.data.MetricAlias;
import net.tsgateway.data.TargetGroup;
import net.tsgateway.data.TimeFrame;
import net.tsgateway.exceptions.StepResolutionException;
import net.tsgateway.rollup.RollupResolver;
import net.tsgateway.storage.ExternalTable;
import net.tsgateway.utils.DateTime;
import net.tsgateway.utils.ReversePath;
import net.tsgateway.utils.StepMath;

/**
 * Turns a target group and a time frame into storage queries.
 * <p>
 * Every metric is looked up in the group's rollup rules with the age of the
 * requested data. A consolidation requested by any target the metric is
 * aliased to overrides the rule's function.
 * <ul>
 * <li><b>Unaggregated</b>: storage returns raw points for all metrics in one
 * query. The bounds are aligned to the largest metric precision and each
 * metric keeps its own precision for the rollup.</li>
 * <li><b>Aggregated</b>: storage downsamples, so there is one query per
 * function. The group contributes the LCM of its per-function maximum
 * precisions to the request's {@link CommonStepResolver}; the final step is
 * the common step, coarsened to a multiple of it when the point budget asks
 * for fewer points.</li>
 * </ul>
 * Bounds are aligned the same way in both modes: {@code from} down and
 * {@code until} up to a multiple of the step, both inclusive.
 *
 * @since 3.0
 */
public class QueryPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(QueryPlanner.class);

  /** Recorded against targets whose consolidation overrode the rules. */
  public static final String CONSOLIDATE_BY = "consolidateBy";

  /**
   * Storage side downsampling: from, stop, step, function, table, prewhere,
   * where. {@code -Resample} excludes its stop, so the stop is one past the
   * inclusive until. Empty buckets come back as zero times and are filtered
   * out.
   */
  static final String AGGREGATED_QUERY =
      "WITH anyResample(%1$d, %2$d, %3$d)(toUInt32(intDiv(Time, %3$d)*%3$d), Time) AS mask\n"
      + "SELECT Path,\n"
      + " arrayFilter(m->m!=0, mask) AS times,\n"
      + " arrayFilter((v,m)->m!=0, %4$sResample(%1$d, %2$d, %3$d)(Value, Time), mask) AS values\n"
      + "FROM %5$s\n"
      + "%6$s\n"
      + "%7$s\n"
      + "GROUP BY Path\n"
      + "FORMAT RowBinary";

  /** Raw points: table, prewhere, where. */
  static final String UNAGGREGATED_QUERY =
      "SELECT Path, groupArray(Time), groupArray(Value), groupArray(Timestamp)\n"
      + "FROM %1$s\n"
      + "%2$s\n"
      + "%3$s\n"
      + "GROUP BY Path\n"
      + "FORMAT RowBinary";

  private final boolean aggregated;
  private final DayFormat day_format;

  /**
   * Default ctor.
   * @param aggregated Whether storage downsamples.
   * @param day_format How the writer derived the Date column.
   */
  public QueryPlanner(final boolean aggregated, final DayFormat day_format) {
    if (day_format == null) {
      throw new IllegalArgumentException("Day format cannot be null.");
    }
    this.aggregated = aggregated;
    this.day_format = day_format;
  }

  /** @return Whether storage downsamples. */
  public boolean aggregated() {
    return aggregated;
  }

  /**
   * Plans the group against the wall clock.
   * @see #plan(TimeFrame, TargetGroup, CommonStepResolver, long)
   */
  public QueryPlan plan(final TimeFrame time_frame,
                        final TargetGroup group,
                        final CommonStepResolver resolver) {
    return plan(time_frame, group, resolver,
        DateTime.currentTimeMillis() / 1000);
  }

  /**
   * Plans the group. When aggregated, the caller must have registered this
   * call as a participant of the resolver; it arrives exactly once, even on
   * failure.
   * @param time_frame The non-null time frame.
   * @param group The non-null group.
   * @param resolver The request's resolver. Required when aggregated,
   * ignored otherwise.
   * @param now The current epoch time in seconds.
   * @return The plan, empty if the group has no metrics.
   * @throws StepResolutionException if the common step could not be
   * resolved in time.
   */
  public QueryPlan plan(final TimeFrame time_frame,
                        final TargetGroup group,
                        final CommonStepResolver resolver,
                        final long now) {
    if (aggregated && resolver == null) {
      throw new IllegalArgumentException("A step resolver is required when "
          + "storage aggregates.");
    }
    if (group.metricNames().isEmpty()) {
      if (aggregated) {
        resolver.doneWithoutContribution();
      }
      return QueryPlan.empty(time_frame, group, aggregated);
    }

    boolean arrived = false;
    try {
      final long age = Math.max(0, now - time_frame.from());
      final RollupResolver rules = group.rollupRules();
      final Map<String, Long> steps = new LinkedHashMap<String, Long>();
      final Map<String, AggregationFunction> functions =
          new LinkedHashMap<String, AggregationFunction>();
      final Map<AggregationFunction, List<String>> aggregations =
          new LinkedHashMap<AggregationFunction, List<String>>();
      final Map<AggregationFunction, List<String>> payloads =
          new LinkedHashMap<AggregationFunction, List<String>>();
      final Map<AggregationFunction, Long> group_steps =
          new LinkedHashMap<AggregationFunction, Long>();
      final Map<String, List<String>> applied =
          new LinkedHashMap<String, List<String>>();
      final List<String> all_requested = Lists.newArrayList();
      long max_step = 1;

      for (final String metric : group.metricNames()) {
        final String requested = group.reversed()
            ? ReversePath.reverse(metric) : metric;
        final String lookup = group.useRevertedLookup() ? metric : requested;
        final RollupResolver.Resolution resolution = rules.lookup(lookup, age);
        AggregationFunction function = resolution.function();
        for (final MetricAlias alias : group.aliases(metric)) {
          final AggregationFunction consolidation =
              group.consolidation(alias.target());
          if (consolidation != null) {
            function = consolidation;
            applied.put(alias.target(),
                Collections.singletonList(CONSOLIDATE_BY));
            break;
          }
        }
        final long precision = Math.max(1, resolution.precision());

        functions.put(metric, function);
        if (!aggregated) {
          steps.put(metric, precision);
        }
        add(aggregations, function, metric);
        add(payloads, function, requested);
        all_requested.add(requested);
        final Long group_step = group_steps.get(function);
        group_steps.put(function, group_step == null
            ? precision : Math.max(group_step, precision));
        max_step = Math.max(max_step, precision);
      }

      final long step;
      if (aggregated) {
        long contribution = 0;
        for (final long group_step : group_steps.values()) {
          contribution = StepMath.lcm(contribution, group_step);
        }
        arrived = true;
        resolver.contribute(contribution);
        step = finalStep(time_frame, resolver.getResult());
      } else {
        step = max_step;
      }

      final long from = StepMath.floorToMultiple(time_frame.from(), step);
      final long until = StepMath.ceilToMultiple(time_frame.until(), step);
      final String prewhere = new Where()
          .and(Where.dateBetween("Date", from, until, day_format))
          .preWhereSql();
      final String where = new Where()
          .and(Where.inTable("Path", ExternalTable.METRICS_LIST))
          .and(Where.timestampBetween("Time", from, until))
          .sql();

      final List<StorageQuery> queries = Lists.newArrayList();
      if (aggregated) {
        for (final Map.Entry<AggregationFunction, List<String>> entry :
            aggregations.entrySet()) {
          final AggregationFunction function = entry.getKey();
          queries.add(new StorageQuery(function, entry.getValue(),
              String.format(AGGREGATED_QUERY, from, until + 1, step, function.name(),
                  group.storageTable(), prewhere, where),
              ExternalTable.metricsList(payloads.get(function))));
        }
      } else {
        queries.add(new StorageQuery(null, group.metricNames(),
            String.format(UNAGGREGATED_QUERY, group.storageTable(), prewhere,
                where),
            ExternalTable.metricsList(all_requested)));
      }

      final QueryPlan plan = new QueryPlan(time_frame, group, aggregated, step,
          from, until, steps, functions, aggregations, applied, queries);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Planned " + plan);
      }
      return plan;
    } finally {
      if (aggregated && !arrived) {
        resolver.doneWithoutContribution();
      }
    }
  }

  /**
   * @param time_frame The time frame.
   * @param common_step The resolver's answer.
   * @return The common step, coarsened to fit the point budget.
   * @throws StepResolutionException if the resolver failed.
   */
  static long finalStep(final TimeFrame time_frame, final long common_step) {
    if (common_step == CommonStepResolver.FAILED) {
      throw new StepResolutionException("Timed out resolving the common "
          + "step for " + time_frame);
    }
    final long common = Math.max(1, common_step);
    if (time_frame.maxDataPoints() <= 0) {
      return common;
    }
    final long budget = StepMath.ceilDiv(time_frame.until() - time_frame.from(),
        time_frame.maxDataPoints());
    return StepMath.ceilToMultiple(Math.max(common, budget), common);
  }

  private static void add(final Map<AggregationFunction, List<String>> map,
                          final AggregationFunction function,
                          final String value) {
    List<String> list = map.get(function);
    if (list == null) {
      list = Lists.newArrayList();
      map.put(function, list);
    }
    list.add(value);
  }
}
