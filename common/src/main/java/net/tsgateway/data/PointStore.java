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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import net.tsgateway.exceptions.IllegalDataException;
import net.tsgateway.rollup.RollupResolver;
import net.tsgateway.utils.DateTime;

/**
 * A columnar collection of decoded points for one fetch. Metric names are
 * interned into dense IDs starting at 1, ID 0 marks a removed point. Each
 * metric may carry an assigned step and aggregation function set by the
 * planner.
 * <p>
 * Consolidation must run in order: {@link #sort()}, then {@link #uniq()},
 * then {@link #rollupPoints(long, long, RollupResolver)}.
 * <p>
 * <b>Not thread safe</b>. The owner serializes appends.
 *
 * @since 3.0
 */
public class PointStore {
  private static final Logger LOG = LoggerFactory.getLogger(PointStore.class);

  private static final int DEFAULT_CAPACITY = 64;
  private static final int INSERTION_SORT_THRESHOLD = 16;

  /** Name to ID. */
  private final Map<String, Integer> name_to_id;

  /** ID to name, index 0 is unused. */
  private final List<String> id_to_name;

  private int[] metric_ids;
  private double[] values;
  private long[] times;
  private long[] timestamps;
  private int size;

  /** Per metric step, indexed by ID. 0 means unassigned. */
  private long[] steps;

  /** Per metric function, indexed by ID. Null means unassigned. */
  private AggregationFunction[] aggregations;

  /** The step shared by all metrics when storage downsampled. 0 if unset. */
  private long common_step;

  /** Default ctor. */
  public PointStore() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Ctor with an initial point capacity.
   * @param capacity The initial capacity, at least 1.
   */
  public PointStore(final int capacity) {
    Preconditions.checkArgument(capacity > 0, "Capacity must be positive.");
    name_to_id = new HashMap<String, Integer>();
    id_to_name = new ArrayList<String>();
    id_to_name.add(null);
    metric_ids = new int[capacity];
    values = new double[capacity];
    times = new long[capacity];
    timestamps = new long[capacity];
    steps = new long[8];
    aggregations = new AggregationFunction[8];
  }

  /**
   * Returns the ID for the metric, assigning the next one on first sight.
   * @param name A non-null metric name.
   * @return The ID, 1 or greater.
   */
  public int intern(final String name) {
    final Integer existing = name_to_id.get(name);
    if (existing != null) {
      return existing;
    }
    final int id = id_to_name.size();
    id_to_name.add(name);
    name_to_id.put(name, id);
    if (id >= steps.length) {
      final int capacity = Math.max(steps.length * 2, id + 1);
      steps = Arrays.copyOf(steps, capacity);
      aggregations = Arrays.copyOf(aggregations, capacity);
    }
    return id;
  }

  /**
   * @param name A metric name.
   * @return The ID of the metric or 0 if it was never interned.
   */
  public int metricId(final String name) {
    final Integer id = name_to_id.get(name);
    return id == null ? 0 : id;
  }

  /**
   * @param id An ID returned by {@link #intern(String)}.
   * @return The metric name.
   * @throws IllegalDataException if the ID was never assigned.
   */
  public String metricName(final int id) {
    checkId(id);
    return id_to_name.get(id);
  }

  /** @return The number of distinct metrics interned. */
  public int metricCount() {
    return id_to_name.size() - 1;
  }

  /** @return The interned names in ID order. */
  public List<String> metricNames() {
    return Collections.unmodifiableList(id_to_name.subList(1, id_to_name.size()));
  }

  /**
   * Appends a point.
   * @param metric_id An interned metric ID.
   * @param value The value.
   * @param time The time in epoch seconds.
   * @param timestamp The ingest version.
   */
  public void appendPoint(final int metric_id,
                          final double value,
                          final long time,
                          final long timestamp) {
    checkId(metric_id);
    if (size == metric_ids.length) {
      final int capacity = metric_ids.length * 2;
      metric_ids = Arrays.copyOf(metric_ids, capacity);
      values = Arrays.copyOf(values, capacity);
      times = Arrays.copyOf(times, capacity);
      timestamps = Arrays.copyOf(timestamps, capacity);
    }
    metric_ids[size] = metric_id;
    values[size] = value;
    times[size] = time;
    timestamps[size] = timestamp;
    size++;
  }

  /** @return The number of points. */
  public int size() {
    return size;
  }

  /**
   * @param index A point index.
   * @return A snapshot of the point.
   */
  public Point get(final int index) {
    Preconditions.checkElementIndex(index, size);
    return new Point(metric_ids[index], values[index], times[index],
        timestamps[index]);
  }

  /** @return A snapshot of all points in current order. */
  public List<Point> points() {
    final List<Point> points = new ArrayList<Point>(size);
    for (int i = 0; i < size; i++) {
      points.add(new Point(metric_ids[i], values[i], times[i], timestamps[i]));
    }
    return points;
  }

  /**
   * @param id A metric ID.
   * @param step The assigned step in seconds.
   */
  public void setStep(final int id, final long step) {
    checkId(id);
    steps[id] = step;
  }

  /**
   * @param id A metric ID.
   * @return The assigned step or 0 if none.
   */
  public long getStep(final int id) {
    checkId(id);
    return steps[id];
  }

  /**
   * @param id A metric ID.
   * @param function The assigned function.
   */
  public void setAggregation(final int id, final AggregationFunction function) {
    checkId(id);
    aggregations[id] = function;
  }

  /**
   * @param id A metric ID.
   * @return The assigned function or null if none.
   */
  public AggregationFunction getAggregation(final int id) {
    checkId(id);
    return aggregations[id];
  }

  /** @param common_step The shared step when storage downsampled. */
  public void setCommonStep(final long common_step) {
    this.common_step = common_step;
  }

  /** @return The shared step or 0 if unset. */
  public long getCommonStep() {
    return common_step;
  }

  /**
   * Orders points by metric ID then time. Points with equal keys keep their
   * append order.
   */
  public void sort() {
    if (size < 2) {
      return;
    }
    final long start = DateTime.nanoTime();
    final int[] order = new int[size];
    for (int i = 0; i < size; i++) {
      order[i] = i;
    }
    mergeSort(order, new int[size], 0, size);

    final int[] sorted_ids = new int[metric_ids.length];
    final double[] sorted_values = new double[values.length];
    final long[] sorted_times = new long[times.length];
    final long[] sorted_timestamps = new long[timestamps.length];
    for (int i = 0; i < size; i++) {
      final int from = order[i];
      sorted_ids[i] = metric_ids[from];
      sorted_values[i] = values[from];
      sorted_times[i] = times[from];
      sorted_timestamps[i] = timestamps[from];
    }
    metric_ids = sorted_ids;
    values = sorted_values;
    times = sorted_times;
    timestamps = sorted_timestamps;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sorted " + size + " points in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    }
  }

  /**
   * Keeps one point per metric and time, the one with the greatest ingest
   * timestamp (the later appended one on a tie), then drops removed and NaN
   * points. Must run after {@link #sort()}.
   */
  public void uniq() {
    int kept = -1;
    for (int i = 0; i < size; i++) {
      if (kept >= 0
          && metric_ids[kept] == metric_ids[i]
          && times[kept] == times[i]) {
        if (timestamps[i] >= timestamps[kept]) {
          metric_ids[kept] = 0;
          kept = i;
        } else {
          metric_ids[i] = 0;
        }
      } else {
        kept = i;
      }
    }
    cleanUp();
  }

  /**
   * Consolidates each metric's points into buckets of its precision. Must run
   * after {@link #uniq()}. Uses the current wall clock to compute the age.
   * @param from The query start in epoch seconds.
   * @param common_step The step shared by all metrics or 0 to use each
   * metric's own step.
   * @param rules Rules consulted for metrics without an assigned step or
   * function. May be null if every metric has both.
   */
  public void rollupPoints(final long from,
                           final long common_step,
                           final RollupResolver rules) {
    rollupPoints(from, common_step, rules, DateTime.currentTimeMillis() / 1000);
  }

  /**
   * Consolidates each metric's points into buckets of its precision. Buckets
   * without points are not filled in.
   * @param from The query start in epoch seconds.
   * @param common_step The step shared by all metrics or 0 to use each
   * metric's own step.
   * @param rules Rules consulted for metrics without an assigned step or
   * function. May be null if every metric has both.
   * @param now The current epoch time in seconds.
   */
  public void rollupPoints(final long from,
                           final long common_step,
                           final RollupResolver rules,
                           final long now) {
    if (size == 0) {
      return;
    }
    final long start = DateTime.nanoTime();
    final long age = Math.max(0, now - from);
    int write = 0;
    int run_start = 0;
    while (run_start < size) {
      final int id = metric_ids[run_start];
      int run_end = run_start + 1;
      while (run_end < size && metric_ids[run_end] == id) {
        run_end++;
      }

      AggregationFunction function = aggregations[id];
      long precision = common_step > 0 ? common_step : steps[id];
      if (function == null || precision <= 0) {
        if (rules == null) {
          throw new IllegalStateException("No step or function assigned to "
              + metricName(id) + " and no rules to resolve them.");
        }
        final RollupResolver.Resolution resolution =
            rules.lookup(metricName(id), age);
        if (function == null) {
          function = resolution.function();
        }
        if (precision <= 0) {
          precision = resolution.precision();
        }
      }
      write = rollupRun(run_start, run_end, write, Math.max(1, precision), function);
      run_start = run_end;
    }
    size = write;
    if (LOG.isDebugEnabled()) {
      LOG.debug("Rolled up " + size + " points in "
          + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
    }
  }

  /**
   * Reduces one metric's run in place.
   * @return The next write index.
   */
  private int rollupRun(final int start,
                        final int end,
                        int write,
                        final long precision,
                        final AggregationFunction function) {
    int i = start;
    while (i < end) {
      final long bucket = times[i] - times[i] % precision;
      int j = i + 1;
      while (j < end && times[j] - times[j] % precision == bucket) {
        j++;
      }
      final double value = j - i == 1 ? values[i] : function.apply(values, i, j);
      metric_ids[write] = metric_ids[i];
      values[write] = value;
      times[write] = bucket;
      timestamps[write] = timestamps[j - 1];
      write++;
      i = j;
    }
    return write;
  }

  /**
   * @return Each metric's contiguous range of points. Only meaningful after
   * {@link #sort()}.
   */
  public List<MetricRun> metricRuns() {
    final List<MetricRun> runs = new ArrayList<MetricRun>();
    int start = 0;
    while (start < size) {
      int end = start + 1;
      while (end < size && metric_ids[end] == metric_ids[start]) {
        end++;
      }
      runs.add(new MetricRun(metric_ids[start], start, end));
      start = end;
    }
    return runs;
  }

  /**
   * Appends all points of another store, re-interning its metric names.
   * @param other A non-null store.
   */
  public void merge(final PointStore other) {
    final int[] mapping = new int[other.id_to_name.size()];
    for (int id = 1; id < mapping.length; id++) {
      mapping[id] = intern(other.id_to_name.get(id));
    }
    // other may be this store, which grows while appending
    final int count = other.size;
    for (int i = 0; i < count; i++) {
      if (other.metric_ids[i] == 0) {
        continue;
      }
      appendPoint(mapping[other.metric_ids[i]], other.values[i],
          other.times[i], other.timestamps[i]);
    }
  }

  /**
   * Stable merge sort of point indices in [lo, hi) by metric ID then time.
   * @param order The indices to sort.
   * @param scratch Scratch space at least as long as order.
   */
  private void mergeSort(final int[] order, final int[] scratch, final int lo,
                         final int hi) {
    if (hi - lo <= INSERTION_SORT_THRESHOLD) {
      for (int i = lo + 1; i < hi; i++) {
        final int index = order[i];
        int j = i - 1;
        while (j >= lo && compareIndices(order[j], index) > 0) {
          order[j + 1] = order[j];
          j--;
        }
        order[j + 1] = index;
      }
      return;
    }
    final int mid = (lo + hi) >>> 1;
    mergeSort(order, scratch, lo, mid);
    mergeSort(order, scratch, mid, hi);
    if (compareIndices(order[mid - 1], order[mid]) <= 0) {
      return;
    }
    System.arraycopy(order, lo, scratch, lo, hi - lo);
    int left = lo;
    int right = mid;
    for (int i = lo; i < hi; i++) {
      if (right >= hi
          || (left < mid && compareIndices(scratch[left], scratch[right]) <= 0)) {
        order[i] = scratch[left++];
      } else {
        order[i] = scratch[right++];
      }
    }
  }

  private int compareIndices(final int a, final int b) {
    final int cmp = Integer.compare(metric_ids[a], metric_ids[b]);
    return cmp != 0 ? cmp : Long.compare(times[a], times[b]);
  }

  /** Drops points with metric ID 0 or a NaN value, keeping order. */
  private void cleanUp() {
    int write = 0;
    for (int i = 0; i < size; i++) {
      if (metric_ids[i] == 0 || Double.isNaN(values[i])) {
        continue;
      }
      if (write != i) {
        metric_ids[write] = metric_ids[i];
        values[write] = values[i];
        times[write] = times[i];
        timestamps[write] = timestamps[i];
      }
      write++;
    }
    size = write;
  }

  private void checkId(final int id) {
    if (id < 1 || id >= id_to_name.size()) {
      throw new IllegalDataException("Metric ID " + id
          + " was never assigned by this store.");
    }
  }

  /**
   * A contiguous range {@code [start, end)} of one metric's points.
   */
  public static final class MetricRun {
    private final int metric_id;
    private final int start;
    private final int end;

    MetricRun(final int metric_id, final int start, final int end) {
      this.metric_id = metric_id;
      this.start = start;
      this.end = end;
    }

    /** @return The metric ID. */
    public int metricId() {
      return metric_id;
    }

    /** @return The first point index, inclusive. */
    public int start() {
      return start;
    }

    /** @return The last point index, exclusive. */
    public int end() {
      return end;
    }
  }
}
