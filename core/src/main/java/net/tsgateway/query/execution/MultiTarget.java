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
package net.tsgateway.query.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Lists;

import net.tsgateway.data.TargetGroup;
import net.tsgateway.data.TimeFrame;
import net.tsgateway.exceptions.MetricsLimitExceededException;

/**
 * The groups of one render request keyed by time frame, in insertion order.
 * Each (time frame, group) pair is fetched by its own task.
 *
 * @since 3.0
 */
public class MultiTarget {
  private final Map<TimeFrame, List<TargetGroup>> targets;

  public MultiTarget() {
    targets = new LinkedHashMap<TimeFrame, List<TargetGroup>>();
  }

  /**
   * Adds a group to the time frame, creating the entry on first use.
   * @param time_frame The non-null time frame.
   * @param group The non-null group.
   * @return This instance for chaining.
   */
  public MultiTarget add(final TimeFrame time_frame, final TargetGroup group) {
    if (time_frame == null) {
      throw new IllegalArgumentException("Time frame cannot be null.");
    }
    if (group == null) {
      throw new IllegalArgumentException("Group cannot be null.");
    }
    List<TargetGroup> groups = targets.get(time_frame);
    if (groups == null) {
      groups = Lists.newArrayList();
      targets.put(time_frame, groups);
    }
    groups.add(group);
    return this;
  }

  /** @return The time frames in insertion order. */
  public Set<TimeFrame> timeFrames() {
    return Collections.unmodifiableSet(targets.keySet());
  }

  /**
   * @param time_frame A time frame.
   * @return The groups of the time frame, empty if unknown.
   */
  public List<TargetGroup> groups(final TimeFrame time_frame) {
    final List<TargetGroup> groups = targets.get(time_frame);
    if (groups == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(groups);
  }

  /** @return The number of (time frame, group) pairs. */
  public int size() {
    int size = 0;
    for (final List<TargetGroup> groups : targets.values()) {
      size += groups.size();
    }
    return size;
  }

  public boolean isEmpty() {
    return targets.isEmpty();
  }

  /**
   * @param time_frame A time frame.
   * @return How many metrics the time frame's groups resolved to.
   */
  public int metricCount(final TimeFrame time_frame) {
    int count = 0;
    for (final TargetGroup group : groups(time_frame)) {
      count += group.metricNames().size();
    }
    return count;
  }

  /** @return The widest {@code until - from} over all time frames, 0 if empty. */
  public long maxRange() {
    long range = 0;
    for (final TimeFrame time_frame : targets.keySet()) {
      range = Math.max(range, time_frame.until() - time_frame.from());
    }
    return range;
  }

  /**
   * Rejects the request if any time frame resolved to more metrics than
   * allowed.
   * @param limit The cap per time frame, 0 or negative for no cap.
   * @throws MetricsLimitExceededException if a time frame is over the cap.
   */
  public void checkMetricsLimit(final int limit) {
    if (limit <= 0) {
      return;
    }
    for (final TimeFrame time_frame : targets.keySet()) {
      final int count = metricCount(time_frame);
      if (count > limit) {
        throw new MetricsLimitExceededException(count, limit);
      }
    }
  }

  @Override
  public String toString() {
    return "MultiTarget{timeFrames=" + targets.size() + ", groups=" + size()
        + "}";
  }
}
