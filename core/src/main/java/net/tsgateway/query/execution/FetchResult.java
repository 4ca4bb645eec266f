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

import java.util.List;
import java.util.Map;

import net.tsgateway.data.MetricAlias;
import net.tsgateway.data.PointStore;
import net.tsgateway.data.TargetGroup;
import net.tsgateway.data.TimeFrame;

/**
 * The decoded and consolidated points of one (time frame, group) pair.
 *
 * @since 3.0
 */
public final class FetchResult {
  private final TimeFrame time_frame;
  private final TargetGroup group;
  private final PointStore store;
  private final Map<String, List<String>> applied_functions;

  /**
   * Default ctor.
   * @param time_frame The requested time frame.
   * @param group The group that was fetched.
   * @param store The points, steps and functions.
   * @param applied_functions Functions applied per target, e.g. a
   * consolidation override.
   */
  public FetchResult(final TimeFrame time_frame,
                     final TargetGroup group,
                     final PointStore store,
                     final Map<String, List<String>> applied_functions) {
    this.time_frame = time_frame;
    this.group = group;
    this.store = store;
    this.applied_functions = applied_functions;
  }

  /** @return The time frame as requested, before the point cap. */
  public TimeFrame timeFrame() {
    return time_frame;
  }

  /** @return The requested start in epoch seconds. */
  public long from() {
    return time_frame.from();
  }

  /** @return The requested end in epoch seconds. */
  public long until() {
    return time_frame.until();
  }

  public TargetGroup group() {
    return group;
  }

  /** @return The resolved aliases, unchanged from the group. */
  public Map<String, List<MetricAlias>> aliases() {
    return group.aliases();
  }

  public PointStore store() {
    return store;
  }

  public Map<String, List<String>> appliedFunctions() {
    return applied_functions;
  }

  @Override
  public String toString() {
    return "{timeFrame=" + time_frame + ", metrics=" + store.metricCount()
        + ", points=" + store.size() + ", appliedFunctions="
        + applied_functions + "}";
  }
}
