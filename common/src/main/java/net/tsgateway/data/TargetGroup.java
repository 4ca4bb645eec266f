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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsgateway.rollup.RollupResolver;

/**
 * The metrics one or more requested target expressions resolved to, along
 * with where and how they are stored. Built by the resolver and read only
 * afterwards.
 * <p>
 * Metric names are the logical (unreversed) names. When {@link #reversed()}
 * is true the storage table keys them with reversed nodes.
 *
 * @since 3.0
 */
public final class TargetGroup {
  private final List<String> metric_names;
  private final Map<String, List<MetricAlias>> aliases;
  private final String storage_table;
  private final boolean reversed;
  private final RollupResolver rollup_rules;
  private final boolean use_reverted_lookup;
  private final Map<String, AggregationFunction> consolidations;

  private TargetGroup(final Builder builder) {
    metric_names = Collections.unmodifiableList(
        new ArrayList<String>(builder.aliases.keySet()));
    final Map<String, List<MetricAlias>> aliases =
        new LinkedHashMap<String, List<MetricAlias>>();
    for (final Map.Entry<String, List<MetricAlias>> entry :
        builder.aliases.entrySet()) {
      aliases.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
    }
    this.aliases = Collections.unmodifiableMap(aliases);
    storage_table = builder.storage_table;
    reversed = builder.reversed;
    rollup_rules = builder.rollup_rules;
    use_reverted_lookup = builder.use_reverted_lookup;
    consolidations = Collections.unmodifiableMap(builder.consolidations);
  }

  /** @return The distinct metric names in resolution order. */
  public List<String> metricNames() {
    return metric_names;
  }

  /** @return Metric name to its display aliases. */
  public Map<String, List<MetricAlias>> aliases() {
    return aliases;
  }

  /**
   * @param metric A metric name.
   * @return The aliases of the metric, empty if it's not part of the group.
   */
  public List<MetricAlias> aliases(final String metric) {
    final List<MetricAlias> list = aliases.get(metric);
    return list == null ? Collections.<MetricAlias>emptyList() : list;
  }

  /** @return The points table to query. */
  public String storageTable() {
    return storage_table;
  }

  /** @return Whether the table keys paths with reversed nodes. */
  public boolean reversed() {
    return reversed;
  }

  /** @return The rules of the table. */
  public RollupResolver rollupRules() {
    return rollup_rules;
  }

  /**
   * @return Whether rules are matched against the logical name even when the
   * table is reversed.
   */
  public boolean useRevertedLookup() {
    return use_reverted_lookup;
  }

  /** @return Target expression to the consolidation function it requested. */
  public Map<String, AggregationFunction> consolidations() {
    return consolidations;
  }

  /**
   * @param target A target expression.
   * @return The consolidation function requested by the target or null.
   */
  public AggregationFunction consolidation(final String target) {
    return consolidations.get(target);
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for target groups.
   */
  public static final class Builder {
    private final Map<String, List<MetricAlias>> aliases = Maps.newLinkedHashMap();
    private final Map<String, AggregationFunction> consolidations = Maps.newHashMap();
    private String storage_table;
    private boolean reversed;
    private RollupResolver rollup_rules;
    private boolean use_reverted_lookup;

    /**
     * Adds a metric with one of its aliases. Adding the same metric again
     * appends another alias.
     * @param metric The logical metric name.
     * @param display_name The display name.
     * @param target The target expression that resolved to the metric.
     * @return The builder.
     */
    public Builder addMetric(final String metric,
                             final String display_name,
                             final String target) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(metric),
          "Metric name cannot be null or empty.");
      List<MetricAlias> list = aliases.get(metric);
      if (list == null) {
        list = Lists.newArrayList();
        aliases.put(metric, list);
      }
      final MetricAlias alias = new MetricAlias(display_name, target);
      if (!list.contains(alias)) {
        list.add(alias);
      }
      return this;
    }

    /**
     * Adds a metric shown under its own name.
     * @param metric The logical metric name.
     * @param target The target expression that resolved to the metric.
     * @return The builder.
     */
    public Builder addMetric(final String metric, final String target) {
      return addMetric(metric, metric, target);
    }

    public Builder setStorageTable(final String storage_table) {
      this.storage_table = storage_table;
      return this;
    }

    public Builder setReversed(final boolean reversed) {
      this.reversed = reversed;
      return this;
    }

    public Builder setRollupRules(final RollupResolver rollup_rules) {
      this.rollup_rules = rollup_rules;
      return this;
    }

    public Builder setUseRevertedLookup(final boolean use_reverted_lookup) {
      this.use_reverted_lookup = use_reverted_lookup;
      return this;
    }

    /**
     * Overrides the consolidation of every metric the target resolved to.
     * @param target The target expression.
     * @param function A function name or alias.
     * @return The builder.
     * @throws java.util.NoSuchElementException if the function is unknown.
     */
    public Builder setConsolidation(final String target, final String function) {
      consolidations.put(target, AggregationFunctions.get(function));
      return this;
    }

    /** @return The target group. */
    public TargetGroup build() {
      if (Strings.isNullOrEmpty(storage_table)) {
        throw new IllegalArgumentException("Storage table cannot be null or empty.");
      }
      if (rollup_rules == null) {
        throw new IllegalArgumentException("Rollup rules cannot be null.");
      }
      return new TargetGroup(this);
    }
  }
}
