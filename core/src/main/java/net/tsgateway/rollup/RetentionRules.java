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

import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsgateway.data.AggregationFunction;
import net.tsgateway.data.AggregationFunctions;
import net.tsgateway.exceptions.InvalidRollupRulesException;
import net.tsgateway.utils.DateTime;
import net.tsgateway.utils.ReversePath;

/**
 * An ordered, compiled set of retention patterns. The set always ends with
 * the configured default pattern and a built-in {@code avg}/60s fallback so
 * that every lookup resolves. Instances are immutable and safe to share
 * between any number of readers; reloads build a new instance.
 * <p>
 * If any pattern is typed {@code plain} or {@code tagged}, untagged names
 * only consult {@code all} and {@code plain} patterns and tagged names only
 * {@code all} and {@code tagged} ones.
 *
 * @since 3.0
 */
public final class RetentionRules implements RollupResolver {

  /** Used when nothing else resolves a function. */
  public static final AggregationFunction FALLBACK_FUNCTION = AggregationFunctions.AVG;

  /** Used when nothing else resolves a precision. */
  public static final long FALLBACK_PRECISION = 60;

  private final List<RetentionPattern> patterns;
  private final List<RetentionPattern> plain;
  private final List<RetentionPattern> tagged;
  private final boolean split;
  private final long updated;

  private RetentionRules(final Builder builder) {
    final List<RetentionPattern> patterns =
        Lists.newArrayList(builder.patterns);

    AggregationFunction default_function = null;
    if (!Strings.isNullOrEmpty(builder.default_function)) {
      try {
        default_function = AggregationFunctions.get(builder.default_function);
      } catch (NoSuchElementException e) {
        throw new InvalidRollupRulesException("Unknown default function \""
            + builder.default_function + "\"", e);
      }
    }
    if (builder.default_precision < 0) {
      throw new InvalidRollupRulesException("Default precision cannot be "
          + "negative: " + builder.default_precision);
    }
    patterns.add(defaultPattern(builder.default_precision, default_function));
    patterns.add(defaultPattern(FALLBACK_PRECISION, FALLBACK_FUNCTION));
    this.patterns = ImmutableList.copyOf(patterns);

    boolean split = false;
    for (final RetentionPattern pattern : patterns) {
      if (pattern.ruleType() != RuleType.ALL) {
        split = true;
        break;
      }
    }
    this.split = split;
    if (split) {
      final ImmutableList.Builder<RetentionPattern> plain = ImmutableList.builder();
      final ImmutableList.Builder<RetentionPattern> tagged = ImmutableList.builder();
      for (final RetentionPattern pattern : patterns) {
        switch (pattern.ruleType()) {
        case PLAIN:
          plain.add(pattern);
          break;
        case TAGGED:
          tagged.add(pattern);
          break;
        default:
          plain.add(pattern);
          tagged.add(pattern);
        }
      }
      this.plain = plain.build();
      this.tagged = tagged.build();
    } else {
      this.plain = this.patterns;
      this.tagged = this.patterns;
    }
    updated = DateTime.currentTimeMillis();
  }

  private static RetentionPattern defaultPattern(final long precision,
                                                 final AggregationFunction function) {
    final RetentionPattern.Builder builder = RetentionPattern.newBuilder()
        .setRegexp(".*")
        .setFunction(function == null ? null : function.name());
    if (precision > 0) {
      builder.addRetention(0, precision);
    }
    return builder.build();
  }

  @Override
  public Resolution lookup(final String metric, final long age) {
    return lookupVerbose(metric, age).resolution();
  }

  /**
   * Like {@link #lookup(String, long)} but also reports which patterns
   * supplied the answer.
   * @param metric The metric name as stored.
   * @param age The data age in seconds.
   * @return The match, never null.
   */
  public Match lookupVerbose(final String metric, final long age) {
    final List<RetentionPattern> candidates =
        split && ReversePath.isTagged(metric) ? tagged : plain;

    AggregationFunction function = null;
    RetentionPattern function_pattern = null;
    long precision = -1;
    RetentionPattern precision_pattern = null;

    for (final RetentionPattern pattern : candidates) {
      final boolean wants_function = function == null && pattern.function() != null;
      final boolean wants_precision = precision < 0 && !pattern.retention().isEmpty();
      if (!wants_function && !wants_precision) {
        continue;
      }
      if (!pattern.matches(metric)) {
        continue;
      }
      if (wants_function) {
        function = pattern.function();
        function_pattern = pattern;
      }
      if (wants_precision) {
        final long p = pattern.precisionFor(age);
        if (p > 0) {
          precision = p;
          precision_pattern = pattern;
        }
      }
      if (function != null && precision > 0) {
        break;
      }
    }

    if (function == null) {
      function = FALLBACK_FUNCTION;
    }
    if (precision < 0) {
      precision = FALLBACK_PRECISION;
    }
    return new Match(new Resolution(precision, function), function_pattern,
        precision_pattern);
  }

  /** @return All patterns including the two trailing defaults. */
  public List<RetentionPattern> patterns() {
    return patterns;
  }

  /** @return Whether typed patterns split the lookup by tagged-ness. */
  public boolean isSplit() {
    return split;
  }

  /** @return When the set was compiled, epoch millis. */
  public long updated() {
    return updated;
  }

  @Override
  public String toString() {
    return "RetentionRules" + patterns;
  }

  /**
   * The outcome of a verbose lookup.
   */
  public static final class Match {
    private final Resolution resolution;
    private final RetentionPattern function_pattern;
    private final RetentionPattern precision_pattern;

    Match(final Resolution resolution,
          final RetentionPattern function_pattern,
          final RetentionPattern precision_pattern) {
      this.resolution = resolution;
      this.function_pattern = function_pattern;
      this.precision_pattern = precision_pattern;
    }

    public Resolution resolution() {
      return resolution;
    }

    /** @return The pattern the function came from or null for the fallback. */
    public RetentionPattern functionPattern() {
      return function_pattern;
    }

    /** @return The pattern the precision came from or null for the fallback. */
    public RetentionPattern precisionPattern() {
      return precision_pattern;
    }
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for a rule set. {@link #build()} either returns a complete set or
   * throws.
   */
  public static final class Builder {
    private final List<RetentionPattern> patterns = Lists.newArrayList();
    private long default_precision;
    private String default_function;

    public Builder addPattern(final RetentionPattern pattern) {
      patterns.add(pattern);
      return this;
    }

    public Builder setPatterns(final List<RetentionPattern> patterns) {
      this.patterns.clear();
      if (patterns != null) {
        this.patterns.addAll(patterns);
      }
      return this;
    }

    /**
     * @param default_precision Precision of the configured default pattern,
     * 0 to let the built-in fallback decide.
     * @return The builder.
     */
    public Builder setDefaultPrecision(final long default_precision) {
      this.default_precision = default_precision;
      return this;
    }

    /**
     * @param default_function Function of the configured default pattern,
     * null or empty to let the built-in fallback decide.
     * @return The builder.
     */
    public Builder setDefaultFunction(final String default_function) {
      this.default_function = default_function;
      return this;
    }

    /**
     * @return The compiled rule set.
     * @throws InvalidRollupRulesException if the defaults are invalid.
     */
    public RetentionRules build() {
      return new RetentionRules(this);
    }
  }

  /**
   * @param default_precision Default precision, 0 for the fallback.
   * @param default_function Default function, null for the fallback.
   * @return A rule set with no patterns besides the defaults.
   */
  public static RetentionRules defaults(final long default_precision,
                                        final String default_function) {
    return newBuilder()
        .setPatterns(Collections.<RetentionPattern>emptyList())
        .setDefaultPrecision(default_precision)
        .setDefaultFunction(default_function)
        .build();
  }
}
