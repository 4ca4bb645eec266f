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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsgateway.data.AggregationFunction;
import net.tsgateway.data.AggregationFunctions;
import net.tsgateway.exceptions.InvalidRollupRulesException;

/**
 * A compiled retention pattern: a name regex (null matching everything), an
 * optional aggregation function and an optional list of retention tiers in
 * ascending age order. Immutable once built.
 *
 * @since 3.0
 */
public final class RetentionPattern {
  private static final Splitter TAG_SPLITTER =
      Splitter.on(';').omitEmptyStrings();

  private final RuleType rule_type;
  private final String regexp;
  private final Pattern pattern;
  private final AggregationFunction function;
  private final List<Retention> retention;

  private RetentionPattern(final Builder builder) {
    String regexp = Strings.nullToEmpty(builder.regexp);
    RuleType type = builder.rule_type == null ? RuleType.ALL : builder.rule_type;
    if (type == RuleType.TAG_LIST) {
      type = RuleType.TAGGED;
      regexp = buildTaggedRegex(regexp);
    }
    rule_type = type;

    if (regexp.isEmpty() || regexp.equals(".*")) {
      this.regexp = ".*";
      pattern = null;
    } else {
      this.regexp = regexp;
      try {
        pattern = Pattern.compile(regexp);
      } catch (PatternSyntaxException e) {
        throw new InvalidRollupRulesException("Invalid pattern regexp: "
            + regexp, e);
      }
    }

    if (Strings.isNullOrEmpty(builder.function)) {
      function = null;
    } else {
      try {
        function = AggregationFunctions.get(builder.function.trim());
      } catch (NoSuchElementException e) {
        throw new InvalidRollupRulesException("Unknown function \""
            + builder.function + "\" in pattern " + regexp, e);
      }
    }

    if (builder.retention == null || builder.retention.isEmpty()) {
      retention = Collections.emptyList();
    } else {
      final List<Retention> sorted = new ArrayList<Retention>(builder.retention);
      Collections.sort(sorted);
      for (final Retention r : sorted) {
        if (r.age() < 0 || r.precision() < 1) {
          throw new InvalidRollupRulesException("Invalid retention " + r
              + " in pattern " + this.regexp);
        }
      }
      retention = Collections.unmodifiableList(sorted);
    }
  }

  /** @return The rule type, never TAG_LIST after compilation. */
  public RuleType ruleType() {
    return rule_type;
  }

  /** @return The regular expression, {@code .*} for match-all. */
  public String regexp() {
    return regexp;
  }

  /** @return The function or null if the pattern doesn't set one. */
  public AggregationFunction function() {
    return function;
  }

  /** @return The tiers in ascending age order, possibly empty. */
  public List<Retention> retention() {
    return retention;
  }

  /**
   * @param metric A metric name.
   * @return Whether the name matches, match-all patterns match everything.
   */
  public boolean matches(final String metric) {
    return pattern == null || pattern.matcher(metric).find();
  }

  /**
   * Finds the precision of the last tier whose age is not greater than the
   * given age.
   * @param age The data age in seconds.
   * @return The precision or -1 if the age is below every tier or there are
   * no tiers.
   */
  public long precisionFor(final long age) {
    long precision = -1;
    for (final Retention r : retention) {
      if (age < r.age()) {
        break;
      }
      precision = r.precision();
    }
    return precision;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{ruleType=")
        .append(rule_type)
        .append(", regexp=")
        .append(regexp)
        .append(", function=")
        .append(function == null ? "" : function.name())
        .append(", retention=")
        .append(retention)
        .append("}")
        .toString();
  }

  /**
   * Converts a tag list such as {@code name;tag1=v1;tag2=v2} into a regex
   * over tagged series names. Tags are sorted since tagged names are stored
   * with sorted tags. A list starting with a tag matches the tag anywhere.
   * @param tag_list The tag list.
   * @return The regex.
   */
  static String buildTaggedRegex(final String tag_list) {
    final List<String> tags = Lists.newArrayList(TAG_SPLITTER.split(tag_list));
    if (tags.isEmpty()) {
      throw new InvalidRollupRulesException("Empty tag list.");
    }
    final StringBuilder buf = new StringBuilder();
    if (tags.get(0).contains("=")) {
      buf.append("[\\?&]");
    } else {
      if (tags.size() == 1) {
        return "^" + tags.get(0) + "\\?";
      }
      buf.append("^")
         .append(tags.remove(0))
         .append("\\?(.*&)?");
    }
    Collections.sort(tags);
    return buf.append(Joiner.on("&(.*&)?").join(tags))
        .append("(&.*)?$")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder for patterns, also the shape rule documents are read into.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Builder {
    private RuleType rule_type;
    private String regexp;
    private String function;
    private List<Retention> retention;

    @JsonProperty("rule_type")
    public Builder setRuleType(final RuleType rule_type) {
      this.rule_type = rule_type;
      return this;
    }

    @JsonProperty("regexp")
    public Builder setRegexp(final String regexp) {
      this.regexp = regexp;
      return this;
    }

    @JsonProperty("function")
    public Builder setFunction(final String function) {
      this.function = function;
      return this;
    }

    @JsonProperty("retention")
    @JacksonXmlElementWrapper(useWrapping = false)
    public Builder setRetention(final List<Retention> retention) {
      this.retention = retention;
      return this;
    }

    /**
     * @param age The age threshold in seconds.
     * @param precision The bucket width in seconds.
     * @return The builder.
     */
    public Builder addRetention(final long age, final long precision) {
      if (retention == null) {
        retention = Lists.newArrayList();
      }
      retention.add(new Retention(age, precision));
      return this;
    }

    /** @return Whether a function or a tier was set. */
    boolean hasContent() {
      return !Strings.isNullOrEmpty(function)
          || (retention != null && !retention.isEmpty());
    }

    /**
     * @return The compiled pattern.
     * @throws InvalidRollupRulesException if the regex or function is invalid.
     */
    public RetentionPattern build() {
      return new RetentionPattern(this);
    }
  }
}
