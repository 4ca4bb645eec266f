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
package net.tsgateway.configuration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;

import io.netty.util.Timer;
import net.tsgateway.data.AggregationFunctions;
import net.tsgateway.rollup.FileRetentionRulesSource;
import net.tsgateway.rollup.RetentionRulesParser;
import net.tsgateway.rollup.RetentionRulesSource;
import net.tsgateway.rollup.RollupRules;
import net.tsgateway.rollup.StorageRetentionRulesSource;
import net.tsgateway.storage.StorageClient;
import net.tsgateway.utils.DateTime;

/**
 * Where the rollup rules of the points table come from. Rules are read from
 * a file, from the storage's retention system table, or not at all in which
 * case only the defaults apply.
 *
 * @since 3.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = RollupConfig.Builder.class)
public class RollupConfig {
  private final String file;
  private final RetentionRulesParser.Format format;
  private final String table;
  private final long default_precision;
  private final String default_function;
  private final long reload_interval;

  protected RollupConfig(final Builder builder) {
    if (!Strings.isNullOrEmpty(builder.file)
        && !Strings.isNullOrEmpty(builder.table)) {
      throw new IllegalArgumentException("Only one of file and table may be "
          + "set.");
    }
    if (builder.defaultPrecision < 0) {
      throw new IllegalArgumentException("Default precision cannot be "
          + "negative.");
    }
    if (!Strings.isNullOrEmpty(builder.defaultFunction)
        && !AggregationFunctions.contains(builder.defaultFunction)) {
      throw new IllegalArgumentException("Unknown default function: "
          + builder.defaultFunction);
    }
    file = builder.file;
    format = Strings.isNullOrEmpty(builder.format) ? null
        : RetentionRulesParser.Format.valueOf(builder.format.toUpperCase());
    table = builder.table;
    default_precision = builder.defaultPrecision;
    default_function = builder.defaultFunction;
    reload_interval = Strings.isNullOrEmpty(builder.reloadInterval) ? 0
        : DateTime.parseDuration(builder.reloadInterval);
  }

  /** @return The rules file or null. */
  public String file() {
    return file;
  }

  /** @return The file format or null to guess from the name. */
  public RetentionRulesParser.Format format() {
    return format;
  }

  /** @return The {@code database.table} whose system table rules apply or null. */
  public String table() {
    return table;
  }

  public long defaultPrecision() {
    return default_precision;
  }

  public String defaultFunction() {
    return default_function;
  }

  /** @return How often to reload in milliseconds, 0 for never. */
  public long reloadInterval() {
    return reload_interval;
  }

  /**
   * Loads the rules.
   * @param storage The storage settings, used for system table rules.
   * @param client The storage client, used for system table rules.
   * @param timer The timer scheduling reloads. May be null if the reload
   * interval is 0.
   * @return The loaded rules.
   * @throws net.tsgateway.exceptions.InvalidRollupRulesException if the
   * initial load failed.
   */
  public RollupRules newRules(final StorageConfig storage,
                              final StorageClient client,
                              final Timer timer) {
    RetentionRulesSource source = null;
    if (!Strings.isNullOrEmpty(file)) {
      source = new FileRetentionRulesSource(file, format);
    } else if (!Strings.isNullOrEmpty(table)) {
      source = new StorageRetentionRulesSource(client, storage.url(), table,
          storage.dataTimeout());
    }
    return RollupRules.newBuilder()
        .setSource(source)
        .setDefaultPrecision(default_precision)
        .setDefaultFunction(default_function)
        .setTimer(timer)
        .setInterval(source == null ? 0 : reload_interval)
        .build();
  }

  @Override
  public String toString() {
    return "{file=" + file + ", table=" + table + ", defaultPrecision="
        + default_precision + ", defaultFunction=" + default_function
        + ", reloadInterval=" + reload_interval + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String file;
    @JsonProperty
    private String format;
    @JsonProperty
    private String table;
    @JsonProperty
    private long defaultPrecision;
    @JsonProperty
    private String defaultFunction;
    @JsonProperty
    private String reloadInterval;

    public Builder setFile(final String file) {
      this.file = file;
      return this;
    }

    /**
     * @param format One of xml, json, yaml or compact.
     * @return The builder.
     */
    public Builder setFormat(final String format) {
      this.format = format;
      return this;
    }

    public Builder setTable(final String table) {
      this.table = table;
      return this;
    }

    public Builder setDefaultPrecision(final long default_precision) {
      defaultPrecision = default_precision;
      return this;
    }

    public Builder setDefaultFunction(final String default_function) {
      defaultFunction = default_function;
      return this;
    }

    public Builder setReloadInterval(final String reload_interval) {
      reloadInterval = reload_interval;
      return this;
    }

    public RollupConfig build() {
      return new RollupConfig(this);
    }
  }
}
