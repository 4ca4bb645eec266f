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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;

import net.tsgateway.utils.DateTime;
import net.tsgateway.utils.JSON;
import net.tsgateway.utils.YAML;

/**
 * The gateway's read path settings, loaded from a YAML or JSON document:
 * <pre>
 * storage:
 *   url: http://localhost:8123
 *   dataTimeout: 1m
 *   maxDataPoints: 4096
 *   internalAggregation: true
 *   queryParams:
 *     - duration: 72h
 *       url: http://long-range:8123
 *       dataTimeout: 5m
 *       maxQueries: 4
 * rollup:
 *   file: /etc/tsgateway/rollup.xml
 *   reloadInterval: 1m
 * maxMetricsPerTarget: 15000
 * secondaryTimeout: 500ms
 * </pre>
 *
 * @since 3.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = GatewayConfig.Builder.class)
public class GatewayConfig {
  private static final Logger LOG = LoggerFactory.getLogger(GatewayConfig.class);

  public static final int DEFAULT_MAX_METRICS_PER_TARGET = 15000;
  public static final String DEFAULT_SECONDARY_TIMEOUT = "500ms";

  private final StorageConfig storage;
  private final RollupConfig rollup;
  private final int max_metrics_per_target;
  private final long secondary_timeout;

  protected GatewayConfig(final Builder builder) {
    storage = builder.storage == null
        ? StorageConfig.newBuilder().build() : builder.storage;
    rollup = builder.rollup == null
        ? RollupConfig.newBuilder().build() : builder.rollup;
    max_metrics_per_target = builder.maxMetricsPerTarget;
    secondary_timeout = DateTime.parseDuration(builder.secondaryTimeout);
  }

  public StorageConfig storage() {
    return storage;
  }

  public RollupConfig rollup() {
    return rollup;
  }

  /** @return The cap on metrics one target may resolve to, 0 or less for none. */
  public int maxMetricsPerTarget() {
    return max_metrics_per_target;
  }

  /** @return How long to wait for the secondary source in milliseconds. */
  public long secondaryTimeout() {
    return secondary_timeout;
  }

  /**
   * Loads a config file, JSON if the name ends in {@code .json} and YAML
   * otherwise.
   * @param path The file path.
   * @return The config.
   * @throws IOException if the file could not be read.
   * @throws IllegalArgumentException if the file could not be parsed or had
   * invalid values.
   */
  public static GatewayConfig fromFile(final String path) throws IOException {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    try (final InputStream stream = Files.newInputStream(Paths.get(path))) {
      final GatewayConfig config = path.toLowerCase().endsWith(".json")
          ? JSON.parseToObject(stream, GatewayConfig.class)
          : YAML.parseToObject(stream, GatewayConfig.class);
      LOG.info("Loaded config from " + path + ": " + config);
      return config;
    }
  }

  /**
   * @param yaml A YAML (or JSON) document.
   * @return The config.
   * @throws IllegalArgumentException if the document could not be parsed or
   * had invalid values.
   */
  public static GatewayConfig parse(final String yaml) {
    return YAML.parseToObject(yaml, GatewayConfig.class);
  }

  @Override
  public String toString() {
    return "{storage=" + storage + ", rollup=" + rollup
        + ", maxMetricsPerTarget=" + max_metrics_per_target
        + ", secondaryTimeout=" + secondary_timeout + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private StorageConfig storage;
    @JsonProperty
    private RollupConfig rollup;
    @JsonProperty
    private int maxMetricsPerTarget = DEFAULT_MAX_METRICS_PER_TARGET;
    @JsonProperty
    private String secondaryTimeout = DEFAULT_SECONDARY_TIMEOUT;

    public Builder setStorage(final StorageConfig storage) {
      this.storage = storage;
      return this;
    }

    public Builder setRollup(final RollupConfig rollup) {
      this.rollup = rollup;
      return this;
    }

    public Builder setMaxMetricsPerTarget(final int max_metrics_per_target) {
      maxMetricsPerTarget = max_metrics_per_target;
      return this;
    }

    public Builder setSecondaryTimeout(final String secondary_timeout) {
      secondaryTimeout = secondary_timeout;
      return this;
    }

    public GatewayConfig build() {
      return new GatewayConfig(this);
    }
  }
}
