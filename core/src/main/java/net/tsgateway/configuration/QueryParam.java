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

import net.tsgateway.limiter.Limiter;
import net.tsgateway.limiter.SemaphoreLimiter;
import net.tsgateway.utils.DateTime;

/**
 * Storage settings for requests whose time range is at least
 * {@link #duration()} seconds long, letting long range queries go to a
 * different endpoint with a longer timeout and their own admission limit.
 * An unset URL or timeout is inherited from {@link StorageConfig}.
 *
 * @since 3.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = QueryParam.Builder.class)
public class QueryParam {
  private final long duration;
  private final String url;
  private final long data_timeout;
  private final int max_queries;
  private final Limiter limiter;

  protected QueryParam(final Builder builder) {
    duration = Strings.isNullOrEmpty(builder.duration) ? 0
        : DateTime.parseDuration(builder.duration) / 1000;
    url = builder.url;
    data_timeout = Strings.isNullOrEmpty(builder.dataTimeout) ? 0
        : DateTime.parseDuration(builder.dataTimeout);
    max_queries = builder.maxQueries;
    if (max_queries < 0) {
      throw new IllegalArgumentException("Max queries cannot be negative.");
    }
    limiter = SemaphoreLimiter.create(
        Strings.isNullOrEmpty(url) ? "storage" : url, max_queries);
  }

  /** @return The shortest time range, in seconds, these settings apply to. */
  public long duration() {
    return duration;
  }

  /** @return The storage URL or null to inherit. */
  public String url() {
    return url;
  }

  /** @return The round trip timeout in milliseconds, 0 to inherit. */
  public long dataTimeout() {
    return data_timeout;
  }

  /** @return The concurrent query limit, 0 for none. */
  public int maxQueries() {
    return max_queries;
  }

  /** @return The admission limiter shared by all requests using these. */
  public Limiter limiter() {
    return limiter;
  }

  @Override
  public String toString() {
    return "{duration=" + duration + ", url=" + url + ", dataTimeout="
        + data_timeout + ", maxQueries=" + max_queries + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Copies the settings, filling in the URL and timeout where unset.
   * @param param A non-null source.
   * @param url The URL to inherit.
   * @param data_timeout The timeout to inherit in milliseconds.
   * @return A populated builder.
   */
  static Builder newBuilder(final QueryParam param,
                            final String url,
                            final long data_timeout) {
    return new Builder()
        .setDuration(param.duration + "s")
        .setUrl(Strings.isNullOrEmpty(param.url) ? url : param.url)
        .setDataTimeout((param.data_timeout > 0 ? param.data_timeout
            : data_timeout) + "ms")
        .setMaxQueries(param.max_queries);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String duration;
    @JsonProperty
    private String url;
    @JsonProperty
    private String dataTimeout;
    @JsonProperty
    private int maxQueries;

    /**
     * @param duration A duration like {@code 72h}.
     * @return The builder.
     */
    public Builder setDuration(final String duration) {
      this.duration = duration;
      return this;
    }

    public Builder setUrl(final String url) {
      this.url = url;
      return this;
    }

    /**
     * @param data_timeout A duration like {@code 30s}.
     * @return The builder.
     */
    public Builder setDataTimeout(final String data_timeout) {
      dataTimeout = data_timeout;
      return this;
    }

    public Builder setMaxQueries(final int max_queries) {
      maxQueries = max_queries;
      return this;
    }

    public QueryParam build() {
      return new QueryParam(this);
    }
  }
}
