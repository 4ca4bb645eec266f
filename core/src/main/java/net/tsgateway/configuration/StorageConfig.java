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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsgateway.query.plan.DayFormat;
import net.tsgateway.utils.DateTime;

/**
 * Where and how points are read from storage.
 *
 * @since 3.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = StorageConfig.Builder.class)
public class StorageConfig {
  public static final String DEFAULT_URL = "http://localhost:8123";
  public static final String DEFAULT_DATA_TIMEOUT = "1m";
  public static final String DEFAULT_CONNECT_TIMEOUT = "1s";
  public static final int DEFAULT_MAX_DATA_POINTS = 4096;
  public static final String DEFAULT_DATE_FORMAT = "default";

  private final String url;
  private final long data_timeout;
  private final long connect_timeout;
  private final int max_data_points;
  private final boolean internal_aggregation;
  private final DayFormat day_format;

  /** Sorted by duration, the first one always covers duration 0. */
  private final List<QueryParam> query_params;

  protected StorageConfig(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.url)) {
      throw new IllegalArgumentException("Storage URL cannot be null or empty.");
    }
    url = builder.url;
    data_timeout = DateTime.parseDuration(builder.dataTimeout);
    connect_timeout = DateTime.parseDuration(builder.connectTimeout);
    if (data_timeout < 1) {
      throw new IllegalArgumentException("Data timeout must be positive.");
    }
    if (builder.maxDataPoints < 1) {
      throw new IllegalArgumentException("Max data points must be positive.");
    }
    max_data_points = builder.maxDataPoints;
    internal_aggregation = builder.internalAggregation;
    day_format = DayFormat.fromString(builder.dateFormat);

    final List<QueryParam> params = Lists.newArrayList();
    boolean has_zero = false;
    if (builder.queryParams != null) {
      for (final QueryParam param : builder.queryParams) {
        if (param.duration() == 0) {
          has_zero = true;
        }
        params.add(QueryParam.newBuilder(param, url, data_timeout).build());
      }
    }
    if (!has_zero) {
      params.add(QueryParam.newBuilder()
          .setUrl(url)
          .setDataTimeout(data_timeout + "ms")
          .build());
    }
    Collections.sort(params, new Comparator<QueryParam>() {
      @Override
      public int compare(final QueryParam a, final QueryParam b) {
        return Long.compare(a.duration(), b.duration());
      }
    });
    for (int i = 1; i < params.size(); i++) {
      if (params.get(i).duration() == params.get(i - 1).duration()) {
        throw new IllegalArgumentException("Duplicate query param duration: "
            + params.get(i).duration());
      }
    }
    query_params = Collections.unmodifiableList(params);
  }

  /** @return The default storage URL. */
  public String url() {
    return url;
  }

  /** @return The default round trip timeout in milliseconds. */
  public long dataTimeout() {
    return data_timeout;
  }

  /** @return The connect timeout in milliseconds. */
  public long connectTimeout() {
    return connect_timeout;
  }

  /** @return The cap on requested points per series. */
  public int maxDataPoints() {
    return max_data_points;
  }

  /** @return Whether storage downsamples. */
  public boolean internalAggregation() {
    return internal_aggregation;
  }

  /** @return How the writer derived the Date column. */
  public DayFormat dayFormat() {
    return day_format;
  }

  /** @return All query params sorted by duration. */
  public List<QueryParam> queryParams() {
    return query_params;
  }

  /**
   * @param duration A time range in seconds.
   * @return The params with the longest duration not above the range.
   */
  public QueryParam queryParam(final long duration) {
    QueryParam match = query_params.get(0);
    for (final QueryParam param : query_params) {
      if (param.duration() > duration) {
        break;
      }
      match = param;
    }
    return match;
  }

  @Override
  public String toString() {
    return "{url=" + url + ", dataTimeout=" + data_timeout
        + ", maxDataPoints=" + max_data_points + ", internalAggregation="
        + internal_aggregation + ", dateFormat=" + day_format
        + ", queryParams=" + query_params + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private String url = DEFAULT_URL;
    @JsonProperty
    private String dataTimeout = DEFAULT_DATA_TIMEOUT;
    @JsonProperty
    private String connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    @JsonProperty
    private int maxDataPoints = DEFAULT_MAX_DATA_POINTS;
    @JsonProperty
    private boolean internalAggregation;
    @JsonProperty
    private String dateFormat = DEFAULT_DATE_FORMAT;
    @JsonProperty
    private List<QueryParam> queryParams;

    public Builder setUrl(final String url) {
      this.url = url;
      return this;
    }

    public Builder setDataTimeout(final String data_timeout) {
      dataTimeout = data_timeout;
      return this;
    }

    public Builder setConnectTimeout(final String connect_timeout) {
      connectTimeout = connect_timeout;
      return this;
    }

    public Builder setMaxDataPoints(final int max_data_points) {
      maxDataPoints = max_data_points;
      return this;
    }

    public Builder setInternalAggregation(final boolean internal_aggregation) {
      internalAggregation = internal_aggregation;
      return this;
    }

    public Builder setDateFormat(final String date_format) {
      dateFormat = date_format;
      return this;
    }

    public Builder setQueryParams(final List<QueryParam> query_params) {
      queryParams = query_params;
      return this;
    }

    public Builder addQueryParam(final QueryParam query_param) {
      if (queryParams == null) {
        queryParams = Lists.newArrayList();
      }
      queryParams.add(query_param);
      return this;
    }

    public StorageConfig build() {
      return new StorageConfig(this);
    }
  }
}
