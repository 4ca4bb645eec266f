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
package net.tsgateway.exceptions;

/**
 * A target resolved to more metrics than the configured cap. Raised before
 * any storage query is sent.
 *
 * @since 3.0
 */
public class MetricsLimitExceededException extends QueryExecutionException {
  private static final long serialVersionUID = -4810525032776131092L;

  /** How many metrics the target resolved to. */
  private final int metrics;

  /** The configured cap. */
  private final int limit;

  /**
   * Default ctor.
   * @param metrics How many metrics the target resolved to.
   * @param limit The configured cap.
   */
  public MetricsLimitExceededException(final int metrics, final int limit) {
    super("metrics limit exceeded: " + metrics + " > " + limit, 403);
    this.metrics = metrics;
    this.limit = limit;
  }

  /** @return How many metrics the target resolved to. */
  public int metrics() {
    return metrics;
  }

  /** @return The configured cap. */
  public int limit() {
    return limit;
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.POLICY_REJECTED;
  }
}
