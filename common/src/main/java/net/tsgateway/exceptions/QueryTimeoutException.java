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
 * The request deadline or a storage round trip timed out.
 *
 * @since 3.0
 */
public class QueryTimeoutException extends QueryExecutionException {
  private static final long serialVersionUID = -1617280427745123806L;

  /**
   * Default ctor.
   * @param msg A non-null message.
   */
  public QueryTimeoutException(final String msg) {
    super(msg, 504);
  }

  /**
   * Ctor with a cause.
   * @param msg A non-null message.
   * @param e The cause.
   */
  public QueryTimeoutException(final String msg, final Exception e) {
    super(msg, 504, e);
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.RETRY;
  }
}
