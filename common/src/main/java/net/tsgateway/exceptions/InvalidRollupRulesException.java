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
 * A retention rule set failed to load: a bad regular expression, an unknown
 * aggregation function or an unparseable rule file. A rule set that throws
 * this is never used.
 *
 * @since 3.0
 */
public class InvalidRollupRulesException extends IllegalArgumentException {
  private static final long serialVersionUID = -6682054106871238541L;

  /**
   * Default ctor.
   * @param msg A non-null message.
   */
  public InvalidRollupRulesException(final String msg) {
    super(msg);
  }

  /**
   * Ctor with a cause.
   * @param msg A non-null message.
   * @param e The cause.
   */
  public InvalidRollupRulesException(final String msg, final Throwable e) {
    super(msg, e);
  }
}
