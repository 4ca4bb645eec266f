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
package net.tsgateway.query.plan;

import com.google.common.base.Strings;

/**
 * Builds the filter clauses of storage queries by AND-ing expressions, each
 * side wrapped in parentheses once there is more than one.
 *
 * @since 3.0
 */
public class Where {
  private String where = "";

  /**
   * ANDs the expression onto the clause. Empty expressions are ignored.
   * @param expression An expression.
   * @return This.
   */
  public Where and(final String expression) {
    if (Strings.isNullOrEmpty(expression)) {
      return this;
    }
    if (where.isEmpty()) {
      where = expression;
    } else {
      where = "(" + where + ") AND (" + expression + ")";
    }
    return this;
  }

  /** @return The clause with a {@code WHERE} keyword or an empty string. */
  public String sql() {
    return where.isEmpty() ? "" : "WHERE " + where;
  }

  /** @return The clause with a {@code PREWHERE} keyword or an empty string. */
  public String preWhereSql() {
    return where.isEmpty() ? "" : "PREWHERE " + where;
  }

  @Override
  public String toString() {
    return where;
  }

  /**
   * @param field The column.
   * @param table An external table name.
   * @return A membership test against the table.
   */
  public static String inTable(final String field, final String table) {
    return field + " in " + table;
  }

  /**
   * @param field A Date column.
   * @param from The start in epoch seconds.
   * @param until The end in epoch seconds.
   * @param format How the writer derived the days.
   * @return An inclusive range over the days covering the times.
   */
  public static String dateBetween(final String field,
                                   final long from,
                                   final long until,
                                   final DayFormat format) {
    return field + " >= '" + format.from(from) + "' AND " + field + " <= '"
        + format.until(until) + "'";
  }

  /**
   * @param field A numeric time column.
   * @param from The start in epoch seconds.
   * @param until The end in epoch seconds.
   * @return An inclusive range.
   */
  public static String timestampBetween(final String field,
                                        final long from,
                                        final long until) {
    return field + " >= " + from + " AND " + field + " <= " + until;
  }
}
