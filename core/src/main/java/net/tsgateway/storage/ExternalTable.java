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
package net.tsgateway.storage;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * An out-of-band table shipped along with a storage query, referenced by
 * name from the query text. The body is one row per line, each followed by
 * a newline.
 *
 * @since 3.0
 */
public final class ExternalTable {
  /** The name queries use for the metric list. */
  public static final String METRICS_LIST = "metrics_list";

  /** Structure of the metric list. */
  public static final String PATH_STRUCTURE = "Path String";

  /** Tab separated values. */
  public static final String TSV = "TSV";

  private final String name;
  private final String structure;
  private final String format;
  private final List<String> rows;

  /**
   * Default ctor.
   * @param name The non-null and non-empty table name.
   * @param structure The column declaration, e.g. {@code Path String}.
   * @param format The body format, e.g. {@code TSV}.
   * @param rows The rows, one per line.
   */
  public ExternalTable(final String name,
                       final String structure,
                       final String format,
                       final Collection<String> rows) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(structure)) {
      throw new IllegalArgumentException("Structure cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(format)) {
      throw new IllegalArgumentException("Format cannot be null or empty.");
    }
    this.name = name;
    this.structure = structure;
    this.format = format;
    this.rows = rows == null ? ImmutableList.<String>of() : ImmutableList.copyOf(rows);
  }

  /**
   * @param paths The metric names in lookup form.
   * @return A {@code metrics_list} table of paths.
   */
  public static ExternalTable metricsList(final Collection<String> paths) {
    return new ExternalTable(METRICS_LIST, PATH_STRUCTURE, TSV, paths);
  }

  public String name() {
    return name;
  }

  public String structure() {
    return structure;
  }

  public String format() {
    return format;
  }

  public List<String> rows() {
    return rows;
  }

  /** @return The UTF-8 body, every row terminated by a newline. */
  public byte[] body() {
    final StringBuilder buf = new StringBuilder();
    for (final String row : rows) {
      buf.append(row).append('\n');
    }
    return buf.toString().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{name=")
        .append(name)
        .append(", structure=")
        .append(structure)
        .append(", format=")
        .append(format)
        .append(", rows=")
        .append(rows.size())
        .append("}")
        .toString();
  }
}
