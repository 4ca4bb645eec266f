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

import java.io.InputStream;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.io.ByteStreams;

import net.tsgateway.storage.StorageClient;

/**
 * Reads the rules the storage engine itself applies to a table from
 * {@code system.graphite_retentions}.
 *
 * @since 3.0
 */
public class StorageRetentionRulesSource implements RetentionRulesSource {

  private final StorageClient client;
  private final String url;
  private final String database;
  private final String table;
  private final long timeout_ms;

  /**
   * Default ctor.
   * @param client The non-null storage client.
   * @param url The non-null storage URL.
   * @param table The table, optionally prefixed with a database and a dot.
   * @param timeout_ms The query timeout in milliseconds.
   */
  public StorageRetentionRulesSource(final StorageClient client,
                                     final String url,
                                     final String table,
                                     final long timeout_ms) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (Strings.isNullOrEmpty(url)) {
      throw new IllegalArgumentException("URL cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(table)) {
      throw new IllegalArgumentException("Table cannot be null or empty.");
    }
    this.client = client;
    this.url = url;
    this.timeout_ms = timeout_ms;
    final int idx = table.indexOf('.');
    if (idx > 0) {
      database = table.substring(0, idx);
      this.table = table.substring(idx + 1);
    } else {
      database = "default";
      this.table = table;
    }
  }

  @Override
  public List<RetentionPattern> load(final boolean force) throws Exception {
    final InputStream stream = client.query(url, query(), null, timeout_ms)
        .join(timeout_ms);
    try (final InputStream body = stream) {
      return RetentionRulesParser.parseSystemTable(ByteStreams.toByteArray(body));
    }
  }

  /** @return The retentions query for the table. */
  String query() {
    return new StringBuilder()
        .append("SELECT rule_type, regexp, function, age, precision, is_default")
        .append(" FROM system.graphite_retentions")
        .append(" ARRAY JOIN Tables AS table")
        .append(" WHERE (table.database = '")
        .append(escape(database))
        .append("') AND (table.table = '")
        .append(escape(table))
        .append("')")
        .append(" ORDER BY is_default ASC, priority ASC, regexp ASC, age ASC")
        .append(" FORMAT JSON")
        .toString();
  }

  private static String escape(final String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  @Override
  public String describe() {
    return "storage:" + database + "." + table;
  }
}
