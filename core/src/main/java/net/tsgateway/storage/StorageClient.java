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

import java.io.InputStream;

import com.stumbleupon.async.Deferred;

/**
 * Transport to the columnar store. Implementations send the query text with
 * an optional external table and hand back the raw response body.
 *
 * @since 3.0
 */
public interface StorageClient {

  /**
   * Issues a query.
   * @param url The base URL of the storage endpoint.
   * @param query The query text.
   * @param table An optional external table, may be null.
   * @param timeout_ms The round trip timeout in milliseconds.
   * @return A deferred resolving to the response body as soon as it starts
   * to arrive. The deferred never fires on a transport I/O thread, so
   * callbacks may block reading the stream. The caller closes the stream;
   * closing it before the end abandons the rest of the body. Errors are
   * {@link net.tsgateway.exceptions.QueryExecutionException}s.
   */
  public Deferred<InputStream> query(final String url,
                                     final String query,
                                     final ExternalTable table,
                                     final long timeout_ms);
}
