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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.http.HttpResponse;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.entity.mime.MultipartEntityBuilder;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.apache.http.nio.client.methods.HttpAsyncMethods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Deferred;

import net.tsgateway.configuration.StorageConfig;
import net.tsgateway.exceptions.QueryExecutionException;
import net.tsgateway.exceptions.QueryTimeoutException;
import net.tsgateway.exceptions.RemoteQueryExecutionException;
import net.tsgateway.utils.DateTime;

/**
 * Sends queries to the ClickHouse HTTP interface on an asynchronous Apache
 * HTTP client.
 * <p>
 * The query text travels in the {@code query} URL parameter. An external
 * table is attached as a multipart form file named after the table, its
 * format and structure announced in the {@code <name>_format} and
 * {@code <name>_structure} parameters. Without a table the query is the
 * request body.
 * <p>
 * Response bodies are streamed through a {@link StreamingResponseConsumer}
 * and handed out on a delivery executor, never on the I/O reactor, so the
 * reader may block while the rest of the body arrives.
 *
 * @since 3.0
 */
public class HttpStorageClient implements StorageClient, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(HttpStorageClient.class);

  public static final String QUERY_PARAM = "query";
  public static final String QUERY_ID_PARAM = "query_id";
  public static final String USER_AGENT = "tsgateway/3.0";

  /** Queries longer than this are abbreviated in logs. */
  static final int MAX_LOGGED_QUERY = 500;

  /** Response bytes buffered per query before reading from storage pauses. */
  static final int DEFAULT_BUFFER_SIZE = 256 * 1024;

  /** The client. */
  protected final CloseableHttpAsyncClient client;

  /** Calls back the query deferreds. */
  protected final Executor executor;

  private final int connect_timeout;
  private final int buffer_size;
  private final boolean owns_client;

  /**
   * Ctor building and starting a private client and delivery pool that
   * {@link #close()} shuts down.
   * @param config The non-null storage settings.
   */
  public HttpStorageClient(final StorageConfig config) {
    this(HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(8).build())
        .setMaxConnTotal(200)
        .setMaxConnPerRoute(25)
        .build(), config.connectTimeout(),
        Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("storage-response-%d")
            .build()),
        DEFAULT_BUFFER_SIZE, true);
    client.start();
    LOG.info("Initialized storage HTTP client for " + config.url());
  }

  /**
   * Ctor with a started client and an executor owned by the caller.
   * @param client The non-null client.
   * @param connect_timeout The connect timeout in milliseconds.
   * @param executor The non-null executor that calls back query results.
   */
  public HttpStorageClient(final CloseableHttpAsyncClient client,
                           final long connect_timeout,
                           final Executor executor) {
    this(client, connect_timeout, executor, DEFAULT_BUFFER_SIZE, false);
  }

  /**
   * Ctor with a caller owned client and executor and a custom buffer size.
   * @param client The non-null client.
   * @param connect_timeout The connect timeout in milliseconds.
   * @param executor The non-null executor that calls back query results.
   * @param buffer_size The response bytes buffered per query.
   */
  HttpStorageClient(final CloseableHttpAsyncClient client,
                    final long connect_timeout,
                    final Executor executor,
                    final int buffer_size) {
    this(client, connect_timeout, executor, buffer_size, false);
  }

  private HttpStorageClient(final CloseableHttpAsyncClient client,
                            final long connect_timeout,
                            final Executor executor,
                            final int buffer_size,
                            final boolean owns_client) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    if (buffer_size < 1) {
      throw new IllegalArgumentException("Buffer size must be at least 1.");
    }
    this.client = client;
    this.executor = executor;
    this.connect_timeout = (int) Math.min(Integer.MAX_VALUE, connect_timeout);
    this.buffer_size = buffer_size;
    this.owns_client = owns_client;
  }

  @Override
  public Deferred<InputStream> query(final String url,
                                     final String query,
                                     final ExternalTable table,
                                     final long timeout_ms) {
    final HttpPost post;
    try {
      post = newRequest(url, query, table, timeout_ms);
    } catch (URISyntaxException e) {
      return Deferred.fromError(new QueryExecutionException(
          "Invalid storage URL: " + url, 400, e));
    }

    final Deferred<InputStream> deferred = new Deferred<InputStream>();
    final StreamingResponseConsumer consumer = new StreamingResponseConsumer(
        url, executor, deferred, buffer_size);
    final long start = DateTime.nanoTime();

    class ResponseCallback implements FutureCallback<HttpResponse> {
      @Override
      public void completed(final HttpResponse response) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Response from [" + url + "] with status "
              + response.getStatusLine().getStatusCode() + " completed after "
              + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
        }
      }

      @Override
      public void failed(final Exception ex) {
        if (consumer.abandoned()) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Aborted the response from [" + url + "] after "
                + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms", ex);
          }
          return;
        }
        LOG.error("Storage query failed after "
            + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms: "
            + abbreviate(query), ex);
        if (ex instanceof SocketTimeoutException
            || ex instanceof ConnectTimeoutException) {
          consumer.fail(new QueryTimeoutException("Storage at " + url
              + " timed out", ex));
        } else {
          consumer.fail(new RemoteQueryExecutionException(
              "Storage request failed: " + ex.getMessage(), url, 500, ex));
        }
      }

      @Override
      public void cancelled() {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Storage query was cancelled: " + abbreviate(query));
        }
        consumer.fail(new QueryTimeoutException("Storage query to "
            + url + " was cancelled"));
      }
    }

    client.execute(HttpAsyncMethods.create(post), consumer,
        new ResponseCallback());
    return deferred;
  }

  /**
   * Shuts down the client and delivery pool if this instance created them.
   */
  @Override
  public void close() throws IOException {
    if (owns_client) {
      try {
        client.close();
      } finally {
        ((ExecutorService) executor).shutdown();
      }
    }
  }

  /**
   * Builds the POST for a query.
   * @param url The base URL.
   * @param query The query text.
   * @param table An optional external table.
   * @param timeout_ms The socket timeout in milliseconds.
   * @return The request.
   * @throws URISyntaxException if the URL is invalid.
   */
  HttpPost newRequest(final String url,
                      final String query,
                      final ExternalTable table,
                      final long timeout_ms) throws URISyntaxException {
    final URIBuilder uri = new URIBuilder(url)
        .addParameter(QUERY_ID_PARAM,
            Long.toHexString(ThreadLocalRandom.current().nextLong()));
    if (table != null) {
      uri.addParameter(QUERY_PARAM, query)
         .addParameter(table.name() + "_format", table.format())
         .addParameter(table.name() + "_structure", table.structure());
    }
    final HttpPost post = new HttpPost(uri.build());
    final int timeout = (int) Math.min(Integer.MAX_VALUE, timeout_ms);
    post.setConfig(RequestConfig.custom()
        .setConnectTimeout(connect_timeout)
        .setConnectionRequestTimeout(timeout)
        .setSocketTimeout(timeout)
        .build());
    post.setHeader("User-Agent", USER_AGENT);
    post.setHeader("Accept-Encoding", "gzip, deflate");
    if (table != null) {
      post.setEntity(MultipartEntityBuilder.create()
          .addBinaryBody(table.name(), table.body(), ContentType.TEXT_PLAIN,
              table.name())
          .build());
    } else {
      post.setEntity(new StringEntity(query, StandardCharsets.UTF_8));
    }
    return post;
  }

  /**
   * @param query A query.
   * @return The query with its middle cut out if it's too long to log.
   */
  static String abbreviate(final String query) {
    if (query.length() <= MAX_LOGGED_QUERY) {
      return query;
    }
    return query.substring(0, 395) + "<...>"
        + query.substring(query.length() - 100);
  }
}
