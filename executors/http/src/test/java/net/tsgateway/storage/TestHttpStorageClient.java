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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.http.HttpResponse;
import org.apache.http.HttpVersion;
import org.apache.http.NameValuePair;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.BasicHttpEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.message.BasicStatusLine;
import org.apache.http.nio.ContentDecoder;
import org.apache.http.nio.IOControl;
import org.apache.http.nio.protocol.HttpAsyncRequestProducer;
import org.apache.http.nio.protocol.HttpAsyncResponseConsumer;
import org.apache.http.protocol.BasicHttpContext;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.google.common.collect.Maps;
import com.google.common.io.ByteStreams;
import com.stumbleupon.async.Deferred;

import net.tsgateway.exceptions.QueryExecutionException;
import net.tsgateway.exceptions.QueryTimeoutException;
import net.tsgateway.exceptions.RemoteQueryExecutionException;

public class TestHttpStorageClient {
  private static final String URL = "http://clickhouse:8123/";

  private CloseableHttpAsyncClient client;
  private ExecutorService executor;
  private IOControl ioctrl;
  private FutureCallback<HttpResponse> callback;

  @Before
  public void before() throws Exception {
    client = mock(CloseableHttpAsyncClient.class);
    executor = Executors.newCachedThreadPool();
    ioctrl = mock(IOControl.class);
  }

  @After
  public void after() throws Exception {
    executor.shutdownNow();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new HttpStorageClient(null, 1000, executor);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new HttpStorageClient(client, 1000, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new HttpStorageClient(client, 1000, executor, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    // a caller owned client and executor are left open
    new HttpStorageClient(client, 1000, executor).close();
    verify(client, never()).close();
    assertFalse(executor.isShutdown());
  }

  @Test
  public void requestWithExternalTable() throws Exception {
    final HttpPost post = new HttpStorageClient(client, 1000, executor).newRequest(URL,
        "SELECT 1", ExternalTable.metricsList(Arrays.asList("a.b", "c.d")),
        30000);
    final Map<String, String> params = params(post);
    assertEquals("SELECT 1", params.get(HttpStorageClient.QUERY_PARAM));
    assertEquals("TSV", params.get("metrics_list_format"));
    assertEquals("Path String", params.get("metrics_list_structure"));
    assertTrue(params.containsKey(HttpStorageClient.QUERY_ID_PARAM));
    assertEquals(1000, post.getConfig().getConnectTimeout());
    assertEquals(30000, post.getConfig().getSocketTimeout());

    assertTrue(post.getEntity().getContentType().getValue()
        .startsWith("multipart/form-data"));
    final ByteArrayOutputStream body = new ByteArrayOutputStream();
    post.getEntity().writeTo(body);
    final String multipart = new String(body.toByteArray(),
        StandardCharsets.UTF_8);
    assertTrue(multipart, multipart.contains("name=\"metrics_list\""));
    assertTrue(multipart, multipart.contains("a.b\nc.d\n"));
  }

  @Test
  public void requestWithoutTable() throws Exception {
    final HttpPost post = new HttpStorageClient(client, 1000, executor).newRequest(URL,
        "SELECT 1", null, 5000);
    assertNull(params(post).get(HttpStorageClient.QUERY_PARAM));
    final ByteArrayOutputStream body = new ByteArrayOutputStream();
    post.getEntity().writeTo(body);
    assertEquals("SELECT 1", new String(body.toByteArray(),
        StandardCharsets.UTF_8));
  }

  @Test (timeout = 10000)
  public void queryStreamsLargeBody() throws Exception {
    final byte[] body = new byte[1024 * 1024];
    new Random(42).nextBytes(body);
    final Deferred<InputStream> deferred =
        new HttpStorageClient(client, 1000, executor, 4096)
          .query(URL, "SELECT 1", null, 5000);
    final StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(200, null, true));

    // handed out before any content arrived
    final InputStream stream = deferred.join(1000);
    final Future<byte[]> read = executor.submit(new Callable<byte[]>() {
      @Override
      public byte[] call() throws Exception {
        try {
          return ByteStreams.toByteArray(stream);
        } finally {
          stream.close();
        }
      }
    });
    feed(consumer, new ChunkDecoder(body, 1500));
    assertArrayEquals(body, read.get(5, TimeUnit.SECONDS));
    // the reactor paused every time the small buffer filled up
    verify(ioctrl, atLeastOnce()).suspendInput();
    callback.completed(response(200, null, true));
  }

  @Test (timeout = 10000)
  public void queryCompressed() throws Exception {
    ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    final GZIPOutputStream gzip = new GZIPOutputStream(compressed);
    gzip.write("Zipped!".getBytes(StandardCharsets.UTF_8));
    gzip.close();
    Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(200, "gzip", true));
    feed(consumer, new ChunkDecoder(compressed.toByteArray(), 3));
    assertEquals("Zipped!", new String(ByteStreams.toByteArray(
        deferred.join(1000)), StandardCharsets.UTF_8));

    compressed = new ByteArrayOutputStream();
    final DeflaterOutputStream deflate = new DeflaterOutputStream(compressed);
    deflate.write("Deflated!".getBytes(StandardCharsets.UTF_8));
    deflate.close();
    client = mock(CloseableHttpAsyncClient.class);
    deferred = new HttpStorageClient(client, 1000, executor)
        .query(URL, "SELECT 1", null, 5000);
    consumer = execute();
    consumer.responseReceived(response(200, "deflate", true));
    feed(consumer, new ChunkDecoder(compressed.toByteArray(), 64));
    assertEquals("Deflated!", new String(ByteStreams.toByteArray(
        deferred.join(1000)), StandardCharsets.UTF_8));
  }

  @Test
  public void queryStorageError() throws Exception {
    Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(404, null, true));
    feed(consumer, new ChunkDecoder(("Code: 60. DB::Exception: Table "
        + "graphite.data doesn't exist.\n").getBytes(StandardCharsets.UTF_8), 10));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(500, e.getStatusCode());
      assertEquals(URL, e.remoteEndpoint());
      assertEquals("Storage response status 404: Code: 60. DB::Exception: "
          + "Table graphite.data doesn't exist.", e.getMessage());
    }

    client = mock(CloseableHttpAsyncClient.class);
    deferred = new HttpStorageClient(client, 1000, executor)
        .query(URL, "SELECT 1", null, 5000);
    consumer = execute();
    consumer.responseReceived(response(502, null, true));
    feed(consumer, new ChunkDecoder("Bad Gateway".getBytes(
        StandardCharsets.UTF_8), 100));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(502, e.getStatusCode());
      assertEquals("Bad Gateway", e.getMessage());
    }
  }

  @Test
  public void queryStorageErrorBodyIsCapped() throws Exception {
    final byte[] body = new byte[StreamingResponseConsumer.MAX_ERROR_BODY * 2];
    Arrays.fill(body, (byte) 'x');
    final Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    final StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(500, null, true));
    feed(consumer, new ChunkDecoder(body, 10000));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals("Storage response status 500: ".length()
          + StreamingResponseConsumer.MAX_ERROR_BODY, e.getMessage().length());
    }
  }

  @Test
  public void queryUnknownEncoding() throws Exception {
    final Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    final StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(200, "br", true));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(500, e.getStatusCode());
      assertTrue(e.getMessage().startsWith("Unhandled content encoding [br]"));
    }
    // the rest of the body is refused
    try {
      consumer.consumeContent(new ChunkDecoder(new byte[10], 10), ioctrl);
      fail("Expected IOException");
    } catch (IOException e) { }
    assertTrue(consumer.abandoned());
  }

  @Test
  public void queryNullEntity() throws Exception {
    final Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    final StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(200, null, false));
    consumer.responseCompleted(new BasicHttpContext());
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertTrue(e.getMessage().startsWith("Content for http response was null"));
    }
  }

  @Test (timeout = 10000)
  public void queryBodyCutShort() throws Exception {
    final Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    final StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(200, null, true));
    final InputStream stream = deferred.join(1000);

    final ChunkDecoder decoder = new ChunkDecoder(new byte[2048], 512);
    decoder.stallAt(1024);
    consumer.consumeContent(decoder, ioctrl);
    final SocketTimeoutException timeout = new SocketTimeoutException("Boo!");
    consumer.failed(timeout);
    callback.failed(timeout);

    // an error instead of a clean but short end
    try {
      ByteStreams.toByteArray(stream);
      fail("Expected IOException");
    } catch (IOException e) { }
  }

  @Test (timeout = 10000)
  public void queryReaderClosesEarly() throws Exception {
    final Deferred<InputStream> deferred =
        new HttpStorageClient(client, 1000, executor, 4096)
          .query(URL, "SELECT 1", null, 5000);
    final StreamingResponseConsumer consumer = execute();
    consumer.responseReceived(response(200, null, true));
    final InputStream stream = deferred.join(1000);

    final ChunkDecoder decoder = new ChunkDecoder(new byte[65536], 1024);
    consumer.consumeContent(decoder, ioctrl);
    assertEquals(0, stream.read());
    stream.close();
    // the reactor is woken up to abort the exchange
    verify(ioctrl, atLeastOnce()).requestInput();
    assertTrue(consumer.abandoned());
    try {
      consumer.consumeContent(decoder, ioctrl);
      fail("Expected IOException");
    } catch (IOException e) { }
    callback.failed(new IOException("Aborted"));
  }

  @Test
  public void queryFailed() throws Exception {
    Deferred<InputStream> deferred = new HttpStorageClient(client, 1000,
        executor).query(URL, "SELECT 1", null, 5000);
    execute();
    callback.failed(new SocketTimeoutException("Boo!"));
    try {
      deferred.join(1000);
      fail("Expected QueryTimeoutException");
    } catch (QueryTimeoutException e) { }

    client = mock(CloseableHttpAsyncClient.class);
    deferred = new HttpStorageClient(client, 1000, executor)
        .query(URL, "SELECT 1", null, 5000);
    execute();
    callback.failed(new ConnectException("Refused"));
    try {
      deferred.join(1000);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(URL, e.remoteEndpoint());
      assertEquals(500, e.getStatusCode());
    }

    client = mock(CloseableHttpAsyncClient.class);
    deferred = new HttpStorageClient(client, 1000, executor)
        .query(URL, "SELECT 1", null, 5000);
    execute();
    callback.cancelled();
    try {
      deferred.join(1000);
      fail("Expected QueryTimeoutException");
    } catch (QueryTimeoutException e) { }
  }

  @Test
  public void queryBadUrl() throws Exception {
    try {
      new HttpStorageClient(client, 1000, executor)
          .query("http://bad url", "SELECT 1", null, 5000).join(1000);
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
    }
  }

  @Test
  public void errorFor() throws Exception {
    RemoteQueryExecutionException e =
        StreamingResponseConsumer.errorFor(503, " Unavailable\n", URL);
    assertEquals(503, e.getStatusCode());
    assertEquals("Unavailable", e.getMessage());
    e = StreamingResponseConsumer.errorFor(400, "Syntax error", URL);
    assertEquals(500, e.getStatusCode());
    assertEquals("Storage response status 400: Syntax error", e.getMessage());
    assertNull(e.getCause());
  }

  @Test
  public void abbreviate() throws Exception {
    assertEquals("SELECT 1", HttpStorageClient.abbreviate("SELECT 1"));
    final StringBuilder query = new StringBuilder();
    for (int i = 0; i < 600; i++) {
      query.append(i % 10);
    }
    final String abbreviated = HttpStorageClient.abbreviate(query.toString());
    assertEquals(500, abbreviated.length());
    assertTrue(abbreviated.contains("<...>"));
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private StreamingResponseConsumer execute() {
    final ArgumentCaptor<HttpAsyncResponseConsumer> consumer =
        ArgumentCaptor.forClass(HttpAsyncResponseConsumer.class);
    final ArgumentCaptor<FutureCallback> callback =
        ArgumentCaptor.forClass(FutureCallback.class);
    verify(client).execute(any(HttpAsyncRequestProducer.class),
        consumer.capture(), callback.capture());
    this.callback = callback.getValue();
    return (StreamingResponseConsumer) consumer.getValue();
  }

  /** Pushes a whole body the way the reactor does, then completes. */
  private void feed(final StreamingResponseConsumer consumer,
                    final ChunkDecoder decoder) throws Exception {
    while (!decoder.isCompleted()) {
      consumer.consumeContent(decoder, ioctrl);
      Thread.yield();
    }
    consumer.responseCompleted(new BasicHttpContext());
  }

  private static HttpResponse response(final int status,
                                       final String encoding,
                                       final boolean entity) {
    final BasicHttpResponse response = new BasicHttpResponse(
        new BasicStatusLine(HttpVersion.HTTP_1_1, status, "Status " + status));
    if (entity) {
      final BasicHttpEntity body = new BasicHttpEntity();
      if (encoding != null) {
        body.setContentEncoding(encoding);
      }
      response.setEntity(body);
    }
    return response;
  }

  private static Map<String, String> params(final HttpPost post) {
    final List<NameValuePair> pairs = URLEncodedUtils.parse(post.getURI(),
        StandardCharsets.UTF_8);
    final Map<String, String> params = Maps.newHashMap();
    for (final NameValuePair pair : pairs) {
      params.put(pair.getName(), pair.getValue());
    }
    return params;
  }

  /** Hands out a body a few bytes at a time, like a socket would. */
  static class ChunkDecoder implements ContentDecoder {
    private final byte[] body;
    private final int chunk;
    private int available;
    private int offset;

    ChunkDecoder(final byte[] body, final int chunk) {
      this.body = body;
      this.chunk = chunk;
      available = body.length;
    }

    /** Stops handing out bytes at the given offset, as if the peer hung. */
    void stallAt(final int offset) {
      available = offset;
    }

    @Override
    public int read(final ByteBuffer dst) {
      if (offset >= body.length) {
        return -1;
      }
      final int length = Math.min(Math.min(chunk, dst.remaining()),
          available - offset);
      if (length <= 0) {
        return 0;
      }
      dst.put(body, offset, length);
      offset += length;
      return length;
    }

    @Override
    public boolean isCompleted() {
      return offset >= body.length;
    }
  }
}
