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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.entity.ContentType;
import org.apache.http.nio.ContentDecoder;
import org.apache.http.nio.IOControl;
import org.apache.http.nio.protocol.AbstractAsyncResponseConsumer;
import org.apache.http.nio.util.SharedInputBuffer;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stumbleupon.async.Deferred;

import net.tsgateway.exceptions.RemoteQueryExecutionException;

/**
 * Hands a storage response body to the caller while it is still arriving.
 * <p>
 * A 200 body flows through a bounded {@link SharedInputBuffer}: the I/O
 * reactor fills it and suspends input when it is full, the reader drains it
 * and input resumes. The deferred is called back on the delivery executor
 * as soon as the headers are in, so decompression and decoding never run on
 * a reactor thread. Any other status has its body buffered, up to
 * {@link #MAX_ERROR_BODY} bytes, and becomes a
 * {@link RemoteQueryExecutionException} once the exchange completes.
 * <p>
 * If the exchange fails after the stream was handed out, the reader gets an
 * {@link IOException} instead of a short body. Closing the stream early
 * aborts the exchange.
 *
 * @since 3.0
 */
class StreamingResponseConsumer
    extends AbstractAsyncResponseConsumer<HttpResponse> {
  private static final Logger LOG =
      LoggerFactory.getLogger(StreamingResponseConsumer.class);

  /** Bytes of a storage error kept for the exception message. */
  static final int MAX_ERROR_BODY = 64 * 1024;

  private final String remote_host;
  private final Executor executor;
  private final Deferred<InputStream> deferred;
  private final int buffer_size;

  /** Set once the deferred has been called back. */
  private final AtomicBoolean delivered = new AtomicBoolean();

  private volatile HttpResponse response;
  private volatile SharedInputBuffer buffer;
  private volatile ByteArrayOutputStream error_body;
  private volatile String encoding;
  private volatile IOControl io_control;
  private volatile boolean body_complete;
  private volatile boolean closed;
  private volatile IOException failure;

  /**
   * Default ctor.
   * @param remote_host The storage URL for errors.
   * @param executor The executor that calls back the deferred.
   * @param deferred The deferred to call back with the body or an error.
   * @param buffer_size The bytes buffered before input is suspended.
   */
  StreamingResponseConsumer(final String remote_host,
                            final Executor executor,
                            final Deferred<InputStream> deferred,
                            final int buffer_size) {
    if (buffer_size < 1) {
      throw new IllegalArgumentException("Buffer size must be at least 1.");
    }
    this.remote_host = remote_host;
    this.executor = executor;
    this.deferred = deferred;
    this.buffer_size = buffer_size;
  }

  @Override
  protected void onResponseReceived(final HttpResponse response) {
    this.response = response;
  }

  @Override
  protected void onEntityEnclosed(final HttpEntity entity,
                                  final ContentType content_type) {
    final Header header = entity.getContentEncoding();
    encoding = header != null && header.getValue() != null
        ? header.getValue().trim().toLowerCase() : "";
    if (response.getStatusLine().getStatusCode() != 200) {
      error_body = new ByteArrayOutputStream();
      return;
    }
    if (!encoding.isEmpty() && !encoding.equals("gzip")
        && !encoding.equals("x-gzip") && !encoding.equals("deflate")) {
      closed = true;
      fail(new RemoteQueryExecutionException("Unhandled content encoding ["
          + encoding + "] : " + response, remote_host, 500));
      return;
    }

    buffer = new SharedInputBuffer(buffer_size);
    final BodyStream body = new BodyStream();
    try {
      executor.execute(new Runnable() {
        @Override
        public void run() {
          final InputStream stream;
          try {
            stream = decompress(body, encoding);
          } catch (IOException e) {
            body.close();
            fail(new RemoteQueryExecutionException("Content parsing failure "
                + "for: " + response, remote_host, 500, e));
            return;
          }
          if (delivered.compareAndSet(false, true)) {
            deferred.callback(stream);
          } else {
            body.close();
          }
        }
      });
    } catch (RejectedExecutionException e) {
      body.close();
      fail(new RemoteQueryExecutionException("Response executor rejected "
          + "the body from " + remote_host, remote_host, 500, e));
    }
  }

  @Override
  protected void onContentReceived(final ContentDecoder decoder,
                                   final IOControl ioctrl) throws IOException {
    io_control = ioctrl;
    if (closed) {
      throw new IOException("Response body from " + remote_host
          + " was closed by the reader");
    }
    if (buffer != null) {
      buffer.consumeContent(decoder, ioctrl);
      if (decoder.isCompleted()) {
        body_complete = true;
      }
      return;
    }
    final ByteArrayOutputStream error = error_body;
    final ByteBuffer chunk = ByteBuffer.allocate(4096);
    while (decoder.read(chunk) > 0) {
      final int keep = Math.min(chunk.position(),
          MAX_ERROR_BODY - error.size());
      if (keep > 0) {
        error.write(chunk.array(), 0, keep);
      }
      chunk.clear();
    }
  }

  @Override
  protected HttpResponse buildResult(final HttpContext context) {
    if (response.getEntity() == null) {
      fail(new RemoteQueryExecutionException("Content for http response "
          + "was null: " + response, remote_host, 500));
      return response;
    }
    if (buffer != null) {
      body_complete = true;
      buffer.close();
    } else if (error_body != null) {
      fail(errorFor(response.getStatusLine().getStatusCode(),
          errorText(error_body.toByteArray(), encoding), remote_host));
    }
    return response;
  }

  @Override
  protected void releaseResources() {
    final SharedInputBuffer buffer = this.buffer;
    if (buffer != null && !body_complete) {
      final Exception cause = getException();
      if (cause instanceof SocketTimeoutException) {
        final SocketTimeoutException timeout = new SocketTimeoutException(
            "Timed out reading the response from " + remote_host);
        timeout.initCause(cause);
        failure = timeout;
      } else {
        failure = new IOException("Response body from " + remote_host
            + " ended early", cause);
      }
      buffer.shutdown();
    }
  }

  /**
   * Calls back the deferred with an error unless it already fired.
   * @param e The error.
   * @return True if the error was delivered.
   */
  boolean fail(final Exception e) {
    if (!delivered.compareAndSet(false, true)) {
      return false;
    }
    try {
      executor.execute(new Runnable() {
        @Override
        public void run() {
          deferred.callback(e);
        }
      });
    } catch (RejectedExecutionException ex) {
      LOG.warn("Response executor rejected an error callback for "
          + remote_host, ex);
      deferred.callback(e);
    }
    return true;
  }

  /** @return Whether the reader gave up on the body. */
  boolean abandoned() {
    return closed;
  }

  /**
   * Maps a non-200 storage answer to an exception. Proxy errors 501 to 511
   * keep their status, anything else is a 500.
   * @param status The HTTP status.
   * @param content The error text.
   * @param remote_host The storage URL.
   * @return The exception.
   */
  static RemoteQueryExecutionException errorFor(final int status,
                                                final String content,
                                                final String remote_host) {
    if (status > 500 && status < 512) {
      return new RemoteQueryExecutionException(content.trim(), remote_host,
          status);
    }
    return new RemoteQueryExecutionException("Storage response status "
        + status + ": " + content.trim(), remote_host, 500);
  }

  /**
   * Decodes a buffered error body. A truncated compressed body yields what
   * could be inflated.
   */
  static String errorText(final byte[] body, final String encoding) {
    if (encoding == null || encoding.isEmpty()) {
      return new String(body, StandardCharsets.UTF_8);
    }
    final ByteArrayOutputStream text = new ByteArrayOutputStream();
    try {
      final InputStream stream =
          decompress(new ByteArrayInputStream(body), encoding);
      final byte[] chunk = new byte[4096];
      int read;
      while ((read = stream.read(chunk)) >= 0) {
        text.write(chunk, 0, read);
      }
    } catch (IOException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Stopped inflating the error body after " + text.size()
            + " bytes", e);
      }
    }
    return new String(text.toByteArray(), StandardCharsets.UTF_8);
  }

  /**
   * Wraps a body in the decompressor for its content encoding.
   * @throws IOException if the encoding is unknown or a gzip header is bad.
   */
  static InputStream decompress(final InputStream stream,
                                final String encoding) throws IOException {
    if (encoding.isEmpty()) {
      return stream;
    }
    if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
      return new GZIPInputStream(stream);
    }
    if (encoding.equals("deflate")) {
      return new InflaterInputStream(stream);
    }
    throw new IOException("Unhandled content encoding [" + encoding + "]");
  }

  /** Reads the shared buffer, surfacing a failed exchange as an error. */
  private class BodyStream extends InputStream {
    @Override
    public int read() throws IOException {
      try {
        return check(buffer.read());
      } catch (InterruptedIOException e) {
        throw failed(e);
      }
    }

    @Override
    public int read(final byte[] b, final int off, final int len)
        throws IOException {
      if (len == 0) {
        return 0;
      }
      try {
        return check(buffer.read(b, off, len));
      } catch (InterruptedIOException e) {
        throw failed(e);
      }
    }

    @Override
    public int available() throws IOException {
      return buffer.available();
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      if (!body_complete) {
        buffer.shutdown();
        final IOControl ioctrl = io_control;
        if (ioctrl != null) {
          ioctrl.requestInput();
        }
      }
    }

    private int check(final int read) throws IOException {
      if (read < 0 && failure != null) {
        throw failed(null);
      }
      return read;
    }

    private IOException failed(final InterruptedIOException e) {
      final IOException failure = StreamingResponseConsumer.this.failure;
      if (failure == null) {
        return e;
      }
      if (failure instanceof SocketTimeoutException) {
        final SocketTimeoutException timeout =
            new SocketTimeoutException(failure.getMessage());
        timeout.initCause(failure);
        return timeout;
      }
      return new IOException(failure.getMessage(), failure);
    }
  }
}
