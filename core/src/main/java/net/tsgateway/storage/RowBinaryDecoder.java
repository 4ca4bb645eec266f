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
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsgateway.exceptions.MalformedResponseException;
import net.tsgateway.exceptions.QueryExecutionException;
import net.tsgateway.exceptions.QueryTimeoutException;

/**
 * Lazily decodes a RowBinary response stream into {@link RawRow}s. The
 * stream is read in chunks into a buffer that starts small and doubles up to
 * a maximum; a single row larger than the maximum is malformed. Not thread
 * safe and not restartable.
 * <p>
 * Errors surface from {@link #hasNext()} as unchecked
 * {@link QueryExecutionException}s: {@link MalformedResponseException} for
 * bad data, {@link QueryTimeoutException} when the read times out and a
 * plain 500 for other read failures.
 *
 * @since 3.0
 */
public class RowBinaryDecoder implements Iterator<RawRow>, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(RowBinaryDecoder.class);

  /** Initial buffer size. */
  public static final int DEFAULT_INITIAL_BUFFER = 1024 * 1024;

  /** Largest buffer, i.e. the largest row. */
  public static final int DEFAULT_MAX_BUFFER = 64 * 1024 * 1024;

  private final InputStream stream;
  private final RowSplitter splitter;
  private final int max_buffer;

  private byte[] buffer;
  private int start;
  private int end;
  private boolean eof;
  private boolean done;
  private RawRow next;

  private long bytes_read;
  private long rows_read;
  private long points_read;

  /**
   * Ctor with the default buffer sizes.
   * @param stream The non-null response body.
   * @param aggregated Whether rows lack the timestamps array.
   */
  public RowBinaryDecoder(final InputStream stream, final boolean aggregated) {
    this(stream, aggregated, DEFAULT_INITIAL_BUFFER, DEFAULT_MAX_BUFFER);
  }

  /**
   * Default ctor.
   * @param stream The non-null response body.
   * @param aggregated Whether rows lack the timestamps array.
   * @param initial_buffer The initial buffer size, at least 1.
   * @param max_buffer The maximum buffer size, at least the initial size.
   */
  public RowBinaryDecoder(final InputStream stream,
                          final boolean aggregated,
                          final int initial_buffer,
                          final int max_buffer) {
    if (stream == null) {
      throw new IllegalArgumentException("Stream cannot be null.");
    }
    if (initial_buffer < 1) {
      throw new IllegalArgumentException("Initial buffer must be at least 1.");
    }
    if (max_buffer < initial_buffer) {
      throw new IllegalArgumentException("Max buffer cannot be less than "
          + "the initial buffer.");
    }
    this.stream = stream;
    splitter = new RowSplitter(aggregated);
    this.max_buffer = max_buffer;
    buffer = new byte[initial_buffer];
  }

  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (done) {
      return false;
    }
    while (true) {
      final int length = splitter.split(buffer, start, end - start, eof);
      if (length == RowSplitter.END) {
        done = true;
        return false;
      }
      if (length > 0) {
        next = splitter.decode(buffer, start, length);
        start += length;
        bytes_read += length;
        rows_read++;
        points_read += next.size();
        return true;
      }
      fill();
    }
  }

  @Override
  public RawRow next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more rows.");
    }
    final RawRow row = next;
    next = null;
    return row;
  }

  /** @return Bytes of complete rows decoded so far. */
  public long bytesRead() {
    return bytes_read;
  }

  /** @return Rows decoded so far. */
  public long rowsRead() {
    return rows_read;
  }

  /** @return Points in the rows decoded so far. */
  public long pointsRead() {
    return points_read;
  }

  @Override
  public void close() throws IOException {
    done = true;
    stream.close();
  }

  /** Reads more input, compacting or growing the buffer as needed. */
  private void fill() {
    if (start > 0) {
      System.arraycopy(buffer, start, buffer, 0, end - start);
      end -= start;
      start = 0;
    }
    if (end == buffer.length) {
      if (buffer.length >= max_buffer) {
        throw new MalformedResponseException("Row exceeds the maximum buffer "
            + "size of " + max_buffer + " bytes", null);
      }
      final byte[] grown = new byte[(int) Math.min((long) buffer.length * 2,
          max_buffer)];
      System.arraycopy(buffer, 0, grown, 0, end);
      buffer = grown;
      if (LOG.isDebugEnabled()) {
        LOG.debug("Grew the row buffer to " + buffer.length + " bytes");
      }
    }
    final int read;
    try {
      read = stream.read(buffer, end, buffer.length - end);
    } catch (SocketTimeoutException e) {
      throw new QueryTimeoutException("Timed out reading the storage "
          + "response", e);
    } catch (IOException e) {
      throw new QueryExecutionException("Failed to read the storage response",
          500, e);
    }
    if (read < 0) {
      eof = true;
    } else {
      end += read;
    }
  }
}
