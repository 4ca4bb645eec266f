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
package net.tsgateway.utils;

import com.stumbleupon.async.DeferredGroupException;

import net.tsgateway.exceptions.QueryExecutionException;

/**
 * Utilities for unwrapping the exceptions of grouped deferreds.
 *
 * @since 3.0
 */
public final class Exceptions {

  private Exceptions() {
    // utility class
  }

  /**
   * Walks nested {@link DeferredGroupException}s to the first real cause.
   * @param e A DeferredGroupException to parse
   * @return The root cause of the exception if found.
   */
  public static Throwable getCause(final DeferredGroupException e) {
    Throwable ex = e;
    while (ex.getClass().equals(DeferredGroupException.class)) {
      if (ex.getCause() == null) {
        break;
      } else {
        ex = ex.getCause();
      }
    }
    return ex;
  }

  /**
   * Converts any throwable seen by a fetch task into a
   * {@link QueryExecutionException}, unwrapping deferred groups first.
   * @param t The throwable.
   * @return The throwable itself if it already is a query exception or a
   * wrapping 500 otherwise.
   */
  public static QueryExecutionException toQueryException(final Throwable t) {
    Throwable cause = t;
    if (cause instanceof DeferredGroupException) {
      cause = getCause((DeferredGroupException) cause);
    }
    if (cause instanceof QueryExecutionException) {
      return (QueryExecutionException) cause;
    }
    return new QueryExecutionException("Unexpected failure: "
        + cause.getMessage(), 500,
        cause instanceof Exception ? (Exception) cause : new RuntimeException(cause));
  }
}
