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

import java.util.Collections;
import java.util.List;

/**
 * Root of the exceptions raised while fetching a render request. Each one
 * carries an HTTP-like status code and a {@link FailureCategory} so that the
 * reply layer can tell a retry condition from bad upstream data or a policy
 * rejection.
 *
 * @since 3.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -3129651426019043817L;

  /** A status code associated with the exception. */
  protected final int status_code;

  /** An optional list of exceptions collected from parallel tasks. */
  protected final List<Exception> exceptions;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, (Exception) null);
  }

  /**
   * Ctor with the exceptions collected from parallel tasks.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param exceptions An optional list of exceptions. May be null or empty.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final List<Exception> exceptions) {
    super(msg);
    this.status_code = status_code;
    this.exceptions = exceptions;
  }

  /**
   * Ctor wrapping a cause.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg,
                                 final int status_code,
                                 final Exception e) {
    super(msg, e);
    this.status_code = status_code;
    exceptions = null;
  }

  /** @return The status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return The failure class used by the reply layer. */
  public FailureCategory category() {
    return FailureCategory.INTERNAL;
  }

  /** @return A list of exceptions that triggered this or an empty list. */
  public List<Exception> getExceptions() {
    return exceptions == null ? Collections.<Exception>emptyList() :
      Collections.<Exception>unmodifiableList(exceptions);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass().getSimpleName())
        .append("(")
        .append(status_code)
        .append("): ")
        .append(getMessage());
    if (exceptions != null && !exceptions.isEmpty()) {
      buf.append(" causes[");
      for (int i = 0; i < exceptions.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(exceptions.get(i));
      }
      buf.append("]");
    }
    return buf.toString();
  }
}
