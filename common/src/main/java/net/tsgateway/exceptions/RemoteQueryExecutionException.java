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

/**
 * The storage server answered with an error status or the connection to it
 * failed.
 *
 * @since 3.0
 */
public class RemoteQueryExecutionException extends QueryExecutionException {
  private static final long serialVersionUID = 5182738109456362270L;

  /** A description of the remote service that threw the exception. */
  private final String remote_endpoint;

  /**
   * Default ctor.
   * @param msg A non-null message.
   * @param remote_endpoint The remote that failed.
   * @param status_code The status code returned by the remote.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code) {
    this(msg, remote_endpoint, status_code, null);
  }

  /**
   * Ctor with a cause.
   * @param msg A non-null message.
   * @param remote_endpoint The remote that failed.
   * @param status_code The status code returned by the remote.
   * @param e The original exception. May be null.
   */
  public RemoteQueryExecutionException(final String msg,
                                       final String remote_endpoint,
                                       final int status_code,
                                       final Exception e) {
    super(msg, status_code, e);
    this.remote_endpoint = remote_endpoint;
  }

  /** @return The remote endpoint that threw this exception. */
  public String remoteEndpoint() {
    return remote_endpoint;
  }

  @Override
  public FailureCategory category() {
    // 5xx and connection failures may clear up on their own.
    return status_code >= 500 || status_code == 408 ?
        FailureCategory.RETRY : FailureCategory.INTERNAL;
  }
}
