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
 * A query slot could not be obtained, either because the wait ran past the
 * deadline or because the limiter was full and the caller would not wait.
 *
 * @since 3.0
 */
public class AdmissionException extends QueryExecutionException {
  private static final long serialVersionUID = 6090318754418829154L;

  /**
   * Default ctor.
   * @param msg A non-null message.
   */
  public AdmissionException(final String msg) {
    super(msg, 503);
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.RESOURCE_EXHAUSTED;
  }
}
