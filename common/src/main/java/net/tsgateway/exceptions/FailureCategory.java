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
 * The coarse class of a fetch failure so the reply layer can pick a status
 * and decide whether the caller should retry.
 *
 * @since 3.0
 */
public enum FailureCategory {
  /** Deadline or barrier expiry. The same request may succeed later. */
  RETRY,

  /** Storage answered with data we can't decode. */
  MALFORMED_UPSTREAM,

  /** No admission slot could be obtained. */
  RESOURCE_EXHAUSTED,

  /** The request was refused by policy before any query was sent. */
  POLICY_REJECTED,

  /** Anything else. */
  INTERNAL
}
