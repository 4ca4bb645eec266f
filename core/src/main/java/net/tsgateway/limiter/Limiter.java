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
package net.tsgateway.limiter;

import net.tsgateway.exceptions.AdmissionException;

/**
 * Bounds the number of storage queries in flight. Every successful
 * {@link #enter(long)} or {@link #tryEnter()} must be paired with exactly one
 * {@link #leave()}, usually in a finally block.
 *
 * @since 3.0
 */
public interface Limiter {

  /**
   * Claims a slot, blocking until one frees up or the deadline passes.
   * @param deadline_ms The absolute deadline in epoch milliseconds.
   * @throws AdmissionException if no slot was obtained in time or the
   * waiting thread was interrupted.
   */
  public void enter(final long deadline_ms);

  /**
   * Claims a slot without blocking.
   * @throws AdmissionException if all slots are taken.
   */
  public void tryEnter();

  /** Releases a slot claimed earlier. */
  public void leave();

  /** @return The number of slots, 0 if unlimited. */
  public int capacity();

  /** @return Whether the limiter actually limits anything. */
  public boolean enabled();
}
