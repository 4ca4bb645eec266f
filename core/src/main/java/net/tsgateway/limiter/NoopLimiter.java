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

/**
 * A limiter that admits everything.
 *
 * @since 3.0
 */
public final class NoopLimiter implements Limiter {

  /** The shared instance. */
  public static final NoopLimiter INSTANCE = new NoopLimiter();

  private NoopLimiter() {
  }

  @Override
  public void enter(final long deadline_ms) {
  }

  @Override
  public void tryEnter() {
  }

  @Override
  public void leave() {
  }

  @Override
  public int capacity() {
    return 0;
  }

  @Override
  public boolean enabled() {
    return false;
  }

  @Override
  public String toString() {
    return "NoopLimiter";
  }
}
