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

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsgateway.exceptions.AdmissionException;
import net.tsgateway.utils.DateTime;

/**
 * A fixed number of fair slots backed by a {@link Semaphore}.
 *
 * @since 3.0
 */
public class SemaphoreLimiter implements Limiter {
  private static final Logger LOG = LoggerFactory.getLogger(SemaphoreLimiter.class);

  private final String name;
  private final int capacity;
  private final Semaphore slots;

  /**
   * Default ctor.
   * @param name A name used in errors and logs.
   * @param capacity The number of slots, at least 1.
   */
  public SemaphoreLimiter(final String name, final int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be at least 1.");
    }
    this.name = name;
    this.capacity = capacity;
    slots = new Semaphore(capacity, true);
  }

  /**
   * @param name A name used in errors and logs.
   * @param capacity The number of slots, 0 or less for no limit.
   * @return A semaphore limiter or the no-op limiter.
   */
  public static Limiter create(final String name, final int capacity) {
    if (capacity <= 0) {
      return NoopLimiter.INSTANCE;
    }
    return new SemaphoreLimiter(name, capacity);
  }

  @Override
  public void enter(final long deadline_ms) {
    final long wait = deadline_ms - DateTime.currentTimeMillis();
    try {
      if (wait > 0 && slots.tryAcquire(wait, TimeUnit.MILLISECONDS)) {
        return;
      }
      if (wait <= 0 && slots.tryAcquire()) {
        return;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AdmissionException("Interrupted waiting for a query slot on "
          + name);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Timed out waiting for one of " + capacity + " slots on " + name);
    }
    throw new AdmissionException("Timed out waiting for a query slot on "
        + name);
  }

  @Override
  public void tryEnter() {
    if (!slots.tryAcquire()) {
      throw new AdmissionException("Maximum queries exceeded on " + name);
    }
  }

  @Override
  public void leave() {
    slots.release();
  }

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public boolean enabled() {
    return true;
  }

  /** @return Currently free slots. */
  public int available() {
    return slots.availablePermits();
  }

  @Override
  public String toString() {
    return "SemaphoreLimiter{name=" + name + ", capacity=" + capacity
        + ", available=" + slots.availablePermits() + "}";
  }
}
