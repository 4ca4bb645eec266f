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
package net.tsgateway.query.plan;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsgateway.utils.StepMath;

/**
 * Computes one step shared by every target group of a request that lets
 * storage downsample, so all series line up on one timeline. Each planner
 * registers before any of them starts, then either contributes its step or
 * leaves without an opinion, exactly once. Contributions fold into the
 * least common multiple under a lock; readers wait on a separate signal
 * until everyone has arrived or the timeout elapses.
 * <p>
 * A timed out wait yields {@link #FAILED}; callers must fail the request
 * instead of guessing a step.
 *
 * @since 3.0
 */
public class CommonStepResolver {
  private static final Logger LOG = LoggerFactory.getLogger(CommonStepResolver.class);

  /** Default wait for all participants in milliseconds. */
  public static final long DEFAULT_TIMEOUT = 2000;

  /** Returned when not everyone arrived in time. */
  public static final long FAILED = -1;

  /** Guards the fold. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Signalled when the last participant arrives. */
  private final Object completion = new Object();

  private final AtomicInteger pending = new AtomicInteger();

  private long result;

  /**
   * Registers participants. Must happen before any of them contributes.
   * @param participants The number of participants, positive.
   */
  public void addParticipants(final int participants) {
    if (participants < 1) {
      throw new IllegalArgumentException("Participants must be positive.");
    }
    pending.addAndGet(participants);
  }

  /**
   * Folds a participant's step into the result and marks it as arrived.
   * @param step The step in seconds, 0 for no opinion.
   */
  public void contribute(final long step) {
    if (step < 0) {
      throw new IllegalArgumentException("Step cannot be negative.");
    }
    lock.lock();
    try {
      result = StepMath.lcm(result, step);
    } finally {
      lock.unlock();
    }
    arrive();
  }

  /** Marks a participant as arrived without changing the result. */
  public void doneWithoutContribution() {
    arrive();
  }

  /**
   * Waits {@link #DEFAULT_TIMEOUT} milliseconds for all participants.
   * @return The common step or {@link #FAILED}.
   */
  public long getResult() {
    return getResult(DEFAULT_TIMEOUT);
  }

  /**
   * Waits for all participants.
   * @param timeout_ms How long to wait in milliseconds.
   * @return The common step or {@link #FAILED} if some participant did not
   * arrive in time or the thread was interrupted.
   */
  public long getResult(final long timeout_ms) {
    final long deadline = System.nanoTime()
        + TimeUnit.MILLISECONDS.toNanos(timeout_ms);
    synchronized (completion) {
      while (pending.get() > 0) {
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          LOG.error("Timed out waiting for " + pending.get()
              + " participants to contribute a step");
          return FAILED;
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(completion, remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOG.error("Interrupted waiting for the common step", e);
          return FAILED;
        }
      }
    }
    lock.lock();
    try {
      return result;
    } finally {
      lock.unlock();
    }
  }

  /** @return Participants that have not arrived yet. */
  public int pending() {
    return pending.get();
  }

  private void arrive() {
    final int remaining = pending.decrementAndGet();
    if (remaining < 0) {
      pending.incrementAndGet();
      throw new IllegalStateException("More arrivals than registered "
          + "participants.");
    }
    if (remaining == 0) {
      synchronized (completion) {
        completion.notifyAll();
      }
    }
  }

  @Override
  public String toString() {
    return "CommonStepResolver{pending=" + pending.get() + "}";
  }
}
