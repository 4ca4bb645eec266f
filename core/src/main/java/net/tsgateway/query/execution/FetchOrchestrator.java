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
package net.tsgateway.query.execution;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.tsgateway.configuration.GatewayConfig;
import net.tsgateway.configuration.QueryParam;
import net.tsgateway.configuration.StorageConfig;
import net.tsgateway.data.PointStore;
import net.tsgateway.data.TargetGroup;
import net.tsgateway.data.TimeFrame;
import net.tsgateway.exceptions.MetricsLimitExceededException;
import net.tsgateway.exceptions.QueryExecutionException;
import net.tsgateway.exceptions.QueryTimeoutException;
import net.tsgateway.limiter.Limiter;
import net.tsgateway.query.plan.CommonStepResolver;
import net.tsgateway.query.plan.QueryPlan;
import net.tsgateway.query.plan.QueryPlanner;
import net.tsgateway.query.plan.StorageQuery;
import net.tsgateway.storage.RawRow;
import net.tsgateway.storage.RowBinaryDecoder;
import net.tsgateway.storage.SecondaryPointSource;
import net.tsgateway.storage.StorageClient;
import net.tsgateway.utils.DateTime;
import net.tsgateway.utils.Exceptions;
import net.tsgateway.utils.ReversePath;

/**
 * Fetches the points of a {@link MultiTarget} from storage.
 * <p>
 * Every (time frame, group) pair runs as its own task on the executor. A
 * task plans its group, sends one storage query per plan query under the
 * admission limiter of the query's duration bucket, decodes the RowBinary
 * answers into the task's {@link PointStore}, merges the secondary source if
 * there is one and finally consolidates the points. When storage aggregates,
 * all tasks of the request share one {@link CommonStepResolver} and every
 * participant is registered before the first task starts.
 * <p>
 * The whole request shares one deadline, derived from the data timeout of
 * the bucket matching the widest time frame. All tasks are waited for, even
 * after a failure, and the first failure in task order is thrown. No
 * partial result is ever returned.
 * <p>
 * The executor must be able to run all tasks of a request at once when
 * storage aggregates, otherwise queued tasks can't contribute their step
 * before the running ones give up waiting for it.
 *
 * @since 3.0
 */
public class FetchOrchestrator implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(FetchOrchestrator.class);

  private final StorageConfig storage;
  private final int max_metrics_per_target;
  private final long secondary_timeout;
  private final StorageClient client;
  private final Optional<SecondaryPointSource> secondary;
  private final ExecutorService executor;
  private final boolean owns_executor;
  private final QueryPlanner planner;

  /**
   * Ctor running tasks on a private cached pool that {@link #close()} shuts
   * down.
   * @param config The non-null configuration.
   * @param client The non-null storage client.
   * @param secondary The secondary point source, if any.
   */
  public FetchOrchestrator(final GatewayConfig config,
                           final StorageClient client,
                           final Optional<SecondaryPointSource> secondary) {
    this(config, client, secondary, Executors.newCachedThreadPool(), true);
  }

  /**
   * Default ctor.
   * @param config The non-null configuration.
   * @param client The non-null storage client.
   * @param secondary The secondary point source, if any.
   * @param executor The executor running the fetch tasks. Owned by the
   * caller.
   */
  public FetchOrchestrator(final GatewayConfig config,
                           final StorageClient client,
                           final Optional<SecondaryPointSource> secondary,
                           final ExecutorService executor) {
    this(config, client, secondary, executor, false);
  }

  private FetchOrchestrator(final GatewayConfig config,
                            final StorageClient client,
                            final Optional<SecondaryPointSource> secondary,
                            final ExecutorService executor,
                            final boolean owns_executor) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (client == null) {
      throw new IllegalArgumentException("Storage client cannot be null.");
    }
    if (secondary == null) {
      throw new IllegalArgumentException("Secondary source cannot be null, "
          + "use Optional.empty().");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    storage = config.storage();
    max_metrics_per_target = config.maxMetricsPerTarget();
    secondary_timeout = config.secondaryTimeout();
    this.client = client;
    this.secondary = secondary;
    this.executor = executor;
    this.owns_executor = owns_executor;
    planner = new QueryPlanner(storage.internalAggregation(),
        storage.dayFormat());
  }

  /**
   * Fetches every group of the request.
   * @param request The non-null request.
   * @return One result per (time frame, group) pair in request order.
   * @throws MetricsLimitExceededException if a time frame resolved to more
   * metrics than allowed. No query is sent in that case.
   * @throws QueryExecutionException the first failure of any task.
   */
  public List<FetchResult> fetch(final MultiTarget request) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    try {
      request.checkMetricsLimit(max_metrics_per_target);
    } catch (MetricsLimitExceededException e) {
      LOG.error("Rejecting " + request, e);
      throw e;
    }
    if (request.isEmpty()) {
      return Collections.emptyList();
    }

    final long deadline = DateTime.currentTimeMillis() + dataTimeout(request);
    final CommonStepResolver resolver;
    if (planner.aggregated()) {
      resolver = new CommonStepResolver();
      resolver.addParticipants(request.size());
    } else {
      resolver = null;
    }

    final List<Future<FetchResult>> futures = Lists.newArrayList();
    QueryExecutionException error = null;
    for (final TimeFrame time_frame : request.timeFrames()) {
      final TimeFrame capped = capDataPoints(time_frame);
      for (final TargetGroup group : request.groups(time_frame)) {
        try {
          futures.add(executor.submit(
              new FetchTask(time_frame, capped, group, resolver, deadline)));
        } catch (RejectedExecutionException e) {
          if (resolver != null) {
            resolver.doneWithoutContribution();
          }
          if (error == null) {
            error = new QueryExecutionException("Fetch task rejected for "
                + time_frame, 503, e);
          }
        }
      }
    }

    final List<FetchResult> results =
        new ArrayList<FetchResult>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException e) {
        if (error == null) {
          error = Exceptions.toQueryException(e.getCause());
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        for (int x = i; x < futures.size(); x++) {
          futures.get(x).cancel(true);
        }
        if (error == null) {
          error = new QueryExecutionException("Interrupted while fetching "
              + request, 500, e);
        }
        break;
      }
    }
    if (error != null) {
      throw error;
    }
    return results;
  }

  /** @return Whether storage aggregates the points. */
  public boolean aggregated() {
    return planner.aggregated();
  }

  /**
   * Shuts down the executor if this instance created it.
   */
  @Override
  public void close() {
    if (owns_executor) {
      executor.shutdownNow();
    }
  }

  /**
   * @param request The request.
   * @return The data timeout of the bucket matching the widest time frame.
   */
  long dataTimeout(final MultiTarget request) {
    return storage.queryParam(request.maxRange()).dataTimeout();
  }

  /**
   * @param time_frame The requested time frame.
   * @return The time frame with its point budget capped to the configured
   * maximum, which also replaces a missing budget.
   */
  TimeFrame capDataPoints(final TimeFrame time_frame) {
    final long max = storage.maxDataPoints();
    if (time_frame.maxDataPoints() <= 0 || time_frame.maxDataPoints() > max) {
      return time_frame.withMaxDataPoints(max);
    }
    return time_frame;
  }

  /** Fetches one group of one time frame. */
  class FetchTask implements Callable<FetchResult> {
    private final TimeFrame time_frame;
    private final TimeFrame capped;
    private final TargetGroup group;
    private final CommonStepResolver resolver;
    private final long deadline;
    private final PointStore store;

    /** Set once the task gave up, late answers must not touch the store. */
    private final AtomicBoolean aborted;

    FetchTask(final TimeFrame time_frame,
              final TimeFrame capped,
              final TargetGroup group,
              final CommonStepResolver resolver,
              final long deadline) {
      this.time_frame = time_frame;
      this.capped = capped;
      this.group = group;
      this.resolver = resolver;
      this.deadline = deadline;
      store = new PointStore();
      aborted = new AtomicBoolean();
    }

    @Override
    public FetchResult call() throws Exception {
      try {
        return run();
      } catch (RuntimeException e) {
        aborted.set(true);
        LOG.error("Failed to fetch " + group.metricNames().size()
            + " metrics for " + time_frame, e);
        throw e;
      }
    }

    private FetchResult run() {
      final long start = DateTime.nanoTime();
      Deferred<PointStore> secondary_points = null;
      long secondary_deadline = 0;
      if (secondary.isPresent() && !group.metricNames().isEmpty()) {
        secondary_deadline = DateTime.currentTimeMillis() + secondary_timeout;
        try {
          secondary_points = secondary.get().fetch(group.metricNames(), capped);
        } catch (RuntimeException e) {
          LOG.info("Secondary point source failed for " + time_frame
              + ", continuing without it", e);
        }
      }

      final QueryPlan plan = planner.plan(capped, group, resolver);
      if (plan.isEmpty()) {
        return new FetchResult(time_frame, group, store,
            plan.appliedFunctions());
      }

      final long bytes = readStorage(plan);
      mergeSecondary(secondary_points, secondary_deadline);
      LOG.info("Parsed " + bytes + " bytes and " + store.size()
          + " points for " + time_frame + " from " + group.storageTable()
          + " in " + DateTime.msFromNanoDiff(DateTime.nanoTime(), start)
          + "ms");

      plan.assign(store);
      // storage already sorted and consolidated aggregated answers
      if (!plan.aggregated() || secondary.isPresent()) {
        store.sort();
        store.uniq();
        store.rollupPoints(time_frame.from(), store.getCommonStep(),
            group.rollupRules());
      }
      return new FetchResult(time_frame, group, store, plan.appliedFunctions());
    }

    /**
     * Sends the plan's queries and decodes the answers into the store. Each
     * query holds an admission slot until its answer is decoded or fails.
     * @return The number of bytes decoded.
     */
    private long readStorage(final QueryPlan plan) {
      final QueryParam param = storage.queryParam(plan.until() - plan.from());
      final Limiter limiter = param.limiter();
      final List<Slot> slots =
          Lists.newArrayListWithCapacity(plan.queries().size());
      final List<Deferred<Long>> deferreds =
          Lists.newArrayListWithCapacity(plan.queries().size());
      boolean done = false;
      try {
        for (final StorageQuery query : plan.queries()) {
          limiter.enter(deadline);
          final Slot slot = new Slot(limiter);
          slots.add(slot);
          deferreds.add(client.query(param.url(), query.text(), query.table(),
                  Math.min(param.dataTimeout(), remaining()))
              .addCallbacks(new DecodeCB(plan.aggregated(), slot),
                  new ReleaseEB(slot)));
        }
        long bytes = 0;
        for (final long read : Deferred.group(deferreds).join(remaining())) {
          bytes += read;
        }
        done = true;
        return bytes;
      } catch (TimeoutException e) {
        throw new QueryTimeoutException("Timed out waiting for storage to "
            + "answer for " + time_frame, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new QueryExecutionException("Interrupted waiting for storage "
            + "for " + time_frame, 500, e);
      } catch (Exception e) {
        throw Exceptions.toQueryException(e);
      } finally {
        if (!done) {
          aborted.set(true);
        }
        for (final Slot slot : slots) {
          slot.release();
        }
      }
    }

    /** @return Milliseconds left until the deadline, at least 1. */
    private long remaining() {
      final long remaining = deadline - DateTime.currentTimeMillis();
      if (remaining <= 0) {
        throw new QueryTimeoutException("Deadline exceeded fetching "
            + time_frame);
      }
      return remaining;
    }

    private void mergeSecondary(final Deferred<PointStore> deferred,
                                final long secondary_deadline) {
      if (deferred == null) {
        return;
      }
      final PointStore points;
      try {
        points = deferred.join(Math.max(1,
            secondary_deadline - DateTime.currentTimeMillis()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new QueryExecutionException("Interrupted waiting for the "
            + "secondary source for " + time_frame, 500, e);
      } catch (Exception e) {
        LOG.info("Secondary point source failed for " + time_frame
            + ", continuing without it", e);
        return;
      }
      if (points != null) {
        synchronized (store) {
          store.merge(points);
        }
      }
    }

    /** Decodes one answer, appending row by row under the store lock. */
    class DecodeCB implements Callback<Long, InputStream> {
      private final boolean aggregated;
      private final Slot slot;

      DecodeCB(final boolean aggregated, final Slot slot) {
        this.aggregated = aggregated;
        this.slot = slot;
      }

      @Override
      public Long call(final InputStream stream) throws Exception {
        final RowBinaryDecoder decoder =
            new RowBinaryDecoder(stream, aggregated);
        try {
          while (decoder.hasNext()) {
            final RawRow row = decoder.next();
            final String name = group.reversed()
                ? ReversePath.reverse(row.nameString()) : row.nameString();
            synchronized (store) {
              if (aborted.get()) {
                break;
              }
              final int id = store.intern(name);
              final long[] times = row.times();
              final double[] values = row.values();
              final long[] timestamps = row.timestamps();
              for (int i = 0; i < times.length; i++) {
                store.appendPoint(id, values[i], times[i], timestamps[i]);
              }
            }
          }
          return decoder.bytesRead();
        } finally {
          slot.release();
          try {
            decoder.close();
          } catch (IOException e) {
            LOG.warn("Failed to close the storage response for "
                + time_frame, e);
          }
        }
      }
    }

    /** Frees the slot of a query that failed before decoding. */
    class ReleaseEB implements Callback<Exception, Exception> {
      private final Slot slot;

      ReleaseEB(final Slot slot) {
        this.slot = slot;
      }

      @Override
      public Exception call(final Exception e) throws Exception {
        slot.release();
        return e;
      }
    }
  }

  /** One admission slot, released at most once. */
  static class Slot {
    private final Limiter limiter;
    private final AtomicBoolean released;

    Slot(final Limiter limiter) {
      this.limiter = limiter;
      released = new AtomicBoolean();
    }

    void release() {
      if (released.compareAndSet(false, true)) {
        limiter.leave();
      }
    }
  }
}
