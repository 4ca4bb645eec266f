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
package net.tsgateway.rollup;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import net.tsgateway.exceptions.InvalidRollupRulesException;

/**
 * Holds the current {@link RetentionRules} of a table and optionally reloads
 * them from the source on a timer. A reload swaps the whole rule set in one
 * step; a reload that fails keeps the previous set and logs the error.
 * Lookups never block.
 * <p>
 * Note that if the interval is 0 or no timer is given then the rules are
 * loaded once at build time.
 *
 * @since 3.0
 */
public class RollupRules implements RollupResolver, TimerTask {
  private static final Logger LOG = LoggerFactory.getLogger(RollupRules.class);

  private final Builder builder;
  private final AtomicReference<RetentionRules> rules;
  private volatile Timeout timeout;
  private volatile boolean closed;

  private RollupRules(final Builder builder) {
    if (builder.interval < 0) {
      throw new IllegalArgumentException("Interval cannot be negative.");
    }
    if (builder.interval > 0 && builder.source != null && builder.timer == null) {
      throw new IllegalArgumentException("A timer is required when the "
          + "reload interval is set.");
    }
    this.builder = builder;
    rules = new AtomicReference<RetentionRules>();

    if (builder.source == null) {
      rules.set(compile(null));
      LOG.info("Using default rollup rules only: " + rules.get().patterns().size()
          + " patterns");
    } else {
      final List<RetentionPattern> patterns;
      try {
        patterns = builder.source.load(true);
      } catch (InvalidRollupRulesException e) {
        throw e;
      } catch (Exception e) {
        throw new InvalidRollupRulesException("Failed to load rollup rules from "
            + builder.source.describe(), e);
      }
      rules.set(compile(patterns));
      LOG.info("Loaded rollup rules from " + builder.source.describe() + ": "
          + rules.get().patterns().size() + " patterns");
      schedule();
    }
  }

  @Override
  public Resolution lookup(final String metric, final long age) {
    return rules.get().lookup(metric, age);
  }

  /** @return The current rule set, never null. */
  public RetentionRules current() {
    return rules.get();
  }

  @Override
  public void run(final Timeout timeout) throws Exception {
    if (closed) {
      return;
    }
    reload(false);
    schedule();
  }

  /**
   * Loads the rules from the source and swaps them in if they changed.
   * @param force Whether to parse the source even if it looks unchanged.
   * @return True if a new set was installed.
   */
  public boolean reload(final boolean force) {
    if (builder.source == null) {
      return false;
    }
    try {
      final List<RetentionPattern> patterns = builder.source.load(force);
      if (patterns == null) {
        return false;
      }
      rules.set(compile(patterns));
      LOG.info("Reloaded rollup rules from " + builder.source.describe() + ": "
          + rules.get().patterns().size() + " patterns");
      return true;
    } catch (Exception e) {
      LOG.error("Failed to reload rollup rules from "
          + builder.source.describe() + ", keeping the previous rules", e);
      return false;
    }
  }

  /** Stops the periodic reload. */
  public void close() {
    closed = true;
    final Timeout timeout = this.timeout;
    if (timeout != null) {
      timeout.cancel();
    }
  }

  private void schedule() {
    if (closed || builder.interval < 1 || builder.timer == null) {
      return; // not scheduling it.
    }
    timeout = builder.timer.newTimeout(this, builder.interval,
        TimeUnit.MILLISECONDS);
  }

  private RetentionRules compile(final List<RetentionPattern> patterns) {
    return RetentionRules.newBuilder()
        .setPatterns(patterns)
        .setDefaultPrecision(builder.default_precision)
        .setDefaultFunction(builder.default_function)
        .build();
  }

  @Override
  public String toString() {
    return "RollupRules{source="
        + (builder.source == null ? "defaults" : builder.source.describe())
        + ", interval=" + builder.interval + "}";
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private RetentionRulesSource source;
    private long default_precision;
    private String default_function;
    private Timer timer;
    private long interval;

    /**
     * @param source An optional source, null for the defaults only.
     * @return The builder.
     */
    public Builder setSource(final RetentionRulesSource source) {
      this.source = source;
      return this;
    }

    public Builder setDefaultPrecision(final long default_precision) {
      this.default_precision = default_precision;
      return this;
    }

    public Builder setDefaultFunction(final String default_function) {
      this.default_function = default_function;
      return this;
    }

    public Builder setTimer(final Timer timer) {
      this.timer = timer;
      return this;
    }

    /**
     * @param interval The reload interval in milliseconds, 0 to disable.
     * @return The builder.
     */
    public Builder setInterval(final long interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Loads the initial rules.
     * @return The holder.
     * @throws InvalidRollupRulesException if the initial load fails.
     */
    public RollupRules build() {
      return new RollupRules(this);
    }
  }
}
