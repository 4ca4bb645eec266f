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

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.google.common.base.Strings;

/**
 * How the writer derived the {@code Date} partition column from a point's
 * time. The storage query prunes partitions by day, so the bounds must be
 * computed the same way or the first or last day goes missing.
 *
 * @since 3.0
 */
public enum DayFormat {
  /** The calendar day in the local time zone of the host. */
  DEFAULT("default"),

  /** The UTC calendar day. */
  UTC("utc"),

  /**
   * Either, for tables still being rewritten from one to the other. The
   * start is the earlier and the end the later of the two days.
   */
  BOTH("both");

  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd");

  private final String name;

  DayFormat(final String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * @param epoch The range start in epoch seconds.
   * @return The first day to scan as {@code yyyy-MM-dd}.
   */
  public String from(final long epoch) {
    return from(epoch, ZoneId.systemDefault());
  }

  /**
   * @param epoch The range end in epoch seconds.
   * @return The last day to scan as {@code yyyy-MM-dd}.
   */
  public String until(final long epoch) {
    return until(epoch, ZoneId.systemDefault());
  }

  String from(final long epoch, final ZoneId local) {
    final LocalDate utc = day(epoch, ZoneOffset.UTC);
    final LocalDate host = day(epoch, local);
    switch (this) {
    case UTC:
      return FORMAT.format(utc);
    case BOTH:
      return FORMAT.format(host.isBefore(utc) ? host : utc);
    default:
      return FORMAT.format(host);
    }
  }

  String until(final long epoch, final ZoneId local) {
    final LocalDate utc = day(epoch, ZoneOffset.UTC);
    final LocalDate host = day(epoch, local);
    switch (this) {
    case UTC:
      return FORMAT.format(utc);
    case BOTH:
      return FORMAT.format(host.isAfter(utc) ? host : utc);
    default:
      return FORMAT.format(host);
    }
  }

  private static LocalDate day(final long epoch, final ZoneId zone) {
    return Instant.ofEpochSecond(epoch).atZone(zone).toLocalDate();
  }

  /**
   * @param value A case insensitive format name. Null or empty means
   * {@link #DEFAULT}.
   * @return The format.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static DayFormat fromString(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      return DEFAULT;
    }
    for (final DayFormat format : values()) {
      if (format.name.equalsIgnoreCase(value.trim())) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown date format: " + value);
  }
}
