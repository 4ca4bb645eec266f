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
package net.tsgateway.utils;

import com.google.common.base.Strings;

/**
 * Time helpers: duration parsing for configuration values and timing of
 * request phases.
 *
 * @since 3.0
 */
public final class DateTime {

  private DateTime() {
    // utility class
  }

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li>
   * <li>{@code y}: years (365 days)</li></ul>
   * A bare integer is taken as milliseconds.
   * @param duration The human-readable duration to parse.
   * @return A non-negative number of milliseconds.
   * @throws IllegalArgumentException if the duration was malformed.
   */
  public static long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    int unit = 0;
    while (unit < duration.length() && Character.isDigit(duration.charAt(unit))) {
      unit++;
    }
    if (unit == 0) {
      throw new IllegalArgumentException("Invalid duration, must start with "
          + "an integer: " + duration);
    }
    final long interval;
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " + duration);
    }
    final long multiplier;
    switch (duration.substring(unit).toLowerCase()) {
      case "":
      case "ms": multiplier = 1; break;
      case "s": multiplier = 1000L; break;
      case "m": multiplier = 60 * 1000L; break;
      case "h": multiplier = 3600 * 1000L; break;
      case "d": multiplier = 86400 * 1000L; break;
      case "w": multiplier = 7 * 86400 * 1000L; break;
      case "y": multiplier = 365 * 86400 * 1000L; break;
      default:
        throw new IllegalArgumentException("Invalid duration (suffix): " + duration);
    }
    if ((double) interval * multiplier > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: "
          + duration);
    }
    return interval * multiplier;
  }

  /**
   * Pass through to {@link System#currentTimeMillis()}.
   * @return The current epoch time in milliseconds
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Pass through to {@link System#nanoTime()}.
   * @return The current monotonic time in nanoseconds.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
