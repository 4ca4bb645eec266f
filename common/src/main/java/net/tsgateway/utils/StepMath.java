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

/**
 * Integer arithmetic on steps and time bounds, all in seconds.
 *
 * @since 3.0
 */
public final class StepMath {

  private StepMath() {
    // utility class
  }

  /**
   * @param a A non-negative value.
   * @param b A non-negative value.
   * @return The greatest common divisor.
   */
  public static long gcd(long a, long b) {
    while (b != 0) {
      final long t = a % b;
      a = b;
      b = t;
    }
    return a;
  }

  /**
   * Least common multiple where a zero on either side means "no opinion" and
   * the other side wins.
   * @param a A non-negative value.
   * @param b A non-negative value.
   * @return The LCM or the max of the two if either is zero.
   */
  public static long lcm(final long a, final long b) {
    if (a == 0 || b == 0) {
      return Math.max(a, b);
    }
    return a / gcd(a, b) * b;
  }

  /**
   * @param a A non-negative dividend.
   * @param b A positive divisor.
   * @return {@code a / b} rounded up.
   */
  public static long ceilDiv(final long a, final long b) {
    return (a + b - 1) / b;
  }

  /**
   * @param value A non-negative value.
   * @param multiple A step, values below 1 are returned unchanged.
   * @return The smallest multiple of {@code multiple} that is {@code >= value}.
   */
  public static long ceilToMultiple(final long value, final long multiple) {
    if (multiple <= 0) {
      return value;
    }
    return ceilDiv(value, multiple) * multiple;
  }

  /**
   * @param value A non-negative value.
   * @param multiple A step, values below 1 are returned unchanged.
   * @return The greatest multiple of {@code multiple} that is {@code <= value}.
   */
  public static long floorToMultiple(final long value, final long multiple) {
    if (multiple <= 0) {
      return value;
    }
    return value - value % multiple;
  }
}
