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
package net.tsgateway.data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.base.Strings;

/**
 * The table of aggregation functions known to the gateway. Names match the
 * storage side aggregate function prefixes ({@code sumResample},
 * {@code avgResample}, etc).
 *
 * @since 3.0
 */
public final class AggregationFunctions {

  /** Sums the values. */
  public static final AggregationFunction SUM = new Sum();

  /** Averages the values. */
  public static final AggregationFunction AVG = new Avg();

  /** Smallest value. */
  public static final AggregationFunction MIN = new Min();

  /** Largest value. */
  public static final AggregationFunction MAX = new Max();

  /** The first value of the batch. */
  public static final AggregationFunction ANY = new Any();

  /** The last value of the batch. */
  public static final AggregationFunction ANY_LAST = new AnyLast();

  /** Maps a name or alias to its instance. */
  private static final Map<String, AggregationFunction> FUNCTIONS;
  static {
    final Map<String, AggregationFunction> functions = new HashMap<String, AggregationFunction>();
    functions.put("sum", SUM);
    functions.put("avg", AVG);
    functions.put("average", AVG);
    functions.put("min", MIN);
    functions.put("max", MAX);
    functions.put("any", ANY);
    functions.put("first", ANY);
    functions.put("anyLast", ANY_LAST);
    functions.put("last", ANY_LAST);
    FUNCTIONS = Collections.unmodifiableMap(functions);
  }

  private AggregationFunctions() {
    // static table
  }

  /** @return The names and aliases of all functions. */
  public static Set<String> names() {
    return FUNCTIONS.keySet();
  }

  /**
   * @param name A name to look for.
   * @return Whether a function of that name or alias exists.
   */
  public static boolean contains(final String name) {
    return !Strings.isNullOrEmpty(name) && FUNCTIONS.containsKey(name);
  }

  /**
   * Returns the function with the given name or alias.
   * @param name The name of the function to get.
   * @return The function, never null.
   * @throws NoSuchElementException if the function is not known.
   */
  public static AggregationFunction get(final String name) {
    final AggregationFunction function =
        Strings.isNullOrEmpty(name) ? null : FUNCTIONS.get(name);
    if (function == null) {
      throw new NoSuchElementException("No such aggregation function: " + name);
    }
    return function;
  }

  private static final class Sum implements AggregationFunction {
    @Override
    public String name() {
      return "sum";
    }

    @Override
    public String graphiteName() {
      return "sum";
    }

    @Override
    public double apply(final double[] values, final int start, final int end) {
      double sum = 0;
      for (int i = start; i < end; i++) {
        sum += values[i];
      }
      return sum;
    }

    @Override
    public String toString() {
      return name();
    }
  }

  private static final class Avg implements AggregationFunction {
    @Override
    public String name() {
      return "avg";
    }

    @Override
    public String graphiteName() {
      return "avg";
    }

    @Override
    public double apply(final double[] values, final int start, final int end) {
      if (end <= start) {
        return Double.NaN;
      }
      double sum = 0;
      for (int i = start; i < end; i++) {
        sum += values[i];
      }
      return sum / (end - start);
    }

    @Override
    public String toString() {
      return name();
    }
  }

  private static final class Min implements AggregationFunction {
    @Override
    public String name() {
      return "min";
    }

    @Override
    public String graphiteName() {
      return "min";
    }

    @Override
    public double apply(final double[] values, final int start, final int end) {
      if (end <= start) {
        return Double.NaN;
      }
      double min = values[start];
      for (int i = start + 1; i < end; i++) {
        if (values[i] < min) {
          min = values[i];
        }
      }
      return min;
    }

    @Override
    public String toString() {
      return name();
    }
  }

  private static final class Max implements AggregationFunction {
    @Override
    public String name() {
      return "max";
    }

    @Override
    public String graphiteName() {
      return "max";
    }

    @Override
    public double apply(final double[] values, final int start, final int end) {
      if (end <= start) {
        return Double.NaN;
      }
      double max = values[start];
      for (int i = start + 1; i < end; i++) {
        if (values[i] > max) {
          max = values[i];
        }
      }
      return max;
    }

    @Override
    public String toString() {
      return name();
    }
  }

  private static final class Any implements AggregationFunction {
    @Override
    public String name() {
      return "any";
    }

    @Override
    public String graphiteName() {
      return "first";
    }

    @Override
    public double apply(final double[] values, final int start, final int end) {
      return end <= start ? Double.NaN : values[start];
    }

    @Override
    public String toString() {
      return name();
    }
  }

  private static final class AnyLast implements AggregationFunction {
    @Override
    public String name() {
      return "anyLast";
    }

    @Override
    public String graphiteName() {
      return "last";
    }

    @Override
    public double apply(final double[] values, final int start, final int end) {
      return end <= start ? Double.NaN : values[end - 1];
    }

    @Override
    public String toString() {
      return name();
    }
  }
}
