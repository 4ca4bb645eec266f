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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

/**
 * One tier of a retention pattern: data at least {@code age} seconds old is
 * stored with {@code precision} seconds buckets.
 *
 * @since 3.0
 */
public final class Retention implements Comparable<Retention> {
  private final long age;
  private final long precision;

  /**
   * Default ctor.
   * @param age The age threshold in seconds.
   * @param precision The bucket width in seconds.
   */
  @JsonCreator
  public Retention(@JsonProperty("age") final long age,
                   @JsonProperty("precision") final long precision) {
    this.age = age;
    this.precision = precision;
  }

  /** @return The age threshold in seconds. */
  @JsonProperty("age")
  public long age() {
    return age;
  }

  /** @return The bucket width in seconds. */
  @JsonProperty("precision")
  public long precision() {
    return precision;
  }

  @Override
  public int compareTo(final Retention other) {
    return Long.compare(age, other.age);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Retention)) {
      return false;
    }
    final Retention other = (Retention) o;
    return age == other.age && precision == other.precision;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(age, precision);
  }

  @Override
  public String toString() {
    return age + ":" + precision;
  }
}
