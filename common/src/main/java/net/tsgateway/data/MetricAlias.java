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

import com.google.common.base.Objects;

/**
 * How one stored metric is shown to the client: the display name and the
 * target expression that resolved to it.
 *
 * @since 3.0
 */
public final class MetricAlias {
  private final String display_name;
  private final String target;

  /**
   * Default ctor.
   * @param display_name The name shown in the reply.
   * @param target The requested expression.
   */
  public MetricAlias(final String display_name, final String target) {
    this.display_name = display_name;
    this.target = target;
  }

  /** @return The name shown in the reply. */
  public String displayName() {
    return display_name;
  }

  /** @return The requested expression. */
  public String target() {
    return target;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricAlias)) {
      return false;
    }
    final MetricAlias other = (MetricAlias) o;
    return Objects.equal(display_name, other.display_name)
        && Objects.equal(target, other.target);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(display_name, target);
  }

  @Override
  public String toString() {
    return display_name + " <- " + target;
  }
}
