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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

import net.tsgateway.exceptions.InvalidRollupRulesException;

/**
 * Which metric names a retention pattern applies to.
 *
 * @since 3.0
 */
public enum RuleType {
  /** Plain and tagged names. */
  ALL("all"),

  /** Only names without tags. */
  PLAIN("plain"),

  /** Only tagged names, {@code name?tag=value&...}. */
  TAGGED("tagged"),

  /** A tag list {@code name;tag1=v1;tag2=v2} compiled to a tagged regex. */
  TAG_LIST("tag_list");

  private final String name;

  RuleType(final String name) {
    this.name = name;
  }

  @JsonValue
  @Override
  public String toString() {
    return name;
  }

  /**
   * @param value A case insensitive type name. Null or empty means ALL.
   * @return The type.
   * @throws InvalidRollupRulesException if the name is unknown.
   */
  @JsonCreator
  public static RuleType fromString(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      return ALL;
    }
    for (final RuleType type : values()) {
      if (type.name.equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    throw new InvalidRollupRulesException("Invalid rule type: " + value);
  }
}
