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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

/**
 * Reverses the dot separated nodes of a metric path, the key layout of the
 * reversed storage tables: {@code a.b.c} is stored as {@code c.b.a}. Tagged
 * names (those with a {@code ?}) are never reversed.
 *
 * @since 3.0
 */
public final class ReversePath {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');
  private static final Joiner DOT_JOINER = Joiner.on('.');

  private ReversePath() {
    // utility class
  }

  /**
   * @param path A metric path.
   * @return The path with its nodes in reverse order.
   */
  public static String reverse(final String path) {
    if (path.indexOf('?') >= 0 || path.indexOf('.') < 0) {
      return path;
    }
    final List<String> nodes = Lists.newArrayList(DOT_SPLITTER.split(path));
    return DOT_JOINER.join(Lists.reverse(nodes));
  }

  /**
   * @param path A metric path.
   * @return Whether the path is a tagged series name.
   */
  public static boolean isTagged(final String path) {
    return path.indexOf('?') >= 0;
  }
}
