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
package net.tsgateway.storage;

import java.util.List;

import com.stumbleupon.async.Deferred;

import net.tsgateway.data.PointStore;
import net.tsgateway.data.TimeFrame;

/**
 * A source of recent points that have not reached the columnar store yet,
 * e.g. a carbonlink cache.
 *
 * @since 3.0
 */
public interface SecondaryPointSource {

  /**
   * Fetches cached points for the given names.
   * @param metrics The metric names in storage form.
   * @param time_frame The requested time frame.
   * @return A deferred resolving to a store with the points, possibly empty.
   */
  public Deferred<PointStore> fetch(final List<String> metrics,
                                    final TimeFrame time_frame);
}
