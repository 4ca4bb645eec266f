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

/**
 * Where a {@link RollupRules} holder reads its patterns from.
 *
 * @since 3.0
 */
public interface RetentionRulesSource {

  /**
   * Loads the current patterns.
   * @param force Whether to load even if the source looks unchanged.
   * @return The compiled patterns or null if nothing changed since the last
   * successful load.
   * @throws Exception if the source could not be read or parsed.
   */
  public List<RetentionPattern> load(final boolean force) throws Exception;

  /** @return A description for logging. */
  public String describe();
}
