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

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;

/**
 * Reads rules from a local file. The format follows the extension, see
 * {@link RetentionRulesParser.Format#fromFileName(String)}. The file content
 * is hashed so unchanged files are not parsed again.
 *
 * @since 3.0
 */
public class FileRetentionRulesSource implements RetentionRulesSource {
  private static final Logger LOG = LoggerFactory.getLogger(
      FileRetentionRulesSource.class);

  private final String path;
  private final RetentionRulesParser.Format format;
  private long last_hash;
  private boolean loaded;

  /**
   * Ctor picking the format from the file name.
   * @param path The non-null and non-empty path.
   */
  public FileRetentionRulesSource(final String path) {
    this(path, null);
  }

  /**
   * Default ctor.
   * @param path The non-null and non-empty path.
   * @param format An optional format, null to use the extension.
   */
  public FileRetentionRulesSource(final String path,
                                  final RetentionRulesParser.Format format) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    this.path = path;
    this.format = format == null
        ? RetentionRulesParser.Format.fromFileName(path) : format;
  }

  @Override
  public synchronized List<RetentionPattern> load(final boolean force)
      throws IOException {
    final File file = new File(path);
    if (!file.exists()) {
      throw new IOException("No rollup rules file found at " + path);
    }
    final byte[] body = Files.toByteArray(file);
    final long hash = Hashing.murmur3_128().hashBytes(body).asLong();
    if (!force && loaded && hash == last_hash) {
      if (LOG.isTraceEnabled()) {
        LOG.trace("Rules hash was the same as the last load: " + path);
      }
      return null;
    }
    final List<RetentionPattern> patterns = RetentionRulesParser.parse(format, body);
    last_hash = hash;
    loaded = true;
    return patterns;
  }

  @Override
  public String describe() {
    return "file:" + path + " (" + format + ")";
  }
}
