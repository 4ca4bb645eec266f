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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.tsgateway.exceptions.InvalidRollupRulesException;
import net.tsgateway.utils.JSON;
import net.tsgateway.utils.YAML;

/**
 * Reads retention patterns from the supported document formats. Every
 * pattern is compiled before returning so a document with one bad pattern
 * yields nothing.
 * <p>
 * The compact format, one pattern per line, is
 * {@code regexp;function;age:precision,age:precision,...} with empty
 * function or retention allowed.
 *
 * @since 3.0
 */
public final class RetentionRulesParser {
  private static final XmlMapper XML_MAPPER = new XmlMapper();
  static {
    XML_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');
  private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults()
      .omitEmptyStrings();
  private static final Splitter COLON_SPLITTER = Splitter.on(':').trimResults();

  /** Document formats. */
  public static enum Format {
    /** ClickHouse {@code graphite_rollup} XML, optionally in a config root. */
    XML,
    /** {@code {"pattern": [...], "default": {...}}} */
    JSON,
    /** The JSON layout written as YAML. */
    YAML,
    /** One pattern per line, mostly for tests. */
    COMPACT,
    /** The JSON output of a {@code system.graphite_retentions} query. */
    SYSTEM_TABLE;

    /**
     * @param file_name A file name.
     * @return The format implied by the extension, compact if unknown.
     */
    public static Format fromFileName(final String file_name) {
      final String lower = file_name.toLowerCase();
      if (lower.endsWith(".xml")) {
        return XML;
      } else if (lower.endsWith(".json")) {
        return JSON;
      } else if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
        return YAML;
      }
      return COMPACT;
    }
  }

  private RetentionRulesParser() {
    // static parser
  }

  /**
   * Parses and compiles a document.
   * @param format The document format.
   * @param body The raw document.
   * @return The compiled patterns in document order.
   * @throws InvalidRollupRulesException if the document or any pattern is
   * invalid.
   */
  public static List<RetentionPattern> parse(final Format format,
                                             final byte[] body) {
    if (body == null) {
      throw new InvalidRollupRulesException("Rules document cannot be null.");
    }
    switch (format) {
    case XML:
      return parseXml(body);
    case JSON:
      return compile(readDocument(JSON.getMapper(), body));
    case YAML:
      return compile(readDocument(YAML.getMapper(), body));
    case COMPACT:
      return parseCompact(new String(body, StandardCharsets.UTF_8));
    case SYSTEM_TABLE:
      return parseSystemTable(body);
    default:
      throw new IllegalArgumentException("Unsupported format: " + format);
    }
  }

  /**
   * @param body A {@code graphite_rollup} document, bare or wrapped.
   * @return The compiled patterns, the default pattern last.
   */
  public static List<RetentionPattern> parseXml(final byte[] body) {
    RulesDocument document = readDocument(XML_MAPPER, body);
    if (document.patterns == null && document.default_pattern == null) {
      // e.g. <yandex><graphite_rollup>...</graphite_rollup></yandex>
      final WrappedDocument wrapped;
      try {
        wrapped = XML_MAPPER.readValue(body, WrappedDocument.class);
      } catch (IOException e) {
        throw new InvalidRollupRulesException("Failed to parse rules XML", e);
      }
      if (wrapped.rules == null) {
        throw new InvalidRollupRulesException("No graphite_rollup section found.");
      }
      document = wrapped.rules;
    }
    return compile(document);
  }

  /**
   * @param body Compact rules, blank lines ignored.
   * @return The compiled patterns.
   */
  public static List<RetentionPattern> parseCompact(final String body) {
    final List<RetentionPattern> patterns = Lists.newArrayList();
    for (final String line : LINE_SPLITTER.split(body)) {
      if (line.trim().isEmpty()) {
        continue;
      }
      final int p2 = line.lastIndexOf(';');
      final int p1 = p2 < 0 ? -1 : line.lastIndexOf(';', p2 - 1);
      if (p1 < 0) {
        throw new InvalidRollupRulesException("Can't parse line: " + line);
      }
      final RetentionPattern.Builder builder = RetentionPattern.newBuilder()
          .setRegexp(line.substring(0, p1).trim())
          .setFunction(line.substring(p1 + 1, p2).trim());
      for (final String retention : COMMA_SPLITTER.split(line.substring(p2 + 1))) {
        final List<String> parts = COLON_SPLITTER.splitToList(retention);
        if (parts.size() != 2) {
          throw new InvalidRollupRulesException("Can't parse line: " + line);
        }
        try {
          builder.addRetention(Long.parseLong(parts.get(0)),
              Long.parseLong(parts.get(1)));
        } catch (NumberFormatException e) {
          throw new InvalidRollupRulesException("Can't parse line: " + line, e);
        }
      }
      patterns.add(builder.build());
    }
    return patterns;
  }

  /**
   * Folds the rows of a retentions table query, one row per pattern and
   * tier, into patterns. Rows must be ordered by default flag, priority,
   * regexp and age.
   * @param body The JSON output.
   * @return The compiled patterns, the default pattern last.
   */
  public static List<RetentionPattern> parseSystemTable(final byte[] body) {
    final SystemTableResponse response;
    try {
      response = JSON.getMapper().readValue(body, SystemTableResponse.class);
    } catch (IOException e) {
      throw new InvalidRollupRulesException("Failed to parse retentions", e);
    }
    final List<RetentionPattern.Builder> builders = Lists.newArrayList();
    final RetentionPattern.Builder default_builder = RetentionPattern.newBuilder();
    String last_regexp = null;
    String last_function = null;
    RetentionPattern.Builder last = null;

    if (response.data != null) {
      for (final SystemTableRow row : response.data) {
        if (row.is_default == 1) {
          if (!Strings.isNullOrEmpty(row.function)) {
            default_builder.setFunction(row.function);
          }
          addRetention(default_builder, row);
          continue;
        }
        if (last == null
            || !Strings.nullToEmpty(row.regexp).equals(last_regexp)
            || !Strings.nullToEmpty(row.function).equals(last_function)) {
          last = RetentionPattern.newBuilder()
              .setRuleType(RuleType.fromString(row.rule_type))
              .setRegexp(row.regexp)
              .setFunction(row.function);
          last_regexp = Strings.nullToEmpty(row.regexp);
          last_function = Strings.nullToEmpty(row.function);
          builders.add(last);
        }
        addRetention(last, row);
      }
    }
    if (default_builder.hasContent()) {
      builders.add(default_builder);
    }

    final List<RetentionPattern> patterns = Lists.newArrayListWithCapacity(builders.size());
    for (final RetentionPattern.Builder builder : builders) {
      patterns.add(builder.build());
    }
    return patterns;
  }

  private static void addRetention(final RetentionPattern.Builder builder,
                                   final SystemTableRow row) {
    if (Strings.isNullOrEmpty(row.age)
        || Strings.isNullOrEmpty(row.precision)
        || row.precision.equals("0")) {
      return;
    }
    try {
      builder.addRetention(Long.parseLong(row.age), Long.parseLong(row.precision));
    } catch (NumberFormatException e) {
      throw new InvalidRollupRulesException("Invalid retention "
          + row.age + ":" + row.precision, e);
    }
  }

  private static RulesDocument readDocument(final ObjectMapper mapper,
                                            final byte[] body) {
    try {
      final RulesDocument document = mapper.readValue(body, RulesDocument.class);
      return document == null ? new RulesDocument() : document;
    } catch (IOException e) {
      throw new InvalidRollupRulesException("Failed to parse rules document", e);
    }
  }

  private static List<RetentionPattern> compile(final RulesDocument document) {
    final List<RetentionPattern> patterns = Lists.newArrayList();
    if (document.patterns != null) {
      for (final RetentionPattern.Builder builder : document.patterns) {
        patterns.add(builder.build());
      }
    }
    if (document.default_pattern != null) {
      patterns.add(document.default_pattern.build());
    }
    return patterns;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class RulesDocument {
    @JsonProperty("pattern")
    @JacksonXmlElementWrapper(useWrapping = false)
    List<RetentionPattern.Builder> patterns;

    @JsonProperty("default")
    RetentionPattern.Builder default_pattern;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class WrappedDocument {
    @JsonProperty("graphite_rollup")
    RulesDocument rules;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class SystemTableResponse {
    @JsonProperty("data")
    List<SystemTableRow> data;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class SystemTableRow {
    @JsonProperty("rule_type")
    String rule_type;
    @JsonProperty("regexp")
    String regexp;
    @JsonProperty("function")
    String function;
    @JsonProperty("age")
    String age;
    @JsonProperty("precision")
    String precision;
    @JsonProperty("is_default")
    int is_default;
  }
}
