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

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A shared, thread safe Jackson mapper for JSON documents plus wrappers that
 * turn Jackson's checked exceptions into {@link IllegalArgumentException} for
 * bad content and {@link JSONException} for I/O failures.
 *
 * @since 3.0
 */
public final class JSON {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  private JSON() {
    // utility class
  }

  /**
   * Deserializes a JSON string to the given class.
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final String json, final Class<T> pojo) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(json, pojo);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /**
   * Deserializes a JSON stream to the given class.
   * @param stream The stream to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws JSONException if the stream could not be read
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final InputStream stream,
                                    final Class<T> pojo) {
    if (stream == null) {
      throw new IllegalArgumentException("Incoming data was null");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(stream, pojo);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Deserializes a JSON string to a complex type.
   * @param json The string to deserialize
   * @param type A type definition for a complex object
   * @return An object of the {@code type} type
   * @throws IllegalArgumentException if the data or type was null or parsing
   * failed
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final String json,
                                    final TypeReference<T> type) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (type == null) {
      throw new IllegalArgumentException("Missing type reference");
    }
    try {
      return MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }

  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
