/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.watchllm.core;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides the JSON serialization utilities shared by the pipeline,
 * the transport and the provider adapters.
 */
public final class JsonUtils {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws WatchLLMException
   *             if serialization fails
   */
  public static String toJson(Object value) throws WatchLLMException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new WatchLLMException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts an object (typically an event) to a generic map.
   *
   * @param value
   *            the object to convert
   * @return the map form of the object
   * @throws WatchLLMException
   *             if conversion fails
   */
  public static Map<String, Object> toMap(Object value) throws WatchLLMException {
    try {
      return objectMapper.convertValue(value, MAP_TYPE);
    } catch (IllegalArgumentException e) {
      throw new WatchLLMException("Failed to convert to map: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws WatchLLMException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws WatchLLMException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new WatchLLMException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts an arbitrary object to a JsonNode without ever failing. Objects
   * Jackson cannot introspect resolve to a missing node, so callers can chain
   * {@code path(...)} lookups safely.
   *
   * @param value
   *            the object to convert, may be null
   * @return the tree form of the value, or a missing node
   */
  public static JsonNode toTreeOrMissing(Object value) {
    if (value == null) {
      return MissingNode.getInstance();
    }
    if (value instanceof JsonNode) {
      return (JsonNode) value;
    }
    try {
      if (value instanceof String) {
        String text = ((String) value).trim();
        if (text.startsWith("{") || text.startsWith("[")) {
          return objectMapper.readTree(text);
        }
      }
      return objectMapper.valueToTree(value);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      return MissingNode.getInstance();
    }
  }
}
