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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unit tests for JsonUtils.
 */
class JsonUtilsTest {

  static class Request {
    public String model = "gpt-4o";
    public List<Map<String, Object>> messages = List.of(Map.of("role", "user", "content", "hi"));
  }

  static class Exploding {
    public String getValue() {
      throw new IllegalStateException("boom");
    }
  }

  @Test
  void testToMapAndToJson() {
    Map<String, Object> map = JsonUtils.toMap(new Request());

    assertEquals("gpt-4o", map.get("model"));
    assertEquals("gpt-4o", JsonUtils.parseJson(JsonUtils.toJson(map)).path("model").asText());
  }

  @Test
  void testParseInvalidJsonThrows() {
    WatchLLMException e = assertThrows(WatchLLMException.class, () -> JsonUtils.parseJson("{not json"));
    assertNotNull(e.getCause());
  }

  @Test
  void testToMapWrapsConversionFailure() {
    WatchLLMException e = assertThrows(WatchLLMException.class, () -> JsonUtils.toMap(new Exploding()));
    assertTrue(e.getMessage().startsWith("Failed to convert to map"));
  }

  @Test
  void testToTreeOrMissingHandlesPojosMapsAndStrings() {
    assertEquals("gpt-4o", JsonUtils.toTreeOrMissing(new Request()).path("model").asText());
    assertEquals("x", JsonUtils.toTreeOrMissing(Map.of("model", "x")).path("model").asText());
    assertEquals(3, JsonUtils.toTreeOrMissing("{\"n\":3}").path("n").asInt());
  }

  @Test
  void testToTreeOrMissingNeverFails() {
    assertTrue(JsonUtils.toTreeOrMissing(null).isMissingNode());
    assertTrue(JsonUtils.toTreeOrMissing("{broken").isMissingNode());
    JsonNode plain = JsonUtils.toTreeOrMissing("plain text");
    assertEquals("plain text", plain.asText());
    assertEquals("", plain.path("model").asText());
  }
}
