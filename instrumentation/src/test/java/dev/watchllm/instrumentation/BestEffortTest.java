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

package dev.watchllm.instrumentation;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unit tests for BestEffort.
 */
class BestEffortTest {

  static class Message {
    public String role;
    public Object content;

    Message(String role, Object content) {
      this.role = role;
      this.content = content;
    }
  }

  @Test
  void testRenderStringMessages() {
    JsonNode messages = BestEffort.tree(List.of(new Message("system", "Be brief."), new Message("user", "Hi")));

    assertEquals("[system]: Be brief.\n[user]: Hi", BestEffort.renderMessages(messages));
  }

  @Test
  void testMultiPartContentKeepsTextOnly() {
    List<Map<String, Object>> parts = List.of(Map.of("type", "text", "text", "Describe this"),
        Map.of("type", "image_url", "image_url", Map.of("url", "https://img.test/a.png")),
        Map.of("type", "text", "text", "briefly"));
    JsonNode messages = BestEffort.tree(List.of(new Message("user", parts)));

    assertEquals("[user]: Describe this briefly", BestEffort.renderMessages(messages));
  }

  @Test
  void testMissingValuesAreEmpty() {
    JsonNode tree = BestEffort.tree(Map.of("a", 1));

    assertEquals("", BestEffort.text(tree, "/choices/0/message/content"));
    assertEquals(0, BestEffort.integer(tree, "/usage/prompt_tokens"));
    assertTrue(BestEffort.fields(tree, "id", "model").isEmpty());
    assertEquals("", BestEffort.renderMessages(tree.path("messages")));
  }

  @Test
  void testNullAndObjectValuesAreNotText() {
    JsonNode tree = BestEffort.tree("{\"content\":null,\"nested\":{\"x\":1}}");

    assertEquals("", BestEffort.text(tree, "/content"));
    assertEquals("", BestEffort.text(tree, "/nested"));
    assertEquals(1, BestEffort.integer(tree, "/nested/x"));
  }

  @Test
  void testFieldsCopiesPresentValues() {
    JsonNode tree = BestEffort.tree("{\"id\":\"r1\",\"model\":\"m\",\"system_fingerprint\":null}");

    Map<String, Object> fields = BestEffort.fields(tree, "id", "model", "system_fingerprint");

    assertEquals(Map.of("id", "r1", "model", "m"), fields);
  }
}
