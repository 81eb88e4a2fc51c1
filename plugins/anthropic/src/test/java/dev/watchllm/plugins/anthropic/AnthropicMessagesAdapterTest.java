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

package dev.watchllm.plugins.anthropic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.watchllm.instrumentation.TokenUsage;

/**
 * Unit tests for AnthropicMessagesAdapter.
 */
class AnthropicMessagesAdapterTest {

  private static final String RESPONSE = "{\"id\":\"msg_01\",\"type\":\"message\",\"role\":\"assistant\","
      + "\"model\":\"claude-3-5-sonnet-20241022\",\"content\":[{\"type\":\"text\",\"text\":\"Hello\"},"
      + "{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"lookup\",\"input\":{}},"
      + "{\"type\":\"text\",\"text\":\" there\"}],\"stop_reason\":\"end_turn\",\"stop_sequence\":null,"
      + "\"usage\":{\"input_tokens\":12,\"output_tokens\":6}}";

  private final AnthropicMessagesAdapter<Object, Object> adapter = new AnthropicMessagesAdapter<>();

  @Test
  void testPromptIncludesSystem() {
    Map<String, Object> request = Map.of("model", "claude-3-5-sonnet-20241022", "system", "You are terse.",
        "messages", List.of(Map.of("role", "user", "content", "Hi")));

    assertEquals("claude-3-5-sonnet-20241022", adapter.model(request));
    assertEquals("[system]: You are terse.\n[user]: Hi", adapter.prompt(request));
  }

  @Test
  void testSystemBlocksAndContentBlocks() {
    Map<String, Object> request = Map.of("model", "claude-3-haiku-20240307", "system",
        List.of(Map.of("type", "text", "text", "Be kind.")), "messages",
        List.of(Map.of("role", "user", "content",
            List.of(Map.of("type", "image", "source", Map.of("type", "base64")),
                Map.of("type", "text", "text", "Describe it")))));

    assertEquals("[system]: Be kind.\n[user]: Describe it", adapter.prompt(request));
  }

  @Test
  void testPromptWithoutSystem() {
    Map<String, Object> request = Map.of("messages", List.of(Map.of("role", "user", "content", "Hi")));

    assertEquals("[user]: Hi", adapter.prompt(request));
  }

  @Test
  void testResponse() {
    TokenUsage usage = adapter.usage(RESPONSE);

    assertEquals("Hello there", adapter.responseText(RESPONSE));
    assertEquals(12, usage.getInputTokens());
    assertEquals(6, usage.getOutputTokens());
    assertEquals(18, usage.getTotalTokens());
    Map<String, Object> metadata = adapter.responseMetadata(RESPONSE);
    assertEquals("msg_01", metadata.get("id"));
    assertEquals("end_turn", metadata.get("stop_reason"));
    assertFalse(metadata.containsKey("stop_sequence"));
  }

  @Test
  void testUnreadableResponse() {
    assertEquals("", adapter.responseText(null));
    assertEquals(0, adapter.usage("not json").getInputTokens());
    assertTrue(adapter.responseMetadata(42).isEmpty());
  }
}
