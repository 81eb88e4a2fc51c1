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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.watchllm.instrumentation.BestEffort;
import dev.watchllm.instrumentation.ProviderAdapter;
import dev.watchllm.instrumentation.TokenUsage;

/**
 * Reads Anthropic Messages API requests and responses.
 *
 * <p>
 * The system prompt, when present, is rendered as a {@code [system]} line
 * ahead of the messages. Response text is the concatenation of the
 * {@code text} content blocks; tool use blocks are skipped.
 *
 * @param <I>
 *            request type
 * @param <O>
 *            response type
 */
public class AnthropicMessagesAdapter<I, O> implements ProviderAdapter<I, O> {

  public static final String PROVIDER = "anthropic";

  @Override
  public String provider() {
    return PROVIDER;
  }

  @Override
  public String model(I request) {
    return BestEffort.text(BestEffort.tree(request), "/model");
  }

  @Override
  public String prompt(I request) {
    JsonNode tree = BestEffort.tree(request);
    List<String> sections = new ArrayList<>();
    String system = BestEffort.contentText(tree.path("system"));
    if (!system.isEmpty()) {
      sections.add("[system]: " + system);
    }
    String messages = BestEffort.renderMessages(tree.path("messages"));
    if (!messages.isEmpty()) {
      sections.add(messages);
    }
    return String.join("\n", sections);
  }

  @Override
  public String responseText(O response) {
    StringBuilder text = new StringBuilder();
    for (JsonNode block : BestEffort.tree(response).path("content")) {
      if ("text".equals(block.path("type").asText())) {
        text.append(block.path("text").asText(""));
      }
    }
    return text.toString();
  }

  @Override
  public TokenUsage usage(O response) {
    JsonNode usage = BestEffort.tree(response).path("usage");
    return TokenUsage.of(BestEffort.integer(usage, "/input_tokens"), BestEffort.integer(usage, "/output_tokens"));
  }

  @Override
  public Map<String, Object> responseMetadata(O response) {
    return BestEffort.fields(BestEffort.tree(response), "id", "model", "stop_reason", "stop_sequence");
  }
}
