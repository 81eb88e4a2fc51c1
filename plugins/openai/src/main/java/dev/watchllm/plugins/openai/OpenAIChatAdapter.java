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

package dev.watchllm.plugins.openai;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.watchllm.instrumentation.BestEffort;
import dev.watchllm.instrumentation.ProviderAdapter;
import dev.watchllm.instrumentation.TokenUsage;

/**
 * Reads OpenAI chat completion requests and responses.
 *
 * <p>
 * Works with any object whose JSON form follows the Chat Completions API:
 * request {@code model} and {@code messages}, response
 * {@code choices[0].message.content} and {@code usage}.
 *
 * @param <I>
 *            request type
 * @param <O>
 *            response type
 */
public class OpenAIChatAdapter<I, O> implements ProviderAdapter<I, O> {

  public static final String PROVIDER = "openai";

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
    return BestEffort.renderMessages(BestEffort.tree(request).path("messages"));
  }

  @Override
  public String responseText(O response) {
    return BestEffort.text(BestEffort.tree(response), "/choices/0/message/content");
  }

  @Override
  public TokenUsage usage(O response) {
    JsonNode usage = BestEffort.tree(response).path("usage");
    return new TokenUsage(BestEffort.integer(usage, "/prompt_tokens"), BestEffort.integer(usage, "/completion_tokens"),
        BestEffort.integer(usage, "/total_tokens"));
  }

  @Override
  public Map<String, Object> responseMetadata(O response) {
    JsonNode tree = BestEffort.tree(response);
    Map<String, Object> metadata = BestEffort.fields(tree, "id", "model", "system_fingerprint");
    String finishReason = BestEffort.text(tree, "/choices/0/finish_reason");
    if (!finishReason.isEmpty()) {
      metadata.put("finish_reason", finishReason);
    }
    return metadata;
  }
}
