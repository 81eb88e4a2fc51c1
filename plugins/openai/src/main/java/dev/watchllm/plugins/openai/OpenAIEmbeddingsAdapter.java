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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.watchllm.instrumentation.BestEffort;
import dev.watchllm.instrumentation.ProviderAdapter;
import dev.watchllm.instrumentation.TokenUsage;

/**
 * Reads OpenAI embeddings requests and responses. The prompt is the embedded
 * input; embeddings have no response text.
 *
 * @param <I>
 *            request type
 * @param <O>
 *            response type
 */
public class OpenAIEmbeddingsAdapter<I, O> implements ProviderAdapter<I, O> {

  @Override
  public String provider() {
    return OpenAIChatAdapter.PROVIDER;
  }

  @Override
  public String model(I request) {
    return BestEffort.text(BestEffort.tree(request), "/model");
  }

  @Override
  public String prompt(I request) {
    JsonNode input = BestEffort.tree(request).path("input");
    if (input.isTextual()) {
      return input.asText();
    }
    List<String> texts = new ArrayList<>();
    for (JsonNode item : input) {
      if (item.isTextual()) {
        texts.add(item.asText());
      }
    }
    return String.join("\n", texts);
  }

  @Override
  public String responseText(O response) {
    return "";
  }

  @Override
  public TokenUsage usage(O response) {
    JsonNode usage = BestEffort.tree(response).path("usage");
    int promptTokens = BestEffort.integer(usage, "/prompt_tokens");
    return new TokenUsage(promptTokens, 0, BestEffort.integer(usage, "/total_tokens"));
  }

  @Override
  public Map<String, Object> responseMetadata(O response) {
    JsonNode tree = BestEffort.tree(response);
    Map<String, Object> metadata = BestEffort.fields(tree, "model");
    metadata.put("embeddings", tree.path("data").size());
    return metadata;
  }
}
