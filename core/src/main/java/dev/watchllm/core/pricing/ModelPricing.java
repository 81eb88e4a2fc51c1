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

package dev.watchllm.core.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ModelPricing estimates the cost of a model call from a static price table.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>exact model id</li>
 * <li>longest table key that prefixes the model id, so dated or suffixed
 * variants such as {@code gpt-4o-2024-08-06} resolve to their base model</li>
 * <li>family heuristic on {@code gpt-4}, {@code gpt-3} and {@code claude}</li>
 * <li>generic default</li>
 * </ol>
 */
public final class ModelPricing {

  static final ModelPrice GPT_4_FAMILY = new ModelPrice(0.03, 0.06);
  static final ModelPrice GPT_3_FAMILY = new ModelPrice(0.0005, 0.0015);
  static final ModelPrice CLAUDE_FAMILY = new ModelPrice(0.003, 0.015);
  static final ModelPrice DEFAULT = new ModelPrice(0.001, 0.002);

  private static final Map<String, ModelPrice> PRICES;

  static {
    Map<String, ModelPrice> prices = new LinkedHashMap<>();
    // OpenAI chat
    prices.put("gpt-4o", new ModelPrice(0.0025, 0.01));
    prices.put("gpt-4o-mini", new ModelPrice(0.00015, 0.0006));
    prices.put("gpt-4-turbo", new ModelPrice(0.01, 0.03));
    prices.put("gpt-4", new ModelPrice(0.03, 0.06));
    prices.put("gpt-4-32k", new ModelPrice(0.06, 0.12));
    prices.put("gpt-3.5-turbo", new ModelPrice(0.0005, 0.0015));
    prices.put("o1", new ModelPrice(0.015, 0.06));
    prices.put("o1-mini", new ModelPrice(0.003, 0.012));
    // OpenAI embeddings
    prices.put("text-embedding-3-small", new ModelPrice(0.00002, 0));
    prices.put("text-embedding-3-large", new ModelPrice(0.00013, 0));
    prices.put("text-embedding-ada-002", new ModelPrice(0.0001, 0));
    // Anthropic
    prices.put("claude-3-5-sonnet-20241022", new ModelPrice(0.003, 0.015));
    prices.put("claude-3-5-sonnet-20240620", new ModelPrice(0.003, 0.015));
    prices.put("claude-3-5-haiku-20241022", new ModelPrice(0.001, 0.005));
    prices.put("claude-3-opus-20240229", new ModelPrice(0.015, 0.075));
    prices.put("claude-3-sonnet-20240229", new ModelPrice(0.003, 0.015));
    prices.put("claude-3-haiku-20240307", new ModelPrice(0.00025, 0.00125));
    PRICES = Collections.unmodifiableMap(prices);
  }

  private ModelPricing() {
    // Utility class
  }

  /**
   * Resolves the price for a model id.
   *
   * @param model
   *            the model id, may be null
   * @return the resolved price, never null
   */
  public static ModelPrice priceFor(String model) {
    if (model == null || model.isEmpty()) {
      return DEFAULT;
    }
    ModelPrice exact = PRICES.get(model);
    if (exact != null) {
      return exact;
    }

    String bestKey = null;
    for (String key : PRICES.keySet()) {
      if (model.startsWith(key) && (bestKey == null || key.length() > bestKey.length())) {
        bestKey = key;
      }
    }
    if (bestKey != null) {
      return PRICES.get(bestKey);
    }

    String normalized = model.toLowerCase();
    if (normalized.contains("gpt-4")) {
      return GPT_4_FAMILY;
    }
    if (normalized.contains("gpt-3")) {
      return GPT_3_FAMILY;
    }
    if (normalized.contains("claude")) {
      return CLAUDE_FAMILY;
    }
    return DEFAULT;
  }

  /**
   * Estimates the cost of a call.
   *
   * @param model
   *            the model id
   * @param inputTokens
   *            input token count
   * @param outputTokens
   *            output token count
   * @return the estimated cost in USD
   */
  public static double calculateCost(String model, long inputTokens, long outputTokens) {
    return priceFor(model).cost(inputTokens, outputTokens);
  }
}
