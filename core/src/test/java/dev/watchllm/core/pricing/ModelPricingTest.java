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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ModelPricing.
 */
class ModelPricingTest {

  private static final double DELTA = 1e-9;

  @Test
  void testExactMatch() {
    assertEquals(0.0075, ModelPricing.calculateCost("gpt-4o", 1000, 500), DELTA);
  }

  @Test
  void testLongestPrefixWins() {
    assertEquals(ModelPricing.priceFor("gpt-4o"), ModelPricing.priceFor("gpt-4o-2024-08-06"));
    assertEquals(ModelPricing.priceFor("gpt-4o-mini"), ModelPricing.priceFor("gpt-4o-mini-2024-07-18"));
  }

  @Test
  void testFamilyHeuristics() {
    assertEquals(new ModelPrice(0.03, 0.06), ModelPricing.priceFor("ft:gpt-4-acme"));
    assertEquals(new ModelPrice(0.0005, 0.0015), ModelPricing.priceFor("ft:gpt-3.5-turbo:acme"));
    assertEquals(new ModelPrice(0.003, 0.015), ModelPricing.priceFor("anthropic.Claude-v2"));
  }

  @Test
  void testUnknownModelUsesDefault() {
    assertEquals(new ModelPrice(0.001, 0.002), ModelPricing.priceFor("llama-3-70b"));
    assertEquals(new ModelPrice(0.001, 0.002), ModelPricing.priceFor(null));
  }

  @Test
  void testEmbeddingsHaveNoOutputCost() {
    assertEquals(0.00002, ModelPricing.calculateCost("text-embedding-3-small", 1000, 1000), DELTA);
  }

  @Test
  void testZeroTokensCostNothing() {
    assertEquals(0.0, ModelPricing.calculateCost("claude-3-opus-20240229", 0, 0), DELTA);
  }
}
