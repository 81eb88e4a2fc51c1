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

package dev.watchllm.core.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for Sampler.
 */
class SamplerTest {

  @Test
  void testFullRateAdmitsEverything() {
    Sampler sampler = new Sampler(1.0);
    for (int i = 0; i < 1000; i++) {
      assertTrue(sampler.admit());
    }
  }

  @Test
  void testZeroRateAdmitsNothing() {
    Sampler sampler = new Sampler(0.0);
    for (int i = 0; i < 1000; i++) {
      assertFalse(sampler.admit());
    }
  }

  @Test
  void testOutOfRangeRatesAreClamped() {
    assertTrue(Sampler.admit(1.5));
    assertFalse(Sampler.admit(-0.5));
  }

  @Test
  void testPartialRateAdmitsRoughlyThatShare() {
    int admitted = 0;
    for (int i = 0; i < 10_000; i++) {
      if (Sampler.admit(0.5)) {
        admitted++;
      }
    }
    assertTrue(admitted > 4000 && admitted < 6000, "admitted " + admitted);
  }
}
