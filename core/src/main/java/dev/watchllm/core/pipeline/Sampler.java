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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Sampler is the probabilistic admission filter applied before an event is
 * queued. It holds no mutable state and is safe to share between producer
 * threads.
 */
public final class Sampler {

  private final double sampleRate;

  /**
   * Creates a sampler bound to a rate.
   *
   * @param sampleRate
   *            fraction of events to admit, in [0, 1]
   */
  public Sampler(double sampleRate) {
    this.sampleRate = sampleRate;
  }

  public double getSampleRate() {
    return sampleRate;
  }

  /**
   * Decides whether to admit one event at the configured rate.
   *
   * @return true if the event should be kept
   */
  public boolean admit() {
    return admit(sampleRate);
  }

  /**
   * Decides whether to admit one event.
   *
   * @param sampleRate
   *            fraction of events to admit
   * @return true always for rates at or above 1, false always for rates at or
   *         below 0, otherwise true with probability {@code sampleRate}
   */
  public static boolean admit(double sampleRate) {
    if (sampleRate >= 1.0) {
      return true;
    }
    if (sampleRate <= 0.0) {
      return false;
    }
    return ThreadLocalRandom.current().nextDouble() < sampleRate;
  }
}
