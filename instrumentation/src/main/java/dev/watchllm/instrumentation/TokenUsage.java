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

/**
 * Token counts reported by a provider for one call.
 */
public final class TokenUsage {

  public static final TokenUsage NONE = new TokenUsage(0, 0, 0);

  private final int inputTokens;
  private final int outputTokens;
  private final int totalTokens;

  public TokenUsage(int inputTokens, int outputTokens, int totalTokens) {
    this.inputTokens = inputTokens;
    this.outputTokens = outputTokens;
    this.totalTokens = totalTokens;
  }

  /**
   * Creates usage whose total is the sum of input and output.
   */
  public static TokenUsage of(int inputTokens, int outputTokens) {
    return new TokenUsage(inputTokens, outputTokens, inputTokens + outputTokens);
  }

  public int getInputTokens() {
    return inputTokens;
  }

  public int getOutputTokens() {
    return outputTokens;
  }

  public int getTotalTokens() {
    return totalTokens;
  }

  @Override
  public String toString() {
    return "TokenUsage{input=" + inputTokens + ", output=" + outputTokens + ", total=" + totalTokens + "}";
  }
}
