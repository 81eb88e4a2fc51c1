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

/**
 * Price of a model in USD per 1000 tokens.
 */
public final class ModelPrice {

  private final double inputPer1k;
  private final double outputPer1k;

  public ModelPrice(double inputPer1k, double outputPer1k) {
    this.inputPer1k = inputPer1k;
    this.outputPer1k = outputPer1k;
  }

  public double getInputPer1k() {
    return inputPer1k;
  }

  public double getOutputPer1k() {
    return outputPer1k;
  }

  /**
   * Computes the cost of a call at this price.
   *
   * @param inputTokens
   *            input token count
   * @param outputTokens
   *            output token count
   * @return the cost in USD
   */
  public double cost(long inputTokens, long outputTokens) {
    return (inputTokens * inputPer1k + outputTokens * outputPer1k) / 1000.0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ModelPrice)) {
      return false;
    }
    ModelPrice other = (ModelPrice) o;
    return Double.compare(inputPer1k, other.inputPer1k) == 0 && Double.compare(outputPer1k, other.outputPer1k) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(inputPer1k) * 31 + Double.hashCode(outputPer1k);
  }

  @Override
  public String toString() {
    return "ModelPrice{input=" + inputPer1k + ", output=" + outputPer1k + '}';
  }
}
