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

import java.util.Map;

/**
 * ProviderAdapter knows how to read one provider's requests and responses.
 *
 * <p>
 * Implementations must not throw: a field that cannot be found resolves to an
 * empty string, zero or an empty map. {@link BestEffort} provides accessors
 * with exactly that behavior.
 *
 * @param <I>
 *            request type
 * @param <O>
 *            response type
 */
public interface ProviderAdapter<I, O> {

  /**
   * Returns the provider name used in tags and metadata, e.g. {@code openai}.
   */
  String provider();

  String model(I request);

  /**
   * Renders the request as prompt text.
   */
  String prompt(I request);

  String responseText(O response);

  TokenUsage usage(O response);

  /**
   * Returns provider metadata worth keeping, such as the response id.
   */
  Map<String, Object> responseMetadata(O response);
}
