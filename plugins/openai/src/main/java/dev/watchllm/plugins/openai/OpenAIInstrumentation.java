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

import dev.watchllm.instrumentation.AsyncProviderCall;
import dev.watchllm.instrumentation.CallSlot;
import dev.watchllm.instrumentation.Instrumentor;
import dev.watchllm.instrumentation.ProviderCall;

/**
 * Installs OpenAI adapters into a client's call slots.
 */
public final class OpenAIInstrumentation {

  private OpenAIInstrumentation() {
  }

  /**
   * Instruments a chat completions slot.
   *
   * @return true if the slot was instrumented by this call
   */
  public static <I, O> boolean instrument(Instrumentor instrumentor, CallSlot<ProviderCall<I, O>> chatCompletions) {
    return instrumentor.install(chatCompletions, new OpenAIChatAdapter<>());
  }

  /**
   * Instruments an asynchronous chat completions slot.
   *
   * @return true if the slot was instrumented by this call
   */
  public static <I, O> boolean instrumentAsync(Instrumentor instrumentor,
      CallSlot<AsyncProviderCall<I, O>> chatCompletions) {
    return instrumentor.installAsync(chatCompletions, new OpenAIChatAdapter<>());
  }

  /**
   * Instruments an embeddings slot.
   *
   * @return true if the slot was instrumented by this call
   */
  public static <I, O> boolean instrumentEmbeddings(Instrumentor instrumentor,
      CallSlot<ProviderCall<I, O>> embeddings) {
    return instrumentor.install(embeddings, new OpenAIEmbeddingsAdapter<>());
  }
}
