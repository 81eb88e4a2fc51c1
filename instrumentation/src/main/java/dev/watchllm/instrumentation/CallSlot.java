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

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CallSlot holds the operation a provider client invokes for one endpoint.
 *
 * <p>
 * A provider client routes every call through {@code slot.current()}, which
 * lets an {@link Instrumentor} swap in an observing wrapper and later put the
 * original back without the client or its callers noticing.
 *
 * <pre>{@code
 * public class ChatClient {
 *   public final CallSlot<ProviderCall<ChatRequest, ChatResponse>> create = new CallSlot<>("chat.completions.create",
 *       this::send);
 *
 *   public ChatResponse create(ChatRequest request) throws Exception {
 *     return create.current().call(request);
 *   }
 * }
 * }</pre>
 *
 * @param <F>
 *            the operation type, usually {@link ProviderCall} or
 *            {@link AsyncProviderCall}
 */
public final class CallSlot<F> {

  private final String name;
  private final AtomicReference<F> target;

  public CallSlot(String name, F initial) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.target = new AtomicReference<>(Objects.requireNonNull(initial, "initial must not be null"));
  }

  public String name() {
    return name;
  }

  /**
   * Returns the operation currently installed.
   *
   * @return the operation, never null
   */
  public F current() {
    return target.get();
  }

  /**
   * Installs a different operation.
   *
   * @param replacement
   *            the new operation
   * @return the operation that was installed before
   */
  public F replace(F replacement) {
    return target.getAndSet(Objects.requireNonNull(replacement, "replacement must not be null"));
  }

  @Override
  public String toString() {
    return "CallSlot{" + name + "}";
  }
}
