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

import java.util.concurrent.CompletableFuture;

/**
 * An asynchronous provider operation. The returned future completes with the
 * provider response or the provider failure.
 *
 * @param <I>
 *            request type
 * @param <O>
 *            response type
 */
@FunctionalInterface
public interface AsyncProviderCall<I, O> {

  CompletableFuture<O> call(I request);
}
