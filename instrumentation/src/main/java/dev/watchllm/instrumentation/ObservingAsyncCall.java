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
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.watchllm.core.event.EventSink;

/**
 * ObservingAsyncCall is the asynchronous counterpart of {@link ObservingCall}.
 * It never blocks: the event is recorded when the provider future completes,
 * and the returned future completes with the same value or the same exception
 * instance.
 */
final class ObservingAsyncCall<I, O> implements AsyncProviderCall<I, O> {

  private static final Logger logger = LoggerFactory.getLogger(ObservingAsyncCall.class);

  private final AsyncProviderCall<I, O> original;
  private final ProviderAdapter<I, O> adapter;
  private final EventSink sink;
  private final Instrumentor instrumentor;

  ObservingAsyncCall(AsyncProviderCall<I, O> original, ProviderAdapter<I, O> adapter, EventSink sink,
      Instrumentor instrumentor) {
    this.original = original;
    this.adapter = adapter;
    this.sink = sink;
    this.instrumentor = instrumentor;
  }

  @Override
  public CompletableFuture<O> call(I request) {
    if (!instrumentor.isEnabled()) {
      return original.call(request);
    }
    PromptCallRecorder<I, O> recorder = PromptCallRecorder.begin(adapter, sink, request);
    CompletableFuture<O> pending;
    try {
      pending = original.call(request);
    } catch (RuntimeException | Error e) {
      recorder.failed(e);
      throw e;
    }
    if (pending == null) {
      logger.debug("{} call returned no future, nothing to observe", recorder.provider());
      return null;
    }

    CompletableFuture<O> result = new CompletableFuture<>();
    pending.whenComplete((response, error) -> {
      if (error != null) {
        Throwable cause = unwrap(error);
        recorder.failed(cause);
        result.completeExceptionally(cause);
      } else {
        recorder.succeeded(response);
        result.complete(response);
      }
    });
    return result;
  }

  static Throwable unwrap(Throwable error) {
    if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
