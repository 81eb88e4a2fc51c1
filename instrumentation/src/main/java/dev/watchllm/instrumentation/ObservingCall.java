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

import dev.watchllm.core.event.EventSink;

/**
 * ObservingCall wraps a synchronous provider operation and records a
 * prompt-call event for every invocation while instrumentation is enabled.
 * The original result or exception is passed through untouched.
 */
final class ObservingCall<I, O> implements ProviderCall<I, O> {

  private final ProviderCall<I, O> original;
  private final ProviderAdapter<I, O> adapter;
  private final EventSink sink;
  private final Instrumentor instrumentor;

  ObservingCall(ProviderCall<I, O> original, ProviderAdapter<I, O> adapter, EventSink sink,
      Instrumentor instrumentor) {
    this.original = original;
    this.adapter = adapter;
    this.sink = sink;
    this.instrumentor = instrumentor;
  }

  @Override
  public O call(I request) throws Exception {
    if (!instrumentor.isEnabled()) {
      return original.call(request);
    }
    PromptCallRecorder<I, O> recorder = PromptCallRecorder.begin(adapter, sink, request);
    O response;
    try {
      response = original.call(request);
    } catch (Exception | Error e) {
      recorder.failed(e);
      throw e;
    }
    recorder.succeeded(response);
    return response;
  }
}
