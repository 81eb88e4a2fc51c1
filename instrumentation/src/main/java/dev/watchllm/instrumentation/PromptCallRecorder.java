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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.watchllm.core.context.RunContext;
import dev.watchllm.core.event.EventSink;
import dev.watchllm.core.event.PromptCallEvent;
import dev.watchllm.core.event.Status;
import dev.watchllm.core.pricing.ModelPricing;

/**
 * PromptCallRecorder observes one provider call and emits its prompt-call
 * event.
 *
 * <p>
 * {@link #begin} runs on the calling thread, so the ambient run context and
 * the prompt are captured there even when the call completes elsewhere. None
 * of the methods throw: adapter and sink failures are logged and the event is
 * emitted with whatever could be read.
 */
final class PromptCallRecorder<I, O> {

  private static final Logger logger = LoggerFactory.getLogger(PromptCallRecorder.class);

  static final String AUTO_INSTRUMENTED_TAG = "auto-instrumented";
  static final String UNKNOWN_PROVIDER = "unknown";

  private final ProviderAdapter<I, O> adapter;
  private final EventSink sink;
  private final String provider;
  private final String runId;
  private final String userId;
  private final List<String> tags;
  private final String model;
  private final String prompt;
  private final long startNanos;

  private PromptCallRecorder(ProviderAdapter<I, O> adapter, EventSink sink, I request) {
    this.adapter = adapter;
    this.sink = sink;
    this.provider = readProvider(adapter);
    this.runId = RunContext.currentRunId();
    this.userId = RunContext.currentUserId();
    this.tags = new ArrayList<>();
    this.tags.add(AUTO_INSTRUMENTED_TAG);
    this.tags.add("provider:" + provider);
    for (String tag : RunContext.currentTags()) {
      if (!this.tags.contains(tag)) {
        this.tags.add(tag);
      }
    }
    this.model = read(() -> adapter.model(request), "model");
    this.prompt = read(() -> adapter.prompt(request), "prompt");
    this.startNanos = System.nanoTime();
  }

  static <I, O> PromptCallRecorder<I, O> begin(ProviderAdapter<I, O> adapter, EventSink sink, I request) {
    return new PromptCallRecorder<>(adapter, sink, request);
  }

  String provider() {
    return provider;
  }

  void succeeded(O response) {
    PromptCallEvent event = newEvent();
    try {
      event.setResponse(adapter.responseText(response));
      TokenUsage usage = adapter.usage(response);
      if (usage != null) {
        event.setTokensInput(usage.getInputTokens());
        event.setTokensOutput(usage.getOutputTokens());
      }
      Map<String, Object> metadata = adapter.responseMetadata(response);
      if (metadata != null) {
        event.getResponseMetadata().putAll(metadata);
      }
      event.getResponseMetadata().put("provider", provider);
    } catch (RuntimeException e) {
      logger.debug("Could not read {} response: {}", provider, e.getMessage());
    }
    event.setCostEstimateUsd(ModelPricing.calculateCost(model, event.getTokensInput(), event.getTokensOutput()));
    emit(event);
  }

  void failed(Throwable error) {
    PromptCallEvent event = newEvent();
    event.setStatus(Status.ERROR);
    Map<String, String> descriptor = new LinkedHashMap<>();
    descriptor.put("message", String.valueOf(error.getMessage()));
    descriptor.put("type", error.getClass().getSimpleName());
    event.setError(descriptor);
    emit(event);
  }

  private PromptCallEvent newEvent() {
    PromptCallEvent event = new PromptCallEvent();
    event.setRunId(runId);
    event.setUserId(userId);
    event.setTags(tags);
    event.setModel(model);
    event.setPrompt(prompt);
    event.setLatencyMs((System.nanoTime() - startNanos) / 1_000_000);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("provider", provider);
    event.setResponseMetadata(metadata);
    return event;
  }

  private void emit(PromptCallEvent event) {
    try {
      sink.log(event);
    } catch (RuntimeException e) {
      logger.warn("Failed to record {} call for run {}: {}", provider, runId, e.getMessage());
    }
  }

  private static String readProvider(ProviderAdapter<?, ?> adapter) {
    try {
      String name = adapter.provider();
      return name != null && !name.isEmpty() ? name : UNKNOWN_PROVIDER;
    } catch (RuntimeException e) {
      logger.debug("Could not read provider name from {}: {}", adapter.getClass().getName(), e.getMessage());
      return UNKNOWN_PROVIDER;
    }
  }

  private String read(TextReader reader, String what) {
    try {
      String value = reader.read();
      return value != null ? value : "";
    } catch (RuntimeException e) {
      logger.debug("Could not read {} {} from request: {}", provider, what, e.getMessage());
      return "";
    }
  }

  @FunctionalInterface
  private interface TextReader {
    String read();
  }
}
