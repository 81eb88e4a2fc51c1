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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import dev.watchllm.core.context.RunContext;
import dev.watchllm.core.context.TraceScope;
import dev.watchllm.core.event.Event;
import dev.watchllm.core.event.EventSink;
import dev.watchllm.core.event.PromptCallEvent;
import dev.watchllm.core.event.Status;

/**
 * Unit tests for the asynchronous observing wrapper.
 */
class ObservingAsyncCallTest {

  private static final Map<String, Object> REQUEST = Map.of("model", "claude-3-haiku-20240307", "messages",
      List.of(Map.of("role", "user", "content", "hi")));

  private EventSink sink;
  private Instrumentor instrumentor;
  private CompletableFuture<Map<String, Object>> pending;
  private CallSlot<AsyncProviderCall<Map<String, Object>, Map<String, Object>>> slot;

  @BeforeEach
  void setUp() {
    sink = mock(EventSink.class);
    instrumentor = new Instrumentor(sink);
    pending = new CompletableFuture<>();
    slot = new CallSlot<>("test.acreate", request -> pending);
    instrumentor.installAsync(slot, new MapAdapter());
  }

  private PromptCallEvent captureOnlyEvent() {
    ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
    verify(sink, times(1)).log(captor.capture());
    return (PromptCallEvent) captor.getValue();
  }

  @Test
  void testRecordsWhenFutureCompletes() throws Exception {
    CompletableFuture<Map<String, Object>> result;
    try (TraceScope scope = RunContext.trace("async-run")) {
      result = slot.current().call(REQUEST);
    }
    verifyNoInteractions(sink);

    Map<String, Object> response = Map.of("text", "hello", "usage", Map.of("in", 3, "out", 2));
    CompletableFuture.runAsync(() -> pending.complete(response)).get(5, TimeUnit.SECONDS);

    assertSame(response, result.get(5, TimeUnit.SECONDS));
    PromptCallEvent event = captureOnlyEvent();
    assertEquals("async-run", event.getRunId());
    assertEquals("hello", event.getResponse());
    assertEquals(3, event.getTokensInput());
  }

  @Test
  void testFailurePropagatesSameInstance() {
    IllegalArgumentException failure = new IllegalArgumentException("bad request");
    CompletableFuture<Map<String, Object>> result = slot.current().call(REQUEST);

    pending.completeExceptionally(failure);

    ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
    assertSame(failure, e.getCause());
    PromptCallEvent event = captureOnlyEvent();
    assertEquals(Status.ERROR, event.getStatus());
    assertEquals("IllegalArgumentException", event.getError().get("type"));
  }

  @Test
  void testSynchronousThrowIsRecordedAndRethrown() {
    IllegalStateException failure = new IllegalStateException("client closed");
    CallSlot<AsyncProviderCall<Map<String, Object>, Map<String, Object>>> throwing = new CallSlot<>("test.throwing",
        request -> {
          throw failure;
        });
    instrumentor.installAsync(throwing, new MapAdapter());

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> throwing.current().call(REQUEST));

    assertSame(failure, thrown);
    assertEquals(Status.ERROR, captureOnlyEvent().getStatus());
  }

  @Test
  void testSynchronousErrorIsRecordedAndRethrown() {
    OutOfMemoryError failure = new OutOfMemoryError("no buffers");
    CallSlot<AsyncProviderCall<Map<String, Object>, Map<String, Object>>> throwing = new CallSlot<>("test.oom",
        request -> {
          throw failure;
        });
    instrumentor.installAsync(throwing, new MapAdapter());

    OutOfMemoryError thrown = assertThrows(OutOfMemoryError.class, () -> throwing.current().call(REQUEST));

    assertSame(failure, thrown);
    PromptCallEvent event = captureOnlyEvent();
    assertEquals(Status.ERROR, event.getStatus());
    assertEquals("OutOfMemoryError", event.getError().get("type"));
  }

  @Test
  void testRemoveRestoresOriginal() {
    AsyncProviderCall<Map<String, Object>, Map<String, Object>> wrapper = slot.current();

    instrumentor.remove(slot);

    assertNotSame(wrapper, slot.current());
    assertSame(pending, slot.current().call(REQUEST));
  }
}
