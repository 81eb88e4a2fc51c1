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
 * Unit tests for Instrumentor and the synchronous observing wrapper.
 */
class InstrumentorTest {

  private static final Map<String, Object> REQUEST = Map.of("model", "gpt-4o", "messages",
      List.of(Map.of("role", "user", "content", "What is 2+2?")));
  private static final Map<String, Object> RESPONSE = Map.of("id", "resp-1", "text", "4", "usage",
      Map.of("in", 1000, "out", 500));

  private EventSink sink;
  private Instrumentor instrumentor;
  private ProviderCall<Map<String, Object>, Map<String, Object>> original;
  private CallSlot<ProviderCall<Map<String, Object>, Map<String, Object>>> slot;

  @BeforeEach
  void setUp() {
    sink = mock(EventSink.class);
    instrumentor = new Instrumentor(sink);
    original = request -> RESPONSE;
    slot = new CallSlot<>("test.create", original);
  }

  private PromptCallEvent captureOnlyEvent() {
    ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
    verify(sink, times(1)).log(captor.capture());
    return (PromptCallEvent) captor.getValue();
  }

  @Test
  void testInstallIsIdempotent() {
    assertTrue(instrumentor.install(slot, new MapAdapter()));
    ProviderCall<Map<String, Object>, Map<String, Object>> wrapper = slot.current();

    assertFalse(instrumentor.install(slot, new MapAdapter()));

    assertSame(wrapper, slot.current());
    assertEquals(1, instrumentor.installedCount());
    assertTrue(instrumentor.isInstalled(slot));
  }

  @Test
  void testRemoveRestoresIdenticalOriginal() {
    instrumentor.install(slot, new MapAdapter());
    assertNotSame(original, slot.current());

    assertTrue(instrumentor.remove(slot));

    assertSame(original, slot.current());
    assertFalse(instrumentor.remove(slot));
    assertEquals(0, instrumentor.installedCount());
  }

  @Test
  void testRemoveAll() {
    CallSlot<ProviderCall<Map<String, Object>, Map<String, Object>>> other = new CallSlot<>("test.other", original);
    instrumentor.install(slot, new MapAdapter());
    instrumentor.install(other, new MapAdapter());

    assertEquals(2, instrumentor.removeAll());

    assertSame(original, slot.current());
    assertSame(original, other.current());
  }

  @Test
  void testSuccessfulCallEmitsPromptCall() throws Exception {
    instrumentor.install(slot, new MapAdapter());

    Map<String, Object> response = slot.current().call(REQUEST);

    assertSame(RESPONSE, response);
    PromptCallEvent event = captureOnlyEvent();
    assertEquals("[user]: What is 2+2?", event.getPrompt());
    assertEquals("gpt-4o", event.getModel());
    assertEquals("4", event.getResponse());
    assertEquals(1000, event.getTokensInput());
    assertEquals(500, event.getTokensOutput());
    assertEquals(0.0075, event.getCostEstimateUsd(), 1e-9);
    assertEquals(Status.SUCCESS, event.getStatus());
    assertEquals("test", event.getResponseMetadata().get("provider"));
    assertEquals("resp-1", event.getResponseMetadata().get("id"));
    assertTrue(event.getTags().containsAll(List.of("auto-instrumented", "provider:test")));
    assertNotNull(event.getRunId());
  }

  @Test
  void testAmbientContextIsUsed() throws Exception {
    instrumentor.install(slot, new MapAdapter());

    try (TraceScope scope = RunContext.trace("run-42", "user-1", List.of("beta"))) {
      slot.current().call(REQUEST);
    }

    PromptCallEvent event = captureOnlyEvent();
    assertEquals("run-42", event.getRunId());
    assertEquals("user-1", event.getUserId());
    assertTrue(event.getTags().contains("beta"));
  }

  @Test
  void testFailingCallEmitsOneErrorEventAndRethrowsSameInstance() {
    IllegalStateException failure = new IllegalStateException("rate limited");
    slot = new CallSlot<>("test.failing", request -> {
      throw failure;
    });
    instrumentor.install(slot, new MapAdapter());

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> slot.current().call(REQUEST));

    assertSame(failure, thrown);
    PromptCallEvent event = captureOnlyEvent();
    assertEquals(Status.ERROR, event.getStatus());
    assertEquals("rate limited", event.getError().get("message"));
    assertEquals("IllegalStateException", event.getError().get("type"));
    assertEquals("[user]: What is 2+2?", event.getPrompt());
  }

  @Test
  void testErrorFromProviderEmitsErrorEventAndPropagates() {
    StackOverflowError failure = new StackOverflowError("deep");
    slot = new CallSlot<>("test.erroring", request -> {
      throw failure;
    });
    instrumentor.install(slot, new MapAdapter());

    StackOverflowError thrown = assertThrows(StackOverflowError.class, () -> slot.current().call(REQUEST));

    assertSame(failure, thrown);
    PromptCallEvent event = captureOnlyEvent();
    assertEquals(Status.ERROR, event.getStatus());
    assertEquals("StackOverflowError", event.getError().get("type"));
  }

  @Test
  void testFailingProviderNameDoesNotBreakTheCall() throws Exception {
    BrokenNameAdapter adapter = new BrokenNameAdapter();
    instrumentor.install(slot, adapter);
    adapter.broken = true;

    assertSame(RESPONSE, slot.current().call(REQUEST));

    PromptCallEvent event = captureOnlyEvent();
    assertEquals(PromptCallRecorder.UNKNOWN_PROVIDER, event.getResponseMetadata().get("provider"));
    assertTrue(event.getTags().contains("provider:" + PromptCallRecorder.UNKNOWN_PROVIDER));
    assertEquals("4", event.getResponse());
  }

  @Test
  void testDisabledWrapperDelegatesWithoutRecording() throws Exception {
    instrumentor.install(slot, new MapAdapter());
    instrumentor.disable();

    assertSame(RESPONSE, slot.current().call(REQUEST));

    verifyNoInteractions(sink);
    instrumentor.enable();
    slot.current().call(REQUEST);
    verify(sink).log(any(Event.class));
  }

  @Test
  void testSinkFailureIsAbsorbed() throws Exception {
    doThrow(new IllegalStateException("queue broken")).when(sink).log(any(Event.class));
    instrumentor.install(slot, new MapAdapter());

    assertSame(RESPONSE, slot.current().call(REQUEST));
  }

  @Test
  void testMissingResponseFieldsResolveToEmpty() throws Exception {
    slot = new CallSlot<>("test.sparse", request -> Map.of());
    instrumentor.install(slot, new MapAdapter());

    slot.current().call(Map.of());

    PromptCallEvent event = captureOnlyEvent();
    assertEquals("", event.getPrompt());
    assertEquals("", event.getModel());
    assertEquals("", event.getResponse());
    assertEquals(0, event.getTokensInput());
    assertEquals(Status.SUCCESS, event.getStatus());
  }

  static class BrokenNameAdapter extends MapAdapter {
    volatile boolean broken;

    @Override
    public String provider() {
      if (broken) {
        throw new IllegalStateException("no name");
      }
      return super.provider();
    }
  }
}
