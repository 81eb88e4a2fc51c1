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

import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import dev.watchllm.core.WatchLLMClient;
import dev.watchllm.core.WatchLLMOptions;
import dev.watchllm.core.transport.QueryClient;
import dev.watchllm.core.transport.Transport;

/**
 * Unit tests for AutoInstrumentation.
 */
class AutoInstrumentationTest {

  @AfterEach
  void tearDown() {
    AutoInstrumentation.disableInstrumentation();
  }

  private static WatchLLMClient newClient() {
    WatchLLMOptions options = WatchLLMOptions.builder().apiKey("key").projectId("proj").build();
    return new WatchLLMClient(options, mock(Transport.class), mock(QueryClient.class));
  }

  @Test
  void testNotInstrumentedByDefault() {
    assertFalse(AutoInstrumentation.isInstrumented());
    assertNull(AutoInstrumentation.getClient());
    assertNull(AutoInstrumentation.getInstrumentor());
  }

  @Test
  void testAutoInstrumentIsIdempotent() {
    WatchLLMClient client = newClient();

    Instrumentor first = AutoInstrumentation.autoInstrument(client);
    Instrumentor second = AutoInstrumentation.autoInstrument(newClient());

    assertSame(first, second);
    assertSame(client, AutoInstrumentation.getClient());
    assertTrue(AutoInstrumentation.isInstrumented());
  }

  @Test
  void testDisableRestoresSlotsAndClosesClient() throws Exception {
    WatchLLMClient client = newClient();
    Instrumentor instrumentor = AutoInstrumentation.autoInstrument(client);
    ProviderCall<Map<String, Object>, Map<String, Object>> original = request -> Map.of();
    CallSlot<ProviderCall<Map<String, Object>, Map<String, Object>>> slot = new CallSlot<>("test.create", original);
    instrumentor.install(slot, new MapAdapter());
    slot.current().call(Map.of("model", "gpt-4o"));
    assertEquals(1, client.pendingCount());

    AutoInstrumentation.disableInstrumentation();

    assertSame(original, slot.current());
    assertFalse(instrumentor.isEnabled());
    assertTrue(client.isClosed());
    assertFalse(AutoInstrumentation.isInstrumented());
  }
}
