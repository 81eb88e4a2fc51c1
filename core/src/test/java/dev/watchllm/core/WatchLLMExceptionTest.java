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

package dev.watchllm.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.watchllm.core.transport.DeliveryException;

/**
 * Unit tests for WatchLLMException and its delivery subtype.
 */
class WatchLLMExceptionTest {

  @Test
  void testSerializationFailureCarriesCauseAndCode() {
    IllegalArgumentException cause = new IllegalArgumentException("bad bean");
    WatchLLMException exception = new WatchLLMException("Failed to convert to map", cause);

    assertEquals("Failed to convert to map", exception.getMessage());
    assertSame(cause, exception.getCause());
    assertEquals(WatchLLMException.SERIALIZATION_FAILED, exception.getErrorCode());
    assertTrue(exception.getDetails().isEmpty());
    assertTrue(exception instanceof RuntimeException);
  }

  @Test
  void testDeliveryExceptionCarriesDetails() {
    DeliveryException exception = new DeliveryException("rejected", null, 429, "slow down", 4);

    assertEquals("DELIVERY_FAILED", exception.getErrorCode());
    assertEquals(429, exception.getStatusCode());
    assertEquals("slow down", exception.getResponseBody());
    assertEquals(4, exception.getAttempts());
    assertFalse(exception.isConnectionFailure());
    Map<String, Object> details = exception.getDetails();
    assertEquals(429, details.get("status"));
    assertEquals(4, details.get("attempts"));
  }
}
