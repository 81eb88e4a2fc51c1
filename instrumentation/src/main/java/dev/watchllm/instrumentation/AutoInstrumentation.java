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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.watchllm.core.WatchLLMClient;
import dev.watchllm.core.WatchLLMOptions;

/**
 * Process-wide entry point for automatic instrumentation.
 *
 * <pre>{@code
 * Instrumentor instrumentor = AutoInstrumentation.autoInstrument(WatchLLMOptions.builder().build());
 * OpenAIInstrumentation.instrument(instrumentor, openAiClient.chatCompletions);
 * ...
 * AutoInstrumentation.disableInstrumentation();
 * }</pre>
 */
public final class AutoInstrumentation {

  private static final Logger logger = LoggerFactory.getLogger(AutoInstrumentation.class);

  private static WatchLLMClient client;
  private static Instrumentor instrumentor;

  private AutoInstrumentation() {
  }

  /**
   * Creates the shared client and an enabled instrumentor. If instrumentation
   * is already active the existing instrumentor is returned and the options
   * are ignored.
   *
   * @param options
   *            options for the shared client
   * @return the shared instrumentor
   */
  public static synchronized Instrumentor autoInstrument(WatchLLMOptions options) {
    if (instrumentor != null) {
      logger.warn("Auto-instrumentation is already active, keeping the existing client");
      return instrumentor;
    }
    return activate(new WatchLLMClient(options));
  }

  /**
   * Activates instrumentation around an existing client. The client is closed
   * by {@link #disableInstrumentation()}.
   *
   * @param existing
   *            the client events are sent to
   * @return the shared instrumentor
   */
  public static synchronized Instrumentor autoInstrument(WatchLLMClient existing) {
    if (instrumentor != null) {
      logger.warn("Auto-instrumentation is already active, keeping the existing client");
      return instrumentor;
    }
    return activate(existing);
  }

  private static Instrumentor activate(WatchLLMClient newClient) {
    client = newClient;
    instrumentor = new Instrumentor(newClient);
    instrumentor.enable();
    logger.info("Auto-instrumentation enabled");
    return instrumentor;
  }

  /**
   * Returns the shared client.
   *
   * @return the client, or null when instrumentation is not active
   */
  public static synchronized WatchLLMClient getClient() {
    return client;
  }

  /**
   * Returns the shared instrumentor.
   *
   * @return the instrumentor, or null when instrumentation is not active
   */
  public static synchronized Instrumentor getInstrumentor() {
    return instrumentor;
  }

  public static synchronized boolean isInstrumented() {
    return instrumentor != null && instrumentor.isEnabled();
  }

  /**
   * Restores every instrumented slot, disables recording and closes the
   * shared client. Does nothing when instrumentation is not active.
   */
  public static synchronized void disableInstrumentation() {
    if (instrumentor == null) {
      return;
    }
    int restored = instrumentor.removeAll();
    instrumentor.disable();
    client.close();
    logger.info("Auto-instrumentation disabled, {} slot(s) restored", restored);
    instrumentor = null;
    client = null;
  }
}
