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

package dev.watchllm.core.event;

/**
 * EventSink accepts events for delivery. The client is the production sink;
 * instrumentation wrappers only depend on this interface.
 */
@FunctionalInterface
public interface EventSink {

  /**
   * Logs an event.
   *
   * @param event
   *            the event to log
   * @return the event id
   */
  String log(Event event);
}
