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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ErrorEvent records an application error that happened during a run.
 */
public class ErrorEvent extends Event {

  @JsonProperty("error")
  private Map<String, String> error = new LinkedHashMap<>();

  @JsonProperty("context")
  private Map<String, Object> context = new LinkedHashMap<>();

  @JsonProperty("stack_trace")
  private String stackTrace;

  /**
   * Default constructor.
   */
  public ErrorEvent() {
  }

  /**
   * Creates an ErrorEvent from an error descriptor map. The {@code stack} entry,
   * if present, becomes the stack trace.
   *
   * @param error
   *            error descriptor with message/type/stack entries
   * @param context
   *            additional context, may be null
   */
  public ErrorEvent(Map<String, String> error, Map<String, Object> context) {
    setError(error);
    setContext(context);
    this.stackTrace = this.error.get("stack");
  }

  /**
   * Creates an ErrorEvent describing a throwable.
   *
   * @param throwable
   *            the error to describe
   * @param context
   *            additional context, may be null
   * @return the error event
   */
  public static ErrorEvent fromThrowable(Throwable throwable, Map<String, Object> context) {
    return new ErrorEvent(describe(throwable), context);
  }

  /**
   * Builds the error descriptor map for a throwable.
   *
   * @param throwable
   *            the error to describe
   * @return map with message, type and stack entries
   */
  public static Map<String, String> describe(Throwable throwable) {
    Map<String, String> descriptor = new LinkedHashMap<>();
    descriptor.put("message", String.valueOf(throwable.getMessage()));
    descriptor.put("type", throwable.getClass().getSimpleName());
    StringWriter stack = new StringWriter();
    throwable.printStackTrace(new PrintWriter(stack));
    descriptor.put("stack", stack.toString());
    return descriptor;
  }

  @Override
  public EventType getEventType() {
    return EventType.ERROR;
  }

  public Map<String, String> getError() {
    return error;
  }

  public void setError(Map<String, String> error) {
    this.error = mapOrEmpty(error);
  }

  public Map<String, Object> getContext() {
    return context;
  }

  public void setContext(Map<String, Object> context) {
    this.context = mapOrEmpty(context);
  }

  public String getStackTrace() {
    return stackTrace;
  }

  public void setStackTrace(String stackTrace) {
    this.stackTrace = stackTrace;
  }
}
