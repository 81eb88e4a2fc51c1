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

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ToolCall records a single tool invocation made while serving a prompt call.
 * It is nested inside {@link PromptCallEvent} and is not an event on its own.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ToolCall {

  @JsonProperty("tool_name")
  private String toolName;

  @JsonProperty("tool_id")
  private String toolId;

  @JsonProperty("input")
  private Map<String, Object> input = new LinkedHashMap<>();

  @JsonProperty("output")
  private Map<String, Object> output = new LinkedHashMap<>();

  @JsonProperty("latency_ms")
  private long latencyMs;

  @JsonProperty("status")
  private Status status = Status.SUCCESS;

  @JsonProperty("error")
  private Map<String, String> error;

  /**
   * Default constructor.
   */
  public ToolCall() {
  }

  /**
   * Creates a ToolCall with the required fields.
   *
   * @param toolName
   *            the tool name
   * @param input
   *            the tool input, may be null
   * @param output
   *            the tool output, may be null
   * @param latencyMs
   *            the tool latency in milliseconds
   */
  public ToolCall(String toolName, Map<String, Object> input, Map<String, Object> output, long latencyMs) {
    this.toolName = toolName;
    setInput(input);
    setOutput(output);
    this.latencyMs = latencyMs;
  }

  public String getToolName() {
    return toolName;
  }

  public void setToolName(String toolName) {
    this.toolName = toolName;
  }

  public String getToolId() {
    return toolId;
  }

  public void setToolId(String toolId) {
    this.toolId = toolId;
  }

  public Map<String, Object> getInput() {
    return input;
  }

  public void setInput(Map<String, Object> input) {
    this.input = Event.mapOrEmpty(input);
  }

  public Map<String, Object> getOutput() {
    return output;
  }

  public void setOutput(Map<String, Object> output) {
    this.output = Event.mapOrEmpty(output);
  }

  public long getLatencyMs() {
    return latencyMs;
  }

  public void setLatencyMs(long latencyMs) {
    this.latencyMs = latencyMs;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status != null ? status : Status.SUCCESS;
  }

  public Map<String, String> getError() {
    return error;
  }

  public void setError(Map<String, String> error) {
    this.error = error;
  }
}
