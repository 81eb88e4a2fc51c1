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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PromptCallEvent records one model invocation: the prompt, the response, the
 * token usage and the derived cost.
 */
public class PromptCallEvent extends Event {

  @JsonProperty("prompt")
  private String prompt = "";

  @JsonProperty("prompt_template_id")
  private String promptTemplateId;

  @JsonProperty("model")
  private String model = "";

  @JsonProperty("model_version")
  private String modelVersion;

  @JsonProperty("tokens_input")
  private int tokensInput;

  @JsonProperty("tokens_output")
  private int tokensOutput;

  @JsonProperty("cost_estimate_usd")
  private double costEstimateUsd;

  @JsonProperty("response")
  private String response = "";

  @JsonProperty("response_metadata")
  private Map<String, Object> responseMetadata = new LinkedHashMap<>();

  @JsonProperty("tool_calls")
  private List<ToolCall> toolCalls = new ArrayList<>();

  @JsonProperty("status")
  private Status status = Status.SUCCESS;

  @JsonProperty("error")
  private Map<String, String> error;

  @JsonProperty("latency_ms")
  private long latencyMs;

  /**
   * Default constructor.
   */
  public PromptCallEvent() {
  }

  /**
   * Creates a PromptCallEvent with the required fields.
   *
   * @param prompt
   *            the prompt text
   * @param model
   *            the model name
   * @param response
   *            the response text
   * @param tokensInput
   *            input token count
   * @param tokensOutput
   *            output token count
   * @param latencyMs
   *            call latency in milliseconds
   */
  public PromptCallEvent(String prompt, String model, String response, int tokensInput, int tokensOutput,
      long latencyMs) {
    setPrompt(prompt);
    setModel(model);
    setResponse(response);
    this.tokensInput = tokensInput;
    this.tokensOutput = tokensOutput;
    this.latencyMs = latencyMs;
  }

  @Override
  public EventType getEventType() {
    return EventType.PROMPT_CALL;
  }

  public String getPrompt() {
    return prompt;
  }

  public void setPrompt(String prompt) {
    this.prompt = prompt != null ? prompt : "";
  }

  public String getPromptTemplateId() {
    return promptTemplateId;
  }

  public void setPromptTemplateId(String promptTemplateId) {
    this.promptTemplateId = promptTemplateId;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model != null ? model : "";
  }

  public String getModelVersion() {
    return modelVersion;
  }

  public void setModelVersion(String modelVersion) {
    this.modelVersion = modelVersion;
  }

  public int getTokensInput() {
    return tokensInput;
  }

  public void setTokensInput(int tokensInput) {
    this.tokensInput = tokensInput;
  }

  public int getTokensOutput() {
    return tokensOutput;
  }

  public void setTokensOutput(int tokensOutput) {
    this.tokensOutput = tokensOutput;
  }

  public double getCostEstimateUsd() {
    return costEstimateUsd;
  }

  public void setCostEstimateUsd(double costEstimateUsd) {
    this.costEstimateUsd = costEstimateUsd;
  }

  public String getResponse() {
    return response;
  }

  public void setResponse(String response) {
    this.response = response != null ? response : "";
  }

  public Map<String, Object> getResponseMetadata() {
    return responseMetadata;
  }

  public void setResponseMetadata(Map<String, Object> responseMetadata) {
    this.responseMetadata = mapOrEmpty(responseMetadata);
  }

  public List<ToolCall> getToolCalls() {
    return toolCalls;
  }

  public void setToolCalls(List<ToolCall> toolCalls) {
    this.toolCalls = listOrEmpty(toolCalls);
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

  public long getLatencyMs() {
    return latencyMs;
  }

  public void setLatencyMs(long latencyMs) {
    this.latencyMs = latencyMs;
  }
}
