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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * AgentStepEvent records one step of a multi-step agent run.
 */
public class AgentStepEvent extends Event {

  @JsonProperty("step_number")
  private int stepNumber;

  @JsonProperty("step_name")
  private String stepName = "";

  @JsonProperty("step_type")
  private StepType stepType = StepType.REASONING;

  @JsonProperty("input_data")
  private Map<String, Object> inputData = new LinkedHashMap<>();

  @JsonProperty("output_data")
  private Map<String, Object> outputData = new LinkedHashMap<>();

  @JsonProperty("reasoning")
  private String reasoning;

  @JsonProperty("context")
  private Map<String, Object> context = new LinkedHashMap<>();

  @JsonProperty("latency_ms")
  private long latencyMs;

  @JsonProperty("status")
  private Status status = Status.SUCCESS;

  @JsonProperty("error")
  private Map<String, String> error;

  /**
   * Default constructor.
   */
  public AgentStepEvent() {
  }

  /**
   * Creates an AgentStepEvent with the required fields.
   *
   * @param stepNumber
   *            position of the step within the run
   * @param stepName
   *            the step name
   * @param stepType
   *            the step type
   * @param inputData
   *            step input, may be null
   * @param outputData
   *            step output, may be null
   * @param latencyMs
   *            step latency in milliseconds
   */
  public AgentStepEvent(int stepNumber, String stepName, StepType stepType, Map<String, Object> inputData,
      Map<String, Object> outputData, long latencyMs) {
    this.stepNumber = stepNumber;
    setStepName(stepName);
    setStepType(stepType);
    setInputData(inputData);
    setOutputData(outputData);
    this.latencyMs = latencyMs;
  }

  @Override
  public EventType getEventType() {
    return EventType.AGENT_STEP;
  }

  public int getStepNumber() {
    return stepNumber;
  }

  public void setStepNumber(int stepNumber) {
    this.stepNumber = stepNumber;
  }

  public String getStepName() {
    return stepName;
  }

  public void setStepName(String stepName) {
    this.stepName = stepName != null ? stepName : "";
  }

  public StepType getStepType() {
    return stepType;
  }

  public void setStepType(StepType stepType) {
    this.stepType = stepType != null ? stepType : StepType.REASONING;
  }

  public Map<String, Object> getInputData() {
    return inputData;
  }

  public void setInputData(Map<String, Object> inputData) {
    this.inputData = mapOrEmpty(inputData);
  }

  public Map<String, Object> getOutputData() {
    return outputData;
  }

  public void setOutputData(Map<String, Object> outputData) {
    this.outputData = mapOrEmpty(outputData);
  }

  public String getReasoning() {
    return reasoning;
  }

  public void setReasoning(String reasoning) {
    this.reasoning = reasoning;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  public void setContext(Map<String, Object> context) {
    this.context = mapOrEmpty(context);
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
