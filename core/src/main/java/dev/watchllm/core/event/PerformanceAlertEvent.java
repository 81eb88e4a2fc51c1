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
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PerformanceAlertEvent reports that an observed metric crossed a threshold
 * within a time window.
 */
public class PerformanceAlertEvent extends Event {

  @JsonProperty("alert_type")
  private AlertType alertType = AlertType.COST_SPIKE;

  @JsonProperty("threshold")
  private double threshold;

  @JsonProperty("actual_value")
  private double actualValue;

  @JsonProperty("window_minutes")
  private int windowMinutes;

  @JsonProperty("affected_models")
  private List<String> affectedModels = new ArrayList<>();

  public PerformanceAlertEvent() {
  }

  public PerformanceAlertEvent(AlertType alertType, double threshold, double actualValue, int windowMinutes) {
    setAlertType(alertType);
    this.threshold = threshold;
    this.actualValue = actualValue;
    this.windowMinutes = windowMinutes;
  }

  @Override
  public EventType getEventType() {
    return EventType.PERFORMANCE_ALERT;
  }

  public AlertType getAlertType() {
    return alertType;
  }

  public void setAlertType(AlertType alertType) {
    this.alertType = alertType != null ? alertType : AlertType.COST_SPIKE;
  }

  public double getThreshold() {
    return threshold;
  }

  public void setThreshold(double threshold) {
    this.threshold = threshold;
  }

  public double getActualValue() {
    return actualValue;
  }

  public void setActualValue(double actualValue) {
    this.actualValue = actualValue;
  }

  public int getWindowMinutes() {
    return windowMinutes;
  }

  public void setWindowMinutes(int windowMinutes) {
    this.windowMinutes = windowMinutes;
  }

  public List<String> getAffectedModels() {
    return affectedModels;
  }

  public void setAffectedModels(List<String> affectedModels) {
    this.affectedModels = listOrEmpty(affectedModels);
  }
}
