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
 * HallucinationDetectedEvent flags model output that is believed to be
 * unsupported. The confidence score is recorded as given and is not range
 * checked.
 */
public class HallucinationDetectedEvent extends Event {

  @JsonProperty("detection_method")
  private DetectionMethod detectionMethod = DetectionMethod.HEURISTIC;

  @JsonProperty("confidence_score")
  private double confidenceScore;

  @JsonProperty("flagged_content")
  private String flaggedContent = "";

  @JsonProperty("ground_truth")
  private String groundTruth;

  @JsonProperty("recommendations")
  private List<String> recommendations = new ArrayList<>();

  public HallucinationDetectedEvent() {
  }

  public HallucinationDetectedEvent(DetectionMethod detectionMethod, double confidenceScore, String flaggedContent) {
    setDetectionMethod(detectionMethod);
    this.confidenceScore = confidenceScore;
    setFlaggedContent(flaggedContent);
  }

  @Override
  public EventType getEventType() {
    return EventType.HALLUCINATION_DETECTED;
  }

  public DetectionMethod getDetectionMethod() {
    return detectionMethod;
  }

  public void setDetectionMethod(DetectionMethod detectionMethod) {
    this.detectionMethod = detectionMethod != null ? detectionMethod : DetectionMethod.HEURISTIC;
  }

  public double getConfidenceScore() {
    return confidenceScore;
  }

  public void setConfidenceScore(double confidenceScore) {
    this.confidenceScore = confidenceScore;
  }

  public String getFlaggedContent() {
    return flaggedContent;
  }

  public void setFlaggedContent(String flaggedContent) {
    this.flaggedContent = flaggedContent != null ? flaggedContent : "";
  }

  public String getGroundTruth() {
    return groundTruth;
  }

  public void setGroundTruth(String groundTruth) {
    this.groundTruth = groundTruth;
  }

  public List<String> getRecommendations() {
    return recommendations;
  }

  public void setRecommendations(List<String> recommendations) {
    this.recommendations = listOrEmpty(recommendations);
  }
}
