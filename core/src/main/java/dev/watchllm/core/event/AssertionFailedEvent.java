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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * AssertionFailedEvent records an output check that did not hold.
 */
public class AssertionFailedEvent extends Event {

  @JsonProperty("assertion_name")
  private String assertionName = "";

  @JsonProperty("assertion_type")
  private AssertionType assertionType = AssertionType.CUSTOM;

  @JsonProperty("expected")
  private Object expected;

  @JsonProperty("actual")
  private Object actual;

  @JsonProperty("severity")
  private Severity severity = Severity.MEDIUM;

  public AssertionFailedEvent() {
  }

  public AssertionFailedEvent(String assertionName, AssertionType assertionType, Object expected, Object actual,
      Severity severity) {
    setAssertionName(assertionName);
    setAssertionType(assertionType);
    this.expected = expected;
    this.actual = actual;
    setSeverity(severity);
  }

  @Override
  public EventType getEventType() {
    return EventType.ASSERTION_FAILED;
  }

  public String getAssertionName() {
    return assertionName;
  }

  public void setAssertionName(String assertionName) {
    this.assertionName = assertionName != null ? assertionName : "";
  }

  public AssertionType getAssertionType() {
    return assertionType;
  }

  public void setAssertionType(AssertionType assertionType) {
    this.assertionType = assertionType != null ? assertionType : AssertionType.CUSTOM;
  }

  public Object getExpected() {
    return expected;
  }

  public void setExpected(Object expected) {
    this.expected = expected;
  }

  public Object getActual() {
    return actual;
  }

  public void setActual(Object actual) {
    this.actual = actual;
  }

  public Severity getSeverity() {
    return severity;
  }

  public void setSeverity(Severity severity) {
    this.severity = severity != null ? severity : Severity.MEDIUM;
  }
}
