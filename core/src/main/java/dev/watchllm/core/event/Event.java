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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Event is the base envelope shared by every event kind sent to the collector.
 *
 * <p>
 * A freshly constructed event already carries a unique id, a UTC timestamp
 * with millisecond precision, an empty tag list and the client descriptor.
 * The project, run and environment fields are filled by the client when the
 * event is logged. Collection setters normalize {@code null} to an empty
 * container so the serialized form never contains a null list or map.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"event_id", "event_type", "project_id", "run_id", "timestamp"})
public abstract class Event {

  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
      .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  /** Environment used when neither the event nor the client sets one. */
  public static final String DEFAULT_ENVIRONMENT = "development";

  @JsonProperty("event_id")
  private String eventId;

  @JsonProperty("project_id")
  private String projectId;

  @JsonProperty("run_id")
  private String runId;

  @JsonProperty("timestamp")
  private String timestamp;

  @JsonProperty("user_id")
  private String userId;

  @JsonProperty("tags")
  private List<String> tags;

  @JsonProperty("release")
  private String release;

  @JsonProperty("env")
  private String env;

  @JsonProperty("client")
  private Map<String, Object> client;

  /**
   * Creates an event with a fresh id and the current time.
   */
  protected Event() {
    this.eventId = UUID.randomUUID().toString();
    this.timestamp = formatTimestamp(Instant.now());
    this.tags = new ArrayList<>();
    this.env = DEFAULT_ENVIRONMENT;
    this.client = ClientInfo.descriptor();
  }

  /**
   * Formats an instant the way the collector expects timestamps.
   *
   * @param instant
   *            the instant to format
   * @return ISO-8601 UTC timestamp with millisecond precision
   */
  public static String formatTimestamp(Instant instant) {
    return TIMESTAMP_FORMAT.format(instant);
  }

  /**
   * Returns the wire tag of this event kind.
   *
   * @return the event type
   */
  @JsonProperty("event_type")
  public abstract EventType getEventType();

  public String getEventId() {
    return eventId;
  }

  public void setEventId(String eventId) {
    this.eventId = eventId;
  }

  public String getProjectId() {
    return projectId;
  }

  public void setProjectId(String projectId) {
    this.projectId = projectId;
  }

  public String getRunId() {
    return runId;
  }

  public void setRunId(String runId) {
    this.runId = runId;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }

  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  public List<String> getTags() {
    return tags;
  }

  public void setTags(List<String> tags) {
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
  }

  /**
   * Adds a tag unless it is already present.
   *
   * @param tag
   *            the tag to add
   */
  public void addTag(String tag) {
    if (tag != null && !tags.contains(tag)) {
      tags.add(tag);
    }
  }

  public String getRelease() {
    return release;
  }

  public void setRelease(String release) {
    this.release = release;
  }

  public String getEnv() {
    return env;
  }

  public void setEnv(String env) {
    this.env = env != null ? env : DEFAULT_ENVIRONMENT;
  }

  public Map<String, Object> getClient() {
    return Collections.unmodifiableMap(client);
  }

  void setClient(Map<String, Object> client) {
    this.client = client != null ? new LinkedHashMap<>(client) : ClientInfo.descriptor();
  }

  static <K, V> Map<K, V> mapOrEmpty(Map<K, V> value) {
    return value != null ? new LinkedHashMap<>(value) : new LinkedHashMap<>();
  }

  static <T> List<T> listOrEmpty(List<T> value) {
    return value != null ? new ArrayList<>(value) : new ArrayList<>();
  }
}
