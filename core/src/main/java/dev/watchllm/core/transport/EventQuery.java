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

package dev.watchllm.core.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.watchllm.core.event.EventType;
import dev.watchllm.core.event.Status;

/**
 * Filters for {@link QueryClient#queryEvents(EventQuery)}. Results are
 * always sorted by timestamp, newest first.
 */
public class EventQuery {

  public static final int DEFAULT_LIMIT = 50;

  private final int limit;
  private final List<EventType> eventTypes;
  private final Status status;
  private final String dateFrom;
  private final String dateTo;
  private final String textSearch;

  private EventQuery(Builder builder) {
    this.limit = builder.limit;
    this.eventTypes = Collections.unmodifiableList(new ArrayList<>(builder.eventTypes));
    this.status = builder.status;
    this.dateFrom = builder.dateFrom;
    this.dateTo = builder.dateTo;
    this.textSearch = builder.textSearch;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getLimit() {
    return limit;
  }

  public List<EventType> getEventTypes() {
    return eventTypes;
  }

  public Status getStatus() {
    return status;
  }

  public String getDateFrom() {
    return dateFrom;
  }

  public String getDateTo() {
    return dateTo;
  }

  public String getTextSearch() {
    return textSearch;
  }

  /**
   * Renders the request body for the given project. Unset filters are omitted.
   */
  Map<String, Object> toRequestBody(String projectId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("project_id", projectId);
    body.put("limit", limit);
    body.put("sort_by", "timestamp");
    body.put("sort_order", "desc");
    if (!eventTypes.isEmpty()) {
      List<String> types = new ArrayList<>();
      for (EventType type : eventTypes) {
        types.add(type.getValue());
      }
      body.put("event_types", types);
    }
    if (status != null) {
      body.put("status", status.getValue());
    }
    putIfPresent(body, "date_from", dateFrom);
    putIfPresent(body, "date_to", dateTo);
    putIfPresent(body, "text_search", textSearch);
    return body;
  }

  private static void putIfPresent(Map<String, Object> body, String key, String value) {
    if (value != null && !value.isEmpty()) {
      body.put(key, value);
    }
  }

  /**
   * Builder for EventQuery.
   */
  public static class Builder {
    private int limit = DEFAULT_LIMIT;
    private final List<EventType> eventTypes = new ArrayList<>();
    private Status status;
    private String dateFrom;
    private String dateTo;
    private String textSearch;

    public Builder limit(int limit) {
      if (limit < 1) {
        throw new IllegalArgumentException("limit must be at least 1, got " + limit);
      }
      this.limit = limit;
      return this;
    }

    public Builder eventType(EventType eventType) {
      this.eventTypes.add(eventType);
      return this;
    }

    public Builder eventTypes(List<EventType> eventTypes) {
      this.eventTypes.clear();
      this.eventTypes.addAll(eventTypes);
      return this;
    }

    public Builder status(Status status) {
      this.status = status;
      return this;
    }

    /**
     * Lower bound on event timestamps, ISO-8601.
     */
    public Builder dateFrom(String dateFrom) {
      this.dateFrom = dateFrom;
      return this;
    }

    public Builder dateTo(String dateTo) {
      this.dateTo = dateTo;
      return this;
    }

    public Builder textSearch(String textSearch) {
      this.textSearch = textSearch;
      return this;
    }

    public EventQuery build() {
      return new EventQuery(this);
    }
  }
}
