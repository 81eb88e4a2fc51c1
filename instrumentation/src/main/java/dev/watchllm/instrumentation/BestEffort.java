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

package dev.watchllm.instrumentation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.watchllm.core.JsonUtils;

/**
 * BestEffort reads fields out of provider objects without knowing their
 * classes. Requests and responses (POJOs, maps, JSON strings or trees) are
 * converted to a Jackson tree and navigated with JSON pointers; anything
 * absent resolves to an empty value instead of an exception.
 */
public final class BestEffort {

  private BestEffort() {
    // Utility class
  }

  /**
   * Converts any object to a tree. Never fails.
   */
  public static JsonNode tree(Object value) {
    return JsonUtils.toTreeOrMissing(value);
  }

  /**
   * Returns the scalar at {@code pointer} as text, or {@code ""}.
   *
   * @param node
   *            the root
   * @param pointer
   *            a JSON pointer such as {@code /choices/0/message/content}
   * @return the text, never null
   */
  public static String text(JsonNode node, String pointer) {
    JsonNode value = node.at(pointer);
    if (value.isMissingNode() || value.isNull() || !value.isValueNode()) {
      return "";
    }
    return value.asText();
  }

  /**
   * Returns the number at {@code pointer}, or 0.
   */
  public static int integer(JsonNode node, String pointer) {
    return node.at(pointer).asInt(0);
  }

  /**
   * Copies the named top-level fields that are present and not null.
   */
  public static Map<String, Object> fields(JsonNode node, String... names) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (String name : names) {
      JsonNode value = node.path(name);
      if (!value.isMissingNode() && !value.isNull()) {
        result.put(name, JsonUtils.getObjectMapper().convertValue(value, Object.class));
      }
    }
    return result;
  }

  /**
   * Renders chat messages as {@code [role]: content} lines.
   *
   * @param messages
   *            an array of objects with {@code role} and {@code content}
   * @return the rendered prompt, empty if there are no messages
   */
  public static String renderMessages(JsonNode messages) {
    List<String> lines = new ArrayList<>();
    for (JsonNode message : messages) {
      lines.add("[" + message.path("role").asText("") + "]: " + contentText(message.path("content")));
    }
    return String.join("\n", lines);
  }

  /**
   * Returns the text of a message content, which is either a string or a list
   * of parts. Only text parts are kept.
   */
  public static String contentText(JsonNode content) {
    if (content.isTextual()) {
      return content.asText();
    }
    if (!content.isArray()) {
      return "";
    }
    List<String> texts = new ArrayList<>();
    Iterator<JsonNode> parts = content.elements();
    while (parts.hasNext()) {
      JsonNode part = parts.next();
      if (part.isTextual()) {
        texts.add(part.asText());
      } else if (part.path("text").isTextual()
          && (part.path("type").isMissingNode() || "text".equals(part.path("type").asText()))) {
        texts.add(part.path("text").asText());
      }
    }
    return String.join(" ", texts);
  }
}
