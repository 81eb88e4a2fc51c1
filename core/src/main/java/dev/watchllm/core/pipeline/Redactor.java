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

package dev.watchllm.core.pipeline;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import dev.watchllm.core.JsonUtils;
import dev.watchllm.core.telemetry.PipelineTelemetry;

/**
 * Redactor scrubs personal data from a serialized event before it leaves the
 * process.
 *
 * <p>
 * The event is converted to a Jackson tree and the rules are applied to every
 * string value and object key, at any depth, so sensitive values are caught
 * regardless of which field carries them. Rules
 * run in order: email addresses, 16-digit card numbers, US social security
 * numbers. Replacement tokens contain no characters the rules match, which
 * makes redaction idempotent.
 */
public class Redactor {

  private static final Logger logger = LoggerFactory.getLogger(Redactor.class);

  public static final String EMAIL_TOKEN = "[REDACTED_EMAIL]";
  public static final String CREDIT_CARD_TOKEN = "[REDACTED_CC]";
  public static final String SSN_TOKEN = "[REDACTED_SSN]";

  private static final List<Rule> RULES = List.of(
      new Rule(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), EMAIL_TOKEN),
      new Rule(Pattern.compile("\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b"), CREDIT_CARD_TOKEN),
      new Rule(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), SSN_TOKEN));

  private final boolean enabled;
  private final PipelineTelemetry telemetry;

  /**
   * Creates a Redactor.
   *
   * @param enabled
   *            false turns the redactor into the identity function
   */
  public Redactor(boolean enabled) {
    this(enabled, PipelineTelemetry.getInstance());
  }

  Redactor(boolean enabled, PipelineTelemetry telemetry) {
    this.enabled = enabled;
    this.telemetry = telemetry;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Redacts a serialized event. Never throws: if the event cannot be
   * converted it is returned unchanged and a warning is logged.
   *
   * @param event
   *            the serialized event
   * @return the redacted event, or the original one on failure
   */
  public Map<String, Object> redact(Map<String, Object> event) {
    if (!enabled || event == null) {
      return event;
    }
    try {
      JsonNode tree = JsonUtils.getObjectMapper().valueToTree(event);
      JsonNode redacted = scrub(tree);
      if (redacted == tree) {
        return event;
      }
      return JsonUtils.toMap(redacted);
    } catch (RuntimeException e) {
      logger.warn("PII redaction failed, sending event {} unredacted: {}", event.get("event_id"), e.getMessage());
      telemetry.recordRedactionFailure();
      return event;
    }
  }

  /**
   * Applies the redaction rules to plain text.
   *
   * @param text
   *            the text to scrub, may be null
   * @return the scrubbed text
   */
  public static String redactText(String text) {
    if (text == null) {
      return null;
    }
    String result = text;
    for (Rule rule : RULES) {
      result = rule.pattern.matcher(result).replaceAll(rule.replacement);
    }
    return result;
  }

  /**
   * Returns the node itself when nothing in it matched, otherwise a copy with
   * the matches replaced.
   */
  private static JsonNode scrub(JsonNode node) {
    if (node.isTextual()) {
      String text = node.textValue();
      String redacted = redactText(text);
      return redacted.equals(text) ? node : TextNode.valueOf(redacted);
    }
    if (node.isObject()) {
      ObjectNode copy = JsonNodeFactory.instance.objectNode();
      boolean changed = false;
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        String key = redactText(field.getKey());
        JsonNode value = scrub(field.getValue());
        changed |= !key.equals(field.getKey()) || value != field.getValue();
        copy.set(key, value);
      }
      return changed ? copy : node;
    }
    if (node.isArray()) {
      ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
      boolean changed = false;
      for (JsonNode element : node) {
        JsonNode value = scrub(element);
        changed |= value != element;
        copy.add(value);
      }
      return changed ? copy : node;
    }
    return node;
  }

  private static final class Rule {
    private final Pattern pattern;
    private final String replacement;

    Rule(Pattern pattern, String replacement) {
      this.pattern = pattern;
      this.replacement = Matcher.quoteReplacement(replacement);
    }
  }
}
