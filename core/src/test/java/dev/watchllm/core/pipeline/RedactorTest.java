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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.watchllm.core.telemetry.PipelineTelemetry;

/**
 * Unit tests for Redactor.
 */
class RedactorTest {

  private final Redactor redactor = new Redactor(true, mock(PipelineTelemetry.class));

  @Test
  void testEmailIsRedactedAnywhereInTheEvent() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("contact", "write to a@b.com please");
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("prompt", "my mail is jane.doe@example.org");
    event.put("context", nested);

    Map<String, Object> redacted = redactor.redact(event);

    assertEquals("my mail is " + Redactor.EMAIL_TOKEN, redacted.get("prompt"));
    @SuppressWarnings("unchecked")
    Map<String, Object> context = (Map<String, Object>) redacted.get("context");
    assertEquals("write to " + Redactor.EMAIL_TOKEN + " please", context.get("contact"));
  }

  @Test
  void testEmailAfterControlCharactersAndQuotesIsRedacted() {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("prompt", "Contact:\na@b.com");
    event.put("response", "Tab\tx@y.com and \"q@r.io\"");
    event.put("note", "other pii z@w.org");

    Map<String, Object> redacted = redactor.redact(event);

    assertEquals("Contact:\n" + Redactor.EMAIL_TOKEN, redacted.get("prompt"));
    assertEquals("Tab\t" + Redactor.EMAIL_TOKEN + " and \"" + Redactor.EMAIL_TOKEN + "\"", redacted.get("response"));
    assertEquals("other pii " + Redactor.EMAIL_TOKEN, redacted.get("note"));
  }

  @Test
  void testCardAfterControlCharactersAndQuotesIsRedacted() {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("newline", "Card:\n4111 1111 1111 1111");
    event.put("tab", "Card:\t4111111111111111");
    event.put("carriage", "Card:\r4111-1111-1111-1111");
    event.put("quoted", "\"4111 1111 1111 1111\"");

    Map<String, Object> redacted = redactor.redact(event);

    assertEquals("Card:\n" + Redactor.CREDIT_CARD_TOKEN, redacted.get("newline"));
    assertEquals("Card:\t" + Redactor.CREDIT_CARD_TOKEN, redacted.get("tab"));
    assertEquals("Card:\r" + Redactor.CREDIT_CARD_TOKEN, redacted.get("carriage"));
    assertEquals("\"" + Redactor.CREDIT_CARD_TOKEN + "\"", redacted.get("quoted"));
  }

  @Test
  void testListElementsAndKeysAreRedacted() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("a@b.com", 1);
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("tags", List.of("plain", "ssn 123-45-6789"));
    event.put("data", data);
    event.put("tokens_input", 7);

    Map<String, Object> redacted = redactor.redact(event);

    assertEquals(List.of("plain", "ssn " + Redactor.SSN_TOKEN), redacted.get("tags"));
    assertEquals(Map.of(Redactor.EMAIL_TOKEN, 1), redacted.get("data"));
    assertEquals(7, redacted.get("tokens_input"));
  }

  @Test
  void testCardAndSsnAreRedacted() {
    assertEquals("card " + Redactor.CREDIT_CARD_TOKEN, Redactor.redactText("card 4111-1111-1111-1111"));
    assertEquals("card " + Redactor.CREDIT_CARD_TOKEN, Redactor.redactText("card 4111111111111111"));
    assertEquals("ssn " + Redactor.SSN_TOKEN, Redactor.redactText("ssn 123-45-6789"));
  }

  @Test
  void testRedactionIsIdempotent() {
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("prompt", "a@b.com 4111 1111 1111 1111 123-45-6789");
    event.put("tags", List.of("x"));

    Map<String, Object> once = redactor.redact(event);
    Map<String, Object> twice = redactor.redact(once);

    assertEquals(once, twice);
  }

  @Test
  void testCleanEventIsReturnedUnchanged() {
    Map<String, Object> event = Map.of("prompt", "nothing to hide", "tokens_input", 12);

    assertSame(event, redactor.redact(event));
  }

  @Test
  void testDisabledRedactorIsIdentity() {
    Redactor disabled = new Redactor(false, mock(PipelineTelemetry.class));
    Map<String, Object> event = Map.of("prompt", "a@b.com");

    assertSame(event, disabled.redact(event));
  }

  @Test
  void testUnserializableEventPassesThroughAndIsCounted() {
    PipelineTelemetry telemetry = mock(PipelineTelemetry.class);
    Redactor counting = new Redactor(true, telemetry);
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("payload", new Exploding());

    assertSame(event, counting.redact(event));
    verify(telemetry).recordRedactionFailure();
  }

  static class Exploding {
    public String getValue() {
      throw new IllegalStateException("not serializable");
    }
  }
}
