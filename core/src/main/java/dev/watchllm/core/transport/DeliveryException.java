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

import java.util.LinkedHashMap;
import java.util.Map;

import dev.watchllm.core.WatchLLMException;

/**
 * DeliveryException signals that the ingestion service did not accept a
 * request. The status code is {@value #CONNECTION_FAILURE} when no HTTP
 * response was received.
 */
public class DeliveryException extends WatchLLMException {

  public static final String ERROR_CODE = "DELIVERY_FAILED";
  public static final int CONNECTION_FAILURE = -1;

  private final int statusCode;
  private final String responseBody;
  private final int attempts;

  /**
   * Creates a new DeliveryException.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying I/O failure, may be null
   * @param statusCode
   *            the last HTTP status, or {@value #CONNECTION_FAILURE}
   * @param responseBody
   *            the last response body, may be null
   * @param attempts
   *            how many attempts were made
   */
  public DeliveryException(String message, Throwable cause, int statusCode, String responseBody, int attempts) {
    super(message, cause, ERROR_CODE, details(statusCode, responseBody, attempts));
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.attempts = attempts;
  }

  private static Map<String, Object> details(int statusCode, String responseBody, int attempts) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("status", statusCode);
    details.put("body", responseBody);
    details.put("attempts", attempts);
    return details;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }

  public int getAttempts() {
    return attempts;
  }

  public boolean isConnectionFailure() {
    return statusCode == CONNECTION_FAILURE;
  }
}
