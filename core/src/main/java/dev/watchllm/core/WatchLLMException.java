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

package dev.watchllm.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WatchLLMException is the base exception for SDK failures. Every instance
 * carries an error code, so callers can tell a serialization problem from a
 * delivery problem without parsing the message.
 */
public class WatchLLMException extends RuntimeException {

  /** An event or payload could not be converted to or from JSON. */
  public static final String SERIALIZATION_FAILED = "SERIALIZATION_FAILED";

  private final String errorCode;
  private final Map<String, Object> details;

  /**
   * Creates a serialization failure.
   *
   * @param message
   *            the error message
   * @param cause
   *            the Jackson failure
   */
  public WatchLLMException(String message, Throwable cause) {
    this(message, cause, SERIALIZATION_FAILED, Collections.emptyMap());
  }

  /**
   * Creates a new WatchLLMException.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause, may be null
   * @param errorCode
   *            the error code
   * @param details
   *            structured details, copied
   */
  protected WatchLLMException(String message, Throwable cause, String errorCode, Map<String, Object> details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns the structured details, empty when there are none.
   */
  public Map<String, Object> getDetails() {
    return details;
  }
}
