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

/**
 * DeliveryAck describes a batch the ingestion service accepted.
 */
public final class DeliveryAck {

  private final int statusCode;
  private final String body;
  private final int attempts;

  public DeliveryAck(int statusCode, String body, int attempts) {
    this.statusCode = statusCode;
    this.body = body != null ? body : "";
    this.attempts = attempts;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Returns the raw response body. The service does not define its shape.
   *
   * @return the body, never null
   */
  public String getBody() {
    return body;
  }

  public int getAttempts() {
    return attempts;
  }

  @Override
  public String toString() {
    return "DeliveryAck{status=" + statusCode + ", attempts=" + attempts + "}";
  }
}
