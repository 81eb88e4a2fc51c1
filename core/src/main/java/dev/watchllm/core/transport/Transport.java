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

import java.util.List;
import java.util.Map;

/**
 * Transport delivers one serialized batch of events to the ingestion service.
 */
public interface Transport {

  /**
   * Sends the batch. Implementations own their retry policy; a thrown
   * exception means the batch was not accepted.
   *
   * @param batch
   *            the serialized events, in queue order
   * @return the acknowledgement of the accepted batch
   * @throws DeliveryException
   *             if delivery failed after all permitted attempts
   */
  DeliveryAck sendBatch(List<Map<String, Object>> batch) throws DeliveryException;

  /**
   * Releases any resources held by the transport.
   */
  default void close() {
  }
}
