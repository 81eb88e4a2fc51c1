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

import java.util.List;
import java.util.Map;

import dev.watchllm.core.transport.DeliveryException;

/**
 * Receives batches that the background scheduler could not deliver. Those
 * batches are not requeued, so this is the last place they can be observed.
 */
@FunctionalInterface
public interface FailedBatchHandler {

  /**
   * Called once per undeliverable batch.
   *
   * @param batch
   *            the serialized events of the batch
   * @param error
   *            the delivery failure
   */
  void onFailedBatch(List<Map<String, Object>> batch, DeliveryException error);
}
