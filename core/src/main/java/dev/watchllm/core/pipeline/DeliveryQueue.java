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

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.watchllm.core.telemetry.PipelineTelemetry;

/**
 * DeliveryQueue is the bounded buffer of serialized, redacted events waiting
 * to be shipped.
 *
 * <p>
 * Producers never block: when the queue is full the new event is dropped and
 * counted. Overflow is lossy by design, no back-pressure reaches the caller.
 */
public class DeliveryQueue {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryQueue.class);

  /** Default capacity of the post-enrichment queue. */
  public static final int DEFAULT_CAPACITY = 1000;

  private final LinkedBlockingDeque<Map<String, Object>> deque;
  private final int capacity;
  private final AtomicLong dropped = new AtomicLong();
  private final PipelineTelemetry telemetry;

  /**
   * Creates a DeliveryQueue.
   *
   * @param capacity
   *            maximum number of pending events
   */
  public DeliveryQueue(int capacity) {
    this(capacity, PipelineTelemetry.getInstance());
  }

  DeliveryQueue(int capacity, PipelineTelemetry telemetry) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1");
    }
    this.capacity = capacity;
    this.deque = new LinkedBlockingDeque<>(capacity);
    this.telemetry = telemetry;
  }

  /**
   * Appends an event without blocking.
   *
   * @param event
   *            the serialized event
   * @return true if queued, false if dropped because the queue is full
   */
  public boolean enqueue(Map<String, Object> event) {
    if (deque.offerLast(event)) {
      return true;
    }
    long total = dropped.incrementAndGet();
    telemetry.recordDropped(1, PipelineTelemetry.REASON_QUEUE_FULL);
    logger.warn("Event queue full (capacity {}), dropping event; {} dropped so far", capacity, total);
    return false;
  }

  /**
   * Atomically removes up to {@code max} events in FIFO order.
   *
   * @param max
   *            maximum number of events to remove
   * @return the removed events, possibly empty
   */
  public List<Map<String, Object>> drainUpTo(int max) {
    List<Map<String, Object>> batch = new ArrayList<>(Math.min(max, Math.max(deque.size(), 0)));
    if (max > 0) {
      deque.drainTo(batch, max);
    }
    return batch;
  }

  /**
   * Puts a failed batch back at the head of the queue, preserving its order.
   * Events that no longer fit are dropped and counted.
   *
   * @param batch
   *            the batch to return
   * @return number of events that could not be requeued
   */
  public int requeue(List<Map<String, Object>> batch) {
    int lost = 0;
    ListIterator<Map<String, Object>> it = batch.listIterator(batch.size());
    while (it.hasPrevious()) {
      if (!deque.offerFirst(it.previous())) {
        lost++;
      }
    }
    if (lost > 0) {
      dropped.addAndGet(lost);
      telemetry.recordDropped(lost, PipelineTelemetry.REASON_REQUEUE_OVERFLOW);
      logger.warn("Event queue full while requeueing a failed batch, dropped {} events", lost);
    }
    return lost;
  }

  /**
   * Returns the approximate number of pending events.
   *
   * @return the pending count
   */
  public int size() {
    return deque.size();
  }

  public boolean isEmpty() {
    return deque.isEmpty();
  }

  /**
   * Returns the number of events dropped since creation.
   *
   * @return the drop count
   */
  public long droppedCount() {
    return dropped.get();
  }
}
