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

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FlushScheduler decides when to drain the queue into a delivery attempt.
 *
 * <p>
 * A daemon thread wakes every tick and triggers a flush when either the queue
 * holds at least {@code batchSize} events, or it is non-empty and
 * {@code flushInterval} has elapsed since the last flush. The idle wait is a
 * latch, so {@link #shutdown(Duration)} wakes the thread immediately.
 */
public class FlushScheduler {

  private static final Logger logger = LoggerFactory.getLogger(FlushScheduler.class);

  /**
   * The work performed when a flush is due.
   */
  @FunctionalInterface
  public interface FlushAction {
    void flush();
  }

  private final DeliveryQueue queue;
  private final FlushAction action;
  private final int batchSize;
  private final long flushIntervalNanos;
  private final long tickMillis;
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final Thread worker;
  private volatile boolean started;

  /**
   * Creates a FlushScheduler. The scheduler does not run until
   * {@link #start()} is called.
   *
   * @param queue
   *            the queue to watch
   * @param action
   *            the flush to perform when due
   * @param batchSize
   *            queue size that triggers an immediate flush
   * @param flushInterval
   *            maximum time a non-empty queue waits for a flush
   * @param tickInterval
   *            how often the trigger conditions are checked
   */
  public FlushScheduler(DeliveryQueue queue, FlushAction action, int batchSize, Duration flushInterval,
      Duration tickInterval) {
    this.queue = queue;
    this.action = action;
    this.batchSize = batchSize;
    this.flushIntervalNanos = flushInterval.toNanos();
    this.tickMillis = Math.max(1, tickInterval.toMillis());
    this.worker = new Thread(this::runLoop, "watchllm-flush-scheduler");
    this.worker.setDaemon(true);
  }

  /**
   * Starts the background thread. Calling it more than once has no effect.
   */
  public synchronized void start() {
    if (!started) {
      started = true;
      worker.start();
      logger.debug("Flush scheduler started: batchSize={}, tick={}ms", batchSize, tickMillis);
    }
  }

  public boolean isRunning() {
    return worker.isAlive();
  }

  /**
   * Signals the scheduler to stop and waits a bounded time for it to exit. A
   * flush in progress is allowed to finish; if it outlives the timeout the
   * scheduler is abandoned and shutdown continues.
   *
   * @param timeout
   *            maximum time to wait for the thread
   * @return true if the thread exited within the timeout
   */
  public boolean shutdown(Duration timeout) {
    stopSignal.countDown();
    if (!started || Thread.currentThread() == worker) {
      return true;
    }
    try {
      worker.join(Math.max(1, timeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (worker.isAlive()) {
      logger.warn("Flush scheduler did not stop within {}ms, continuing shutdown", timeout.toMillis());
      return false;
    }
    logger.debug("Flush scheduler stopped");
    return true;
  }

  boolean isFlushDue(int size, long nanosSinceLastFlush) {
    return size >= batchSize || (size > 0 && nanosSinceLastFlush >= flushIntervalNanos);
  }

  private void runLoop() {
    long lastFlush = System.nanoTime();
    try {
      while (!stopSignal.await(tickMillis, TimeUnit.MILLISECONDS)) {
        try {
          if (isFlushDue(queue.size(), System.nanoTime() - lastFlush)) {
            action.flush();
            lastFlush = System.nanoTime();
          }
        } catch (RuntimeException e) {
          logger.error("Error in flush scheduler, retrying on next tick", e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.debug("Flush scheduler interrupted");
    }
  }
}
