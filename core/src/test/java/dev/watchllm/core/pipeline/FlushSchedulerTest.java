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

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.watchllm.core.telemetry.PipelineTelemetry;

/**
 * Unit tests for FlushScheduler.
 */
class FlushSchedulerTest {

  private DeliveryQueue queue;
  private FlushScheduler scheduler;

  @BeforeEach
  void setUp() {
    queue = new DeliveryQueue(100, mock(PipelineTelemetry.class));
  }

  @AfterEach
  void tearDown() {
    if (scheduler != null) {
      scheduler.shutdown(Duration.ofSeconds(1));
    }
  }

  @Test
  void testFlushesOnceBatchSizeIsReached() throws Exception {
    CountDownLatch flushed = new CountDownLatch(1);
    scheduler = new FlushScheduler(queue, () -> {
      queue.drainUpTo(10);
      flushed.countDown();
    }, 3, Duration.ofHours(1), Duration.ofMillis(20));
    scheduler.start();

    queue.enqueue(Map.of("n", 1));
    queue.enqueue(Map.of("n", 2));
    queue.enqueue(Map.of("n", 3));

    assertTrue(flushed.await(2, TimeUnit.SECONDS));
    assertEquals(0, queue.size());
  }

  @Test
  void testFlushesPartialBatchAfterInterval() throws Exception {
    CountDownLatch flushed = new CountDownLatch(1);
    scheduler = new FlushScheduler(queue, () -> {
      queue.drainUpTo(10);
      flushed.countDown();
    }, 50, Duration.ofMillis(100), Duration.ofMillis(20));
    scheduler.start();

    queue.enqueue(Map.of("n", 1));

    assertTrue(flushed.await(2, TimeUnit.SECONDS));
  }

  @Test
  void testFailingFlushDoesNotStopTheLoop() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    CountDownLatch twice = new CountDownLatch(2);
    scheduler = new FlushScheduler(queue, () -> {
      calls.incrementAndGet();
      twice.countDown();
      throw new IllegalStateException("collector down");
    }, 1, Duration.ofHours(1), Duration.ofMillis(10));
    scheduler.start();

    queue.enqueue(Map.of("n", 1));

    assertTrue(twice.await(2, TimeUnit.SECONDS));
    assertTrue(scheduler.isRunning());
  }

  @Test
  void testShutdownWakesIdleScheduler() {
    scheduler = new FlushScheduler(queue, () -> {
    }, 10, Duration.ofHours(1), Duration.ofHours(1));
    scheduler.start();

    long start = System.nanoTime();
    assertTrue(scheduler.shutdown(Duration.ofSeconds(5)));

    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2));
    assertFalse(scheduler.isRunning());
  }

  @Test
  void testIsFlushDue() {
    scheduler = new FlushScheduler(queue, () -> {
    }, 5, Duration.ofSeconds(5), Duration.ofSeconds(1));

    assertTrue(scheduler.isFlushDue(5, 0));
    assertFalse(scheduler.isFlushDue(4, TimeUnit.SECONDS.toNanos(1)));
    assertTrue(scheduler.isFlushDue(1, TimeUnit.SECONDS.toNanos(5)));
    assertFalse(scheduler.isFlushDue(0, TimeUnit.SECONDS.toNanos(60)));
  }
}
