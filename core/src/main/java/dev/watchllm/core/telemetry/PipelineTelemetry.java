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

package dev.watchllm.core.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

/**
 * PipelineTelemetry records health metrics of the event pipeline itself.
 *
 * <p>
 * Metrics go to the global OpenTelemetry meter provider, which is a no-op
 * unless the application installs an SDK. Tracked:
 * <ul>
 * <li>events queued, sampled out and dropped</li>
 * <li>redaction fallbacks</li>
 * <li>batches sent and failed, and batch delivery latency</li>
 * </ul>
 */
public class PipelineTelemetry {

  private static final Logger logger = LoggerFactory.getLogger(PipelineTelemetry.class);
  private static final String METER_NAME = "watchllm";

  private static final String METRIC_QUEUED = "watchllm/events/queued";
  private static final String METRIC_SAMPLED_OUT = "watchllm/events/sampled_out";
  private static final String METRIC_DROPPED = "watchllm/events/dropped";
  private static final String METRIC_REDACTION_FAILURES = "watchllm/redaction/failures";
  private static final String METRIC_BATCHES_SENT = "watchllm/batches/sent";
  private static final String METRIC_BATCHES_FAILED = "watchllm/batches/failed";
  private static final String METRIC_BATCH_LATENCY = "watchllm/batches/latency";

  public static final String REASON_QUEUE_FULL = "queue_full";
  public static final String REASON_REQUEUE_OVERFLOW = "requeue_overflow";
  public static final String REASON_SERIALIZATION_FAILED = "serialization_failed";
  public static final String REASON_DELIVERY_FAILED = "delivery_failed";

  private static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("event_type");
  private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");
  private static final AttributeKey<String> TRIGGER = AttributeKey.stringKey("trigger");

  private final LongCounter queuedCounter;
  private final LongCounter sampledOutCounter;
  private final LongCounter droppedCounter;
  private final LongCounter redactionFailureCounter;
  private final LongCounter batchesSentCounter;
  private final LongCounter batchesFailedCounter;
  private final LongHistogram batchLatencyHistogram;

  private static PipelineTelemetry instance;

  /**
   * Gets the shared PipelineTelemetry instance.
   *
   * @return the PipelineTelemetry instance
   */
  public static synchronized PipelineTelemetry getInstance() {
    if (instance == null) {
      instance = new PipelineTelemetry(GlobalOpenTelemetry.getMeter(METER_NAME));
    }
    return instance;
  }

  PipelineTelemetry(Meter meter) {
    queuedCounter = meter.counterBuilder(METRIC_QUEUED).setDescription("Counts events accepted into the queue.")
        .setUnit("1").build();

    sampledOutCounter = meter.counterBuilder(METRIC_SAMPLED_OUT)
        .setDescription("Counts events rejected by the sampler.").setUnit("1").build();

    droppedCounter = meter.counterBuilder(METRIC_DROPPED)
        .setDescription("Counts dropped events, with the reason attribute saying why.").setUnit("1")
        .build();

    redactionFailureCounter = meter.counterBuilder(METRIC_REDACTION_FAILURES)
        .setDescription("Counts events sent unredacted because redaction failed.").setUnit("1").build();

    batchesSentCounter = meter.counterBuilder(METRIC_BATCHES_SENT)
        .setDescription("Counts batches acknowledged by the collector.").setUnit("1").build();

    batchesFailedCounter = meter.counterBuilder(METRIC_BATCHES_FAILED)
        .setDescription("Counts batches that could not be delivered.").setUnit("1").build();

    batchLatencyHistogram = meter.histogramBuilder(METRIC_BATCH_LATENCY)
        .setDescription("Latency of batch delivery including retries.").setUnit("ms").ofLongs().build();

    logger.debug("PipelineTelemetry initialized with OpenTelemetry metrics");
  }

  public void recordQueued(String eventType) {
    queuedCounter.add(1, Attributes.of(EVENT_TYPE, eventType));
  }

  public void recordSampledOut(String eventType) {
    sampledOutCounter.add(1, Attributes.of(EVENT_TYPE, eventType));
  }

  public void recordDropped(long count, String reason) {
    if (count > 0) {
      droppedCounter.add(count, Attributes.of(REASON, reason));
    }
  }

  public void recordRedactionFailure() {
    redactionFailureCounter.add(1);
  }

  /**
   * Records the outcome of a batch delivery.
   *
   * @param trigger
   *            what started the flush (scheduled, manual, shutdown)
   * @param success
   *            whether the collector acknowledged the batch
   * @param latencyMs
   *            time spent delivering, including retries
   */
  public void recordBatch(String trigger, boolean success, long latencyMs) {
    Attributes attributes = Attributes.of(TRIGGER, trigger);
    if (success) {
      batchesSentCounter.add(1, attributes);
    } else {
      batchesFailedCounter.add(1, attributes);
    }
    batchLatencyHistogram.record(latencyMs, attributes);
  }
}
