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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import dev.watchllm.core.context.RunContext;
import dev.watchllm.core.event.AgentStepEvent;
import dev.watchllm.core.event.AlertType;
import dev.watchllm.core.event.AssertionFailedEvent;
import dev.watchllm.core.event.AssertionType;
import dev.watchllm.core.event.DetectionMethod;
import dev.watchllm.core.event.ErrorEvent;
import dev.watchllm.core.event.Event;
import dev.watchllm.core.event.EventSink;
import dev.watchllm.core.event.HallucinationDetectedEvent;
import dev.watchllm.core.event.PerformanceAlertEvent;
import dev.watchllm.core.event.PromptCallEvent;
import dev.watchllm.core.event.Severity;
import dev.watchllm.core.event.StepType;
import dev.watchllm.core.pipeline.DeliveryQueue;
import dev.watchllm.core.pipeline.FailedBatchHandler;
import dev.watchllm.core.pipeline.FlushScheduler;
import dev.watchllm.core.pipeline.Redactor;
import dev.watchllm.core.pipeline.Sampler;
import dev.watchllm.core.pricing.ModelPricing;
import dev.watchllm.core.telemetry.PipelineTelemetry;
import dev.watchllm.core.transport.DeliveryException;
import dev.watchllm.core.transport.EventQuery;
import dev.watchllm.core.transport.HttpTransport;
import dev.watchllm.core.transport.QueryClient;
import dev.watchllm.core.transport.Transport;

import okhttp3.OkHttpClient;

/**
 * WatchLLMClient is the entry point for recording events.
 *
 * <p>
 * {@link #log(Event)} never blocks on the network: events are enriched,
 * sampled, serialized, redacted and queued, and a background scheduler
 * delivers them in batches. Call {@link #close()} on shutdown so queued
 * events get one final delivery attempt.
 *
 * <pre>{@code
 * try (WatchLLMClient client = new WatchLLMClient(WatchLLMOptions.builder().build());
 *     TraceScope scope = RunContext.trace()) {
 *   client.logPromptCall(null, "Hello", "gpt-4o", "Hi!", 5, 3, 120);
 * }
 * }</pre>
 */
public class WatchLLMClient implements EventSink, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(WatchLLMClient.class);

  private final WatchLLMOptions options;
  private final Sampler sampler;
  private final Redactor redactor;
  private final DeliveryQueue queue;
  private final Transport transport;
  private final QueryClient queryClient;
  private final FlushScheduler scheduler;
  private final PipelineTelemetry telemetry;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a client delivering over HTTP.
   *
   * @param options
   *            the client options
   */
  public WatchLLMClient(WatchLLMOptions options) {
    this(options, HttpTransport.newHttpClient(options));
  }

  private WatchLLMClient(WatchLLMOptions options, OkHttpClient httpClient) {
    this(options, new HttpTransport(options, httpClient), new QueryClient(options, httpClient));
  }

  /**
   * Creates a client delivering through the given transport.
   *
   * @param options
   *            the client options
   * @param transport
   *            the batch transport
   * @param queryClient
   *            the client used for read-back queries
   */
  public WatchLLMClient(WatchLLMOptions options, Transport transport, QueryClient queryClient) {
    this(options, transport, queryClient, PipelineTelemetry.getInstance());
  }

  WatchLLMClient(WatchLLMOptions options, Transport transport, QueryClient queryClient,
      PipelineTelemetry telemetry) {
    this.options = Objects.requireNonNull(options, "options must not be null");
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.queryClient = Objects.requireNonNull(queryClient, "queryClient must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.sampler = new Sampler(options.getSampleRate());
    this.redactor = new Redactor(options.isRedactPii());
    this.queue = new DeliveryQueue(options.getQueueCapacity());
    this.scheduler = new FlushScheduler(queue, this::flushScheduled, options.getBatchSize(),
        options.getFlushInterval(), options.getTickInterval());
    this.scheduler.start();
    logger.info("WatchLLM client started for project {} ({})", options.getProjectId(), options.getEnvironment());
  }

  /**
   * Records an event. The envelope is completed from the client options and
   * the ambient {@link RunContext}; a prompt call without a cost gets one from
   * {@link ModelPricing}.
   *
   * @param event
   *            the event to record
   * @return the event id, also when the event was sampled out, could not be
   *         serialized or was dropped
   */
  @Override
  public String log(Event event) {
    Objects.requireNonNull(event, "event must not be null");
    if (closed.get()) {
      logger.warn("Client is closed, ignoring {} event {}", event.getEventType(), event.getEventId());
      return event.getEventId();
    }
    enrich(event);

    String eventType = event.getEventType().getValue();
    if (!sampler.admit()) {
      telemetry.recordSampledOut(eventType);
      logger.debug("Sampled out {} event {}", eventType, event.getEventId());
      return event.getEventId();
    }

    Map<String, Object> serialized;
    try {
      serialized = JsonUtils.toMap(event);
    } catch (WatchLLMException e) {
      logger.warn("Dropping {} event {} that could not be serialized: {}", eventType, event.getEventId(),
          e.getMessage());
      telemetry.recordDropped(1, PipelineTelemetry.REASON_SERIALIZATION_FAILED);
      return event.getEventId();
    }
    serialized = redactor.redact(serialized);
    if (queue.enqueue(serialized)) {
      telemetry.recordQueued(eventType);
    }
    return event.getEventId();
  }

  private void enrich(Event event) {
    event.setProjectId(options.getProjectId());
    RunContext ambient = RunContext.current();
    if (event.getRunId() == null || event.getRunId().isEmpty()) {
      event.setRunId(RunContext.currentRunId());
    }
    if (ambient != null) {
      if (event.getUserId() == null) {
        event.setUserId(ambient.getUserId());
      }
      for (String tag : ambient.getTags()) {
        event.addTag(tag);
      }
    }
    if (event.getRelease() == null) {
      event.setRelease(options.getRelease());
    }
    if (Event.DEFAULT_ENVIRONMENT.equals(event.getEnv())) {
      event.setEnv(options.getEnvironment());
    }
    if (event instanceof PromptCallEvent) {
      PromptCallEvent call = (PromptCallEvent) event;
      if (call.getCostEstimateUsd() == 0.0 && (call.getTokensInput() > 0 || call.getTokensOutput() > 0)) {
        call.setCostEstimateUsd(
            ModelPricing.calculateCost(call.getModel(), call.getTokensInput(), call.getTokensOutput()));
      }
    }
  }

  /**
   * Records a model invocation.
   *
   * @param runId
   *            the run id, or null for the ambient one
   * @return the event id
   */
  public String logPromptCall(String runId, String prompt, String model, String response, int tokensInput,
      int tokensOutput, long latencyMs) {
    PromptCallEvent event = new PromptCallEvent(prompt, model, response, tokensInput, tokensOutput, latencyMs);
    event.setRunId(runId);
    return log(event);
  }

  /**
   * Records one step of an agent run.
   *
   * @return the event id
   */
  public String logAgentStep(String runId, int stepNumber, String stepName, StepType stepType,
      Map<String, Object> inputData, Map<String, Object> outputData, long latencyMs) {
    AgentStepEvent event = new AgentStepEvent(stepNumber, stepName, stepType, inputData, outputData, latencyMs);
    event.setRunId(runId);
    return log(event);
  }

  /**
   * Records an exception with its stack trace.
   *
   * @return the event id
   */
  public String logError(String runId, Throwable error, Map<String, Object> context) {
    Objects.requireNonNull(error, "error must not be null");
    ErrorEvent event = ErrorEvent.fromThrowable(error, context);
    event.setRunId(runId);
    return log(event);
  }

  /**
   * Records an error described as a map, typically with {@code message},
   * {@code type} and {@code stack} keys.
   *
   * @return the event id
   */
  public String logError(String runId, Map<String, String> error, Map<String, Object> context) {
    Objects.requireNonNull(error, "error must not be null");
    ErrorEvent event = new ErrorEvent(error, context);
    event.setRunId(runId);
    return log(event);
  }

  public String logAssertionFailure(String runId, String assertionName, AssertionType assertionType,
      Object expected, Object actual, Severity severity) {
    AssertionFailedEvent event = new AssertionFailedEvent(assertionName, assertionType, expected, actual, severity);
    event.setRunId(runId);
    return log(event);
  }

  public String logHallucinationDetection(String runId, DetectionMethod detectionMethod, double confidenceScore,
      String flaggedContent, String groundTruth, List<String> recommendations) {
    HallucinationDetectedEvent event = new HallucinationDetectedEvent(detectionMethod, confidenceScore,
        flaggedContent);
    event.setRunId(runId);
    event.setGroundTruth(groundTruth);
    event.setRecommendations(recommendations);
    return log(event);
  }

  public String logPerformanceAlert(String runId, AlertType alertType, double threshold, double actualValue,
      int windowMinutes, List<String> affectedModels) {
    PerformanceAlertEvent event = new PerformanceAlertEvent(alertType, threshold, actualValue, windowMinutes);
    event.setRunId(runId);
    event.setAffectedModels(affectedModels);
    return log(event);
  }

  /**
   * Sends up to {@code maxBatchSize} queued events now. On failure the batch
   * is put back at the head of the queue and the exception is rethrown.
   *
   * @return the number of events delivered
   * @throws DeliveryException
   *             if the batch could not be delivered
   */
  public int flush() throws DeliveryException {
    List<Map<String, Object>> batch = queue.drainUpTo(options.getMaxBatchSize());
    if (batch.isEmpty()) {
      return 0;
    }
    try {
      send(batch, "manual");
      return batch.size();
    } catch (DeliveryException e) {
      int lost = queue.requeue(batch);
      logger.warn("Manual flush of {} events failed, requeued {}", batch.size(), batch.size() - lost);
      throw e;
    }
  }

  void flushScheduled() {
    List<Map<String, Object>> batch = queue.drainUpTo(options.getMaxBatchSize());
    if (batch.isEmpty()) {
      return;
    }
    try {
      send(batch, "scheduled");
    } catch (DeliveryException e) {
      logger.error("Dropping batch of {} events after {} attempt(s)", batch.size(), e.getAttempts(), e);
      telemetry.recordDropped(batch.size(), PipelineTelemetry.REASON_DELIVERY_FAILED);
      notifyFailedBatch(batch, e);
    }
  }

  private void send(List<Map<String, Object>> batch, String trigger) {
    long start = System.nanoTime();
    try {
      transport.sendBatch(batch);
      telemetry.recordBatch(trigger, true, elapsedMillis(start));
      logger.debug("Delivered {} events ({})", batch.size(), trigger);
    } catch (DeliveryException e) {
      telemetry.recordBatch(trigger, false, elapsedMillis(start));
      throw e;
    }
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private void notifyFailedBatch(List<Map<String, Object>> batch, DeliveryException error) {
    FailedBatchHandler handler = options.getFailedBatchHandler();
    if (handler == null) {
      return;
    }
    try {
      handler.onFailedBatch(batch, error);
    } catch (RuntimeException e) {
      logger.warn("Failed batch handler threw", e);
    }
  }

  /**
   * Queries stored events. The call goes straight to the service.
   *
   * @param query
   *            the filters
   * @return the parsed response
   */
  public JsonNode queryEvents(EventQuery query) throws DeliveryException {
    return queryClient.queryEvents(query);
  }

  /**
   * Fetches aggregate project metrics. The call goes straight to the service.
   *
   * @param dateFrom
   *            optional lower bound
   * @param dateTo
   *            optional upper bound
   * @return the parsed response
   */
  public JsonNode getMetrics(String dateFrom, String dateTo) throws DeliveryException {
    return queryClient.getMetrics(dateFrom, dateTo);
  }

  /**
   * Returns the approximate number of events waiting for delivery.
   */
  public int pendingCount() {
    return queue.size();
  }

  /**
   * Returns how many events were dropped because the queue was full.
   */
  public long droppedCount() {
    return queue.droppedCount();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Stops the scheduler, makes one final attempt to deliver what is queued
   * and releases HTTP resources. Delivery failures at this point are logged,
   * not thrown. Calling close more than once has no effect.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    scheduler.shutdown(options.getShutdownTimeout());
    while (!queue.isEmpty()) {
      List<Map<String, Object>> batch = queue.drainUpTo(options.getMaxBatchSize());
      if (batch.isEmpty()) {
        break;
      }
      try {
        send(batch, "shutdown");
      } catch (DeliveryException e) {
        logger.warn("Final flush failed, {} events and {} still queued are lost", batch.size(), queue.size(), e);
        telemetry.recordDropped(batch.size() + queue.size(), PipelineTelemetry.REASON_DELIVERY_FAILED);
        notifyFailedBatch(batch, e);
        break;
      }
    }
    transport.close();
    logger.info("WatchLLM client closed");
  }
}
