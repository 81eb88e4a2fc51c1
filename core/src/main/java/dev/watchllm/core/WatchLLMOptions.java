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

import java.time.Duration;

import dev.watchllm.core.event.Event;
import dev.watchllm.core.pipeline.DeliveryQueue;
import dev.watchllm.core.pipeline.FailedBatchHandler;

/**
 * Options for configuring a {@link WatchLLMClient}.
 *
 * <p>
 * The API key, project id, base URL and environment fall back to the
 * {@code WATCHLLM_API_KEY}, {@code WATCHLLM_PROJECT_ID},
 * {@code WATCHLLM_BASE_URL} and {@code WATCHLLM_ENV} environment variables.
 */
public class WatchLLMOptions {

  public static final String DEFAULT_BASE_URL = "https://proxy.watchllm.dev/v1";

  private final String apiKey;
  private final String projectId;
  private final String baseUrl;
  private final String environment;
  private final String release;
  private final double sampleRate;
  private final boolean redactPii;
  private final int batchSize;
  private final int maxBatchSize;
  private final Duration flushInterval;
  private final Duration tickInterval;
  private final int queueCapacity;
  private final Duration timeout;
  private final int maxRetries;
  private final Duration retryBackoff;
  private final Duration shutdownTimeout;
  private final FailedBatchHandler failedBatchHandler;

  private WatchLLMOptions(Builder builder) {
    this.apiKey = builder.apiKey;
    this.projectId = builder.projectId;
    this.baseUrl = stripTrailingSlash(builder.baseUrl);
    this.environment = builder.environment;
    this.release = builder.release;
    this.sampleRate = builder.sampleRate;
    this.redactPii = builder.redactPii;
    this.batchSize = builder.batchSize;
    this.maxBatchSize = builder.maxBatchSize;
    this.flushInterval = builder.flushInterval;
    this.tickInterval = builder.tickInterval;
    this.queueCapacity = builder.queueCapacity;
    this.timeout = builder.timeout;
    this.maxRetries = builder.maxRetries;
    this.retryBackoff = builder.retryBackoff;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.failedBatchHandler = builder.failedBatchHandler;
  }

  private static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets the API key sent as a bearer token.
   *
   * @return the API key
   */
  public String getApiKey() {
    return apiKey;
  }

  /**
   * Gets the project every event is attributed to.
   *
   * @return the project id
   */
  public String getProjectId() {
    return projectId;
  }

  /**
   * Gets the base URL of the ingestion service, without a trailing slash.
   *
   * @return the base URL
   */
  public String getBaseUrl() {
    return baseUrl;
  }

  public String getEnvironment() {
    return environment;
  }

  /**
   * Gets the release label stamped on events, if any.
   *
   * @return the release, or null
   */
  public String getRelease() {
    return release;
  }

  public double getSampleRate() {
    return sampleRate;
  }

  public boolean isRedactPii() {
    return redactPii;
  }

  /**
   * Gets the queue size that triggers a scheduled flush.
   *
   * @return the batch size
   */
  public int getBatchSize() {
    return batchSize;
  }

  /**
   * Gets the hard cap on events sent in one request.
   *
   * @return the maximum batch size
   */
  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public Duration getFlushInterval() {
    return flushInterval;
  }

  public Duration getTickInterval() {
    return tickInterval;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  /**
   * Gets the timeout applied to each HTTP attempt.
   *
   * @return the timeout
   */
  public Duration getTimeout() {
    return timeout;
  }

  /**
   * Gets how many times a failed batch is retried after the first attempt.
   *
   * @return the retry count
   */
  public int getMaxRetries() {
    return maxRetries;
  }

  /**
   * Gets the delay before the first retry. Each further retry doubles it.
   *
   * @return the base backoff
   */
  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  /**
   * Gets the handler notified when a scheduled flush gives up on a batch.
   *
   * @return the handler, or null when failures are only logged
   */
  public FailedBatchHandler getFailedBatchHandler() {
    return failedBatchHandler;
  }

  /**
   * Builder for WatchLLMOptions.
   */
  public static class Builder {
    private String apiKey = System.getenv("WATCHLLM_API_KEY");
    private String projectId = System.getenv("WATCHLLM_PROJECT_ID");
    private String baseUrl = envOrDefault("WATCHLLM_BASE_URL", DEFAULT_BASE_URL);
    private String environment = envOrDefault("WATCHLLM_ENV", Event.DEFAULT_ENVIRONMENT);
    private String release;
    private double sampleRate = 1.0;
    private boolean redactPii = true;
    private int batchSize = 10;
    private int maxBatchSize = 100;
    private Duration flushInterval = Duration.ofSeconds(5);
    private Duration tickInterval = Duration.ofSeconds(1);
    private int queueCapacity = DeliveryQueue.DEFAULT_CAPACITY;
    private Duration timeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration retryBackoff = Duration.ofSeconds(1);
    private Duration shutdownTimeout = Duration.ofSeconds(5);
    private FailedBatchHandler failedBatchHandler;

    private static String envOrDefault(String name, String defaultValue) {
      String value = System.getenv(name);
      return value == null || value.isEmpty() ? defaultValue : value;
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder projectId(String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    public Builder release(String release) {
      this.release = release;
      return this;
    }

    public Builder sampleRate(double sampleRate) {
      this.sampleRate = sampleRate;
      return this;
    }

    public Builder redactPii(boolean redactPii) {
      this.redactPii = redactPii;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder maxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
      return this;
    }

    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    public Builder tickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryBackoff(Duration retryBackoff) {
      this.retryBackoff = retryBackoff;
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public Builder failedBatchHandler(FailedBatchHandler failedBatchHandler) {
      this.failedBatchHandler = failedBatchHandler;
      return this;
    }

    public WatchLLMOptions build() {
      if (apiKey == null || apiKey.isEmpty()) {
        throw new IllegalStateException(
            "WatchLLM API key is required. Set WATCHLLM_API_KEY environment variable or provide it in options.");
      }
      if (projectId == null || projectId.isEmpty()) {
        throw new IllegalStateException(
            "WatchLLM project id is required. Set WATCHLLM_PROJECT_ID environment variable or provide it in options.");
      }
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalStateException("Base URL must not be empty");
      }
      if (environment == null) {
        environment = Event.DEFAULT_ENVIRONMENT;
      }
      if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
        throw new IllegalStateException("sampleRate must be between 0.0 and 1.0, got " + sampleRate);
      }
      if (batchSize < 1) {
        throw new IllegalStateException("batchSize must be at least 1, got " + batchSize);
      }
      if (maxBatchSize < batchSize) {
        throw new IllegalStateException(
            "maxBatchSize (" + maxBatchSize + ") must not be smaller than batchSize (" + batchSize + ")");
      }
      if (queueCapacity < 1) {
        throw new IllegalStateException("queueCapacity must be at least 1, got " + queueCapacity);
      }
      if (maxRetries < 0) {
        throw new IllegalStateException("maxRetries must not be negative, got " + maxRetries);
      }
      requirePositive("flushInterval", flushInterval);
      requirePositive("tickInterval", tickInterval);
      requirePositive("timeout", timeout);
      requireNonNegative("retryBackoff", retryBackoff);
      requireNonNegative("shutdownTimeout", shutdownTimeout);
      return new WatchLLMOptions(this);
    }

    private static void requirePositive(String name, Duration value) {
      if (value == null || value.isZero() || value.isNegative()) {
        throw new IllegalStateException(name + " must be positive, got " + value);
      }
    }

    private static void requireNonNegative(String name, Duration value) {
      if (value == null || value.isNegative()) {
        throw new IllegalStateException(name + " must not be negative, got " + value);
      }
    }
  }
}
