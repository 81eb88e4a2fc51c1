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

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.watchllm.core.JsonUtils;
import dev.watchllm.core.WatchLLMOptions;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * HttpTransport posts batches to {@code {baseUrl}/events/batch}.
 *
 * <p>
 * Connection failures and the statuses in {@link #RETRYABLE_STATUS} are
 * retried up to {@code maxRetries} times with exponential backoff; any other
 * non-2xx status fails the batch on the first attempt.
 */
public class HttpTransport implements Transport {

  private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);
  static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");

  /** Statuses worth another attempt. */
  public static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 500, 502, 503, 504);

  private static final int MAX_BACKOFF_SHIFT = 20;

  private final String endpoint;
  private final String apiKey;
  private final int maxRetries;
  private final long retryBackoffMs;
  private final OkHttpClient client;

  /**
   * Creates a new HttpTransport with its own HTTP client.
   *
   * @param options
   *            the client options
   */
  public HttpTransport(WatchLLMOptions options) {
    this(options, newHttpClient(options));
  }

  /**
   * Creates a new HttpTransport sharing the given HTTP client.
   *
   * @param options
   *            the client options
   * @param client
   *            the HTTP client
   */
  public HttpTransport(WatchLLMOptions options, OkHttpClient client) {
    this.endpoint = options.getBaseUrl() + "/events/batch";
    this.apiKey = options.getApiKey();
    this.maxRetries = options.getMaxRetries();
    this.retryBackoffMs = options.getRetryBackoff().toMillis();
    this.client = client;
  }

  /**
   * Builds an HTTP client whose every call is bounded by the configured
   * timeout.
   *
   * @param options
   *            the client options
   * @return a new HTTP client
   */
  public static OkHttpClient newHttpClient(WatchLLMOptions options) {
    return new OkHttpClient.Builder().callTimeout(options.getTimeout()).connectTimeout(options.getTimeout())
        .readTimeout(options.getTimeout()).writeTimeout(options.getTimeout()).build();
  }

  @Override
  public DeliveryAck sendBatch(List<Map<String, Object>> batch) throws DeliveryException {
    String payload = JsonUtils.toJson(Collections.singletonMap("events", batch));
    Request request = new Request.Builder().url(endpoint).header("Authorization", "Bearer " + apiKey)
        .header("Content-Type", "application/json").post(RequestBody.create(payload, JSON_MEDIA_TYPE)).build();

    int attempt = 0;
    while (true) {
      attempt++;
      int lastStatus;
      String lastBody;
      IOException lastError;
      try (Response response = client.newCall(request).execute()) {
        String body = readBody(response);
        if (response.isSuccessful()) {
          logger.debug("Batch of {} events accepted with status {} after {} attempt(s): {}", batch.size(),
              response.code(), attempt, body);
          return new DeliveryAck(response.code(), body, attempt);
        }
        lastStatus = response.code();
        lastBody = body;
        lastError = null;
        if (!RETRYABLE_STATUS.contains(lastStatus)) {
          throw new DeliveryException("Batch rejected with status " + lastStatus + ": " + body, null, lastStatus,
              body, attempt);
        }
      } catch (IOException e) {
        lastStatus = DeliveryException.CONNECTION_FAILURE;
        lastBody = null;
        lastError = e;
      }

      if (attempt > maxRetries) {
        throw new DeliveryException("Batch delivery failed after " + attempt + " attempt(s), last status "
            + lastStatus, lastError, lastStatus, lastBody, attempt);
      }
      long delay = backoffMillis(attempt);
      logger.warn("Retry attempt {} in {}ms after status {}", attempt, delay, lastStatus);
      try {
        Thread.sleep(delay);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new DeliveryException("Batch delivery interrupted", ie, lastStatus, lastBody, attempt);
      }
    }
  }

  /**
   * Returns the delay before the given retry: {@code retryBackoff * 2^(retry-1)}.
   */
  long backoffMillis(int retry) {
    int shift = Math.min(Math.max(retry - 1, 0), MAX_BACKOFF_SHIFT);
    return retryBackoffMs << shift;
  }

  static String readBody(Response response) throws IOException {
    ResponseBody body = response.body();
    return body != null ? body.string() : "";
  }

  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
