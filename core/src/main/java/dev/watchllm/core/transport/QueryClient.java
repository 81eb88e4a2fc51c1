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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import dev.watchllm.core.JsonUtils;
import dev.watchllm.core.WatchLLMOptions;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * QueryClient reads events and aggregate metrics back from the service. Calls
 * are synchronous and are not retried.
 */
public class QueryClient {

  private static final Logger logger = LoggerFactory.getLogger(QueryClient.class);

  private final String baseUrl;
  private final String apiKey;
  private final String projectId;
  private final OkHttpClient client;

  public QueryClient(WatchLLMOptions options, OkHttpClient client) {
    this.baseUrl = options.getBaseUrl();
    this.apiKey = options.getApiKey();
    this.projectId = options.getProjectId();
    this.client = client;
  }

  /**
   * Queries stored events of this project.
   *
   * @param query
   *            the filters to apply
   * @return the parsed response
   * @throws DeliveryException
   *             if the service answers with a non-2xx status or is unreachable
   */
  public JsonNode queryEvents(EventQuery query) throws DeliveryException {
    String payload = JsonUtils.toJson(query.toRequestBody(projectId));
    Request request = new Request.Builder().url(baseUrl + "/events/query").header("Authorization", "Bearer " + apiKey)
        .header("Content-Type", "application/json")
        .post(RequestBody.create(payload, HttpTransport.JSON_MEDIA_TYPE)).build();
    return execute(request, "event query");
  }

  /**
   * Fetches aggregate metrics of this project.
   *
   * @param dateFrom
   *            optional lower bound, ISO-8601
   * @param dateTo
   *            optional upper bound, ISO-8601
   * @return the parsed response
   * @throws DeliveryException
   *             if the service answers with a non-2xx status or is unreachable
   */
  public JsonNode getMetrics(String dateFrom, String dateTo) throws DeliveryException {
    HttpUrl.Builder url = HttpUrl.get(baseUrl + "/projects/" + projectId + "/metrics").newBuilder();
    if (dateFrom != null && !dateFrom.isEmpty()) {
      url.addQueryParameter("date_from", dateFrom);
    }
    if (dateTo != null && !dateTo.isEmpty()) {
      url.addQueryParameter("date_to", dateTo);
    }
    Request request = new Request.Builder().url(url.build()).header("Authorization", "Bearer " + apiKey).get()
        .build();
    return execute(request, "metrics");
  }

  private JsonNode execute(Request request, String what) {
    try (Response response = client.newCall(request).execute()) {
      String body = HttpTransport.readBody(response);
      if (!response.isSuccessful()) {
        throw new DeliveryException(what + " failed with status " + response.code() + ": " + body, null,
            response.code(), body, 1);
      }
      logger.debug("{} returned status {}", what, response.code());
      return JsonUtils.parseJson(body);
    } catch (IOException e) {
      throw new DeliveryException(what + " failed: " + e.getMessage(), e, DeliveryException.CONNECTION_FAILURE, null,
          1);
    }
  }
}
