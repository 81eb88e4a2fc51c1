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

package dev.watchllm.core.event;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed descriptor of this SDK attached to every event.
 */
public final class ClientInfo {

  public static final String SDK_NAME = "watchllm-java";
  public static final String SDK_VERSION = "0.1.0";
  public static final String PLATFORM = "java";

  private ClientInfo() {
  }

  /**
   * Returns a new copy of the client descriptor map.
   *
   * @return map with sdk, sdk_version, platform and runtime_version
   */
  public static Map<String, Object> descriptor() {
    Map<String, Object> descriptor = new LinkedHashMap<>();
    descriptor.put("sdk", SDK_NAME);
    descriptor.put("sdk_version", SDK_VERSION);
    descriptor.put("platform", PLATFORM);
    descriptor.put("runtime_version", System.getProperty("java.version", "unknown"));
    return descriptor;
  }
}
