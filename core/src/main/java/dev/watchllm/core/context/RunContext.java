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

package dev.watchllm.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * RunContext is the ambient run identity of the current thread: the run id,
 * the user id and the tags that events logged inside a trace scope inherit.
 *
 * <p>
 * The context is stored in a ThreadLocal, so independent call stacks never
 * observe each other's values. Scopes nest: opening a scope saves the current
 * value and closing it restores exactly that value, whether the body returned
 * normally or threw.
 *
 * <pre>{@code
 * try (TraceScope scope = RunContext.trace("run-42", "user-7", List.of("checkout"))) {
 *   agent.run(input); // instrumented calls are tagged with run-42
 * }
 * }</pre>
 */
public final class RunContext {

  private static final ThreadLocal<RunContext> CURRENT = new ThreadLocal<>();

  private final String runId;
  private final String userId;
  private final List<String> tags;

  /**
   * Creates a new RunContext.
   *
   * @param runId
   *            the run id, must not be null
   * @param userId
   *            the user id, may be null
   * @param tags
   *            the tags, may be null
   */
  public RunContext(String runId, String userId, List<String> tags) {
    if (runId == null) {
      throw new IllegalArgumentException("runId must not be null");
    }
    this.runId = runId;
    this.userId = userId;
    this.tags = tags != null ? Collections.unmodifiableList(new ArrayList<>(tags)) : Collections.emptyList();
  }

  public String getRunId() {
    return runId;
  }

  public String getUserId() {
    return userId;
  }

  public List<String> getTags() {
    return tags;
  }

  /**
   * Returns the ambient context of the calling thread.
   *
   * @return the current context, or null outside any trace scope
   */
  public static RunContext current() {
    return CURRENT.get();
  }

  /**
   * Returns the ambient run id, or a freshly generated one when no scope is
   * active. The generated id is not remembered: two calls outside a scope
   * return two different ids.
   *
   * @return the run id
   */
  public static String currentRunId() {
    RunContext context = CURRENT.get();
    return context != null ? context.runId : newRunId();
  }

  /**
   * Returns the ambient user id.
   *
   * @return the user id, or null
   */
  public static String currentUserId() {
    RunContext context = CURRENT.get();
    return context != null ? context.userId : null;
  }

  /**
   * Returns the ambient tags.
   *
   * @return the tags, empty outside any scope
   */
  public static List<String> currentTags() {
    RunContext context = CURRENT.get();
    return context != null ? context.tags : Collections.emptyList();
  }

  /**
   * Opens a trace scope with a generated run id.
   *
   * @return the scope, to be closed with try-with-resources
   */
  public static TraceScope trace() {
    return trace(null, null, null);
  }

  /**
   * Opens a trace scope for a run id.
   *
   * @param runId
   *            the run id, or null to generate one
   * @return the scope, to be closed with try-with-resources
   */
  public static TraceScope trace(String runId) {
    return trace(runId, null, null);
  }

  /**
   * Opens a trace scope. Null user id and tags are inherited from the
   * enclosing scope.
   *
   * @param runId
   *            the run id, or null to generate one
   * @param userId
   *            the user id, or null to inherit
   * @param tags
   *            the tags, or null to inherit
   * @return the scope, to be closed with try-with-resources
   */
  public static TraceScope trace(String runId, String userId, List<String> tags) {
    RunContext parent = CURRENT.get();
    RunContext context = new RunContext(runId != null ? runId : newRunId(),
        userId != null ? userId : parent != null ? parent.userId : null,
        tags != null ? tags : parent != null ? parent.tags : null);
    return attach(context);
  }

  /**
   * Installs an existing context on the calling thread.
   *
   * @param context
   *            the context to install, or null to clear it for the scope
   * @return the scope that restores the previous context
   */
  public static TraceScope attach(RunContext context) {
    RunContext previous = CURRENT.get();
    set(context);
    return new TraceScope(context, previous);
  }

  /**
   * Runs a callable inside a trace scope.
   *
   * @param runId
   *            the run id, or null to generate one
   * @param userId
   *            the user id, or null to inherit
   * @param tags
   *            the tags, or null to inherit
   * @param callable
   *            the body
   * @param <T>
   *            the result type
   * @return the result of the callable
   * @throws Exception
   *             if the callable throws
   */
  public static <T> T runInTrace(String runId, String userId, List<String> tags, Callable<T> callable)
      throws Exception {
    try (TraceScope scope = trace(runId, userId, tags)) {
      return callable.call();
    }
  }

  /**
   * Runs a runnable inside a trace scope.
   *
   * @param runId
   *            the run id, or null to generate one
   * @param runnable
   *            the body
   */
  public static void runInTrace(String runId, Runnable runnable) {
    try (TraceScope scope = trace(runId)) {
      runnable.run();
    }
  }

  /**
   * Wraps a runnable so that it runs with the caller's current context on
   * whichever thread executes it.
   *
   * @param runnable
   *            the runnable to wrap
   * @return the wrapped runnable
   */
  public static Runnable wrap(Runnable runnable) {
    RunContext captured = CURRENT.get();
    return () -> {
      try (TraceScope scope = attach(captured)) {
        runnable.run();
      }
    };
  }

  /**
   * Wraps a callable so that it runs with the caller's current context on
   * whichever thread executes it.
   *
   * @param callable
   *            the callable to wrap
   * @param <T>
   *            the result type
   * @return the wrapped callable
   */
  public static <T> Callable<T> wrap(Callable<T> callable) {
    RunContext captured = CURRENT.get();
    return () -> {
      try (TraceScope scope = attach(captured)) {
        return callable.call();
      }
    };
  }

  static void set(RunContext context) {
    if (context != null) {
      CURRENT.set(context);
    } else {
      CURRENT.remove();
    }
  }

  private static String newRunId() {
    return UUID.randomUUID().toString();
  }

  @Override
  public String toString() {
    return "RunContext{runId='" + runId + "', userId='" + userId + "', tags=" + tags + '}';
  }
}
