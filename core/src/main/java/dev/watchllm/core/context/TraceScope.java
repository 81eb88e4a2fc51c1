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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TraceScope is an open {@link RunContext} scope. Closing it restores the
 * context that was current when it was opened. Scopes must be closed on the
 * thread that opened them and in reverse order of opening.
 */
public final class TraceScope implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TraceScope.class);

  private final RunContext context;
  private final RunContext previous;
  private boolean closed;

  TraceScope(RunContext context, RunContext previous) {
    this.context = context;
    this.previous = previous;
  }

  /**
   * Returns the run id installed by this scope.
   *
   * @return the run id, or null for a scope that cleared the context
   */
  public String getRunId() {
    return context != null ? context.getRunId() : null;
  }

  /**
   * Returns the context installed by this scope.
   *
   * @return the context, may be null
   */
  public RunContext getContext() {
    return context;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (RunContext.current() != context) {
      logger.warn("Trace scope for run {} closed out of order; restoring its parent context anyway", getRunId());
    }
    RunContext.set(previous);
  }
}
