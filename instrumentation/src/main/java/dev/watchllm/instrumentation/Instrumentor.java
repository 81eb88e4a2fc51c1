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

package dev.watchllm.instrumentation;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.watchllm.core.event.EventSink;

/**
 * Instrumentor installs observing wrappers into provider {@link CallSlot}s
 * and remembers the originals so they can be restored.
 *
 * <p>
 * Installing into a slot that is already instrumented, or removing from one
 * that is not, does nothing. {@link #disable()} keeps the wrappers in place
 * but makes them delegate straight to the originals without recording.
 */
public class Instrumentor {

  private static final Logger logger = LoggerFactory.getLogger(Instrumentor.class);

  private final EventSink sink;
  private final Map<CallSlot<?>, Object> originals = new ConcurrentHashMap<>();
  private final AtomicBoolean enabled = new AtomicBoolean(true);

  /**
   * Creates an Instrumentor emitting to the given sink.
   *
   * @param sink
   *            where prompt-call events go, usually a WatchLLMClient
   */
  public Instrumentor(EventSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink must not be null");
  }

  /**
   * Instruments a synchronous slot.
   *
   * @param slot
   *            the slot to instrument
   * @param adapter
   *            reads the provider's requests and responses
   * @return true if the slot was instrumented by this call
   */
  public synchronized <I, O> boolean install(CallSlot<ProviderCall<I, O>> slot, ProviderAdapter<I, O> adapter) {
    Objects.requireNonNull(adapter, "adapter must not be null");
    if (originals.containsKey(slot)) {
      logger.debug("{} is already instrumented", slot.name());
      return false;
    }
    ProviderCall<I, O> original = slot.current();
    originals.put(slot, original);
    slot.replace(new ObservingCall<>(original, adapter, sink, this));
    logger.info("Instrumented {} ({})", slot.name(), adapter.provider());
    return true;
  }

  /**
   * Instruments an asynchronous slot.
   *
   * @param slot
   *            the slot to instrument
   * @param adapter
   *            reads the provider's requests and responses
   * @return true if the slot was instrumented by this call
   */
  public synchronized <I, O> boolean installAsync(CallSlot<AsyncProviderCall<I, O>> slot,
      ProviderAdapter<I, O> adapter) {
    Objects.requireNonNull(adapter, "adapter must not be null");
    if (originals.containsKey(slot)) {
      logger.debug("{} is already instrumented", slot.name());
      return false;
    }
    AsyncProviderCall<I, O> original = slot.current();
    originals.put(slot, original);
    slot.replace(new ObservingAsyncCall<>(original, adapter, sink, this));
    logger.info("Instrumented {} ({}, async)", slot.name(), adapter.provider());
    return true;
  }

  /**
   * Restores the original operation of a slot.
   *
   * @param slot
   *            the slot to restore
   * @return true if the slot was instrumented and has been restored
   */
  @SuppressWarnings("unchecked")
  public synchronized <F> boolean remove(CallSlot<F> slot) {
    Object original = originals.remove(slot);
    if (original == null) {
      return false;
    }
    slot.replace((F) original);
    logger.info("Removed instrumentation from {}", slot.name());
    return true;
  }

  /**
   * Restores every slot this instrumentor has instrumented.
   *
   * @return the number of slots restored
   */
  public synchronized int removeAll() {
    int removed = 0;
    for (CallSlot<?> slot : new ArrayList<>(originals.keySet())) {
      if (remove(slot)) {
        removed++;
      }
    }
    return removed;
  }

  public boolean isInstalled(CallSlot<?> slot) {
    return originals.containsKey(slot);
  }

  public int installedCount() {
    return originals.size();
  }

  public void enable() {
    enabled.set(true);
  }

  public void disable() {
    enabled.set(false);
  }

  public boolean isEnabled() {
    return enabled.get();
  }
}
