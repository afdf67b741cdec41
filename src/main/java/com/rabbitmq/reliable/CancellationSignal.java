// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Reliable Messaging Java client library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.reliable;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation for publishing calls and consumers.
 *
 * <p>Publishing calls check the signal before each publish. Consumers register a callback that
 * cancels the subscription and closes the channel when the signal fires.
 *
 * <p>Instances are thread-safe. Callbacks run once, on the thread calling {@link #cancel()}, or
 * immediately on the registering thread if the signal is already cancelled.
 */
public final class CancellationSignal {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationSignal.class);

  private static final CancellationSignal NONE = new CancellationSignal(false);

  private final boolean cancellable;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  private CancellationSignal(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * Create a signal that can be cancelled.
   *
   * @return a new signal
   */
  public static CancellationSignal create() {
    return new CancellationSignal(true);
  }

  /**
   * A signal that never fires.
   *
   * @return the shared non-cancellable signal
   */
  public static CancellationSignal none() {
    return NONE;
  }

  /**
   * Fire the signal and run the registered callbacks.
   *
   * @throws UnsupportedOperationException on {@link #none()}
   */
  public void cancel() {
    if (!this.cancellable) {
      throw new UnsupportedOperationException("This signal cannot be cancelled");
    }
    if (this.cancelled.compareAndSet(false, true)) {
      for (Runnable callback : this.callbacks) {
        if (this.callbacks.remove(callback)) {
          run(callback);
        }
      }
    }
  }

  public boolean isCancelled() {
    return this.cancelled.get();
  }

  /**
   * Throw a {@link CancellationException} if the signal has fired.
   *
   * @throws CancellationException if cancelled
   */
  public void throwIfCancelled() {
    if (this.cancelled.get()) {
      throw new CancellationException("Operation cancelled");
    }
  }

  /**
   * Register a callback to run when the signal fires.
   *
   * @param callback the callback
   * @return a registration to remove the callback
   */
  public Registration onCancel(Runnable callback) {
    if (!this.cancellable) {
      return () -> {};
    }
    this.callbacks.add(callback);
    if (this.cancelled.get() && this.callbacks.remove(callback)) {
      run(callback);
    }
    return () -> this.callbacks.remove(callback);
  }

  private static void run(Runnable callback) {
    try {
      callback.run();
    } catch (Exception e) {
      LOGGER.warn("Error in cancellation callback", e);
    }
  }

  /** Registration of a cancellation callback. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {

    /** Remove the callback, it has no effect if it already ran. */
    @Override
    void close();
  }
}
