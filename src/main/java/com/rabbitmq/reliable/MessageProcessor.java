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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Callback API to process inbound messages.
 *
 * <p>The returned stage must complete with <code>true</code> when the message has been processed.
 * <code>false</code>, a <code>null</code> result, an exceptionally completed stage, or an exception
 * thrown by the callback mean a failure and trigger the retry policy (in manual acknowledgment
 * mode).
 *
 * @param <T> the type of the messages
 * @see ReliableMessaging#receive(String, Class, MessageProcessor, int, boolean, CancellationSignal)
 */
@FunctionalInterface
public interface MessageProcessor<T> {

  /**
   * Adapt a synchronous callback.
   *
   * @param processor the synchronous callback
   * @param <T> the type of the messages
   * @return the message processor
   */
  static <T> MessageProcessor<T> sync(Synchronous<T> processor) {
    return message -> CompletableFuture.completedFuture(processor.process(message));
  }

  /**
   * Process a message.
   *
   * @param message the decoded message, can be <code>null</code> for an empty body
   * @return the outcome of the processing
   * @throws Exception if the processing fails
   */
  CompletionStage<Boolean> process(T message) throws Exception;

  /**
   * Synchronous flavor of {@link MessageProcessor}.
   *
   * @param <T> the type of the messages
   */
  @FunctionalInterface
  interface Synchronous<T> {

    boolean process(T message) throws Exception;
  }
}
