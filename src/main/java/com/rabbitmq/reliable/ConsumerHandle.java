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

/**
 * Handle on a consumer started with {@link ReliableMessaging#receive(String, Class,
 * MessageProcessor)}.
 *
 * <p>Closing the handle, or cancelling the {@link CancellationSignal} the consumer was created
 * with, cancels the subscription and releases the channel. Processing already in progress is not
 * interrupted.
 */
public interface ConsumerHandle extends Resource, AutoCloseable {

  /**
   * The queue the consumer is subscribed to.
   *
   * @return the queue name
   */
  String queue();

  /**
   * The tag the broker assigned to the subscription.
   *
   * @return the consumer tag, <code>null</code> if the subscription is not registered yet
   */
  String consumerTag();

  /**
   * Whether the consumer is receiving messages.
   *
   * @return true if open
   */
  boolean isOpen();

  /** Cancel the subscription and close the channel. */
  @Override
  void close();
}
