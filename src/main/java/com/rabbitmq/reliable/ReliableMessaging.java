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
import java.util.Map;

/**
 * The {@link ReliableMessaging} is the main entry point to publish messages with publisher
 * confirms and to consume them with a bounded retry and dead-letter policy.
 *
 * <p>Every message published through this API carries the {@link MessageHeaders#RETRY_COUNT},
 * {@link MessageHeaders#EXCHANGE_NAME}, and {@link MessageHeaders#EXCHANGE_ROUTING_KEY} headers.
 * Consumers created with {@link #receive(String, Class, MessageProcessor)} use these headers to
 * republish failed messages to their original destination or to reject them once the configured
 * {@link MessageOptions#maxRetryCount()} is reached.
 *
 * <p>The underlying AMQP connection is shared. Each publishing call and each consumer uses its own
 * channel.
 *
 * <p>Use {@link ReliableMessaging#builder()} to configure and create an instance.
 *
 * <p>{@link ReliableMessaging} instances are expected to be thread-safe.
 *
 * @see ReliableMessagingBuilder
 */
public interface ReliableMessaging extends AutoCloseable {

  /**
   * Create a builder to configure and create a {@link ReliableMessaging} instance.
   *
   * @return the builder
   * @see ReliableMessagingBuilder
   */
  static ReliableMessagingBuilder builder() {
    try {
      return (ReliableMessagingBuilder)
          Class.forName("com.rabbitmq.reliable.impl.DefaultReliableMessagingBuilder")
              .getConstructor()
              .newInstance();
    } catch (Exception e) {
      throw new ReliableMessagingException("Error while creating reliable messaging builder", e);
    }
  }

  /**
   * Publish a message to an exchange with an empty routing key.
   *
   * @param exchange the exchange to publish to
   * @param message the message
   * @param <T> the type of the message
   * @see #send(String, Object, String, Map, CancellationSignal)
   */
  <T> void send(String exchange, T message);

  /**
   * Publish a message to an exchange.
   *
   * @param exchange the exchange to publish to
   * @param message the message
   * @param routingKey the routing key
   * @param <T> the type of the message
   * @see #send(String, Object, String, Map, CancellationSignal)
   */
  <T> void send(String exchange, T message, String routingKey);

  /**
   * Publish a message and wait for the broker to confirm it.
   *
   * <p>A <code>null</code> message is published with an empty body, a {@link String} as its UTF-8
   * bytes, a <code>byte[]</code> as is, and any other value with the configured {@link
   * Serializer}.
   *
   * @param exchange the exchange to publish to
   * @param message the message
   * @param routingKey the routing key, can be <code>null</code> (empty routing key)
   * @param headers additional headers, can be <code>null</code>
   * @param cancellationSignal signal checked before publishing
   * @param <T> the type of the message
   * @throws PublishConfirmException if the broker does not confirm the message in time or nacks
   *     it
   * @throws ReliableMessagingException if the channel cannot be opened or the publish fails
   * @throws java.util.concurrent.CancellationException if the signal is cancelled
   */
  <T> void send(
      String exchange,
      T message,
      String routingKey,
      Map<String, Object> headers,
      CancellationSignal cancellationSignal);

  /**
   * Publish messages to an exchange with an empty routing key.
   *
   * @param exchange the exchange to publish to
   * @param messages the messages
   * @param <T> the type of the messages
   * @see #sendBatch(String, List, String, Map, CancellationSignal)
   */
  <T> void sendBatch(String exchange, List<T> messages);

  /**
   * Publish messages to an exchange.
   *
   * @param exchange the exchange to publish to
   * @param messages the messages
   * @param routingKey the routing key used for all the messages
   * @param <T> the type of the messages
   * @see #sendBatch(String, List, String, Map, CancellationSignal)
   */
  <T> void sendBatch(String exchange, List<T> messages, String routingKey);

  /**
   * Publish messages in batches and wait for the broker to confirm them.
   *
   * <p>Messages are published in batches of {@link MessageOptions#batchSize()}, the call waits for
   * the confirmation of a batch before publishing the next one. The number of unconfirmed messages
   * never exceeds {@link MessageOptions#maxOutstandingConfirms()}.
   *
   * <p>Messages confirmed before a failure or a cancellation are not rolled back.
   *
   * @param exchange the exchange to publish to
   * @param messages the messages
   * @param routingKey the routing key used for all the messages, can be <code>null</code>
   * @param headers additional headers for all the messages, can be <code>null</code>
   * @param cancellationSignal signal checked before each publish
   * @param <T> the type of the messages
   * @throws PublishConfirmException if the broker does not confirm a batch in time or nacks a
   *     message
   * @throws ReliableMessagingException if the channel cannot be opened or a publish fails
   * @throws java.util.concurrent.CancellationException if the signal is cancelled
   */
  <T> void sendBatch(
      String exchange,
      List<T> messages,
      String routingKey,
      Map<String, Object> headers,
      CancellationSignal cancellationSignal);

  /**
   * Start consuming from a queue with a prefetch count of 1 and manual acknowledgment.
   *
   * @param queue the queue to consume from
   * @param type the type to decode message bodies to
   * @param processor the processing callback
   * @param <T> the type of the messages
   * @return the consumer handle
   * @see #receive(String, Class, MessageProcessor, int, boolean, CancellationSignal)
   */
  <T> ConsumerHandle receive(String queue, Class<T> type, MessageProcessor<T> processor);

  /**
   * Start consuming from a queue.
   *
   * <p>In manual acknowledgment mode, a message is acknowledged when the processor returns <code>
   * true</code>. When it returns <code>false</code> or fails, the message is republished with an
   * incremented {@link MessageHeaders#RETRY_COUNT} header, or rejected without requeueing once the
   * maximum retry count is reached (the broker then dead-letters or drops it). Messages without
   * retry headers are rejected and requeued.
   *
   * <p>In automatic acknowledgment mode, the result of the processor is ignored.
   *
   * @param queue the queue to consume from
   * @param type the type to decode message bodies to
   * @param processor the processing callback
   * @param prefetchCount the maximum number of unacknowledged messages for the consumer
   * @param autoAck whether messages are acknowledged on delivery
   * @param cancellationSignal signal to stop the consumer and release its channel
   * @param <T> the type of the messages
   * @return the consumer handle
   * @throws java.util.concurrent.CancellationException if the signal is already cancelled
   */
  <T> ConsumerHandle receive(
      String queue,
      Class<T> type,
      MessageProcessor<T> processor,
      int prefetchCount,
      boolean autoAck,
      CancellationSignal cancellationSignal);

  /**
   * Declare a durable queue and, if an exchange name is provided, a durable exchange and a binding
   * between them.
   *
   * @param queue the queue name
   * @param exchange the exchange name, the queue is only declared if empty or <code>null</code>
   * @param exchangeType the exchange type (<code>direct</code>, <code>fanout</code>, <code>topic
   *     </code>, <code>headers</code>)
   * @param routingKey the binding routing key
   * @param arguments queue arguments (e.g. <code>x-dead-letter-exchange</code>), also used as
   *     binding arguments
   * @return information on the declared queue
   */
  QueueInfo queueDeclare(
      String queue,
      String exchange,
      String exchangeType,
      String routingKey,
      Map<String, Object> arguments);

  /**
   * Declare two durable exchanges and bind the destination to the source.
   *
   * @param destination the exchange receiving messages
   * @param source the exchange forwarding messages
   * @param exchangeType the type of both exchanges
   * @param routingKey the binding routing key
   * @param arguments binding arguments, can be <code>null</code>
   */
  void exchangeBind(
      String destination,
      String source,
      String exchangeType,
      String routingKey,
      Map<String, Object> arguments);

  /**
   * The options used by publishers and consumers.
   *
   * @return the message options
   */
  MessageOptions options();

  /** Close the consumers and release the resources this instance owns. */
  @Override
  void close();
}
