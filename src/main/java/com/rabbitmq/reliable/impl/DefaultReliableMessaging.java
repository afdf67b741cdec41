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
package com.rabbitmq.reliable.impl;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.reliable.CancellationSignal;
import com.rabbitmq.reliable.ChannelProvider;
import com.rabbitmq.reliable.ConsumerHandle;
import com.rabbitmq.reliable.MessageOptions;
import com.rabbitmq.reliable.MessageProcessor;
import com.rabbitmq.reliable.QueueInfo;
import com.rabbitmq.reliable.ReliableMessaging;
import com.rabbitmq.reliable.ReliableMessagingException;
import com.rabbitmq.reliable.Resource;
import com.rabbitmq.reliable.ResourceClosedException;
import com.rabbitmq.reliable.Serializer;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class DefaultReliableMessaging implements ReliableMessaging {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultReliableMessaging.class);

  private static final String DEFAULT_EXCHANGE_TYPE = "direct";
  private static final int MAX_PREFETCH_COUNT = 65535;

  private final ChannelProvider channelProvider;
  private final MessageOptions options;
  private final PayloadCodec codec;
  private final MetricsCollector metricsCollector;
  private final BatchPublisher publisher;
  private final DeadLetterRouter deadLetterRouter;
  private final List<Resource.StateListener> consumerListeners;
  private final ScheduledExecutorService scheduledExecutorService;
  private final boolean privateScheduledExecutorService;
  private final Connection ownedConnection;
  private final Set<ConsumerHandle> consumers = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  DefaultReliableMessaging(
      ChannelProvider channelProvider,
      MessageOptions options,
      Serializer serializer,
      MetricsCollector metricsCollector,
      List<Resource.StateListener> consumerListeners,
      ScheduledExecutorService scheduledExecutorService,
      boolean privateScheduledExecutorService,
      Connection ownedConnection) {
    this.channelProvider = channelProvider;
    this.options = options;
    this.codec = new PayloadCodec(serializer);
    this.metricsCollector = metricsCollector;
    this.consumerListeners = List.copyOf(consumerListeners);
    this.scheduledExecutorService = scheduledExecutorService;
    this.privateScheduledExecutorService = privateScheduledExecutorService;
    this.ownedConnection = ownedConnection;
    this.publisher = new BatchPublisher(channelProvider, options, this.codec, metricsCollector);
    this.deadLetterRouter =
        new DeadLetterRouter(options, scheduledExecutorService, metricsCollector);
    LOGGER.debug("Reliable messaging created with {}", options);
  }

  @Override
  public <T> void send(String exchange, T message) {
    send(exchange, message, "", null, CancellationSignal.none());
  }

  @Override
  public <T> void send(String exchange, T message, String routingKey) {
    send(exchange, message, routingKey, null, CancellationSignal.none());
  }

  @Override
  public <T> void send(
      String exchange,
      T message,
      String routingKey,
      Map<String, Object> headers,
      CancellationSignal cancellationSignal) {
    sendBatch(
        exchange, Collections.singletonList(message), routingKey, headers, cancellationSignal);
  }

  @Override
  public <T> void sendBatch(String exchange, List<T> messages) {
    sendBatch(exchange, messages, "", null, CancellationSignal.none());
  }

  @Override
  public <T> void sendBatch(String exchange, List<T> messages, String routingKey) {
    sendBatch(exchange, messages, routingKey, null, CancellationSignal.none());
  }

  @Override
  public <T> void sendBatch(
      String exchange,
      List<T> messages,
      String routingKey,
      Map<String, Object> headers,
      CancellationSignal cancellationSignal) {
    checkNotClosed();
    if (messages == null) {
      throw new IllegalArgumentException("messages cannot be null");
    }
    this.publisher.publish(
        exchange, messages, routingKey, headers, signalOrNone(cancellationSignal));
  }

  @Override
  public <T> ConsumerHandle receive(String queue, Class<T> type, MessageProcessor<T> processor) {
    return receive(queue, type, processor, 1, false, CancellationSignal.none());
  }

  @Override
  public <T> ConsumerHandle receive(
      String queue,
      Class<T> type,
      MessageProcessor<T> processor,
      int prefetchCount,
      boolean autoAck,
      CancellationSignal cancellationSignal) {
    checkNotClosed();
    if (queue == null || queue.isEmpty()) {
      throw new IllegalArgumentException("A queue must be specified");
    }
    if (type == null || processor == null) {
      throw new IllegalArgumentException("A message type and a processor must be specified");
    }
    if (prefetchCount < 0 || prefetchCount > MAX_PREFETCH_COUNT) {
      throw new IllegalArgumentException(
          "the prefetch count must be between 0 and " + MAX_PREFETCH_COUNT);
    }
    CancellationSignal signal = signalOrNone(cancellationSignal);
    signal.throwIfCancelled();
    Channel channel;
    try {
      channel = this.channelProvider.openChannel();
    } catch (IOException e) {
      throw new ReliableMessagingException("Error while opening consumer channel", e);
    }
    List<ConsumerHandle> holder = new ArrayList<>(1);
    RetryingConsumer<T> consumer =
        new RetryingConsumer<>(
            queue,
            type,
            processor,
            prefetchCount,
            autoAck,
            signal,
            channel,
            this.channelProvider,
            this.codec,
            this.deadLetterRouter,
            this.metricsCollector,
            () -> holder.forEach(this.consumers::remove),
            this.consumerListeners);
    holder.add(consumer);
    this.consumers.add(consumer);
    if (this.closed.get()) {
      consumer.close();
      throw new ResourceClosedException("This reliable messaging instance is closed");
    }
    try {
      consumer.start();
    } catch (IOException | RuntimeException e) {
      consumer.close();
      throw new ReliableMessagingException(
          "Error while starting consumer on queue '" + queue + "'", e);
    }
    return consumer;
  }

  @Override
  public QueueInfo queueDeclare(
      String queue,
      String exchange,
      String exchangeType,
      String routingKey,
      Map<String, Object> arguments) {
    checkNotClosed();
    return withChannel(
        channel -> {
          AMQP.Queue.DeclareOk declareOk = channel.queueDeclare(queue, true, false, false, arguments);
          if (exchange != null && !exchange.isEmpty()) {
            channel.exchangeDeclare(exchange, exchangeTypeOrDefault(exchangeType), true);
            channel.queueBind(queue, exchange, Utils.nullToEmpty(routingKey), arguments);
          }
          return new QueueInfo(
              declareOk.getQueue(), declareOk.getMessageCount(), declareOk.getConsumerCount());
        },
        "Error while declaring queue '" + queue + "'");
  }

  @Override
  public void exchangeBind(
      String destination,
      String source,
      String exchangeType,
      String routingKey,
      Map<String, Object> arguments) {
    checkNotClosed();
    withChannel(
        channel -> {
          String type = exchangeTypeOrDefault(exchangeType);
          channel.exchangeDeclare(destination, type, true);
          channel.exchangeDeclare(source, type, true);
          channel.exchangeBind(destination, source, Utils.nullToEmpty(routingKey), arguments);
          return null;
        },
        "Error while binding exchange '" + destination + "' to '" + source + "'");
  }

  @Override
  public MessageOptions options() {
    return this.options;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      for (ConsumerHandle consumer : new ArrayList<>(this.consumers)) {
        try {
          consumer.close();
        } catch (Exception e) {
          LOGGER.info("Error while closing consumer on queue '{}': {}", consumer.queue(), e.getMessage());
        }
      }
      if (this.privateScheduledExecutorService) {
        this.scheduledExecutorService.shutdownNow();
      }
      if (this.ownedConnection != null && this.ownedConnection.isOpen()) {
        try {
          this.ownedConnection.close();
        } catch (IOException e) {
          LOGGER.info("Error while closing connection: {}", e.getMessage());
        }
      }
      LOGGER.debug("Reliable messaging closed");
    }
  }

  int consumerCount() {
    return this.consumers.size();
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new ResourceClosedException("This reliable messaging instance is closed");
    }
  }

  private <R> R withChannel(ChannelCallable<R> operation, String errorMessage) {
    Channel channel;
    try {
      channel = this.channelProvider.openChannel();
    } catch (IOException e) {
      throw new ReliableMessagingException(errorMessage, e);
    }
    try {
      return operation.call(channel);
    } catch (IOException e) {
      throw new ReliableMessagingException(errorMessage, e);
    } finally {
      this.channelProvider.closeChannel(channel);
    }
  }

  private static String exchangeTypeOrDefault(String exchangeType) {
    return exchangeType == null || exchangeType.isEmpty() ? DEFAULT_EXCHANGE_TYPE : exchangeType;
  }

  private static CancellationSignal signalOrNone(CancellationSignal signal) {
    return signal == null ? CancellationSignal.none() : signal;
  }

  @FunctionalInterface
  private interface ChannelCallable<R> {

    R call(Channel channel) throws IOException;
  }
}
