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

import static com.rabbitmq.reliable.Resource.State.CLOSED;
import static com.rabbitmq.reliable.Resource.State.CLOSING;
import static com.rabbitmq.reliable.Resource.State.OPEN;
import static com.rabbitmq.reliable.Resource.State.OPENING;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.reliable.CancellationSignal;
import com.rabbitmq.reliable.ChannelProvider;
import com.rabbitmq.reliable.ConsumerHandle;
import com.rabbitmq.reliable.DeliveryOutcome;
import com.rabbitmq.reliable.MessageProcessor;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer of a queue on its own channel.
 *
 * <p>In manual acknowledgment mode, successful deliveries are acked and failed ones go through
 * the {@link DeadLetterRouter}. In automatic acknowledgment mode, the processing result is
 * ignored.
 */
final class RetryingConsumer<T> extends ResourceBase implements ConsumerHandle {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingConsumer.class);

  private final String queue;
  private final Class<T> type;
  private final MessageProcessor<T> processor;
  private final int prefetchCount;
  private final boolean autoAck;
  private final CancellationSignal cancellationSignal;
  private final Channel channel;
  private final ChannelProvider channelProvider;
  private final PayloadCodec codec;
  private final DeadLetterRouter deadLetterRouter;
  private final MetricsCollector metricsCollector;
  private final Runnable closingCallback;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile String consumerTag;
  private volatile CancellationSignal.Registration cancellationRegistration;

  RetryingConsumer(
      String queue,
      Class<T> type,
      MessageProcessor<T> processor,
      int prefetchCount,
      boolean autoAck,
      CancellationSignal cancellationSignal,
      Channel channel,
      ChannelProvider channelProvider,
      PayloadCodec codec,
      DeadLetterRouter deadLetterRouter,
      MetricsCollector metricsCollector,
      Runnable closingCallback,
      List<StateListener> listeners) {
    super(listeners);
    this.queue = queue;
    this.type = type;
    this.processor = processor;
    this.prefetchCount = prefetchCount;
    this.autoAck = autoAck;
    this.cancellationSignal = cancellationSignal;
    this.channel = channel;
    this.channelProvider = channelProvider;
    this.codec = codec;
    this.deadLetterRouter = deadLetterRouter;
    this.metricsCollector = metricsCollector;
    this.closingCallback = closingCallback;
  }

  void start() throws IOException {
    this.opening();
    this.channel.basicQos(this.prefetchCount);
    this.consumerTag = this.channel.basicConsume(this.queue, this.autoAck, new Delivery());
    LOGGER.debug(
        "Consumer {} registered on queue '{}' (prefetch {}, auto-ack {})",
        this.consumerTag,
        this.queue,
        this.prefetchCount,
        this.autoAck);
    if (this.transition(OPENING, OPEN)) {
      this.cancellationRegistration = this.cancellationSignal.onCancel(this::close);
    }
  }

  @Override
  public String queue() {
    return this.queue;
  }

  @Override
  public String consumerTag() {
    return this.consumerTag;
  }

  @Override
  public boolean isOpen() {
    return this.state() == OPEN;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.state(CLOSING);
      if (this.cancellationRegistration != null) {
        this.cancellationRegistration.close();
      }
      String tag = this.consumerTag;
      if (tag != null && this.channel.isOpen()) {
        try {
          this.channel.basicCancel(tag);
        } catch (IOException | AlreadyClosedException e) {
          LOGGER.debug("Error while cancelling consumer {}: {}", tag, e.getMessage());
        }
      }
      this.channelProvider.closeChannel(this.channel);
      this.closingCallback.run();
      this.state(CLOSED);
      LOGGER.debug("Closed consumer {} on queue '{}'", tag, this.queue);
    }
  }

  private boolean accepting() {
    return !this.cancellationSignal.isCancelled() && !this.closed.get();
  }

  private CompletionStage<Boolean> invoke(byte[] body) throws Exception {
    T message = this.codec.decode(body, this.type);
    CompletionStage<Boolean> result = this.processor.process(message);
    return result == null ? CompletableFuture.completedFuture(Boolean.FALSE) : result;
  }

  // visible for testing
  void handle(Envelope envelope, AMQP.BasicProperties properties, byte[] body)
      throws IOException {
    if (!accepting()) {
      LOGGER.debug(
          "Ignoring message {} on queue '{}', consumer is cancelled",
          envelope.getDeliveryTag(),
          this.queue);
      return;
    }
    this.metricsCollector.consume();
    if (this.autoAck) {
      handleAutoAck(envelope, body);
    } else {
      handleManualAck(envelope, properties, body);
    }
  }

  private void handleAutoAck(Envelope envelope, byte[] body) {
    CompletionStage<Boolean> result;
    try {
      result = invoke(body);
    } catch (Exception e) {
      LOGGER.warn(
          "Error while processing message {} from queue '{}' (auto-ack, message not retried)",
          envelope.getDeliveryTag(),
          this.queue,
          e);
      return;
    }
    result.whenComplete(
        (processed, e) -> {
          if (e != null || !Boolean.TRUE.equals(processed)) {
            LOGGER.debug(
                "Message {} from queue '{}' not processed (auto-ack, message not retried)",
                envelope.getDeliveryTag(),
                this.queue,
                e);
          }
        });
  }

  private void handleManualAck(Envelope envelope, AMQP.BasicProperties properties, byte[] body)
      throws IOException {
    long deliveryTag = envelope.getDeliveryTag();
    CompletableFuture<Boolean> result = new CompletableFuture<>();
    try {
      invoke(body)
          .whenComplete(
              (processed, ex) -> {
                if (ex == null) {
                  result.complete(processed);
                } else {
                  result.completeExceptionally(ex);
                }
              });
    } catch (Exception e) {
      LOGGER.error("Error while processing message {} from queue '{}'", deliveryTag, this.queue, e);
      settle(deliveryTag, properties, body, false);
      return;
    }
    if (result.isDone()) {
      settle(deliveryTag, properties, body, processed(deliveryTag, result));
    } else {
      result.whenComplete(
          (ignored, ex) -> {
            try {
              settle(deliveryTag, properties, body, processed(deliveryTag, result));
            } catch (IOException | RuntimeException e) {
              LOGGER.error(
                  "Error while settling message {} from queue '{}'", deliveryTag, this.queue, e);
            }
          });
    }
  }

  private boolean processed(long deliveryTag, CompletableFuture<Boolean> result) {
    try {
      return Boolean.TRUE.equals(result.join());
    } catch (CompletionException | CancellationException e) {
      LOGGER.error(
          "Error while processing message {} from queue '{}'",
          deliveryTag,
          this.queue,
          e.getCause() == null ? e : e.getCause());
      return false;
    }
  }

  private DeliveryOutcome settle(
      long deliveryTag, AMQP.BasicProperties properties, byte[] body, boolean processed)
      throws IOException {
    DeliveryOutcome outcome;
    if (processed) {
      this.channel.basicAck(deliveryTag, false);
      this.metricsCollector.ack();
      outcome = DeliveryOutcome.ACKNOWLEDGED;
    } else {
      outcome = this.deadLetterRouter.route(this.channel, deliveryTag, properties, body);
    }
    LOGGER.debug("Message {} from queue '{}': {}", deliveryTag, this.queue, outcome);
    return outcome;
  }

  private final class Delivery extends DefaultConsumer {

    private Delivery() {
      super(channel);
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body)
        throws IOException {
      handle(envelope, properties, body);
    }

    @Override
    public void handleCancel(String consumerTag) {
      LOGGER.info(
          "Consumer {} on queue '{}' cancelled by the broker, closing it", consumerTag, queue);
      close();
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      if (!closed.get()) {
        LOGGER.info(
            "Channel of consumer {} on queue '{}' shut down: {}",
            consumerTag,
            queue,
            sig.getMessage());
        close();
      }
    }
  }
}
