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
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.reliable.CancellationSignal;
import com.rabbitmq.reliable.ChannelProvider;
import com.rabbitmq.reliable.MessageOptions;
import com.rabbitmq.reliable.PublishConfirmException;
import com.rabbitmq.reliable.ReliableMessagingException;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes messages on a dedicated confirm channel and waits for confirmations every {@link
 * MessageOptions#batchSize()} messages.
 */
final class BatchPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchPublisher.class);

  private static final int PERSISTENT_DELIVERY_MODE = 2;

  private static final ReturnListener RETURN_LISTENER =
      (replyCode, replyText, exchange, routingKey, properties, body) ->
          LOGGER.warn(
              "Message returned by the broker (exchange '{}', routing key '{}'): {} {}",
              exchange,
              routingKey,
              replyCode,
              replyText);

  private final ChannelProvider channelProvider;
  private final MessageOptions options;
  private final PayloadCodec codec;
  private final MetricsCollector metricsCollector;

  BatchPublisher(
      ChannelProvider channelProvider,
      MessageOptions options,
      PayloadCodec codec,
      MetricsCollector metricsCollector) {
    this.channelProvider = channelProvider;
    this.options = options;
    this.codec = codec;
    this.metricsCollector = metricsCollector;
  }

  <T> void publish(
      String exchange,
      List<T> messages,
      String routingKey,
      Map<String, Object> headers,
      CancellationSignal cancellationSignal) {
    String exchangeName = Utils.nullToEmpty(exchange);
    String key = Utils.nullToEmpty(routingKey);
    cancellationSignal.throwIfCancelled();
    Channel channel;
    try {
      channel = this.channelProvider.openConfirmChannel();
    } catch (IOException e) {
      throw new ReliableMessagingException("Error while opening publishing channel", e);
    }
    ConfirmTracker tracker =
        new ConfirmTracker(
            this.options.maxOutstandingConfirms(),
            this.options.confirmTimeout(),
            this.metricsCollector);
    channel.addConfirmListener(tracker);
    channel.addReturnListener(RETURN_LISTENER);
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .deliveryMode(PERSISTENT_DELIVERY_MODE)
            .headers(RetryHeaders.initial(headers, exchangeName, key))
            .build();
    int batchSize = this.options.batchSize();
    int pending = 0;
    int confirmed = 0;
    try {
      for (T message : messages) {
        cancellationSignal.throwIfCancelled();
        byte[] body = this.codec.encode(message);
        long sequenceNumber = channel.getNextPublishSeqNo();
        tracker.acquire(sequenceNumber, confirmed);
        this.metricsCollector.publish(1);
        try {
          channel.basicPublish(exchangeName, key, true, properties, body);
        } catch (IOException | RuntimeException e) {
          tracker.cancel(sequenceNumber);
          this.metricsCollector.publishError(1);
          throw e;
        }
        pending++;
        if (pending >= batchSize) {
          awaitConfirms(channel, tracker, exchangeName, pending, confirmed);
          confirmed += pending;
          pending = 0;
        }
      }
      if (pending > 0) {
        awaitConfirms(channel, tracker, exchangeName, pending, confirmed);
        confirmed += pending;
      }
      LOGGER.debug("{} message(s) published and confirmed on exchange '{}'", confirmed, exchange);
    } catch (IOException e) {
      throw new ReliableMessagingException(
          "Error while publishing to exchange '" + exchangeName + "'", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ReliableMessagingException(
          "Interrupted while publishing to exchange '" + exchangeName + "'", e);
    } finally {
      channel.removeConfirmListener(tracker);
      channel.removeReturnListener(RETURN_LISTENER);
      int abandoned = tracker.abandon();
      if (abandoned > 0) {
        LOGGER.debug(
            "{} message(s) published to exchange '{}' left without confirmation",
            abandoned,
            exchangeName);
      }
      this.channelProvider.closeChannel(channel);
    }
  }

  private void awaitConfirms(
      Channel channel, ConfirmTracker tracker, String exchange, int batchCount, int confirmed)
      throws InterruptedException {
    try {
      channel.waitForConfirmsOrDie(this.options.confirmTimeout().toMillis());
    } catch (IOException e) {
      throw new PublishConfirmException(
          "Broker did not confirm a batch of " + batchCount + " message(s) on exchange '"
              + exchange + "'",
          confirmed,
          e);
    } catch (TimeoutException e) {
      throw new PublishConfirmException(
          "Batch of " + batchCount + " message(s) on exchange '" + exchange
              + "' not confirmed after " + this.options.confirmTimeout().toMillis() + " ms",
          confirmed,
          e);
    }
    tracker.confirmAll();
    LOGGER.debug("Batch of {} message(s) confirmed on exchange '{}'", batchCount, exchange);
  }
}
