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

import static com.rabbitmq.reliable.MessageHeaders.RETRY_COUNT;
import static com.rabbitmq.reliable.impl.Utils.namedRunnable;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.reliable.DeliveryOutcome;
import com.rabbitmq.reliable.MessageOptions;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens to a delivery that failed processing.
 *
 * <ul>
 *   <li>no headers or no retry count: reject and requeue
 *   <li>retry count reached the maximum: reject without requeueing
 *   <li>otherwise: republish with an incremented retry count to the original exchange and routing
 *       key, then ack the delivery
 * </ul>
 */
final class DeadLetterRouter {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeadLetterRouter.class);

  private static final int PERSISTENT_DELIVERY_MODE = 2;

  private final int maxRetryCount;
  private final long retryDelayMs;
  private final ScheduledExecutorService scheduledExecutorService;
  private final MetricsCollector metricsCollector;

  DeadLetterRouter(
      MessageOptions options,
      ScheduledExecutorService scheduledExecutorService,
      MetricsCollector metricsCollector) {
    this.maxRetryCount = options.maxRetryCount();
    this.retryDelayMs = options.retryDelay().toMillis();
    this.scheduledExecutorService = scheduledExecutorService;
    this.metricsCollector = metricsCollector;
  }

  DeliveryOutcome route(
      Channel channel, long deliveryTag, AMQP.BasicProperties properties, byte[] body)
      throws IOException {
    Map<String, Object> headers = properties == null ? null : properties.getHeaders();
    if (headers == null) {
      LOGGER.warn("Message {} has no header, cannot use retry algorithm, requeuing it", deliveryTag);
      channel.basicReject(deliveryTag, true);
      this.metricsCollector.requeue();
      return DeliveryOutcome.REQUEUED;
    }
    try {
      int retryCount = RetryHeaders.retryCount(headers);
      if (retryCount == RetryHeaders.NO_RETRY_COUNT) {
        LOGGER.warn(
            "Message {} has no retry count header, cannot use retry algorithm, requeuing it",
            deliveryTag);
        channel.basicReject(deliveryTag, true);
        this.metricsCollector.requeue();
        return DeliveryOutcome.REQUEUED;
      } else if (retryCount >= this.maxRetryCount) {
        LOGGER.warn(
            "Message {} reached the maximum retry count ({}), rejecting it to dead letter",
            deliveryTag,
            this.maxRetryCount);
        channel.basicReject(deliveryTag, false);
        this.metricsCollector.deadLetter();
        return DeliveryOutcome.DEAD_LETTERED;
      } else {
        String exchange = RetryHeaders.exchange(headers);
        String routingKey = RetryHeaders.routingKey(headers);
        AMQP.BasicProperties retryProperties =
            properties
                .builder()
                .deliveryMode(PERSISTENT_DELIVERY_MODE)
                .headers(RetryHeaders.withRetryCount(headers, retryCount + 1))
                .build();
        if (this.retryDelayMs <= 0) {
          republish(channel, deliveryTag, exchange, routingKey, retryProperties, body);
        } else {
          this.scheduledExecutorService.schedule(
              namedRunnable(
                  () -> {
                    try {
                      republish(channel, deliveryTag, exchange, routingKey, retryProperties, body);
                    } catch (IOException | RuntimeException e) {
                      LOGGER.error(
                          "Error while republishing message {} after retry delay, "
                              + "delivery left unacknowledged",
                          deliveryTag,
                          e);
                    }
                  },
                  "Delayed retry of message %d to exchange '%s'",
                  deliveryTag,
                  exchange),
              this.retryDelayMs,
              TimeUnit.MILLISECONDS);
        }
        return DeliveryOutcome.RETRIED;
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Error while trying to retry message {}", deliveryTag, e);
      throw e;
    }
  }

  private void republish(
      Channel channel,
      long deliveryTag,
      String exchange,
      String routingKey,
      AMQP.BasicProperties properties,
      byte[] body)
      throws IOException {
    channel.basicPublish(exchange, routingKey, true, properties, body);
    channel.basicAck(deliveryTag, false);
    this.metricsCollector.retry();
    LOGGER.debug(
        "Message {} republished to exchange '{}' with routing key '{}' and retry count {}",
        deliveryTag,
        exchange,
        routingKey,
        properties.getHeaders().get(RETRY_COUNT));
  }
}
