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

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.util.concurrent.ScheduledExecutorService;

/**
 * API to configure and create a {@link ReliableMessaging} instance.
 *
 * @see ReliableMessaging#builder()
 */
public interface ReliableMessagingBuilder {

  /**
   * The connection factory to create the shared connection with.
   *
   * <p>The connection is then owned by the {@link ReliableMessaging} instance and closed with it.
   * A default {@link ConnectionFactory} (<code>localhost</code>, <code>guest</code>) is used if
   * neither a connection factory, a connection, nor a channel provider is set.
   *
   * @param connectionFactory the connection factory
   * @return this builder instance
   */
  ReliableMessagingBuilder connectionFactory(ConnectionFactory connectionFactory);

  /**
   * An existing connection to share.
   *
   * <p>The connection is owned by the application and is not closed by {@link
   * ReliableMessaging#close()}.
   *
   * @param connection the connection
   * @return this builder instance
   */
  ReliableMessagingBuilder connection(Connection connection);

  /**
   * The provider of channels, takes precedence over the connection settings.
   *
   * @param channelProvider the channel provider
   * @return this builder instance
   */
  ReliableMessagingBuilder channelProvider(ChannelProvider channelProvider);

  /**
   * The options for publishing and consuming.
   *
   * <p>Default is {@link MessageOptions#defaults()}.
   *
   * @param options the message options
   * @return this builder instance
   */
  ReliableMessagingBuilder options(MessageOptions options);

  /**
   * The serializer for payloads that are neither strings nor byte arrays.
   *
   * <p>Default is {@link com.rabbitmq.reliable.codec.GsonSerializer}.
   *
   * @param serializer the serializer
   * @return this builder instance
   */
  ReliableMessagingBuilder serializer(Serializer serializer);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.rabbitmq.reliable.metrics.MicrometerMetricsCollector
   */
  ReliableMessagingBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Set the {@link ScheduledExecutorService} used to delay retries.
   *
   * <p>The executor is not shut down when the instance is closed. A single-threaded executor is
   * created and owned by the instance if none is set.
   *
   * @param scheduledExecutorService the scheduled executor service
   * @return this builder instance
   * @see MessageOptions#retryDelay()
   */
  ReliableMessagingBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService);

  /**
   * Listeners notified of the state changes of all the consumers.
   *
   * @param listeners the listeners
   * @return this builder instance
   * @see ConsumerHandle
   */
  ReliableMessagingBuilder consumerListeners(Resource.StateListener... listeners);

  /**
   * Create the {@link ReliableMessaging} instance.
   *
   * @return the configured instance
   */
  ReliableMessaging build();
}
