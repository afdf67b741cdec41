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

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.reliable.ChannelProvider;
import com.rabbitmq.reliable.MessageOptions;
import com.rabbitmq.reliable.ReliableMessaging;
import com.rabbitmq.reliable.ReliableMessagingBuilder;
import com.rabbitmq.reliable.ReliableMessagingException;
import com.rabbitmq.reliable.Resource;
import com.rabbitmq.reliable.Serializer;
import com.rabbitmq.reliable.codec.GsonSerializer;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import com.rabbitmq.reliable.metrics.NoOpMetricsCollector;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

public class DefaultReliableMessagingBuilder implements ReliableMessagingBuilder {

  private static final String CONNECTION_NAME = "rabbitmq-reliable-messaging";

  private ConnectionFactory connectionFactory;
  private Connection connection;
  private ChannelProvider channelProvider;
  private MessageOptions options = MessageOptions.defaults();
  private Serializer serializer = new GsonSerializer();
  private MetricsCollector metricsCollector = NoOpMetricsCollector.SINGLETON;
  private ScheduledExecutorService scheduledExecutorService;
  private List<Resource.StateListener> consumerListeners = List.of();

  public DefaultReliableMessagingBuilder() {}

  @Override
  public ReliableMessagingBuilder connectionFactory(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    return this;
  }

  @Override
  public ReliableMessagingBuilder connection(Connection connection) {
    this.connection = connection;
    return this;
  }

  @Override
  public ReliableMessagingBuilder channelProvider(ChannelProvider channelProvider) {
    this.channelProvider = channelProvider;
    return this;
  }

  @Override
  public ReliableMessagingBuilder options(MessageOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("options cannot be null");
    }
    this.options = options;
    return this;
  }

  @Override
  public ReliableMessagingBuilder serializer(Serializer serializer) {
    if (serializer == null) {
      throw new IllegalArgumentException("serializer cannot be null");
    }
    this.serializer = serializer;
    return this;
  }

  @Override
  public ReliableMessagingBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.SINGLETON : metricsCollector;
    return this;
  }

  @Override
  public ReliableMessagingBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  @Override
  public ReliableMessagingBuilder consumerListeners(Resource.StateListener... listeners) {
    this.consumerListeners = listeners == null ? List.of() : Arrays.asList(listeners);
    return this;
  }

  @Override
  public ReliableMessaging build() {
    ChannelProvider provider = this.channelProvider;
    Connection ownedConnection = null;
    if (provider == null) {
      Connection c = this.connection;
      if (c == null) {
        ConnectionFactory factory =
            this.connectionFactory == null ? new ConnectionFactory() : this.connectionFactory;
        try {
          c = factory.newConnection(CONNECTION_NAME);
        } catch (IOException | TimeoutException e) {
          throw new ReliableMessagingException("Error while connecting to the broker", e);
        }
        ownedConnection = c;
      }
      provider = new ConnectionChannelProvider(c);
    }
    ScheduledExecutorService executorService = this.scheduledExecutorService;
    boolean privateExecutorService = false;
    if (executorService == null) {
      executorService =
          Executors.newSingleThreadScheduledExecutor(
              new Utils.NamedThreadFactory("rabbitmq-reliable-retry-"));
      privateExecutorService = true;
    }
    return new DefaultReliableMessaging(
        provider,
        this.options,
        this.serializer,
        this.metricsCollector,
        this.consumerListeners,
        executorService,
        privateExecutorService,
        ownedConnection);
  }
}
