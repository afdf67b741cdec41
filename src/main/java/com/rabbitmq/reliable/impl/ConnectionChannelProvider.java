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

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.reliable.ChannelProvider;
import com.rabbitmq.reliable.ReliableMessagingException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ChannelProvider} creating channels from a shared {@link Connection}. */
final class ConnectionChannelProvider implements ChannelProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionChannelProvider.class);

  private final Connection connection;

  ConnectionChannelProvider(Connection connection) {
    this.connection = connection;
  }

  @Override
  public Channel openChannel() throws IOException {
    Channel channel = this.connection.createChannel();
    if (channel == null) {
      throw new ReliableMessagingException("No channel available on the connection");
    }
    LOGGER.debug("Opened channel {}", channel.getChannelNumber());
    return channel;
  }

  @Override
  public Channel openConfirmChannel() throws IOException {
    Channel channel = openChannel();
    try {
      channel.confirmSelect();
    } catch (IOException | RuntimeException e) {
      closeChannel(channel);
      throw e;
    }
    return channel;
  }

  @Override
  public void closeChannel(Channel channel) {
    if (channel.isOpen()) {
      try {
        channel.close();
        LOGGER.debug("Closed channel {}", channel.getChannelNumber());
      } catch (IOException | TimeoutException | AlreadyClosedException e) {
        LOGGER.debug("Error while closing channel {}: {}", channel.getChannelNumber(), e.getMessage());
      }
    }
  }
}
