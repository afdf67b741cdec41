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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.reliable.ReliableMessagingException;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class ConnectionChannelProviderTest {

  @Mock Connection connection;
  @Mock Channel channel;

  ConnectionChannelProvider provider;
  AutoCloseable mocks;

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
    provider = new ConnectionChannelProvider(connection);
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  @Test
  void confirmChannelShouldHaveConfirmsEnabled() throws Exception {
    when(connection.createChannel()).thenReturn(channel);

    assertThat(provider.openConfirmChannel()).isSameAs(channel);
    verify(channel).confirmSelect();
  }

  @Test
  void confirmSelectFailureShouldCloseChannel() throws Exception {
    when(connection.createChannel()).thenReturn(channel);
    when(channel.isOpen()).thenReturn(true);
    when(channel.confirmSelect()).thenThrow(new IOException("not supported"));

    assertThatThrownBy(() -> provider.openConfirmChannel()).isInstanceOf(IOException.class);
    verify(channel).close();
  }

  @Test
  void exhaustedChannelsShouldFail() throws Exception {
    when(connection.createChannel()).thenReturn(null);

    assertThatThrownBy(() -> provider.openChannel())
        .isInstanceOf(ReliableMessagingException.class);
  }

  @Test
  void closeChannelShouldSkipClosedChannels() throws Exception {
    when(channel.isOpen()).thenReturn(false);

    provider.closeChannel(channel);

    verify(channel, never()).close();
  }

  @Test
  void closeChannelShouldNotFailWhenChannelIsAlreadyGone() throws Exception {
    when(channel.isOpen()).thenReturn(true);
    doThrow(
            new AlreadyClosedException(
                new ShutdownSignalException(false, false, null, channel)))
        .when(channel)
        .close();

    provider.closeChannel(channel);

    verify(channel).close();
  }
}
