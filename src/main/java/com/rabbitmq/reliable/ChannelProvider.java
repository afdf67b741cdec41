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

import com.rabbitmq.client.Channel;
import java.io.IOException;

/**
 * Source of AMQP channels for publishing calls and consumers.
 *
 * <p>Channels are not shared: each publishing call and each consumer gets its own and gives it
 * back with {@link #closeChannel(Channel)}.
 *
 * @see ReliableMessagingBuilder#channelProvider(ChannelProvider)
 */
public interface ChannelProvider {

  /**
   * Open a plain channel.
   *
   * @return the channel
   * @throws IOException if the channel cannot be opened
   */
  Channel openChannel() throws IOException;

  /**
   * Open a channel with publisher confirms enabled.
   *
   * @return the channel
   * @throws IOException if the channel cannot be opened
   */
  Channel openConfirmChannel() throws IOException;

  /**
   * Close a channel, errors are not propagated.
   *
   * @param channel the channel to close
   */
  void closeChannel(Channel channel);
}
