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

/**
 * Information on a declared queue.
 *
 * @see ReliableMessaging#queueDeclare(String, String, String, String, java.util.Map)
 */
public final class QueueInfo {

  private final String name;
  private final int messageCount;
  private final int consumerCount;

  public QueueInfo(String name, int messageCount, int consumerCount) {
    this.name = name;
    this.messageCount = messageCount;
    this.consumerCount = consumerCount;
  }

  public String name() {
    return name;
  }

  /**
   * The number of ready messages at declaration time.
   *
   * @return message count
   */
  public int messageCount() {
    return messageCount;
  }

  public int consumerCount() {
    return consumerCount;
  }

  @Override
  public String toString() {
    return "QueueInfo{"
        + "name='"
        + name
        + '\''
        + ", messageCount="
        + messageCount
        + ", consumerCount="
        + consumerCount
        + '}';
  }
}
