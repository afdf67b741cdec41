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
 * Thrown when published messages are not confirmed by the broker: negative acknowledgment or
 * confirm timeout.
 *
 * <p>Messages of the batches confirmed before the failure stay published.
 */
public class PublishConfirmException extends ReliableMessagingException {

  private static final long serialVersionUID = 3906417512930553178L;

  private final int confirmedCount;

  public PublishConfirmException(String message, int confirmedCount) {
    super(message);
    this.confirmedCount = confirmedCount;
  }

  public PublishConfirmException(String message, int confirmedCount, Throwable cause) {
    super(message, cause);
    this.confirmedCount = confirmedCount;
  }

  /**
   * The number of messages of the call confirmed before the failure.
   *
   * @return the number of confirmed messages
   */
  public int confirmedCount() {
    return confirmedCount;
  }
}
