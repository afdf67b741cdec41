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

/** Names of the headers the library sets on published messages. */
public final class MessageHeaders {

  /** Number of times the message has been republished after a processing failure. */
  public static final String RETRY_COUNT = "x-retry-count";

  /** Exchange the message was first published to. */
  public static final String EXCHANGE_NAME = "x-exchange-name";

  /** Routing key the message was first published with. */
  public static final String EXCHANGE_ROUTING_KEY = "x-exchange-routing-key";

  private MessageHeaders() {}
}
