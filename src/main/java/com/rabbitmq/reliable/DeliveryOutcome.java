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

/** What happened to a delivery once processed by a consumer in manual acknowledgment mode. */
public enum DeliveryOutcome {
  /** Processed successfully and acknowledged. */
  ACKNOWLEDGED,
  /** Republished with an incremented retry count, the original delivery is acknowledged. */
  RETRIED,
  /** Rejected without requeueing, the broker dead-letters or drops it. */
  DEAD_LETTERED,
  /** Rejected and requeued because it carries no retry metadata. */
  REQUEUED
}
