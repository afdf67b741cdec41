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

import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.reliable.PublishConfirmException;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.time.Duration;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Keeps track of the unconfirmed publishes of a channel and caps their number.
 *
 * <p>A permit is taken before each publish and given back when the broker acks or nacks the
 * publishing sequence number.
 */
final class ConfirmTracker implements ConfirmListener {

  private final ConcurrentNavigableMap<Long, Boolean> unconfirmed = new ConcurrentSkipListMap<>();
  private final Semaphore permits;
  private final long permitTimeoutMs;
  private final MetricsCollector metricsCollector;

  ConfirmTracker(
      int maxOutstandingConfirms, Duration permitTimeout, MetricsCollector metricsCollector) {
    this.permits = new Semaphore(maxOutstandingConfirms, true);
    this.permitTimeoutMs = permitTimeout.toMillis();
    this.metricsCollector = metricsCollector;
  }

  /**
   * Block until the publish can go out.
   *
   * @param sequenceNumber the publishing sequence number of the message
   * @param confirmedCount messages of the call confirmed so far, for error reporting
   */
  void acquire(long sequenceNumber, int confirmedCount) throws InterruptedException {
    if (this.permits.tryAcquire(this.permitTimeoutMs, TimeUnit.MILLISECONDS)) {
      this.unconfirmed.put(sequenceNumber, Boolean.TRUE);
    } else {
      throw new PublishConfirmException(
          "Could not publish message in "
              + this.permitTimeoutMs
              + " ms, "
              + this.unconfirmed.size()
              + " message(s) are still waiting for confirmation",
          confirmedCount);
    }
  }

  /** Give back the permit of a message that could not be published. */
  void cancel(long sequenceNumber) {
    if (this.unconfirmed.remove(sequenceNumber) != null) {
      this.permits.release();
    }
  }

  @Override
  public void handleAck(long deliveryTag, boolean multiple) {
    int count = settle(deliveryTag, multiple);
    if (count > 0) {
      this.metricsCollector.publishConfirm(count);
    }
  }

  @Override
  public void handleNack(long deliveryTag, boolean multiple) {
    int count = settle(deliveryTag, multiple);
    if (count > 0) {
      this.metricsCollector.publishError(count);
    }
  }

  /**
   * Settle all the tracked messages once the channel reported they are confirmed.
   *
   * @return the number of messages the listener had not seen confirmations for yet
   */
  int confirmAll() {
    int count = 0;
    for (Long sequenceNumber : this.unconfirmed.keySet()) {
      if (this.unconfirmed.remove(sequenceNumber) != null) {
        count++;
      }
    }
    if (count > 0) {
      this.permits.release(count);
      this.metricsCollector.publishConfirm(count);
    }
    return count;
  }

  /**
   * Drop the messages still waiting for a confirmation, once nothing listens to the channel anymore.
   *
   * <p>Their outcome is unknown, they are reported as publish errors.
   *
   * @return the number of dropped messages
   */
  int abandon() {
    int count = 0;
    for (Long sequenceNumber : this.unconfirmed.keySet()) {
      if (this.unconfirmed.remove(sequenceNumber) != null) {
        count++;
      }
    }
    if (count > 0) {
      this.permits.release(count);
      this.metricsCollector.publishError(count);
    }
    return count;
  }

  int unconfirmedCount() {
    return this.unconfirmed.size();
  }

  private int settle(long deliveryTag, boolean multiple) {
    int count = 0;
    if (multiple) {
      for (Long sequenceNumber : this.unconfirmed.headMap(deliveryTag, true).keySet()) {
        if (this.unconfirmed.remove(sequenceNumber) != null) {
          count++;
        }
      }
    } else if (this.unconfirmed.remove(deliveryTag) != null) {
      count = 1;
    }
    if (count > 0) {
      this.permits.release(count);
    }
    return count;
  }
}
