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

import java.time.Duration;

/**
 * Policy settings for publishing and consuming.
 *
 * <p>Instances are immutable, use {@link #builder()} to create them.
 *
 * @see ReliableMessagingBuilder#options(MessageOptions)
 */
public final class MessageOptions {

  public static final int DEFAULT_MAX_RETRY_COUNT = 3;
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(5000);
  public static final int DEFAULT_MAX_OUTSTANDING_CONFIRMS = 1000;
  public static final int DEFAULT_BATCH_SIZE = 20;
  public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(30);

  private static final MessageOptions DEFAULTS = builder().build();

  private final int maxRetryCount;
  private final Duration retryDelay;
  private final int maxOutstandingConfirms;
  private final int batchSize;
  private final Duration confirmTimeout;

  private MessageOptions(Builder builder) {
    this.maxRetryCount = builder.maxRetryCount;
    this.retryDelay = builder.retryDelay;
    this.maxOutstandingConfirms = builder.maxOutstandingConfirms;
    this.batchSize = builder.batchSize;
    this.confirmTimeout = builder.confirmTimeout;
  }

  public static MessageOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The number of times a failed message is republished before it is rejected without
   * requeueing.
   *
   * <p>With 0, failed messages are rejected on the first failure. The broker routes rejected
   * messages to the dead letter exchange of the queue, if any, or drops them.
   *
   * @return the maximum retry count
   */
  public int maxRetryCount() {
    return this.maxRetryCount;
  }

  /**
   * The delay before a failed message is republished.
   *
   * <p>The original delivery stays unacknowledged during the delay.
   *
   * @return the retry delay
   */
  public Duration retryDelay() {
    return this.retryDelay;
  }

  /**
   * The maximum number of published messages waiting for a confirmation.
   *
   * @return the maximum number of outstanding confirms
   */
  public int maxOutstandingConfirms() {
    return this.maxOutstandingConfirms;
  }

  /**
   * The number of messages published between 2 confirmation waits.
   *
   * @return the batch size
   */
  public int batchSize() {
    return this.batchSize;
  }

  /**
   * The time to wait for the confirmation of a batch, and for a slot when the maximum number of
   * outstanding confirms is reached.
   *
   * @return the confirm timeout
   */
  public Duration confirmTimeout() {
    return this.confirmTimeout;
  }

  @Override
  public String toString() {
    return "MessageOptions{"
        + "maxRetryCount="
        + maxRetryCount
        + ", retryDelay="
        + retryDelay
        + ", maxOutstandingConfirms="
        + maxOutstandingConfirms
        + ", batchSize="
        + batchSize
        + ", confirmTimeout="
        + confirmTimeout
        + '}';
  }

  /** Builder for {@link MessageOptions}. */
  public static final class Builder {

    private int maxRetryCount = DEFAULT_MAX_RETRY_COUNT;
    private Duration retryDelay = DEFAULT_RETRY_DELAY;
    private int maxOutstandingConfirms = DEFAULT_MAX_OUTSTANDING_CONFIRMS;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration confirmTimeout = DEFAULT_CONFIRM_TIMEOUT;

    private Builder() {}

    public Builder maxRetryCount(int maxRetryCount) {
      if (maxRetryCount < 0) {
        throw new IllegalArgumentException("the maximum retry count cannot be negative");
      }
      this.maxRetryCount = maxRetryCount;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      if (retryDelay == null || retryDelay.isNegative()) {
        throw new IllegalArgumentException("the retry delay cannot be null or negative");
      }
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder retryDelayMilliseconds(long retryDelayMilliseconds) {
      return this.retryDelay(Duration.ofMillis(retryDelayMilliseconds));
    }

    public Builder maxOutstandingConfirms(int maxOutstandingConfirms) {
      if (maxOutstandingConfirms <= 0) {
        throw new IllegalArgumentException(
            "the maximum number of outstanding confirms must be greater than 0");
      }
      this.maxOutstandingConfirms = maxOutstandingConfirms;
      return this;
    }

    public Builder batchSize(int batchSize) {
      if (batchSize <= 0) {
        throw new IllegalArgumentException("the batch size must be greater than 0");
      }
      this.batchSize = batchSize;
      return this;
    }

    public Builder confirmTimeout(Duration confirmTimeout) {
      if (confirmTimeout == null || confirmTimeout.isNegative() || confirmTimeout.isZero()) {
        throw new IllegalArgumentException("the confirm timeout must be positive");
      }
      this.confirmTimeout = confirmTimeout;
      return this;
    }

    public MessageOptions build() {
      return new MessageOptions(this);
    }
  }
}
