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
package com.rabbitmq.reliable.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

public class MicrometerMetricsCollector implements MetricsCollector {

  private final Counter publish;
  private final Counter publishConfirm;
  private final Counter publishError;
  private final Counter consume;
  private final Counter ack;
  private final Counter retry;
  private final Counter deadLetter;
  private final Counter requeue;

  private final AtomicLong outstandingPublishConfirm;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.reliable");
  }

  public MicrometerMetricsCollector(MeterRegistry registry, String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(MeterRegistry registry, String prefix, String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(MeterRegistry registry, String prefix, Iterable<Tag> tags) {
    this.publish = registry.counter(prefix + ".published", tags);
    this.publishConfirm = registry.counter(prefix + ".confirmed", tags);
    this.publishError = registry.counter(prefix + ".errored", tags);
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.ack = registry.counter(prefix + ".acknowledged", tags);
    this.retry = registry.counter(prefix + ".retried", tags);
    this.deadLetter = registry.counter(prefix + ".dead_lettered", tags);
    this.requeue = registry.counter(prefix + ".requeued", tags);
    this.outstandingPublishConfirm =
        registry.gauge(prefix + ".outstanding_publish_confirm", tags, new AtomicLong(0));
  }

  @Override
  public void publish(int count) {
    publish.increment(count);
    outstandingPublishConfirm.addAndGet(count);
  }

  @Override
  public void publishConfirm(int count) {
    publishConfirm.increment(count);
    outstandingPublishConfirm.addAndGet(-count);
  }

  @Override
  public void publishError(int count) {
    publishError.increment(count);
    outstandingPublishConfirm.addAndGet(-count);
  }

  @Override
  public void consume() {
    consume.increment();
  }

  @Override
  public void ack() {
    ack.increment();
  }

  @Override
  public void retry() {
    retry.increment();
  }

  @Override
  public void deadLetter() {
    deadLetter.increment();
  }

  @Override
  public void requeue() {
    requeue.increment();
  }
}
