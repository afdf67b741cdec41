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

import static com.rabbitmq.reliable.MessageHeaders.EXCHANGE_NAME;
import static com.rabbitmq.reliable.MessageHeaders.EXCHANGE_ROUTING_KEY;
import static com.rabbitmq.reliable.MessageHeaders.RETRY_COUNT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.reliable.CancellationSignal;
import com.rabbitmq.reliable.ChannelProvider;
import com.rabbitmq.reliable.MessageOptions;
import com.rabbitmq.reliable.PublishConfirmException;
import com.rabbitmq.reliable.ReliableMessagingException;
import com.rabbitmq.reliable.codec.GsonSerializer;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import com.rabbitmq.reliable.metrics.MicrometerMetricsCollector;
import com.rabbitmq.reliable.metrics.NoOpMetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

public class BatchPublisherTest {

  Channel channel;
  ChannelProvider channelProvider;

  @BeforeEach
  void init() throws Exception {
    channel = TestUtils.channel();
    channelProvider = mock(ChannelProvider.class);
    when(channelProvider.openConfirmChannel()).thenReturn(channel);
  }

  BatchPublisher publisher(MessageOptions options) {
    return publisher(options, NoOpMetricsCollector.SINGLETON);
  }

  BatchPublisher publisher(MessageOptions options, MetricsCollector metricsCollector) {
    return new BatchPublisher(
        channelProvider, options, new PayloadCodec(new GsonSerializer()), metricsCollector);
  }

  static double outstandingConfirms(SimpleMeterRegistry registry) {
    return registry.get("rabbitmq.reliable.outstanding_publish_confirm").gauge().value();
  }

  static List<String> messages(int count) {
    return IntStream.range(0, count).mapToObj(i -> "message " + i).collect(Collectors.toList());
  }

  @ParameterizedTest
  @CsvSource({"1,20,1", "20,20,1", "21,20,2", "45,20,3", "100,7,15", "5,1,5", "0,20,0"})
  void confirmWaitShouldHappenOncePerBatch(int messageCount, int batchSize, int expectedWaits)
      throws Exception {
    MessageOptions options =
        MessageOptions.builder().batchSize(batchSize).maxOutstandingConfirms(1000).build();
    publisher(options)
        .publish("exchange", messages(messageCount), "rk", null, CancellationSignal.none());

    verify(channel, times(messageCount))
        .basicPublish(eq("exchange"), eq("rk"), eq(true), any(AMQP.BasicProperties.class), any());
    verify(channel, times(expectedWaits)).waitForConfirmsOrDie(anyLong());
    verify(channelProvider).closeChannel(channel);
  }

  @Test
  void lastPartialBatchShouldBeConfirmedBeforeReturning() throws Exception {
    publisher(MessageOptions.builder().batchSize(2).build())
        .publish("exchange", messages(3), "", null, CancellationSignal.none());

    InOrder inOrder = inOrder(channel, channelProvider);
    inOrder.verify(channel, times(2)).basicPublish(anyString(), anyString(), anyBoolean(), any(), any());
    inOrder.verify(channel).waitForConfirmsOrDie(anyLong());
    inOrder.verify(channel).basicPublish(anyString(), anyString(), anyBoolean(), any(), any());
    inOrder.verify(channel).waitForConfirmsOrDie(anyLong());
    inOrder.verify(channelProvider).closeChannel(channel);
  }

  @Test
  @SuppressWarnings("unchecked")
  void messagesShouldBePersistentAndCarryRetryHeaders() throws Exception {
    Map<String, Object> applicationHeaders = Map.of("tenant", "acme", RETRY_COUNT, 42);
    publisher(MessageOptions.defaults())
        .publish("orders", messages(1), "created", applicationHeaders, CancellationSignal.none());

    ArgumentCaptor<AMQP.BasicProperties> properties =
        ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel)
        .basicPublish(eq("orders"), eq("created"), eq(true), properties.capture(), any());
    assertThat(properties.getValue().getDeliveryMode()).isEqualTo(2);
    assertThat(properties.getValue().getHeaders())
        .containsEntry(RETRY_COUNT, 0)
        .containsEntry(EXCHANGE_NAME, "orders")
        .containsEntry(EXCHANGE_ROUTING_KEY, "created")
        .containsEntry("tenant", "acme");
    assertThat(applicationHeaders).containsEntry(RETRY_COUNT, 42);
  }

  @Test
  void nullRoutingKeyShouldBePublishedAsEmpty() throws Exception {
    publisher(MessageOptions.defaults())
        .publish("orders", messages(1), null, null, CancellationSignal.none());

    ArgumentCaptor<AMQP.BasicProperties> properties =
        ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel).basicPublish(eq("orders"), eq(""), eq(true), properties.capture(), any());
    assertThat(properties.getValue().getHeaders()).containsEntry(EXCHANGE_ROUTING_KEY, "");
  }

  @Test
  void payloadsShouldBeEncodedByType() throws Exception {
    List<Object> payloads = new ArrayList<>();
    payloads.add(null);
    payloads.add("héllo");
    payloads.add(new Order(1, "book"));
    publisher(MessageOptions.defaults())
        .publish("exchange", payloads, "", null, CancellationSignal.none());

    ArgumentCaptor<byte[]> bodies = ArgumentCaptor.forClass(byte[].class);
    verify(channel, times(3))
        .basicPublish(anyString(), anyString(), anyBoolean(), any(), bodies.capture());
    assertThat(bodies.getAllValues().get(0)).isEmpty();
    assertThat(bodies.getAllValues().get(1)).isEqualTo("héllo".getBytes(StandardCharsets.UTF_8));
    assertThat(new String(bodies.getAllValues().get(2), StandardCharsets.UTF_8))
        .isEqualTo("{\"id\":1,\"name\":\"book\"}");
  }

  @Test
  void cancellationShouldStopPublishingAndCloseChannel() throws Exception {
    CancellationSignal signal = CancellationSignal.create();
    AtomicInteger published = new AtomicInteger();
    doAnswer(
            invocation -> {
              if (published.incrementAndGet() == 3) {
                signal.cancel();
              }
              return null;
            })
        .when(channel)
        .basicPublish(anyString(), anyString(), anyBoolean(), any(), any());

    assertThatThrownBy(
            () ->
                publisher(MessageOptions.builder().batchSize(2).build())
                    .publish("exchange", messages(10), "", null, signal))
        .isInstanceOf(CancellationException.class);
    assertThat(published).hasValue(3);
    verify(channel, times(1)).waitForConfirmsOrDie(anyLong());
    verify(channelProvider).closeChannel(channel);
  }

  @Test
  void alreadyCancelledSignalShouldNotOpenChannel() throws Exception {
    CancellationSignal signal = CancellationSignal.create();
    signal.cancel();
    assertThatThrownBy(
            () ->
                publisher(MessageOptions.defaults())
                    .publish("exchange", messages(1), "", null, signal))
        .isInstanceOf(CancellationException.class);
    verify(channelProvider, never()).openConfirmChannel();
  }

  @Test
  void nackShouldFailWithNumberOfConfirmedMessages() throws Exception {
    AtomicInteger waits = new AtomicInteger();
    doAnswer(
            invocation -> {
              if (waits.incrementAndGet() == 2) {
                throw new IOException("nacks received");
              }
              return null;
            })
        .when(channel)
        .waitForConfirmsOrDie(anyLong());

    assertThatThrownBy(
            () ->
                publisher(MessageOptions.builder().batchSize(5).build())
                    .publish("exchange", messages(20), "", null, CancellationSignal.none()))
        .isInstanceOf(PublishConfirmException.class)
        .hasCauseInstanceOf(IOException.class)
        .extracting(e -> ((PublishConfirmException) e).confirmedCount())
        .isEqualTo(5);
    verify(channel, times(10)).basicPublish(anyString(), anyString(), anyBoolean(), any(), any());
    verify(channelProvider).closeChannel(channel);
  }

  @Test
  void confirmTimeoutShouldFail() throws Exception {
    doThrow(new TimeoutException()).when(channel).waitForConfirmsOrDie(anyLong());
    assertThatThrownBy(
            () ->
                publisher(MessageOptions.defaults())
                    .publish("exchange", messages(3), "", null, CancellationSignal.none()))
        .isInstanceOf(PublishConfirmException.class)
        .hasCauseInstanceOf(TimeoutException.class);
    verify(channelProvider).closeChannel(channel);
  }

  @Test
  void publishErrorShouldPropagate() throws Exception {
    doThrow(new IOException("connection reset"))
        .when(channel)
        .basicPublish(anyString(), anyString(), anyBoolean(), any(), any());
    assertThatThrownBy(
            () ->
                publisher(MessageOptions.defaults())
                    .publish("exchange", messages(3), "", null, CancellationSignal.none()))
        .isInstanceOf(ReliableMessagingException.class)
        .hasCauseInstanceOf(IOException.class);
    verify(channel, never()).waitForConfirmsOrDie(anyLong());
    verify(channelProvider).closeChannel(channel);
  }

  @Test
  void channelOpeningErrorShouldPropagate() throws Exception {
    when(channelProvider.openConfirmChannel()).thenThrow(new IOException("no connection"));
    assertThatThrownBy(
            () ->
                publisher(MessageOptions.defaults())
                    .publish("exchange", messages(1), "", null, CancellationSignal.none()))
        .isInstanceOf(ReliableMessagingException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void outstandingConfirmsShouldBeCappedWhenBrokerDoesNotConfirm() {
    MessageOptions options =
        MessageOptions.builder()
            .batchSize(10)
            .maxOutstandingConfirms(3)
            .confirmTimeout(Duration.ofMillis(200))
            .build();
    assertThatThrownBy(
            () ->
                publisher(options)
                    .publish("exchange", messages(10), "", null, CancellationSignal.none()))
        .isInstanceOf(PublishConfirmException.class)
        .hasMessageContaining("3 message(s) are still waiting for confirmation");
  }

  @Test
  void confirmationsShouldReleaseOutstandingSlots() throws Exception {
    AtomicReference<ConfirmListener> listener = new AtomicReference<>();
    doAnswer(
            invocation -> {
              listener.set(invocation.getArgument(0));
              return null;
            })
        .when(channel)
        .addConfirmListener(any(ConfirmListener.class));
    AtomicInteger published = new AtomicInteger();
    doAnswer(
            invocation -> {
              int count = published.incrementAndGet();
              listener.get().handleAck(count, false);
              return null;
            })
        .when(channel)
        .basicPublish(anyString(), anyString(), anyBoolean(), any(), any());
    MessageOptions options =
        MessageOptions.builder()
            .batchSize(10)
            .maxOutstandingConfirms(1)
            .confirmTimeout(Duration.ofMillis(200))
            .build();

    publisher(options).publish("exchange", messages(10), "", null, CancellationSignal.none());

    assertThat(published).hasValue(10);
    verify(channel, times(1)).waitForConfirmsOrDie(anyLong());
  }

  @Test
  void outstandingConfirmGaugeShouldGoBackToZeroAfterCancellation() throws Exception {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    CancellationSignal signal = CancellationSignal.create();
    AtomicInteger published = new AtomicInteger();
    doAnswer(
            invocation -> {
              if (published.incrementAndGet() == 3) {
                signal.cancel();
              }
              return null;
            })
        .when(channel)
        .basicPublish(anyString(), anyString(), anyBoolean(), any(), any());

    assertThatThrownBy(
            () ->
                publisher(
                        MessageOptions.builder().batchSize(2).build(),
                        new MicrometerMetricsCollector(registry))
                    .publish("exchange", messages(10), "", null, signal))
        .isInstanceOf(CancellationException.class);

    assertThat(outstandingConfirms(registry)).isZero();
    assertThat(registry.get("rabbitmq.reliable.confirmed").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("rabbitmq.reliable.errored").counter().count()).isEqualTo(1.0);
  }

  @Test
  void outstandingConfirmGaugeShouldGoBackToZeroAfterConfirmTimeout() throws Exception {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    doThrow(new TimeoutException()).when(channel).waitForConfirmsOrDie(anyLong());

    assertThatThrownBy(
            () ->
                publisher(
                        MessageOptions.builder().batchSize(2).build(),
                        new MicrometerMetricsCollector(registry))
                    .publish("exchange", messages(2), "", null, CancellationSignal.none()))
        .isInstanceOf(PublishConfirmException.class);

    assertThat(outstandingConfirms(registry)).isZero();
    assertThat(registry.get("rabbitmq.reliable.errored").counter().count()).isEqualTo(2.0);
  }

  @Test
  void outstandingConfirmGaugeShouldGoBackToZeroAfterPermitTimeout() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MessageOptions options =
        MessageOptions.builder()
            .batchSize(10)
            .maxOutstandingConfirms(3)
            .confirmTimeout(Duration.ofMillis(100))
            .build();

    assertThatThrownBy(
            () ->
                publisher(options, new MicrometerMetricsCollector(registry))
                    .publish("exchange", messages(10), "", null, CancellationSignal.none()))
        .isInstanceOf(PublishConfirmException.class);

    assertThat(outstandingConfirms(registry)).isZero();
  }

  static class Order {

    final int id;
    final String name;

    Order(int id, String name) {
      this.id = id;
      this.name = name;
    }
  }
}
