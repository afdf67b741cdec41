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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class CancellationSignalTest {

  @Test
  void callbacksShouldRunOnceOnCancel() {
    CancellationSignal signal = CancellationSignal.create();
    AtomicInteger calls = new AtomicInteger();
    signal.onCancel(calls::incrementAndGet);
    signal.onCancel(calls::incrementAndGet);

    signal.cancel();
    signal.cancel();

    assertThat(calls).hasValue(2);
    assertThat(signal.isCancelled()).isTrue();
  }

  @Test
  void callbackRegisteredAfterCancelShouldRunImmediately() {
    CancellationSignal signal = CancellationSignal.create();
    signal.cancel();
    AtomicInteger calls = new AtomicInteger();

    signal.onCancel(calls::incrementAndGet);

    assertThat(calls).hasValue(1);
  }

  @Test
  void closedRegistrationShouldNotRun() {
    CancellationSignal signal = CancellationSignal.create();
    AtomicInteger calls = new AtomicInteger();
    CancellationSignal.Registration registration = signal.onCancel(calls::incrementAndGet);

    registration.close();
    signal.cancel();

    assertThat(calls).hasValue(0);
  }

  @Test
  void failingCallbackShouldNotPreventOthers() {
    CancellationSignal signal = CancellationSignal.create();
    AtomicInteger calls = new AtomicInteger();
    signal.onCancel(
        () -> {
          throw new IllegalStateException("boom");
        });
    signal.onCancel(calls::incrementAndGet);

    signal.cancel();

    assertThat(calls).hasValue(1);
  }

  @Test
  void throwIfCancelledShouldThrowOnlyOnceCancelled() {
    CancellationSignal signal = CancellationSignal.create();
    signal.throwIfCancelled();
    signal.cancel();
    assertThatThrownBy(signal::throwIfCancelled).isInstanceOf(CancellationException.class);
  }

  @Test
  void noneShouldNeverFire() {
    CancellationSignal none = CancellationSignal.none();
    none.onCancel(() -> {
      throw new IllegalStateException("should not run");
    });
    assertThat(none.isCancelled()).isFalse();
    assertThatThrownBy(none::cancel).isInstanceOf(UnsupportedOperationException.class);
  }
}
