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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.reliable.ReliableMessagingException;
import com.rabbitmq.reliable.codec.GsonSerializer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

public class PayloadCodecTest {

  PayloadCodec codec = new PayloadCodec(new GsonSerializer());

  @Test
  void stringsShouldBeRawUtf8NotJson() {
    assertThat(codec.encode("naïve \"quoted\""))
        .isEqualTo("naïve \"quoted\"".getBytes(StandardCharsets.UTF_8));
    assertThat(codec.decode("{\"a\":1}".getBytes(StandardCharsets.UTF_8), String.class))
        .isEqualTo("{\"a\":1}");
  }

  @Test
  void nullShouldBeEncodedAsEmptyBody() {
    assertThat(codec.encode(null)).isEmpty();
  }

  @Test
  void emptyBodyShouldDecodeToEmptyStringOrNull() {
    assertThat(codec.decode(new byte[0], String.class)).isEmpty();
    assertThat(codec.decode(new byte[0], Item.class)).isNull();
    assertThat(codec.decode(null, Integer.class)).isNull();
  }

  @Test
  void byteArraysShouldPassThrough() {
    byte[] data = new byte[] {0, 1, 2, (byte) 0xff};
    assertThat(codec.encode(data)).isSameAs(data);
    assertThat(codec.decode(data, byte[].class)).isSameAs(data);
  }

  @Test
  void otherTypesShouldGoThroughSerializer() {
    Item item = new Item();
    item.name = "book";
    item.tags = List.of("paper", "used");

    byte[] body = codec.encode(item);
    assertThat(new String(body, StandardCharsets.UTF_8))
        .isEqualTo("{\"name\":\"book\",\"tags\":[\"paper\",\"used\"]}");

    Item decoded = codec.decode(body, Item.class);
    assertThat(decoded.name).isEqualTo("book");
    assertThat(decoded.tags).containsExactly("paper", "used");
    assertThat(codec.decode("12".getBytes(StandardCharsets.UTF_8), Integer.class)).isEqualTo(12);
  }

  @Test
  void malformedPayloadShouldFail() {
    assertThatThrownBy(
            () -> codec.decode("{\"name\":".getBytes(StandardCharsets.UTF_8), Item.class))
        .isInstanceOf(ReliableMessagingException.class);
  }

  static class Item {

    String name;
    List<String> tags;
  }
}
