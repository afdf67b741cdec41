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

import com.rabbitmq.reliable.Serializer;
import java.nio.charset.StandardCharsets;

/** Turns messages into message bodies and back, strings and byte arrays bypass the serializer. */
final class PayloadCodec {

  private static final byte[] EMPTY = new byte[0];

  private final Serializer serializer;

  PayloadCodec(Serializer serializer) {
    this.serializer = serializer;
  }

  byte[] encode(Object message) {
    if (message == null) {
      return EMPTY;
    } else if (message instanceof String) {
      return ((String) message).getBytes(StandardCharsets.UTF_8);
    } else if (message instanceof byte[]) {
      return (byte[]) message;
    } else {
      return this.serializer.serialize(message);
    }
  }

  @SuppressWarnings("unchecked")
  <T> T decode(byte[] body, Class<T> type) {
    if (body == null || body.length == 0) {
      return type == String.class ? (T) "" : null;
    } else if (type == String.class) {
      return (T) new String(body, StandardCharsets.UTF_8);
    } else if (type == byte[].class) {
      return (T) body;
    } else {
      return this.serializer.deserialize(body, type);
    }
  }
}
