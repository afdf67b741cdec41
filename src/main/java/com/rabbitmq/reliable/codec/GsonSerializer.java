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
package com.rabbitmq.reliable.codec;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.rabbitmq.reliable.ReliableMessagingException;
import com.rabbitmq.reliable.Serializer;
import java.nio.charset.StandardCharsets;

/**
 * {@link Serializer} using JSON with <a href="https://github.com/google/gson">Gson</a>.
 *
 * <p>This is the default serializer.
 */
public class GsonSerializer implements Serializer {

  private final Gson gson;

  public GsonSerializer() {
    this(new Gson());
  }

  public GsonSerializer(Gson gson) {
    this.gson = gson;
  }

  @Override
  public byte[] serialize(Object value) {
    return this.gson.toJson(value).getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public <T> T deserialize(byte[] data, Class<T> type) {
    try {
      return this.gson.fromJson(new String(data, StandardCharsets.UTF_8), type);
    } catch (JsonParseException e) {
      throw new ReliableMessagingException(
          "Error while deserializing payload to " + type.getName(), e);
    }
  }
}
