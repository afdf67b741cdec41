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

/**
 * Contract to turn message objects into bytes and back.
 *
 * <p>Strings and byte arrays bypass the serializer.
 *
 * @see com.rabbitmq.reliable.codec.GsonSerializer
 */
public interface Serializer {

  /**
   * Serialize a value.
   *
   * @param value the value, never <code>null</code>
   * @return the bytes
   */
  byte[] serialize(Object value);

  /**
   * Deserialize bytes to a value of the given type.
   *
   * @param data the bytes, never empty
   * @param type the target type
   * @param <T> the target type
   * @return the value
   */
  <T> T deserialize(byte[] data, Class<T> type);
}
