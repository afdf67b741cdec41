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

import com.rabbitmq.client.LongString;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Encodes and decodes the retry headers.
 *
 * <p>The broker hands string header values back as {@link LongString}, numbers as {@link Number}.
 */
final class RetryHeaders {

  static final int NO_RETRY_COUNT = -1;

  private RetryHeaders() {}

  /** Headers of a first publish: application headers plus the retry headers. */
  static Map<String, Object> initial(
      Map<String, Object> applicationHeaders, String exchange, String routingKey) {
    Map<String, Object> headers =
        applicationHeaders == null ? new HashMap<>() : new HashMap<>(applicationHeaders);
    headers.put(RETRY_COUNT, 0);
    headers.put(EXCHANGE_NAME, Utils.nullToEmpty(exchange));
    headers.put(EXCHANGE_ROUTING_KEY, Utils.nullToEmpty(routingKey));
    return headers;
  }

  /** Copy of the delivery headers with a new retry count. */
  static Map<String, Object> withRetryCount(Map<String, Object> headers, int retryCount) {
    Map<String, Object> copy = new HashMap<>(headers);
    copy.put(RETRY_COUNT, retryCount);
    return copy;
  }

  /** The retry count, {@link #NO_RETRY_COUNT} if absent or not a number. */
  static int retryCount(Map<String, Object> headers) {
    Object value = headers.get(RETRY_COUNT);
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    String text = string(value);
    if (text == null || text.isEmpty()) {
      return NO_RETRY_COUNT;
    }
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      return NO_RETRY_COUNT;
    }
  }

  static String exchange(Map<String, Object> headers) {
    return Utils.nullToEmpty(string(headers.get(EXCHANGE_NAME)));
  }

  static String routingKey(Map<String, Object> headers) {
    return Utils.nullToEmpty(string(headers.get(EXCHANGE_ROUTING_KEY)));
  }

  private static String string(Object value) {
    if (value == null) {
      return null;
    } else if (value instanceof LongString) {
      return new String(((LongString) value).getBytes(), StandardCharsets.UTF_8);
    } else if (value instanceof byte[]) {
      return new String((byte[]) value, StandardCharsets.UTF_8);
    } else {
      return value.toString();
    }
  }
}
