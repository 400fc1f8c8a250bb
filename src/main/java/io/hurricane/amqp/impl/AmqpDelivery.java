// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.hurricane.amqp.impl;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import io.hurricane.amqp.Delivery;
import java.util.Collections;
import java.util.Map;

final class AmqpDelivery implements Delivery {

  private final long deliveryTag;
  private final boolean redelivered;
  private final String exchange;
  private final String routingKey;
  private final AMQP.BasicProperties properties;
  private final byte[] body;

  AmqpDelivery(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    this(
        envelope.getDeliveryTag(),
        envelope.isRedeliver(),
        envelope.getExchange(),
        envelope.getRoutingKey(),
        properties,
        body);
  }

  AmqpDelivery(
      long deliveryTag,
      boolean redelivered,
      String exchange,
      String routingKey,
      AMQP.BasicProperties properties,
      byte[] body) {
    this.deliveryTag = deliveryTag;
    this.redelivered = redelivered;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.properties = properties == null ? new AMQP.BasicProperties() : properties;
    this.body = body == null ? new byte[0] : body;
  }

  @Override
  public long deliveryTag() {
    return this.deliveryTag;
  }

  @Override
  public boolean redelivered() {
    return this.redelivered;
  }

  @Override
  public String exchange() {
    return this.exchange;
  }

  @Override
  public String routingKey() {
    return this.routingKey;
  }

  @Override
  public String appId() {
    return this.properties.getAppId();
  }

  @Override
  public String contentType() {
    return this.properties.getContentType();
  }

  @Override
  public String contentEncoding() {
    return this.properties.getContentEncoding();
  }

  @Override
  public String messageId() {
    return this.properties.getMessageId();
  }

  @Override
  public String correlationId() {
    return this.properties.getCorrelationId();
  }

  @Override
  public Map<String, Object> headers() {
    Map<String, Object> headers = this.properties.getHeaders();
    return headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(headers);
  }

  @Override
  public byte[] body() {
    return this.body;
  }

  @Override
  public String toString() {
    return "AmqpDelivery{"
        + "deliveryTag="
        + deliveryTag
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", appId='"
        + appId()
        + '\''
        + ", size="
        + body.length
        + '}';
  }
}
