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

import io.hurricane.amqp.Delivery;

/** Response or notification from a {@link Transport}. */
final class TransportEvent {

  enum Type {
    CONNECTION_OPENED,
    CONNECTION_OPEN_FAILED,
    CONNECTION_CLOSED,
    CHANNEL_OPENED,
    CHANNEL_CLOSED,
    EXCHANGE_DECLARED,
    QUEUE_DECLARED,
    QUEUE_BOUND,
    QOS_SET,
    CONSUME_STARTED,
    CANCEL_OK,
    CONSUMER_CANCELLED,
    DELIVERY
  }

  private final Type type;
  private final Throwable cause;
  private final String name;
  private final long requestId;
  private final Delivery delivery;

  private TransportEvent(
      Type type, Throwable cause, String name, long requestId, Delivery delivery) {
    this.type = type;
    this.cause = cause;
    this.name = name;
    this.requestId = requestId;
    this.delivery = delivery;
  }

  private static TransportEvent of(Type type) {
    return new TransportEvent(type, null, null, 0, null);
  }

  static TransportEvent connectionOpened() {
    return of(Type.CONNECTION_OPENED);
  }

  static TransportEvent connectionOpenFailed(Throwable cause) {
    return new TransportEvent(Type.CONNECTION_OPEN_FAILED, cause, null, 0, null);
  }

  /**
   * Connection closed.
   *
   * @param cause the cause, null if the application closed the connection
   * @return the event
   */
  static TransportEvent connectionClosed(Throwable cause) {
    return new TransportEvent(Type.CONNECTION_CLOSED, cause, null, 0, null);
  }

  static TransportEvent channelOpened() {
    return of(Type.CHANNEL_OPENED);
  }

  /**
   * Channel closed.
   *
   * @param cause the cause, null if the application closed the channel
   * @return the event
   */
  static TransportEvent channelClosed(Throwable cause) {
    return new TransportEvent(Type.CHANNEL_CLOSED, cause, null, 0, null);
  }

  static TransportEvent exchangeDeclared() {
    return of(Type.EXCHANGE_DECLARED);
  }

  static TransportEvent queueDeclared(String queue) {
    return new TransportEvent(Type.QUEUE_DECLARED, null, queue, 0, null);
  }

  static TransportEvent queueBound(long requestId) {
    return new TransportEvent(Type.QUEUE_BOUND, null, null, requestId, null);
  }

  static TransportEvent qosSet() {
    return of(Type.QOS_SET);
  }

  static TransportEvent consumeStarted(String consumerTag) {
    return new TransportEvent(Type.CONSUME_STARTED, null, consumerTag, 0, null);
  }

  static TransportEvent cancelOk(String consumerTag) {
    return new TransportEvent(Type.CANCEL_OK, null, consumerTag, 0, null);
  }

  static TransportEvent consumerCancelled(String consumerTag) {
    return new TransportEvent(Type.CONSUMER_CANCELLED, null, consumerTag, 0, null);
  }

  static TransportEvent delivery(Delivery delivery) {
    return new TransportEvent(Type.DELIVERY, null, null, 0, delivery);
  }

  Type type() {
    return this.type;
  }

  Throwable cause() {
    return this.cause;
  }

  /**
   * Queue name or consumer tag, depending on the type.
   *
   * @return name
   */
  String name() {
    return this.name;
  }

  long requestId() {
    return this.requestId;
  }

  Delivery delivery() {
    return this.delivery;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("TransportEvent{type=").append(type);
    if (name != null) {
      builder.append(", name='").append(name).append('\'');
    }
    if (type == Type.QUEUE_BOUND) {
      builder.append(", requestId=").append(requestId);
    }
    if (delivery != null) {
      builder.append(", deliveryTag=").append(delivery.deliveryTag());
    }
    if (cause != null) {
      builder.append(", cause=").append(cause.getMessage());
    }
    return builder.append('}').toString();
  }
}
