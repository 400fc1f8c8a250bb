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

/**
 * Asynchronous AMQP 0-9-1 operations for one connection with one channel.
 *
 * <p>Methods return immediately. Broker responses and notifications are reported as {@link
 * TransportEvent}s to the sink the transport has been created with, in the order they occur.
 * Closure events ({@link TransportEvent.Type#CONNECTION_CLOSED}, {@link
 * TransportEvent.Type#CHANNEL_CLOSED}) are reported at most once.
 */
interface Transport extends AutoCloseable {

  /**
   * Open the connection.
   *
   * <p>Reports {@link TransportEvent.Type#CONNECTION_OPENED} or {@link
   * TransportEvent.Type#CONNECTION_OPEN_FAILED}, then {@link TransportEvent.Type#CONNECTION_CLOSED}
   * when the opened connection closes, whatever the reason.
   */
  void open();

  /**
   * Open the channel.
   *
   * <p>Reports {@link TransportEvent.Type#CHANNEL_OPENED}, then {@link
   * TransportEvent.Type#CHANNEL_CLOSED} when the channel closes, whatever the reason.
   */
  void openChannel();

  /** Reports {@link TransportEvent.Type#EXCHANGE_DECLARED}. */
  void declareExchange(String exchange, String type);

  /** Reports {@link TransportEvent.Type#QUEUE_DECLARED} with the name of the queue. */
  void declareQueue(String queue);

  /**
   * Bind the queue to the exchange.
   *
   * <p>Reports {@link TransportEvent.Type#QUEUE_BOUND} with the request ID.
   *
   * @param requestId ID of the request
   * @param queue queue
   * @param exchange exchange
   * @param routingKey routing key, null to bind without routing key filter
   */
  void bindQueue(long requestId, String queue, String exchange, String routingKey);

  /** Reports {@link TransportEvent.Type#QOS_SET}. */
  void qos(int prefetchCount);

  /**
   * Start consuming.
   *
   * <p>Reports {@link TransportEvent.Type#CONSUME_STARTED} with the consumer tag, then a {@link
   * TransportEvent.Type#DELIVERY} for each message and {@link
   * TransportEvent.Type#CONSUMER_CANCELLED} if the broker cancels the consumer.
   */
  void consume(String queue);

  /** Reports {@link TransportEvent.Type#CANCEL_OK}. */
  void cancel(String consumerTag);

  void ack(long deliveryTag);

  void nack(long deliveryTag, boolean requeue);

  void closeChannel();

  void closeConnection();

  /** Release all the resources, without reporting events. */
  @Override
  void close();

  @FunctionalInterface
  interface Factory {

    Transport create(
        ConsumerSettings settings, java.util.function.Consumer<TransportEvent> eventSink, long id);
  }
}
