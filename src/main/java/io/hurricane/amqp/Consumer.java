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
package io.hurricane.amqp;

import java.util.List;

/**
 * A consumer of one AMQP 0-9-1 queue, bound to one exchange, over one connection and one
 * channel.
 *
 * <p>A consumer instance is single-use: {@link #run()} goes through the whole lifecycle once
 * (connection, topology declaration, consumption, closing). The {@link Client} inspects {@link
 * #shouldReconnect()} and {@link #wasConsuming()} after it returns and creates a new instance to
 * reconnect.
 *
 * @see Client
 */
public interface Consumer {

  /**
   * Connect and consume until the consumer stops.
   *
   * <p>This method blocks, all the consumer callbacks (including the {@link MessageHandler}) run
   * on the calling thread. Transport errors do not escape, see {@link #shouldReconnect()} and
   * {@link #failureCause()}.
   *
   * @throws InterruptedException if the calling thread is interrupted
   */
  void run() throws InterruptedException;

  /**
   * Stop the consumer cleanly.
   *
   * <p>Idempotent, can be called from any thread.
   */
  void stop();

  /**
   * Whether the consumer stopped because of an unexpected closure and should be replaced.
   *
   * @return true if a reconnection is necessary
   */
  boolean shouldReconnect();

  /**
   * Whether the consumer reached consumption at some point of its lifetime.
   *
   * @return true if the consumer consumed
   */
  boolean wasConsuming();

  /**
   * The current state.
   *
   * @return current state
   */
  State state();

  /**
   * The consumer tag assigned by the broker, null until consumption starts.
   *
   * @return consumer tag
   */
  String consumerTag();

  /**
   * The cause of the last unexpected closure or fatal condition, can be null.
   *
   * @return failure cause
   */
  Throwable failureCause();

  /** Contract to process a message. */
  @FunctionalInterface
  interface MessageHandler {

    /**
     * Process a message.
     *
     * <p>The handler must acknowledge or reject the message before returning: the broker does not
     * deliver more messages than the prefetch count until then.
     *
     * @param context message context
     * @param delivery message
     */
    void handle(Context context, Delivery delivery);
  }

  /** Context for message processing. */
  interface Context {

    /** Acknowledge the message (<code>basic.ack</code>). */
    void acknowledge();

    /** Reject the message without requeueing it (<code>basic.nack</code>). */
    void reject();

    /**
     * Reject the message (<code>basic.nack</code>).
     *
     * @param requeue whether the broker should requeue the message
     */
    void reject(boolean requeue);

    /**
     * The consumer the message has been delivered to.
     *
     * @return the consumer
     */
    Consumer consumer();
  }

  /** Contract to compute the routing keys to bind the queue with. */
  @FunctionalInterface
  interface RoutingKeyResolver {

    /**
     * An empty list binds the queue to the exchange once, without routing key filter.
     *
     * @param queue the queue name
     * @return the routing keys
     */
    List<String> routingKeys(String queue);
  }

  /**
   * Listener for consumer state changes.
   *
   * @see ClientBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(StateContext context);
  }

  /** Context of a state change. */
  interface StateContext {

    Consumer consumer();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause
     */
    Throwable failureCause();

    State previousState();

    State currentState();
  }

  /** Consumer state, in lifecycle order. */
  enum State {
    IDLE,
    CONNECTING,
    CHANNEL_OPENING,
    EXCHANGE_DECLARING,
    QUEUE_DECLARING,
    BINDING,
    SETTING_QOS,
    CONSUMING,
    CANCELLING,
    CHANNEL_CLOSING,
    CONNECTION_CLOSING,
    CLOSED
  }
}
