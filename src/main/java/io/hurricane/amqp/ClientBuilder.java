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

import io.hurricane.amqp.metrics.MetricsCollector;
import java.time.Duration;
import java.util.Map;

/** API to configure and create a {@link Client}. */
public interface ClientBuilder {

  /**
   * The queue to declare and consume from.
   *
   * @param queue queue name
   * @return this builder instance
   */
  ClientBuilder queue(String queue);

  /**
   * The exchange to declare and bind the queue to.
   *
   * @param exchange exchange name
   * @return this builder instance
   */
  ClientBuilder exchange(String exchange);

  /**
   * The type of the exchange.
   *
   * <p>Default is {@link ExchangeType#TOPIC}.
   *
   * @param type exchange type
   * @return this builder instance
   */
  ClientBuilder exchangeType(ExchangeType type);

  /**
   * The host to connect to.
   *
   * @param host broker host
   * @return this builder instance
   */
  ClientBuilder host(String host);

  /**
   * The port to connect to.
   *
   * <p>Default is 5672.
   *
   * @param port broker port
   * @return this builder instance
   */
  ClientBuilder port(int port);

  /**
   * The virtual host to connect to.
   *
   * <p>Default is <code>/</code>.
   *
   * @param virtualHost virtual host
   * @return this builder instance
   */
  ClientBuilder virtualHost(String virtualHost);

  /**
   * The username to use, no credentials are sent if not set.
   *
   * @param username username
   * @return this builder instance
   */
  ClientBuilder username(String username);

  /**
   * The password to use.
   *
   * @param password password
   * @return this builder instance
   */
  ClientBuilder password(String password);

  /**
   * Configuration from environment variables.
   *
   * <p>Supported variables: <code>AMQP_HOST</code>, <code>AMQP_PORT</code>, <code>AMQP_VHOST
   * </code>, <code>AMQP_USER</code>, <code>AMQP_PASSWORD</code>. Values set explicitly on the
   * builder take precedence.
   *
   * @param environment environment variables, usually {@link System#getenv()}
   * @return this builder instance
   */
  ClientBuilder environment(Map<String, String> environment);

  /**
   * The number of unacknowledged messages the broker can deliver to the consumer.
   *
   * <p>Default is 1.
   *
   * @param prefetchCount prefetch count
   * @return this builder instance
   */
  ClientBuilder prefetchCount(int prefetchCount);

  /**
   * Maximum time to wait for the broker to answer a step of the consumer handshake (connection,
   * declarations, bindings, QoS, consumption).
   *
   * <p>The consumer stops and asks for reconnection when the timeout expires. Default is 60
   * seconds, {@link Duration#ZERO} disables the timeout.
   *
   * @param rpcTimeout timeout
   * @return this builder instance
   */
  ClientBuilder rpcTimeout(Duration rpcTimeout);

  /**
   * The callback for inbound messages.
   *
   * <p>The default handler rejects messages and stops the consumer.
   *
   * @param handler message handler
   * @return this builder instance
   */
  ClientBuilder messageHandler(Consumer.MessageHandler handler);

  /**
   * The routing keys to bind the queue with.
   *
   * <p>The default resolver returns no keys: the queue is bound once without routing key filter.
   *
   * @param resolver routing key resolver
   * @return this builder instance
   */
  ClientBuilder routingKeyResolver(Consumer.RoutingKeyResolver resolver);

  /**
   * Listeners of consumer state changes, registered on every consumer instance the client
   * creates.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ClientBuilder listeners(Consumer.StateListener... listeners);

  /**
   * Collector for metrics.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   */
  ClientBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Delay policy between a disconnection and the creation of a new consumer.
   *
   * <p>Default is {@link BackOffDelayPolicy#linear(Duration, Duration)} with a 1-second step and
   * a 30-second maximum.
   *
   * @param policy back-off delay policy
   * @return this builder instance
   */
  ClientBuilder backOffDelayPolicy(BackOffDelayPolicy policy);

  /**
   * Create the client.
   *
   * @return the client
   */
  Client build();
}
