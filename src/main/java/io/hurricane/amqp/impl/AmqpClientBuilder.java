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

import io.hurricane.amqp.BackOffDelayPolicy;
import io.hurricane.amqp.Client;
import io.hurricane.amqp.ClientBuilder;
import io.hurricane.amqp.Consumer;
import io.hurricane.amqp.ExchangeType;
import io.hurricane.amqp.metrics.MetricsCollector;
import io.hurricane.amqp.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Builder to create a {@link Client} instance consuming from a RabbitMQ broker. */
public class AmqpClientBuilder implements ClientBuilder {

  static final String ENV_HOST = "AMQP_HOST";
  static final String ENV_PORT = "AMQP_PORT";
  static final String ENV_VIRTUAL_HOST = "AMQP_VHOST";
  static final String ENV_USERNAME = "AMQP_USER";
  static final String ENV_PASSWORD = "AMQP_PASSWORD";

  static final int DEFAULT_PORT = 5672;
  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final int DEFAULT_PREFETCH_COUNT = 1;
  static final Duration DEFAULT_RPC_TIMEOUT = Duration.ofSeconds(60);
  static final BackOffDelayPolicy DEFAULT_BACK_OFF_DELAY_POLICY =
      BackOffDelayPolicy.linear(Duration.ofSeconds(1), Duration.ofSeconds(30));

  private String queue;
  private String exchange;
  private ExchangeType exchangeType = ExchangeType.TOPIC;
  private String host;
  private Integer port;
  private String virtualHost;
  private String username;
  private String password;
  private Map<String, String> environment = Map.of();
  private int prefetchCount = DEFAULT_PREFETCH_COUNT;
  private Duration rpcTimeout = DEFAULT_RPC_TIMEOUT;
  private Consumer.MessageHandler messageHandler = AmqpConsumer.UNHANDLED_MESSAGE_HANDLER;
  private Consumer.RoutingKeyResolver routingKeyResolver = queue -> List.of();
  private final List<Consumer.StateListener> listeners = new ArrayList<>();
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private BackOffDelayPolicy backOffDelayPolicy = DEFAULT_BACK_OFF_DELAY_POLICY;
  private Transport.Factory transportFactory = RabbitMqTransport::new;

  public AmqpClientBuilder() {}

  @Override
  public AmqpClientBuilder queue(String queue) {
    this.queue = queue;
    return this;
  }

  @Override
  public AmqpClientBuilder exchange(String exchange) {
    this.exchange = exchange;
    return this;
  }

  @Override
  public AmqpClientBuilder exchangeType(ExchangeType type) {
    if (type == null) {
      throw new IllegalArgumentException("Exchange type cannot be null");
    }
    this.exchangeType = type;
    return this;
  }

  @Override
  public AmqpClientBuilder host(String host) {
    this.host = host;
    return this;
  }

  @Override
  public AmqpClientBuilder port(int port) {
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    this.port = port;
    return this;
  }

  @Override
  public AmqpClientBuilder virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return this;
  }

  @Override
  public AmqpClientBuilder username(String username) {
    this.username = username;
    return this;
  }

  @Override
  public AmqpClientBuilder password(String password) {
    this.password = password;
    return this;
  }

  @Override
  public AmqpClientBuilder environment(Map<String, String> environment) {
    this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    return this;
  }

  @Override
  public AmqpClientBuilder prefetchCount(int prefetchCount) {
    if (prefetchCount < 0) {
      throw new IllegalArgumentException("Prefetch count must be positive or 0");
    }
    this.prefetchCount = prefetchCount;
    return this;
  }

  @Override
  public AmqpClientBuilder rpcTimeout(Duration rpcTimeout) {
    if (rpcTimeout == null || rpcTimeout.isNegative()) {
      throw new IllegalArgumentException("RPC timeout must be positive or 0");
    }
    this.rpcTimeout = rpcTimeout;
    return this;
  }

  @Override
  public AmqpClientBuilder messageHandler(Consumer.MessageHandler handler) {
    this.messageHandler = handler == null ? AmqpConsumer.UNHANDLED_MESSAGE_HANDLER : handler;
    return this;
  }

  @Override
  public AmqpClientBuilder routingKeyResolver(Consumer.RoutingKeyResolver resolver) {
    this.routingKeyResolver = resolver == null ? queue -> List.of() : resolver;
    return this;
  }

  @Override
  public AmqpClientBuilder listeners(Consumer.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public AmqpClientBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public AmqpClientBuilder backOffDelayPolicy(BackOffDelayPolicy policy) {
    this.backOffDelayPolicy = policy == null ? DEFAULT_BACK_OFF_DELAY_POLICY : policy;
    return this;
  }

  AmqpClientBuilder transportFactory(Transport.Factory transportFactory) {
    this.transportFactory = transportFactory;
    return this;
  }

  @Override
  public Client build() {
    return new AmqpClient(this.settings(), this.backOffDelayPolicy);
  }

  ConsumerSettings settings() {
    String effectiveHost = this.host == null ? this.environment.get(ENV_HOST) : this.host;
    if (effectiveHost == null || effectiveHost.isBlank()) {
      throw new IllegalStateException(
          "No broker host configured, set it on the builder or with " + ENV_HOST);
    }
    if (this.queue == null) {
      throw new IllegalStateException("No queue configured");
    }
    if (this.exchange == null || this.exchange.isEmpty()) {
      throw new IllegalStateException(
          "No exchange configured, the default exchange is not allowed");
    }
    int effectivePort = this.port == null ? environmentPort() : this.port;
    String effectiveVirtualHost =
        this.virtualHost == null
            ? this.environment.getOrDefault(ENV_VIRTUAL_HOST, DEFAULT_VIRTUAL_HOST)
            : this.virtualHost;
    String effectiveUsername =
        this.username == null ? this.environment.get(ENV_USERNAME) : this.username;
    String effectivePassword =
        this.password == null ? this.environment.get(ENV_PASSWORD) : this.password;
    return new ConsumerSettings(
        this.queue,
        this.exchange,
        this.exchangeType,
        effectiveHost,
        effectivePort,
        effectiveVirtualHost,
        effectiveUsername,
        effectivePassword,
        this.prefetchCount,
        this.rpcTimeout,
        this.messageHandler,
        this.routingKeyResolver,
        this.listeners,
        this.metricsCollector,
        this.transportFactory);
  }

  private int environmentPort() {
    String value = this.environment.get(ENV_PORT);
    if (value == null || value.isBlank()) {
      return DEFAULT_PORT;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(ENV_PORT + " is not a valid port: " + value, e);
    }
  }
}
