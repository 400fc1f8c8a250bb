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

import io.hurricane.amqp.Consumer;
import io.hurricane.amqp.ExchangeType;
import io.hurricane.amqp.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;

/** Immutable settings shared by all the consumer instances of a client. */
final class ConsumerSettings {

  private final String queue;
  private final String exchange;
  private final ExchangeType exchangeType;
  private final String host;
  private final int port;
  private final String virtualHost;
  private final String username;
  private final String password;
  private final int prefetchCount;
  private final Duration rpcTimeout;
  private final Consumer.MessageHandler messageHandler;
  private final Consumer.RoutingKeyResolver routingKeyResolver;
  private final List<Consumer.StateListener> listeners;
  private final MetricsCollector metricsCollector;
  private final Transport.Factory transportFactory;

  ConsumerSettings(
      String queue,
      String exchange,
      ExchangeType exchangeType,
      String host,
      int port,
      String virtualHost,
      String username,
      String password,
      int prefetchCount,
      Duration rpcTimeout,
      Consumer.MessageHandler messageHandler,
      Consumer.RoutingKeyResolver routingKeyResolver,
      List<Consumer.StateListener> listeners,
      MetricsCollector metricsCollector,
      Transport.Factory transportFactory) {
    this.queue = queue;
    this.exchange = exchange;
    this.exchangeType = exchangeType;
    this.host = host;
    this.port = port;
    this.virtualHost = virtualHost;
    this.username = username;
    this.password = password;
    this.prefetchCount = prefetchCount;
    this.rpcTimeout = rpcTimeout;
    this.messageHandler = messageHandler;
    this.routingKeyResolver = routingKeyResolver;
    this.listeners = List.copyOf(listeners);
    this.metricsCollector = metricsCollector;
    this.transportFactory = transportFactory;
  }

  String queue() {
    return this.queue;
  }

  String exchange() {
    return this.exchange;
  }

  ExchangeType exchangeType() {
    return this.exchangeType;
  }

  String host() {
    return this.host;
  }

  int port() {
    return this.port;
  }

  String virtualHost() {
    return this.virtualHost;
  }

  String username() {
    return this.username;
  }

  String password() {
    return this.password;
  }

  int prefetchCount() {
    return this.prefetchCount;
  }

  Duration rpcTimeout() {
    return this.rpcTimeout;
  }

  Consumer.MessageHandler messageHandler() {
    return this.messageHandler;
  }

  Consumer.RoutingKeyResolver routingKeyResolver() {
    return this.routingKeyResolver;
  }

  List<Consumer.StateListener> listeners() {
    return this.listeners;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Transport.Factory transportFactory() {
    return this.transportFactory;
  }

  String label() {
    return this.host + ":" + this.port + this.virtualHost;
  }

  @Override
  public String toString() {
    return "ConsumerSettings{"
        + "queue='"
        + queue
        + '\''
        + ", exchange='"
        + exchange
        + '\''
        + ", exchangeType="
        + exchangeType
        + ", broker='"
        + label()
        + '\''
        + ", prefetchCount="
        + prefetchCount
        + '}';
  }
}
