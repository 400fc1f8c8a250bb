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
import io.hurricane.amqp.Consumer;
import io.hurricane.amqp.metrics.MetricsCollector;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpClient implements Client {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClient.class);

  private final ConsumerSettings settings;
  private final BackOffDelayPolicy backOffDelayPolicy;
  private final MetricsCollector metricsCollector;
  private final Function<ConsumerSettings, Consumer> consumerFactory;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CountDownLatch closeLatch = new CountDownLatch(1);
  private volatile Consumer consumer;
  private volatile boolean consumerStarted = false;
  private volatile int reconnectAttempt = 0;
  private volatile Duration reconnectDelay = Duration.ZERO;

  AmqpClient(ConsumerSettings settings, BackOffDelayPolicy backOffDelayPolicy) {
    this(settings, backOffDelayPolicy, AmqpConsumer::new);
  }

  AmqpClient(
      ConsumerSettings settings,
      BackOffDelayPolicy backOffDelayPolicy,
      Function<ConsumerSettings, Consumer> consumerFactory) {
    this.settings = settings;
    this.backOffDelayPolicy = backOffDelayPolicy;
    this.metricsCollector = settings.metricsCollector();
    this.consumerFactory = consumerFactory;
    this.consumer = consumerFactory.apply(settings);
  }

  @Override
  public void run(boolean reconnect) {
    try {
      if (reconnect) {
        LOGGER.info("AMQP consumer running in auto-reconnect mode");
      }
      boolean keepRunning = true;
      while (keepRunning && !this.closed.get()) {
        Consumer current = this.startConsumer();
        if (this.closed.get()) {
          // close() may have stopped the previous instance
          current.stop();
        }
        try {
          current.run();
        } catch (InterruptedException e) {
          LOGGER.info("AMQP client interrupted, stopping consumer");
          current.stop();
          Thread.currentThread().interrupt();
          break;
        } catch (RuntimeException e) {
          LOGGER.error("Error while running AMQP consumer", e);
        }
        keepRunning = reconnect && this.maybeReconnect(current);
      }
    } finally {
      LOGGER.info("Terminating AMQP client");
    }
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing AMQP client");
      this.consumer.stop();
      this.closeLatch.countDown();
    }
  }

  Consumer consumer() {
    return this.consumer;
  }

  Duration reconnectDelay() {
    return this.reconnectDelay;
  }

  int reconnectAttempt() {
    return this.reconnectAttempt;
  }

  /**
   * Compute the delay before replacing a consumer that asked for reconnection.
   *
   * @param finished the consumer that stopped
   * @return the delay
   */
  Duration nextReconnectDelay(Consumer finished) {
    if (finished.wasConsuming()) {
      this.reconnectAttempt = 0;
    } else if (this.reconnectAttempt < Integer.MAX_VALUE) {
      this.reconnectAttempt++;
    }
    this.reconnectDelay = this.backOffDelayPolicy.delay(this.reconnectAttempt);
    return this.reconnectDelay;
  }

  private Consumer startConsumer() {
    if (this.consumerStarted) {
      this.consumer = this.consumerFactory.apply(this.settings);
    }
    this.consumerStarted = true;
    return this.consumer;
  }

  private boolean maybeReconnect(Consumer finished) {
    if (!finished.shouldReconnect() || this.closed.get()) {
      return false;
    }
    finished.stop();
    Duration delay = this.nextReconnectDelay(finished);
    LOGGER.warn(
        "Reconnecting after {} second(s) (cause: {})",
        delay.getSeconds(),
        Utils.exceptionMessage(finished.failureCause()));
    try {
      if (this.closeLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.debug("AMQP client closed while waiting to reconnect");
        return false;
      }
    } catch (InterruptedException e) {
      LOGGER.info("AMQP client interrupted while waiting to reconnect");
      Thread.currentThread().interrupt();
      return false;
    }
    if (this.closed.get()) {
      return false;
    }
    this.metricsCollector.reconnect();
    return true;
  }

  @Override
  public String toString() {
    return "AmqpClient{" + "settings=" + settings + ", closed=" + closed + '}';
  }
}
