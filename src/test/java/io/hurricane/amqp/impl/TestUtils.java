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

import static org.assertj.core.api.Assertions.fail;

import com.rabbitmq.client.AMQP;
import io.hurricane.amqp.Consumer;
import io.hurricane.amqp.Delivery;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public abstract class TestUtils {

  static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_WAIT_TIME = Duration.ofMillis(50);

  private TestUtils() {}

  @FunctionalInterface
  public interface CallableBooleanSupplier {
    boolean getAsBoolean() throws Exception;
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, DEFAULT_WAIT_TIME, condition, null);
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition, Supplier<String> message) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, DEFAULT_WAIT_TIME, condition, message);
  }

  public static Duration waitAtMost(Duration timeout, CallableBooleanSupplier condition) {
    return waitAtMost(timeout, DEFAULT_WAIT_TIME, condition, null);
  }

  public static Duration waitAtMost(
      Duration timeout,
      Duration waitTime,
      CallableBooleanSupplier condition,
      Supplier<String> message) {
    long start = System.nanoTime();
    try {
      if (condition.getAsBoolean()) {
        return Duration.ZERO;
      }
      Duration waitedTime = Duration.ofNanos(System.nanoTime() - start);
      Exception exception = null;
      while (waitedTime.compareTo(timeout) <= 0) {
        Thread.sleep(waitTime.toMillis());
        waitedTime = waitedTime.plus(waitTime);
        start = System.nanoTime();
        try {
          if (condition.getAsBoolean()) {
            return waitedTime;
          }
          exception = null;
        } catch (Exception e) {
          exception = e;
        }
        waitedTime = waitedTime.plus(Duration.ofNanos(System.nanoTime() - start));
      }
      String msg;
      if (message == null) {
        msg = "Waited " + timeout.getSeconds() + " second(s), condition never got true";
      } else {
        msg = "Waited " + timeout.getSeconds() + " second(s), " + message.get();
      }
      if (exception == null) {
        fail(msg);
      } else {
        fail(msg, exception);
      }
      return waitedTime;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  static Future<?> start(ExecutorService executorService, Consumer consumer) {
    return executorService.submit(
        () -> {
          consumer.run();
          return null;
        });
  }

  static void await(Future<?> future) {
    try {
      future.get(DEFAULT_CONDITION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (Exception e) {
      fail("Consumer did not complete", e);
    }
  }

  static void await(CountDownLatch latch) {
    try {
      if (!latch.await(DEFAULT_CONDITION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        fail("Latch timed out");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  static Delivery delivery(long deliveryTag, String routingKey, String body) {
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder().appId("test-app").contentType("text/plain").build();
    return new AmqpDelivery(
        deliveryTag,
        false,
        "orders-x",
        routingKey,
        properties,
        body.getBytes(StandardCharsets.UTF_8));
  }
}
