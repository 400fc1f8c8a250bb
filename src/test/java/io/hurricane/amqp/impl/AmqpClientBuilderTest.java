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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.hurricane.amqp.ExchangeType;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AmqpClientBuilderTest {

  AmqpClientBuilder builder;

  @BeforeEach
  void init() {
    builder = new AmqpClientBuilder().queue("orders").exchange("orders-x");
  }

  @Test
  void defaults() {
    ConsumerSettings settings = builder.host("localhost").settings();
    assertThat(settings.port()).isEqualTo(5672);
    assertThat(settings.virtualHost()).isEqualTo("/");
    assertThat(settings.exchangeType()).isEqualTo(ExchangeType.TOPIC);
    assertThat(settings.prefetchCount()).isEqualTo(1);
    assertThat(settings.rpcTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThat(settings.username()).isNull();
    assertThat(settings.password()).isNull();
    assertThat(settings.routingKeyResolver().routingKeys("orders")).isEmpty();
    assertThat(settings.messageHandler()).isSameAs(AmqpConsumer.UNHANDLED_MESSAGE_HANDLER);
    assertThat(settings.label()).isEqualTo("localhost:5672/");
  }

  @Test
  void environmentShouldConfigureConnection() {
    ConsumerSettings settings =
        builder
            .environment(
                Map.of(
                    "AMQP_HOST", "rabbitmq.internal",
                    "AMQP_PORT", "5673",
                    "AMQP_VHOST", "billing",
                    "AMQP_USER", "consumer",
                    "AMQP_PASSWORD", "secret"))
            .settings();
    assertThat(settings.host()).isEqualTo("rabbitmq.internal");
    assertThat(settings.port()).isEqualTo(5673);
    assertThat(settings.virtualHost()).isEqualTo("billing");
    assertThat(settings.username()).isEqualTo("consumer");
    assertThat(settings.password()).isEqualTo("secret");
  }

  @Test
  void builderValuesShouldWinOverEnvironment() {
    ConsumerSettings settings =
        builder
            .host("localhost")
            .port(5674)
            .username("explicit")
            .environment(
                Map.of("AMQP_HOST", "rabbitmq.internal", "AMQP_PORT", "5673", "AMQP_USER", "env"))
            .settings();
    assertThat(settings.host()).isEqualTo("localhost");
    assertThat(settings.port()).isEqualTo(5674);
    assertThat(settings.username()).isEqualTo("explicit");
  }

  @Test
  void missingHostShouldFail() {
    assertThatThrownBy(() -> builder.build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("AMQP_HOST");
    assertThatThrownBy(() -> builder.environment(Map.of("AMQP_PORT", "5672")).build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void invalidPortShouldFail() {
    builder.environment(Map.of("AMQP_HOST", "localhost", "AMQP_PORT", "five"));
    assertThatThrownBy(() -> builder.settings())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("AMQP_PORT");
    assertThatThrownBy(() -> builder.port(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void defaultExchangeShouldBeRefused() {
    assertThatThrownBy(() -> builder.host("localhost").exchange("").build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void negativeSettingsShouldBeRefused() {
    assertThatThrownBy(() -> builder.prefetchCount(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.rpcTimeout(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void listenersShouldBeCopied() {
    builder.host("localhost").listeners(context -> {}, context -> {});
    ConsumerSettings settings = builder.settings();
    builder.listeners(context -> {});
    assertThat(settings.listeners()).hasSize(2);
    assertThat(builder.settings().listeners()).hasSize(3);
  }
}
