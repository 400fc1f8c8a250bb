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

import static io.hurricane.amqp.impl.ExceptionUtils.convert;
import static io.hurricane.amqp.impl.ExceptionUtils.convertShutdownSignal;
import static org.assertj.core.api.Assertions.assertThat;

import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQImpl;
import io.hurricane.amqp.AmqpException;
import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

public class ExceptionUtilsTest {

  @Test
  void convertTest() {
    assertThat(convert(new AuthenticationFailureException("ACCESS_REFUSED")))
        .isInstanceOf(AmqpException.AmqpSecurityException.class)
        .hasCauseInstanceOf(AuthenticationFailureException.class);
    assertThat(convert(new ConnectException("Connection refused")))
        .isInstanceOf(AmqpException.AmqpConnectionException.class)
        .hasCauseInstanceOf(ConnectException.class);
    assertThat(convert(new TimeoutException("handshake")))
        .isInstanceOf(AmqpException.AmqpTimeoutException.class);
    assertThat(convert(new IllegalStateException("")))
        .isInstanceOf(AmqpException.class)
        .hasCauseInstanceOf(IllegalStateException.class);

    AmqpException amqpException = new AmqpException.AmqpChannelException("already converted");
    assertThat(convert(amqpException)).isSameAs(amqpException);
  }

  @Test
  void shutdownSignals() {
    assertThat(convert(connectionClose(403, "ACCESS_REFUSED - access to vhost refused")))
        .isInstanceOf(AmqpException.AmqpSecurityException.class);
    assertThat(convert(connectionClose(320, "CONNECTION_FORCED - broker forced closure")))
        .isInstanceOf(AmqpException.AmqpConnectionException.class);
    assertThat(convert(channelClose(406, "PRECONDITION_FAILED - inequivalent arg 'type'")))
        .isInstanceOf(AmqpException.AmqpChannelException.class)
        .hasMessageContaining("PRECONDITION_FAILED");
    assertThat(convert(new IOException(channelClose(404, "NOT_FOUND - no queue 'orders'"))))
        .isInstanceOf(AmqpException.AmqpChannelException.class)
        .hasCauseInstanceOf(ShutdownSignalException.class);
  }

  @Test
  void applicationInitiatedShutdownShouldNotBeFailure() {
    ShutdownSignalException applicationClose =
        new ShutdownSignalException(
            true, true, new AMQImpl.Connection.Close(200, "OK", 0, 0), null);
    assertThat(convertShutdownSignal(applicationClose)).isNull();
    assertThat(convertShutdownSignal(null)).isNull();
    assertThat(convertShutdownSignal(connectionClose(320, "CONNECTION_FORCED")))
        .isInstanceOf(AmqpException.AmqpConnectionException.class);
  }

  static ShutdownSignalException connectionClose(int code, String text) {
    return new ShutdownSignalException(
        true, false, new AMQImpl.Connection.Close(code, text, 0, 0), null);
  }

  static ShutdownSignalException channelClose(int code, String text) {
    return new ShutdownSignalException(
        false, false, new AMQImpl.Channel.Close(code, text, 40, 10), null);
  }
}
