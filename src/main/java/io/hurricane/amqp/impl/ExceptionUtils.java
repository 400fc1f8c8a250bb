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

import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import io.hurricane.amqp.AmqpException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static AmqpException convert(Throwable e) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else if (e instanceof PossibleAuthenticationFailureException) {
      return new AmqpException.AmqpSecurityException(e.getMessage(), e);
    } else if (e instanceof ShutdownSignalException) {
      return convert((ShutdownSignalException) e);
    } else if (e instanceof IOException && e.getCause() instanceof ShutdownSignalException) {
      return convert((ShutdownSignalException) e.getCause());
    } else if (e instanceof TimeoutException) {
      return new AmqpException.AmqpTimeoutException(Utils.exceptionMessage(e), e);
    } else if (e instanceof IOException) {
      return new AmqpException.AmqpConnectionException(Utils.exceptionMessage(e), e);
    } else {
      return new AmqpException(e);
    }
  }

  static AmqpException convert(ShutdownSignalException e) {
    if (e.isHardError()) {
      if (isAccessRefused(e)) {
        return new AmqpException.AmqpSecurityException(e.getMessage(), e);
      }
      return new AmqpException.AmqpConnectionException(e.getMessage(), e);
    } else {
      return new AmqpException.AmqpChannelException(e.getMessage(), e);
    }
  }

  /**
   * Convert the shutdown signal of a connection or a channel.
   *
   * @param e the signal
   * @return the exception, null if the application closed the resource
   */
  static AmqpException convertShutdownSignal(ShutdownSignalException e) {
    if (e == null || e.isInitiatedByApplication()) {
      return null;
    } else {
      return convert(e);
    }
  }

  private static boolean isAccessRefused(ShutdownSignalException e) {
    // 403 ACCESS_REFUSED
    String message = e.getMessage();
    return message != null && message.contains("reply-code=403");
  }
}
