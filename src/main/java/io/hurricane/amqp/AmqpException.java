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

/**
 * Base exception of the consumer library.
 *
 * <p>Transport failures are converted to one of the subclasses and reported through {@link
 * Consumer#failureCause()}, they do not escape {@link Consumer#run()}.
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Authentication or authorization refused by the broker. */
  public static class AmqpSecurityException extends AmqpException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpSecurityException(Throwable cause) {
      super(cause);
    }
  }

  /** Broker unreachable or connection closed. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpConnectionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** Channel closed by the broker, usually after a protocol violation. */
  public static class AmqpChannelException extends AmqpException {

    public AmqpChannelException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpChannelException(String format, Object... args) {
      super(format, args);
    }
  }

  /** The broker did not answer a handshake request in time. */
  public static class AmqpTimeoutException extends AmqpException {

    public AmqpTimeoutException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpTimeoutException(String format, Object... args) {
      super(format, args);
    }
  }

  /** Raised by the default message handler, no handler has been configured. */
  public static class AmqpUnhandledDeliveryException extends AmqpException {

    public AmqpUnhandledDeliveryException(String format, Object... args) {
      super(format, args);
    }
  }

  public static class AmqpResourceInvalidStateException extends AmqpException {

    public AmqpResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AmqpResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
