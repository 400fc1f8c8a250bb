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
package io.hurricane.amqp.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a connection to the broker is opened. */
  void openConnection();

  /** Called when a connection to the broker is closed. */
  void closeConnection();

  /** Called when a {@link io.hurricane.amqp.Consumer} starts consuming. */
  void openConsumer();

  /** Called when a {@link io.hurricane.amqp.Consumer} stops consuming. */
  void closeConsumer();

  /** Called when a message is dispatched to the message handler. */
  void consume();

  /**
   * Called when a message is settled by the message handler.
   *
   * @param disposition disposition
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** Called when the client replaces a consumer after a disconnection. */
  void reconnect();

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link io.hurricane.amqp.Consumer.Context#acknowledge()} */
    ACKNOWLEDGED,
    /** see {@link io.hurricane.amqp.Consumer.Context#reject()} */
    REJECTED,
    /** see {@link io.hurricane.amqp.Consumer.Context#reject(boolean)} */
    REQUEUED
  }
}
