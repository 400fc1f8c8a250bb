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
 * Supervisor of a {@link Consumer}: runs it and replaces it with a new instance after unexpected
 * disconnections.
 *
 * <p>Instances are created with a {@link ClientBuilder}.
 */
public interface Client extends AutoCloseable {

  /**
   * Run the consumer, blocking the calling thread.
   *
   * <p>Without reconnection, the consumer runs once and the method returns when it stops. With
   * reconnection, a consumer that stops because of an unexpected closure is replaced after a
   * delay computed by the {@link BackOffDelayPolicy}. The method returns when a consumer stops
   * without asking for reconnection, when the client is closed, or when the calling thread is
   * interrupted. It does not throw.
   *
   * <p>Interruption releases the running consumer at once: its connection is aborted, the
   * consumer is not cancelled and the channel and connection are not closed gracefully. Use
   * {@link #close()} from another thread for a graceful stop.
   *
   * @param reconnect whether to reconnect automatically
   */
  void run(boolean reconnect);

  /**
   * Stop the current consumer and prevent further reconnections.
   *
   * <p>Idempotent, can be called from any thread (e.g. a shutdown hook).
   */
  @Override
  void close();
}
