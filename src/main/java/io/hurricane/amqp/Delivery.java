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

import java.util.Map;

/**
 * A message delivered by the broker to a {@link Consumer}.
 *
 * <p>Property accessors return <code>null</code> when the publisher did not set the property.
 */
public interface Delivery {

  /**
   * The delivery tag, to use to acknowledge or reject the message.
   *
   * @return delivery tag
   */
  long deliveryTag();

  /**
   * Whether the message has been delivered before and not acknowledged.
   *
   * @return redelivered flag
   */
  boolean redelivered();

  /**
   * The exchange the message was published to.
   *
   * @return exchange name
   */
  String exchange();

  /**
   * The routing key the message was published with.
   *
   * @return routing key
   */
  String routingKey();

  String appId();

  String contentType();

  String contentEncoding();

  String messageId();

  String correlationId();

  /**
   * Message headers, empty if none.
   *
   * @return headers
   */
  Map<String, Object> headers();

  /**
   * The message body.
   *
   * @return body
   */
  byte[] body();
}
