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

import io.hurricane.amqp.Delivery;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory {@link Transport} answering requests like a well-behaved broker.
 *
 * <p>Requests are recorded as strings (e.g. <code>queue.bind orders orders-x null</code>). Some
 * requests can be scripted to fail with a channel closure or to get no answer at all.
 */
class FakeTransport implements Transport {

  static final String CONSUMER_TAG = "ctag-1";

  private final Consumer<TransportEvent> eventSink;
  private final List<String> requests = new CopyOnWriteArrayList<>();
  private final Map<String, Throwable> channelFailures = new ConcurrentHashMap<>();
  private final List<String> silentRequests = new CopyOnWriteArrayList<>();
  private final List<Long> heldBinds = new CopyOnWriteArrayList<>();
  private volatile Throwable connectionRefusal;
  private volatile boolean holdBinds = false;
  private volatile boolean connectionOpen = false;
  private volatile boolean channelOpen = false;
  private volatile boolean released = false;

  FakeTransport(Consumer<TransportEvent> eventSink) {
    this.eventSink = eventSink;
  }

  static Factory factory(List<FakeTransport> created, Consumer<FakeTransport> configurer) {
    return (settings, eventSink, id) -> {
      FakeTransport transport = new FakeTransport(eventSink);
      configurer.accept(transport);
      created.add(transport);
      return transport;
    };
  }

  static Factory factory(List<FakeTransport> created) {
    return factory(created, t -> {});
  }

  FakeTransport refuseConnection(Throwable cause) {
    this.connectionRefusal = cause;
    return this;
  }

  /** The broker closes the channel when it receives a request starting with the prefix. */
  FakeTransport closeChannelOn(String requestPrefix, Throwable cause) {
    this.channelFailures.put(requestPrefix, cause);
    return this;
  }

  /** The broker never answers requests starting with the prefix. */
  FakeTransport silentOn(String requestPrefix) {
    this.silentRequests.add(requestPrefix);
    return this;
  }

  FakeTransport holdBinds() {
    this.holdBinds = true;
    return this;
  }

  void completeBind(long requestId) {
    this.heldBinds.remove(requestId);
    emit(TransportEvent.queueBound(requestId));
  }

  List<Long> heldBinds() {
    return new ArrayList<>(this.heldBinds);
  }

  List<String> requests() {
    return new ArrayList<>(this.requests);
  }

  boolean released() {
    return this.released;
  }

  void deliver(Delivery delivery) {
    emit(TransportEvent.delivery(delivery));
  }

  /** Connection lost without closing handshake. */
  void dropConnection(Throwable cause) {
    if (this.connectionOpen) {
      this.connectionOpen = false;
      this.channelOpen = false;
      emit(TransportEvent.connectionClosed(cause));
    }
  }

  void cancelConsumer() {
    emit(TransportEvent.consumerCancelled(CONSUMER_TAG));
  }

  void emit(TransportEvent event) {
    this.eventSink.accept(event);
  }

  @Override
  public void open() {
    record("connection.open");
    if (this.connectionRefusal != null) {
      emit(TransportEvent.connectionOpenFailed(this.connectionRefusal));
    } else if (answer("connection.open")) {
      this.connectionOpen = true;
      emit(TransportEvent.connectionOpened());
    }
  }

  @Override
  public void openChannel() {
    if (request("channel.open")) {
      this.channelOpen = true;
      emit(TransportEvent.channelOpened());
    }
  }

  @Override
  public void declareExchange(String exchange, String type) {
    if (request("exchange.declare " + exchange + " " + type)) {
      emit(TransportEvent.exchangeDeclared());
    }
  }

  @Override
  public void declareQueue(String queue) {
    if (request("queue.declare " + queue)) {
      emit(TransportEvent.queueDeclared(queue));
    }
  }

  @Override
  public void bindQueue(long requestId, String queue, String exchange, String routingKey) {
    if (request("queue.bind " + queue + " " + exchange + " " + routingKey)) {
      if (this.holdBinds) {
        this.heldBinds.add(requestId);
      } else {
        emit(TransportEvent.queueBound(requestId));
      }
    }
  }

  @Override
  public void qos(int prefetchCount) {
    if (request("basic.qos " + prefetchCount)) {
      emit(TransportEvent.qosSet());
    }
  }

  @Override
  public void consume(String queue) {
    if (request("basic.consume " + queue)) {
      emit(TransportEvent.consumeStarted(CONSUMER_TAG));
    }
  }

  @Override
  public void cancel(String consumerTag) {
    if (request("basic.cancel " + consumerTag)) {
      emit(TransportEvent.cancelOk(consumerTag));
    }
  }

  @Override
  public void ack(long deliveryTag) {
    record("basic.ack " + deliveryTag);
  }

  @Override
  public void nack(long deliveryTag, boolean requeue) {
    record("basic.nack " + deliveryTag + " " + requeue);
  }

  @Override
  public void closeChannel() {
    record("channel.close");
    if (this.channelOpen) {
      this.channelOpen = false;
      emit(TransportEvent.channelClosed(null));
    }
  }

  @Override
  public void closeConnection() {
    record("connection.close");
    if (this.channelOpen) {
      this.channelOpen = false;
      emit(TransportEvent.channelClosed(null));
    }
    if (this.connectionOpen) {
      this.connectionOpen = false;
      emit(TransportEvent.connectionClosed(null));
    }
  }

  @Override
  public void close() {
    this.released = true;
    this.connectionOpen = false;
    this.channelOpen = false;
  }

  private void record(String request) {
    this.requests.add(request);
  }

  private boolean request(String request) {
    record(request);
    for (Map.Entry<String, Throwable> failure : this.channelFailures.entrySet()) {
      if (request.startsWith(failure.getKey())) {
        this.channelOpen = false;
        emit(TransportEvent.channelClosed(failure.getValue()));
        return false;
      }
    }
    return answer(request);
  }

  private boolean answer(String request) {
    return this.silentRequests.stream().noneMatch(request::startsWith);
  }
}
