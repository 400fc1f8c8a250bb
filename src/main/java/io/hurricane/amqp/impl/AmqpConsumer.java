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

import static io.hurricane.amqp.Consumer.State.BINDING;
import static io.hurricane.amqp.Consumer.State.CANCELLING;
import static io.hurricane.amqp.Consumer.State.CHANNEL_CLOSING;
import static io.hurricane.amqp.Consumer.State.CHANNEL_OPENING;
import static io.hurricane.amqp.Consumer.State.CLOSED;
import static io.hurricane.amqp.Consumer.State.CONNECTING;
import static io.hurricane.amqp.Consumer.State.CONNECTION_CLOSING;
import static io.hurricane.amqp.Consumer.State.CONSUMING;
import static io.hurricane.amqp.Consumer.State.EXCHANGE_DECLARING;
import static io.hurricane.amqp.Consumer.State.IDLE;
import static io.hurricane.amqp.Consumer.State.QUEUE_DECLARING;
import static io.hurricane.amqp.Consumer.State.SETTING_QOS;

import io.hurricane.amqp.AmqpException;
import io.hurricane.amqp.Consumer;
import io.hurricane.amqp.Delivery;
import io.hurricane.amqp.metrics.MetricsCollector;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer state machine.
 *
 * <p>All the state changes happen in the {@link Reactor} of the instance, the transport posts
 * its events to it. An instance runs once, the {@link AmqpClient} creates a new one to
 * reconnect.
 */
final class AmqpConsumer implements Consumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumer.class);

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  static final MessageHandler UNHANDLED_MESSAGE_HANDLER =
      (context, delivery) -> {
        LOGGER.error(
            "Received message # {} from {}: no message handler configured",
            delivery.deliveryTag(),
            delivery.appId());
        context.reject();
        throw new AmqpException.AmqpUnhandledDeliveryException(
            "No message handler configured, rejected delivery %d", delivery.deliveryTag());
      };

  private static final Map<State, Set<TransportEvent.Type>> EXPECTED_EVENTS;

  static {
    Map<State, Set<TransportEvent.Type>> expected = new EnumMap<>(State.class);
    for (State state : State.values()) {
      expected.put(state, EnumSet.noneOf(TransportEvent.Type.class));
    }
    expected.put(CONNECTING, EnumSet.of(TransportEvent.Type.CONNECTION_OPENED));
    expected.put(CHANNEL_OPENING, EnumSet.of(TransportEvent.Type.CHANNEL_OPENED));
    expected.put(EXCHANGE_DECLARING, EnumSet.of(TransportEvent.Type.EXCHANGE_DECLARED));
    expected.put(QUEUE_DECLARING, EnumSet.of(TransportEvent.Type.QUEUE_DECLARED));
    expected.put(BINDING, EnumSet.of(TransportEvent.Type.QUEUE_BOUND));
    expected.put(SETTING_QOS, EnumSet.of(TransportEvent.Type.QOS_SET));
    expected.put(
        CONSUMING,
        EnumSet.of(
            TransportEvent.Type.CONSUME_STARTED,
            TransportEvent.Type.DELIVERY,
            TransportEvent.Type.CONSUMER_CANCELLED));
    expected.put(
        CANCELLING,
        EnumSet.of(
            TransportEvent.Type.CANCEL_OK,
            TransportEvent.Type.DELIVERY,
            TransportEvent.Type.CONSUMER_CANCELLED));
    EXPECTED_EVENTS = Collections.unmodifiableMap(expected);
  }

  private final long id;
  private final ConsumerSettings settings;
  private final Reactor reactor;
  private final Transport transport;
  private final List<StateListener> listeners;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean ran = new AtomicBoolean(false);
  // request id -> routing key, null key for a binding without routing key
  private final Map<Long, String> pendingBinds = Collections.synchronizedMap(new LinkedHashMap<>());
  private volatile State state = IDLE;
  private volatile boolean shouldReconnect = false;
  private volatile boolean wasConsuming = false;
  private volatile boolean closing = false;
  private volatile boolean consuming = false;
  private volatile String consumerTag;
  private volatile Throwable failureCause;
  private volatile String queue;
  // accessed only in the reactor thread
  private boolean connectionOpen = false;
  private boolean channelOpen = false;
  private long bindRequestSequence = 0;
  private Reactor.Timer deadline;

  AmqpConsumer(ConsumerSettings settings) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.settings = settings;
    this.queue = settings.queue();
    this.reactor = new Reactor("hurricane-amqp-consumer-" + this.id);
    this.listeners = settings.listeners();
    this.metricsCollector = settings.metricsCollector();
    this.transport =
        settings
            .transportFactory()
            .create(settings, event -> this.reactor.execute(() -> dispatch(event)), this.id);
  }

  @Override
  public void run() throws InterruptedException {
    if (!this.ran.compareAndSet(false, true)) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Consumer %d has already run, create a new instance", this.id);
    }
    this.reactor.execute(this::connect);
    try {
      this.reactor.run();
    } finally {
      this.release();
    }
  }

  @Override
  public void stop() {
    if (!this.reactor.execute(this::doStop)) {
      this.closing = true;
    }
  }

  @Override
  public boolean shouldReconnect() {
    return this.shouldReconnect;
  }

  @Override
  public boolean wasConsuming() {
    return this.wasConsuming;
  }

  @Override
  public State state() {
    return this.state;
  }

  @Override
  public String consumerTag() {
    return this.consumerTag;
  }

  @Override
  public Throwable failureCause() {
    return this.failureCause;
  }

  long id() {
    return this.id;
  }

  String queue() {
    return this.queue;
  }

  Map<Long, String> pendingBinds() {
    synchronized (this.pendingBinds) {
      return new LinkedHashMap<>(this.pendingBinds);
    }
  }

  void dispatch(TransportEvent event) {
    LOGGER.debug("Consumer {} received {} in state {}", this.id, event, this.state);
    switch (event.type()) {
      case CONNECTION_OPEN_FAILED:
        onConnectionOpenFailed(event.cause());
        return;
      case CONNECTION_CLOSED:
        onConnectionClosed(event.cause());
        return;
      case CHANNEL_CLOSED:
        onChannelClosed(event.cause());
        return;
      default:
        break;
    }
    if (!EXPECTED_EVENTS.get(this.state).contains(event.type())) {
      LOGGER.debug(
          "Consumer {} ignoring unexpected event {} in state {}", this.id, event, this.state);
      return;
    }
    try {
      switch (event.type()) {
        case CONNECTION_OPENED:
          onConnectionOpened();
          break;
        case CHANNEL_OPENED:
          onChannelOpened();
          break;
        case EXCHANGE_DECLARED:
          onExchangeDeclared();
          break;
        case QUEUE_DECLARED:
          onQueueDeclared(event.name());
          break;
        case QUEUE_BOUND:
          onQueueBound(event.requestId());
          break;
        case QOS_SET:
          onQosSet();
          break;
        case CONSUME_STARTED:
          onConsumeStarted(event.name());
          break;
        case DELIVERY:
          onDelivery(event.delivery());
          break;
        case CONSUMER_CANCELLED:
          onConsumerCancelled(event.name());
          break;
        case CANCEL_OK:
          onCancelOk(event.name());
          break;
        default:
          throw new IllegalStateException("Unexpected event type: " + event.type());
      }
    } catch (RuntimeException e) {
      LOGGER.warn("Error while processing {} in consumer {}", event, this.id, e);
      failure(ExceptionUtils.convert(e));
      reconnect();
    }
  }

  private void connect() {
    LOGGER.info("Connecting to {}", this.settings.label());
    state(CONNECTING);
    armDeadline();
    this.transport.open();
  }

  private void onConnectionOpened() {
    LOGGER.info("Connection opened");
    this.connectionOpen = true;
    this.metricsCollector.openConnection();
    LOGGER.info("Creating a new channel");
    state(CHANNEL_OPENING);
    armDeadline();
    this.transport.openChannel();
  }

  private void onChannelOpened() {
    LOGGER.info("Channel opened");
    this.channelOpen = true;
    LOGGER.info("Declaring exchange: {}", this.settings.exchange());
    state(EXCHANGE_DECLARING);
    armDeadline();
    this.transport.declareExchange(
        this.settings.exchange(), this.settings.exchangeType().type());
  }

  private void onExchangeDeclared() {
    LOGGER.info("Exchange declared");
    LOGGER.info("Declaring queue {}", this.queue);
    state(QUEUE_DECLARING);
    armDeadline();
    this.transport.declareQueue(this.queue);
  }

  private void onQueueDeclared(String declaredQueue) {
    if (declaredQueue != null && !declaredQueue.isEmpty()) {
      this.queue = declaredQueue;
    }
    LOGGER.info("Binding to {}", this.queue);
    List<String> routingKeys = this.settings.routingKeyResolver().routingKeys(this.queue);
    state(BINDING);
    armDeadline();
    Map<Long, String> requests = new LinkedHashMap<>();
    if (routingKeys == null || routingKeys.isEmpty()) {
      requests.put(this.bindRequestSequence++, null);
    } else {
      for (String routingKey : routingKeys) {
        requests.put(this.bindRequestSequence++, routingKey);
      }
    }
    this.pendingBinds.putAll(requests);
    requests.forEach(
        (requestId, routingKey) ->
            this.transport.bindQueue(
                requestId, this.queue, this.settings.exchange(), routingKey));
  }

  private void onQueueBound(long requestId) {
    if (!this.pendingBinds.containsKey(requestId)) {
      LOGGER.debug("Consumer {} ignoring bind-ok for unknown request {}", this.id, requestId);
      return;
    }
    String routingKey = this.pendingBinds.remove(requestId);
    if (routingKey == null) {
      LOGGER.info("Queue bound: {}", this.queue);
    } else {
      LOGGER.info("Queue bound: {} with routing key {}", this.queue, routingKey);
    }
    if (this.pendingBinds.isEmpty()) {
      state(SETTING_QOS);
      armDeadline();
      this.transport.qos(this.settings.prefetchCount());
    }
  }

  private void onQosSet() {
    LOGGER.info("QOS set to: {}", this.settings.prefetchCount());
    LOGGER.info("Issuing consumer related RPC commands");
    state(CONSUMING);
    armDeadline();
    this.transport.consume(this.queue);
  }

  private void onConsumeStarted(String tag) {
    cancelDeadline();
    this.consumerTag = tag;
    this.consuming = true;
    this.wasConsuming = true;
    this.metricsCollector.openConsumer();
    LOGGER.info("Consumer {} consuming from {} with tag {}", this.id, this.queue, tag);
  }

  private void onDelivery(Delivery delivery) {
    this.metricsCollector.consume();
    DeliveryContext context = new DeliveryContext(delivery.deliveryTag());
    try {
      this.settings.messageHandler().handle(context, delivery);
    } catch (AmqpException.AmqpUnhandledDeliveryException e) {
      failure(e);
      doStop();
    } catch (Exception e) {
      LOGGER.error("Error in message handler for delivery {}", delivery.deliveryTag(), e);
    }
  }

  private void onConsumerCancelled(String tag) {
    LOGGER.info("Consumer was cancelled remotely, shutting down: {}", tag);
    failure(new AmqpException.AmqpChannelException("Consumer %s cancelled by the broker", tag));
    if (this.consuming) {
      this.consuming = false;
      this.metricsCollector.closeConsumer();
    }
    closeChannel();
  }

  private void onCancelOk(String tag) {
    cancelDeadline();
    if (this.consuming) {
      this.consuming = false;
      this.metricsCollector.closeConsumer();
    }
    LOGGER.info("The broker acknowledged the cancellation of the consumer: {}", tag);
    closeChannel();
  }

  private void onChannelClosed(Throwable cause) {
    this.channelOpen = false;
    if (this.consuming) {
      this.consuming = false;
      this.metricsCollector.closeConsumer();
    }
    if (this.closing) {
      LOGGER.info("Channel closed");
    } else {
      LOGGER.warn("Channel was closed: {}", Utils.exceptionMessage(cause));
      failure(
          cause == null
              ? new AmqpException.AmqpChannelException("Channel closed unexpectedly")
              : cause);
    }
    closeConnection();
  }

  private void onConnectionOpenFailed(Throwable cause) {
    LOGGER.error("Connection open failed: {}", Utils.exceptionMessage(cause));
    failure(
        cause == null
            ? new AmqpException.AmqpConnectionException("Connection open failed")
            : cause);
    reconnect();
  }

  private void onConnectionClosed(Throwable cause) {
    cancelDeadline();
    this.channelOpen = false;
    if (this.consuming) {
      this.consuming = false;
      this.metricsCollector.closeConsumer();
    }
    if (this.connectionOpen) {
      this.connectionOpen = false;
      this.metricsCollector.closeConnection();
    }
    if (this.closing) {
      this.reactor.stop();
    } else {
      LOGGER.warn("Connection closed, reconnect necessary: {}", Utils.exceptionMessage(cause));
      failure(
          cause == null
              ? new AmqpException.AmqpConnectionException("Connection closed unexpectedly")
              : cause);
      reconnect();
    }
  }

  private void closeChannel() {
    LOGGER.info("Closing the channel");
    state(CHANNEL_CLOSING);
    if (this.channelOpen) {
      this.transport.closeChannel();
    } else {
      closeConnection();
    }
  }

  private void closeConnection() {
    this.consuming = false;
    if (!this.connectionOpen || this.state == CONNECTION_CLOSING) {
      LOGGER.info("Connection is closing or already closed");
      if (!this.connectionOpen) {
        if (this.closing) {
          this.reactor.stop();
        } else {
          reconnect();
        }
      }
    } else {
      LOGGER.info("Closing connection");
      state(CONNECTION_CLOSING);
      this.transport.closeConnection();
    }
  }

  private void reconnect() {
    if (this.closing) {
      // no reconnection once stopping, the release aborts what is left
      this.reactor.stop();
      return;
    }
    this.shouldReconnect = true;
    doStop();
  }

  private void doStop() {
    if (this.closing) {
      return;
    }
    this.closing = true;
    LOGGER.info("Stopping");
    cancelDeadline();
    if (this.consuming) {
      LOGGER.info("Sending a Basic.Cancel command to the broker");
      state(CANCELLING);
      armDeadline();
      this.transport.cancel(this.consumerTag);
    } else {
      this.reactor.stop();
    }
  }

  private void armDeadline() {
    cancelDeadline();
    Duration timeout = this.settings.rpcTimeout();
    if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
      State armedState = this.state;
      this.deadline = this.reactor.schedule(timeout, () -> onDeadline(armedState, timeout));
    }
  }

  private void cancelDeadline() {
    if (this.deadline != null) {
      this.deadline.cancel();
      this.deadline = null;
    }
  }

  private void onDeadline(State armedState, Duration timeout) {
    this.deadline = null;
    if (this.closing) {
      LOGGER.warn(
          "No answer from the broker after {} ms while closing, releasing the consumer",
          timeout.toMillis());
      this.reactor.stop();
    } else {
      LOGGER.warn(
          "No answer from the broker after {} ms in state {}", timeout.toMillis(), armedState);
      failure(
          new AmqpException.AmqpTimeoutException(
              "No answer from the broker after %d ms in state %s",
              timeout.toMillis(), armedState));
      reconnect();
    }
  }

  private void failure(Throwable cause) {
    if (this.failureCause == null) {
      this.failureCause = cause;
    }
  }

  private void state(State newState) {
    State previousState = this.state;
    if (previousState != newState) {
      this.state = newState;
      if (!this.listeners.isEmpty()) {
        StateChange change = new StateChange(this.failureCause, previousState, newState);
        for (StateListener listener : this.listeners) {
          try {
            listener.handle(change);
          } catch (Exception e) {
            LOGGER.warn("Error in state listener of consumer {}", this.id, e);
          }
        }
      }
    }
  }

  private void release() {
    cancelDeadline();
    Utils.maybeClose(
        this.transport,
        e -> LOGGER.warn("Error while releasing transport of consumer {}", this.id, e));
    if (this.consuming) {
      this.consuming = false;
      this.metricsCollector.closeConsumer();
    }
    if (this.connectionOpen) {
      this.connectionOpen = false;
      this.metricsCollector.closeConnection();
    }
    this.closing = true;
    state(CLOSED);
    LOGGER.debug("Consumer {} released", this.id);
  }

  @Override
  public String toString() {
    return "AmqpConsumer{" + "id=" + id + ", queue='" + queue + '\'' + ", state=" + state + '}';
  }

  private final class StateChange implements StateContext {

    private final Throwable cause;
    private final State previous;
    private final State current;

    private StateChange(Throwable cause, State previous, State current) {
      this.cause = cause;
      this.previous = previous;
      this.current = current;
    }

    @Override
    public Consumer consumer() {
      return AmqpConsumer.this;
    }

    @Override
    public Throwable failureCause() {
      return this.cause;
    }

    @Override
    public State previousState() {
      return this.previous;
    }

    @Override
    public State currentState() {
      return this.current;
    }
  }

  private final class DeliveryContext implements Context {

    private final long deliveryTag;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private DeliveryContext(long deliveryTag) {
      this.deliveryTag = deliveryTag;
    }

    @Override
    public void acknowledge() {
      if (settle()) {
        transport.ack(this.deliveryTag);
        metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.ACKNOWLEDGED);
      }
    }

    @Override
    public void reject() {
      this.reject(false);
    }

    @Override
    public void reject(boolean requeue) {
      if (settle()) {
        transport.nack(this.deliveryTag, requeue);
        metricsCollector.consumeDisposition(
            requeue
                ? MetricsCollector.ConsumeDisposition.REQUEUED
                : MetricsCollector.ConsumeDisposition.REJECTED);
      }
    }

    @Override
    public Consumer consumer() {
      return AmqpConsumer.this;
    }

    private boolean settle() {
      if (this.settled.compareAndSet(false, true)) {
        return true;
      } else {
        LOGGER.debug("Delivery {} already settled", this.deliveryTag);
        return false;
      }
    }
  }
}
