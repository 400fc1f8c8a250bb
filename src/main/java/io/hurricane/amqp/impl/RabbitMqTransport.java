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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} on top of the RabbitMQ Java client.
 *
 * <p>The blocking calls of the client run on a single-thread executor, in submission order.
 * Automatic recovery of the client is disabled, a new transport is created on reconnection.
 */
final class RabbitMqTransport implements Transport {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitMqTransport.class);
  private static final int ABORT_TIMEOUT_IN_MS = 1000;

  private final long id;
  private final ConnectionFactory connectionFactory;
  private final Consumer<TransportEvent> eventSink;
  private final ExecutorService ioExecutor;
  private final AtomicBoolean connectionClosed = new AtomicBoolean(false);
  private final AtomicBoolean channelClosed = new AtomicBoolean(false);
  private final AtomicBoolean released = new AtomicBoolean(false);
  private volatile Connection connection;
  private volatile Channel channel;

  RabbitMqTransport(ConsumerSettings settings, Consumer<TransportEvent> eventSink, long id) {
    this(connectionFactory(settings), eventSink, id);
  }

  RabbitMqTransport(
      ConnectionFactory connectionFactory, Consumer<TransportEvent> eventSink, long id) {
    this.id = id;
    this.connectionFactory = connectionFactory;
    this.eventSink = eventSink;
    this.ioExecutor = Utils.singleThreadExecutor("hurricane-amqp-io-%d-", id);
  }

  static ConnectionFactory connectionFactory(ConsumerSettings settings) {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(settings.host());
    factory.setPort(settings.port());
    factory.setVirtualHost(settings.virtualHost());
    if (settings.username() != null) {
      factory.setUsername(settings.username());
      factory.setPassword(settings.password());
    }
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    return factory;
  }

  @Override
  public void open() {
    submit(
        "connection opening",
        () -> {
          Connection c;
          try {
            c = this.connectionFactory.newConnection("hurricane-amqp-consumer-" + this.id);
          } catch (Exception e) {
            LOGGER.debug("Connection attempt failed: {}", Utils.exceptionMessage(e));
            emit(TransportEvent.connectionOpenFailed(ExceptionUtils.convert(e)));
            return;
          }
          this.connection = c;
          if (this.released.get()) {
            // released while connecting, close() may not have seen the connection
            LOGGER.debug("Transport {} released during connection, aborting connection", this.id);
            c.abort(ABORT_TIMEOUT_IN_MS);
            return;
          }
          emit(TransportEvent.connectionOpened());
          // fires immediately if the connection is already closed
          c.addShutdownListener(this::connectionShutdown);
        });
  }

  @Override
  public void openChannel() {
    submit(
        "channel opening",
        () -> {
          Channel ch = this.connection.createChannel();
          if (ch == null) {
            throw new IllegalStateException("No channel available on the connection");
          }
          this.channel = ch;
          emit(TransportEvent.channelOpened());
          ch.addShutdownListener(this::channelShutdown);
        });
  }

  @Override
  public void declareExchange(String exchange, String type) {
    channelOperation(
        "exchange declaration",
        ch -> {
          ch.exchangeDeclare(exchange, type);
          emit(TransportEvent.exchangeDeclared());
        });
  }

  @Override
  public void declareQueue(String queue) {
    channelOperation(
        "queue declaration",
        ch -> {
          AMQP.Queue.DeclareOk declareOk = ch.queueDeclare(queue, false, false, false, null);
          emit(TransportEvent.queueDeclared(declareOk.getQueue()));
        });
  }

  @Override
  public void bindQueue(long requestId, String queue, String exchange, String routingKey) {
    channelOperation(
        "queue binding",
        ch -> {
          // the queue name is the binding key when there is no routing key filter
          ch.queueBind(queue, exchange, routingKey == null ? queue : routingKey);
          emit(TransportEvent.queueBound(requestId));
        });
  }

  @Override
  public void qos(int prefetchCount) {
    channelOperation(
        "basic.qos",
        ch -> {
          ch.basicQos(prefetchCount);
          emit(TransportEvent.qosSet());
        });
  }

  @Override
  public void consume(String queue) {
    channelOperation(
        "basic.consume",
        ch ->
            ch.basicConsume(
                queue,
                false,
                new DefaultConsumer(ch) {

                  @Override
                  public void handleConsumeOk(String consumerTag) {
                    super.handleConsumeOk(consumerTag);
                    emit(TransportEvent.consumeStarted(consumerTag));
                  }

                  @Override
                  public void handleCancelOk(String consumerTag) {
                    emit(TransportEvent.cancelOk(consumerTag));
                  }

                  @Override
                  public void handleCancel(String consumerTag) {
                    emit(TransportEvent.consumerCancelled(consumerTag));
                  }

                  @Override
                  public void handleDelivery(
                      String consumerTag,
                      Envelope envelope,
                      AMQP.BasicProperties properties,
                      byte[] body) {
                    emit(TransportEvent.delivery(new AmqpDelivery(envelope, properties, body)));
                  }
                }));
  }

  @Override
  public void cancel(String consumerTag) {
    channelOperation("basic.cancel", ch -> ch.basicCancel(consumerTag));
  }

  @Override
  public void ack(long deliveryTag) {
    channelOperation("basic.ack", ch -> ch.basicAck(deliveryTag, false));
  }

  @Override
  public void nack(long deliveryTag, boolean requeue) {
    channelOperation("basic.nack", ch -> ch.basicNack(deliveryTag, false, requeue));
  }

  @Override
  public void closeChannel() {
    submit(
        "channel closing",
        () -> {
          Channel ch = this.channel;
          if (ch != null && ch.isOpen()) {
            ch.close();
          }
        });
  }

  @Override
  public void closeConnection() {
    submit(
        "connection closing",
        () -> {
          Connection c = this.connection;
          if (c != null && c.isOpen()) {
            c.close();
          }
        });
  }

  @Override
  public void close() {
    if (this.released.compareAndSet(false, true)) {
      this.ioExecutor.shutdownNow();
      Connection c = this.connection;
      if (c != null && c.isOpen()) {
        LOGGER.debug("Aborting connection of transport {}", this.id);
        c.abort(ABORT_TIMEOUT_IN_MS);
      }
      try {
        if (!this.ioExecutor.awaitTermination(ABORT_TIMEOUT_IN_MS, TimeUnit.MILLISECONDS)) {
          LOGGER.debug("I/O executor of transport {} did not terminate in time", this.id);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void connectionShutdown(ShutdownSignalException cause) {
    if (this.connectionClosed.compareAndSet(false, true)) {
      emit(TransportEvent.connectionClosed(ExceptionUtils.convertShutdownSignal(cause)));
    }
  }

  private void channelShutdown(ShutdownSignalException cause) {
    if (this.channelClosed.compareAndSet(false, true)) {
      emit(TransportEvent.channelClosed(ExceptionUtils.convertShutdownSignal(cause)));
    }
  }

  private void emit(TransportEvent event) {
    LOGGER.trace("Transport {} emitting {}", this.id, event);
    this.eventSink.accept(event);
  }

  private void channelOperation(String description, ChannelOperation operation) {
    submit(
        description,
        () -> {
          Channel ch = this.channel;
          if (ch == null) {
            throw new IllegalStateException("Channel is not open");
          }
          operation.run(ch);
        });
  }

  private void submit(String description, IoOperation operation) {
    if (this.released.get()) {
      LOGGER.debug("Transport {} released, ignoring {}", this.id, description);
      return;
    }
    try {
      this.ioExecutor.execute(
          () -> {
            try {
              operation.run();
            } catch (Exception e) {
              onOperationFailure(description, e);
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Transport {} could not submit {}", this.id, description);
    }
  }

  private void onOperationFailure(String description, Exception e) {
    LOGGER.debug(
        "Operation '{}' failed on transport {}: {}",
        description,
        this.id,
        Utils.exceptionMessage(e));
    Channel ch = this.channel;
    Connection c = this.connection;
    if (ch != null && ch.isOpen()) {
      // the shutdown listener reports the closure
      try {
        ch.abort();
      } catch (IOException ex) {
        LOGGER.debug(
            "Error while aborting channel of transport {}: {}",
            this.id,
            Utils.exceptionMessage(ex));
      }
    } else if (ch == null && c != null && c.isOpen()) {
      c.abort(ABORT_TIMEOUT_IN_MS);
    } else if (c == null) {
      emit(TransportEvent.connectionOpenFailed(ExceptionUtils.convert(e)));
    }
  }

  @FunctionalInterface
  private interface IoOperation {

    void run() throws Exception;
  }

  @FunctionalInterface
  private interface ChannelOperation {

    void run(Channel channel) throws Exception;
  }
}
