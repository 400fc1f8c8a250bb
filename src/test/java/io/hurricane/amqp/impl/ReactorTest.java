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

import static io.hurricane.amqp.impl.TestUtils.await;
import static io.hurricane.amqp.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ReactorTest {

  ExecutorService executorService;
  Reactor reactor;

  @BeforeEach
  void init() {
    executorService = Executors.newCachedThreadPool();
    reactor = new Reactor("test");
  }

  @AfterEach
  void tearDown() {
    reactor.stop();
    executorService.shutdownNow();
  }

  @Test
  void tasksShouldRunInSubmissionOrder() {
    List<Integer> executed = new CopyOnWriteArrayList<>();
    IntStream.range(0, 100).forEach(i -> reactor.execute(() -> executed.add(i)));
    Future<?> loop = start();

    waitAtMost(() -> executed.size() == 100);
    assertThat(executed).isSorted().hasSize(100);
    reactor.stop();
    await(loop);
    assertThat(reactor.terminated()).isTrue();
  }

  @Test
  void tasksSubmittedFromLoopShouldNotRunReentrantly() {
    List<String> executed = new CopyOnWriteArrayList<>();
    reactor.execute(
        () -> {
          reactor.execute(() -> executed.add("inner"));
          executed.add("outer");
        });
    Future<?> loop = start();

    waitAtMost(() -> executed.size() == 2);
    assertThat(executed).containsExactly("outer", "inner");
    reactor.stop();
    await(loop);
  }

  @Test
  void failingTaskShouldNotStopLoop() {
    AtomicInteger counter = new AtomicInteger();
    reactor.execute(
        () -> {
          throw new IllegalStateException("task error");
        });
    reactor.execute(counter::incrementAndGet);
    Future<?> loop = start();

    waitAtMost(() -> counter.get() == 1);
    reactor.stop();
    await(loop);
  }

  @Test
  void timersShouldRunInDeadlineOrder() {
    List<String> executed = new CopyOnWriteArrayList<>();
    reactor.execute(
        () -> {
          reactor.schedule(Duration.ofMillis(200), () -> executed.add("late"));
          reactor.schedule(Duration.ofMillis(50), () -> executed.add("early"));
        });
    Future<?> loop = start();

    waitAtMost(() -> executed.size() == 2);
    assertThat(executed).containsExactly("early", "late");
    reactor.stop();
    await(loop);
  }

  @Test
  void cancelledTimerShouldNotRun() throws Exception {
    AtomicBoolean fired = new AtomicBoolean(false);
    CountDownLatch scheduled = new CountDownLatch(1);
    reactor.execute(
        () -> {
          Reactor.Timer timer = reactor.schedule(Duration.ofMillis(50), () -> fired.set(true));
          timer.cancel();
          scheduled.countDown();
        });
    Future<?> loop = start();

    await(scheduled);
    Thread.sleep(200);
    assertThat(fired).isFalse();
    reactor.stop();
    await(loop);
  }

  @Test
  void scheduleOutsideLoopShouldFail() {
    assertThatThrownBy(() -> reactor.schedule(Duration.ofMillis(10), () -> {}))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void executeAfterTerminationShouldBeRejected() {
    Future<?> loop = start();
    reactor.stop();
    await(loop);

    assertThat(reactor.execute(() -> {})).isFalse();
  }

  @Test
  void runShouldNotBeCalledTwice() {
    Future<?> loop = start();
    waitAtMost(() -> reactor.execute(() -> {}) && !loop.isDone());
    reactor.stop();
    await(loop);

    assertThatThrownBy(() -> reactor.run()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void stopFromLoopShouldExitAfterCurrentTask() {
    AtomicBoolean afterStop = new AtomicBoolean(false);
    reactor.execute(reactor::stop);
    reactor.execute(() -> afterStop.set(true));
    Future<?> loop = start();

    await(loop);
    assertThat(afterStop).isFalse();
  }

  @Test
  void inLoopThreadShouldBeTrueOnlyInLoop() {
    AtomicBoolean inLoop = new AtomicBoolean(false);
    reactor.execute(() -> inLoop.set(reactor.inLoopThread()));
    reactor.execute(reactor::stop);
    await(start());

    assertThat(inLoop).isTrue();
    assertThat(reactor.inLoopThread()).isFalse();
  }

  Future<?> start() {
    return executorService.submit(
        () -> {
          reactor.run();
          return null;
        });
  }
}
