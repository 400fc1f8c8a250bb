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

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded task loop.
 *
 * <p>The loop runs on the thread that calls {@link #run()}. Tasks submitted with {@link
 * #execute(Runnable)} from any thread run one after the other in submission order, timers run on
 * the same thread. Tasks submitted from the loop thread are queued as well, they never run
 * re-entrantly.
 */
final class Reactor {

  private static final Logger LOGGER = LoggerFactory.getLogger(Reactor.class);
  private static final long IDLE_WAIT_IN_NANOS = TimeUnit.SECONDS.toNanos(1);
  private static final Runnable WAKE_UP = () -> {};

  private final String name;
  private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
  private final AtomicReference<Thread> loopThread = new AtomicReference<>();
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  private volatile boolean stopRequested = false;
  // accessed only in the loop thread
  private final PriorityQueue<Timer> timers = new PriorityQueue<>();
  private long timerSequence = 0;

  Reactor(String name) {
    this.name = name;
  }

  /**
   * Run the loop until {@link #stop()} is called.
   *
   * @throws InterruptedException if the loop thread is interrupted
   */
  void run() throws InterruptedException {
    if (!this.loopThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Reactor '" + this.name + "' has already been started");
    }
    LOGGER.debug("Starting reactor '{}'", this.name);
    try {
      while (!this.stopRequested) {
        Runnable task = this.taskQueue.poll(this.nextTimerDelayInNanos(), TimeUnit.NANOSECONDS);
        if (task != null) {
          this.runTask(task);
        }
        this.runDueTimers();
      }
    } finally {
      this.terminated.set(true);
      if (!this.taskQueue.isEmpty()) {
        LOGGER.debug(
            "Reactor '{}' stopped, dropping {} pending task(s)", this.name, this.taskQueue.size());
      }
      this.taskQueue.clear();
      this.timers.clear();
      LOGGER.debug("Reactor '{}' stopped", this.name);
    }
  }

  /**
   * Submit a task.
   *
   * @param task the task
   * @return false if the reactor is terminated and the task has been dropped
   */
  boolean execute(Runnable task) {
    if (this.terminated.get()) {
      LOGGER.debug("Reactor '{}' is terminated, dropping task", this.name);
      return false;
    } else {
      this.taskQueue.add(task);
      return true;
    }
  }

  /** Request the loop to stop, pending tasks are dropped. */
  void stop() {
    this.stopRequested = true;
    this.taskQueue.add(WAKE_UP);
  }

  /**
   * Schedule a task on the loop thread.
   *
   * <p>Must be called from the loop thread.
   *
   * @param delay delay before running the task
   * @param task the task
   * @return the timer, to cancel it
   */
  Timer schedule(Duration delay, Runnable task) {
    if (Thread.currentThread() != this.loopThread.get()) {
      throw new IllegalStateException("Timers must be scheduled from the reactor thread");
    }
    Timer timer = new Timer(System.nanoTime() + delay.toNanos(), this.timerSequence++, task);
    this.timers.add(timer);
    return timer;
  }

  boolean terminated() {
    return this.terminated.get();
  }

  boolean inLoopThread() {
    return Thread.currentThread() == this.loopThread.get();
  }

  private long nextTimerDelayInNanos() {
    Timer next = this.timers.peek();
    if (next == null) {
      return IDLE_WAIT_IN_NANOS;
    } else {
      return Math.max(0, next.deadline - System.nanoTime());
    }
  }

  private void runDueTimers() {
    long now = System.nanoTime();
    while (!this.stopRequested
        && !this.timers.isEmpty()
        && this.timers.peek().deadline - now <= 0) {
      Timer timer = this.timers.poll();
      if (!timer.cancelled) {
        this.runTask(timer.task);
      }
    }
  }

  private void runTask(Runnable task) {
    try {
      task.run();
    } catch (Exception e) {
      LOGGER.warn("Error during task processing in reactor '{}'", this.name, e);
    }
  }

  @Override
  public String toString() {
    return "Reactor{" + "name='" + name + '\'' + '}';
  }

  static final class Timer implements Comparable<Timer> {

    private final long deadline;
    private final long sequence;
    private final Runnable task;
    private volatile boolean cancelled = false;

    private Timer(long deadline, long sequence, Runnable task) {
      this.deadline = deadline;
      this.sequence = sequence;
      this.task = task;
    }

    void cancel() {
      this.cancelled = true;
    }

    @Override
    public int compareTo(Timer other) {
      int result = Long.compare(this.deadline - other.deadline, 0);
      return result == 0 ? Long.compare(this.sequence, other.sequence) : result;
    }
  }
}
