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

import java.time.Duration;

/**
 * Contract to determine the delay before a new consumer is created after a disconnection.
 *
 * <p>The attempt counter is reset to 0 when the previous consumer managed to consume, so a
 * policy should return its shortest delay for attempt 0.
 *
 * @see ClientBuilder#backOffDelayPolicy(BackOffDelayPolicy)
 */
public interface BackOffDelayPolicy {

  /**
   * Returns the delay to use for a given attempt.
   *
   * @param attempt number of consecutive attempts that did not reach consumption, 0 after a
   *     consumer that did
   * @return the delay
   */
  Duration delay(int attempt);

  /**
   * Policy with a delay growing by a fixed step on each attempt, up to a maximum.
   *
   * <p>With a 1-second step and a 30-second maximum, the delays are 0, 1, 2, ..., 30, 30, ...
   *
   * @param step the delay increment for each attempt
   * @param max the maximum delay
   * @return linear policy
   */
  static BackOffDelayPolicy linear(Duration step, Duration max) {
    return new LinearBackOffDelayPolicy(step, max);
  }

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedBackOffDelayPolicy(delay);
  }

  final class LinearBackOffDelayPolicy implements BackOffDelayPolicy {

    private final Duration step;
    private final Duration max;

    private LinearBackOffDelayPolicy(Duration step, Duration max) {
      if (step.isNegative() || max.isNegative()) {
        throw new IllegalArgumentException("Step and maximum delay must be positive");
      }
      this.step = step;
      this.max = max;
    }

    @Override
    public Duration delay(int attempt) {
      if (attempt <= 0) {
        return Duration.ZERO;
      } else if (this.step.isZero()) {
        return this.step;
      }
      // avoids overflow when the attempt counter keeps growing
      long maxAttempt = this.max.toNanos() / this.step.toNanos();
      if (attempt > maxAttempt) {
        return this.max;
      } else {
        Duration delay = this.step.multipliedBy(attempt);
        return delay.compareTo(this.max) > 0 ? this.max : delay;
      }
    }

    @Override
    public String toString() {
      return "LinearBackOffDelayPolicy{" + "step=" + step + ", max=" + max + '}';
    }
  }

  final class FixedBackOffDelayPolicy implements BackOffDelayPolicy {

    private final Duration delay;

    private FixedBackOffDelayPolicy(Duration delay) {
      this.delay = delay;
    }

    @Override
    public Duration delay(int attempt) {
      return this.delay;
    }

    @Override
    public String toString() {
      return "FixedBackOffDelayPolicy{" + "delay=" + delay + '}';
    }
  }
}
