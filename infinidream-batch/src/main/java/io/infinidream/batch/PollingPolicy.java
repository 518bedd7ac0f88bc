/*
 * Copyright © 2025 The infinidream-batch Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.infinidream.batch;

import java.time.Duration;

/**
 * Pace and bound of the completion polling phase.
 * <p>
 * Every cycle polls each pending job once, then sleeps for {@link #interval()}. Polling stops
 * when no job is pending or once {@link #maxWait()} has elapsed since the phase started; the
 * phase therefore never outlives {@code maxWait + interval} by more than one polling pass.
 * </p>
 *
 * @param interval pause between two polling cycles (must be &gt;= 0)
 * @param maxWait  wall-clock budget of the whole polling phase (must be &gt; 0)
 */
public record PollingPolicy(Duration interval, Duration maxWait) {

  /**
   * Ten seconds between cycles, one hour in total.
   */
  public static final PollingPolicy DEFAULT = new PollingPolicy(Duration.ofSeconds(10), Duration.ofHours(1));

  public PollingPolicy {
    if (interval == null || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be >= 0, got: " + interval);
    }
    if (maxWait == null || maxWait.isZero() || maxWait.isNegative()) {
      throw new IllegalArgumentException("maxWait must be > 0, got: " + maxWait);
    }
  }
}
