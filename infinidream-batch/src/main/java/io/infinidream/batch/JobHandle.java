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

import io.infinidream.batch.materialize.MaterializedArtifact;

import static java.util.Objects.requireNonNull;

/**
 * A submitted job tracked until its artifact is materialized or the batch gives up on it.
 * <p>
 * Handles are owned and advanced by the polling thread of a {@link BatchOrchestrator}; they are
 * not thread-safe.
 * </p>
 */
public final class JobHandle {

  private final String handle;
  private final Combination combination;
  private HandleState state = HandleState.PENDING;
  private int failedAttempts;
  private MaterializedArtifact artifact;

  JobHandle(String handle, Combination combination) {
    this.handle = requireNonNull(handle, "handle must not be null");
    this.combination = requireNonNull(combination, "combination must not be null");
  }

  /**
   * Returns the opaque handle the queue assigned to the job.
   *
   * @return the queue handle
   */
  public String handle() {
    return handle;
  }

  public Combination combination() {
    return combination;
  }

  public HandleState state() {
    return state;
  }

  /**
   * Returns how many materialization attempts failed for this job so far.
   *
   * @return the number of failed attempts
   */
  public int failedAttempts() {
    return failedAttempts;
  }

  /**
   * Returns the materialized artifact.
   *
   * @return the artifact, or {@code null} unless the handle is {@link HandleState#COMPLETED}
   */
  public MaterializedArtifact artifact() {
    return artifact;
  }

  void recordFailedAttempt() {
    failedAttempts++;
  }

  void complete(MaterializedArtifact artifact) {
    transition(HandleState.COMPLETED);
    this.artifact = requireNonNull(artifact, "artifact must not be null");
  }

  void timeOut() {
    transition(HandleState.TIMED_OUT);
  }

  private void transition(HandleState target) {
    if (state.isTerminal()) {
      throw new IllegalStateException("Handle " + handle + " is already " + state + ", cannot become " + target);
    }
    state = target;
  }

  @Override
  public String toString() {
    return "JobHandle{" +
      "handle='" + handle + '\'' +
      ", identifier=" + combination.identifier().asString() +
      ", name='" + combination.displayName() + '\'' +
      ", state=" + state +
      ", failedAttempts=" + failedAttempts +
      '}';
  }
}
