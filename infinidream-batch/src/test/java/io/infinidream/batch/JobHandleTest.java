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

import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.identity.JobIdentifier;
import io.infinidream.batch.materialize.MaterializedArtifact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobHandleTest {

  private static final JobIdentifier ID = JobIdentifier.from("0123456789ab");

  private final JobHandle handle = new JobHandle("42", new Combination(IterationContext.forGeneration(1, "fox", null), ID));

  @Test
  @DisplayName("should complete pending handle after failed attempts")
  void should_complete_pending_handle_after_failed_attempts() {
    // When
    handle.recordFailedAttempt();
    handle.recordFailedAttempt();
    handle.complete(new MaterializedArtifact(ID, "d-1", null));

    // Then
    assertThat(handle.state()).isEqualTo(HandleState.COMPLETED);
    assertThat(handle.failedAttempts()).isEqualTo(2);
    assertThat(handle.artifact().itemUuid()).isEqualTo("d-1");
  }

  @Test
  @DisplayName("should not leave a terminal state")
  void should_not_leave_a_terminal_state() {
    // Given
    handle.timeOut();

    // When / Then
    assertThat(handle.state().isTerminal()).isTrue();
    assertThatThrownBy(() -> handle.complete(new MaterializedArtifact(ID, "d-1", null)))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("already TIMED_OUT");
    assertThat(handle.artifact()).isNull();
  }
}
