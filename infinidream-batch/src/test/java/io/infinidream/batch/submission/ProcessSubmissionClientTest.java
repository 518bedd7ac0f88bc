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
package io.infinidream.batch.submission;

import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.definition.JobDescriptor;
import io.infinidream.batch.definition.JobDescriptorBuilder;
import io.infinidream.batch.exception.ConfigException;
import io.infinidream.batch.exception.HandleMissingException;
import io.infinidream.batch.exception.SubmissionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class ProcessSubmissionClientTest {

  @TempDir
  Path workDir;

  private JobDescriptor descriptor;

  @BeforeEach
  void setUp() {
    descriptor = new JobDescriptorBuilder(Algorithm.QWEN_IMAGE, Map.of("size", "1024*1024"), "a red fox")
      .build(IterationContext.forGeneration(1, "fox", null));
  }

  private ProcessSubmissionClient shell(String script, Duration timeout) {
    return new ProcessSubmissionClient(List.of("sh", "-c", script), workDir, timeout);
  }

  @Test
  @DisplayName("should write descriptor to stdin and return handle")
  void should_write_descriptor_to_stdin_and_return_handle() throws Exception {
    // Given
    var client = shell("cat > received.json; echo 'queued'; echo '{\"jobId\":\"7\"}'", Duration.ofSeconds(10));

    // When
    var handle = client.submit(descriptor);

    // Then
    assertThat(handle).isEqualTo("7");
    var received = Files.readString(workDir.resolve("received.json"), UTF_8);
    assertThat(received)
      .startsWith("{\"" + JobDescriptor.ALGORITHM_FIELD + "\":\"qwen-image\"")
      .contains("\"prompt\":\"a red fox\"")
      .contains("\"size\":\"1024*1024\"");
  }

  @Test
  @DisplayName("should report exit status and stderr on failure")
  void should_report_exit_status_and_stderr_on_failure() {
    // Given
    var client = shell("cat > /dev/null; echo 'queue unreachable' >&2; exit 3", Duration.ofSeconds(10));

    // When / Then
    assertThatThrownBy(() -> client.submit(descriptor))
      .isInstanceOfSatisfying(SubmissionException.class, e -> {
        assertThat(e.exitStatus()).isEqualTo(3);
        assertThat(e.errorText()).contains("queue unreachable");
      });
  }

  @Test
  @DisplayName("should fail with missing handle when output has no job id")
  void should_fail_with_missing_handle_when_output_has_no_job_id() {
    // Given
    var client = shell("cat > /dev/null; echo '{\"status\":\"queued\"}'", Duration.ofSeconds(10));

    // When / Then
    assertThatThrownBy(() -> client.submit(descriptor))
      .isInstanceOfSatisfying(HandleMissingException.class,
                              e -> assertThat(e.output()).contains("queued"));
  }

  @Test
  @DisplayName("should abort command exceeding timeout")
  void should_abort_command_exceeding_timeout() {
    // Given
    var client = shell("sleep 5", Duration.ofMillis(200));

    // When / Then
    assertThatThrownBy(() -> client.submit(descriptor))
      .isInstanceOfSatisfying(SubmissionException.class,
                              e -> assertThat(e.exitStatus()).isEqualTo(SubmissionException.NO_EXIT_STATUS))
      .hasMessageContaining("timed out");
  }

  @Test
  @DisplayName("should fail when command cannot be started")
  void should_fail_when_command_cannot_be_started() {
    // Given
    var client = new ProcessSubmissionClient(List.of("definitely-not-a-command-xyz"), workDir, Duration.ofSeconds(5));

    // When / Then
    assertThatThrownBy(() -> client.submit(descriptor))
      .isInstanceOf(SubmissionException.class)
      .hasMessageContaining("Failed to start submission command");
  }

  @Test
  @DisplayName("should require the built script for the default command")
  void should_require_the_built_script_for_the_default_command() throws Exception {
    // When / Then
    assertThatThrownBy(() -> ProcessSubmissionClient.forAlgorithm(Algorithm.WAN_I2V, workDir, Duration.ofSeconds(5)))
      .isInstanceOf(ConfigException.class)
      .hasMessageContaining("Submission script not built");

    // Given
    var script = workDir.resolve(Algorithm.WAN_I2V.defaultSubmissionScript());
    Files.createDirectories(script.getParent());
    Files.writeString(script, "");

    // When
    var client = ProcessSubmissionClient.forAlgorithm(Algorithm.WAN_I2V, workDir, Duration.ofSeconds(5));

    // Then
    assertThat(client.command()).containsExactly("node", script.toString());
  }
}
