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
package io.infinidream.batch.cli;

import io.infinidream.batch.config.EnvironmentSettings;
import io.infinidream.batch.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchMainTest {

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(output, true, UTF_8);

  private int execute(String... args) {
    return BatchMain.execute(args, () -> EnvironmentSettings.from(Map.of()), out);
  }

  @Test
  @DisplayName("should parse run command with worker directory")
  void should_parse_run_command_with_worker_directory() {
    // When
    var command = BatchMain.Command.parse(new String[]{"run", "--worker-dir", "/opt/worker", "jobs/dawn.json"});

    // Then
    assertThat(command).isEqualTo(new BatchMain.Command.Run(Path.of("jobs/dawn.json"), Path.of("/opt/worker")));
  }

  @Test
  @DisplayName("should default worker directory to current directory")
  void should_default_worker_directory_to_current_directory() {
    assertThat(BatchMain.Command.parse(new String[]{"run", "job.json"}))
      .isEqualTo(new BatchMain.Command.Run(Path.of("job.json"), Path.of("")));
  }

  @Test
  @DisplayName("should parse inspect command with default queue")
  void should_parse_inspect_command_with_default_queue() {
    assertThat(BatchMain.Command.parse(new String[]{"inspect", "42"}))
      .isEqualTo(new BatchMain.Command.Inspect("42", BatchMain.DEFAULT_INSPECT_QUEUE));
    assertThat(BatchMain.Command.parse(new String[]{"inspect", "42", "qwenimage"}))
      .isEqualTo(new BatchMain.Command.Inspect("42", "qwenimage"));
  }

  @Test
  @DisplayName("should reject malformed command lines")
  void should_reject_malformed_command_lines() {
    assertThatThrownBy(() -> BatchMain.Command.parse(new String[0]))
      .isInstanceOf(ConfigException.class).hasMessage("No command given");
    assertThatThrownBy(() -> BatchMain.Command.parse(new String[]{"submit"}))
      .isInstanceOf(ConfigException.class).hasMessage("Unknown command: submit");
    assertThatThrownBy(() -> BatchMain.Command.parse(new String[]{"run", "a.json", "b.json"}))
      .isInstanceOf(ConfigException.class).hasMessage("run expects exactly one job file");
    assertThatThrownBy(() -> BatchMain.Command.parse(new String[]{"run", "a.json", "--worker-dir"}))
      .isInstanceOf(ConfigException.class).hasMessage("--worker-dir requires a directory");
    assertThatThrownBy(() -> BatchMain.Command.parse(new String[]{"inspect"}))
      .isInstanceOf(ConfigException.class).hasMessage("inspect expects a handle and an optional queue");
  }

  @Test
  @DisplayName("should exit with configuration status and usage on bad arguments")
  void should_exit_with_configuration_status_and_usage_on_bad_arguments() {
    // When
    int status = execute("frobnicate");

    // Then
    assertThat(status).isEqualTo(BatchMain.EXIT_CONFIG_ERROR);
    assertThat(output.toString(UTF_8))
      .contains("Error: Unknown command: frobnicate")
      .contains(BatchMain.Command.USAGE);
  }

  @Test
  @DisplayName("should exit with configuration status on invalid job file")
  void should_exit_with_configuration_status_on_invalid_job_file(@TempDir Path dir) throws Exception {
    // Given
    var job = Files.writeString(dir.resolve("job.json"), "{\"algorithm\":\"wan-i2v\"}");

    // When
    int status = execute("run", job.toString(), "--worker-dir", dir.toString());

    // Then
    assertThat(status).isEqualTo(BatchMain.EXIT_CONFIG_ERROR);
    assertThat(output.toString(UTF_8)).contains("image_path is required");
  }

  @Test
  @DisplayName("should exit with configuration status when submission script is not built")
  void should_exit_with_configuration_status_when_submission_script_is_not_built(@TempDir Path dir) throws Exception {
    // Given
    var job = Files.writeString(dir.resolve("job.json"), "{\"algorithm\":\"qwen-image\",\"prompt\":\"a red fox\"}");

    // When
    int status = execute("run", job.toString(), "--worker-dir", dir.toString());

    // Then
    assertThat(status).isEqualTo(BatchMain.EXIT_CONFIG_ERROR);
    assertThat(output.toString(UTF_8)).contains("Submission script not built");
  }
}
