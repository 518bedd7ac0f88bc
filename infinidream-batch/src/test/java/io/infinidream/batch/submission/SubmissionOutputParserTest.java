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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionOutputParserTest {

  @Test
  @DisplayName("should read handle from last json line after log lines")
  void should_read_handle_from_last_json_line_after_log_lines() {
    // Given
    var output = """
      Connecting to redis...
      {"level":"info","msg":"queued"}
      {"jobId":"42","queue":"wani2v"}
      """;

    // When
    var handle = SubmissionOutputParser.findHandle(output);

    // Then
    assertThat(handle).contains("42");
  }

  @Test
  @DisplayName("should skip trailing lines that are not json objects")
  void should_skip_trailing_lines_that_are_not_json_objects() {
    // Given
    var output = "{\"jobId\":\"17\"}\nDone.\n{not json}\n";

    // When
    var handle = SubmissionOutputParser.findHandle(output);

    // Then
    assertThat(handle).contains("17");
  }

  @Test
  @DisplayName("should stop at the last json object even without handle")
  void should_stop_at_the_last_json_object_even_without_handle() {
    // Given
    var output = "{\"jobId\":\"17\"}\n{\"status\":\"queued\"}\n";

    // When
    var handle = SubmissionOutputParser.findHandle(output);

    // Then
    assertThat(handle).isEmpty();
  }

  @Test
  @DisplayName("should accept numeric handles")
  void should_accept_numeric_handles() {
    assertThat(SubmissionOutputParser.findHandle("{\"jobId\": 1234}")).contains("1234");
  }

  @Test
  @DisplayName("should find nothing in empty output")
  void should_find_nothing_in_empty_output() {
    assertThat(SubmissionOutputParser.findHandle("")).isEmpty();
    assertThat(SubmissionOutputParser.findHandle(null)).isEmpty();
    assertThat(SubmissionOutputParser.findHandle("queued without id")).isEmpty();
  }
}
