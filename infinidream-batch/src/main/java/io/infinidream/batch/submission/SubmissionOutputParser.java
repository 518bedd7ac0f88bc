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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Optional;

/**
 * Extracts the job handle from the standard output of the submission command.
 * <p>
 * The command may print log lines before its result, so the output is scanned from the last
 * line backwards. The first line found that is a complete JSON object decides the outcome:
 * its {@value #HANDLE_FIELD} field, when present and non-blank, is the handle.
 * </p>
 */
final class SubmissionOutputParser {

  static final String HANDLE_FIELD = "jobId";

  private SubmissionOutputParser() {
  }

  static Optional<String> findHandle(String output) {
    if (output == null || output.isBlank()) return Optional.empty();

    var lines = output.strip().split("\\R");
    for (int i = lines.length - 1; i >= 0; i--) {
      var line = lines[i].strip();
      if (!line.startsWith("{") || !line.endsWith("}")) continue;

      var object = parseObject(line);
      if (object.isPresent()) return handleOf(object.get());
    }
    return Optional.empty();
  }

  private static Optional<JsonObject> parseObject(String line) {
    try {
      JsonElement element = JsonParser.parseString(line);
      return element.isJsonObject() ? Optional.of(element.getAsJsonObject()) : Optional.empty();
    } catch (JsonParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<String> handleOf(JsonObject object) {
    var handle = object.get(HANDLE_FIELD);
    if (handle == null || handle.isJsonNull() || !handle.isJsonPrimitive()) return Optional.empty();

    var value = handle.getAsString().strip();
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }
}
