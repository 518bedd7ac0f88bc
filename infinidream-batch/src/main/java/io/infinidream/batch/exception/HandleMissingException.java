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
package io.infinidream.batch.exception;

/**
 * Thrown when the submission command accepted a job but its output did not contain a handle.
 * <p>
 * The job was queued and may still complete, but it cannot be tracked by this process. It is
 * reported at warning level and counted as untracked.
 * </p>
 */
public class HandleMissingException extends BatchException {

  private final String output;

  public HandleMissingException(String output) {
    super("Submission succeeded but no handle could be parsed from its output");
    this.output = output == null ? "" : output;
  }

  /**
   * Returns the standard output of the submission command.
   *
   * @return the captured output, never {@code null}
   */
  public String output() {
    return output;
  }
}
