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
 * Thrown when the submission command rejects a job or cannot be run at all.
 * <p>
 * The failure is scoped to a single job: the orchestrator counts it as failed and keeps
 * submitting the rest of the batch.
 * </p>
 */
public class SubmissionException extends BatchException {

  /**
   * Exit status used when the submission process never produced one (start failure, timeout).
   */
  public static final int NO_EXIT_STATUS = -1;

  private final int exitStatus;
  private final String errorText;

  public SubmissionException(int exitStatus, String errorText) {
    super("Submission failed with exit status " + exitStatus + ": " + summarize(errorText));
    this.exitStatus = exitStatus;
    this.errorText = errorText == null ? "" : errorText;
  }

  public SubmissionException(String message, Throwable cause) {
    super(message, cause);
    this.exitStatus = NO_EXIT_STATUS;
    this.errorText = cause == null || cause.getMessage() == null ? message : cause.getMessage();
  }

  /**
   * Returns the exit status of the submission process.
   *
   * @return the exit status, or {@link #NO_EXIT_STATUS} if the process did not exit normally
   */
  public int exitStatus() {
    return exitStatus;
  }

  /**
   * Returns the text captured from the standard error stream of the submission process.
   *
   * @return the captured error text, never {@code null}
   */
  public String errorText() {
    return errorText;
  }

  private static String summarize(String errorText) {
    if (errorText == null || errorText.isBlank()) return "Unknown error";
    return errorText.strip();
  }
}
