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
 * Base exception for all batch dispatch operations.
 * <p>
 * This unchecked exception is thrown when an error occurs while building, submitting, tracking
 * or materializing generation jobs. Subclasses identify which stage failed so that callers can
 * decide whether the failure aborts the batch or only the job at hand.
 * </p>
 *
 * @see RuntimeException
 */
public class BatchException extends RuntimeException {

  /**
   * Creates a new batch exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public BatchException(String message) {
    super(message);
  }

  /**
   * Creates a new batch exception with the specified error message and cause.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public BatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
