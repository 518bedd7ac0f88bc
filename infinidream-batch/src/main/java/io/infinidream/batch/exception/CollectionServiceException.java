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
 * Generic remote error raised by the collection service.
 * <p>
 * Carries the HTTP status code when the failure came from a response, or {@code 0} when the
 * request did not reach the service.
 * </p>
 */
public class CollectionServiceException extends BatchException {

  private final int statusCode;

  public CollectionServiceException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public CollectionServiceException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  public int statusCode() {
    return statusCode;
  }
}
