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
 * Thrown when a completed job could not be downloaded, uploaded or stamped.
 * <p>
 * The handle returns to the pending set and materialization is attempted again on the next
 * poll cycle, until the batch deadline expires.
 * </p>
 */
public class MaterializationException extends BatchException {

  public MaterializationException(String message) {
    super(message);
  }

  public MaterializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
