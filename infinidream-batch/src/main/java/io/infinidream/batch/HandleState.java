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

/**
 * Lifecycle of a tracked job.
 * <p>
 * A handle starts {@link #PENDING} and reaches exactly one terminal state. A failed
 * materialization attempt leaves it pending; only the batch deadline moves it to
 * {@link #TIMED_OUT}.
 * </p>
 */
public enum HandleState {
  PENDING,
  COMPLETED,
  TIMED_OUT;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
