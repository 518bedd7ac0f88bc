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
 * Parallelism of the submission phase.
 *
 * @param concurrency maximum number of submissions in flight (must be &gt; 0)
 */
public record SubmissionPolicy(int concurrency) {

  public static final SubmissionPolicy DEFAULT = new SubmissionPolicy(10);

  public SubmissionPolicy {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0, got: " + concurrency);
    }
  }
}
