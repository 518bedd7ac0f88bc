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
package io.infinidream.batch.result;

import static java.util.Objects.requireNonNull;

/**
 * Result of a finished job, ready to be materialized.
 *
 * @param handle            the queue handle of the job
 * @param artifactReference where the produced artifact can be retrieved
 * @param payload           the payload the reference was normalized from
 */
public record CompletionRecord(String handle, String artifactReference, CompletionPayload payload) {

  public CompletionRecord {
    requireNonNull(handle, "handle must not be null");
    requireNonNull(artifactReference, "artifactReference must not be null");
    requireNonNull(payload, "payload must not be null");
  }
}
