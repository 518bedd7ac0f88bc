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
package io.infinidream.batch.materialize;

import io.infinidream.batch.identity.JobIdentifier;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a successful materialization. Exactly one of {@code itemUuid} and {@code localFile}
 * is set, depending on the {@link Destination}.
 *
 * @param identifier the job identifier
 * @param itemUuid   the created collection item, or {@code null}
 * @param localFile  the written file, or {@code null}
 */
public record MaterializedArtifact(JobIdentifier identifier, String itemUuid, Path localFile) {

  public MaterializedArtifact {
    requireNonNull(identifier, "identifier must not be null");
  }
}
