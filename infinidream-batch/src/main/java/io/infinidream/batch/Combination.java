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

import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.identity.JobIdentifier;

import static java.util.Objects.requireNonNull;

/**
 * One job of a batch: the iteration inputs and the identifier derived from them.
 *
 * @param context    the iteration inputs
 * @param identifier the dedup identifier of the job
 */
public record Combination(IterationContext context, JobIdentifier identifier) {

  public Combination {
    requireNonNull(context, "context must not be null");
    requireNonNull(identifier, "identifier must not be null");
  }

  public String displayName() {
    return context.displayName();
  }
}
