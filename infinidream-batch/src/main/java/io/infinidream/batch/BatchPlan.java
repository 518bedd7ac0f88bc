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

import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.identity.IdentifierDeriver;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The full cross product of a batch, before deduplication.
 *
 * @param algorithm        the algorithm of every job
 * @param basePrompt       the prompt shared by every job, may be {@code null}
 * @param combinations     the jobs, in planning order
 * @param alreadyProcessed number of candidate inputs left out while planning because they were
 *                         already processed (e.g. source items carrying the marker)
 */
public record BatchPlan(Algorithm algorithm, String basePrompt, List<Combination> combinations, int alreadyProcessed) {

  public BatchPlan {
    requireNonNull(algorithm, "algorithm must not be null");
    combinations = List.copyOf(requireNonNull(combinations, "combinations must not be null"));
    if (alreadyProcessed < 0) {
      throw new IllegalArgumentException("alreadyProcessed must be >= 0, got: " + alreadyProcessed);
    }
  }

  /**
   * Plans a batch from its iterations, deriving the identifier of each.
   *
   * @param algorithm  the algorithm
   * @param basePrompt the shared prompt, may be {@code null}
   * @param contexts   the iterations
   * @return the plan
   */
  public static BatchPlan of(Algorithm algorithm, String basePrompt, List<IterationContext> contexts) {
    return of(algorithm, basePrompt, contexts, 0);
  }

  public static BatchPlan of(Algorithm algorithm, String basePrompt, List<IterationContext> contexts, int alreadyProcessed) {
    requireNonNull(contexts, "contexts must not be null");
    var combinations = contexts.stream()
                               .map(context -> new Combination(context, IdentifierDeriver.derive(algorithm, context, basePrompt)))
                               .toList();
    return new BatchPlan(algorithm, basePrompt, combinations, alreadyProcessed);
  }

  public int size() {
    return combinations.size();
  }
}
