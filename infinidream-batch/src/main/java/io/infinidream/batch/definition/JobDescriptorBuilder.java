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
package io.infinidream.batch.definition;

import io.infinidream.batch.exception.ConfigException;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Builds {@link JobDescriptor}s by merging a base configuration with one iteration's overrides.
 * <p>
 * The merge proceeds in three layers, each overriding the previous one:
 * </p>
 * <ol>
 *   <li>the algorithm defaults,</li>
 *   <li>the base parameters named in the algorithm allow-list (other base keys are ignored),</li>
 *   <li>the fields derived from the {@link IterationContext}.</li>
 * </ol>
 * <p>
 * After the merge every required group of the algorithm must be satisfied, otherwise a
 * {@link ConfigException} is thrown. A blank string counts as absent.
 * </p>
 *
 * <p><strong>Thread-safety:</strong> instances are immutable and may be shared by the
 * submission workers.</p>
 */
public final class JobDescriptorBuilder {

  private final Algorithm algorithm;
  private final Map<String, Object> baseParameters;
  private final String basePrompt;

  /**
   * Creates a builder for the given algorithm.
   *
   * @param algorithm      the algorithm every descriptor targets
   * @param baseParameters the fixed parameters of the batch; keys outside the allow-list are ignored
   * @param basePrompt     the prompt shared by every job, may be {@code null}
   */
  public JobDescriptorBuilder(Algorithm algorithm, Map<String, Object> baseParameters, String basePrompt) {
    this.algorithm = requireNonNull(algorithm, "algorithm must not be null");
    this.baseParameters = Map.copyOf(requireNonNull(baseParameters, "baseParameters must not be null"));
    this.basePrompt = basePrompt;
  }

  public Algorithm algorithm() {
    return algorithm;
  }

  /**
   * Builds the descriptor for one iteration.
   *
   * @param context the iteration overrides
   * @return the merged descriptor
   * @throws ConfigException if a required field is missing after the merge
   */
  public JobDescriptor build(IterationContext context) {
    requireNonNull(context, "context must not be null");

    var merged = new LinkedHashMap<String, Object>(algorithm.defaults());
    for (var name : algorithm.copiedParameters()) {
      var value = baseParameters.get(name);
      if (value != null) merged.put(name, value);
    }

    switch (algorithm) {
      case WAN_I2V -> {
        merged.put("prompt", composePrompt(basePrompt, context.promptSuffix()));
        if (context.asset() != null) merged.put("image", context.asset().reference());
      }
      case QWEN_IMAGE -> merged.put("prompt", composePrompt(basePrompt, context.promptSuffix()));
      case UPREZ -> {
        var source = context.sourceItem();
        if (source != null && source.uuid() != null) {
          merged.put("video_uuid", source.uuid());
        } else if (source != null && source.videoUrl() != null) {
          merged.put("video_url", source.videoUrl());
        }
      }
    }

    if (context.seed() != null) merged.put("seed", context.seed().longValue());

    validate(merged, context);
    return new JobDescriptor(algorithm, merged);
  }

  /**
   * Joins the base prompt and a suffix with a single space and trims the result.
   *
   * @param basePrompt the shared prompt, may be {@code null}
   * @param suffix     the iteration suffix, may be {@code null}
   * @return the composed prompt, possibly empty
   */
  static String composePrompt(String basePrompt, String suffix) {
    var base = basePrompt == null ? "" : basePrompt;
    var tail = suffix == null ? "" : suffix;
    return (base + " " + tail).strip();
  }

  private void validate(Map<String, Object> merged, IterationContext context) {
    for (var group : algorithm.requiredGroups()) {
      boolean satisfied = group.stream().anyMatch(field -> isPresent(merged.get(field)));
      if (!satisfied) {
        throw new ConfigException(
          "Missing required field " + String.join(" or ", group) + " for " + algorithm.tag() +
            " job #" + context.index() + " (" + context.displayName() + ")");
      }
    }
  }

  private static boolean isPresent(Object value) {
    if (value == null) return false;
    return !(value instanceof String text) || !text.isBlank();
  }
}
