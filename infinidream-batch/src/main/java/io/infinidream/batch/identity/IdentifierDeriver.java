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
package io.infinidream.batch.identity;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.definition.IterationContext;

import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Computes {@link JobIdentifier}s from the inputs that make a job semantically distinct.
 * <p>
 * Only the distinguishing axis of each algorithm is hashed, never the whole descriptor:
 * </p>
 * <ul>
 *   <li><strong>wan-i2v</strong>: asset name and prompt suffix</li>
 *   <li><strong>qwen-image</strong>: base prompt and generation index</li>
 *   <li><strong>uprez</strong>: source item uuid (or video URL when the item has no uuid)</li>
 * </ul>
 * <p>
 * Seeds and other volatile parameters therefore never change an identifier. The digest is
 * SHA-256 over the UTF-8 inputs, each followed by a unit separator, truncated to
 * {@value JobIdentifier#LENGTH} hex characters.
 * </p>
 */
public final class IdentifierDeriver {

  private static final char SEPARATOR = '\u001F';

  private IdentifierDeriver() {
  }

  /**
   * Derives the identifier of one iteration of a batch.
   *
   * @param algorithm  the batch algorithm
   * @param context    the iteration
   * @param basePrompt the prompt shared by the batch, may be {@code null}
   * @return the identifier
   */
  public static JobIdentifier derive(Algorithm algorithm, IterationContext context, String basePrompt) {
    requireNonNull(algorithm, "algorithm must not be null");
    requireNonNull(context, "context must not be null");

    return derive(distinguishingInputs(algorithm, context, basePrompt));
  }

  /**
   * Derives an identifier from an ordered list of inputs.
   *
   * @param inputs the distinguishing inputs; {@code null} elements hash as empty strings
   * @return the identifier
   */
  public static JobIdentifier derive(List<String> inputs) {
    requireNonNull(inputs, "inputs must not be null");

    Hasher hasher = Hashing.sha256().newHasher();
    for (var input : inputs) {
      hasher.putString(input == null ? "" : input, UTF_8);
      hasher.putChar(SEPARATOR);
    }
    return JobIdentifier.from(hasher.hash().toString().substring(0, JobIdentifier.LENGTH));
  }

  static List<String> distinguishingInputs(Algorithm algorithm, IterationContext context, String basePrompt) {
    return switch (algorithm) {
      case WAN_I2V -> List.of(
        context.asset() == null ? "" : context.asset().name(),
        context.promptSuffix() == null ? "" : context.promptSuffix().strip());
      case QWEN_IMAGE -> List.of(
        basePrompt == null ? "" : basePrompt.strip(),
        Integer.toString(context.index()));
      case UPREZ -> List.of(sourceKey(context.sourceItem()));
    };
  }

  private static String sourceKey(IterationContext.SourceItem sourceItem) {
    if (sourceItem == null) return "";
    if (sourceItem.uuid() != null) return sourceItem.uuid();
    return sourceItem.videoUrl() == null ? "" : sourceItem.videoUrl();
  }
}
