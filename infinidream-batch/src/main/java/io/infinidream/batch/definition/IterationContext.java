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

import static java.util.Objects.requireNonNull;

/**
 * One point of a batch's cross product: what varies from one job to the next.
 * <p>
 * A context carries only the iteration-specific inputs. Fixed parameters come from the base
 * configuration and are merged in by {@link JobDescriptorBuilder}. Unused axes are {@code null}.
 * </p>
 *
 * @param index        1-based position of this context in the batch
 * @param displayName  name given to the materialized artifact
 * @param asset        the source asset, or {@code null}
 * @param promptSuffix text appended to the base prompt, or {@code null}
 * @param seed         explicit seed overriding the base configuration, or {@code null}
 * @param sourceItem   the collection item this job transforms, or {@code null}
 */
public record IterationContext(
  int index,
  String displayName,
  Asset asset,
  String promptSuffix,
  Integer seed,
  SourceItem sourceItem
) {

  public IterationContext {
    if (index < 1) throw new IllegalArgumentException("index must be >= 1, got: " + index);
    requireNonNull(displayName, "displayName must not be null");
  }

  /**
   * Context for an asset combined with a prompt suffix.
   */
  public static IterationContext forAsset(int index, String displayName, Asset asset, String promptSuffix) {
    requireNonNull(asset, "asset must not be null");
    return new IterationContext(index, displayName, asset, promptSuffix == null ? "" : promptSuffix, null, null);
  }

  /**
   * Context for the n-th generation of a single prompt.
   */
  public static IterationContext forGeneration(int index, String displayName, Integer seed) {
    return new IterationContext(index, displayName, null, null, seed, null);
  }

  /**
   * Context for a job that transforms an existing collection item.
   */
  public static IterationContext forSourceItem(int index, SourceItem sourceItem) {
    requireNonNull(sourceItem, "sourceItem must not be null");
    return new IterationContext(index, sourceItem.name(), null, null, null, sourceItem);
  }

  /**
   * A source asset.
   *
   * @param name      stable name of the asset, used for deduplication
   * @param reference what the submission command receives: a path relative to the worker
   *                  directory, an absolute path or a URL
   */
  public record Asset(String name, String reference) {
    public Asset {
      requireNonNull(name, "name must not be null");
      requireNonNull(reference, "reference must not be null");
    }
  }

  /**
   * An item of a source collection.
   *
   * @param uuid     the item uuid, or {@code null} when only a video URL is known
   * @param name     the item name
   * @param videoUrl the item video URL, or {@code null}
   */
  public record SourceItem(String uuid, String name, String videoUrl) {
    public SourceItem {
      requireNonNull(name, "name must not be null");
    }
  }
}
