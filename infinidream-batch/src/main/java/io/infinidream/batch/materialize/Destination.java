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

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Where materialized artifacts end up.
 */
public sealed interface Destination {

  /**
   * A remote collection. Artifacts become new items tagged with their job identifier, which
   * makes the collection the dedup ledger of the batch.
   *
   * @param collectionUuid the collection
   * @param attachKeyframe whether the source asset of a job is registered as the starting
   *                       keyframe of the item it produced
   */
  record CollectionDestination(String collectionUuid, boolean attachKeyframe) implements Destination {
    public CollectionDestination {
      requireNonNull(collectionUuid, "collectionUuid must not be null");
    }
  }

  /**
   * A local folder. Files are named {@code <baseName>_<NNNN>.<ext>} after the iteration index,
   * or {@code <baseName>.<ext>} when not numbered.
   *
   * @param folder   the folder, created when missing
   * @param baseName the file name stem
   * @param numbered whether the iteration index is part of the file name
   */
  record LocalFolder(Path folder, String baseName, boolean numbered) implements Destination {
    public LocalFolder {
      requireNonNull(folder, "folder must not be null");
      requireNonNull(baseName, "baseName must not be null");
    }

    String fileName(int index, String extension) {
      return numbered
        ? String.format("%s_%04d.%s", baseName, index, extension)
        : baseName + "." + extension;
    }
  }
}
