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
package io.infinidream.batch.config;

/**
 * Destination collection of a batch.
 *
 * @param name           name of the collection to create when none is reused
 * @param description    description of the collection to create, may be {@code null}
 * @param nsfw           whether the created collection is flagged NSFW
 * @param existingUuid   collection to reuse, may be {@code null}
 * @param sortByName     whether the collection is reordered by item name after the batch
 * @param attachKeyframe whether source images are attached to the produced items as keyframes
 */
public record CollectionSettings(
  String name,
  String description,
  boolean nsfw,
  String existingUuid,
  boolean sortByName,
  boolean attachKeyframe
) {

  public CollectionSettings {
    if ((name == null || name.isBlank()) && (existingUuid == null || existingUuid.isBlank())) {
      throw new IllegalArgumentException("Either a name or an existing uuid is required for a destination collection");
    }
  }
}
