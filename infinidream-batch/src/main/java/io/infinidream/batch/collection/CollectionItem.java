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
package io.infinidream.batch.collection;

import static java.util.Objects.requireNonNull;

/**
 * An item of a collection.
 * <p>
 * The service distinguishes the entry that places an item in a collection ({@code entryId},
 * used for ordering) from the item itself ({@code uuid}, used for metadata updates).
 * </p>
 *
 * @param entryId     identifier of the collection entry, may be {@code null} for items fetched directly
 * @param uuid        the item uuid
 * @param name        the display name, may be {@code null}
 * @param description the description metadata, may be {@code null}
 * @param videoUrl    URL of the item video, may be {@code null}
 */
public record CollectionItem(String entryId, String uuid, String name, String description, String videoUrl) {

  public CollectionItem {
    requireNonNull(uuid, "uuid must not be null");
  }

  /**
   * Returns the description, or an empty string when the item has none.
   *
   * @return the description, never {@code null}
   */
  public String descriptionOrEmpty() {
    return description == null ? "" : description;
  }
}
