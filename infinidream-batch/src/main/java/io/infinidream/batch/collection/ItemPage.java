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

import java.util.List;

/**
 * One page of collection items.
 * <p>
 * A page may hold entries that are not items (e.g. nested collections); they count in
 * {@code entryCount} and {@code totalCount} but are not part of {@code items}.
 * </p>
 *
 * @param items      the items of this page
 * @param entryCount the number of entries the service returned for this page
 * @param totalCount the number of entries in the whole collection
 */
public record ItemPage(List<CollectionItem> items, int entryCount, int totalCount) {

  public ItemPage {
    items = items == null ? List.of() : List.copyOf(items);
    if (entryCount < items.size()) {
      throw new IllegalArgumentException("entryCount must be >= " + items.size() + ", got: " + entryCount);
    }
  }

  /**
   * Creates a page made of items only.
   */
  public static ItemPage of(List<CollectionItem> items, int totalCount) {
    var copy = items == null ? List.<CollectionItem>of() : items;
    return new ItemPage(copy, copy.size(), totalCount);
  }
}
