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

import io.infinidream.batch.exception.CollectionServiceException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Remote service managing the destination collections of materialized artifacts.
 * <p>
 * All calls are synchronous. Any failure, whether the service answered with an error or could
 * not be reached, is reported as a {@link CollectionServiceException}.
 * </p>
 *
 * @see HttpCollectionService
 */
public interface CollectionService {

  /**
   * Page size used by {@link #listAllItems(String)}.
   */
  int PAGE_SIZE = 100;

  Collection createCollection(NewCollection definition);

  Collection fetchCollection(String collectionUuid);

  /**
   * Lists one page of the items of a collection.
   *
   * @param collectionUuid the collection
   * @param take           the maximum number of items to return
   * @param skip           the number of items to skip
   * @return the page
   */
  ItemPage listItems(String collectionUuid, int take, int skip);

  /**
   * Uploads a file as a new item appended to a collection.
   *
   * @param collectionUuid the collection
   * @param file           the file to upload
   * @param displayName    the item name, or {@code null} to let the service derive one
   * @return the created item
   */
  CollectionItem addFile(String collectionUuid, Path file, String displayName);

  CollectionItem fetchItem(String itemUuid);

  void updateItemDescription(String itemUuid, String description);

  /**
   * Registers an image as a keyframe asset.
   *
   * @param file the image
   * @param name the keyframe name
   * @return the keyframe uuid
   */
  String addKeyframe(Path file, String name);

  /**
   * Links a keyframe to an item as its starting frame.
   */
  void linkKeyframe(String itemUuid, String keyframeUuid);

  /**
   * Reorders the entries of a collection.
   *
   * @param collectionUuid the collection
   * @param entryIds       every entry id of the collection, in the desired order
   */
  void reorderItems(String collectionUuid, List<String> entryIds);

  /**
   * Lists every item of a collection, {@value #PAGE_SIZE} at a time.
   * <p>
   * Paging stops once the reported total of entries is reached or a short page is returned.
   * </p>
   *
   * @param collectionUuid the collection
   * @return all items, in collection order
   */
  default List<CollectionItem> listAllItems(String collectionUuid) {
    var all = new ArrayList<CollectionItem>();
    int skip = 0;
    while (true) {
      var page = listItems(collectionUuid, PAGE_SIZE, skip);
      all.addAll(page.items());
      skip += page.entryCount();

      if (page.entryCount() < PAGE_SIZE || skip >= page.totalCount()) return all;
    }
  }
}
