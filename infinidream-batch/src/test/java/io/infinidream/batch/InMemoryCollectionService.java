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

import io.infinidream.batch.collection.Collection;
import io.infinidream.batch.collection.CollectionItem;
import io.infinidream.batch.collection.CollectionService;
import io.infinidream.batch.collection.ItemPage;
import io.infinidream.batch.collection.NewCollection;
import io.infinidream.batch.exception.CollectionServiceException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collection service keeping everything in memory, for orchestration tests.
 */
class InMemoryCollectionService implements CollectionService {

  private final Map<String, Collection> collections = new LinkedHashMap<>();
  private final Map<String, List<String>> entries = new LinkedHashMap<>();
  private final Map<String, CollectionItem> items = new LinkedHashMap<>();
  private final Map<String, String> entryItems = new LinkedHashMap<>();
  private final AtomicInteger sequence = new AtomicInteger();
  private final List<String> uploads = new ArrayList<>();

  synchronized Collection givenCollection(String uuid, String name) {
    var collection = new Collection(uuid, name, null, false);
    collections.put(uuid, collection);
    entries.put(uuid, new ArrayList<>());
    return collection;
  }

  synchronized CollectionItem givenItem(String collectionUuid, String name, String description, String videoUrl) {
    var uuid = "item-" + sequence.incrementAndGet();
    var entryId = "entry-" + sequence.get();
    var item = new CollectionItem(null, uuid, name, description, videoUrl);
    items.put(uuid, item);
    entryItems.put(entryId, uuid);
    entries(collectionUuid).add(entryId);
    return item;
  }

  synchronized List<CollectionItem> itemsOf(String collectionUuid) {
    return listItems(collectionUuid, Integer.MAX_VALUE, 0).items();
  }

  synchronized List<String> uploads() {
    return List.copyOf(uploads);
  }

  synchronized int collectionCount() {
    return collections.size();
  }

  @Override
  public synchronized Collection createCollection(NewCollection definition) {
    var uuid = "collection-" + sequence.incrementAndGet();
    var collection = new Collection(uuid, definition.name(), definition.description(), definition.nsfw());
    collections.put(uuid, collection);
    entries.put(uuid, new ArrayList<>());
    return collection;
  }

  @Override
  public synchronized Collection fetchCollection(String collectionUuid) {
    var collection = collections.get(collectionUuid);
    if (collection == null) throw new CollectionServiceException("GET /v1/playlist/" + collectionUuid + " failed with HTTP 404", 404);
    return collection;
  }

  @Override
  public synchronized ItemPage listItems(String collectionUuid, int take, int skip) {
    var ids = entries(collectionUuid);
    var page = new ArrayList<CollectionItem>();
    for (int i = skip; i < ids.size() && page.size() < take; i++) {
      var entryId = ids.get(i);
      var item = items.get(entryItems.get(entryId));
      page.add(new CollectionItem(entryId, item.uuid(), item.name(), item.description(), item.videoUrl()));
    }
    return ItemPage.of(page, ids.size());
  }

  @Override
  public synchronized CollectionItem addFile(String collectionUuid, Path file, String displayName) {
    uploads.add(displayName);
    return givenItem(collectionUuid, displayName, null, "https://cdn/" + file.getFileName());
  }

  @Override
  public synchronized CollectionItem fetchItem(String itemUuid) {
    var item = items.get(itemUuid);
    if (item == null) throw new CollectionServiceException("GET /v1/dream/" + itemUuid + " failed with HTTP 404", 404);
    return item;
  }

  @Override
  public synchronized void updateItemDescription(String itemUuid, String description) {
    var item = fetchItem(itemUuid);
    items.put(itemUuid, new CollectionItem(null, item.uuid(), item.name(), description, item.videoUrl()));
  }

  @Override
  public synchronized String addKeyframe(Path file, String name) {
    return "keyframe-" + sequence.incrementAndGet();
  }

  @Override
  public synchronized void linkKeyframe(String itemUuid, String keyframeUuid) {
    fetchItem(itemUuid);
  }

  @Override
  public synchronized void reorderItems(String collectionUuid, List<String> entryIds) {
    var current = entries(collectionUuid);
    if (!new ArrayList<>(entryIds).containsAll(current) || entryIds.size() != current.size()) {
      throw new CollectionServiceException("PUT /v1/playlist/" + collectionUuid + "/order failed with HTTP 400", 400);
    }
    current.clear();
    current.addAll(entryIds);
  }

  private List<String> entries(String collectionUuid) {
    var ids = entries.get(collectionUuid);
    if (ids == null) throw new CollectionServiceException("Collection " + collectionUuid + " not found", 404);
    return ids;
  }
}
