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
 * A collection of the remote collection service.
 *
 * @param uuid        the collection uuid
 * @param name        the display name
 * @param description the description, may be {@code null}
 * @param nsfw        whether the collection is flagged as not safe for work
 */
public record Collection(String uuid, String name, String description, boolean nsfw) {

  public Collection {
    requireNonNull(uuid, "uuid must not be null");
  }
}
