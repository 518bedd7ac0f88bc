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
package io.infinidream.batch.result;

import io.infinidream.batch.exception.TransientResultException;

import java.util.Map;

/**
 * Read access to the store where queue workers record job results.
 *
 * @see RedisResultStore
 */
public interface ResultStore {

  /**
   * Returns the field-value record stored under a key.
   *
   * @param key the namespaced key
   * @return the fields, empty if the key does not exist
   * @throws TransientResultException if the store could not be read
   */
  Map<String, String> fieldsOf(String key);
}
