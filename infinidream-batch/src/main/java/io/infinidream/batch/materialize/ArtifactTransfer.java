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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Retrieves produced artifacts from where the queue workers stored them.
 *
 * @see HttpArtifactTransfer
 */
@FunctionalInterface
public interface ArtifactTransfer {

  /**
   * Downloads an artifact into a local file.
   *
   * @param reference the artifact reference found in the completion record
   * @param target    the file to write; parent directories exist, the file is overwritten
   * @throws IOException if the artifact cannot be retrieved or written
   */
  void download(String reference, Path target) throws IOException;
}
