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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

import static java.util.Objects.requireNonNull;

/**
 * Temporary directory bound to a scope.
 * <p>
 * The directory is created when the scope opens and deleted with all its content when the scope
 * closes, whatever happened in between. Deletion failures are logged, never thrown.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (var storage = ScopedStorage.open(root, "artifact-")) {
 *   var file = storage.resolve("video.mp4");
 *   // ...
 * } // directory deleted
 * }</pre>
 */
public final class ScopedStorage implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ScopedStorage.class);

  private final Path directory;

  private ScopedStorage(Path directory) {
    this.directory = directory;
  }

  /**
   * Opens a scope in a new temporary directory.
   *
   * @param root   the parent directory, or {@code null} for the system temporary directory
   * @param prefix the directory name prefix
   * @return the opened scope
   * @throws UncheckedIOException if the directory cannot be created
   */
  public static ScopedStorage open(Path root, String prefix) {
    requireNonNull(prefix, "prefix must not be null");
    try {
      var directory = root == null
        ? Files.createTempDirectory(prefix)
        : Files.createTempDirectory(Files.createDirectories(root), prefix);
      return new ScopedStorage(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temporary directory", e);
    }
  }

  public Path directory() {
    return directory;
  }

  public Path resolve(String fileName) {
    return directory.resolve(fileName);
  }

  @Override
  public void close() {
    if (!Files.exists(directory)) return;

    try (var walk = Files.walk(directory)) {
      walk.sorted(Comparator.reverseOrder())
          .forEach(path -> {
            try {
              Files.delete(path);
            } catch (IOException e) {
              logger.debug("Failed to delete: {}", path, e);
            }
          });
      logger.debug("Deleted temporary directory: {}", directory);
    } catch (IOException e) {
      logger.warn("Failed to delete temporary directory: {}", directory, e);
    }
  }
}
