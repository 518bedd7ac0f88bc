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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ScopedStorageTest {

  @TempDir
  Path root;

  @Test
  @DisplayName("should delete directory and content on close")
  void should_delete_directory_and_content_on_close() throws Exception {
    // Given
    Path directory;
    try (var storage = ScopedStorage.open(root, "artifact-")) {
      directory = storage.directory();
      Files.createDirectories(storage.resolve("nested"));
      Files.writeString(storage.resolve("nested/frame.png"), "png");
      Files.writeString(storage.resolve("video.mp4"), "mp4");

      // Then
      assertThat(directory).isDirectory().hasParent(root);
      assertThat(directory.getFileName().toString()).startsWith("artifact-");
    }

    // Then
    assertThat(directory).doesNotExist();
  }

  @Test
  @DisplayName("should delete directory when scope exits with an exception")
  void should_delete_directory_when_scope_exits_with_an_exception() {
    // Given
    Path[] directory = new Path[1];

    // When
    try (var storage = ScopedStorage.open(root, "artifact-")) {
      directory[0] = storage.directory();
      Files.writeString(storage.resolve("partial.mp4"), "partial");
      throw new IllegalStateException("download interrupted");
    } catch (Exception expected) {
      // Then
      assertThat(expected).hasMessage("download interrupted");
    }

    assertThat(directory[0]).doesNotExist();
  }

  @Test
  @DisplayName("should create missing root")
  void should_create_missing_root() {
    // Given
    var missing = root.resolve("scratch/deeper");

    // When
    try (var storage = ScopedStorage.open(missing, "artifact-")) {
      // Then
      assertThat(storage.directory()).isDirectory().hasParent(missing);
    }
  }
}
