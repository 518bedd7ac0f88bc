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

import io.infinidream.batch.config.BatchSettings;
import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPlannerTest {

  @TempDir
  Path workerDirectory;

  private Path images(String... names) throws IOException {
    var directory = Files.createDirectories(workerDirectory.resolve("images"));
    for (var name : names) Files.writeString(directory.resolve(name), name);
    return directory;
  }

  @Test
  @DisplayName("should cross sorted images with combos")
  void should_cross_sorted_images_with_combos() throws IOException {
    // Given
    images("b.jpg", "a.PNG", "notes.txt", "c.webp");
    var settings = BatchSettings.builder(Algorithm.WAN_I2V)
                                .prompt("a slow dolly shot")
                                .imagePath("images")
                                .combos(List.of("at dawn", "at night"))
                                .build();

    // When
    var plan = new BatchPlanner(settings, workerDirectory, null).plan();

    // Then
    assertThat(plan.size()).isEqualTo(6);
    assertThat(plan.combinations()).extracting(Combination::displayName)
                                   .containsExactly("a_1", "a_2", "b_1", "b_2", "c_1", "c_2");
    var first = plan.combinations().get(0).context();
    assertThat(first.index()).isEqualTo(1);
    assertThat(first.asset()).isEqualTo(new IterationContext.Asset("a.PNG", Path.of("images", "a.PNG").toString()));
    assertThat(first.promptSuffix()).isEqualTo("at dawn");
    assertThat(plan.combinations().get(5).context().index()).isEqualTo(6);
  }

  @Test
  @DisplayName("should name artifacts after the image alone with a single combo")
  void should_name_artifacts_after_the_image_alone_with_a_single_combo() throws IOException {
    // Given
    var directory = images("lake.png");
    var settings = BatchSettings.builder(Algorithm.WAN_I2V)
                                .prompt("a calm lake")
                                .imagePath(directory.toString())
                                .build();

    // When
    var plan = new BatchPlanner(settings, workerDirectory, null).plan();

    // Then
    assertThat(plan.combinations()).singleElement()
                                   .extracting(Combination::displayName)
                                   .isEqualTo("lake");
  }

  @Test
  @DisplayName("should reject missing or empty image directory")
  void should_reject_missing_or_empty_image_directory() throws IOException {
    // Given
    var missing = BatchSettings.builder(Algorithm.WAN_I2V).imagePath("nowhere").build();
    images("readme.md");
    var empty = BatchSettings.builder(Algorithm.WAN_I2V).imagePath("images").build();

    // When / Then
    assertThatThrownBy(() -> new BatchPlanner(missing, workerDirectory, null).plan())
      .isInstanceOf(ConfigException.class)
      .hasMessageContaining("Image directory not found");
    assertThatThrownBy(() -> new BatchPlanner(empty, workerDirectory, null).plan())
      .isInstanceOf(ConfigException.class)
      .hasMessageContaining("No image files found");
  }

  @Test
  @DisplayName("should number generations of a single prompt")
  void should_number_generations_of_a_single_prompt() {
    // Given
    var settings = BatchSettings.builder(Algorithm.QWEN_IMAGE)
                                .prompt("a red fox")
                                .numGenerations(3)
                                .outputFilename("fox")
                                .build();

    // When
    var plan = new BatchPlanner(settings, workerDirectory, null).plan();

    // Then
    assertThat(plan.combinations()).extracting(Combination::displayName)
                                   .containsExactly("fox_0001", "fox_0002", "fox_0003");
    assertThat(plan.combinations()).extracting(Combination::identifier).doesNotHaveDuplicates();
  }

  @Test
  @DisplayName("should plan unmarked source items and count marked ones")
  void should_plan_unmarked_source_items_and_count_marked_ones() {
    // Given
    var service = new InMemoryCollectionService();
    service.givenCollection("src", "Sources");
    service.givenItem("src", "Night drive", "city lights", "https://cdn/1.mp4");
    service.givenItem("src", "Harbor", "harbor UPREZ", "https://cdn/2.mp4");
    var unnamed = service.givenItem("src", " ", null, "https://cdn/3.mp4");
    var settings = BatchSettings.builder(Algorithm.UPREZ).sourceCollectionUuid("src").build();

    // When
    var plan = new BatchPlanner(settings, workerDirectory, service).plan();

    // Then
    assertThat(plan.alreadyProcessed()).isEqualTo(1);
    assertThat(plan.combinations()).extracting(Combination::displayName)
                                   .containsExactly("Night drive", unnamed.uuid());
    assertThat(plan.combinations().get(1).context().sourceItem().videoUrl()).isEqualTo("https://cdn/3.mp4");
  }

  @Test
  @DisplayName("should require collection service for source collection")
  void should_require_collection_service_for_source_collection() {
    // Given
    var settings = BatchSettings.builder(Algorithm.UPREZ).sourceCollectionUuid("src").build();

    // When / Then
    assertThatThrownBy(() -> new BatchPlanner(settings, workerDirectory, null).plan())
      .isInstanceOf(ConfigException.class)
      .hasMessageContaining("BACKEND_URL and API_KEY");
    assertThatThrownBy(() -> new BatchPlanner(settings, workerDirectory, new InMemoryCollectionService()).plan())
      .isInstanceOf(ConfigException.class)
      .hasMessageContaining("Cannot read source collection src");
  }
}
