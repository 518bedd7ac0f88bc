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

import io.infinidream.batch.collection.CollectionItem;
import io.infinidream.batch.config.BatchSettings;
import io.infinidream.batch.config.CollectionSettings;
import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.definition.JobDescriptor;
import io.infinidream.batch.ledger.IdentifierTag;
import io.infinidream.batch.materialize.ArtifactTransfer;
import io.infinidream.batch.result.CompletionPoller;
import io.infinidream.batch.result.ResultStore;
import io.infinidream.batch.submission.SubmissionClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchRunnerTest {

  private static final PollingPolicy FAST = new PollingPolicy(Duration.ZERO, Duration.ofSeconds(30));

  @TempDir
  Path workerDirectory;

  private InMemoryCollectionService collectionService;
  private final List<JobDescriptor> submitted = new CopyOnWriteArrayList<>();
  private final Map<String, Map<String, String>> results = new ConcurrentHashMap<>();
  private SubmissionClient submissionClient;
  private ResultStore resultStore;
  private ArtifactTransfer transfer;

  @BeforeEach
  void setUp() throws IOException {
    collectionService = new InMemoryCollectionService();
    var handles = new AtomicInteger();
    submissionClient = descriptor -> {
      submitted.add(descriptor);
      var handle = Integer.toString(handles.incrementAndGet());
      results.put(CompletionPoller.keyOf(descriptor.algorithm().queueName(), handle),
                  Map.of("returnvalue", "\"https://cdn/" + handle + "\""));
      return handle;
    };
    resultStore = key -> results.getOrDefault(key, Map.of());
    transfer = (reference, target) -> Files.writeString(target, reference);

    var images = Files.createDirectories(workerDirectory.resolve("images"));
    Files.writeString(images.resolve("owl.png"), "owl");
    Files.writeString(images.resolve("lake.png"), "lake");
  }

  private BatchRunner runner(BatchSettings settings) {
    return new BatchRunner(settings, workerDirectory, submissionClient, resultStore, collectionService, transfer);
  }

  private static BatchSettings.Builder wan() {
    return BatchSettings.builder(Algorithm.WAN_I2V)
                        .prompt("a slow dolly shot")
                        .imagePath("images")
                        .pollingPolicy(FAST);
  }

  @Test
  @DisplayName("should publish a batch into a new collection sorted by name")
  void should_publish_a_batch_into_a_new_collection_sorted_by_name() {
    // Given
    var settings = wan().collection(new CollectionSettings("Dolly", null, false, null, true, true)).build();

    // When
    var report = runner(settings).run();

    // Then
    assertThat(report.submitted()).isEqualTo(2);
    assertThat(report.materialized()).isEqualTo(2);
    assertThat(collectionService.collectionCount()).isEqualTo(1);
    var items = collectionService.itemsOf("collection-1");
    assertThat(items).extracting(CollectionItem::name).containsExactly("lake", "owl");
    assertThat(items).allSatisfy(item -> assertThat(IdentifierTag.extract(item.description())).hasSize(1));
    assertThat(submitted).extracting(descriptor -> descriptor.parameter("image"))
                         .containsExactlyInAnyOrder(Path.of("images", "lake.png").toString(),
                                                    Path.of("images", "owl.png").toString());
  }

  @Test
  @DisplayName("should skip everything already recorded in the reused collection")
  void should_skip_everything_already_recorded_in_the_reused_collection() {
    // Given
    var first = wan().collection(new CollectionSettings("Dolly", null, false, null, false, false)).build();
    runner(first).run();
    var rerun = wan().collection(new CollectionSettings("Dolly", null, false, "collection-1", false, false)).build();

    // When
    var report = runner(rerun).run();

    // Then
    assertThat(report.submitted()).isZero();
    assertThat(report.skippedAsDuplicate()).isEqualTo(2);
    assertThat(collectionService.collectionCount()).isEqualTo(1);
    assertThat(collectionService.uploads()).hasSize(2);
  }

  @Test
  @DisplayName("should create a collection when the reused one cannot be fetched")
  void should_create_a_collection_when_the_reused_one_cannot_be_fetched() {
    // Given
    var settings = wan().collection(new CollectionSettings("Dolly", null, false, "gone", false, false)).build();

    // When
    var report = runner(settings).run();

    // Then
    assertThat(report.materialized()).isEqualTo(2);
    assertThat(collectionService.collectionCount()).isEqualTo(1);
    assertThat(collectionService.itemsOf("collection-1")).hasSize(2);
  }

  @Test
  @DisplayName("should save generated images into the output folder")
  void should_save_generated_images_into_the_output_folder() {
    // Given
    var settings = BatchSettings.builder(Algorithm.QWEN_IMAGE)
                                .prompt("a red fox")
                                .numGenerations(2)
                                .outputFilename("fox")
                                .pollingPolicy(FAST)
                                .build();

    // When
    var report = runner(settings).run();

    // Then
    assertThat(report.materialized()).isEqualTo(2);
    assertThat(workerDirectory.resolve("generated-images/fox_0001.png")).exists();
    assertThat(workerDirectory.resolve("generated-images/fox_0002.png")).exists();
    assertThat(submitted).extracting(descriptor -> descriptor.parameter("seed")).containsOnly(-1L);
  }

  @Test
  @DisplayName("should leave jobs outstanding without any destination")
  void should_leave_jobs_outstanding_without_any_destination() {
    // Given
    var settings = wan().build();
    var runner = new BatchRunner(settings, workerDirectory, submissionClient, resultStore, null, transfer);

    // When
    var report = runner.run();

    // Then
    assertThat(report.submitted()).isEqualTo(2);
    assertThat(report.outstanding()).hasSize(2);
    assertThat(report.materialized()).isZero();
  }

  @Test
  @DisplayName("should upscale unmarked source items and mark them")
  void should_upscale_unmarked_source_items_and_mark_them() {
    // Given
    collectionService.givenCollection("src", "Sources");
    var night = collectionService.givenItem("src", "Night drive", "city lights", "https://cdn/night.mp4");
    collectionService.givenItem("src", "Harbor", "harbor uprez", "https://cdn/harbor.mp4");
    var settings = BatchSettings.builder(Algorithm.UPREZ)
                                .sourceCollectionUuid("src")
                                .collection(new CollectionSettings("Upscaled", null, false, null, false, false))
                                .pollingPolicy(FAST)
                                .build();

    // When
    var report = runner(settings).run();

    // Then
    assertThat(report.planned()).isEqualTo(2);
    assertThat(report.skippedAsDuplicate()).isEqualTo(1);
    assertThat(report.materialized()).isEqualTo(1);
    assertThat(submitted).singleElement()
                         .satisfies(descriptor -> assertThat(descriptor.parameter("video_uuid")).isEqualTo(night.uuid()));
    assertThat(collectionService.fetchItem(night.uuid()).description()).isEqualTo("city lights uprez");
  }
}
