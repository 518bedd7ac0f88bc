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
import io.infinidream.batch.collection.CollectionService;
import io.infinidream.batch.config.BatchSettings;
import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.exception.ConfigException;
import io.infinidream.batch.materialize.SourceMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Expands {@link BatchSettings} into the cross product of a batch.
 * <ul>
 *   <li><strong>wan-i2v</strong>: every image of the image directory, sorted by file name,
 *       combined with every prompt suffix.</li>
 *   <li><strong>qwen-image</strong>: {@code num_generations} generations of the prompt.</li>
 *   <li><strong>uprez</strong>: every item of the source collection, except items whose
 *       description already carries the marker.</li>
 * </ul>
 */
public final class BatchPlanner {
  private static final Logger logger = LoggerFactory.getLogger(BatchPlanner.class);

  static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");

  private final BatchSettings settings;
  private final Path workerDirectory;
  private final CollectionService collectionService;

  /**
   * Creates a planner.
   *
   * @param settings          the batch settings
   * @param workerDirectory   the directory relative paths are resolved against
   * @param collectionService the collection service, may be {@code null} unless the batch reads
   *                          a source collection
   */
  public BatchPlanner(BatchSettings settings, Path workerDirectory, CollectionService collectionService) {
    this.settings = requireNonNull(settings, "settings must not be null");
    this.workerDirectory = requireNonNull(workerDirectory, "workerDirectory must not be null");
    this.collectionService = collectionService;
  }

  /**
   * Plans the batch.
   *
   * @return the plan
   * @throws ConfigException if the inputs of the batch cannot be found
   */
  public BatchPlan plan() {
    var plan = switch (settings.algorithm()) {
      case WAN_I2V -> BatchPlan.of(settings.algorithm(), settings.prompt(), imageContexts());
      case QWEN_IMAGE -> BatchPlan.of(settings.algorithm(), settings.prompt(), generationContexts());
      case UPREZ -> sourceItemPlan();
    };
    logger.info("Planned {} {} job(s)", plan.size(), settings.algorithm().tag());
    return plan;
  }

  private List<IterationContext> imageContexts() {
    var images = images();
    var combos = settings.combos();

    var contexts = new ArrayList<IterationContext>();
    for (var image : images) {
      var asset = new IterationContext.Asset(image.getFileName().toString(), assetReference(image));
      var stem = stem(image.getFileName().toString());
      for (int combo = 0; combo < combos.size(); combo++) {
        var displayName = combos.size() == 1 ? stem : stem + "_" + (combo + 1);
        contexts.add(IterationContext.forAsset(contexts.size() + 1, displayName, asset, combos.get(combo)));
      }
    }
    logger.info("Found {} image(s) and {} combo(s)", images.size(), combos.size());
    return contexts;
  }

  private List<Path> images() {
    var directory = resolve(settings.imagePath());
    if (!Files.isDirectory(directory)) {
      throw new ConfigException("Image directory not found: " + directory);
    }

    List<Path> images;
    try (var files = Files.list(directory)) {
      images = files.filter(Files::isRegularFile)
                    .filter(file -> IMAGE_EXTENSIONS.contains(extension(file.getFileName().toString())))
                    .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                    .toList();
    } catch (IOException e) {
      throw new ConfigException("Cannot list image directory " + directory, e);
    }

    if (images.isEmpty()) throw new ConfigException("No image files found in " + directory);
    return images;
  }

  private List<IterationContext> generationContexts() {
    int count = settings.numGenerations();
    var contexts = new ArrayList<IterationContext>();
    for (int index = 1; index <= count; index++) {
      var displayName = count > 1
        ? String.format("%s_%04d", settings.outputFilename(), index)
        : settings.outputFilename();
      contexts.add(IterationContext.forGeneration(index, displayName, null));
    }
    return contexts;
  }

  private BatchPlan sourceItemPlan() {
    if (collectionService == null) {
      throw new ConfigException("BACKEND_URL and API_KEY are required to read source collection " + settings.sourceCollectionUuid());
    }

    List<CollectionItem> items;
    try {
      items = collectionService.listAllItems(settings.sourceCollectionUuid());
    } catch (RuntimeException e) {
      throw new ConfigException("Cannot read source collection " + settings.sourceCollectionUuid() + ": " + e.getMessage(), e);
    }

    var marker = settings.marker() == null ? null : new SourceMarker(settings.marker());
    var contexts = new ArrayList<IterationContext>();
    int alreadyProcessed = 0;
    for (var item : items) {
      if (marker != null && marker.isMarked(item.description())) {
        logger.debug("Skipping source item {}: already marked '{}'", item.uuid(), marker.marker());
        alreadyProcessed++;
        continue;
      }
      var name = item.name() == null || item.name().isBlank() ? item.uuid() : item.name();
      contexts.add(IterationContext.forSourceItem(
        contexts.size() + 1,
        new IterationContext.SourceItem(item.uuid(), name, item.videoUrl())));
    }

    logger.info("Found {} source item(s), {} already processed", items.size(), alreadyProcessed);
    return BatchPlan.of(settings.algorithm(), settings.prompt(), contexts, alreadyProcessed);
  }

  private Path resolve(String path) {
    var candidate = Path.of(path);
    return candidate.isAbsolute() ? candidate : workerDirectory.resolve(candidate);
  }

  private String assetReference(Path image) {
    var absoluteImage = image.toAbsolutePath().normalize();
    var absoluteWorker = workerDirectory.toAbsolutePath().normalize();
    return absoluteImage.startsWith(absoluteWorker)
      ? absoluteWorker.relativize(absoluteImage).toString()
      : absoluteImage.toString();
  }

  private static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String stem(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? fileName : fileName.substring(0, dot);
  }
}
