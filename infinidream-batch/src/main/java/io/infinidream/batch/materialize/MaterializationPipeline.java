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

import io.infinidream.batch.collection.CollectionItem;
import io.infinidream.batch.collection.CollectionService;
import io.infinidream.batch.definition.IterationContext;
import io.infinidream.batch.exception.MaterializationException;
import io.infinidream.batch.identity.JobIdentifier;
import io.infinidream.batch.ledger.IdentifierTag;
import io.infinidream.batch.result.CompletionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Turns completion records into durable artifacts.
 * <p>
 * For each completed job the pipeline:
 * </p>
 * <ol>
 *   <li>downloads the artifact into a {@link ScopedStorage} opened for this attempt only,</li>
 *   <li>delivers it to the {@link Destination}: uploaded as a new collection item, optionally
 *       with the source asset as starting keyframe, or copied into a local folder,</li>
 *   <li>for collections, stamps the item description with the job's {@link IdentifierTag},
 *       which records the job in the dedup ledger,</li>
 *   <li>marks the source item when a {@link SourceMarker} is configured and the job derives
 *       from one,</li>
 *   <li>deletes the scoped storage, whatever the outcome.</li>
 * </ol>
 * <p>
 * A failure in steps 1 to 3 raises a {@link MaterializationException}; the caller keeps the job
 * pending and calls again on a later cycle. Work already done on the remote side is remembered
 * across attempts, so a retry after a failed stamp does not upload the artifact a second time.
 * A failure to mark the source item is only logged.
 * </p>
 *
 * <p><strong>Thread-safety:</strong> not thread-safe. A pipeline is driven by the single polling
 * thread of a batch.</p>
 */
public final class MaterializationPipeline {
  private static final Logger logger = LoggerFactory.getLogger(MaterializationPipeline.class);

  private final ArtifactTransfer transfer;
  private final CollectionService collectionService;
  private final Destination destination;
  private final String artifactExtension;
  private final SourceMarker sourceMarker;
  private final Path scratchRoot;
  private final Path assetRoot;
  private final Map<JobIdentifier, RemoteProgress> inProgress = new HashMap<>();

  private MaterializationPipeline(Builder builder) {
    this.transfer = builder.transfer;
    this.collectionService = builder.collectionService;
    this.destination = builder.destination;
    this.artifactExtension = builder.artifactExtension;
    this.sourceMarker = builder.sourceMarker;
    this.scratchRoot = builder.scratchRoot;
    this.assetRoot = builder.assetRoot;
  }

  /**
   * Creates a builder for a pipeline delivering to the given destination.
   *
   * @param transfer    retrieves artifacts
   * @param destination where artifacts are delivered
   * @return a new builder
   */
  public static Builder builder(ArtifactTransfer transfer, Destination destination) {
    return new Builder(transfer, destination);
  }

  public Destination destination() {
    return destination;
  }

  /**
   * Materializes the artifact of a completed job.
   *
   * @param context    the iteration that produced the job
   * @param identifier the job identifier
   * @param record     the completion record
   * @return the materialized artifact
   * @throws MaterializationException if the artifact could not be downloaded or delivered
   */
  public MaterializedArtifact materialize(IterationContext context, JobIdentifier identifier, CompletionRecord record) {
    requireNonNull(context, "context must not be null");
    requireNonNull(identifier, "identifier must not be null");
    requireNonNull(record, "record must not be null");

    MaterializedArtifact artifact;
    try (var storage = ScopedStorage.open(scratchRoot, "artifact-")) {
      var file = storage.resolve(safeFileName(context.displayName()) + "." + artifactExtension);
      transfer.download(record.artifactReference(), file);
      logger.debug("Downloaded artifact of job {} ({})", record.handle(), identifier.asString());

      if (destination instanceof Destination.CollectionDestination collection) {
        artifact = publish(collection, context, identifier, file);
      } else {
        artifact = store((Destination.LocalFolder) destination, context, identifier, file);
      }
    } catch (IOException | UncheckedIOException e) {
      throw new MaterializationException("Failed to materialize job " + record.handle() + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new MaterializationException("Failed to deliver job " + record.handle() + ": " + e.getMessage(), e);
    }

    markSource(context);
    return artifact;
  }

  private MaterializedArtifact publish(Destination.CollectionDestination collection,
                                       IterationContext context,
                                       JobIdentifier identifier,
                                       Path file) {
    var progress = inProgress.get(identifier);
    if (progress == null) {
      var item = collectionService.addFile(collection.collectionUuid(), file, context.displayName());
      logger.info("Added '{}' to collection {} as item {}", context.displayName(), collection.collectionUuid(), item.uuid());
      progress = new RemoteProgress(item);
      inProgress.put(identifier, progress);
    }

    if (collection.attachKeyframe() && !progress.keyframeLinked) {
      attachKeyframe(progress.item, context);
      progress.keyframeLinked = true;
    }

    collectionService.updateItemDescription(progress.item.uuid(), IdentifierTag.stamp(progress.item.description(), identifier));
    inProgress.remove(identifier);
    return new MaterializedArtifact(identifier, progress.item.uuid(), null);
  }

  private void attachKeyframe(CollectionItem item, IterationContext context) {
    var asset = context.asset();
    if (asset == null) return;

    var image = assetRoot.resolve(asset.reference());
    if (!Files.isRegularFile(image)) {
      logger.warn("Keyframe source {} is not a readable file, item {} keeps no keyframe", image, item.uuid());
      return;
    }

    var keyframeUuid = collectionService.addKeyframe(image, asset.name());
    collectionService.linkKeyframe(item.uuid(), keyframeUuid);
    logger.debug("Linked keyframe {} to item {}", keyframeUuid, item.uuid());
  }

  private MaterializedArtifact store(Destination.LocalFolder folder,
                                     IterationContext context,
                                     JobIdentifier identifier,
                                     Path file) throws IOException {
    Files.createDirectories(folder.folder());
    var target = folder.folder().resolve(folder.fileName(context.index(), artifactExtension));
    Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
    logger.info("Saved '{}' to {}", context.displayName(), target);
    return new MaterializedArtifact(identifier, null, target);
  }

  private void markSource(IterationContext context) {
    var source = context.sourceItem();
    if (sourceMarker == null || source == null || source.uuid() == null) return;

    try {
      var item = collectionService.fetchItem(source.uuid());
      if (sourceMarker.isMarked(item.description())) return;

      collectionService.updateItemDescription(source.uuid(), sourceMarker.mark(item.description()));
      logger.debug("Marked source item {} with '{}'", source.uuid(), sourceMarker.marker());
    } catch (RuntimeException e) {
      logger.warn("Failed to mark source item {}: {}", source.uuid(), e.getMessage());
    }
  }

  static String safeFileName(String displayName) {
    var sanitized = displayName.replaceAll("[^A-Za-z0-9._ -]", "_").strip();
    return sanitized.isEmpty() || sanitized.startsWith(".") ? "artifact" + sanitized : sanitized;
  }

  /**
   * Builder for {@link MaterializationPipeline}.
   */
  public static final class Builder {
    private final ArtifactTransfer transfer;
    private final Destination destination;
    private CollectionService collectionService;
    private String artifactExtension = "bin";
    private SourceMarker sourceMarker;
    private Path scratchRoot;
    private Path assetRoot = Path.of("");

    private Builder(ArtifactTransfer transfer, Destination destination) {
      this.transfer = requireNonNull(transfer, "transfer must not be null");
      this.destination = requireNonNull(destination, "destination must not be null");
    }

    /**
     * Sets the collection service, required to publish into a collection or to mark sources.
     */
    public Builder collectionService(CollectionService collectionService) {
      this.collectionService = collectionService;
      return this;
    }

    /**
     * Sets the extension of the produced artifacts, without the dot.
     */
    public Builder artifactExtension(String artifactExtension) {
      this.artifactExtension = requireNonNull(artifactExtension, "artifactExtension must not be null");
      return this;
    }

    /**
     * Sets the marker appended to source items; {@code null} leaves them untouched.
     */
    public Builder sourceMarker(SourceMarker sourceMarker) {
      this.sourceMarker = sourceMarker;
      return this;
    }

    /**
     * Sets the parent of the scoped directories; {@code null} uses the system temporary directory.
     */
    public Builder scratchRoot(Path scratchRoot) {
      this.scratchRoot = scratchRoot;
      return this;
    }

    /**
     * Sets the directory relative asset references are resolved against.
     */
    public Builder assetRoot(Path assetRoot) {
      this.assetRoot = requireNonNull(assetRoot, "assetRoot must not be null");
      return this;
    }

    /**
     * Builds the pipeline.
     *
     * @return the pipeline
     * @throws IllegalArgumentException if a collection destination or a source marker is
     *                                  configured without a collection service
     */
    public MaterializationPipeline build() {
      if ((destination instanceof Destination.CollectionDestination || sourceMarker != null) && collectionService == null) {
        throw new IllegalArgumentException("collectionService is required to publish into a collection or mark sources");
      }
      return new MaterializationPipeline(this);
    }
  }

  private static final class RemoteProgress {
    private final CollectionItem item;
    private boolean keyframeLinked;

    private RemoteProgress(CollectionItem item) {
      this.item = item;
    }
  }
}
