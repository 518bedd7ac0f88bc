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
import io.infinidream.batch.collection.NewCollection;
import io.infinidream.batch.config.BatchSettings;
import io.infinidream.batch.definition.JobDescriptorBuilder;
import io.infinidream.batch.exception.CollectionServiceException;
import io.infinidream.batch.identity.JobIdentifier;
import io.infinidream.batch.ledger.DedupLedger;
import io.infinidream.batch.materialize.ArtifactTransfer;
import io.infinidream.batch.materialize.Destination;
import io.infinidream.batch.materialize.MaterializationPipeline;
import io.infinidream.batch.materialize.SourceMarker;
import io.infinidream.batch.result.CompletionPoller;
import io.infinidream.batch.result.ResultStore;
import io.infinidream.batch.submission.SubmissionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Runs one batch described by {@link BatchSettings} against concrete collaborators.
 * <p>
 * The runner resolves the destination, reads its ledger, wires a {@link BatchOrchestrator} for
 * the batch algorithm and, once the batch is over, optionally reorders the destination by item
 * name.
 * </p>
 *
 * <h2>Destination</h2>
 * <ul>
 *   <li>A configured collection with an existing uuid is reused; if it cannot be fetched, a new
 *       collection is created from the configured name, description and NSFW flag.</li>
 *   <li>Without a configured collection, or without a collection service to reach it, artifacts
 *       are saved to the output folder when one is configured.</li>
 *   <li>Otherwise jobs are submitted but not waited for.</li>
 * </ul>
 */
public final class BatchRunner {
  private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

  private final BatchSettings settings;
  private final Path workerDirectory;
  private final SubmissionClient submissionClient;
  private final ResultStore resultStore;
  private final CollectionService collectionService;
  private final ArtifactTransfer transfer;

  /**
   * Creates a runner.
   *
   * @param settings          the batch
   * @param workerDirectory   the directory relative paths are resolved against
   * @param submissionClient  submits jobs to the queue
   * @param resultStore       the store queue workers write results to
   * @param collectionService the collection service, or {@code null} when none is configured
   * @param transfer          downloads artifacts
   */
  public BatchRunner(BatchSettings settings,
                     Path workerDirectory,
                     SubmissionClient submissionClient,
                     ResultStore resultStore,
                     CollectionService collectionService,
                     ArtifactTransfer transfer) {
    this.settings = requireNonNull(settings, "settings must not be null");
    this.workerDirectory = requireNonNull(workerDirectory, "workerDirectory must not be null");
    this.submissionClient = requireNonNull(submissionClient, "submissionClient must not be null");
    this.resultStore = requireNonNull(resultStore, "resultStore must not be null");
    this.collectionService = collectionService;
    this.transfer = requireNonNull(transfer, "transfer must not be null");
  }

  /**
   * Runs the batch.
   *
   * @return the report
   * @throws io.infinidream.batch.exception.ConfigException if the batch inputs are invalid
   * @throws CollectionServiceException                     if the destination collection cannot be created
   */
  public BatchReport run() {
    var algorithm = settings.algorithm();
    var plan = new BatchPlanner(settings, workerDirectory, collectionService).plan();

    var collection = resolveCollection();
    Set<JobIdentifier> existing = collection == null
      ? Set.of()
      : new DedupLedger(collectionService).existingIdentifiers(collection.uuid());

    var orchestrator = BatchOrchestrator.builder()
                                        .submissionClient(submissionClient)
                                        .descriptorBuilder(new JobDescriptorBuilder(algorithm, settings.parameters(), settings.prompt()))
                                        .poller(new CompletionPoller(resultStore, algorithm.queueName()))
                                        .pipeline(pipeline(collection, plan))
                                        .submissionPolicy(settings.submissionPolicy())
                                        .pollingPolicy(settings.pollingPolicy())
                                        .build();

    var report = orchestrator.run(plan, existing);

    if (collection != null && settings.collection().sortByName() && report.materialized() > 0 && !report.interrupted()) {
      sortByName(collection.uuid());
    }
    if (collection != null) logger.info("Destination collection: {}", collection.uuid());
    return report;
  }

  private Collection resolveCollection() {
    var configured = settings.collection();
    if (configured == null) return null;

    if (collectionService == null) {
      logger.warn("A destination collection is configured but BACKEND_URL or API_KEY is missing, results will not be published");
      return null;
    }

    if (configured.existingUuid() != null && !configured.existingUuid().isBlank()) {
      try {
        var existing = collectionService.fetchCollection(configured.existingUuid());
        logger.info("Using existing collection {} ({})", existing.uuid(), existing.name());
        return existing;
      } catch (CollectionServiceException e) {
        logger.warn("Cannot fetch collection {}, creating a new one instead: {}", configured.existingUuid(), e.getMessage());
      }
    }

    var created = collectionService.createCollection(
      new NewCollection(configured.name(), configured.description(), configured.nsfw()));
    logger.info("Created collection {} ({})", created.uuid(), created.name());
    return created;
  }

  private MaterializationPipeline pipeline(Collection collection, BatchPlan plan) {
    Destination destination;
    if (collection != null) {
      destination = new Destination.CollectionDestination(collection.uuid(), settings.collection().attachKeyframe());
    } else if (settings.outputFolder() != null) {
      var folder = Path.of(settings.outputFolder());
      destination = new Destination.LocalFolder(
        folder.isAbsolute() ? folder : workerDirectory.resolve(folder),
        settings.outputFilename(),
        plan.size() > 1);
    } else {
      return null;
    }

    var marker = settings.marker() != null && collectionService != null ? new SourceMarker(settings.marker()) : null;
    return MaterializationPipeline.builder(transfer, destination)
                                  .collectionService(collectionService)
                                  .artifactExtension(settings.algorithm().artifactExtension())
                                  .sourceMarker(marker)
                                  .assetRoot(workerDirectory)
                                  .build();
  }

  private void sortByName(String collectionUuid) {
    try {
      var entryIds = collectionService.listAllItems(collectionUuid).stream()
                                      .sorted(Comparator.comparing(CollectionItem::name,
                                                                   Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                                      .map(CollectionItem::entryId)
                                      .filter(Objects::nonNull)
                                      .toList();
      collectionService.reorderItems(collectionUuid, entryIds);
      logger.info("Sorted {} item(s) of collection {} by name", entryIds.size(), collectionUuid);
    } catch (CollectionServiceException e) {
      logger.warn("Failed to sort collection {} by name: {}", collectionUuid, e.getMessage());
    }
  }
}
