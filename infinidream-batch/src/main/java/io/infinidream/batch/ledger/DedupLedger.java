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
package io.infinidream.batch.ledger;

import io.infinidream.batch.collection.CollectionItem;
import io.infinidream.batch.collection.CollectionService;
import io.infinidream.batch.exception.LedgerReadException;
import io.infinidream.batch.identity.JobIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Record of the work already materialized into a destination collection.
 * <p>
 * The ledger has no storage of its own: every materialized item carries the
 * {@link IdentifierTag tag} of the job that produced it in its description, and reading the
 * ledger means scanning every item of the collection for tags. Reading is best effort; when the
 * collection cannot be listed the ledger is considered empty and a warning is logged, so the
 * batch proceeds and may redo work rather than failing.
 * </p>
 */
public final class DedupLedger {
  private static final Logger logger = LoggerFactory.getLogger(DedupLedger.class);

  private final CollectionService collectionService;

  public DedupLedger(CollectionService collectionService) {
    this.collectionService = requireNonNull(collectionService, "collectionService must not be null");
  }

  /**
   * Returns the identifiers recorded in a collection.
   *
   * @param collectionUuid the destination collection
   * @return the recorded identifiers, empty if the collection could not be read
   */
  public Set<JobIdentifier> existingIdentifiers(String collectionUuid) {
    requireNonNull(collectionUuid, "collectionUuid must not be null");

    try {
      var identifiers = read(collectionUuid);
      logger.info("Ledger of collection {} holds {} identifier(s)", collectionUuid, identifiers.size());
      return identifiers;
    } catch (LedgerReadException e) {
      logger.warn("Proceeding with an empty ledger: {}", e.getMessage(), e);
      return Set.of();
    }
  }

  /**
   * Reads the identifiers recorded in a collection, failing if the collection cannot be listed.
   *
   * @param collectionUuid the destination collection
   * @return the recorded identifiers
   * @throws LedgerReadException if listing the collection fails
   */
  Set<JobIdentifier> read(String collectionUuid) {
    List<CollectionItem> items;
    try {
      items = collectionService.listAllItems(collectionUuid);
    } catch (RuntimeException e) {
      throw new LedgerReadException("Failed to list items of collection " + collectionUuid, e);
    }

    var identifiers = new HashSet<JobIdentifier>();
    for (var item : items) {
      identifiers.addAll(IdentifierTag.extract(item.description()));
    }
    return identifiers;
  }
}
