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
import io.infinidream.batch.exception.CollectionServiceException;
import io.infinidream.batch.exception.LedgerReadException;
import io.infinidream.batch.identity.JobIdentifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DedupLedgerTest {

  private CollectionService collectionService;
  private DedupLedger ledger;

  @BeforeEach
  void setUp() {
    collectionService = mock(CollectionService.class);
    ledger = new DedupLedger(collectionService);
  }

  @Test
  @DisplayName("should collect tagged identifiers of every item")
  void should_collect_tagged_identifiers_of_every_item() {
    // Given
    when(collectionService.listAllItems("p-1")).thenReturn(List.of(
      new CollectionItem("1", "d-1", "lake", "Lake\n[job:0123456789ab]", null),
      new CollectionItem("2", "d-2", "fox", null, null),
      new CollectionItem("3", "d-3", "owl", "[job:ba9876543210] hand made", null)));

    // When
    var identifiers = ledger.existingIdentifiers("p-1");

    // Then
    assertThat(identifiers).containsExactlyInAnyOrder(
      JobIdentifier.from("0123456789ab"),
      JobIdentifier.from("ba9876543210"));
  }

  @Test
  @DisplayName("should proceed with empty ledger when collection cannot be listed")
  void should_proceed_with_empty_ledger_when_collection_cannot_be_listed() {
    // Given
    when(collectionService.listAllItems("p-1")).thenThrow(new CollectionServiceException("GET failed with HTTP 503", 503));

    // When
    var identifiers = ledger.existingIdentifiers("p-1");

    // Then
    assertThat(identifiers).isEmpty();
  }

  @Test
  @DisplayName("should surface listing failure when read strictly")
  void should_surface_listing_failure_when_read_strictly() {
    // Given
    when(collectionService.listAllItems("p-1")).thenThrow(new CollectionServiceException("GET failed with HTTP 503", 503));

    // When / Then
    assertThatThrownBy(() -> ledger.read("p-1"))
      .isInstanceOf(LedgerReadException.class)
      .hasMessageContaining("p-1")
      .hasCauseInstanceOf(CollectionServiceException.class);
  }
}
