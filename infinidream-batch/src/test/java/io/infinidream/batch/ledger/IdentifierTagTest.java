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

import io.infinidream.batch.identity.JobIdentifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierTagTest {

  private static final JobIdentifier ID = JobIdentifier.from("0123456789ab");
  private static final JobIdentifier OTHER = JobIdentifier.from("ba9876543210");

  @Test
  @DisplayName("should format tag")
  void should_format_tag() {
    assertThat(IdentifierTag.format(ID)).isEqualTo("[job:0123456789ab]");
  }

  @Test
  @DisplayName("should extract every tag in order regardless of case")
  void should_extract_every_tag_in_order_regardless_of_case() {
    // Given
    var description = "Sunset over the lake\n[job:BA9876543210]\nnotes [job:0123456789ab] [job:short] [job:0123456789ab]";

    // When
    var identifiers = IdentifierTag.extract(description);

    // Then
    assertThat(identifiers).containsExactly(OTHER, ID);
  }

  @Test
  @DisplayName("should extract nothing from untagged text")
  void should_extract_nothing_from_untagged_text() {
    assertThat(IdentifierTag.extract(null)).isEmpty();
    assertThat(IdentifierTag.extract("")).isEmpty();
    assertThat(IdentifierTag.extract("job:0123456789ab without brackets")).isEmpty();
  }

  @Test
  @DisplayName("should append tag on a new line")
  void should_append_tag_on_a_new_line() {
    assertThat(IdentifierTag.stamp("Sunset  \n", ID)).isEqualTo("Sunset\n[job:0123456789ab]");
    assertThat(IdentifierTag.stamp(null, ID)).isEqualTo("[job:0123456789ab]");
    assertThat(IdentifierTag.stamp("  ", ID)).isEqualTo("[job:0123456789ab]");
  }

  @Test
  @DisplayName("should keep description already carrying the tag")
  void should_keep_description_already_carrying_the_tag() {
    // Given
    var description = "Sunset\n[job:0123456789ab]";

    // When / Then
    assertThat(IdentifierTag.stamp(description, ID)).isSameAs(description);
    assertThat(IdentifierTag.stamp(description, OTHER)).isEqualTo(description + "\n[job:ba9876543210]");
  }
}
