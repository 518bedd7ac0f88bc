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

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Word appended to the description of a source item once a job derived from it is materialized.
 * Matching is case-insensitive.
 *
 * @param marker the marker text, e.g. {@code "uprez"}
 */
public record SourceMarker(String marker) {

  public SourceMarker {
    requireNonNull(marker, "marker must not be null");
    if (marker.isBlank()) throw new IllegalArgumentException("marker must not be blank");
    marker = marker.strip();
  }

  public boolean isMarked(String description) {
    return description != null && description.toLowerCase(Locale.ROOT).contains(marker.toLowerCase(Locale.ROOT));
  }

  /**
   * Appends the marker to a description, separated by a space.
   *
   * @param description the current description, may be {@code null}
   * @return the marked description, unchanged if already marked
   */
  public String mark(String description) {
    if (description == null || description.isBlank()) return marker;
    if (isMarked(description)) return description;
    return description + " " + marker;
  }
}
