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
package io.infinidream.batch.identity;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic fingerprint of a job's distinguishing inputs, used only for deduplication.
 * <p>
 * Identifiers are {@value #LENGTH} lowercase hexadecimal characters. They are produced by
 * {@link IdentifierDeriver} and read back from collection metadata by the dedup ledger.
 * </p>
 *
 * @see IdentifierDeriver
 */
public final class JobIdentifier {

  /**
   * Number of hexadecimal characters in an identifier.
   */
  public static final int LENGTH = 12;

  static final Pattern FORMAT = Pattern.compile("[0-9a-f]{" + LENGTH + "}");

  private final String id;

  private JobIdentifier(String id) {
    this.id = id;
  }

  /**
   * Returns the string representation of this identifier.
   *
   * @return the identifier as {@value #LENGTH} hex characters
   */
  public String asString() {
    return id;
  }

  /**
   * Creates an identifier from its string form.
   *
   * @param id the identifier, case-insensitive
   * @return the identifier
   * @throws IllegalArgumentException if {@code id} is not {@value #LENGTH} hex characters
   */
  public static JobIdentifier from(String id) {
    if (id == null) throw new IllegalArgumentException("id must not be null");

    var normalized = id.strip().toLowerCase(Locale.ROOT);
    if (!FORMAT.matcher(normalized).matches()) {
      throw new IllegalArgumentException("Invalid job identifier: '" + id + "'");
    }
    return new JobIdentifier(normalized);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (JobIdentifier) obj;
    return Objects.equals(this.id, that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "JobIdentifier{" +
      "id='" + id + '\'' +
      '}';
  }
}
