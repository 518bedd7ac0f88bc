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

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Textual form of a {@link JobIdentifier} embedded in item descriptions: {@code [job:<identifier>]}.
 */
public final class IdentifierTag {

  private static final String PREFIX = "[job:";
  private static final String SUFFIX = "]";
  private static final Pattern TAG = Pattern.compile("\\[job:([0-9a-fA-F]{" + JobIdentifier.LENGTH + "})]");

  private IdentifierTag() {
  }

  /**
   * Formats the tag of an identifier.
   *
   * @param identifier the identifier
   * @return the tag, e.g. {@code [job:0123456789ab]}
   */
  public static String format(JobIdentifier identifier) {
    requireNonNull(identifier, "identifier must not be null");
    return PREFIX + identifier.asString() + SUFFIX;
  }

  /**
   * Extracts every identifier tagged in a text.
   *
   * @param text the text to scan, may be {@code null}
   * @return the tagged identifiers, in order of appearance
   */
  public static Set<JobIdentifier> extract(String text) {
    var identifiers = new LinkedHashSet<JobIdentifier>();
    if (text == null || text.isEmpty()) return identifiers;

    var matcher = TAG.matcher(text);
    while (matcher.find()) {
      identifiers.add(JobIdentifier.from(matcher.group(1)));
    }
    return identifiers;
  }

  /**
   * Appends the tag of an identifier to a description.
   * <p>
   * The description is returned unchanged if it already carries the tag. Otherwise the tag is
   * appended on a new line, or becomes the whole description when there is none.
   * </p>
   *
   * @param description the current description, may be {@code null}
   * @param identifier  the identifier to tag
   * @return the stamped description
   */
  public static String stamp(String description, JobIdentifier identifier) {
    var tag = format(identifier);
    if (description == null || description.isBlank()) return tag;
    if (extract(description).contains(identifier)) return description;
    return description.stripTrailing() + "\n" + tag;
  }
}
