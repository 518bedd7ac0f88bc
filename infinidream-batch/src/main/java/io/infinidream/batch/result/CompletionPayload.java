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
package io.infinidream.batch.result;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Result value written by a queue worker once it finished a job.
 * <p>
 * The shape of the value is not guaranteed, so it is modelled as one of two variants:
 * </p>
 * <ul>
 *   <li>{@link Structured}: a JSON object; it is ready when it holds a non-blank
 *       {@value #ARTIFACT_FIELD} field</li>
 *   <li>{@link Raw}: anything else; the text itself is the artifact reference</li>
 * </ul>
 * <p>
 * {@link #artifactReference()} is the single normalization step shared by both variants.
 * </p>
 */
public sealed interface CompletionPayload {

  /**
   * Field of a structured payload that holds the artifact reference.
   */
  String ARTIFACT_FIELD = "r2_url";

  /**
   * Returns the reference of the produced artifact.
   *
   * @return the reference, or empty if this payload does not designate an artifact yet
   */
  Optional<String> artifactReference();

  /**
   * Parses a stored result value.
   * <p>
   * A JSON object becomes {@link Structured}. A JSON string becomes {@link Raw} with the
   * unquoted string. Any other JSON value, or text that is not JSON at all, becomes
   * {@link Raw} with the text as stored.
   * </p>
   *
   * @param value the stored value, may be {@code null}
   * @return the payload, or empty if {@code value} is {@code null} or blank
   */
  static Optional<CompletionPayload> parse(String value) {
    if (value == null || value.isBlank()) return Optional.empty();

    try {
      JsonElement element = JsonParser.parseString(value);
      if (element.isJsonObject()) return Optional.of(new Structured(element.getAsJsonObject()));
      if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
        return Optional.of(new Raw(element.getAsString()));
      }
      return Optional.of(new Raw(value));
    } catch (JsonParseException e) {
      return Optional.of(new Raw(value));
    }
  }

  /**
   * Payload stored as a JSON object.
   *
   * @param fields the object fields
   */
  record Structured(JsonObject fields) implements CompletionPayload {
    public Structured {
      requireNonNull(fields, "fields must not be null");
    }

    @Override
    public Optional<String> artifactReference() {
      var reference = fields.get(ARTIFACT_FIELD);
      if (reference == null || !reference.isJsonPrimitive()) return Optional.empty();

      var value = reference.getAsString().strip();
      return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
  }

  /**
   * Payload stored as plain text, treated as the artifact reference.
   *
   * @param value the stored text
   */
  record Raw(String value) implements CompletionPayload {
    public Raw {
      requireNonNull(value, "value must not be null");
    }

    @Override
    public Optional<String> artifactReference() {
      var reference = value.strip();
      return reference.isEmpty() ? Optional.empty() : Optional.of(reference);
    }
  }
}
