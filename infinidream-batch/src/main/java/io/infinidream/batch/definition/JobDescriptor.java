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
package io.infinidream.batch.definition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable parameter payload describing one unit of work to submit.
 * <p>
 * Parameter values are strings, numbers or booleans. Descriptors are created by
 * {@link JobDescriptorBuilder} right before submission and discarded afterwards.
 * </p>
 *
 * @see JobDescriptorBuilder
 */
public final class JobDescriptor {

  /**
   * Field carrying the algorithm tag in the submitted payload.
   */
  public static final String ALGORITHM_FIELD = "infinidream_algorithm";

  private final Algorithm algorithm;
  private final Map<String, Object> parameters;

  JobDescriptor(Algorithm algorithm, Map<String, Object> parameters) {
    this.algorithm = requireNonNull(algorithm, "algorithm must not be null");
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(parameters, "parameters must not be null")));
  }

  public Algorithm algorithm() {
    return algorithm;
  }

  /**
   * Returns the parameters of this descriptor, without the algorithm tag.
   *
   * @return an unmodifiable view of the parameters, in insertion order
   */
  public Map<String, Object> parameters() {
    return parameters;
  }

  /**
   * Returns the value of a single parameter.
   *
   * @param name the parameter name
   * @return the value, or {@code null} if absent
   */
  public Object parameter(String name) {
    return parameters.get(name);
  }

  /**
   * Returns the payload handed to the submission boundary: the algorithm tag followed by
   * every parameter.
   *
   * @return a new mutable map, in field order
   */
  public Map<String, Object> toPayload() {
    var payload = new LinkedHashMap<String, Object>();
    payload.put(ALGORITHM_FIELD, algorithm.tag());
    payload.putAll(parameters);
    return payload;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (JobDescriptor) obj;
    return this.algorithm == that.algorithm && Objects.equals(this.parameters, that.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, parameters);
  }

  @Override
  public String toString() {
    return "JobDescriptor{" +
      "algorithm=" + algorithm.tag() +
      ", parameters=" + parameters +
      '}';
  }
}
