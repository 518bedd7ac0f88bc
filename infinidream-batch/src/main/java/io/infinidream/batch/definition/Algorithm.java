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

import io.infinidream.batch.exception.ConfigException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.joining;

/**
 * Generation algorithms understood by the queue workers.
 * <p>
 * Each algorithm owns the queue it is dispatched to, the allow-list of parameters that may be
 * copied from a base configuration into a job descriptor, the groups of fields that must be
 * present once a descriptor is built, and the defaults applied before the base configuration.
 * A required group is satisfied when any one of its fields is present.
 * </p>
 */
public enum Algorithm {

  WAN_I2V(
    "wan-i2v",
    "wani2v",
    "mp4",
    List.of("size", "duration", "num_inference_steps", "guidance", "seed",
            "negative_prompt", "flow_shift", "enable_prompt_optimization", "enable_safety_checker"),
    List.of(List.of("prompt"), List.of("image")),
    Map.of()
  ),

  QWEN_IMAGE(
    "qwen-image",
    "qwenimage",
    "png",
    List.of("size", "negative_prompt", "enable_safety_checker", "seed"),
    List.of(List.of("prompt")),
    Map.of("seed", -1L)
  ),

  UPREZ(
    "uprez",
    "uprezvideo",
    "mp4",
    List.of("upscale_factor", "interpolation_factor", "output_format", "tile_size",
            "tile_padding", "quality", "output_fps"),
    List.of(List.of("video_uuid", "video_url")),
    Map.of(
      "upscale_factor", 2L,
      "interpolation_factor", 2L,
      "output_format", "mp4",
      "tile_size", 1024L,
      "tile_padding", 10L,
      "quality", "high"
    )
  );

  private final String tag;
  private final String queueName;
  private final String artifactExtension;
  private final List<String> copiedParameters;
  private final List<List<String>> requiredGroups;
  private final Map<String, Object> defaults;

  Algorithm(String tag,
            String queueName,
            String artifactExtension,
            List<String> copiedParameters,
            List<List<String>> requiredGroups,
            Map<String, Object> defaults) {
    this.tag = tag;
    this.queueName = queueName;
    this.artifactExtension = artifactExtension;
    this.copiedParameters = copiedParameters;
    this.requiredGroups = requiredGroups;
    this.defaults = defaults;
  }

  /**
   * Returns the tag written into the {@code infinidream_algorithm} field of every descriptor.
   *
   * @return the algorithm tag, e.g. {@code "wan-i2v"}
   */
  public String tag() {
    return tag;
  }

  /**
   * Returns the name of the queue the workers for this algorithm consume.
   *
   * @return the queue name, e.g. {@code "wani2v"}
   */
  public String queueName() {
    return queueName;
  }

  /**
   * Returns the file extension of the artifacts this algorithm produces.
   *
   * @return the extension without the leading dot
   */
  public String artifactExtension() {
    return artifactExtension;
  }

  public List<String> copiedParameters() {
    return copiedParameters;
  }

  public List<List<String>> requiredGroups() {
    return requiredGroups;
  }

  public Map<String, Object> defaults() {
    return defaults;
  }

  /**
   * Returns the default submission script for this algorithm, relative to the worker directory.
   *
   * @return the script path, e.g. {@code "dist/queue-wan-i2v.js"}
   */
  public String defaultSubmissionScript() {
    return "dist/queue-" + tag + ".js";
  }

  /**
   * Resolves an algorithm from its tag.
   *
   * @param tag the algorithm tag as found in the job file
   * @return the matching algorithm
   * @throws ConfigException if the tag is {@code null} or unknown
   */
  public static Algorithm fromTag(String tag) {
    if (tag == null || tag.isBlank()) throw new ConfigException("algorithm is required");

    return Arrays.stream(values())
                 .filter(algorithm -> algorithm.tag.equalsIgnoreCase(tag.strip()))
                 .findFirst()
                 .orElseThrow(() -> new ConfigException(
                   "Unknown algorithm '" + tag + "', expected one of: " +
                     Arrays.stream(values()).map(Algorithm::tag).collect(joining(", "))));
  }
}
