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
package io.infinidream.batch.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.infinidream.batch.PollingPolicy;
import io.infinidream.batch.SubmissionPolicy;
import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Reads {@link BatchSettings} from a JSON job file.
 *
 * <h2>Format</h2>
 * <pre>{@code
 * {
 *   "algorithm": "wan-i2v",
 *   "prompt": "a slow dolly shot",
 *   "image_path": "images",
 *   "combos": ["at dawn", "at night"],
 *   "size": "1280*720",
 *   "playlist": { "name": "Dawn and night", "nsfw": false, "sort_by_name": true },
 *   "poll": { "interval_seconds": 10, "max_wait_seconds": 3600 },
 *   "submission": { "concurrency": 10, "timeout_seconds": 120 }
 * }
 * }</pre>
 * <p>
 * Every other top-level scalar is a base parameter of the descriptors; the algorithm decides
 * which ones reach the queue. Integral numbers are read as {@code Long}, other numbers as
 * {@code Double}. The legacy layout of upscaling job files is also understood:
 * {@code playlist_uuid} for the source collection, {@code uprez_config} for the parameters,
 * {@code output_playlist} for the destination and {@code tracking.existing_playlist_uuid} for
 * the collection to reuse.
 * </p>
 */
public final class BatchSettingsLoader {
  private static final Logger logger = LoggerFactory.getLogger(BatchSettingsLoader.class);

  private static final Set<String> RESERVED = Set.of(
    "algorithm", "prompt", "image_path", "combos", "num_generations", "output_folder", "output_filename",
    "source_playlist_uuid", "playlist_uuid", "playlist", "output_playlist", "tracking", "poll", "submission",
    "uprez_config");

  private BatchSettingsLoader() {
  }

  /**
   * Loads the settings of a job file.
   *
   * @param jobFile the job file
   * @return the settings
   * @throws ConfigException if the file cannot be read or describes an invalid batch
   */
  public static BatchSettings load(Path jobFile) {
    requireNonNull(jobFile, "jobFile must not be null");
    try {
      var settings = parse(Files.readString(jobFile, UTF_8));
      logger.info("Loaded job file {}", jobFile);
      return settings;
    } catch (IOException e) {
      throw new ConfigException("Cannot read job file " + jobFile, e);
    }
  }

  /**
   * Parses the settings from the content of a job file.
   *
   * @param json the job file content
   * @return the settings
   * @throws ConfigException if the content is not a JSON object or describes an invalid batch
   */
  public static BatchSettings parse(String json) {
    requireNonNull(json, "json must not be null");

    JsonObject root;
    try {
      var element = JsonParser.parseString(json);
      if (!element.isJsonObject()) throw new ConfigException("Job file must contain a JSON object");
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new ConfigException("Job file is not valid JSON: " + e.getMessage(), e);
    }

    try {
      return toSettings(root);
    } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException | ClassCastException e) {
      throw new ConfigException("Invalid job file: " + e.getMessage(), e);
    }
  }

  private static BatchSettings toSettings(JsonObject root) {
    var algorithm = Algorithm.fromTag(string(root, "algorithm"));
    var builder = BatchSettings.builder(algorithm);

    for (var entry : root.entrySet()) {
      if (!RESERVED.contains(entry.getKey()) && entry.getValue().isJsonPrimitive()) {
        builder.parameter(entry.getKey(), scalar(entry.getValue().getAsJsonPrimitive()));
      }
    }
    var legacyParameters = object(root, "uprez_config");
    if (legacyParameters != null) {
      for (var entry : legacyParameters.entrySet()) {
        if (entry.getValue().isJsonPrimitive()) builder.parameter(entry.getKey(), scalar(entry.getValue().getAsJsonPrimitive()));
      }
    }

    builder.prompt(string(root, "prompt"))
           .imagePath(string(root, "image_path"))
           .combos(strings(root, "combos"));
    if (has(root, "num_generations")) builder.numGenerations(root.get("num_generations").getAsInt());
    if (has(root, "output_folder")) builder.outputFolder(string(root, "output_folder"));
    if (has(root, "output_filename")) builder.outputFilename(string(root, "output_filename"));

    var source = has(root, "source_playlist_uuid") ? string(root, "source_playlist_uuid") : string(root, "playlist_uuid");
    builder.sourceCollectionUuid(source);

    var tracking = object(root, "tracking");
    if (tracking != null && has(tracking, "marker")) builder.marker(string(tracking, "marker"));

    var playlist = has(root, "playlist") ? object(root, "playlist") : object(root, "output_playlist");
    var reused = tracking == null ? null : string(tracking, "existing_playlist_uuid");
    if (playlist != null || reused != null) builder.collection(collection(playlist, reused));

    var poll = object(root, "poll");
    if (poll != null) builder.pollingPolicy(polling(poll, BatchSettings.defaultPollingPolicy(algorithm)));

    var submission = object(root, "submission");
    if (submission != null) {
      if (has(submission, "concurrency")) builder.submissionPolicy(new SubmissionPolicy(submission.get("concurrency").getAsInt()));
      if (has(submission, "command")) builder.submissionCommand(strings(submission, "command"));
      if (has(submission, "timeout_seconds")) builder.submissionTimeout(Duration.ofSeconds(submission.get("timeout_seconds").getAsLong()));
    }

    return builder.build();
  }

  private static CollectionSettings collection(JsonObject playlist, String reusedUuid) {
    var settings = playlist == null ? new JsonObject() : playlist;
    var existing = has(settings, "existing_uuid") ? string(settings, "existing_uuid") : reusedUuid;
    var name = has(settings, "name") ? string(settings, "name") : "Unnamed Playlist";

    return new CollectionSettings(
      name,
      string(settings, "description"),
      bool(settings, "nsfw"),
      existing,
      bool(settings, "sort_by_name"),
      bool(settings, "attach_keyframe"));
  }

  private static PollingPolicy polling(JsonObject poll, PollingPolicy defaults) {
    var interval = has(poll, "interval_seconds") ? Duration.ofSeconds(poll.get("interval_seconds").getAsLong()) : defaults.interval();
    var maxWait = has(poll, "max_wait_seconds") ? Duration.ofSeconds(poll.get("max_wait_seconds").getAsLong()) : defaults.maxWait();
    return new PollingPolicy(interval, maxWait);
  }

  private static Object scalar(JsonPrimitive primitive) {
    if (primitive.isBoolean()) return primitive.getAsBoolean();
    if (primitive.isString()) return primitive.getAsString();

    BigDecimal number = primitive.getAsBigDecimal();
    if (number.stripTrailingZeros().scale() <= 0) {
      try {
        return number.longValueExact();
      } catch (ArithmeticException e) {
        return number.doubleValue();
      }
    }
    return number.doubleValue();
  }

  private static boolean has(JsonObject object, String field) {
    return object.has(field) && !object.get(field).isJsonNull();
  }

  private static String string(JsonObject object, String field) {
    return has(object, field) ? object.get(field).getAsString() : null;
  }

  private static boolean bool(JsonObject object, String field) {
    return has(object, field) && object.get(field).getAsBoolean();
  }

  private static JsonObject object(JsonObject object, String field) {
    if (!has(object, field)) return null;
    JsonElement value = object.get(field);
    if (!value.isJsonObject()) throw new IllegalArgumentException("'" + field + "' must be an object");
    return value.getAsJsonObject();
  }

  private static List<String> strings(JsonObject object, String field) {
    var values = new ArrayList<String>();
    if (!has(object, field)) return values;

    JsonElement value = object.get(field);
    if (!value.isJsonArray()) throw new IllegalArgumentException("'" + field + "' must be an array");
    for (JsonElement element : (JsonArray) value) {
      values.add(element.isJsonNull() ? "" : element.getAsString());
    }
    return values;
  }
}
