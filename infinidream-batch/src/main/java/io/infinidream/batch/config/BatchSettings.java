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

import io.infinidream.batch.PollingPolicy;
import io.infinidream.batch.SubmissionPolicy;
import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.exception.ConfigException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable description of one batch, as read from a job file.
 * <p>
 * Settings say what to generate and where results go. Credentials and endpoints are not part of
 * them; see {@link EnvironmentSettings}. Create instances with {@link #builder(Algorithm)} or
 * {@link BatchSettingsLoader}.
 * </p>
 *
 * @see BatchSettingsLoader
 */
public final class BatchSettings {

  /**
   * Default wall-clock budget of the polling phase for upscaling batches.
   */
  public static final Duration UPREZ_MAX_WAIT = Duration.ofHours(2);

  private final Algorithm algorithm;
  private final String prompt;
  private final Map<String, Object> parameters;
  private final String imagePath;
  private final List<String> combos;
  private final int numGenerations;
  private final String outputFolder;
  private final String outputFilename;
  private final String sourceCollectionUuid;
  private final CollectionSettings collection;
  private final String marker;
  private final PollingPolicy pollingPolicy;
  private final SubmissionPolicy submissionPolicy;
  private final List<String> submissionCommand;
  private final Duration submissionTimeout;

  private BatchSettings(Builder builder) {
    this.algorithm = builder.algorithm;
    this.prompt = builder.prompt;
    this.parameters = Map.copyOf(builder.parameters);
    this.imagePath = builder.imagePath;
    this.combos = builder.combos.isEmpty() ? List.of("") : List.copyOf(builder.combos);
    this.numGenerations = builder.numGenerations;
    this.outputFolder = builder.outputFolder;
    this.outputFilename = builder.outputFilename == null ? builder.algorithm.tag() : builder.outputFilename;
    this.sourceCollectionUuid = builder.sourceCollectionUuid;
    this.collection = builder.collection;
    this.marker = builder.marker;
    this.pollingPolicy = builder.pollingPolicy;
    this.submissionPolicy = builder.submissionPolicy;
    this.submissionCommand = builder.submissionCommand == null ? null : List.copyOf(builder.submissionCommand);
    this.submissionTimeout = builder.submissionTimeout;
  }

  public Algorithm algorithm() {
    return algorithm;
  }

  /**
   * Returns the prompt shared by every job of the batch.
   *
   * @return the prompt, or {@code null}
   */
  public String prompt() {
    return prompt;
  }

  /**
   * Returns the base parameters of every descriptor. Only the parameters the algorithm accepts
   * are forwarded to the queue.
   *
   * @return the parameters, never {@code null}
   */
  public Map<String, Object> parameters() {
    return parameters;
  }

  /**
   * Returns the directory holding the source images, relative to the worker directory unless absolute.
   *
   * @return the image directory, or {@code null}
   */
  public String imagePath() {
    return imagePath;
  }

  /**
   * Returns the prompt suffixes combined with every source image.
   *
   * @return the suffixes; a single empty suffix when none were configured
   */
  public List<String> combos() {
    return combos;
  }

  public int numGenerations() {
    return numGenerations;
  }

  /**
   * Returns the local folder artifacts are saved to when no collection is configured.
   *
   * @return the folder, or {@code null}
   */
  public String outputFolder() {
    return outputFolder;
  }

  /**
   * Returns the file name stem of artifacts saved to the output folder.
   *
   * @return the stem; the algorithm tag unless configured
   */
  public String outputFilename() {
    return outputFilename;
  }

  /**
   * Returns the collection whose items are the inputs of the batch.
   *
   * @return the source collection uuid, or {@code null}
   */
  public String sourceCollectionUuid() {
    return sourceCollectionUuid;
  }

  /**
   * Returns the destination collection.
   *
   * @return the destination, or {@code null} when artifacts are not published
   */
  public CollectionSettings collection() {
    return collection;
  }

  /**
   * Returns the marker appended to processed source items.
   *
   * @return the marker, or {@code null}
   */
  public String marker() {
    return marker;
  }

  public PollingPolicy pollingPolicy() {
    return pollingPolicy;
  }

  public SubmissionPolicy submissionPolicy() {
    return submissionPolicy;
  }

  /**
   * Returns the command that submits one job.
   *
   * @return the command and its arguments, or {@code null} for the algorithm default
   */
  public List<String> submissionCommand() {
    return submissionCommand;
  }

  public Duration submissionTimeout() {
    return submissionTimeout;
  }

  /**
   * Returns the polling policy used when a job file sets none: the default policy, with a
   * longer budget for upscaling batches.
   *
   * @param algorithm the batch algorithm
   * @return the default policy
   */
  public static PollingPolicy defaultPollingPolicy(Algorithm algorithm) {
    return algorithm == Algorithm.UPREZ
      ? new PollingPolicy(PollingPolicy.DEFAULT.interval(), UPREZ_MAX_WAIT)
      : PollingPolicy.DEFAULT;
  }

  /**
   * Creates a builder with the defaults of the given algorithm.
   *
   * @param algorithm the batch algorithm
   * @return a new builder
   */
  public static Builder builder(Algorithm algorithm) {
    return new Builder(algorithm);
  }

  @Override
  public String toString() {
    return "BatchSettings{" +
      "algorithm=" + algorithm.tag() +
      ", prompt='" + prompt + '\'' +
      ", parameters=" + parameters +
      ", imagePath='" + imagePath + '\'' +
      ", combos=" + combos.size() +
      ", numGenerations=" + numGenerations +
      ", outputFolder='" + outputFolder + '\'' +
      ", sourceCollectionUuid='" + sourceCollectionUuid + '\'' +
      ", collection=" + collection +
      ", marker='" + marker + '\'' +
      ", pollingPolicy=" + pollingPolicy +
      ", submissionPolicy=" + submissionPolicy +
      '}';
  }

  /**
   * Builder for {@link BatchSettings}.
   */
  public static final class Builder {
    private final Algorithm algorithm;
    private String prompt;
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private String imagePath;
    private final List<String> combos = new ArrayList<>();
    private int numGenerations = 1;
    private String outputFolder;
    private String outputFilename;
    private String sourceCollectionUuid;
    private CollectionSettings collection;
    private String marker;
    private PollingPolicy pollingPolicy;
    private SubmissionPolicy submissionPolicy = SubmissionPolicy.DEFAULT;
    private List<String> submissionCommand;
    private Duration submissionTimeout = Duration.ofSeconds(120);

    private Builder(Algorithm algorithm) {
      this.algorithm = requireNonNull(algorithm, "algorithm must not be null");
      this.pollingPolicy = defaultPollingPolicy(algorithm);
      if (algorithm == Algorithm.UPREZ) this.marker = "uprez";
      if (algorithm == Algorithm.QWEN_IMAGE) {
        this.outputFolder = "generated-images";
        this.outputFilename = "qwen-image";
      }
    }

    public Builder prompt(String prompt) {
      this.prompt = prompt;
      return this;
    }

    /**
     * Adds a base parameter. {@code null} values are ignored.
     */
    public Builder parameter(String name, Object value) {
      requireNonNull(name, "name must not be null");
      if (value != null) parameters.put(name, value);
      return this;
    }

    public Builder imagePath(String imagePath) {
      this.imagePath = imagePath;
      return this;
    }

    public Builder combos(List<String> combos) {
      this.combos.clear();
      this.combos.addAll(requireNonNull(combos, "combos must not be null"));
      return this;
    }

    public Builder numGenerations(int numGenerations) {
      this.numGenerations = numGenerations;
      return this;
    }

    public Builder outputFolder(String outputFolder) {
      this.outputFolder = outputFolder;
      return this;
    }

    public Builder outputFilename(String outputFilename) {
      this.outputFilename = outputFilename;
      return this;
    }

    public Builder sourceCollectionUuid(String sourceCollectionUuid) {
      this.sourceCollectionUuid = sourceCollectionUuid;
      return this;
    }

    public Builder collection(CollectionSettings collection) {
      this.collection = collection;
      return this;
    }

    public Builder marker(String marker) {
      this.marker = marker;
      return this;
    }

    public Builder pollingPolicy(PollingPolicy pollingPolicy) {
      this.pollingPolicy = requireNonNull(pollingPolicy, "pollingPolicy must not be null");
      return this;
    }

    public Builder submissionPolicy(SubmissionPolicy submissionPolicy) {
      this.submissionPolicy = requireNonNull(submissionPolicy, "submissionPolicy must not be null");
      return this;
    }

    public Builder submissionCommand(List<String> submissionCommand) {
      this.submissionCommand = submissionCommand;
      return this;
    }

    public Builder submissionTimeout(Duration submissionTimeout) {
      this.submissionTimeout = requireNonNull(submissionTimeout, "submissionTimeout must not be null");
      return this;
    }

    /**
     * Builds the immutable settings.
     *
     * @return the settings
     * @throws ConfigException if the settings are inconsistent or miss what the algorithm needs
     */
    public BatchSettings build() {
      validate();
      return new BatchSettings(this);
    }

    private void validate() {
      switch (algorithm) {
        case WAN_I2V -> {
          if (imagePath == null || imagePath.isBlank())
            throw new ConfigException("image_path is required for " + algorithm.tag());
        }
        case QWEN_IMAGE -> {
          if (prompt == null || prompt.isBlank())
            throw new ConfigException("prompt is required for " + algorithm.tag());
        }
        case UPREZ -> {
          if (sourceCollectionUuid == null || sourceCollectionUuid.isBlank())
            throw new ConfigException("source_playlist_uuid is required for " + algorithm.tag());
        }
      }

      if (numGenerations < 1)
        throw new ConfigException("num_generations must be at least 1, got: " + numGenerations);

      if (outputFilename != null && outputFilename.isBlank())
        throw new ConfigException("output_filename must not be blank");

      if (submissionCommand != null && submissionCommand.isEmpty())
        throw new ConfigException("submission.command must not be empty");

      if (submissionTimeout.isZero() || submissionTimeout.isNegative())
        throw new ConfigException("submission.timeout_seconds must be > 0, got: " + submissionTimeout.toSeconds());

      if (marker != null && marker.isBlank())
        throw new ConfigException("tracking.marker must not be blank");
    }
  }
}
