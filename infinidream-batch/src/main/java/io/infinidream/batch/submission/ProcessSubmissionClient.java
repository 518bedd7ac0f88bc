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
package io.infinidream.batch.submission;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import io.infinidream.batch.definition.Algorithm;
import io.infinidream.batch.definition.JobDescriptor;
import io.infinidream.batch.exception.ConfigException;
import io.infinidream.batch.exception.HandleMissingException;
import io.infinidream.batch.exception.SubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.infinidream.batch.exception.SubmissionException.NO_EXIT_STATUS;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * {@link SubmissionClient} that runs an external command once per job.
 * <p>
 * The descriptor is serialized to a single JSON object and written to the command's standard
 * input. Standard output and standard error are drained concurrently so that a chatty command
 * cannot block on a full pipe. The job is accepted when the command exits with status zero; the
 * handle is then read from the output by {@link SubmissionOutputParser}.
 * </p>
 *
 * <h2>Failure Mapping</h2>
 * <ul>
 *   <li>command cannot be started, is interrupted or exceeds the timeout: {@link SubmissionException}
 *       with {@link SubmissionException#NO_EXIT_STATUS}</li>
 *   <li>non-zero exit status: {@link SubmissionException} carrying the status and standard error</li>
 *   <li>zero exit status without a parseable handle: {@link HandleMissingException}</li>
 * </ul>
 */
public final class ProcessSubmissionClient implements SubmissionClient {
  private static final Logger logger = LoggerFactory.getLogger(ProcessSubmissionClient.class);

  private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(
    new ThreadFactoryBuilder().setNameFormat("submission-io-%d").setDaemon(true).build()
  );

  private final List<String> command;
  private final Path workingDirectory;
  private final Duration timeout;
  private final Gson gson = new Gson();

  /**
   * Creates a client running the given command.
   *
   * @param command          the command and its arguments
   * @param workingDirectory the directory the command runs in
   * @param timeout          how long a single submission may take
   */
  public ProcessSubmissionClient(List<String> command, Path workingDirectory, Duration timeout) {
    requireNonNull(command, "command must not be null");
    if (command.isEmpty()) throw new IllegalArgumentException("command must not be empty");
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
    }

    this.command = List.copyOf(command);
    this.workingDirectory = requireNonNull(workingDirectory, "workingDirectory must not be null");
    this.timeout = timeout;
  }

  /**
   * Creates a client running the default Node.js submission script of an algorithm.
   *
   * @param algorithm       the algorithm whose queue receives the jobs
   * @param workerDirectory the worker project directory containing the built scripts
   * @param timeout         how long a single submission may take
   * @return the client
   * @throws ConfigException if the script has not been built
   */
  public static ProcessSubmissionClient forAlgorithm(Algorithm algorithm, Path workerDirectory, Duration timeout) {
    var script = workerDirectory.resolve(algorithm.defaultSubmissionScript());
    if (!Files.isRegularFile(script)) {
      throw new ConfigException("Submission script not built. Run 'npm run build' first. Expected: " + script);
    }
    return new ProcessSubmissionClient(List.of("node", script.toString()), workerDirectory, timeout);
  }

  public List<String> command() {
    return command;
  }

  @Override
  public String submit(JobDescriptor descriptor) {
    requireNonNull(descriptor, "descriptor must not be null");

    var payload = gson.toJson(descriptor.toPayload());
    var process = start();

    var stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), STREAM_READERS);
    var stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), STREAM_READERS);

    try (var stdin = process.getOutputStream()) {
      stdin.write(payload.getBytes(UTF_8));
    } catch (IOException e) {
      logger.debug("Submission command closed its input early: {}", e.getMessage());
    }

    int exitStatus = awaitExit(process);
    var output = stdout.join();
    var errors = stderr.join();

    if (exitStatus != 0) {
      throw new SubmissionException(exitStatus, errors.isBlank() ? output : errors);
    }

    return SubmissionOutputParser.findHandle(output)
                                 .orElseThrow(() -> new HandleMissingException(output));
  }

  private Process start() {
    try {
      return new ProcessBuilder(command).directory(workingDirectory.toFile()).start();
    } catch (IOException e) {
      throw new SubmissionException("Failed to start submission command " + command, e);
    }
  }

  private int awaitExit(Process process) {
    try {
      if (!process.waitFor(timeout.toMillis(), MILLISECONDS)) {
        process.destroyForcibly();
        throw new SubmissionException(NO_EXIT_STATUS, "Submission command timed out after " + timeout.toSeconds() + "s");
      }
      return process.exitValue();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new SubmissionException("Interrupted while waiting for the submission command", e);
    }
  }

  private static String readFully(InputStream stream) {
    try (stream) {
      return new String(stream.readAllBytes(), UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
