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
package io.infinidream.batch.cli;

import com.google.gson.GsonBuilder;
import io.infinidream.batch.BatchReport;
import io.infinidream.batch.BatchRunner;
import io.infinidream.batch.collection.HttpCollectionService;
import io.infinidream.batch.config.BatchSettings;
import io.infinidream.batch.config.BatchSettingsLoader;
import io.infinidream.batch.config.EnvironmentSettings;
import io.infinidream.batch.exception.ConfigException;
import io.infinidream.batch.materialize.HttpArtifactTransfer;
import io.infinidream.batch.result.CompletionPayload;
import io.infinidream.batch.result.CompletionPoller;
import io.infinidream.batch.result.RedisResultStore;
import io.infinidream.batch.submission.ProcessSubmissionClient;
import io.infinidream.batch.submission.SubmissionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Command-line entry point.
 *
 * <h2>Usage</h2>
 * <pre>
 * BatchMain run &lt;job.json&gt; [--worker-dir &lt;dir&gt;]
 * BatchMain inspect &lt;handle&gt; [queue]
 * </pre>
 * <p>
 * {@code run} executes the batch described by a job file. The worker directory holds the
 * submission scripts and is the base of relative paths; it defaults to the current directory.
 * {@code inspect} polls the result of a single job once and prints it.
 * </p>
 *
 * <h2>Exit status</h2>
 * <ul>
 *   <li>{@value #EXIT_OK}: the batch ran and every job was submitted</li>
 *   <li>{@value #EXIT_SUBMISSION_FAILED}: at least one job failed to submit</li>
 *   <li>{@value #EXIT_CONFIG_ERROR}: invalid arguments, job file or environment</li>
 *   <li>{@value #EXIT_UNEXPECTED}: any other failure</li>
 * </ul>
 * <p>
 * On SIGINT the polling loop is interrupted and the summary of the batch so far is printed
 * before the JVM exits.
 * </p>
 */
public final class BatchMain {
  private static final Logger logger = LoggerFactory.getLogger(BatchMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_SUBMISSION_FAILED = 1;
  static final int EXIT_CONFIG_ERROR = 2;
  static final int EXIT_UNEXPECTED = 3;

  static final String DEFAULT_INSPECT_QUEUE = "wani2v";
  private static final long SHUTDOWN_GRACE_MILLIS = 30_000;

  private BatchMain() {
  }

  public static void main(String[] args) {
    var shuttingDown = new AtomicBoolean(false);
    var mainThread = Thread.currentThread();
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      shuttingDown.set(true);
      mainThread.interrupt();
      try {
        mainThread.join(SHUTDOWN_GRACE_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "batch-shutdown"));

    int status = execute(args, EnvironmentSettings::fromSystem, System.out);
    if (!shuttingDown.get()) System.exit(status);
  }

  /**
   * Parses the arguments and runs the requested command.
   *
   * @param args        the command-line arguments
   * @param environment supplies the environment settings, read only once arguments are valid
   * @param out         where results are printed
   * @return the exit status
   */
  static int execute(String[] args, Supplier<EnvironmentSettings> environment, PrintStream out) {
    try {
      var command = Command.parse(args);
      if (command instanceof Command.Run run) return run(run, environment.get(), out);
      return inspect((Command.Inspect) command, environment.get(), out);
    } catch (ConfigException e) {
      logger.error("Configuration error: {}", e.getMessage());
      out.println("Error: " + e.getMessage());
      out.println(Command.USAGE);
      return EXIT_CONFIG_ERROR;
    } catch (RuntimeException e) {
      logger.error("Batch failed unexpectedly", e);
      return EXIT_UNEXPECTED;
    }
  }

  private static int run(Command.Run command, EnvironmentSettings environment, PrintStream out) {
    var settings = BatchSettingsLoader.load(command.jobFile());
    logger.info("Worker directory: {}", command.workerDirectory().toAbsolutePath());
    logger.debug("{} / {}", settings, environment);

    var submissionClient = submissionClient(settings, command.workerDirectory());
    var collectionService = environment.hasCollectionService()
      ? HttpCollectionService.create(environment.backendUrl().orElseThrow(), environment.apiKey().orElseThrow())
      : null;

    try (var resultStore = connect(environment)) {
      var runner = new BatchRunner(
        settings,
        command.workerDirectory(),
        submissionClient,
        resultStore,
        collectionService,
        HttpArtifactTransfer.create());

      BatchReport report = runner.run();
      out.println(report.summary());
      return report.exitCode();
    }
  }

  private static int inspect(Command.Inspect command, EnvironmentSettings environment, PrintStream out) {
    try (var resultStore = connect(environment)) {
      var poller = new CompletionPoller(resultStore, command.queue());
      var record = poller.poll(command.handle());

      if (record.isEmpty()) {
        out.println("No result yet for job " + command.handle() + " on queue " + command.queue());
        return EXIT_OK;
      }

      out.println("Job " + command.handle() + " completed");
      out.println("Artifact: " + record.get().artifactReference());
      if (record.get().payload() instanceof CompletionPayload.Structured structured) {
        out.println(new GsonBuilder().setPrettyPrinting().create().toJson(structured.fields()));
      }
      return EXIT_OK;
    }
  }

  private static SubmissionClient submissionClient(BatchSettings settings, Path workerDirectory) {
    if (settings.submissionCommand() != null) {
      return new ProcessSubmissionClient(settings.submissionCommand(), workerDirectory, settings.submissionTimeout());
    }
    return ProcessSubmissionClient.forAlgorithm(settings.algorithm(), workerDirectory, settings.submissionTimeout());
  }

  private static RedisResultStore connect(EnvironmentSettings environment) {
    return environment.redisUrl()
                      .map(RedisResultStore::connect)
                      .orElseGet(() -> RedisResultStore.connect(
                        environment.redisHost(),
                        environment.redisPort(),
                        environment.redisPassword().orElse(null)));
  }

  /**
   * A parsed command line.
   */
  sealed interface Command {
    String USAGE = "Usage: BatchMain run <job.json> [--worker-dir <dir>] | BatchMain inspect <handle> [queue]";

    record Run(Path jobFile, Path workerDirectory) implements Command {
    }

    record Inspect(String handle, String queue) implements Command {
    }

    /**
     * Parses the command-line arguments.
     *
     * @param args the arguments
     * @return the command
     * @throws ConfigException if the arguments are invalid
     */
    static Command parse(String[] args) {
      if (args == null || args.length == 0) throw new ConfigException("No command given");

      var rest = new ArrayList<>(List.of(args).subList(1, args.length));
      return switch (args[0]) {
        case "run" -> {
          Path workerDirectory = Path.of("");
          int flag = rest.indexOf("--worker-dir");
          if (flag >= 0) {
            if (flag + 1 >= rest.size()) throw new ConfigException("--worker-dir requires a directory");
            workerDirectory = Path.of(rest.get(flag + 1));
            rest.subList(flag, flag + 2).clear();
          }
          if (rest.size() != 1) throw new ConfigException("run expects exactly one job file");
          yield new Run(Path.of(rest.get(0)), workerDirectory);
        }
        case "inspect" -> {
          if (rest.isEmpty() || rest.size() > 2) throw new ConfigException("inspect expects a handle and an optional queue");
          yield new Inspect(rest.get(0), rest.size() == 2 ? rest.get(1) : DEFAULT_INSPECT_QUEUE);
        }
        default -> throw new ConfigException("Unknown command: " + args[0]);
      };
    }
  }
}
