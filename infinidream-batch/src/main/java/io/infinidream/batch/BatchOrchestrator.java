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
package io.infinidream.batch;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.infinidream.batch.definition.JobDescriptor;
import io.infinidream.batch.definition.JobDescriptorBuilder;
import io.infinidream.batch.exception.HandleMissingException;
import io.infinidream.batch.exception.MaterializationException;
import io.infinidream.batch.exception.SubmissionException;
import io.infinidream.batch.identity.JobIdentifier;
import io.infinidream.batch.materialize.MaterializationPipeline;
import io.infinidream.batch.result.CompletionPoller;
import io.infinidream.batch.submission.SubmissionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Drives a batch from its plan to its report.
 * <p>
 * A run goes through three phases:
 * </p>
 * <ol>
 *   <li><strong>Filtering</strong>: combinations whose identifier is already in the ledger, or
 *       repeats an earlier combination of the same batch, are skipped. Descriptors are built
 *       for the remaining ones, so configuration errors surface before anything is submitted.</li>
 *   <li><strong>Submission</strong>: descriptors are submitted on a fixed-size pool; outcomes are
 *       collected on the calling thread as they arrive. A failed submission is counted and the
 *       batch continues.</li>
 *   <li><strong>Polling</strong>: the calling thread repeatedly polls every pending handle once,
 *       materializes completed ones and sleeps between cycles, until nothing is pending or the
 *       deadline has passed. A failed materialization leaves the handle pending for the next
 *       cycle. Handles still pending at the deadline are timed out.</li>
 * </ol>
 * <p>
 * Without a materialization pipeline the polling phase is skipped and every tracked handle is
 * reported as outstanding.
 * </p>
 *
 * <h2>Interruption</h2>
 * <p>
 * Interrupting the calling thread stops the run at the next submission outcome or poll step.
 * Submissions not yet started are dropped. Running ones are interrupted, and every submission
 * that returned is still counted, so a job that reached the queue appears in the report. The
 * report is then flagged {@link BatchReport#interrupted() interrupted}, lists the handles still
 * pending, and the interrupt flag is restored.
 * </p>
 */
public final class BatchOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

  static final Duration SUBMISSION_STOP_GRACE = Duration.ofSeconds(5);

  private final SubmissionClient submissionClient;
  private final JobDescriptorBuilder descriptorBuilder;
  private final CompletionPoller poller;
  private final MaterializationPipeline pipeline;
  private final SubmissionPolicy submissionPolicy;
  private final PollingPolicy pollingPolicy;

  private BatchOrchestrator(Builder builder) {
    this.submissionClient = builder.submissionClient;
    this.descriptorBuilder = builder.descriptorBuilder;
    this.poller = builder.poller;
    this.pipeline = builder.pipeline;
    this.submissionPolicy = builder.submissionPolicy;
    this.pollingPolicy = builder.pollingPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs a batch.
   *
   * @param plan     the combinations to run
   * @param existing identifiers already recorded in the destination ledger
   * @return the report of the run
   * @throws io.infinidream.batch.exception.ConfigException if a descriptor cannot be built
   */
  public BatchReport run(BatchPlan plan, Set<JobIdentifier> existing) {
    requireNonNull(plan, "plan must not be null");
    requireNonNull(existing, "existing must not be null");

    var tally = new Tally(plan.size() + plan.alreadyProcessed());
    tally.skipped = plan.alreadyProcessed();

    var descriptors = filter(plan, existing, tally);
    logger.info("{} job(s) to submit, {} skipped as already done", descriptors.size(), tally.skipped);

    var tracked = new ArrayList<JobHandle>();
    boolean interrupted = !submitAll(descriptors, tracked, tally);

    if (interrupted) return tally.report(tracked, true);
    if (tracked.isEmpty()) return tally.report(List.of(), false);
    if (pipeline == null) {
      logger.info("No destination configured, {} job(s) left to complete on their own", tracked.size());
      return tally.report(tracked, false);
    }

    return pollUntilDone(tracked, tally);
  }

  private Map<Combination, JobDescriptor> filter(BatchPlan plan, Set<JobIdentifier> existing, Tally tally) {
    var seen = new HashSet<JobIdentifier>();
    var descriptors = new LinkedHashMap<Combination, JobDescriptor>();

    for (var combination : plan.combinations()) {
      var identifier = combination.identifier();
      if (existing.contains(identifier)) {
        logger.debug("Skipping '{}': {} already in the ledger", combination.displayName(), identifier.asString());
        tally.skipped++;
      } else if (!seen.add(identifier)) {
        logger.debug("Skipping '{}': {} repeats an earlier job of this batch", combination.displayName(), identifier.asString());
        tally.skipped++;
      } else {
        descriptors.put(combination, descriptorBuilder.build(combination.context()));
      }
    }
    return descriptors;
  }

  /**
   * Submits every descriptor and records the tracked handles.
   *
   * @return {@code false} if interrupted
   */
  private boolean submitAll(Map<Combination, JobDescriptor> descriptors, List<JobHandle> tracked, Tally tally) {
    if (descriptors.isEmpty()) return true;

    var executor = Executors.newFixedThreadPool(
      Math.min(submissionPolicy.concurrency(), descriptors.size()),
      new ThreadFactoryBuilder().setNameFormat("submission-%d").setDaemon(true).build());
    var completion = new ExecutorCompletionService<SubmissionOutcome>(executor);

    int total = descriptors.size();
    int done = 0;
    try {
      descriptors.forEach((combination, descriptor) -> completion.submit(() -> submit(combination, descriptor)));

      while (done < total) {
        account(completion.take().get(), ++done, total, tracked, tally);
      }
      return true;
    } catch (InterruptedException e) {
      done = accountFinished(executor, completion, done, total, tracked, tally);
      Thread.currentThread().interrupt();
      logger.warn("Interrupted during submission, {} job(s) submitted so far, {} not yet answered",
                  tally.submitted, total - done);
      return false;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Submission task failed unexpectedly", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Stops pending submissions and records those that finished or were cut short.
   * <p>
   * Submissions still queued in the executor never reach the queue and are not recorded.
   * Running ones are interrupted and given {@link #SUBMISSION_STOP_GRACE} to return.
   * </p>
   *
   * @return the number of submissions recorded so far
   */
  private int accountFinished(ExecutorService executor,
                              ExecutorCompletionService<SubmissionOutcome> completion,
                              int done,
                              int total,
                              List<JobHandle> tracked,
                              Tally tally) {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(SUBMISSION_STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Submissions still running after {}, their outcome is unknown", SUBMISSION_STOP_GRACE);
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted again while stopping submissions");
    }

    Future<SubmissionOutcome> finished;
    while (done < total && (finished = completion.poll()) != null) {
      try {
        account(finished.get(), ++done, total, tracked, tally);
      } catch (InterruptedException | ExecutionException e) {
        logger.warn("Cannot read the outcome of a finished submission", e);
      }
    }
    return done;
  }

  private void account(SubmissionOutcome outcome, int done, int total, List<JobHandle> tracked, Tally tally) {
    var name = outcome.combination().displayName();

    if (outcome instanceof SubmissionOutcome.Tracked submitted) {
      tally.submitted++;
      tracked.add(new JobHandle(submitted.handle(), submitted.combination()));
      logger.info("[{}/{}] Submitted '{}' as job {}", done, total, name, submitted.handle());
    } else if (outcome instanceof SubmissionOutcome.Untracked untracked) {
      tally.submitted++;
      tally.untracked++;
      logger.warn("[{}/{}] Submitted '{}' but no job handle was returned, it will not be tracked: {}",
                  done, total, name, untracked.error().getMessage());
    } else if (outcome instanceof SubmissionOutcome.Failed failed) {
      tally.failed++;
      logger.error("[{}/{}] Failed to submit '{}': {}", done, total, name, failed.error().getMessage());
    }
  }

  private SubmissionOutcome submit(Combination combination, JobDescriptor descriptor) {
    try {
      return new SubmissionOutcome.Tracked(combination, submissionClient.submit(descriptor));
    } catch (HandleMissingException e) {
      return new SubmissionOutcome.Untracked(combination, e);
    } catch (SubmissionException e) {
      return new SubmissionOutcome.Failed(combination, e);
    } catch (RuntimeException e) {
      return new SubmissionOutcome.Failed(combination, new SubmissionException("Unexpected submission failure", e));
    }
  }

  private BatchReport pollUntilDone(List<JobHandle> tracked, Tally tally) {
    var pending = new ArrayList<>(tracked);
    var stopwatch = Stopwatch.createStarted();
    logger.info("Waiting for {} job(s) to complete", pending.size());

    try {
      while (!pending.isEmpty()) {
        pollOnce(pending, tally);
        if (pending.isEmpty()) break;

        if (stopwatch.elapsed().compareTo(pollingPolicy.maxWait()) >= 0) {
          logger.warn("Timeout: {} job(s) did not complete within {}", pending.size(), pollingPolicy.maxWait());
          for (var handle : pending) {
            handle.timeOut();
            tally.timedOut++;
          }
          return tally.report(pending, false);
        }

        logger.info("Waiting for {} more job(s)", pending.size());
        Thread.sleep(pollingPolicy.interval().toMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while polling, {} job(s) outstanding", pending.size());
      return tally.report(pending, true);
    }

    logger.info("All tracked jobs materialized in {}", stopwatch);
    return tally.report(List.of(), false);
  }

  private void pollOnce(List<JobHandle> pending, Tally tally) throws InterruptedException {
    var iterator = pending.iterator();
    while (iterator.hasNext()) {
      if (Thread.currentThread().isInterrupted()) throw new InterruptedException();

      var handle = iterator.next();
      var record = poller.poll(handle.handle());
      if (record.isEmpty()) continue;

      var combination = handle.combination();
      logger.info("Job {} completed, materializing '{}'", handle.handle(), combination.displayName());
      try {
        handle.complete(pipeline.materialize(combination.context(), combination.identifier(), record.get()));
        tally.materialized++;
        iterator.remove();
      } catch (MaterializationException e) {
        handle.recordFailedAttempt();
        logger.warn("Materialization of job {} failed (attempt {}), will retry: {}",
                    handle.handle(), handle.failedAttempts(), e.getMessage());
      }
    }
  }

  private sealed interface SubmissionOutcome {
    Combination combination();

    record Tracked(Combination combination, String handle) implements SubmissionOutcome {
    }

    record Untracked(Combination combination, HandleMissingException error) implements SubmissionOutcome {
    }

    record Failed(Combination combination, SubmissionException error) implements SubmissionOutcome {
    }
  }

  private static final class Tally {
    private final int planned;
    private int submitted;
    private int skipped;
    private int failed;
    private int untracked;
    private int materialized;
    private int timedOut;

    private Tally(int planned) {
      this.planned = planned;
    }

    private BatchReport report(List<JobHandle> outstanding, boolean interrupted) {
      return new BatchReport(planned, submitted, skipped, failed, untracked, materialized, timedOut, outstanding, interrupted);
    }
  }

  /**
   * Builder for {@link BatchOrchestrator}.
   */
  public static final class Builder {
    private SubmissionClient submissionClient;
    private JobDescriptorBuilder descriptorBuilder;
    private CompletionPoller poller;
    private MaterializationPipeline pipeline;
    private SubmissionPolicy submissionPolicy = SubmissionPolicy.DEFAULT;
    private PollingPolicy pollingPolicy = PollingPolicy.DEFAULT;

    private Builder() {
    }

    public Builder submissionClient(SubmissionClient submissionClient) {
      this.submissionClient = submissionClient;
      return this;
    }

    public Builder descriptorBuilder(JobDescriptorBuilder descriptorBuilder) {
      this.descriptorBuilder = descriptorBuilder;
      return this;
    }

    public Builder poller(CompletionPoller poller) {
      this.poller = poller;
      return this;
    }

    /**
     * Sets the materialization pipeline; without one, completed jobs are not polled.
     */
    public Builder pipeline(MaterializationPipeline pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    public Builder submissionPolicy(SubmissionPolicy submissionPolicy) {
      this.submissionPolicy = requireNonNull(submissionPolicy, "submissionPolicy must not be null");
      return this;
    }

    public Builder pollingPolicy(PollingPolicy pollingPolicy) {
      this.pollingPolicy = requireNonNull(pollingPolicy, "pollingPolicy must not be null");
      return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return the orchestrator
     * @throws IllegalArgumentException if a required collaborator is missing
     */
    public BatchOrchestrator build() {
      if (submissionClient == null) throw new IllegalArgumentException("submissionClient is required");
      if (descriptorBuilder == null) throw new IllegalArgumentException("descriptorBuilder is required");
      if (pipeline != null && poller == null) throw new IllegalArgumentException("poller is required to materialize results");
      return new BatchOrchestrator(this);
    }
  }
}
