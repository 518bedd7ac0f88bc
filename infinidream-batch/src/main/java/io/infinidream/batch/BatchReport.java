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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a batch run.
 * <p>
 * Counts partition the planned jobs: every job was either skipped as a duplicate, failed to
 * submit, or was submitted. Submitted jobs are either untracked (the queue gave no handle) or
 * tracked, and tracked jobs end materialized, timed out, or still outstanding when the run was
 * interrupted or had no destination to materialize into.
 * </p>
 *
 * @param planned            number of jobs in the plan, including inputs left out as already processed
 * @param submitted          jobs accepted by the queue, tracked or not
 * @param skippedAsDuplicate jobs already recorded in the ledger, or repeated within the batch
 * @param failedToSubmit     jobs the submission command rejected
 * @param untracked          submitted jobs for which no handle was returned
 * @param materialized       jobs whose artifact was materialized
 * @param timedOut           jobs still pending when the polling deadline passed
 * @param outstanding        tracked jobs left pending, including timed out ones
 * @param interrupted        whether the run was interrupted before completing
 */
public record BatchReport(
  int planned,
  int submitted,
  int skippedAsDuplicate,
  int failedToSubmit,
  int untracked,
  int materialized,
  int timedOut,
  List<JobHandle> outstanding,
  boolean interrupted
) {

  public BatchReport {
    outstanding = List.copyOf(requireNonNull(outstanding, "outstanding must not be null"));
  }

  /**
   * Returns the process exit status for this report.
   * <p>
   * Only submission failures make a batch fail; jobs that timed out or were still being
   * materialized are reported but leave the status at zero.
   * </p>
   *
   * @return {@code 1} if any job failed to submit, {@code 0} otherwise
   */
  public int exitCode() {
    return failedToSubmit > 0 ? 1 : 0;
  }

  /**
   * Renders a multi-line human-readable summary.
   *
   * @return the summary
   */
  public String summary() {
    var builder = new StringBuilder()
      .append("Planned: ").append(planned).append('\n')
      .append("Skipped (already done): ").append(skippedAsDuplicate).append('\n')
      .append("Submitted: ").append(submitted).append('\n')
      .append("Failed to submit: ").append(failedToSubmit).append('\n')
      .append("Untracked: ").append(untracked).append('\n')
      .append("Materialized: ").append(materialized).append('\n')
      .append("Timed out: ").append(timedOut);
    if (interrupted) builder.append('\n').append("Interrupted with ").append(outstanding.size()).append(" job(s) outstanding");
    for (var handle : outstanding) {
      builder.append('\n').append("  - ").append(handle.handle()).append(" (").append(handle.combination().displayName()).append(')');
    }
    return builder.toString();
  }
}
