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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Checks the result store for the completion of submitted jobs.
 * <p>
 * Each job's result lives under {@code bull:<queue>:<handle>}, in the {@value #RESULT_FIELD}
 * field. A poll answers one of two things: the job is complete and here is its
 * {@link CompletionRecord}, or nothing is known yet. Absence of the key, absence of the field,
 * a structured payload without artifact reference and any failure to read the store all mean
 * "pending". The poller never throws for store errors; the next poll cycle simply asks again.
 * </p>
 */
public final class CompletionPoller {
  private static final Logger logger = LoggerFactory.getLogger(CompletionPoller.class);

  static final String RESULT_FIELD = "returnvalue";

  private final ResultStore store;
  private final String queueName;

  public CompletionPoller(ResultStore store, String queueName) {
    this.store = requireNonNull(store, "store must not be null");
    this.queueName = requireNonNull(queueName, "queueName must not be null");
  }

  /**
   * Builds the key a job's result is stored under.
   *
   * @param queueName the queue the job was submitted to
   * @param handle    the job handle
   * @return the namespaced key
   */
  public static String keyOf(String queueName, String handle) {
    return "bull:" + queueName + ":" + handle;
  }

  public String queueName() {
    return queueName;
  }

  /**
   * Polls the completion of one job.
   *
   * @param handle the job handle
   * @return the completion record, or empty while the job is pending or its state is unknown
   */
  public Optional<CompletionRecord> poll(String handle) {
    requireNonNull(handle, "handle must not be null");

    Map<String, String> fields;
    try {
      fields = store.fieldsOf(keyOf(queueName, handle));
    } catch (RuntimeException e) {
      // reported as pending; the next cycle retries
      logger.debug("Result store read failed for handle {} on queue {}: {}", handle, queueName, e.getMessage());
      return Optional.empty();
    }

    if (fields == null || fields.isEmpty()) return Optional.empty();

    return CompletionPayload.parse(fields.get(RESULT_FIELD))
                            .flatMap(payload -> payload.artifactReference()
                                                       .map(reference -> new CompletionRecord(handle, reference, payload)));
  }
}
