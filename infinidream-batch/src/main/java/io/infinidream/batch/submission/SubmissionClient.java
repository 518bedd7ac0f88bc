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

import io.infinidream.batch.definition.JobDescriptor;
import io.infinidream.batch.exception.HandleMissingException;
import io.infinidream.batch.exception.SubmissionException;

/**
 * Boundary through which job descriptors are handed to the external work queue.
 * <p>
 * A successful call means the queue accepted the job, not that the job completed. Implementations
 * block until the queue has answered and must be safe to call from several submission workers
 * at once.
 * </p>
 *
 * @see ProcessSubmissionClient
 */
public interface SubmissionClient {

  /**
   * Submits one job.
   *
   * @param descriptor the job to submit
   * @return the opaque handle assigned by the queue
   * @throws SubmissionException    if the queue rejected the job or could not be reached
   * @throws HandleMissingException if the job was accepted but no handle came back
   */
  String submit(JobDescriptor descriptor);
}
