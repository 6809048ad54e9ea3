/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package fr.aneo.fossology.client.agent;

import fr.aneo.fossology.client.model.Job;
import fr.aneo.fossology.client.model.JobId;
import fr.aneo.fossology.client.model.ReportFormat;
import fr.aneo.fossology.client.model.UploadId;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Starts scanning agents against uploads and follows the jobs they run.
 * <p>
 * Starting an agent does not return the job it creates: the server only lists the job with
 * the other jobs of the upload. The orchestrator finds it as the most recent job of the upload
 * run by that agent, then polls its status until it is terminal (see
 * {@link fr.aneo.fossology.client.model.JobStatus}).
 *
 * <pre>{@code
 * orchestrator.startLicenseScanAgents(uploadId);
 * var result = orchestrator.awaitCompletion(uploadId, Agent.MONK.jobName(),
 *                                           AwaitOptions.every(Duration.ofSeconds(10)).withTimeout(Duration.ofHours(1)));
 * }</pre>
 *
 * @see DefaultAgentOrchestrator
 */
public interface AgentOrchestrator {

  /**
   * Starts one or more agents against an upload. Returns once the request is accepted; the
   * agents run in the background.
   *
   * @param uploadId         the upload to analyze
   * @param agentIdentifiers agent form identifiers (for example {@code agent_copyright})
   * @throws IllegalArgumentException if no agent is given
   */
  void startAgent(UploadId uploadId, List<String> agentIdentifiers);

  default void startAgent(UploadId uploadId, Agent... agents) {
    startAgent(uploadId, Arrays.stream(agents).map(Agent::formValue).collect(toList()));
  }

  /**
   * Starts the reuser agent, copying the conclusions of another upload.
   *
   * @param uploadId       the upload to analyze
   * @param reusedUploadId the upload whose conclusions are reused
   */
  void startReuserAgent(UploadId uploadId, UploadId reusedUploadId);

  /**
   * Starts the monk and nomos license scanners in one request.
   *
   * @param uploadId the upload to analyze
   */
  void startLicenseScanAgents(UploadId uploadId);

  void startCopyrightAgent(UploadId uploadId);

  /**
   * Starts the generation of a report for an upload.
   *
   * @param uploadId the upload to export
   * @param format   the report format
   */
  void startReportGeneratorAgent(UploadId uploadId, ReportFormat format);

  /**
   * Finds the job of the most recent run of an agent against an upload.
   *
   * @param uploadId  the upload
   * @param agentName the agent name as shown in job lists (for example {@code monk})
   * @return the job identifier, or empty if the agent never ran against this upload
   */
  Optional<JobId> findMostRecentJob(UploadId uploadId, String agentName);

  /**
   * Reads the current state of a job.
   *
   * @param jobId the job
   * @return the job, or empty if the server does not describe it
   */
  Optional<Job> getJob(JobId jobId);

  /**
   * Lists every job of an upload, most recent first.
   *
   * @param uploadId the upload
   * @return the jobs of the upload
   */
  List<Job> listJobs(UploadId uploadId);

  /**
   * Tells whether the most recent run of an agent against an upload is finished, whether it
   * completed or was killed.
   *
   * @param uploadId  the upload
   * @param agentName the agent name as shown in job lists
   * @return true if the job is terminal; false if it is in progress or if no job was found
   */
  boolean isDone(UploadId uploadId, String agentName);

  /**
   * Blocks until the most recent run of an agent against an upload is finished, polling at the
   * given interval.
   * <p>
   * There is no timeout; the wait ends early if the calling thread is interrupted, in which
   * case the result is {@link AwaitResult.Outcome#CANCELLED}.
   *
   * @param uploadId     the upload
   * @param agentName    the agent name as shown in job lists
   * @param pollInterval delay between two status checks
   * @return the outcome of the wait
   */
  default AwaitResult waitUntilDone(UploadId uploadId, String agentName, Duration pollInterval) {
    return awaitCompletion(uploadId, agentName, AwaitOptions.every(pollInterval));
  }

  /**
   * Blocks until the most recent run of an agent against an upload is finished, the timeout
   * elapses, or the wait is cancelled.
   * <p>
   * While the job cannot be found yet, the job list is read again at every poll.
   *
   * @param uploadId  the upload
   * @param agentName the agent name as shown in job lists
   * @param options   poll interval, timeout and cancellation token
   * @return the outcome of the wait and the last observed job state
   */
  AwaitResult awaitCompletion(UploadId uploadId, String agentName, AwaitOptions options);
}
