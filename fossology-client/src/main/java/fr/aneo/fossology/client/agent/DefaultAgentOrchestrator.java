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
import fr.aneo.fossology.client.model.Page;
import fr.aneo.fossology.client.model.ReportFormat;
import fr.aneo.fossology.client.model.UploadId;
import fr.aneo.fossology.client.parser.ConsoleParser;
import fr.aneo.fossology.client.transport.ConsoleEndpoints;
import fr.aneo.fossology.client.transport.ConsoleTransport;
import fr.aneo.fossology.client.transport.FormData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static fr.aneo.fossology.client.agent.AwaitResult.Outcome.CANCELLED;
import static fr.aneo.fossology.client.agent.AwaitResult.Outcome.STILL_PENDING;
import static fr.aneo.fossology.client.transport.ConsoleEndpoints.AGENT_ADD;
import static fr.aneo.fossology.client.transport.ConsoleEndpoints.JOB_LIST;
import static java.util.Objects.requireNonNull;

/**
 * {@link AgentOrchestrator} driving the console's agent form and job pages.
 * <p>
 * The job list of an upload is rendered most recent first and is read page by page, stopping at
 * the first job run by the requested agent. Job status comes from the single job detail page.
 */
public final class DefaultAgentOrchestrator implements AgentOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(DefaultAgentOrchestrator.class);

  // Group id expected by the reuser form along with the reused upload.
  static final int REUSER_GROUP_ID = 3;

  private final ConsoleTransport transport;
  private final ConsoleParser parser;

  public DefaultAgentOrchestrator(ConsoleTransport transport, ConsoleParser parser) {
    this.transport = requireNonNull(transport, "transport must not be null");
    this.parser = requireNonNull(parser, "parser must not be null");
  }

  @Override
  public void startAgent(UploadId uploadId, List<String> agentIdentifiers) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(agentIdentifiers, "agentIdentifiers must not be null");
    if (agentIdentifiers.isEmpty()) throw new IllegalArgumentException("at least one agent is required");

    var form = FormData.builder();
    agentIdentifiers.forEach(agent -> form.add("agents[]", agent));
    form.add("upload", uploadId.asString());

    submitAgentForm(uploadId, agentIdentifiers, form.build());
  }

  @Override
  public void startReuserAgent(UploadId uploadId, UploadId reusedUploadId) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(reusedUploadId, "reusedUploadId must not be null");

    var form = FormData.builder()
                       .add("agents[]", Agent.REUSER.formValue())
                       .add("upload", uploadId.asString())
                       .add("uploadToReuse", reusedUploadId.asString() + "," + REUSER_GROUP_ID)
                       .build();

    submitAgentForm(uploadId, List.of(Agent.REUSER.formValue()), form);
  }

  @Override
  public void startLicenseScanAgents(UploadId uploadId) {
    startAgent(uploadId, Agent.MONK, Agent.NOMOS);
  }

  @Override
  public void startCopyrightAgent(UploadId uploadId) {
    startAgent(uploadId, Agent.COPYRIGHT);
  }

  @Override
  public void startReportGeneratorAgent(UploadId uploadId, ReportFormat format) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(format, "format must not be null");

    transport.get(ConsoleEndpoints.reportGeneration(format.outputFormat(), uploadId));
    logger.info("Requested {} report generation for {}", format.outputFormat(), uploadId);
  }

  @Override
  public Optional<JobId> findMostRecentJob(UploadId uploadId, String agentName) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(agentName, "agentName must not be null");

    int pageNumber = 0;
    while (true) {
      var page = fetchJobPage(uploadId, pageNumber);
      var match = page.items()
                      .stream()
                      .filter(job -> job.agent().equals(agentName))
                      .map(Job::id)
                      .findFirst();
      if (match.isPresent()) return match;
      if (page.isEmpty() || !page.hasNext()) break;
      pageNumber++;
    }

    logger.debug("No {} job found for {}", agentName, uploadId);
    return Optional.empty();
  }

  @Override
  public Optional<Job> getJob(JobId jobId) {
    requireNonNull(jobId, "jobId must not be null");

    var response = transport.get(ConsoleEndpoints.singleJob(jobId));
    return parser.parseJob(response.bodyAsString());
  }

  @Override
  public List<Job> listJobs(UploadId uploadId) {
    requireNonNull(uploadId, "uploadId must not be null");

    var jobs = new ArrayList<Job>();
    int pageNumber = 0;
    Page<Job> page;
    do {
      page = fetchJobPage(uploadId, pageNumber++);
      jobs.addAll(page.items());
    } while (!page.isEmpty() && page.hasNext());

    return jobs;
  }

  @Override
  public boolean isDone(UploadId uploadId, String agentName) {
    return findMostRecentJob(uploadId, agentName).flatMap(this::getJob)
                                                 .map(Job::isTerminal)
                                                 .orElse(false);
  }

  @Override
  public AwaitResult awaitCompletion(UploadId uploadId, String agentName, AwaitOptions options) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(agentName, "agentName must not be null");
    requireNonNull(options, "options must not be null");

    // Measured on the same monotonic time base as the cancellation wait.
    var deadline = options.maxDuration().map(timeout -> System.nanoTime() + timeout.toNanos());
    var cancellation = options.cancellation();
    JobId jobId = null;
    Job lastSeen = null;

    logger.debug("Waiting for {} job of {} (poll every {}, timeout {})", agentName, uploadId, options.pollInterval(), options.timeout());
    while (true) {
      if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
        logger.info("Wait for {} job of {} cancelled", agentName, uploadId);
        return new AwaitResult(CANCELLED, Optional.ofNullable(lastSeen));
      }

      if (jobId == null) {
        jobId = findMostRecentJob(uploadId, agentName).orElse(null);
      }
      if (jobId != null) {
        lastSeen = getJob(jobId).orElse(lastSeen);
        if (lastSeen != null && lastSeen.isTerminal()) {
          logger.info("{} job {} of {} finished with status '{}'", agentName, jobId.asString(), uploadId, lastSeen.status());
          return AwaitResult.finished(lastSeen);
        }
      }

      var now = System.nanoTime();
      if (deadline.isPresent() && now - deadline.get() >= 0) {
        logger.warn("Gave up waiting for {} job of {} after {}", agentName, uploadId, options.timeout());
        return new AwaitResult(STILL_PENDING, Optional.ofNullable(lastSeen));
      }

      logger.debug("{} job of {} not finished yet (status '{}')", agentName, uploadId, lastSeen == null ? "not found" : lastSeen.status());
      try {
        if (cancellation.awaitCancellation(nextWait(options.pollInterval(), now, deadline))) {
          logger.info("Wait for {} job of {} cancelled", agentName, uploadId);
          return new AwaitResult(CANCELLED, Optional.ofNullable(lastSeen));
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.info("Wait for {} job of {} interrupted", agentName, uploadId);
        return new AwaitResult(CANCELLED, Optional.ofNullable(lastSeen));
      }
    }
  }

  private static Duration nextWait(Duration pollInterval, long now, Optional<Long> deadline) {
    if (deadline.isEmpty()) return pollInterval;

    var remaining = Duration.ofNanos(deadline.get() - now);
    return remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
  }

  private Page<Job> fetchJobPage(UploadId uploadId, int pageNumber) {
    var form = FormData.builder()
                       .add("upload", uploadId.asString())
                       .add("allusers", 0)
                       .add("page", pageNumber)
                       .build();

    return parser.parseJobPage(transport.post(JOB_LIST, form).bodyAsString());
  }

  private void submitAgentForm(UploadId uploadId, List<String> agentIdentifiers, FormData form) {
    transport.post(AGENT_ADD, form);
    logger.info("Started {} on {}", agentIdentifiers, uploadId);
  }
}
