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
package fr.aneo.fossology.client.model;

import java.util.OptionalLong;

import static java.util.Objects.requireNonNull;

/**
 * One run of an agent against an upload.
 * <p>
 * Jobs are created by the server when an agent is started and are observed by polling. The
 * report identifier is only present for report generating agents once the report exists.
 *
 * @param id       the server-assigned job identifier
 * @param agent    the name of the agent run by this job (for example {@code monk} or {@code spdx2tv})
 * @param status   the last status reported by the server
 * @param reportId the identifier of the generated report, if any
 */
public record Job(JobId id, String agent, JobStatus status, OptionalLong reportId) {

  public Job {
    requireNonNull(id, "id must not be null");
    requireNonNull(agent, "agent must not be null");
    requireNonNull(status, "status must not be null");
    reportId = reportId == null ? OptionalLong.empty() : reportId;
  }

  public Job(JobId id, String agent, JobStatus status) {
    this(id, agent, status, OptionalLong.empty());
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
