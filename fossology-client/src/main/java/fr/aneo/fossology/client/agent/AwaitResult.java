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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Result of waiting for an agent's job.
 *
 * @param outcome how the wait ended
 * @param job     the last observed state of the job, or empty if the job was never found
 */
public record AwaitResult(Outcome outcome, Optional<Job> job) {

  /**
   * How a job wait ended.
   */
  public enum Outcome {
    /** The job reached the {@code Completed} status. */
    COMPLETED,
    /** The job was killed. */
    KILLED,
    /** The timeout elapsed before the job reached a terminal status. */
    STILL_PENDING,
    /** The wait was cancelled, or the waiting thread interrupted. */
    CANCELLED
  }

  public AwaitResult {
    requireNonNull(outcome, "outcome must not be null");
    job = job == null ? Optional.empty() : job;
  }

  static AwaitResult finished(Job job) {
    return new AwaitResult(job.status().isCompleted() ? Outcome.COMPLETED : Outcome.KILLED, Optional.of(job));
  }

  /**
   * @return true if the job reached a terminal status, completed or killed
   */
  public boolean isDone() {
    return outcome == Outcome.COMPLETED || outcome == Outcome.KILLED;
  }
}
