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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Status of a job as reported by the Fossology server.
 * <p>
 * The set of statuses is owned by the server and is open ended; this class keeps the raw value
 * and only classifies it:
 * <ul>
 *   <li><strong>completed</strong>: the status is exactly {@value #COMPLETED}</li>
 *   <li><strong>killed</strong>: the status contains {@value #KILLED_MARKER} (for example "killed by user")</li>
 *   <li><strong>terminal</strong>: completed or killed. Any other status means the job is still in progress.</li>
 * </ul>
 * A job whose status is terminal never changes status again.
 */
public final class JobStatus {
  public static final String COMPLETED = "Completed";
  static final String KILLED_MARKER = "killed";

  private final String value;

  private JobStatus(String value) {
    this.value = value;
  }

  /**
   * Wraps a status string reported by the server.
   *
   * @param value the raw status
   * @return the job status
   * @throws NullPointerException if value is null
   */
  public static JobStatus of(String value) {
    requireNonNull(value, "value must not be null");
    return new JobStatus(value);
  }

  public String value() {
    return value;
  }

  public boolean isCompleted() {
    return COMPLETED.equals(value);
  }

  public boolean isKilled() {
    return value.contains(KILLED_MARKER);
  }

  /**
   * @return true if the job finished, successfully or not
   */
  public boolean isTerminal() {
    return isCompleted() || isKilled();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (JobStatus) obj;
    return Objects.equals(this.value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
