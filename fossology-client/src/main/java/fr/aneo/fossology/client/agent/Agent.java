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

/**
 * Scanning agents started by the client.
 * <p>
 * Each agent is known under two names: the identifier submitted in the {@code agents[]} field
 * of the agent form ({@code agent_monk}) and the name shown in job lists ({@code monk}).
 */
public enum Agent {
  MONK("monk"),
  NOMOS("nomos"),
  COPYRIGHT("copyright"),
  REUSER("reuser"),
  MONKBULK("monkbulk");

  private final String jobName;

  Agent(String jobName) {
    this.jobName = jobName;
  }

  /**
   * @return the agent name as shown in job lists
   */
  public String jobName() {
    return jobName;
  }

  /**
   * @return the agent identifier submitted to the agent form
   */
  public String formValue() {
    return "agent_" + jobName;
  }
}
