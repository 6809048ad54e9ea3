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

/**
 * Report formats produced by the console's SPDX export page.
 * <p>
 * The output format requested from the export page is also the name of the agent whose job
 * generates the report.
 */
public enum ReportFormat {
  SPDX2_TAG_VALUE("spdx2tv"),
  SPDX2_RDF("spdx2"),
  DEP5("dep5");

  private final String outputFormat;

  ReportFormat(String outputFormat) {
    this.outputFormat = outputFormat;
  }

  /**
   * @return the {@code outputFormat} value of the export request
   */
  public String outputFormat() {
    return outputFormat;
  }

  /**
   * @return the name of the agent generating this format, as shown in job lists
   */
  public String agentName() {
    return outputFormat;
  }
}
