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
package fr.aneo.fossology.client.report;

import fr.aneo.fossology.client.model.ReportFormat;
import fr.aneo.fossology.client.model.UploadId;

import java.nio.file.Path;

/**
 * Downloads reports generated by report agents.
 *
 * @see DefaultReportRetriever
 */
public interface ReportRetriever {

  /**
   * Downloads the report produced by the most recent report job of an upload and writes it to
   * disk.
   * <p>
   * Nothing is written unless the most recent job for the format's agent exists, was run by
   * exactly that agent, has the status {@code Completed} and references a report. An older
   * completed job is not used when a newer one is still running or was killed. Such cases are
   * expected while a report is being generated and are reported by returning {@code false}.
   *
   * @param uploadId   the upload the report was generated for
   * @param format     the report format
   * @param outputPath the file receiving the report text
   * @return true if the report was written, false otherwise
   * @throws fr.aneo.fossology.client.exception.FossologyException if the report cannot be written
   */
  boolean fetchGeneratedReport(UploadId uploadId, ReportFormat format, Path outputPath);

  /**
   * Downloads the SPDX tag-value report of an upload.
   *
   * @param uploadId   the upload the report was generated for
   * @param outputPath the file receiving the report text
   * @return true if the report was written, false otherwise
   * @see #fetchGeneratedReport(UploadId, ReportFormat, Path)
   */
  default boolean fetchGeneratedReport(UploadId uploadId, Path outputPath) {
    return fetchGeneratedReport(uploadId, ReportFormat.SPDX2_TAG_VALUE, outputPath);
  }
}
