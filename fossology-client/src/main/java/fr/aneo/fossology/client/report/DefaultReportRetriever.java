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

import fr.aneo.fossology.client.agent.AgentOrchestrator;
import fr.aneo.fossology.client.exception.FossologyException;
import fr.aneo.fossology.client.model.Job;
import fr.aneo.fossology.client.model.ReportFormat;
import fr.aneo.fossology.client.model.UploadId;
import fr.aneo.fossology.client.transport.ConsoleEndpoints;
import fr.aneo.fossology.client.transport.ConsoleTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

public final class DefaultReportRetriever implements ReportRetriever {
  private static final Logger logger = LoggerFactory.getLogger(DefaultReportRetriever.class);

  private final ConsoleTransport transport;
  private final AgentOrchestrator orchestrator;

  public DefaultReportRetriever(ConsoleTransport transport, AgentOrchestrator orchestrator) {
    this.transport = requireNonNull(transport, "transport must not be null");
    this.orchestrator = requireNonNull(orchestrator, "orchestrator must not be null");
  }

  @Override
  public boolean fetchGeneratedReport(UploadId uploadId, ReportFormat format, Path outputPath) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(format, "format must not be null");
    requireNonNull(outputPath, "outputPath must not be null");

    var job = orchestrator.findMostRecentJob(uploadId, format.agentName())
                          .flatMap(orchestrator::getJob);
    if (job.isEmpty()) {
      logger.info("No {} job found for {}", format.agentName(), uploadId);
      return false;
    }
    if (!isDownloadable(job.get(), format)) {
      logger.info("{} report of {} not available: job {} is '{}'", format.agentName(), uploadId, job.get().id().asString(), job.get().status());
      return false;
    }

    var reportId = job.get().reportId().getAsLong();
    var report = transport.get(ConsoleEndpoints.download(reportId)).bodyAsString();
    write(outputPath, report);
    logger.info("Wrote {} report {} of {} to {}", format.agentName(), reportId, uploadId, outputPath);
    return true;
  }

  private static boolean isDownloadable(Job job, ReportFormat format) {
    return job.agent().equals(format.agentName())
      && job.status().isCompleted()
      && job.reportId().isPresent();
  }

  private static void write(Path outputPath, String report) {
    try {
      var parent = outputPath.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(outputPath, report, UTF_8);
    } catch (IOException e) {
      throw new FossologyException("Unable to write report to " + outputPath, e);
    }
  }
}
