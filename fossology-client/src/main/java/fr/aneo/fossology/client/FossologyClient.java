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
package fr.aneo.fossology.client;

import fr.aneo.fossology.client.agent.AgentOrchestrator;
import fr.aneo.fossology.client.agent.DefaultAgentOrchestrator;
import fr.aneo.fossology.client.auth.Authenticator;
import fr.aneo.fossology.client.folder.DefaultFolderUploadLocator;
import fr.aneo.fossology.client.folder.FolderUploadLocator;
import fr.aneo.fossology.client.license.DefaultLicenseService;
import fr.aneo.fossology.client.license.LicenseService;
import fr.aneo.fossology.client.parser.ConsoleParser;
import fr.aneo.fossology.client.report.DefaultReportRetriever;
import fr.aneo.fossology.client.report.ReportRetriever;
import fr.aneo.fossology.client.transport.ConsoleTransport;
import fr.aneo.fossology.client.transport.HttpConsoleTransport;

import static java.util.Objects.requireNonNull;

/**
 * The main entry point for driving a Fossology server through its web console.
 * <p>
 * A client owns one console session: every service it exposes sends its requests through the
 * same {@link ConsoleTransport}, so the cookie set by {@link #login()} authenticates all of them.
 * Clients are not meant to be shared between threads; run concurrent workflows with one client
 * each.
 * <p>
 * The console answers with HTML pages whose markup the client does not interpret itself; a
 * {@link ConsoleParser} matching the server version must be supplied.
 *
 * <pre>{@code
 * var config = FossologyConfig.fromFile(Path.of("fossologyrc.json"));
 * var client = new FossologyClient(config, parser);
 * client.login();
 *
 * var folderId = client.folders().resolveFolder("Software Repository").orElseThrow();
 * var uploadId = client.folders().uploadFile(Path.of("lib-1.0.tar.gz"), folderId).orElseThrow();
 *
 * client.agents().startLicenseScanAgents(uploadId);
 * client.agents().awaitCompletion(uploadId, Agent.MONK.jobName(), AwaitOptions.defaults().withTimeout(Duration.ofHours(1)));
 *
 * client.agents().startReportGeneratorAgent(uploadId, ReportFormat.SPDX2_TAG_VALUE);
 * client.agents().awaitCompletion(uploadId, ReportFormat.SPDX2_TAG_VALUE.agentName(), AwaitOptions.defaults());
 * client.reports().fetchGeneratedReport(uploadId, Path.of("lib-1.0.spdx"));
 * }</pre>
 *
 * @see FossologyConfig
 * @see ConsoleParser
 */
public class FossologyClient {
  private final FossologyConfig config;
  private final ConsoleTransport transport;
  private final Authenticator authenticator;
  private final FolderUploadLocator folders;
  private final AgentOrchestrator agents;
  private final ReportRetriever reports;
  private final LicenseService licenses;

  /**
   * Creates a client with a new console session for the configured server.
   * <p>
   * No request is sent until a service is used; call {@link #login()} first.
   *
   * @param config the connection configuration
   * @param parser the parser for the console pages of the target server
   * @throws NullPointerException if config or parser is null
   */
  public FossologyClient(FossologyConfig config, ConsoleParser parser) {
    this(config, HttpConsoleTransport.create(requireNonNull(config, "config must not be null")), parser);
  }

  FossologyClient(FossologyConfig config, ConsoleTransport transport, ConsoleParser parser) {
    this.config = requireNonNull(config, "config must not be null");
    this.transport = requireNonNull(transport, "transport must not be null");
    requireNonNull(parser, "parser must not be null");

    this.authenticator = new Authenticator(transport);
    this.folders = new DefaultFolderUploadLocator(transport, parser, config.pageSize());
    this.agents = new DefaultAgentOrchestrator(transport, parser);
    this.reports = new DefaultReportRetriever(transport, agents);
    this.licenses = new DefaultLicenseService(transport, parser);
  }

  /**
   * Logs in with the configured credentials. Must be called once, before any other request.
   *
   * @throws fr.aneo.fossology.client.exception.FossologyConnectionException if the server cannot be reached
   */
  public void login() {
    authenticator.login(config.username(), config.password());
  }

  public FolderUploadLocator folders() {
    return folders;
  }

  public AgentOrchestrator agents() {
    return agents;
  }

  public ReportRetriever reports() {
    return reports;
  }

  public LicenseService licenses() {
    return licenses;
  }

  public ConsoleTransport transport() {
    return transport;
  }

  public FossologyConfig config() {
    return config;
  }
}
