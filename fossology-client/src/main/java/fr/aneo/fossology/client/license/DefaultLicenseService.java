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
package fr.aneo.fossology.client.license;

import fr.aneo.fossology.client.model.ItemId;
import fr.aneo.fossology.client.model.License;
import fr.aneo.fossology.client.model.UploadId;
import fr.aneo.fossology.client.parser.ConsoleParser;
import fr.aneo.fossology.client.transport.ConsoleEndpoints;
import fr.aneo.fossology.client.transport.ConsoleTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static fr.aneo.fossology.client.transport.ConsoleEndpoints.BULK_TEXT_MATCH;
import static java.util.Objects.requireNonNull;

public final class DefaultLicenseService implements LicenseService {
  private static final Logger logger = LoggerFactory.getLogger(DefaultLicenseService.class);

  private final ConsoleTransport transport;
  private final ConsoleParser parser;

  public DefaultLicenseService(ConsoleTransport transport, ConsoleParser parser) {
    this.transport = requireNonNull(transport, "transport must not be null");
    this.parser = requireNonNull(parser, "parser must not be null");
  }

  @Override
  public List<License> getLicenses(UploadId uploadId, ItemId itemId) {
    requireNonNull(uploadId, "uploadId must not be null");
    requireNonNull(itemId, "itemId must not be null");

    var page = transport.get(ConsoleEndpoints.licenses(uploadId, itemId)).bodyAsString();
    return parser.parseLicenses(page);
  }

  @Override
  public void startBulkTextMatch(String referenceText, ItemId itemId, List<BulkTextMatchAction> actions) {
    var form = BulkTextMatchRequestBuilder.buildRequest(referenceText, itemId, actions);
    transport.post(BULK_TEXT_MATCH, form);
    logger.info("Started bulk text match from {} with {} action(s)", itemId, actions.size());
  }
}
