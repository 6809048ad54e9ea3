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

import java.util.List;
import java.util.Optional;

/**
 * Reads the licenses known to the server and submits bulk license decisions.
 *
 * @see DefaultLicenseService
 */
public interface LicenseService {

  /**
   * Lists the licenses the server offers for an upload item.
   *
   * @param uploadId the upload
   * @param itemId   an item of that upload
   * @return the licenses, in page order
   */
  List<License> getLicenses(UploadId uploadId, ItemId itemId);

  /**
   * Finds a license by exact name in a previously fetched list.
   *
   * @param licenses    licenses obtained from {@link #getLicenses(UploadId, ItemId)}
   * @param licenseName the license short name
   * @return the first license with that name, or empty if none has it
   */
  default Optional<License> findLicense(List<License> licenses, String licenseName) {
    return licenses.stream()
                   .filter(license -> license.name().equals(licenseName))
                   .findFirst();
  }

  /**
   * Starts a bulk text match over the whole upload containing the given item. The match runs
   * as a {@code monkbulk} job that can be awaited like any agent job.
   *
   * @param referenceText the text to look for
   * @param itemId        the upload tree item the match starts from
   * @param actions       the license decisions to apply where the text is found
   */
  void startBulkTextMatch(String referenceText, ItemId itemId, List<BulkTextMatchAction> actions);
}
