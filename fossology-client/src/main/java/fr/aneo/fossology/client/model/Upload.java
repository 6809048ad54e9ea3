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

import static java.util.Objects.requireNonNull;

/**
 * A file or archive previously submitted to the Fossology server for scanning.
 *
 * @param id       the server-assigned upload identifier
 * @param name     the display name of the upload; not guaranteed unique within a folder
 * @param folderId the folder containing the upload
 */
public record Upload(UploadId id, String name, FolderId folderId) {

  public Upload {
    requireNonNull(id, "id must not be null");
    requireNonNull(name, "name must not be null");
    requireNonNull(folderId, "folderId must not be null");
  }
}
