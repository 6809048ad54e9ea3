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
 * A license known to the Fossology server, as listed for an upload item.
 *
 * @param id   the server-assigned license identifier
 * @param name the short name of the license (for example {@code GPL-2.0})
 */
public record License(LicenseId id, String name) {

  public License {
    requireNonNull(id, "id must not be null");
    requireNonNull(name, "name must not be null");
  }
}
