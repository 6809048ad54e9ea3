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

import fr.aneo.fossology.client.model.License;
import fr.aneo.fossology.client.model.LicenseId;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * A license decision applied by a bulk text match: add or remove a license wherever the
 * reference text is found.
 *
 * @param licenseId   the license to add or remove
 * @param licenseName the short name of that license
 * @param action      whether the license is added or removed
 */
public record BulkTextMatchAction(LicenseId licenseId, String licenseName, Action action) {

  /**
   * Decision applied to the matched license.
   */
  public enum Action {
    ADD("add"),
    REMOVE("remove");

    private final String value;

    Action(String value) {
      this.value = value;
    }

    /**
     * @return the action verb submitted to the bulk form
     */
    public String value() {
      return value;
    }

    /**
     * Returns the action for the given verb.
     *
     * @param value {@code add} or {@code remove}
     * @return the matching action
     * @throws IllegalArgumentException if the verb is neither {@code add} nor {@code remove}
     */
    public static Action fromValue(String value) {
      return Arrays.stream(values())
                   .filter(action -> action.value.equals(value))
                   .findFirst()
                   .orElseThrow(() -> new IllegalArgumentException("Unknown bulk action '" + value + "', expected 'add' or 'remove'"));
    }
  }

  public BulkTextMatchAction {
    requireNonNull(licenseId, "licenseId must not be null");
    requireNonNull(licenseName, "licenseName must not be null");
    requireNonNull(action, "action must not be null");
    if (licenseId.asLong() <= 0) throw new IllegalArgumentException("licenseId must be positive, got: " + licenseId.asLong());
    if (licenseName.isBlank()) throw new IllegalArgumentException("licenseName must not be blank");
  }

  public static BulkTextMatchAction add(License license) {
    requireNonNull(license, "license must not be null");
    return new BulkTextMatchAction(license.id(), license.name(), Action.ADD);
  }

  public static BulkTextMatchAction remove(License license) {
    requireNonNull(license, "license must not be null");
    return new BulkTextMatchAction(license.id(), license.name(), Action.REMOVE);
  }

  /**
   * Creates an action from loosely typed values, as read from a user-supplied list.
   *
   * @param licenseId   the license identifier
   * @param licenseName the license short name
   * @param action      {@code add} or {@code remove}
   * @return the action
   * @throws IllegalArgumentException if the action verb is unknown or the license reference is invalid
   */
  public static BulkTextMatchAction of(long licenseId, String licenseName, String action) {
    return new BulkTextMatchAction(LicenseId.from(licenseId), licenseName, Action.fromValue(action));
  }
}
