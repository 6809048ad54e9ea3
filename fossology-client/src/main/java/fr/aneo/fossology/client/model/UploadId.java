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

import java.util.Objects;

/**
 * Immutable identifier of an upload on the Fossology server.
 * <p>
 * Identifiers are assigned by the server and are opaque: two uploads with the same name are
 * still different uploads. Equality and hash code are based on the numeric value only.
 */
public final class UploadId {
  private final long id;

  private UploadId(long id) {
    this.id = id;
  }

  /**
   * Creates an upload identifier from the numeric value assigned by the server.
   *
   * @param id the server-assigned identifier
   * @return a new UploadId instance wrapping the given value
   */
  public static UploadId from(long id) {
    return new UploadId(id);
  }

  /**
   * @return the numeric value of this identifier
   */
  public long asLong() {
    return id;
  }

  /**
   * @return the decimal representation of this identifier, as sent in console requests
   */
  public String asString() {
    return Long.toString(id);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (UploadId) obj;
    return this.id == that.id;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "UploadId{" +
      "id=" + id +
      '}';
  }
}
