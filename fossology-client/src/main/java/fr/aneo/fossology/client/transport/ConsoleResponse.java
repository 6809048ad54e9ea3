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
package fr.aneo.fossology.client.transport;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Raw response returned by the Fossology web console.
 * <p>
 * The status code is carried as is and never interpreted by the transport: the console does
 * not reliably use status codes to signal application errors, so callers look at the body.
 *
 * @param statusCode the HTTP status code
 * @param body       the response body bytes
 */
public record ConsoleResponse(int statusCode, byte[] body) {

  public ConsoleResponse {
    requireNonNull(body, "body must not be null");
  }

  /**
   * @return the body decoded as UTF-8 text
   */
  public String bodyAsString() {
    return new String(body, UTF_8);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (ConsoleResponse) obj;
    return this.statusCode == that.statusCode && Arrays.equals(this.body, that.body);
  }

  @Override
  public int hashCode() {
    return 31 * statusCode + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "ConsoleResponse[statusCode=" + statusCode + ", bodyLength=" + body.length + ']';
  }
}
