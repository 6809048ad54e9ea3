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
package fr.aneo.fossology.client.exception;

/**
 * Thrown when the Fossology server could not be reached after every attempt allowed by the
 * configured {@link fr.aneo.fossology.client.RetryPolicy}.
 * <p>
 * The {@linkplain #getCause() cause} is the connection error raised by the last attempt.
 * </p>
 */
public class FossologyConnectionException extends FossologyException {

  private final int attempts;

  public FossologyConnectionException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  /**
   * @return the number of attempts made before giving up
   */
  public int attempts() {
    return attempts;
  }
}
