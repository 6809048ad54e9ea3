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
 * Base exception for all Fossology client operations.
 * <p>
 * This unchecked exception is thrown when an error occurs while talking to the Fossology
 * web console or while processing what it returned. It can wrap lower-level exceptions
 * (such as I/O errors) to provide context about the operation that failed.
 * </p>
 * <p>
 * Missing data (an unknown folder, upload, job or license) is never reported through this
 * exception: lookups return an empty {@link java.util.Optional} instead.
 * </p>
 *
 * @see FossologyConnectionException
 */
public class FossologyException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public FossologyException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public FossologyException(String message, Throwable cause) {
    super(message, cause);
  }
}
