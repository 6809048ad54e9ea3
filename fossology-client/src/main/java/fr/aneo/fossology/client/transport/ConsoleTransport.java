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

import java.util.List;

/**
 * Request channel to the Fossology web console.
 * <p>
 * All requests issued through one transport share one session: cookies set by the server
 * (in particular the authentication cookie set by the login form) are sent back on every later
 * request. A transport is meant to be used by one workflow at a time; concurrent workflows
 * must each use their own transport so that their sessions stay independent.
 * <p>
 * Implementations retry requests that fail to reach the server and propagate the last
 * connection failure once the retry policy is exhausted. Responses are returned whatever their
 * HTTP status code.
 *
 * @see HttpConsoleTransport
 */
public interface ConsoleTransport {

  /**
   * Issues a GET request.
   *
   * @param path the console path, relative to the server URL (for example {@code /repo/?mod=upload_file})
   * @return the console response
   * @throws fr.aneo.fossology.client.exception.FossologyConnectionException if the server cannot be reached
   * @throws fr.aneo.fossology.client.exception.FossologyException           if the request fails for another reason
   */
  ConsoleResponse get(String path);

  /**
   * Issues a form-encoded POST request.
   *
   * @param path the console path, relative to the server URL
   * @param form the form fields to submit
   * @return the console response
   * @throws fr.aneo.fossology.client.exception.FossologyConnectionException if the server cannot be reached
   * @throws fr.aneo.fossology.client.exception.FossologyException           if the request fails for another reason
   */
  ConsoleResponse post(String path, FormData form);

  /**
   * Issues a {@code multipart/form-data} POST request presented as a browser form submission.
   *
   * @param path   the console path, relative to the server URL
   * @param fields the parts to submit, in order
   * @return the console response
   * @throws fr.aneo.fossology.client.exception.FossologyConnectionException if the server cannot be reached
   * @throws fr.aneo.fossology.client.exception.FossologyException           if the request fails for another reason
   */
  ConsoleResponse postMultipart(String path, List<MultipartField> fields);
}
