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
package fr.aneo.fossology.client.auth;

import fr.aneo.fossology.client.transport.ConsoleTransport;
import fr.aneo.fossology.client.transport.FormData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static fr.aneo.fossology.client.transport.ConsoleEndpoints.AUTH;
import static java.util.Objects.requireNonNull;

/**
 * Establishes the authenticated console session of a transport.
 * <p>
 * Logging in submits the console login form once; the server answers by setting the session
 * cookie, which the transport keeps for every later request. The outcome is not checked here:
 * a failed login shows up as later requests returning the login page instead of data.
 * <p>
 * Login must happen once, before any other request on the same transport. This ordering is
 * the caller's responsibility.
 */
public final class Authenticator {
  private static final Logger logger = LoggerFactory.getLogger(Authenticator.class);

  private final ConsoleTransport transport;

  public Authenticator(ConsoleTransport transport) {
    this.transport = requireNonNull(transport, "transport must not be null");
  }

  /**
   * Submits the login form.
   *
   * @param username the console user name
   * @param password the console password
   * @throws NullPointerException if username or password is null
   * @throws fr.aneo.fossology.client.exception.FossologyConnectionException if the server cannot be reached
   */
  public void login(String username, String password) {
    requireNonNull(username, "username must not be null");
    requireNonNull(password, "password must not be null");

    var form = FormData.builder()
                       .add("username", username)
                       .add("password", password)
                       .build();
    transport.post(AUTH, form);
    logger.info("Submitted login form for user '{}'", username);
  }
}
