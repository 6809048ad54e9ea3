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
package fr.aneo.fossology.client.internal.retry;

import fr.aneo.fossology.client.RetryPolicy;
import fr.aneo.fossology.client.exception.FossologyConnectionException;
import fr.aneo.fossology.client.exception.FossologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.nio.channels.UnresolvedAddressException;

import static java.util.Objects.requireNonNull;

/**
 * Utility for executing blocking console requests with a fixed-backoff retry on connection failures.
 * <p>
 * Each attempt runs the given {@link Attempt}. When it fails with an error indicating that the
 * server could not be reached (connection refused, reset or dropped before any response, unknown host, connect timeout),
 * the calling thread sleeps for {@link RetryPolicy#backoff()} and the attempt is repeated, up to
 * {@link RetryPolicy#maxAttempts()} attempts in total. Any other failure is reported
 * immediately.
 * <p>
 * Failures are reported as follows:
 * <ul>
 *   <li>retries exhausted: {@link FossologyConnectionException} whose cause is the last connection error</li>
 *   <li>any other {@link IOException}: {@link FossologyException} wrapping it</li>
 *   <li>interruption: the interrupt flag is restored and a {@link FossologyException} is thrown</li>
 * </ul>
 *
 * @see RetryPolicy
 */
public final class RetryableOperation {
  private static final Logger logger = LoggerFactory.getLogger(RetryableOperation.class);
  private static final String NO_BYTES_RECEIVED = "received no bytes";

  private RetryableOperation() {
  }

  /**
   * A single blocking attempt of a request.
   *
   * @param <T> the type of the attempt result
   */
  @FunctionalInterface
  public interface Attempt<T> {
    T run() throws IOException, InterruptedException;
  }

  /**
   * Executes the operation, retrying connection failures according to the policy.
   *
   * @param description short description of the request, used in logs and error messages
   * @param operation   the blocking operation to attempt
   * @param policy      retry policy specifying max attempts and backoff
   * @param <T>         the type of the operation result
   * @return the result of the first successful attempt
   * @throws FossologyConnectionException if every attempt failed to reach the server
   * @throws FossologyException           if an attempt failed for another reason or the thread was interrupted
   * @throws NullPointerException         if any argument is null
   */
  public static <T> T execute(String description, Attempt<T> operation, RetryPolicy policy) {
    requireNonNull(description, "description must not be null");
    requireNonNull(operation, "operation must not be null");
    requireNonNull(policy, "policy must not be null");

    IOException lastFailure = null;
    for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
      try {
        return operation.run();
      } catch (IOException e) {
        if (!isRetryable(e)) {
          throw new FossologyException(description + " failed: " + e.getMessage(), e);
        }
        lastFailure = e;
        logger.debug("{}: attempt {}/{} failed ({})", description, attempt, policy.maxAttempts(), e.toString());
        if (attempt < policy.maxAttempts()) {
          sleep(description, policy);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FossologyException("Interrupted during " + description, e);
      }
    }

    logger.warn("{}: giving up after {} attempts", description, policy.maxAttempts());
    throw new FossologyConnectionException(
      "Could not reach server for " + description + " after " + policy.maxAttempts() + " attempts",
      policy.maxAttempts(),
      lastFailure);
  }

  /**
   * Determines whether a failure means the server could not be reached.
   * <p>
   * The exception and its causes are inspected, since the HTTP client reports some connection
   * errors wrapped in a plain {@link IOException}.
   *
   * @param throwable the failure to classify
   * @return true if the failure is a connection-level failure, false otherwise
   */
  static boolean isRetryable(Throwable throwable) {
    Throwable current = throwable;
    while (current != null) {
      if (current instanceof ConnectException
        || current instanceof HttpConnectTimeoutException
        || current instanceof SocketException
        || current instanceof EOFException
        || current instanceof UnknownHostException
        || current instanceof UnresolvedAddressException
        || isDroppedConnection(current)) {
        return true;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }

  // The HTTP client reports a connection closed before any response byte as a bare IOException.
  private static boolean isDroppedConnection(Throwable throwable) {
    return throwable.getClass() == IOException.class
      && throwable.getMessage() != null
      && throwable.getMessage().contains(NO_BYTES_RECEIVED);
  }

  private static void sleep(String description, RetryPolicy policy) {
    if (policy.backoff().isZero()) return;

    logger.trace("{}: sleeping {} ms before next attempt", description, policy.backoff().toMillis());
    try {
      Thread.sleep(policy.backoff().toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FossologyException("Interrupted while waiting to retry " + description, e);
    }
  }
}
