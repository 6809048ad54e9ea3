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
package fr.aneo.fossology.client;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Retry policy applied by the transport to connection-level failures.
 * <p>
 * A request is attempted at most {@code maxAttempts} times in total. Between two attempts the
 * calling thread sleeps for {@code backoff}. Only failures to reach the server are retried;
 * responses carrying an HTTP error status are returned to the caller as they are.
 * </p>
 *
 * @param maxAttempts total number of attempts, including the first one; must be at least 1
 * @param backoff     fixed delay between two attempts; must not be negative
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {

  /**
   * Five attempts, one second apart.
   */
  public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofSeconds(1));

  /**
   * A single attempt, no retry.
   */
  public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO);

  public RetryPolicy {
    requireNonNull(backoff, "backoff must not be null");
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
    if (backoff.isNegative()) throw new IllegalArgumentException("backoff must not be negative");
  }
}
