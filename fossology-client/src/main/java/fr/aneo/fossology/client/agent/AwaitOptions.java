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
package fr.aneo.fossology.client.agent;

import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Settings of a job wait: how often to poll, how long to wait at most, and how to cancel.
 *
 * @param pollInterval delay between two status checks; must be positive
 * @param timeout      maximum time to wait, or {@code null} to wait until the job finishes or the wait is cancelled
 * @param cancellation token stopping the wait when cancelled
 */
public record AwaitOptions(Duration pollInterval, Duration timeout, CancellationToken cancellation) {
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

  public AwaitOptions {
    requireNonNull(pollInterval, "pollInterval must not be null");
    if (pollInterval.isZero() || pollInterval.isNegative()) throw new IllegalArgumentException("pollInterval must be positive");
    if (timeout != null && timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative");
    cancellation = cancellation == null ? CancellationToken.none() : cancellation;
  }

  /**
   * Polls at the given interval, without timeout or cancellation token.
   *
   * @param pollInterval delay between two status checks
   * @return the options
   */
  public static AwaitOptions every(Duration pollInterval) {
    return new AwaitOptions(pollInterval, null, null);
  }

  public static AwaitOptions defaults() {
    return every(DEFAULT_POLL_INTERVAL);
  }

  public AwaitOptions withTimeout(Duration timeout) {
    return new AwaitOptions(pollInterval, timeout, cancellation);
  }

  public AwaitOptions cancelledBy(CancellationToken cancellation) {
    return new AwaitOptions(pollInterval, timeout, cancellation);
  }

  public Optional<Duration> maxDuration() {
    return Optional.ofNullable(timeout);
  }
}
