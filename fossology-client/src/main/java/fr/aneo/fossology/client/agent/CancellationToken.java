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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Signal used to stop a job wait from another thread.
 * <p>
 * Cancelling wakes a wait that is sleeping between two polls immediately. A token cannot be
 * reset once cancelled.
 *
 * <pre>{@code
 * var token = new CancellationToken();
 * executor.submit(() -> orchestrator.awaitCompletion(uploadId, "monk", AwaitOptions.every(pollInterval).cancelledBy(token)));
 * // later
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken();

  private final CountDownLatch cancelled = new CountDownLatch(1);

  /**
   * @return a token that nobody holds, hence never cancelled
   */
  public static CancellationToken none() {
    return NONE;
  }

  public void cancel() {
    if (this == NONE) throw new IllegalStateException("The shared non-cancellable token cannot be cancelled");
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Waits until the token is cancelled or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @return true if the token was cancelled, false if the timeout elapsed first
   * @throws InterruptedException if the current thread is interrupted while waiting
   */
  boolean awaitCancellation(Duration timeout) throws InterruptedException {
    requireNonNull(timeout, "timeout must not be null");
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
