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
package fr.aneo.imagepublisher.client.operation;

import fr.aneo.imagepublisher.client.exception.RemoteOperationFailedException;
import fr.aneo.imagepublisher.client.exception.WaitTimeoutException;
import fr.aneo.imagepublisher.client.internal.concurrent.Schedulers;
import fr.aneo.imagepublisher.client.retry.RequestContext;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static fr.aneo.imagepublisher.client.internal.concurrent.Futures.unwrap;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Awaits asynchronous remote operations by polling their status.
 * <p>
 * The first probe runs immediately. While the operation is in progress the next probe is
 * scheduled after {@code min(pollInterval, time left before the deadline)}; when the deadline is
 * reached without a terminal status the wait fails with {@link WaitTimeoutException}. A
 * {@code FAILED} or {@code CANCELED} status fails the wait with
 * {@link RemoteOperationFailedException}. Probe errors that survive the request executor's
 * retries are propagated as-is. Polling stops as soon as a terminal status is observed or the
 * returned stage is cancelled.
 * </p>
 */
public final class OperationWaiter {
  private static final Logger logger = LoggerFactory.getLogger(OperationWaiter.class);

  private final RequestExecutor executor;
  private final Duration pollInterval;
  private final Duration timeout;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;

  public OperationWaiter(RequestExecutor executor, Duration pollInterval, Duration timeout) {
    this(executor, pollInterval, timeout, Schedulers.shared(), Clock.systemUTC());
  }

  OperationWaiter(RequestExecutor executor, Duration pollInterval, Duration timeout, ScheduledExecutorService scheduler, Clock clock) {
    this.executor = requireNonNull(executor, "executor must not be null");
    this.pollInterval = requireNonNull(pollInterval, "pollInterval must not be null");
    this.timeout = requireNonNull(timeout, "timeout must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.clock = requireNonNull(clock, "clock must not be null");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Awaits an operation with the waiter's poll interval and a deadline of now plus its timeout.
   */
  public <T> CompletionStage<OperationOutcome<T>> await(OperationKind kind, String handle, StatusProbe<T> probe) {
    return await(new Operation(handle, kind, pollInterval, clock.instant().plus(timeout)), probe);
  }

  /**
   * Awaits an operation until it reaches a terminal status or its deadline.
   *
   * @param operation the operation to await, in progress
   * @param probe     queries the operation status
   * @param <T>       the payload type
   * @return a stage completing with the outcome when the operation succeeded
   */
  public <T> CompletionStage<OperationOutcome<T>> await(Operation operation, StatusProbe<T> probe) {
    requireNonNull(operation, "operation must not be null");
    requireNonNull(probe, "probe must not be null");

    logger.atDebug()
          .addKeyValue("kind", operation.kind())
          .addKeyValue("handle", operation.handle())
          .addKeyValue("deadline", operation.deadline())
          .log("Waiting for remote operation");

    var polling = new Polling<>(operation, probe);
    polling.start();
    return polling.result;
  }

  private final class Polling<T> {
    private final Operation operation;
    private final StatusProbe<T> probe;
    private final CompletableFuture<OperationOutcome<T>> result = new CompletableFuture<>();
    private volatile ScheduledFuture<?> nextPoll;
    private volatile ScheduledFuture<?> deadlineTimer;
    private volatile CompletableFuture<ProbeResult<T>> inFlight;

    private Polling(Operation operation, StatusProbe<T> probe) {
      this.operation = operation;
      this.probe = probe;
      result.whenComplete((value, error) -> {
        cancel(nextPoll);
        cancel(deadlineTimer);
        var probing = inFlight;
        if (probing != null) probing.cancel(false);
      });
    }

    private void start() {
      var remaining = Duration.between(clock.instant(), operation.deadline());
      try {
        deadlineTimer = scheduler.schedule(this::timeOut, Math.max(0, remaining.toMillis()), MILLISECONDS);
      } catch (RejectedExecutionException e) {
        result.completeExceptionally(e);
        return;
      }
      if (result.isDone()) cancel(deadlineTimer);
      poll();
    }

    private void poll() {
      if (result.isDone()) return;

      var context = RequestContext.of("probe " + operation.kind() + " " + operation.handle(), probe.scope());
      CompletionStage<ProbeResult<T>> stage;
      try {
        stage = executor.executeAuthenticated(token -> probe.probe(operation.handle(), token), context);
      } catch (RuntimeException e) {
        stage = CompletableFuture.failedFuture(e);
      }

      // cancelling the status request stops its pending retries
      var probing = stage.toCompletableFuture();
      inFlight = probing;
      if (result.isDone()) probing.cancel(false);

      probing.whenComplete((probed, error) -> {
        if (result.isDone()) return;
        if (error != null) {
          result.completeExceptionally(unwrap(error));
          return;
        }
        onProbe(probed);
      });
    }

    private void onProbe(ProbeResult<T> probed) {
      try {
        operation.transitionTo(probed.status(), probed.detail());
      } catch (IllegalStateException e) {
        result.completeExceptionally(e);
        return;
      }

      switch (probed.status()) {
        case SUCCEEDED -> {
          logger.atInfo()
                .addKeyValue("kind", operation.kind())
                .addKeyValue("handle", operation.handle())
                .addKeyValue("probes", operation.probeCount())
                .log("Remote operation succeeded");
          result.complete(new OperationOutcome<>(operation.kind(), operation.handle(), OperationStatus.SUCCEEDED, probed.payload(), operation.probeCount()));
        }
        case FAILED, CANCELED -> result.completeExceptionally(
          new RemoteOperationFailedException(operation.kind(), operation.handle(), probed.status(), probed.detail()));
        case IN_PROGRESS -> scheduleNext();
      }
    }

    private void scheduleNext() {
      var remaining = Duration.between(clock.instant(), operation.deadline());
      if (remaining.isNegative() || remaining.isZero()) {
        timeOut();
        return;
      }

      var delay = remaining.compareTo(operation.pollInterval()) < 0 ? remaining : operation.pollInterval();
      ScheduledFuture<?> scheduled;
      try {
        scheduled = scheduler.schedule(this::pollOrTimeout, delay.toMillis(), MILLISECONDS);
      } catch (RejectedExecutionException e) {
        result.completeExceptionally(e);
        return;
      }
      nextPoll = scheduled;
      if (result.isDone()) scheduled.cancel(false);
    }

    private void pollOrTimeout() {
      if (!clock.instant().isBefore(operation.deadline())) {
        timeOut();
        return;
      }
      poll();
    }

    private void timeOut() {
      if (result.isDone()) return;
      logger.atWarn()
            .addKeyValue("kind", operation.kind())
            .addKeyValue("handle", operation.handle())
            .addKeyValue("probes", operation.probeCount())
            .log("Timed out waiting for remote operation");
      result.completeExceptionally(new WaitTimeoutException(operation.kind(), operation.handle(), operation.status(), timeout));
    }
  }

  private static void cancel(ScheduledFuture<?> scheduled) {
    if (scheduled != null) scheduled.cancel(false);
  }
}
