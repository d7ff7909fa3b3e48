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
package fr.aneo.imagepublisher.client.retry;

import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.CredentialProvider;
import fr.aneo.imagepublisher.client.exception.ExhaustedRetriesException;
import fr.aneo.imagepublisher.client.exception.PermanentFailureException;
import fr.aneo.imagepublisher.client.internal.concurrent.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static fr.aneo.imagepublisher.client.internal.concurrent.Futures.unwrap;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs remote calls with retry, backoff and token refresh.
 * <p>
 * Every management, storage and cloud partner request goes through this executor. For each call:
 * <ol>
 *   <li>the call is invoked; on success its result is returned immediately;</li>
 *   <li>a failure is classified by the policy's {@link ErrorClassifier};</li>
 *   <li>a transient failure is retried after {@link RetryPolicy#backoff(int)} while attempts
 *       remain, otherwise the call fails with {@link ExhaustedRetriesException};</li>
 *   <li>an authentication failure invalidates the token of the call's scope and retries once
 *       immediately with a fresh token; this refresh does not consume the retry budget and a
 *       second authentication failure is permanent;</li>
 *   <li>a permanent failure fails the call with {@link PermanentFailureException}.</li>
 * </ol>
 * Backoff delays are scheduled, no thread sleeps. Cancelling the returned stage stops the call
 * before its next attempt.
 * <p>
 * The executor holds no per-call state and is safe for concurrent use.
 *
 * @see RetryPolicy
 * @see RequestContext
 */
public final class RequestExecutor {
  private static final Logger logger = LoggerFactory.getLogger(RequestExecutor.class);

  private final RetryPolicy defaultPolicy;
  private final CredentialProvider credentialProvider;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;

  /**
   * Creates an executor.
   *
   * @param defaultPolicy      policy used when the request context does not set one
   * @param credentialProvider token supplier for authenticated calls; may be {@code null} when no
   *                           call is ever made with a token scope
   */
  public RequestExecutor(RetryPolicy defaultPolicy, CredentialProvider credentialProvider) {
    this(defaultPolicy, credentialProvider, Schedulers.shared(), Clock.systemUTC());
  }

  RequestExecutor(RetryPolicy defaultPolicy, CredentialProvider credentialProvider, ScheduledExecutorService scheduler, Clock clock) {
    this.defaultPolicy = requireNonNull(defaultPolicy, "defaultPolicy must not be null");
    this.credentialProvider = credentialProvider;
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.clock = requireNonNull(clock, "clock must not be null");
  }

  public RetryPolicy defaultPolicy() {
    return defaultPolicy;
  }

  /**
   * Executes a call that needs no token.
   *
   * @param call    one attempt of the remote operation
   * @param context the per-call context
   * @param <T>     the result type
   * @return a stage completing with the first successful result, or exceptionally with
   * {@link ExhaustedRetriesException} or {@link PermanentFailureException}
   */
  public <T> CompletionStage<T> execute(RemoteCall<T> call, RequestContext context) {
    requireNonNull(call, "call must not be null");
    return executeAuthenticated(token -> call.call(), context);
  }

  /**
   * Executes a call authorized with a token of {@link RequestContext#scope()}.
   * <p>
   * A fresh token is requested from the credential provider before every attempt. When the
   * context has no scope the call receives {@code null}.
   *
   * @param call    one attempt of the remote operation
   * @param context the per-call context
   * @param <T>     the result type
   * @return a stage completing with the first successful result, or exceptionally with
   * {@link ExhaustedRetriesException} or {@link PermanentFailureException}
   * @throws IllegalStateException if the context has a scope but the executor has no credential provider
   */
  public <T> CompletionStage<T> executeAuthenticated(AuthenticatedCall<T> call, RequestContext context) {
    requireNonNull(call, "call must not be null");
    requireNonNull(context, "context must not be null");
    if (context.scope() != null && credentialProvider == null) {
      throw new IllegalStateException("No credential provider configured for " + context.operation());
    }

    var policy = context.policy() == null ? defaultPolicy : context.policy();
    var execution = new Execution<>(call, context, policy);
    execution.start();
    return execution.result;
  }

  private final class Execution<T> {
    private final AuthenticatedCall<T> call;
    private final RequestContext context;
    private final RetryPolicy policy;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    private volatile ScheduledFuture<?> pendingRetry;
    private volatile int attemptNumber;
    private volatile int budgetUsed;
    private volatile boolean tokenRefreshed;
    private volatile boolean refreshing;

    private Execution(AuthenticatedCall<T> call, RequestContext context, RetryPolicy policy) {
      this.call = call;
      this.context = context;
      this.policy = policy;
    }

    private void start() {
      result.whenComplete((value, error) -> {
        var retry = pendingRetry;
        if (retry != null) retry.cancel(false);
      });
      attempt();
    }

    private void attempt() {
      if (result.isDone()) return;

      attemptNumber++;
      if (!refreshing) budgetUsed++;
      refreshing = false;

      var number = attemptNumber;
      var startedAt = clock.instant();
      CompletionStage<T> stage;
      try {
        stage = call.call(token());
      } catch (RuntimeException e) {
        stage = CompletableFuture.failedFuture(e);
      }

      stage.whenComplete((value, error) -> {
        if (error == null) {
          context.record(new Attempt(number, startedAt, clock.instant(), AttemptOutcome.SUCCESS, null));
          if (number > 1) {
            logger.atDebug()
                  .addKeyValue("operation", context.operation())
                  .addKeyValue("attempts", number)
                  .log("Remote call succeeded after retry");
          }
          result.complete(value);
        } else {
          onFailure(number, startedAt, unwrap(error));
        }
      });
    }

    private AccessToken token() {
      return context.scope() == null ? null : credentialProvider.getToken(context.scope());
    }

    private void onFailure(int number, Instant startedAt, Throwable cause) {
      var errorClass = policy.classifier().classify(cause);
      var endedAt = clock.instant();

      switch (errorClass) {
        case AUTHENTICATION -> {
          context.record(new Attempt(number, startedAt, endedAt, AttemptOutcome.AUTHENTICATION_FAILURE, cause));
          if (context.scope() != null && !tokenRefreshed) {
            tokenRefreshed = true;
            refreshing = true;
            credentialProvider.invalidate(context.scope());
            logger.atWarn()
                  .addKeyValue("operation", context.operation())
                  .addKeyValue("scope", context.scope())
                  .log("Token rejected, retrying once with a refreshed token");
            attempt();
          } else {
            fail(new PermanentFailureException(context.operation(), context.attempts(), cause));
          }
        }
        case TRANSIENT -> {
          context.record(new Attempt(number, startedAt, endedAt, AttemptOutcome.TRANSIENT_FAILURE, cause));
          if (budgetUsed >= policy.maxAttempts()) {
            logger.atError()
                  .addKeyValue("operation", context.operation())
                  .addKeyValue("attempts", number)
                  .setCause(cause)
                  .log("Max retry attempts exhausted");
            fail(new ExhaustedRetriesException(context.operation(), context.attempts(), cause));
          } else {
            scheduleRetry(cause);
          }
        }
        default -> {
          context.record(new Attempt(number, startedAt, endedAt, AttemptOutcome.PERMANENT_FAILURE, cause));
          logger.atDebug()
                .addKeyValue("operation", context.operation())
                .addKeyValue("attempt", number)
                .addKeyValue("error", cause.getClass().getSimpleName())
                .log("Error is not retryable, failing immediately");
          fail(new PermanentFailureException(context.operation(), context.attempts(), cause));
        }
      }
    }

    private void scheduleRetry(Throwable cause) {
      Duration backoff = policy.backoff(budgetUsed);
      logger.warn("{} failed ({}), retrying after backoff. Attempt {}/{}, backoff {} ms",
        context.operation(), cause.getMessage(), budgetUsed, policy.maxAttempts(), backoff.toMillis());

      ScheduledFuture<?> retry;
      try {
        retry = scheduler.schedule(this::attempt, backoff.toMillis(), MILLISECONDS);
      } catch (RejectedExecutionException e) {
        fail(new ExhaustedRetriesException(context.operation(), context.attempts(), cause));
        return;
      }
      pendingRetry = retry;
      // the caller may have cancelled between the check in attempt() and now
      if (result.isDone()) retry.cancel(false);
    }

    private void fail(RuntimeException error) {
      result.completeExceptionally(error);
    }
  }
}
