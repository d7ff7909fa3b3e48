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
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.exception.ExhaustedRetriesException;
import fr.aneo.imagepublisher.client.exception.PermanentFailureException;
import fr.aneo.imagepublisher.client.exception.RemoteCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RequestExecutorTest {

  private static final RetryPolicy FAST_RETRY_POLICY = new RetryPolicy(
    5,
    Duration.ofMillis(10),
    Duration.ofMillis(50),
    2.0,
    0.0,
    ErrorClassifier.defaults()
  );

  private static final AccessToken STALE_TOKEN = new AccessToken("stale", Instant.now().plusSeconds(3600));
  private static final AccessToken FRESH_TOKEN = new AccessToken("fresh", Instant.now().plusSeconds(3600));

  private CredentialProvider credentialProvider;
  private RequestExecutor executor;

  @BeforeEach
  void setUp() {
    credentialProvider = mock(CredentialProvider.class);
    executor = new RequestExecutor(FAST_RETRY_POLICY, credentialProvider);
  }

  @Test
  @DisplayName("returns the result of the first successful attempt")
  void returns_the_result_of_the_first_successful_attempt() {
    // Given
    var context = RequestContext.of("get image");

    // When
    var result = executor.execute(() -> completedFuture("image"), context).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("image");
    assertThat(context.attempts()).singleElement()
                                  .extracting(Attempt::outcome)
                                  .isEqualTo(AttemptOutcome.SUCCESS);
    verifyNoInteractions(credentialProvider);
  }

  @Test
  @DisplayName("503 twice then 200 returns the result after three attempts")
  void service_unavailable_twice_then_ok_returns_result_after_three_attempts() {
    // Given
    var calls = new AtomicInteger();
    var context = RequestContext.of("get image");
    RemoteCall<String> call = () -> calls.incrementAndGet() <= 2
      ? failedFuture(new RemoteCallException("get image", 503, "{\"error\":{\"code\":\"ServerBusy\"}}", "ServerBusy"))
      : completedFuture("200 OK");

    // When
    var result = executor.execute(call, context).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("200 OK");
    assertThat(context.attemptCount()).isEqualTo(3);
    assertThat(context.attempts()).extracting(Attempt::outcome)
                                  .containsExactly(AttemptOutcome.TRANSIENT_FAILURE, AttemptOutcome.TRANSIENT_FAILURE, AttemptOutcome.SUCCESS);
    assertThat(context.attempts().get(0).statusCode()).isEqualTo(503);
  }

  @Test
  @DisplayName("transient failures are retried exactly maxAttempts times before failing")
  void transient_failures_are_retried_exactly_max_attempts_times() {
    // Given
    var calls = new AtomicInteger();
    RemoteCall<String> call = () -> {
      calls.incrementAndGet();
      return failedFuture(new RemoteCallException("put block", 500, "internal error body", "InternalError"));
    };

    // When/Then
    assertThatThrownBy(() -> executor.execute(call, RequestContext.of("put block")).toCompletableFuture().join())
      .isInstanceOf(CompletionException.class)
      .cause()
      .isInstanceOfSatisfying(ExhaustedRetriesException.class, error -> {
        assertThat(error.attemptCount()).isEqualTo(5);
        assertThat(error.statusCode()).isEqualTo(500);
        assertThat(error.responseBody()).isEqualTo("internal error body");
        assertThat(error.errorCode()).isEqualTo("InternalError");
        assertThat(error.getMessage()).contains("5 attempt(s)").contains("internal error body");
      });
    assertThat(calls.get()).isEqualTo(5);
  }

  @Test
  @DisplayName("permanent failures are never retried")
  void permanent_failures_are_never_retried() {
    // Given
    var calls = new AtomicInteger();
    RemoteCall<String> call = () -> {
      calls.incrementAndGet();
      return failedFuture(new RemoteCallException("create image", 400, "{\"error\":{\"code\":\"InvalidParameter\"}}", "InvalidParameter"));
    };

    // When/Then
    assertThatThrownBy(() -> executor.execute(call, RequestContext.of("create image")).toCompletableFuture().join())
      .isInstanceOf(CompletionException.class)
      .cause()
      .isInstanceOfSatisfying(PermanentFailureException.class, error -> {
        assertThat(error.attemptCount()).isEqualTo(1);
        assertThat(error.errorCode()).isEqualTo("InvalidParameter");
      });
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("an exception thrown by the call is classified like a failed stage")
  void exception_thrown_by_the_call_is_classified() {
    // Given
    RemoteCall<String> call = () -> {
      throw new IllegalStateException("broken request");
    };

    // When/Then
    assertThatThrownBy(() -> executor.execute(call, RequestContext.of("broken")).toCompletableFuture().join())
      .cause()
      .isInstanceOf(PermanentFailureException.class)
      .hasRootCauseMessage("broken request");
  }

  @Test
  @DisplayName("authentication failure refreshes the token once without consuming the budget")
  void authentication_failure_refreshes_the_token_once() {
    // Given
    when(credentialProvider.getToken(TokenScope.MANAGEMENT)).thenReturn(STALE_TOKEN, FRESH_TOKEN);
    var tokens = new CopyOnWriteArrayList<String>();
    AuthenticatedCall<String> call = token -> {
      tokens.add(token.token());
      return "stale".equals(token.token())
        ? failedFuture(new RemoteCallException("get image", 401, "", "ExpiredAuthenticationToken"))
        : completedFuture("image");
    };
    var context = RequestContext.of("get image", TokenScope.MANAGEMENT).withPolicy(FAST_RETRY_POLICY.withMaxAttempts(1));

    // When
    var result = executor.executeAuthenticated(call, context).toCompletableFuture().join();

    // Then
    assertThat(result).isEqualTo("image");
    assertThat(tokens).containsExactly("stale", "fresh");
    verify(credentialProvider).invalidate(TokenScope.MANAGEMENT);
  }

  @Test
  @DisplayName("a second authentication failure is permanent")
  void second_authentication_failure_is_permanent() {
    // Given
    when(credentialProvider.getToken(TokenScope.CLOUD_PARTNER)).thenReturn(STALE_TOKEN);
    var calls = new AtomicInteger();
    AuthenticatedCall<String> call = token -> {
      calls.incrementAndGet();
      return failedFuture(new RemoteCallException("get offer", 401, "", null));
    };

    // When/Then
    assertThatThrownBy(() -> executor.executeAuthenticated(call, RequestContext.of("get offer", TokenScope.CLOUD_PARTNER))
                                     .toCompletableFuture().join())
      .cause()
      .isInstanceOfSatisfying(PermanentFailureException.class, error -> assertThat(error.statusCode()).isEqualTo(401));
    assertThat(calls.get()).isEqualTo(2);
    verify(credentialProvider, times(1)).invalidate(TokenScope.CLOUD_PARTNER);
  }

  @Test
  @DisplayName("authentication failure without token scope is permanent")
  void authentication_failure_without_scope_is_permanent() {
    // Given
    var calls = new AtomicInteger();
    RemoteCall<String> call = () -> {
      calls.incrementAndGet();
      return failedFuture(new RemoteCallException("put block", 401, "", null));
    };

    // When/Then
    assertThatThrownBy(() -> executor.execute(call, RequestContext.of("put block")).toCompletableFuture().join())
      .cause()
      .isInstanceOf(PermanentFailureException.class);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("a context with scope needs a credential provider")
  void context_with_scope_needs_a_credential_provider() {
    // Given
    var anonymous = new RequestExecutor(FAST_RETRY_POLICY, null);

    // When/Then
    assertThatThrownBy(() -> anonymous.executeAuthenticated(token -> completedFuture("x"), RequestContext.of("get image", TokenScope.MANAGEMENT)))
      .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("cancelling the call stops further attempts")
  void cancelling_the_call_stops_further_attempts() throws Exception {
    // Given
    var slowPolicy = new RetryPolicy(5, Duration.ofMillis(200), Duration.ofMillis(200), 1.0, 0.0, null);
    var calls = new AtomicInteger();
    RemoteCall<String> call = () -> {
      calls.incrementAndGet();
      return failedFuture(new RemoteCallException("get image", 503, "", null));
    };

    // When
    var result = executor.execute(call, RequestContext.of("get image").withPolicy(slowPolicy)).toCompletableFuture();
    result.cancel(false);
    TimeUnit.MILLISECONDS.sleep(500);

    // Then
    assertThat(result).isCancelled();
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("backoff delays grow between attempts")
  void backoff_delays_grow_between_attempts() {
    // Given
    var policy = new RetryPolicy(4, Duration.ofMillis(20), Duration.ofMillis(200), 3.0, 0.0, null);
    var startTimes = new CopyOnWriteArrayList<Long>();
    RemoteCall<String> call = () -> {
      startTimes.add(System.nanoTime());
      return startTimes.size() < 4
        ? failedFuture(new RemoteCallException("get image", 429, "", null))
        : completedFuture("ok");
    };

    // When
    executor.execute(call, RequestContext.of("get image").withPolicy(policy)).toCompletableFuture().join();

    // Then
    List<Long> gaps = new ArrayList<>();
    for (int i = 1; i < startTimes.size(); i++) {
      gaps.add(TimeUnit.NANOSECONDS.toMillis(startTimes.get(i) - startTimes.get(i - 1)));
    }
    assertThat(gaps.get(0)).isGreaterThanOrEqualTo(20);
    assertThat(gaps.get(1)).isGreaterThanOrEqualTo(60);
    assertThat(gaps.get(2)).isGreaterThanOrEqualTo(180);
  }

  @Test
  @DisplayName("the result of a stage completing later is returned")
  void result_of_a_stage_completing_later_is_returned() {
    // Given
    var pending = new CompletableFuture<String>();

    // When
    var result = executor.execute(() -> pending, RequestContext.of("get image")).toCompletableFuture();
    pending.complete("done");

    // Then
    assertThat(result.join()).isEqualTo("done");
  }
}
