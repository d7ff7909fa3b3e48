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

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static java.util.Objects.requireNonNull;

/**
 * Immutable retry configuration for remote calls.
 * <p>
 * The delay before attempt {@code n + 1} is {@code initialBackoff × multiplier^(n-1)}, capped at
 * {@code maxBackoff}, plus a random jitter of up to {@code jitter × delay}. Without jitter the
 * delays never decrease from one attempt to the next.
 *
 * @param maxAttempts       total number of attempts, including the first one
 * @param initialBackoff    delay after the first failed attempt
 * @param maxBackoff        upper bound of the delay before jitter
 * @param backoffMultiplier growth factor applied per attempt
 * @param jitter            fraction of the delay added at random, between 0 and 1
 * @param classifier        decides which errors are retried
 */
public record RetryPolicy(
  int maxAttempts,
  Duration initialBackoff,
  Duration maxBackoff,
  double backoffMultiplier,
  double jitter,
  ErrorClassifier classifier
) {

  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  /**
   * Five attempts, backoff starting at one second and doubling up to 30 seconds, 20% jitter.
   */
  public static final RetryPolicy DEFAULT = new RetryPolicy(
    DEFAULT_MAX_ATTEMPTS,
    Duration.ofSeconds(1),
    Duration.ofSeconds(30),
    2.0,
    0.2,
    ErrorClassifier.defaults());

  /**
   * Applies default values and validates parameters.
   *
   * @throws IllegalArgumentException if a parameter is out of range
   */
  public RetryPolicy {
    initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
    maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
    classifier = classifier == null ? ErrorClassifier.defaults() : classifier;

    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (initialBackoff.isNegative()) {
      throw new IllegalArgumentException("initialBackoff must be positive");
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be greater than initialBackoff");
    }
    if (backoffMultiplier < 1.0) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
    }
    if (jitter < 0.0 || jitter > 1.0) {
      throw new IllegalArgumentException("jitter must be between 0 and 1, got: " + jitter);
    }
  }

  public RetryPolicy withMaxAttempts(int maxAttempts) {
    return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitter, classifier);
  }

  public RetryPolicy withClassifier(ErrorClassifier classifier) {
    requireNonNull(classifier, "classifier must not be null");
    return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitter, classifier);
  }

  /**
   * Delay to wait after the given failed attempt, jitter included.
   *
   * @param attempt the failed attempt number (1-based)
   * @return the delay before the next attempt
   */
  public Duration backoff(int attempt) {
    var base = baseBackoff(attempt);
    if (jitter == 0.0 || base.isZero()) return base;

    var extra = (long) (base.toMillis() * jitter * ThreadLocalRandom.current().nextDouble());
    return base.plusMillis(extra);
  }

  /**
   * Delay to wait after the given failed attempt, without jitter.
   *
   * @param attempt the failed attempt number (1-based)
   * @return the capped exponential delay
   */
  public Duration baseBackoff(int attempt) {
    if (attempt <= 1) return initialBackoff;

    var multiplier = Math.pow(backoffMultiplier, attempt - 1);
    var backoffMillis = initialBackoff.toMillis() * multiplier;
    var cappedMillis = Math.min(backoffMillis, (double) maxBackoff.toMillis());

    return Duration.ofMillis((long) cappedMillis);
  }
}
