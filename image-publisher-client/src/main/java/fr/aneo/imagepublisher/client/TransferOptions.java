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
package fr.aneo.imagepublisher.client;

import fr.aneo.imagepublisher.client.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Tuning of uploads, retries and operation waits.
 * <p>
 * Values can be given through the {@link Builder} or read from the environment with
 * {@link #fromEnvironment()}:
 * <ul>
 *   <li>{@code AZURE_IMG_MAX_WORKERS}: maximum number of chunks uploaded at once, unset for
 *       {@code min(chunks, 32)}</li>
 *   <li>{@code AZURE_IMG_MAX_ATTEMPTS}: attempts per remote call, including the first (default 5)</li>
 *   <li>{@code AZURE_IMG_CHUNK_SIZE}: upload chunk size in bytes (default 4 MiB)</li>
 *   <li>{@code AZURE_IMG_POLL_INTERVAL_SECONDS}: delay between two status probes (default 5)</li>
 *   <li>{@code AZURE_IMG_TIMEOUT_SECONDS}: deadline of an operation wait (default 1800)</li>
 * </ul>
 * A variable that is not a positive number is ignored with a warning and its default applies.
 *
 * @param maxWorkers   maximum number of chunks in flight, {@code null} for the default cap
 * @param maxAttempts  attempts per remote call and per chunk
 * @param chunkSize    size of an upload chunk in bytes
 * @param pollInterval delay between two status probes
 * @param timeout      deadline of an operation wait
 */
public record TransferOptions(
  Integer maxWorkers,
  int maxAttempts,
  long chunkSize,
  Duration pollInterval,
  Duration timeout
) {
  private static final Logger logger = LoggerFactory.getLogger(TransferOptions.class);

  static final String ENV_MAX_WORKERS = "AZURE_IMG_MAX_WORKERS";
  static final String ENV_MAX_ATTEMPTS = "AZURE_IMG_MAX_ATTEMPTS";
  static final String ENV_CHUNK_SIZE = "AZURE_IMG_CHUNK_SIZE";
  static final String ENV_POLL_INTERVAL_SECONDS = "AZURE_IMG_POLL_INTERVAL_SECONDS";
  static final String ENV_TIMEOUT_SECONDS = "AZURE_IMG_TIMEOUT_SECONDS";

  public static final long DEFAULT_CHUNK_SIZE = 4L * 1024 * 1024;
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

  public static final TransferOptions DEFAULT = builder().build();

  public TransferOptions {
    pollInterval = pollInterval == null ? DEFAULT_POLL_INTERVAL : pollInterval;
    timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;

    if (maxWorkers != null && maxWorkers < 1) {
      throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0, got: " + chunkSize);
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be > 0, got: " + pollInterval);
    }
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative, got: " + timeout);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the options from the process environment.
   */
  public static TransferOptions fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static TransferOptions fromEnvironment(Map<String, String> env) {
    var builder = builder();
    positive(env, ENV_MAX_WORKERS).ifPresent(value -> builder.maxWorkers(Math.toIntExact(value)));
    positive(env, ENV_MAX_ATTEMPTS).ifPresent(value -> builder.maxAttempts(Math.toIntExact(value)));
    positive(env, ENV_CHUNK_SIZE).ifPresent(builder::chunkSize);
    positive(env, ENV_POLL_INTERVAL_SECONDS).map(Duration::ofSeconds).ifPresent(builder::pollInterval);
    positive(env, ENV_TIMEOUT_SECONDS).map(Duration::ofSeconds).ifPresent(builder::timeout);
    return builder.build();
  }

  private static Optional<Long> positive(Map<String, String> env, String name) {
    var value = env.get(name);
    if (value == null || value.trim().isEmpty()) return Optional.empty();
    try {
      var parsed = Long.parseLong(value.trim());
      var limit = name.equals(ENV_CHUNK_SIZE) ? Long.MAX_VALUE : Integer.MAX_VALUE;
      if (parsed > 0 && parsed <= limit) {
        logger.debug("Using {}={}", name, parsed);
        return Optional.of(parsed);
      }
      logger.warn("Invalid value in {}: {} (must be a positive number). Using default", name, value);
    } catch (NumberFormatException e) {
      logger.warn("Invalid number format for {}: {}. Using default", name, value);
    }
    return Optional.empty();
  }

  /**
   * @return the default retry policy with this options' attempt budget
   */
  public RetryPolicy retryPolicy() {
    return RetryPolicy.DEFAULT.withMaxAttempts(maxAttempts);
  }

  public TransferOptions withMaxWorkers(Integer maxWorkers) {
    return new TransferOptions(maxWorkers, maxAttempts, chunkSize, pollInterval, timeout);
  }

  public TransferOptions withChunkSize(long chunkSize) {
    return new TransferOptions(maxWorkers, maxAttempts, chunkSize, pollInterval, timeout);
  }

  /**
   * Builder of {@link TransferOptions}; every field starts at its default.
   */
  public static final class Builder {
    private Integer maxWorkers;
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private long chunkSize = DEFAULT_CHUNK_SIZE;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private Duration timeout = DEFAULT_TIMEOUT;

    private Builder() {
    }

    public Builder maxWorkers(Integer maxWorkers) {
      this.maxWorkers = maxWorkers;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder chunkSize(long chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public TransferOptions build() {
      return new TransferOptions(maxWorkers, maxAttempts, chunkSize, pollInterval, timeout);
    }
  }
}
