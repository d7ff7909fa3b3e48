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

import fr.aneo.imagepublisher.client.exception.RemoteCallException;

import java.time.Duration;
import java.time.Instant;

/**
 * Diagnostic record of one try of a remote call.
 *
 * @param number    attempt number within its call, starting at 1
 * @param startedAt when the attempt was started
 * @param endedAt   when its outcome was known
 * @param outcome   how it ended
 * @param error     the failure, {@code null} on success
 */
public record Attempt(int number, Instant startedAt, Instant endedAt, AttemptOutcome outcome, Throwable error) {

  public Duration duration() {
    return Duration.between(startedAt, endedAt);
  }

  /**
   * @return the HTTP status of the failure, or {@link RemoteCallException#NO_STATUS}
   */
  public int statusCode() {
    return error instanceof RemoteCallException remote ? remote.statusCode() : RemoteCallException.NO_STATUS;
  }

  public String responseBody() {
    return error instanceof RemoteCallException remote ? remote.responseBody() : null;
  }
}
