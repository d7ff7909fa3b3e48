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
package fr.aneo.imagepublisher.client.auth;

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A bearer token and its expiry.
 *
 * @param token     the raw token value
 * @param expiresAt the instant after which the token is no longer accepted
 */
public record AccessToken(String token, Instant expiresAt) {

  public AccessToken {
    requireNonNull(token, "token must not be null");
    requireNonNull(expiresAt, "expiresAt must not be null");
    if (token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
  }

  /**
   * Returns whether the token expires within the given margin from {@code now}.
   *
   * @param margin safety margin before the actual expiry
   * @param now    the current instant
   * @return {@code true} if the token should be renewed
   */
  public boolean expiresWithin(Duration margin, Instant now) {
    return !now.plus(margin).isBefore(expiresAt);
  }

  public String authorizationHeader() {
    return "Bearer " + token;
  }

  @Override
  public String toString() {
    return "AccessToken{expiresAt=" + expiresAt + "}";
  }
}
