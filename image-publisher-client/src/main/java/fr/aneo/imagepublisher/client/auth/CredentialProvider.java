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

import fr.aneo.imagepublisher.client.exception.AuthenticationException;

/**
 * Supplies bearer tokens to the request executor.
 * <p>
 * Implementations must be thread-safe: tokens are requested concurrently by chunk uploads and
 * operation probes.
 * </p>
 */
public interface CredentialProvider {

  /**
   * Returns a valid token for the given scope, acquiring a new one if needed.
   *
   * @param scope the token audience
   * @return a token accepted by the endpoints of {@code scope}
   * @throws AuthenticationException if no token can be acquired
   */
  AccessToken getToken(TokenScope scope);

  /**
   * Discards any cached token for the scope so that the next {@link #getToken(TokenScope)}
   * re-fetches it. Called after the remote side rejected a token.
   *
   * @param scope the token audience
   */
  void invalidate(TokenScope scope);
}
