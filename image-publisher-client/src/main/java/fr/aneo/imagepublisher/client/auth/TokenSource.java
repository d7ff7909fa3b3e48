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

/**
 * External identity provider that exchanges service principal credentials for a token.
 */
@FunctionalInterface
public interface TokenSource {

  /**
   * Acquires a new token.
   *
   * @param credentials the service principal
   * @param scope       the token audience
   * @return a freshly issued token
   */
  AccessToken acquire(InlineCredentials credentials, TokenScope scope);
}
