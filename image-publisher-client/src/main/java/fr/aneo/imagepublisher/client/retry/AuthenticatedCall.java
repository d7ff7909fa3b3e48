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

import java.util.concurrent.CompletionStage;

/**
 * A single attempt of a remote operation authorized with a bearer token.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AuthenticatedCall<T> {

  /**
   * @param token the token to authorize with, {@code null} when the request context has no scope
   * @return the stage completing with the attempt's result
   */
  CompletionStage<T> call(AccessToken token);
}
