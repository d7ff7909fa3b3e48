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

import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;

import java.util.concurrent.CompletionStage;

/**
 * Queries the current status of a remote operation once.
 * <p>
 * Each probe is a single remote attempt; the {@link OperationWaiter} runs it through the request
 * executor so that transient failures of the probe itself are retried.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface StatusProbe<T> {

  CompletionStage<ProbeResult<T>> probe(String handle, AccessToken token);

  /**
   * @return the scope of the token passed to {@link #probe}, or {@code null} for none
   */
  default TokenScope scope() {
    return null;
  }
}
