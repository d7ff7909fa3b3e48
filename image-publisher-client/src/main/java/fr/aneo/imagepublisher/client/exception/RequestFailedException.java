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
package fr.aneo.imagepublisher.client.exception;

import fr.aneo.imagepublisher.client.retry.Attempt;

import java.util.List;

/**
 * Terminal failure of a call made through the request executor.
 * <p>
 * Holds every attempt made for the call. The status code, response body and Azure error code
 * of the last remote error are exposed directly and included in the message.
 * </p>
 *
 * @see ExhaustedRetriesException
 * @see PermanentFailureException
 */
public abstract class RequestFailedException extends ImagePublisherException {

  private final String operation;
  private final List<Attempt> attempts;

  protected RequestFailedException(String reason, String operation, List<Attempt> attempts, Throwable lastError) {
    super(reason + " for " + operation + " after " + attempts.size() + " attempt(s): " + lastError.getMessage(), lastError);
    this.operation = operation;
    this.attempts = List.copyOf(attempts);
  }

  public String operation() {
    return operation;
  }

  public List<Attempt> attempts() {
    return attempts;
  }

  public int attemptCount() {
    return attempts.size();
  }

  public Throwable lastError() {
    return getCause();
  }

  /**
   * @return the status code of the last remote error, or {@link RemoteCallException#NO_STATUS}
   */
  public int statusCode() {
    return remoteCause() == null ? RemoteCallException.NO_STATUS : remoteCause().statusCode();
  }

  public String responseBody() {
    return remoteCause() == null ? null : remoteCause().responseBody();
  }

  public String errorCode() {
    return remoteCause() == null ? null : remoteCause().errorCode();
  }

  private RemoteCallException remoteCause() {
    return getCause() instanceof RemoteCallException remote ? remote : null;
  }
}
