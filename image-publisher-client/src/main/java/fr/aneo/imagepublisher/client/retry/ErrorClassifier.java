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

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static fr.aneo.imagepublisher.client.internal.concurrent.Futures.unwrap;

/**
 * Decides whether a failed attempt is worth retrying.
 * <p>
 * Default classification:
 * <ul>
 *   <li>{@link ErrorClass#TRANSIENT}: I/O errors (connection refused or reset, request timeout),
 *       remote errors without a response, HTTP 408, 429 and 5xx, plus any configured status
 *       code or Azure error code</li>
 *   <li>{@link ErrorClass#AUTHENTICATION}: HTTP 401</li>
 *   <li>{@link ErrorClass#PERMANENT}: everything else</li>
 * </ul>
 * Instances are immutable.
 */
public final class ErrorClassifier {

  private static final ErrorClassifier DEFAULTS = new ErrorClassifier(Set.of(), Set.of());

  private final Set<Integer> transientStatusCodes;
  private final Set<String> transientErrorCodes;

  private ErrorClassifier(Set<Integer> transientStatusCodes, Set<String> transientErrorCodes) {
    this.transientStatusCodes = Set.copyOf(transientStatusCodes);
    this.transientErrorCodes = Set.copyOf(transientErrorCodes);
  }

  public static ErrorClassifier defaults() {
    return DEFAULTS;
  }

  /**
   * Returns a classifier that also treats the given HTTP status codes as transient.
   *
   * @param statusCodes additional transient status codes
   * @return a new classifier
   */
  public ErrorClassifier withTransientStatusCodes(Integer... statusCodes) {
    var codes = new HashSet<>(transientStatusCodes);
    codes.addAll(List.of(statusCodes));
    return new ErrorClassifier(codes, transientErrorCodes);
  }

  /**
   * Returns a classifier that also treats the given Azure error codes (the {@code error.code}
   * field of a response body) as transient, whatever the status code.
   *
   * @param errorCodes additional transient error codes
   * @return a new classifier
   */
  public ErrorClassifier withTransientErrorCodes(String... errorCodes) {
    var codes = new HashSet<>(transientErrorCodes);
    codes.addAll(List.of(errorCodes));
    return new ErrorClassifier(transientStatusCodes, codes);
  }

  public ErrorClass classify(Throwable error) {
    var cause = unwrap(error);

    if (cause instanceof RemoteCallException remote) {
      if (!remote.hasStatus()) return ErrorClass.TRANSIENT;
      if (remote.errorCode() != null && transientErrorCodes.contains(remote.errorCode())) return ErrorClass.TRANSIENT;

      var status = remote.statusCode();
      if (status == 401) return ErrorClass.AUTHENTICATION;
      if (status == 408 || status == 429 || status >= 500 || transientStatusCodes.contains(status)) {
        return ErrorClass.TRANSIENT;
      }
      return ErrorClass.PERMANENT;
    }

    if (cause instanceof IOException) return ErrorClass.TRANSIENT;

    return ErrorClass.PERMANENT;
  }

  @Override
  public String toString() {
    return "ErrorClassifier{transientStatusCodes=" + transientStatusCodes + ", transientErrorCodes=" + transientErrorCodes + "}";
  }
}
