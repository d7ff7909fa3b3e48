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

/**
 * Failure of a single remote attempt.
 * <p>
 * Carries the HTTP status code, the raw response body and the Azure error code (when the body
 * follows the {@code {"error": {"code": ..., "message": ...}}} convention) so that callers can
 * diagnose a failure without re-running the operation in verbose mode.
 * </p>
 * A status code of {@link #NO_STATUS} means no response was received.
 */
public class RemoteCallException extends ImagePublisherException {

  public static final int NO_STATUS = 0;

  private final String operation;
  private final int statusCode;
  private final String responseBody;
  private final String errorCode;

  public RemoteCallException(String operation, int statusCode, String responseBody, String errorCode) {
    this(operation, statusCode, responseBody, errorCode, null);
  }

  public RemoteCallException(String operation, int statusCode, String responseBody, String errorCode, Throwable cause) {
    super(describe(operation, statusCode, responseBody, errorCode, cause), cause);
    this.operation = operation;
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.errorCode = errorCode;
  }

  /**
   * Creates an exception for an attempt that failed before any response was received.
   *
   * @param operation the operation description
   * @param cause     the transport error
   * @return the exception
   */
  public static RemoteCallException transportFailure(String operation, Throwable cause) {
    return new RemoteCallException(operation, NO_STATUS, null, null, cause);
  }

  public String operation() {
    return operation;
  }

  public int statusCode() {
    return statusCode;
  }

  public String responseBody() {
    return responseBody;
  }

  public String errorCode() {
    return errorCode;
  }

  public boolean hasStatus() {
    return statusCode != NO_STATUS;
  }

  private static String describe(String operation, int statusCode, String responseBody, String errorCode, Throwable cause) {
    var message = new StringBuilder(operation == null ? "remote call" : operation).append(" failed");
    if (statusCode != NO_STATUS) message.append(" with status ").append(statusCode);
    if (errorCode != null) message.append(" (").append(errorCode).append(')');
    if (responseBody != null && !responseBody.isBlank()) message.append(": ").append(responseBody);
    if (statusCode == NO_STATUS && cause != null) message.append(": ").append(cause);
    return message.toString();
  }
}
