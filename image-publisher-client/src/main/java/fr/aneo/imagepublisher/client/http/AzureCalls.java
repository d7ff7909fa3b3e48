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
package fr.aneo.imagepublisher.client.http;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.http.HttpHeaderName;
import fr.aneo.imagepublisher.client.exception.RemoteCallException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Bridges Azure SDK reactive calls to {@link CompletionStage}s.
 * <p>
 * Errors are translated to {@link RemoteCallException}: an {@link HttpResponseException} keeps
 * its status and the service error code from the {@code x-ms-error-code} header or the
 * {@code error.code} of the body, any other failure becomes a transport failure without status.
 * Cancelling the returned stage cancels the subscription, hence the request.
 */
public final class AzureCalls {

  static final HttpHeaderName ERROR_CODE = HttpHeaderName.fromString("x-ms-error-code");

  private AzureCalls() {
  }

  /**
   * Subscribes to a single attempt of an SDK call.
   *
   * @param operation description used in errors
   * @param call      the call, subscribed once
   * @param <T>       the result type
   * @return a stage completing with the call's value, {@code null} for an empty call
   */
  public static <T> CompletionStage<T> toStage(String operation, Mono<T> call) {
    try {
      return call.onErrorMap(error -> toRemoteCallException(operation, error)).toFuture();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(toRemoteCallException(operation, e));
    }
  }

  public static RemoteCallException toRemoteCallException(String operation, Throwable error) {
    var cause = Exceptions.unwrap(error);
    if (cause instanceof RemoteCallException remote) return remote;
    if (cause instanceof HttpResponseException http && http.getResponse() != null) {
      var response = http.getResponse();
      var errorCode = response.getHeaderValue(ERROR_CODE);
      var body = http.getValue() == null ? http.getMessage() : String.valueOf(http.getValue());
      return new RemoteCallException(operation, response.getStatusCode(), body,
        errorCode != null ? errorCode : Json.errorCode(body), http);
    }
    return RemoteCallException.transportFailure(operation, cause);
  }
}
