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

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpPipeline;
import com.azure.core.http.HttpPipelineBuilder;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.policy.UserAgentPolicy;
import com.azure.core.util.HttpClientOptions;
import fr.aneo.imagepublisher.client.exception.RemoteCallException;
import fr.aneo.imagepublisher.client.exception.RequestFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

import static fr.aneo.imagepublisher.client.internal.concurrent.Futures.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * Sends single HTTP requests to Azure endpoints through an Azure Core {@link HttpPipeline}.
 * <p>
 * One call is one attempt: the pipeline carries no retry policy. A 2xx response completes the
 * stage with the response; any other status completes it exceptionally with a
 * {@link RemoteCallException} carrying the status, the full response body and the Azure error
 * code. Transport errors (connection refused, timeout) become a {@link RemoteCallException}
 * without status.
 * </p>
 * The underlying {@link HttpClient} is shared with the storage clients built on top of it.
 */
public class AzureHttpTransport {
  private static final Logger logger = LoggerFactory.getLogger(AzureHttpTransport.class);

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofMinutes(5);

  static final String USER_AGENT = "image-publisher";
  private static final int NOT_FOUND = 404;

  private final HttpClient httpClient;
  private final HttpPipeline pipeline;

  public AzureHttpTransport() {
    this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_RESPONSE_TIMEOUT);
  }

  public AzureHttpTransport(Duration connectTimeout, Duration responseTimeout) {
    this(HttpClient.createDefault(new HttpClientOptions()
      .setConnectTimeout(requireNonNull(connectTimeout, "connectTimeout must not be null"))
      .setResponseTimeout(requireNonNull(responseTimeout, "responseTimeout must not be null"))));
  }

  public AzureHttpTransport(HttpClient httpClient) {
    this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
    this.pipeline = new HttpPipelineBuilder()
      .httpClient(httpClient)
      .policies(new UserAgentPolicy(USER_AGENT))
      .build();
  }

  public HttpClient httpClient() {
    return httpClient;
  }

  /**
   * Creates a request.
   *
   * @param method HTTP method
   * @param uri    target URI
   * @return a mutable request to add headers and body to
   */
  public HttpRequest request(HttpMethod method, String uri) {
    return new HttpRequest(method, uri);
  }

  /**
   * Sends a request.
   *
   * @param operation description used in logs and errors
   * @param request   the request
   * @return a stage completing with the 2xx response, or exceptionally with {@link RemoteCallException}.
   * Cancelling the stage aborts the exchange.
   */
  public CompletionStage<AzureResponse> send(String operation, HttpRequest request) {
    logger.atDebug()
          .addKeyValue("operation", operation)
          .addKeyValue("method", request.getHttpMethod())
          .addKeyValue("uri", redact(request.getUrl().toString()))
          .log("Sending request");

    var exchange = pipeline.send(request)
                           .flatMap(response -> response.getBodyAsString()
                                                        .defaultIfEmpty("")
                                                        .map(body -> new AzureResponse(response.getStatusCode(), response.getHeaders(), body)));

    return AzureCalls.toStage(operation, exchange).thenApply(response -> {
      var status = response.statusCode();
      if (status < 200 || status >= 300) {
        throw new RemoteCallException(operation, status, response.body(), Json.errorCode(response.body()));
      }
      return response;
    });
  }

  /**
   * Tells whether a failure, as returned by this transport or by the request executor, is a
   * {@code 404 Not Found} response.
   *
   * @param error the failure, possibly wrapped in a {@code CompletionException}
   * @return {@code true} for a 404 response
   */
  public static boolean isNotFound(Throwable error) {
    var cause = unwrap(error);
    if (cause instanceof RequestFailedException failed) return failed.statusCode() == NOT_FOUND;
    return cause instanceof RemoteCallException remote && remote.statusCode() == NOT_FOUND;
  }

  /**
   * Removes the signature of a shared access signature from a URI before logging it.
   */
  static String redact(String uri) {
    return uri.replaceAll("([?&]sig=)[^&]*", "$1***");
  }
}
