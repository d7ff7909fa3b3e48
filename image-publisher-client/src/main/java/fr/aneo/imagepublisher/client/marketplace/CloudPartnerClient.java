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
package fr.aneo.imagepublisher.client.marketplace;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.exception.CloudPartnerException;
import fr.aneo.imagepublisher.client.http.AzureEndpoints;
import fr.aneo.imagepublisher.client.http.AzureHttpTransport;
import fr.aneo.imagepublisher.client.http.AzureResponse;
import fr.aneo.imagepublisher.client.http.Json;
import fr.aneo.imagepublisher.client.operation.OperationKind;
import fr.aneo.imagepublisher.client.operation.OperationOutcome;
import fr.aneo.imagepublisher.client.operation.OperationStatus;
import fr.aneo.imagepublisher.client.operation.OperationWaiter;
import fr.aneo.imagepublisher.client.operation.ProbeResult;
import fr.aneo.imagepublisher.client.operation.StatusProbe;
import fr.aneo.imagepublisher.client.retry.RequestContext;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;

import java.util.Locale;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Client of the cloud partner portal API, which manages marketplace offers.
 * <p>
 * Publishing and going live are long-running: the API answers with the path of an operation in
 * the {@code Location} header, which is the handle awaited with {@link #awaitOperation}.
 * </p>
 */
public class CloudPartnerClient {

  static final String API_VERSION = "2017-10-31";
  static final String WAITING_FOR_PUBLISHER_REVIEW = "waitingForPublisherReview";

  private final AzureHttpTransport transport;
  private final RequestExecutor executor;
  private final OperationWaiter waiter;
  private final AzureEndpoints endpoints;

  public CloudPartnerClient(AzureHttpTransport transport, RequestExecutor executor, OperationWaiter waiter, AzureEndpoints endpoints) {
    this.transport = requireNonNull(transport, "transport must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
    this.waiter = requireNonNull(waiter, "waiter must not be null");
    this.endpoints = requireNonNull(endpoints, "endpoints must not be null");
  }

  public CompletionStage<JsonObject> getOffer(String publisherId, String offerId) {
    var operation = "get offer " + offerId;
    return call(operation, token -> request(HttpMethod.GET, offerUri(publisherId, offerId, ""), token))
      .thenApply(response -> Json.parseObject(response.body()));
  }

  /**
   * Replaces the offer document, whatever its current revision.
   */
  public CompletionStage<JsonObject> putOffer(String publisherId, String offerId, JsonObject doc) {
    requireNonNull(doc, "doc must not be null");
    var body = Json.toJson(doc);
    return call("put offer " + offerId, token -> request(HttpMethod.PUT, offerUri(publisherId, offerId, ""), token)
      .setHeader(HttpHeaderName.CONTENT_TYPE, "application/json")
      .setHeader(HttpHeaderName.IF_MATCH, "*")
      .setBody(body))
      .thenApply(response -> Json.parseObject(response.body()));
  }

  /**
   * Starts publishing an offer.
   *
   * @param notificationEmails comma separated addresses notified of the publishing progress
   * @return a stage completing with the handle of the publish operation
   */
  public CompletionStage<String> publishOffer(String publisherId, String offerId, String notificationEmails) {
    requireNonNull(notificationEmails, "notificationEmails must not be null");
    var metadata = new JsonObject();
    metadata.addProperty("notification-emails", notificationEmails);
    var body = new JsonObject();
    body.add("metadata", metadata);

    var operation = "publish offer " + offerId;
    return call(operation, token -> request(HttpMethod.POST, offerUri(publisherId, offerId, "/publish"), token)
      .setHeader(HttpHeaderName.CONTENT_TYPE, "application/json")
      .setBody(Json.toJson(body)))
      .thenApply(response -> location(operation, response));
  }

  /**
   * Makes a published offer available to customers.
   *
   * @return a stage completing with the handle of the go-live operation
   */
  public CompletionStage<String> goLive(String publisherId, String offerId) {
    var operation = "go live with offer " + offerId;
    return call(operation, token -> request(HttpMethod.POST, offerUri(publisherId, offerId, "/golive"), token)
      .setHeader(HttpHeaderName.CONTENT_TYPE, "application/json")
      .setBody(""))
      .thenApply(response -> location(operation, response));
  }

  /**
   * @param handle operation path, as returned by {@link #publishOffer} or {@link #goLive}
   */
  public CompletionStage<JsonObject> getOperation(String handle) {
    return executor.executeAuthenticated(token -> fetchOperation(handle, token),
      RequestContext.of("get operation " + handle, TokenScope.CLOUD_PARTNER));
  }

  /**
   * Returns the publishing status of an offer.
   * <p>
   * While the offer is running and its {@code publisher-signoff} step waits for the publisher, the
   * status is {@value #WAITING_FOR_PUBLISHER_REVIEW}: the offer is ready to go live. An answer
   * without status gives {@code unknown}.
   */
  public CompletionStage<String> getOfferStatus(String publisherId, String offerId) {
    return call("get status of offer " + offerId, token -> request(HttpMethod.GET, offerUri(publisherId, offerId, "/status"), token))
      .thenApply(response -> offerStatus(Json.parseObject(response.body())));
  }

  /**
   * Waits for a publish or go-live operation to complete.
   */
  public CompletionStage<OperationOutcome<JsonObject>> awaitOperation(OperationKind kind, String handle) {
    return waiter.await(kind, handle, new StatusProbe<>() {
      @Override
      public CompletionStage<ProbeResult<JsonObject>> probe(String operation, AccessToken token) {
        return fetchOperation(operation, token).thenApply(CloudPartnerClient::operationResult);
      }

      @Override
      public TokenScope scope() {
        return TokenScope.CLOUD_PARTNER;
      }
    });
  }

  static String offerStatus(JsonObject response) {
    var status = Json.string(response, "status");
    if (status == null) return "unknown";
    if ("running".equals(status) && WAITING_FOR_PUBLISHER_REVIEW.equals(signoffStatus(response.getAsJsonArray("steps")))) {
      return WAITING_FOR_PUBLISHER_REVIEW;
    }
    return status;
  }

  static ProbeResult<JsonObject> operationResult(JsonObject operation) {
    var status = Json.string(operation, "status");
    var normalized = switch (status == null ? "" : status.toLowerCase(Locale.ROOT)) {
      case "complete", "completed", "succeeded" -> OperationStatus.SUCCEEDED;
      case "failed" -> OperationStatus.FAILED;
      case "canceled", "cancelled" -> OperationStatus.CANCELED;
      default -> OperationStatus.IN_PROGRESS;
    };
    var detail = normalized == OperationStatus.FAILED ? Json.toJson(operation) : null;
    return new ProbeResult<>(normalized, operation, detail);
  }

  private static String signoffStatus(JsonArray steps) {
    if (steps == null) return null;
    for (var step : steps) {
      if (step.isJsonObject() && "publisher-signoff".equals(Json.string(step.getAsJsonObject(), "stepName"))) {
        return Json.string(step.getAsJsonObject(), "status");
      }
    }
    return null;
  }

  String offerUri(String publisherId, String offerId, String method) {
    requireNonNull(publisherId, "publisherId must not be null");
    requireNonNull(offerId, "offerId must not be null");
    return endpoints.cloudPartner() + "/api/publishers/" + publisherId + "/offers/" + offerId + method + "?api-version=" + API_VERSION;
  }

  private CompletionStage<JsonObject> fetchOperation(String handle, AccessToken token) {
    return transport.send("get operation " + handle, request(HttpMethod.GET, endpoints.cloudPartner() + handle, token)).thenApply(response -> Json.parseObject(response.body()));
  }

  private HttpRequest request(HttpMethod method, String uri, AccessToken token) {
    return transport.request(method, uri)
                    .setHeader(HttpHeaderName.AUTHORIZATION, token.authorizationHeader())
                    .setHeader(HttpHeaderName.ACCEPT, "application/json");
  }

  private CompletionStage<AzureResponse> call(String operation, Function<AccessToken, HttpRequest> request) {
    return executor.executeAuthenticated(token -> transport.send(operation, request.apply(token)),
      RequestContext.of(operation, TokenScope.CLOUD_PARTNER));
  }

  private static String location(String operation, AzureResponse response) {
    var location = response.header("Location");
    if (location == null) {
      throw new CloudPartnerException(operation + " returned no Location header");
    }
    return location;
  }
}
