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

import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.CredentialProvider;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.exception.CloudPartnerException;
import fr.aneo.imagepublisher.client.exception.RemoteOperationFailedException;
import fr.aneo.imagepublisher.client.http.Json;
import fr.aneo.imagepublisher.client.operation.OperationKind;
import fr.aneo.imagepublisher.client.operation.OperationStatus;
import fr.aneo.imagepublisher.client.operation.OperationWaiter;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;
import fr.aneo.imagepublisher.client.retry.RetryPolicy;
import fr.aneo.imagepublisher.client.testutils.FakeAzureServerTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static fr.aneo.imagepublisher.client.testutils.FakeAzureServerTestBase.FakeResponse.ok;
import static fr.aneo.imagepublisher.client.testutils.FakeAzureServerTestBase.FakeResponse.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CloudPartnerClientTest extends FakeAzureServerTestBase {

  private static final String OFFER_PATH = "/api/publishers/aneo/offers/armonik-os";
  private static final String OPERATION_PATH = "/api/publishers/aneo/offers/armonik-os/submissions/1/operations/42";
  private static final RetryPolicy FAST_RETRY_POLICY = new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(10), 2.0, 0.0, null);

  private CredentialProvider credentialProvider;
  private CloudPartnerClient client;

  @BeforeEach
  void setUp() {
    credentialProvider = mock(CredentialProvider.class);
    when(credentialProvider.getToken(TokenScope.CLOUD_PARTNER)).thenReturn(new AccessToken("partner-token", Instant.now().plusSeconds(3600)));
    var executor = new RequestExecutor(FAST_RETRY_POLICY, credentialProvider);
    var waiter = new OperationWaiter(executor, Duration.ofMillis(10), Duration.ofSeconds(5));
    client = new CloudPartnerClient(transport, executor, waiter, endpoints);
  }

  @Test
  @DisplayName("should get an offer document with a cloud partner token")
  void should_get_an_offer_document_with_a_cloud_partner_token() {
    // Given
    on("GET", OFFER_PATH, ok("{\"id\":\"armonik-os\",\"definition\":{\"plans\":[]}}"));

    // When
    var offer = client.getOffer("aneo", "armonik-os").toCompletableFuture().join();

    // Then
    assertThat(Json.string(offer, "id")).isEqualTo("armonik-os");
    var request = requests("GET", OFFER_PATH).get(0);
    assertThat(request.query()).isEqualTo("api-version=2017-10-31");
    assertThat(request.header("Authorization")).isEqualTo("Bearer partner-token");
    verify(credentialProvider).getToken(TokenScope.CLOUD_PARTNER);
  }

  @Test
  @DisplayName("should replace the offer document whatever its revision")
  void should_replace_the_offer_document_whatever_its_revision() {
    // Given
    on("PUT", OFFER_PATH, ok("{\"id\":\"armonik-os\"}"));
    var doc = Json.parseObject("{\"id\":\"armonik-os\",\"definition\":{}}");

    // When
    client.putOffer("aneo", "armonik-os", doc).toCompletableFuture().join();

    // Then
    var request = requests("PUT", OFFER_PATH).get(0);
    assertThat(request.header("If-Match")).isEqualTo("*");
    assertThat(Json.parseObject(request.bodyAsString())).isEqualTo(doc);
  }

  @Test
  @DisplayName("should publish an offer and return the operation handle")
  void should_publish_an_offer_and_return_the_operation_handle() {
    // Given
    on("POST", OFFER_PATH + "/publish", status(202).withHeader("Location", OPERATION_PATH));

    // When
    var handle = client.publishOffer("aneo", "armonik-os", "ops@aneo.fr").toCompletableFuture().join();

    // Then
    assertThat(handle).isEqualTo(OPERATION_PATH);
    var body = Json.parseObject(requests("POST", OFFER_PATH + "/publish").get(0).bodyAsString());
    assertThat(Json.string(Json.object(body, "metadata"), "notification-emails")).isEqualTo("ops@aneo.fr");
  }

  @Test
  @DisplayName("should fail when publishing returns no operation handle")
  void should_fail_when_publishing_returns_no_operation_handle() {
    // Given
    on("POST", OFFER_PATH + "/golive", status(202));

    // When/Then
    assertThatThrownBy(() -> client.goLive("aneo", "armonik-os").toCompletableFuture().join())
      .hasCauseInstanceOf(CloudPartnerException.class)
      .hasMessageContaining("Location");
  }

  @Test
  @DisplayName("should wait for a publish operation to complete")
  void should_wait_for_a_publish_operation_to_complete() {
    // Given
    on("GET", OPERATION_PATH,
      ok("{\"status\":\"running\"}"),
      ok("{\"status\":\"running\"}"),
      ok("{\"status\":\"complete\",\"id\":\"42\"}"));

    // When
    var outcome = client.awaitOperation(OperationKind.OFFER_PUBLISH, OPERATION_PATH).toCompletableFuture().join();

    // Then
    assertThat(outcome.status()).isEqualTo(OperationStatus.SUCCEEDED);
    assertThat(outcome.probes()).isEqualTo(3);
    assertThat(Json.string(outcome.payload(), "id")).isEqualTo("42");
  }

  @Test
  @DisplayName("should fail the wait when the operation failed")
  void should_fail_the_wait_when_the_operation_failed() {
    // Given
    on("GET", OPERATION_PATH, ok("{\"status\":\"failed\",\"errors\":[\"certification failed\"]}"));

    // When/Then
    assertThatThrownBy(() -> client.awaitOperation(OperationKind.OFFER_GO_LIVE, OPERATION_PATH).toCompletableFuture().join())
      .cause()
      .isInstanceOfSatisfying(RemoteOperationFailedException.class,
        error -> assertThat(error.detail()).contains("certification failed"));
  }

  @Test
  @DisplayName("should report an offer waiting for publisher review")
  void should_report_an_offer_waiting_for_publisher_review() {
    // Given
    on("GET", OFFER_PATH + "/status", ok("""
      {"status": "running", "steps": [
        {"stepName": "validation", "status": "complete"},
        {"stepName": "publisher-signoff", "status": "waitingForPublisherReview"}
      ]}
      """));

    // When
    var status = client.getOfferStatus("aneo", "armonik-os").toCompletableFuture().join();

    // Then
    assertThat(status).isEqualTo("waitingForPublisherReview");
  }

  @Test
  @DisplayName("offer status falls back to the raw status or unknown")
  void offer_status_falls_back_to_the_raw_status_or_unknown() {
    assertThat(CloudPartnerClient.offerStatus(Json.parseObject("{\"status\":\"succeeded\"}"))).isEqualTo("succeeded");
    assertThat(CloudPartnerClient.offerStatus(Json.parseObject("{\"status\":\"running\",\"steps\":[]}"))).isEqualTo("running");
    assertThat(CloudPartnerClient.offerStatus(Json.parseObject("{}"))).isEqualTo("unknown");
  }

  @Test
  @DisplayName("operation states map to operation statuses")
  void operation_states_map_to_operation_statuses() {
    assertThat(CloudPartnerClient.operationResult(Json.parseObject("{\"status\":\"Completed\"}")).status()).isEqualTo(OperationStatus.SUCCEEDED);
    assertThat(CloudPartnerClient.operationResult(Json.parseObject("{\"status\":\"canceled\"}")).status()).isEqualTo(OperationStatus.CANCELED);
    assertThat(CloudPartnerClient.operationResult(Json.parseObject("{\"status\":\"notStarted\"}")).status()).isEqualTo(OperationStatus.IN_PROGRESS);
    assertThat(CloudPartnerClient.operationResult(Json.parseObject("{}")).status()).isEqualTo(OperationStatus.IN_PROGRESS);
  }
}
