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
package fr.aneo.imagepublisher.client;

import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.CredentialSource;
import fr.aneo.imagepublisher.client.auth.InlineCredentials;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.exception.CloudPartnerException;
import fr.aneo.imagepublisher.client.exception.MissingArgumentException;
import fr.aneo.imagepublisher.client.http.Json;
import fr.aneo.imagepublisher.client.marketplace.ImageVersion;
import fr.aneo.imagepublisher.client.marketplace.OfferDocuments;
import fr.aneo.imagepublisher.client.operation.OperationStatus;
import fr.aneo.imagepublisher.client.testutils.FakeAzureServerTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static fr.aneo.imagepublisher.client.testutils.FakeAzureServerTestBase.FakeResponse.ok;
import static fr.aneo.imagepublisher.client.testutils.FakeAzureServerTestBase.FakeResponse.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImagePublisherClientTest extends FakeAzureServerTestBase {

  private static final String OFFER_PATH = "/api/publishers/aneo/offers/armonik-os";
  private static final InlineCredentials CREDENTIALS = new InlineCredentials("client", "secret", "tenant", "sub-1");
  private static final TransferOptions FAST_OPTIONS = TransferOptions.builder()
                                                                     .chunkSize(512)
                                                                     .maxAttempts(2)
                                                                     .pollInterval(Duration.ofMillis(10))
                                                                     .timeout(Duration.ofSeconds(5))
                                                                     .build();

  @TempDir
  Path tempDir;

  private final List<TokenScope> requestedScopes = new CopyOnWriteArrayList<>();

  @Test
  @DisplayName("should upload an image blob with a shared access signature")
  void should_upload_an_image_blob_with_a_shared_access_signature() throws IOException {
    // Given
    var file = Files.write(tempDir.resolve("os.vhd"), new byte[1024]);
    on("PUT", "/imagestore/vhds/os.vhd", status(201));
    var client = clientBuilder(storageConfig().withCredentialSource(CredentialSource.sasToken("sv=2021-08-06&sig=secret"))).build();

    // When
    var result = client.uploadImageBlob(file, null, false).toCompletableFuture().join();

    // Then
    assertThat(result.chunkCount()).isEqualTo(2);
    assertThat(requests("PUT", "/imagestore/vhds/os.vhd")).hasSize(3)
                                                        .allSatisfy(request -> assertThat(request.query()).contains("sig=secret"));
    assertThat(client.getBlobSasUrl("os.vhd")).isEqualTo(baseUrl + "/imagestore/vhds/os.vhd?sv=2021-08-06&sig=secret");
  }

  @Test
  @DisplayName("should name the missing configuration field")
  void should_name_the_missing_configuration_field() {
    // Given
    var client = clientBuilder(ImagePublisherConfig.builder()
                                                   .withCredentialSource(CredentialSource.sasToken("sig=secret"))
                                                   .withStorageAccount("imagestore")).build();

    // When/Then
    assertThatThrownBy(() -> client.imageBlobExists("os.vhd"))
      .isInstanceOfSatisfying(MissingArgumentException.class, error -> assertThat(error.field()).isEqualTo("container"));
    assertThatThrownBy(() -> client.getOfferDoc("armonik-os"))
      .isInstanceOfSatisfying(MissingArgumentException.class, error -> assertThat(error.field()).isEqualTo("credentialSource"));
  }

  @Test
  @DisplayName("a shared access signature does not authorize compute operations")
  void shared_access_signature_does_not_authorize_compute_operations() {
    // Given
    var client = clientBuilder(storageConfig().withCredentialSource(CredentialSource.sasToken("sig=secret"))
                                              .withResourceGroup("images-rg")
                                              .withRegion("westeurope")).build();

    // When/Then
    assertThatThrownBy(() -> client.createComputeImage("os.vhd", "my-image", false, null))
      .isInstanceOfSatisfying(MissingArgumentException.class, error -> assertThat(error.field()).isEqualTo("credentialSource"));
    assertThat(requests()).isEmpty();
  }

  @Test
  @DisplayName("a service principal without a token source uses the identity library")
  void service_principal_defaults_to_the_identity_library() {
    // Given
    var builder = ImagePublisherClient.newBuilder()
                                      .withConfig(ImagePublisherConfig.builder().withCredentialSource(CREDENTIALS).build())
                                      .withTransport(transport);

    // When
    var client = builder.build();

    // Then
    assertThat(client).isNotNull();
    assertThat(requests()).isEmpty();
  }

  @Test
  @DisplayName("should read the service principal from a credentials file")
  void should_read_the_service_principal_from_a_credentials_file() throws IOException {
    // Given
    var file = Files.writeString(tempDir.resolve("sp.json"),
      "{\"clientId\":\"c\",\"clientSecret\":\"s\",\"tenantId\":\"t\",\"subscriptionId\":\"sub-from-file\"}");
    var imagePath = "/subscriptions/sub-from-file/resourceGroups/images-rg/providers/Microsoft.Compute/images/my-image";
    on("GET", imagePath, ok("{\"name\":\"my-image\"}"));
    var client = clientBuilder(ImagePublisherConfig.builder()
                                                   .withCredentialSource(CredentialSource.file(file))
                                                   .withResourceGroup("images-rg"))
      .withTokenSource(this::issueToken)
      .build();

    // When
    var exists = client.imageExists("my-image").toCompletableFuture().join();

    // Then
    assertThat(exists).isTrue();
    assertThat(requestedScopes).containsExactly(TokenScope.MANAGEMENT);
    assertThat(requests("GET", imagePath).get(0).header("Authorization")).isEqualTo("Bearer MANAGEMENT-token");
  }

  @Test
  @DisplayName("should add an image to an offer and upload the updated document")
  void should_add_an_image_to_an_offer_and_upload_the_updated_document() {
    // Given
    on("GET", OFFER_PATH, ok(offerDoc()));
    on("PUT", OFFER_PATH, ok("{}"));
    var client = partnerClient();

    // When
    client.addImageToOffer("armonik-os", new ImageVersion("https://blob/os.vhd?sig=x", "January", "os-20250102", "OS", "standard"))
          .toCompletableFuture().join();

    // Then
    var uploaded = Json.parseObject(requests("PUT", OFFER_PATH).get(0).bodyAsString());
    var versions = uploaded.getAsJsonObject("definition").getAsJsonArray("plans").get(0).getAsJsonObject()
                           .getAsJsonObject(OfferDocuments.VM_IMAGES_KEY);
    assertThat(versions.keySet()).containsExactlyInAnyOrder("2024.12.01", "2025.01.02");
    assertThat(requestedScopes).containsOnly(TokenScope.CLOUD_PARTNER);
  }

  @Test
  @DisplayName("should not upload an offer whose last version would be removed")
  void should_not_upload_an_offer_whose_last_version_would_be_removed() {
    // Given
    on("GET", OFFER_PATH, ok(offerDoc()));
    var client = partnerClient();

    // When/Then
    assertThatThrownBy(() -> client.removeImageFromOffer("armonik-os", "2024.12.01", "standard", null).toCompletableFuture().join())
      .hasCauseInstanceOf(CloudPartnerException.class);
    assertThat(requests("PUT", OFFER_PATH)).isEmpty();
  }

  @Test
  @DisplayName("should publish an offer and wait for the operation")
  void should_publish_an_offer_and_wait_for_the_operation() {
    // Given
    var operationPath = "/api/publishers/aneo/offers/armonik-os/submissions/2/operations/7";
    on("POST", OFFER_PATH + "/publish", status(202).withHeader("Location", operationPath));
    on("GET", operationPath, ok("{\"status\":\"running\"}"), ok("{\"status\":\"complete\"}"));
    var client = partnerClient();

    // When
    var outcome = client.publishOfferAndWait("armonik-os").toCompletableFuture().join();

    // Then
    assertThat(outcome.status()).isEqualTo(OperationStatus.SUCCEEDED);
    assertThat(outcome.handle()).isEqualTo(operationPath);
    assertThat(outcome.probes()).isEqualTo(2);
  }

  @Test
  @DisplayName("publishing needs notification addresses")
  void publishing_needs_notification_addresses() {
    // Given
    var client = clientBuilder(ImagePublisherConfig.builder().withCredentialSource(CREDENTIALS).withPublisherId("aneo"))
      .withTokenSource(this::issueToken)
      .build();

    // When/Then
    assertThatThrownBy(() -> client.publishOffer("armonik-os"))
      .isInstanceOfSatisfying(MissingArgumentException.class, error -> assertThat(error.field()).isEqualTo("notificationEmails"));
  }

  private ImagePublisherClient partnerClient() {
    return clientBuilder(ImagePublisherConfig.builder()
                                             .withCredentialSource(CREDENTIALS)
                                             .withPublisherId("aneo")
                                             .withNotificationEmails("ops@aneo.fr"))
      .withTokenSource(this::issueToken)
      .build();
  }

  private ImagePublisherClientBuilder clientBuilder(ImagePublisherConfig.Builder config) {
    return ImagePublisherClient.newBuilder()
                               .withConfig(config.build())
                               .withTransferOptions(FAST_OPTIONS)
                               .withEndpoints(endpoints)
                               .withTransport(transport);
  }

  private static ImagePublisherConfig.Builder storageConfig() {
    return ImagePublisherConfig.builder().withStorageAccount("imagestore").withContainer("vhds");
  }

  private AccessToken issueToken(InlineCredentials credentials, TokenScope scope) {
    requestedScopes.add(scope);
    return new AccessToken(scope.name() + "-token", Instant.now().plusSeconds(3600));
  }

  private static String offerDoc() {
    return """
      {"definition": {"plans": [{"planId": "standard", "%s": {"2024.12.01": {"mediaName": "os-20241201"}}}]}}
      """.formatted(OfferDocuments.VM_IMAGES_KEY);
  }
}
