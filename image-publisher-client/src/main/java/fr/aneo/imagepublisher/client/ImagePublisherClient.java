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

import com.google.gson.JsonObject;
import fr.aneo.imagepublisher.client.auth.CredentialProvider;
import fr.aneo.imagepublisher.client.auth.InlineCredentials;
import fr.aneo.imagepublisher.client.auth.SasToken;
import fr.aneo.imagepublisher.client.compute.ComputeClient;
import fr.aneo.imagepublisher.client.compute.GalleryImageVersionId;
import fr.aneo.imagepublisher.client.compute.GalleryImageVersionRequest;
import fr.aneo.imagepublisher.client.compute.HyperVGeneration;
import fr.aneo.imagepublisher.client.compute.ImageRequest;
import fr.aneo.imagepublisher.client.exception.MissingArgumentException;
import fr.aneo.imagepublisher.client.http.AzureEndpoints;
import fr.aneo.imagepublisher.client.http.AzureHttpTransport;
import fr.aneo.imagepublisher.client.marketplace.CloudPartnerClient;
import fr.aneo.imagepublisher.client.marketplace.ImageVersion;
import fr.aneo.imagepublisher.client.marketplace.OfferDocuments;
import fr.aneo.imagepublisher.client.operation.OperationKind;
import fr.aneo.imagepublisher.client.operation.OperationOutcome;
import fr.aneo.imagepublisher.client.operation.OperationWaiter;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;
import fr.aneo.imagepublisher.client.storage.BlobContainerClient;
import fr.aneo.imagepublisher.client.storage.BlobType;
import fr.aneo.imagepublisher.client.storage.ImageBlobUploader;
import fr.aneo.imagepublisher.client.storage.ImageUploadRequest;
import fr.aneo.imagepublisher.client.upload.ConcurrentUploader;
import fr.aneo.imagepublisher.client.upload.UploadResult;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.CompletionStage;
import java.util.function.UnaryOperator;

/**
 * Entry point for publishing VM images on Azure.
 * <p>
 * The client uploads image files to blob storage, creates compute images and gallery image
 * versions from them, and manages marketplace offers through the cloud partner API. Every
 * remote call goes through a shared {@link RequestExecutor}, so transient failures are retried
 * with backoff and expired tokens are refreshed once; long-running operations are awaited
 * with an {@link OperationWaiter}.
 *
 * <p>All operations are asynchronous and return a {@link CompletionStage}. Operations validate
 * the configuration fields they need before any remote call and throw
 * {@link MissingArgumentException} when one is absent.
 *
 * <p><strong>Thread-safety:</strong> instances are immutable and safe for concurrent use.
 *
 * @see ImagePublisherClientBuilder
 * @see ImagePublisherConfig
 * @see TransferOptions
 */
public class ImagePublisherClient {

  private final ImagePublisherConfig config;
  private final TransferOptions options;
  private final InlineCredentials credentials;
  private final SasToken sasToken;
  private final CredentialProvider credentialProvider;
  private final AzureEndpoints endpoints;
  private final AzureHttpTransport transport;
  private final RequestExecutor executor;
  private final OperationWaiter waiter;
  private final ConcurrentUploader uploader;
  private final Clock clock;

  ImagePublisherClient(ImagePublisherConfig config,
                       TransferOptions options,
                       InlineCredentials credentials,
                       SasToken sasToken,
                       CredentialProvider credentialProvider,
                       AzureEndpoints endpoints,
                       AzureHttpTransport transport) {
    this.config = config;
    this.options = options;
    this.credentials = credentials;
    this.sasToken = sasToken;
    this.credentialProvider = credentialProvider;
    this.endpoints = endpoints;
    this.transport = transport;
    this.executor = new RequestExecutor(options.retryPolicy(), credentialProvider);
    this.waiter = new OperationWaiter(executor, options.pollInterval(), options.timeout());
    this.uploader = new ConcurrentUploader(executor);
    this.clock = Clock.systemUTC();
  }

  public static ImagePublisherClientBuilder newBuilder() {
    return new ImagePublisherClientBuilder();
  }

  public ImagePublisherConfig config() {
    return config;
  }

  public TransferOptions transferOptions() {
    return options;
  }

  /**
   * Uploads an image file as a page blob of the configured container.
   *
   * @param imageFile    the image file
   * @param blobName     destination blob name, the file name when {@code null}
   * @param forceReplace replace an existing blob instead of failing
   * @return a stage completing with the upload result once the blob is committed
   */
  public CompletionStage<UploadResult> uploadImageBlob(Path imageFile, String blobName, boolean forceReplace) {
    return uploadImageBlob(imageFile, blobName, forceReplace, BlobType.PAGE);
  }

  public CompletionStage<UploadResult> uploadImageBlob(Path imageFile, String blobName, boolean forceReplace, BlobType blobType) {
    return uploadImageBlob(imageFile, blobName, forceReplace, blobType, true);
  }

  /**
   * Uploads an image file.
   *
   * @param expandImage upload the decompressed content when the file is xz compressed
   */
  public CompletionStage<UploadResult> uploadImageBlob(Path imageFile, String blobName, boolean forceReplace, BlobType blobType, boolean expandImage) {
    var request = new ImageUploadRequest(imageFile, blobName, blobType, forceReplace,
      options.chunkSize(), options.maxWorkers(), options.maxAttempts(), expandImage);
    return new ImageBlobUploader(container("image upload"), uploader).upload(request);
  }

  public CompletionStage<Boolean> imageBlobExists(String blobName) {
    return container("blob lookup").exists(blobName);
  }

  /**
   * @return a stage completing with {@code false} when the blob did not exist
   */
  public CompletionStage<Boolean> deleteStorageBlob(String blobName) {
    return container("blob deletion").delete(blobName);
  }

  /**
   * @return the URL of a blob signed with the configured shared access signature
   */
  public String getBlobSasUrl(String blobName) {
    return container("blob SAS URL").sasUrl(blobName);
  }

  public CompletionStage<JsonObject> getComputeImage(String imageName) {
    var operation = "compute image lookup";
    return compute(operation).getImage(config.requireResourceGroup(operation), imageName);
  }

  public CompletionStage<Boolean> imageExists(String imageName) {
    var operation = "compute image lookup";
    return compute(operation).imageExists(config.requireResourceGroup(operation), imageName);
  }

  /**
   * Creates a compute image from a blob of the configured container and waits until it is provisioned.
   *
   * @param blobName     source blob
   * @param imageName    name of the image
   * @param forceReplace delete an existing image of the same name first instead of failing
   * @param generation   Hyper-V generation, {@code V1} when {@code null}
   */
  public CompletionStage<JsonObject> createComputeImage(String blobName, String imageName, boolean forceReplace, HyperVGeneration generation) {
    var operation = "compute image creation";
    var request = new ImageRequest(
      config.requireResourceGroup(operation),
      imageName,
      blobContainer(operation).blobUrl(blobName),
      config.requireRegion(operation),
      generation,
      forceReplace);
    return compute(operation).createImage(request);
  }

  public CompletionStage<Void> deleteComputeImage(String imageName) {
    var operation = "compute image deletion";
    return compute(operation).deleteImage(config.requireResourceGroup(operation), imageName);
  }

  /**
   * Creates a gallery image version from a blob of the configured container, replicated to the
   * configured region, and waits until it is provisioned.
   */
  public CompletionStage<JsonObject> createGalleryImageVersion(String blobName,
                                                               String galleryName,
                                                               String galleryImageName,
                                                               String version,
                                                               String galleryResourceGroup) {
    var operation = "gallery image version creation";
    var request = new GalleryImageVersionRequest(
      galleryResourceGroup,
      galleryName,
      galleryImageName,
      version,
      config.requireRegion(operation),
      config.requireResourceGroup(operation),
      config.requireStorageAccount(operation),
      blobContainer(operation).blobUrl(blobName));
    return compute(operation).createGalleryImageVersion(request);
  }

  public CompletionStage<JsonObject> getGalleryImageVersion(String galleryName, String galleryImageName, String version, String galleryResourceGroup) {
    return compute("gallery image version lookup")
      .getGalleryImageVersion(new GalleryImageVersionId(galleryResourceGroup, galleryName, galleryImageName, version));
  }

  public CompletionStage<Boolean> galleryImageVersionExists(String galleryName, String galleryImageName, String version, String galleryResourceGroup) {
    return compute("gallery image version lookup")
      .galleryImageVersionExists(new GalleryImageVersionId(galleryResourceGroup, galleryName, galleryImageName, version));
  }

  public CompletionStage<Void> deleteGalleryImageVersion(String galleryName, String galleryImageName, String version, String galleryResourceGroup) {
    return compute("gallery image version deletion")
      .deleteGalleryImageVersion(new GalleryImageVersionId(galleryResourceGroup, galleryName, galleryImageName, version));
  }

  public CompletionStage<JsonObject> getOfferDoc(String offerId) {
    var operation = "offer lookup";
    return cloudPartner(operation).getOffer(config.requirePublisherId(operation), offerId);
  }

  public CompletionStage<JsonObject> uploadOfferDoc(String offerId, JsonObject doc) {
    var operation = "offer update";
    return cloudPartner(operation).putOffer(config.requirePublisherId(operation), offerId, doc);
  }

  /**
   * Starts publishing an offer, notifying the configured addresses.
   *
   * @return a stage completing with the handle of the publish operation
   */
  public CompletionStage<String> publishOffer(String offerId) {
    var operation = "offer publishing";
    return cloudPartner(operation).publishOffer(
      config.requirePublisherId(operation),
      offerId,
      config.requireNotificationEmails(operation));
  }

  /**
   * Publishes an offer and waits until the publish operation completes.
   */
  public CompletionStage<OperationOutcome<JsonObject>> publishOfferAndWait(String offerId) {
    var partner = cloudPartner("offer publishing");
    return publishOffer(offerId).thenCompose(handle -> partner.awaitOperation(OperationKind.OFFER_PUBLISH, handle));
  }

  /**
   * @return a stage completing with the handle of the go-live operation
   */
  public CompletionStage<String> goLiveWithOffer(String offerId) {
    var operation = "offer go-live";
    return cloudPartner(operation).goLive(config.requirePublisherId(operation), offerId);
  }

  /**
   * Makes an offer live and waits until the go-live operation completes.
   */
  public CompletionStage<OperationOutcome<JsonObject>> goLiveAndWait(String offerId) {
    var partner = cloudPartner("offer go-live");
    return goLiveWithOffer(offerId).thenCompose(handle -> partner.awaitOperation(OperationKind.OFFER_GO_LIVE, handle));
  }

  public CompletionStage<JsonObject> getOperation(String handle) {
    return cloudPartner("operation lookup").getOperation(handle);
  }

  public CompletionStage<String> getOfferStatus(String offerId) {
    var operation = "offer status";
    return cloudPartner(operation).getOfferStatus(config.requirePublisherId(operation), offerId);
  }

  /**
   * Adds an image version to a plan of an offer and uploads the updated offer document.
   */
  public CompletionStage<JsonObject> addImageToOffer(String offerId, ImageVersion image) {
    var operation = "offer image addition";
    return updateOffer(operation, offerId, doc -> OfferDocuments.addImageVersion(doc, image, LocalDate.now(clock)));
  }

  /**
   * Removes a release ({@code yyyy.MM.dd}) from a plan of an offer and uploads the updated offer
   * document. The last version of a plan cannot be removed.
   */
  public CompletionStage<JsonObject> removeImageFromOffer(String offerId, String release, String sku, String generationId) {
    var operation = "offer image removal";
    return updateOffer(operation, offerId, doc -> OfferDocuments.removeImageVersion(doc, release, sku, generationId));
  }

  /**
   * Hides an image of a plan from the marketplace and uploads the updated offer document.
   */
  public CompletionStage<JsonObject> deprecateImageInOffer(String offerId, String imageName, String sku) {
    var operation = "offer image deprecation";
    return updateOffer(operation, offerId, doc -> OfferDocuments.deprecateImage(doc, imageName, sku));
  }

  private CompletionStage<JsonObject> updateOffer(String operation, String offerId, UnaryOperator<JsonObject> update) {
    var publisherId = config.requirePublisherId(operation);
    var partner = cloudPartner(operation);
    return partner.getOffer(publisherId, offerId)
                  .thenApply(update)
                  .thenCompose(doc -> partner.putOffer(publisherId, offerId, doc));
  }

  private BlobContainerClient blobContainer(String operation) {
    return new BlobContainerClient(
      transport,
      executor,
      endpoints,
      config.requireStorageAccount(operation),
      config.requireContainer(operation),
      sasToken);
  }

  private BlobContainerClient container(String operation) {
    if (sasToken == null) requireCredentialProvider(operation);
    return blobContainer(operation);
  }

  private ComputeClient compute(String operation) {
    requireCredentialProvider(operation);
    var principal = ImagePublisherConfig.require(credentials, "credentialSource", operation);
    return new ComputeClient(transport, executor, waiter, endpoints, principal.subscriptionId());
  }

  private CloudPartnerClient cloudPartner(String operation) {
    requireCredentialProvider(operation);
    return new CloudPartnerClient(transport, executor, waiter, endpoints);
  }

  private void requireCredentialProvider(String operation) {
    ImagePublisherConfig.require(credentialProvider, "credentialSource", operation);
  }
}
