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
package fr.aneo.imagepublisher.client.compute;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpMethod;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.exception.ResourceConflictException;
import fr.aneo.imagepublisher.client.http.AzureEndpoints;
import fr.aneo.imagepublisher.client.http.AzureHttpTransport;
import fr.aneo.imagepublisher.client.http.Json;
import fr.aneo.imagepublisher.client.operation.OperationKind;
import fr.aneo.imagepublisher.client.operation.OperationStatus;
import fr.aneo.imagepublisher.client.operation.OperationWaiter;
import fr.aneo.imagepublisher.client.operation.ProbeResult;
import fr.aneo.imagepublisher.client.operation.StatusProbe;
import fr.aneo.imagepublisher.client.retry.RequestContext;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static fr.aneo.imagepublisher.client.http.AzureHttpTransport.isNotFound;
import static java.util.Objects.requireNonNull;

/**
 * Manages compute images and shared image gallery versions through the Azure Resource Manager API.
 * <p>
 * Creations and deletions are long-running on the Azure side: every mutating method returns a
 * stage that completes once the {@link OperationWaiter} observed the final state. Creations are
 * tracked through the resource's {@code provisioningState}; deletions complete when the resource
 * is no longer found.
 * </p>
 */
public class ComputeClient {
  private static final Logger logger = LoggerFactory.getLogger(ComputeClient.class);

  static final String IMAGES_API_VERSION = "2022-08-01";
  static final String GALLERIES_API_VERSION = "2022-03-03";

  private final AzureHttpTransport transport;
  private final RequestExecutor executor;
  private final OperationWaiter waiter;
  private final AzureEndpoints endpoints;
  private final String subscriptionId;

  public ComputeClient(AzureHttpTransport transport,
                       RequestExecutor executor,
                       OperationWaiter waiter,
                       AzureEndpoints endpoints,
                       String subscriptionId) {
    this.transport = requireNonNull(transport, "transport must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
    this.waiter = requireNonNull(waiter, "waiter must not be null");
    this.endpoints = requireNonNull(endpoints, "endpoints must not be null");
    this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId must not be null");
  }

  public CompletionStage<JsonObject> getImage(String resourceGroup, String imageName) {
    var uri = imageUri(resourceGroup, imageName);
    return executor.executeAuthenticated(token -> get("get image " + imageName, uri, token),
      RequestContext.of("get image " + imageName, TokenScope.MANAGEMENT));
  }

  public CompletionStage<Boolean> imageExists(String resourceGroup, String imageName) {
    return exists(getImage(resourceGroup, imageName));
  }

  /**
   * Creates a compute image from a blob and waits until it is provisioned.
   * <p>
   * If an image of the same name already exists, it is deleted first when
   * {@link ImageRequest#forceReplace()} is set, otherwise the stage fails with
   * {@link ResourceConflictException}.
   *
   * @return a stage completing with the provisioned image resource
   */
  public CompletionStage<JsonObject> createImage(ImageRequest request) {
    requireNonNull(request, "request must not be null");

    return imageExists(request.resourceGroup(), request.imageName())
      .thenCompose(exists -> {
        if (!exists) return CompletableFuture.completedFuture(null);
        if (!request.forceReplace()) {
          throw new ResourceConflictException("Image " + request.imageName()
            + " already exists. Set forceReplace to delete and re-create it.");
        }
        logger.atInfo()
              .addKeyValue("image", request.imageName())
              .log("Replacing existing image");
        return deleteImage(request.resourceGroup(), request.imageName());
      })
      .thenCompose(ignored -> {
        var uri = imageUri(request.resourceGroup(), request.imageName());
        var body = imageBody(request);
        return executor.executeAuthenticated(
          token -> put("create image " + request.imageName(), uri, body, token),
          RequestContext.of("create image " + request.imageName(), TokenScope.MANAGEMENT));
      })
      .thenCompose(ignored -> waiter.await(OperationKind.IMAGE_CREATE, request.imageName(),
        provisioningProbe(imageUri(request.resourceGroup(), request.imageName()))))
      .thenApply(outcome -> outcome.payload());
  }

  /**
   * Deletes a compute image and waits until it is gone. Deleting an absent image succeeds.
   */
  public CompletionStage<Void> deleteImage(String resourceGroup, String imageName) {
    var uri = imageUri(resourceGroup, imageName);
    return delete("delete image " + imageName, uri)
      .thenCompose(found -> found
        ? waiter.await(OperationKind.IMAGE_DELETE, imageName, deletionProbe(uri)).thenApply(outcome -> null)
        : CompletableFuture.<Void>completedFuture(null));
  }

  public CompletionStage<JsonObject> getGalleryImageVersion(GalleryImageVersionId id) {
    var uri = galleryVersionUri(id);
    return executor.executeAuthenticated(token -> get("get gallery image version " + id, uri, token),
      RequestContext.of("get gallery image version " + id, TokenScope.MANAGEMENT));
  }

  public CompletionStage<Boolean> galleryImageVersionExists(GalleryImageVersionId id) {
    return exists(getGalleryImageVersion(id));
  }

  /**
   * Creates a gallery image version from a blob and waits until it is provisioned.
   *
   * @return a stage completing with the provisioned version resource
   */
  public CompletionStage<JsonObject> createGalleryImageVersion(GalleryImageVersionRequest request) {
    requireNonNull(request, "request must not be null");

    var id = request.id();
    var uri = galleryVersionUri(id);
    var body = galleryVersionBody(request);
    return executor.executeAuthenticated(
                     token -> put("create gallery image version " + id, uri, body, token),
                     RequestContext.of("create gallery image version " + id, TokenScope.MANAGEMENT))
                   .thenCompose(ignored -> waiter.await(OperationKind.GALLERY_IMAGE_VERSION_CREATE, id.toString(), provisioningProbe(uri)))
                   .thenApply(outcome -> outcome.payload());
  }

  /**
   * Deletes a gallery image version and waits until it is gone. Deleting an absent version succeeds.
   */
  public CompletionStage<Void> deleteGalleryImageVersion(GalleryImageVersionId id) {
    var uri = galleryVersionUri(id);
    return delete("delete gallery image version " + id, uri)
      .thenCompose(found -> found
        ? waiter.await(OperationKind.GALLERY_IMAGE_VERSION_DELETE, id.toString(), deletionProbe(uri)).thenApply(outcome -> null)
        : CompletableFuture.<Void>completedFuture(null));
  }

  String imageUri(String resourceGroup, String imageName) {
    return resourceUri(resourceGroup, "images/" + imageName, IMAGES_API_VERSION);
  }

  String galleryVersionUri(GalleryImageVersionId id) {
    return resourceUri(id.resourceGroup(), id.path(), GALLERIES_API_VERSION);
  }

  private String resourceUri(String resourceGroup, String path, String apiVersion) {
    requireNonNull(resourceGroup, "resourceGroup must not be null");
    return endpoints.management()
      + "/subscriptions/" + subscriptionId
      + "/resourceGroups/" + resourceGroup
      + "/providers/Microsoft.Compute/" + path
      + "?api-version=" + apiVersion;
  }

  static JsonObject imageBody(ImageRequest request) {
    var osDisk = new JsonObject();
    osDisk.addProperty("osType", "Linux");
    osDisk.addProperty("osState", "Generalized");
    osDisk.addProperty("caching", "ReadWrite");
    osDisk.addProperty("blobUri", request.blobUri());

    var storageProfile = new JsonObject();
    storageProfile.add("osDisk", osDisk);

    var properties = new JsonObject();
    properties.addProperty("hyperVGeneration", request.generation().name());
    properties.add("storageProfile", storageProfile);

    var body = new JsonObject();
    body.addProperty("location", request.region());
    body.add("properties", properties);
    return body;
  }

  JsonObject galleryVersionBody(GalleryImageVersionRequest request) {
    var targetRegion = new JsonObject();
    targetRegion.addProperty("name", request.region());
    var targetRegions = new JsonArray();
    targetRegions.add(targetRegion);
    var publishingProfile = new JsonObject();
    publishingProfile.add("targetRegions", targetRegions);

    var source = new JsonObject();
    source.addProperty("id", "/subscriptions/" + subscriptionId
      + "/resourceGroups/" + request.blobResourceGroup()
      + "/providers/Microsoft.Storage/storageAccounts/" + request.storageAccount());
    source.addProperty("uri", request.blobUri());
    var osDiskImage = new JsonObject();
    osDiskImage.add("source", source);
    osDiskImage.addProperty("hostCaching", "ReadWrite");
    var storageProfile = new JsonObject();
    storageProfile.add("osDiskImage", osDiskImage);

    var properties = new JsonObject();
    properties.add("publishingProfile", publishingProfile);
    properties.add("storageProfile", storageProfile);

    var body = new JsonObject();
    body.addProperty("location", request.region());
    body.add("properties", properties);
    return body;
  }

  private CompletionStage<JsonObject> get(String operation, String uri, AccessToken token) {
    var request = transport.request(HttpMethod.GET, uri)
                           .setHeader(HttpHeaderName.AUTHORIZATION, token.authorizationHeader())
                           .setHeader(HttpHeaderName.ACCEPT, "application/json");
    return transport.send(operation, request).thenApply(response -> Json.parseObject(response.body()));
  }

  private CompletionStage<JsonObject> put(String operation, String uri, JsonObject body, AccessToken token) {
    var request = transport.request(HttpMethod.PUT, uri)
                           .setHeader(HttpHeaderName.AUTHORIZATION, token.authorizationHeader())
                           .setHeader(HttpHeaderName.CONTENT_TYPE, "application/json")
                           .setBody(Json.toJson(body));
    return transport.send(operation, request).thenApply(response -> Json.parseObject(response.body()));
  }

  /**
   * @return a stage completing with {@code false} when the resource was already absent
   */
  private CompletionStage<Boolean> delete(String operation, String uri) {
    return executor.executeAuthenticated(
                     token -> transport.send(operation, transport.request(HttpMethod.DELETE, uri)
                                                                 .setHeader(HttpHeaderName.AUTHORIZATION, token.authorizationHeader())),
                     RequestContext.of(operation, TokenScope.MANAGEMENT))
                   .handle((response, error) -> {
                     if (error == null) return true;
                     if (isNotFound(error)) return false;
                     throw propagate(error);
                   });
  }

  private StatusProbe<JsonObject> provisioningProbe(String uri) {
    return new StatusProbe<>() {
      @Override
      public CompletionStage<ProbeResult<JsonObject>> probe(String handle, AccessToken token) {
        return get("probe " + handle, uri, token).thenApply(resource -> {
          var properties = Json.object(resource, "properties");
          var status = OperationStatus.fromProvisioningState(Json.string(properties, "provisioningState"));
          var detail = status == OperationStatus.FAILED ? Json.toJson(resource) : null;
          return new ProbeResult<>(status, resource, detail);
        });
      }

      @Override
      public TokenScope scope() {
        return TokenScope.MANAGEMENT;
      }
    };
  }

  private StatusProbe<JsonObject> deletionProbe(String uri) {
    return new StatusProbe<>() {
      @Override
      public CompletionStage<ProbeResult<JsonObject>> probe(String handle, AccessToken token) {
        return get("probe " + handle, uri, token).handle((resource, error) -> {
          if (error == null) return ProbeResult.<JsonObject>inProgress();
          if (isNotFound(error)) return ProbeResult.<JsonObject>succeeded(null);
          throw propagate(error);
        });
      }

      @Override
      public TokenScope scope() {
        return TokenScope.MANAGEMENT;
      }
    };
  }

  private static CompletionStage<Boolean> exists(CompletionStage<JsonObject> lookup) {
    return lookup.handle((resource, error) -> {
      if (error == null) return true;
      if (isNotFound(error)) return false;
      throw propagate(error);
    });
  }

  private static RuntimeException propagate(Throwable error) {
    return error instanceof CompletionException completion ? completion : new CompletionException(error);
  }
}
