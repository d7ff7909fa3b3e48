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
package fr.aneo.imagepublisher.client.storage;

import com.azure.storage.blob.BlobAsyncClient;
import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.SasToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.exception.MissingArgumentException;
import fr.aneo.imagepublisher.client.http.AzureCalls;
import fr.aneo.imagepublisher.client.http.AzureEndpoints;
import fr.aneo.imagepublisher.client.http.AzureHttpTransport;
import fr.aneo.imagepublisher.client.retry.RequestContext;
import fr.aneo.imagepublisher.client.retry.RequestExecutor;
import fr.aneo.imagepublisher.client.upload.BlobUploadTarget;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Blob operations on one storage container through the Azure Storage SDK.
 * <p>
 * Requests are authorized either with a bearer token of the {@link TokenScope#STORAGE} scope, or,
 * when the container client is created with a {@link SasToken}, with the shared access signature.
 * Every SDK call is a single attempt run by the {@link RequestExecutor}.
 * </p>
 */
public class BlobContainerClient {

  private final RequestExecutor executor;
  private final ContainerClientFactory clients;
  private final String containerUrl;
  private final String storageAccount;
  private final String container;
  private final SasToken sasToken;

  /**
   * Creates a client on the transport's HTTP client.
   *
   * @param sasToken shared access signature authorizing the requests; {@code null} to authorize
   *                 with bearer tokens
   */
  public BlobContainerClient(AzureHttpTransport transport,
                             RequestExecutor executor,
                             AzureEndpoints endpoints,
                             String storageAccount,
                             String container,
                             SasToken sasToken) {
    this(executor, endpoints, storageAccount, container, sasToken,
      ContainerClientFactory.create(requireNonNull(transport, "transport must not be null").httpClient(),
        containerUrl(endpoints, storageAccount, container), sasToken));
  }

  public BlobContainerClient(RequestExecutor executor,
                             AzureEndpoints endpoints,
                             String storageAccount,
                             String container,
                             SasToken sasToken,
                             ContainerClientFactory clients) {
    this.executor = requireNonNull(executor, "executor must not be null");
    this.storageAccount = requireNonNull(storageAccount, "storageAccount must not be null");
    this.container = requireNonNull(container, "container must not be null");
    this.containerUrl = containerUrl(endpoints, storageAccount, container);
    this.sasToken = sasToken;
    this.clients = requireNonNull(clients, "clients must not be null");
  }

  private static String containerUrl(AzureEndpoints endpoints, String storageAccount, String container) {
    requireNonNull(endpoints, "endpoints must not be null");
    requireNonNull(storageAccount, "storageAccount must not be null");
    requireNonNull(container, "container must not be null");
    return endpoints.blobEndpoint(storageAccount) + "/" + container;
  }

  public String storageAccount() {
    return storageAccount;
  }

  public String container() {
    return container;
  }

  /**
   * @return the URL of a blob, without any signature
   */
  public String blobUrl(String blobName) {
    return containerUrl + "/" + URLEncoder.encode(blobName, StandardCharsets.UTF_8).replace("+", "%20").replace("%2F", "/");
  }

  /**
   * @return the URL of a blob with the client's shared access signature appended
   * @throws MissingArgumentException if the client authorizes with bearer tokens
   */
  public String sasUrl(String blobName) {
    if (sasToken == null) {
      throw new MissingArgumentException("sasToken", "blob SAS URL");
    }
    return blobUrl(blobName) + "?" + sasToken.token();
  }

  /**
   * @return the scope of the bearer token, {@code null} when requests are signed with a SAS
   */
  public TokenScope tokenScope() {
    return sasToken == null ? TokenScope.STORAGE : null;
  }

  public CompletionStage<Boolean> exists(String blobName) {
    var operation = "check blob " + blobName;
    return executor.executeAuthenticated(
      token -> AzureCalls.toStage(operation, blob(blobName, token).exists()),
      RequestContext.of(operation, tokenScope()));
  }

  /**
   * Deletes a blob.
   *
   * @return a stage completing with {@code false} when the blob did not exist
   */
  public CompletionStage<Boolean> delete(String blobName) {
    var operation = "delete blob " + blobName;
    return executor.executeAuthenticated(
      token -> AzureCalls.toStage(operation, blob(blobName, token).deleteIfExists()),
      RequestContext.of(operation, tokenScope()));
  }

  /**
   * @return the target a chunked upload of the given blob writes to
   */
  public BlobUploadTarget uploadTarget(String blobName, BlobType type) {
    return switch (type) {
      case PAGE -> new PageBlobUploadTarget(this, blobName);
      case BLOCK -> new BlockBlobUploadTarget(this, blobName);
    };
  }

  /**
   * @param token bearer token, ignored when the client uses a SAS
   */
  BlobAsyncClient blob(String blobName, AccessToken token) {
    return clients.connect(sasToken == null ? token : null).getBlobAsyncClient(blobName);
  }
}
