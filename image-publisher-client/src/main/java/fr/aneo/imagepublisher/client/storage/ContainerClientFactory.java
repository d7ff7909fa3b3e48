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

import com.azure.core.credential.TokenCredential;
import com.azure.core.http.HttpClient;
import com.azure.storage.blob.BlobContainerAsyncClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.SasToken;
import reactor.core.publisher.Mono;

import java.time.ZoneOffset;

import static java.util.Objects.requireNonNull;

/**
 * Supplies the Azure Storage SDK client of a container for one attempt.
 * <p>
 * The SDK clients are built with a single try per request: retries are driven by the request
 * executor, which also decides when a rejected token is renewed. A client authorized with a
 * bearer token is therefore bound to the token of the attempt.
 */
@FunctionalInterface
public interface ContainerClientFactory {

  RequestRetryOptions SINGLE_TRY = new RequestRetryOptions(RetryPolicyType.FIXED, 1, (Integer) null, null, null, null);

  /**
   * @param token bearer token of the attempt, {@code null} when requests are signed with a SAS
   * @return the container client
   */
  BlobContainerAsyncClient connect(AccessToken token);

  /**
   * Creates a factory for a container.
   *
   * @param httpClient   HTTP client shared with the other Azure clients
   * @param containerUrl URL of the container
   * @param sasToken     shared access signature, or {@code null} to authorize with bearer tokens
   */
  static ContainerClientFactory create(HttpClient httpClient, String containerUrl, SasToken sasToken) {
    requireNonNull(httpClient, "httpClient must not be null");
    requireNonNull(containerUrl, "containerUrl must not be null");

    if (sasToken != null) {
      var client = builder(httpClient, containerUrl).sasToken(sasToken.token()).buildAsyncClient();
      return token -> client;
    }
    return token -> {
      requireNonNull(token, "a bearer token is required without shared access signature");
      return builder(httpClient, containerUrl).credential(bearer(token)).buildAsyncClient();
    };
  }

  private static BlobContainerClientBuilder builder(HttpClient httpClient, String containerUrl) {
    return new BlobContainerClientBuilder()
      .endpoint(containerUrl)
      .httpClient(httpClient)
      .retryOptions(SINGLE_TRY);
  }

  private static TokenCredential bearer(AccessToken token) {
    var sdkToken = new com.azure.core.credential.AccessToken(token.token(), token.expiresAt().atOffset(ZoneOffset.UTC));
    return request -> Mono.just(sdkToken);
  }
}
