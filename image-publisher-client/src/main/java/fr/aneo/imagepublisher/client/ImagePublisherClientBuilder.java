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

import fr.aneo.imagepublisher.client.auth.CachingCredentialProvider;
import fr.aneo.imagepublisher.client.auth.ClientSecretTokenSource;
import fr.aneo.imagepublisher.client.auth.CredentialProvider;
import fr.aneo.imagepublisher.client.auth.CredentialsFile;
import fr.aneo.imagepublisher.client.auth.InlineCredentials;
import fr.aneo.imagepublisher.client.auth.SasToken;
import fr.aneo.imagepublisher.client.auth.TokenSource;
import fr.aneo.imagepublisher.client.http.AzureEndpoints;
import fr.aneo.imagepublisher.client.http.AzureHttpTransport;

import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * Fluent builder for {@link ImagePublisherClient}.
 * <p>
 * The credential source of the configuration is resolved once, here: a credentials file is read,
 * inline credentials are used as-is, and a shared access signature restricts the client to blob
 * operations.
 *
 * <p>Usage:
 * <pre>{@code
 * ImagePublisherClient client = ImagePublisherClient.newBuilder()
 *     .withConfig(ImagePublisherConfig.builder()
 *         .withCredentialSource(CredentialSource.file(Path.of("~/.config/azure/sp.json")))
 *         .withResourceGroup("images")
 *         .withStorageAccount("imagestore")
 *         .withContainer("vhds")
 *         .withRegion("westeurope")
 *         .build())
 *     .withTransferOptions(TransferOptions.fromEnvironment())
 *     .build();
 * }</pre>
 */
public class ImagePublisherClientBuilder {
  private ImagePublisherConfig config;
  private TransferOptions transferOptions = TransferOptions.DEFAULT;
  private TokenSource tokenSource;
  private CredentialProvider credentialProvider;
  private AzureEndpoints endpoints;
  private AzureHttpTransport transport;

  ImagePublisherClientBuilder() {
  }

  public ImagePublisherClientBuilder withConfig(ImagePublisherConfig config) {
    this.config = config;
    return this;
  }

  /**
   * @param transferOptions upload, retry and wait tuning; {@code null} restores the defaults
   */
  public ImagePublisherClientBuilder withTransferOptions(TransferOptions transferOptions) {
    this.transferOptions = transferOptions == null ? TransferOptions.DEFAULT : transferOptions;
    return this;
  }

  /**
   * Sets the identity provider exchanging service principal credentials for access tokens.
   * Defaults to a {@link ClientSecretTokenSource} on the client's transport.
   */
  public ImagePublisherClientBuilder withTokenSource(TokenSource tokenSource) {
    this.tokenSource = tokenSource;
    return this;
  }

  /**
   * Sets the token supplier directly, bypassing the token source and its cache.
   */
  public ImagePublisherClientBuilder withCredentialProvider(CredentialProvider credentialProvider) {
    this.credentialProvider = credentialProvider;
    return this;
  }

  /**
   * Overrides the service endpoints. Defaults to the public cloud, with the management endpoint
   * of the service principal when it declares one.
   */
  public ImagePublisherClientBuilder withEndpoints(AzureEndpoints endpoints) {
    this.endpoints = endpoints;
    return this;
  }

  public ImagePublisherClientBuilder withTransport(AzureHttpTransport transport) {
    this.transport = transport;
    return this;
  }

  /**
   * Builds the client.
   *
   * @throws NullPointerException if no configuration was given
   * @throws fr.aneo.imagepublisher.client.exception.AuthenticationException if the credentials file cannot be read
   */
  public ImagePublisherClient build() {
    requireNonNull(config, "config must not be null");

    InlineCredentials credentials = null;
    SasToken sasToken = null;
    var source = config.credentialSource();
    if (source instanceof CredentialsFile file) {
      credentials = file.load();
    } else if (source instanceof InlineCredentials inline) {
      credentials = inline;
    } else if (source instanceof SasToken token) {
      sasToken = token;
    }

    var resolvedTransport = transport == null ? new AzureHttpTransport() : transport;
    var provider = credentialProvider;
    if (provider == null && credentials != null) {
      var identity = tokenSource == null ? new ClientSecretTokenSource(resolvedTransport.httpClient()) : tokenSource;
      provider = new CachingCredentialProvider(credentials, identity);
    }

    var resolvedEndpoints = endpoints;
    if (resolvedEndpoints == null) {
      resolvedEndpoints = credentials == null
        ? AzureEndpoints.PUBLIC_CLOUD
        : new AzureEndpoints(URI.create(credentials.managementEndpointUrl()),
                             AzureEndpoints.PUBLIC_CLOUD.cloudPartner(),
                             AzureEndpoints.PUBLIC_CLOUD.blobEndpointFormat());
    }

    return new ImagePublisherClient(
      config,
      transferOptions,
      credentials,
      sasToken,
      provider,
      resolvedEndpoints,
      resolvedTransport);
  }
}
