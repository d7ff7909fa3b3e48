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

import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * Base URLs of the Azure services the publisher talks to.
 *
 * @param management         resource manager endpoint
 * @param cloudPartner       cloud partner (marketplace) endpoint
 * @param blobEndpointFormat format of a storage account's blob endpoint, with one {@code %s}
 *                           placeholder for the account name
 */
public record AzureEndpoints(URI management, URI cloudPartner, String blobEndpointFormat) {

  public static final AzureEndpoints PUBLIC_CLOUD = new AzureEndpoints(
    URI.create("https://management.azure.com"),
    URI.create("https://cloudpartner.azure.com"),
    "https://%s.blob.core.windows.net");

  public AzureEndpoints {
    requireNonNull(management, "management must not be null");
    requireNonNull(cloudPartner, "cloudPartner must not be null");
    requireNonNull(blobEndpointFormat, "blobEndpointFormat must not be null");
    if (!blobEndpointFormat.contains("%s")) {
      throw new IllegalArgumentException("blobEndpointFormat must contain a %s placeholder, got: " + blobEndpointFormat);
    }
    management = stripTrailingSlash(management);
    cloudPartner = stripTrailingSlash(cloudPartner);
  }

  public String blobEndpoint(String storageAccount) {
    return String.format(blobEndpointFormat, storageAccount);
  }

  private static URI stripTrailingSlash(URI uri) {
    var value = uri.toString();
    return value.endsWith("/") ? URI.create(value.substring(0, value.length() - 1)) : uri;
  }
}
