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
package fr.aneo.imagepublisher.client.auth;

import static java.util.Objects.requireNonNull;

/**
 * Service principal credentials, in the layout of the Azure SDK authentication file.
 *
 * @param clientId                   application (client) id
 * @param clientSecret               client secret
 * @param tenantId                   directory (tenant) id
 * @param subscriptionId             subscription the resources live in
 * @param activeDirectoryEndpointUrl authority base URL, defaults to the public cloud
 * @param managementEndpointUrl      resource manager URL, defaults to the public cloud
 */
public record InlineCredentials(
  String clientId,
  String clientSecret,
  String tenantId,
  String subscriptionId,
  String activeDirectoryEndpointUrl,
  String managementEndpointUrl
) implements CredentialSource {

  public static final String DEFAULT_ACTIVE_DIRECTORY_ENDPOINT = "https://login.microsoftonline.com";
  public static final String DEFAULT_MANAGEMENT_ENDPOINT = "https://management.azure.com/";

  public InlineCredentials {
    requireNonNull(clientId, "clientId must not be null");
    requireNonNull(clientSecret, "clientSecret must not be null");
    requireNonNull(tenantId, "tenantId must not be null");
    requireNonNull(subscriptionId, "subscriptionId must not be null");
    activeDirectoryEndpointUrl = activeDirectoryEndpointUrl == null ? DEFAULT_ACTIVE_DIRECTORY_ENDPOINT : activeDirectoryEndpointUrl;
    managementEndpointUrl = managementEndpointUrl == null ? DEFAULT_MANAGEMENT_ENDPOINT : managementEndpointUrl;
  }

  public InlineCredentials(String clientId, String clientSecret, String tenantId, String subscriptionId) {
    this(clientId, clientSecret, tenantId, subscriptionId, null, null);
  }

  @Override
  public String toString() {
    return "InlineCredentials{clientId='" + clientId + "', tenantId='" + tenantId + "', subscriptionId='" + subscriptionId + "'}";
  }
}
