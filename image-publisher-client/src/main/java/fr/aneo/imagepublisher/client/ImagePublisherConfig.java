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

import fr.aneo.imagepublisher.client.auth.CredentialSource;
import fr.aneo.imagepublisher.client.exception.MissingArgumentException;

/**
 * Resources the publisher works on.
 * <p>
 * Every field is optional when the client is built; each operation checks the fields it needs
 * and fails with {@link MissingArgumentException} naming the first one that is missing. A
 * client that only uploads blobs does not need a publisher id, one that only publishes offers
 * does not need a storage account.
 *
 * @param credentialSource   identity of the publisher
 * @param resourceGroup      resource group of images and of the storage account
 * @param storageAccount     storage account holding image blobs
 * @param container          blob container holding image blobs
 * @param region             Azure region of created images
 * @param publisherId        marketplace publisher id
 * @param notificationEmails comma separated addresses notified when an offer is published
 */
public record ImagePublisherConfig(
  CredentialSource credentialSource,
  String resourceGroup,
  String storageAccount,
  String container,
  String region,
  String publisherId,
  String notificationEmails
) {

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a field value, failing when it is absent.
   *
   * @param value     the value of the field
   * @param field     the field name
   * @param operation the operation needing the field
   * @return {@code value}
   * @throws MissingArgumentException if {@code value} is {@code null} or blank
   */
  static <T> T require(T value, String field, String operation) {
    if (value == null || value instanceof String text && text.isBlank()) {
      throw new MissingArgumentException(field, operation);
    }
    return value;
  }

  String requireResourceGroup(String operation) {
    return require(resourceGroup, "resourceGroup", operation);
  }

  String requireStorageAccount(String operation) {
    return require(storageAccount, "storageAccount", operation);
  }

  String requireContainer(String operation) {
    return require(container, "container", operation);
  }

  String requireRegion(String operation) {
    return require(region, "region", operation);
  }

  String requirePublisherId(String operation) {
    return require(publisherId, "publisherId", operation);
  }

  String requireNotificationEmails(String operation) {
    return require(notificationEmails, "notificationEmails", operation);
  }

  /**
   * Fluent builder of {@link ImagePublisherConfig}.
   */
  public static final class Builder {
    private CredentialSource credentialSource;
    private String resourceGroup;
    private String storageAccount;
    private String container;
    private String region;
    private String publisherId;
    private String notificationEmails;

    private Builder() {
    }

    public Builder withCredentialSource(CredentialSource credentialSource) {
      this.credentialSource = credentialSource;
      return this;
    }

    public Builder withResourceGroup(String resourceGroup) {
      this.resourceGroup = resourceGroup;
      return this;
    }

    public Builder withStorageAccount(String storageAccount) {
      this.storageAccount = storageAccount;
      return this;
    }

    public Builder withContainer(String container) {
      this.container = container;
      return this;
    }

    public Builder withRegion(String region) {
      this.region = region;
      return this;
    }

    public Builder withPublisherId(String publisherId) {
      this.publisherId = publisherId;
      return this;
    }

    public Builder withNotificationEmails(String notificationEmails) {
      this.notificationEmails = notificationEmails;
      return this;
    }

    public ImagePublisherConfig build() {
      return new ImagePublisherConfig(credentialSource, resourceGroup, storageAccount, container, region, publisherId, notificationEmails);
    }
  }
}
