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

import static java.util.Objects.requireNonNull;

/**
 * Creation of a shared image gallery version from a VHD blob, replicated to a single region.
 *
 * @param galleryResourceGroup resource group of the gallery
 * @param galleryName          name of the gallery
 * @param imageName            gallery image definition
 * @param version              version to create, e.g. {@code 1.0.0}
 * @param region               Azure region, also the only target region
 * @param blobResourceGroup    resource group of the source storage account
 * @param storageAccount       source storage account
 * @param blobUri              URL of the source page blob
 */
public record GalleryImageVersionRequest(
  String galleryResourceGroup,
  String galleryName,
  String imageName,
  String version,
  String region,
  String blobResourceGroup,
  String storageAccount,
  String blobUri
) {

  public GalleryImageVersionRequest {
    requireNonNull(galleryResourceGroup, "galleryResourceGroup must not be null");
    requireNonNull(galleryName, "galleryName must not be null");
    requireNonNull(imageName, "imageName must not be null");
    requireNonNull(version, "version must not be null");
    requireNonNull(region, "region must not be null");
    requireNonNull(blobResourceGroup, "blobResourceGroup must not be null");
    requireNonNull(storageAccount, "storageAccount must not be null");
    requireNonNull(blobUri, "blobUri must not be null");
  }

  public GalleryImageVersionId id() {
    return new GalleryImageVersionId(galleryResourceGroup, galleryName, imageName, version);
  }
}
