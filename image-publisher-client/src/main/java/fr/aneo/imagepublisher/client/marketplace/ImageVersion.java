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
package fr.aneo.imagepublisher.client.marketplace;

import static java.util.Objects.requireNonNull;

/**
 * A new image version to add to a plan of an offer.
 *
 * @param blobUrl          signed URL of the image VHD
 * @param description      version description
 * @param imageName        media name; an 8-digit {@code yyyyMMdd} date in it becomes the release date
 * @param label            version label
 * @param sku              plan the version is added to
 * @param generationId     disk generation plan to also add the version to, or {@code null}
 * @param generationSuffix suffix of the media name in the generation plan, the generation id when {@code null}
 */
public record ImageVersion(
  String blobUrl,
  String description,
  String imageName,
  String label,
  String sku,
  String generationId,
  String generationSuffix
) {

  public ImageVersion {
    requireNonNull(blobUrl, "blobUrl must not be null");
    requireNonNull(description, "description must not be null");
    requireNonNull(imageName, "imageName must not be null");
    requireNonNull(label, "label must not be null");
    requireNonNull(sku, "sku must not be null");
  }

  public ImageVersion(String blobUrl, String description, String imageName, String label, String sku) {
    this(blobUrl, description, imageName, label, sku, null, null);
  }
}
