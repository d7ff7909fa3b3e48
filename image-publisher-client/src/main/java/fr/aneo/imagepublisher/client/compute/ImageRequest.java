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
 * Creation of a managed compute image from a VHD blob.
 *
 * @param resourceGroup   resource group of the image
 * @param imageName       name of the image
 * @param blobUri         URL of the source page blob
 * @param region          Azure region of the image
 * @param generation      Hyper-V generation, {@link HyperVGeneration#V1} when {@code null}
 * @param forceReplace    delete an existing image of the same name first instead of failing
 */
public record ImageRequest(
  String resourceGroup,
  String imageName,
  String blobUri,
  String region,
  HyperVGeneration generation,
  boolean forceReplace
) {

  public ImageRequest {
    requireNonNull(resourceGroup, "resourceGroup must not be null");
    requireNonNull(imageName, "imageName must not be null");
    requireNonNull(blobUri, "blobUri must not be null");
    requireNonNull(region, "region must not be null");
    generation = generation == null ? HyperVGeneration.V1 : generation;
  }
}
