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
 * Identifies a shared image gallery version.
 */
public record GalleryImageVersionId(String resourceGroup, String galleryName, String imageName, String version) {

  public GalleryImageVersionId {
    requireNonNull(resourceGroup, "resourceGroup must not be null");
    requireNonNull(galleryName, "galleryName must not be null");
    requireNonNull(imageName, "imageName must not be null");
    requireNonNull(version, "version must not be null");
  }

  String path() {
    return "galleries/" + galleryName + "/images/" + imageName + "/versions/" + version;
  }

  @Override
  public String toString() {
    return galleryName + "/" + imageName + "/" + version;
  }
}
