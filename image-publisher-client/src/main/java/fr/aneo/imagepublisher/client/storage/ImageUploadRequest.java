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

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Upload of an image file.
 *
 * @param file         the image file
 * @param blobName     destination blob, the file name when {@code null}
 * @param blobType     kind of blob, {@link BlobType#PAGE} when {@code null}
 * @param forceReplace replace an existing blob instead of failing
 * @param chunkSize    size of an upload chunk
 * @param maxWorkers   maximum number of chunks in flight, {@code null} for the default cap
 * @param maxAttempts  retry budget of each chunk
 * @param expandImage  upload the decompressed content of an xz compressed image
 */
public record ImageUploadRequest(
  Path file,
  String blobName,
  BlobType blobType,
  boolean forceReplace,
  long chunkSize,
  Integer maxWorkers,
  int maxAttempts,
  boolean expandImage
) {

  public ImageUploadRequest {
    requireNonNull(file, "file must not be null");
    blobType = blobType == null ? BlobType.PAGE : blobType;
    if (blobName != null && blobName.isBlank()) {
      throw new IllegalArgumentException("blobName must not be blank");
    }
  }

  /**
   * Creates a request that expands xz compressed images.
   */
  public ImageUploadRequest(Path file, String blobName, BlobType blobType, boolean forceReplace, long chunkSize, Integer maxWorkers, int maxAttempts) {
    this(file, blobName, blobType, forceReplace, chunkSize, maxWorkers, maxAttempts, true);
  }
}
