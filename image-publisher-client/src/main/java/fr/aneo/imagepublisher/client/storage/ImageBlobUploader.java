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

import fr.aneo.imagepublisher.client.exception.ImagePublisherException;
import fr.aneo.imagepublisher.client.exception.ResourceConflictException;
import fr.aneo.imagepublisher.client.upload.ConcurrentUploader;
import fr.aneo.imagepublisher.client.upload.ChunkSource;
import fr.aneo.imagepublisher.client.upload.FileChunkReader;
import fr.aneo.imagepublisher.client.upload.UploadResult;
import fr.aneo.imagepublisher.client.upload.UploadSession;
import fr.aneo.imagepublisher.client.upload.XzChunkReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Uploads an image file to a storage container as a blob.
 * <p>
 * The blob name defaults to the file name. An existing blob of the same name makes the upload
 * fail with {@link ResourceConflictException}, unless replacement is requested, in which case the
 * blob is deleted before the upload starts.
 * </p>
 * An xz compressed image is uploaded decompressed when {@link ImageUploadRequest#expandImage()} is
 * set; the blob then has the uncompressed size.
 */
public class ImageBlobUploader {
  private static final Logger logger = LoggerFactory.getLogger(ImageBlobUploader.class);

  private final BlobContainerClient container;
  private final ConcurrentUploader uploader;

  public ImageBlobUploader(BlobContainerClient container, ConcurrentUploader uploader) {
    this.container = requireNonNull(container, "container must not be null");
    this.uploader = requireNonNull(uploader, "uploader must not be null");
  }

  /**
   * Uploads an image.
   *
   * @param request what to upload and how
   * @return a stage completing with the result of the committed upload
   */
  public CompletionStage<UploadResult> upload(ImageUploadRequest request) {
    requireNonNull(request, "request must not be null");

    var file = request.file();
    if (!Files.isRegularFile(file)) {
      return CompletableFuture.failedFuture(new ImagePublisherException(
        "Image file " + file + " not found. Ensure the path to the file is correct."));
    }
    if (request.blobType() == BlobType.PAGE) {
      try {
        PageBlobUploadTarget.validateChunkSize(request.chunkSize());
      } catch (IllegalArgumentException e) {
        return CompletableFuture.failedFuture(e);
      }
    }

    var blobName = request.blobName() != null ? request.blobName() : file.getFileName().toString();
    return container.exists(blobName)
                    .thenCompose(exists -> {
                      if (!exists) return CompletableFuture.completedFuture(false);
                      if (!request.forceReplace()) {
                        throw new ResourceConflictException("Image " + blobName
                          + " already exists. To replace an existing image use the force replace option.");
                      }
                      logger.atInfo()
                            .addKeyValue("blob", blobName)
                            .log("Deleting existing blob before upload");
                      return container.delete(blobName);
                    })
                    .thenCompose(ignored -> uploadFile(request, file, blobName));
  }

  private CompletionStage<UploadResult> uploadFile(ImageUploadRequest request, Path file, String blobName) {
    ChunkSource source;
    try {
      source = open(file, request.expandImage());
    } catch (IOException e) {
      return CompletableFuture.failedFuture(new ImagePublisherException("Unable to open image file " + file, e));
    }

    UploadSession session;
    try {
      session = UploadSession.plan(blobName, source.size(), request.chunkSize(), request.maxWorkers(), request.maxAttempts());
    } catch (IOException e) {
      close(source, file);
      return CompletableFuture.failedFuture(new ImagePublisherException("Unable to read image file " + file, e));
    }
    if (request.blobType() == BlobType.BLOCK && session.chunks().size() > BlockBlobUploadTarget.MAX_BLOCKS) {
      close(source, file);
      return CompletableFuture.failedFuture(new IllegalArgumentException("Image " + file + " needs " + session.chunks().size()
        + " blocks, a block blob holds at most " + BlockBlobUploadTarget.MAX_BLOCKS + ". Increase the chunk size."));
    }

    return uploader.upload(session, container.uploadTarget(blobName, request.blobType()), source)
                   .whenComplete((result, error) -> close(source, file));
  }

  private static ChunkSource open(Path file, boolean expandImage) throws IOException {
    if (expandImage && XzChunkReader.isXz(file)) {
      var reader = new XzChunkReader(file);
      logger.atInfo()
            .addKeyValue("file", file)
            .addKeyValue("size", reader.size())
            .log("Expanding xz compressed image");
      return reader;
    }
    return new FileChunkReader(file);
  }

  private static void close(ChunkSource source, Path file) {
    try {
      source.close();
    } catch (IOException e) {
      logger.atWarn()
            .addKeyValue("file", file)
            .setCause(e)
            .log("Failed to close image file");
    }
  }
}
