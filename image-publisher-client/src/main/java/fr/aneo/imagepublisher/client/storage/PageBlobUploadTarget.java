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

import com.azure.storage.blob.models.PageRange;
import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.http.AzureCalls;
import fr.aneo.imagepublisher.client.upload.BlobUploadTarget;
import fr.aneo.imagepublisher.client.upload.Chunk;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Uploads a page blob: the blob is created at its final size, then each chunk is written as a
 * range of pages. Pages are written in place, so no commit is needed.
 * <p>
 * Page blobs are made of 512-byte pages: every chunk but the last must be a multiple of
 * {@link #PAGE_SIZE}, the last one is zero-padded and the blob size is rounded up to a whole page.
 * A single write is limited to {@link #MAX_WRITE_SIZE}.
 */
public final class PageBlobUploadTarget implements BlobUploadTarget {

  public static final int PAGE_SIZE = 512;
  public static final long MAX_WRITE_SIZE = 4L * 1024 * 1024;

  private final BlobContainerClient client;
  private final String blobName;

  PageBlobUploadTarget(BlobContainerClient client, String blobName) {
    this.client = requireNonNull(client, "client must not be null");
    this.blobName = requireNonNull(blobName, "blobName must not be null");
  }

  /**
   * Checks that chunks of the given size can be written as pages.
   *
   * @throws IllegalArgumentException if the size is not a positive multiple of {@link #PAGE_SIZE}
   *                                  or exceeds {@link #MAX_WRITE_SIZE}
   */
  public static void validateChunkSize(long chunkSize) {
    if (chunkSize <= 0 || chunkSize % PAGE_SIZE != 0) {
      throw new IllegalArgumentException("Page blob chunk size must be a positive multiple of " + PAGE_SIZE + ", got: " + chunkSize);
    }
    if (chunkSize > MAX_WRITE_SIZE) {
      throw new IllegalArgumentException("Page blob chunk size must be at most " + MAX_WRITE_SIZE + ", got: " + chunkSize);
    }
  }

  static long roundUpToPage(long size) {
    var remainder = size % PAGE_SIZE;
    return remainder == 0 ? size : size + PAGE_SIZE - remainder;
  }

  @Override
  public String blobName() {
    return blobName;
  }

  @Override
  public TokenScope tokenScope() {
    return client.tokenScope();
  }

  @Override
  public CompletionStage<Void> prepare(long totalSize, AccessToken token) {
    var pageBlob = client.blob(blobName, token).getPageBlobAsyncClient();
    return AzureCalls.toStage("create page blob " + blobName, pageBlob.create(roundUpToPage(totalSize), true).then());
  }

  @Override
  public CompletionStage<Void> uploadChunk(Chunk chunk, byte[] data, AccessToken token) {
    if (data.length == 0) return CompletableFuture.completedFuture(null);

    var pages = Arrays.copyOf(data, (int) roundUpToPage(data.length));
    var range = new PageRange().setStart(chunk.offset()).setEnd(chunk.offset() + pages.length - 1);
    var pageBlob = client.blob(blobName, token).getPageBlobAsyncClient();
    return AzureCalls.toStage("write pages " + range.getStart() + "-" + range.getEnd() + " of " + blobName,
      pageBlob.uploadPages(range, Flux.just(ByteBuffer.wrap(pages))).then());
  }

  @Override
  public CompletionStage<Void> commit(List<Chunk> chunks, AccessToken token) {
    return CompletableFuture.completedFuture(null);
  }
}
