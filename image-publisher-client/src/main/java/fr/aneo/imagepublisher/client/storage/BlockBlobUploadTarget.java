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

import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;
import fr.aneo.imagepublisher.client.http.AzureCalls;
import fr.aneo.imagepublisher.client.upload.BlobUploadTarget;
import fr.aneo.imagepublisher.client.upload.Chunk;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * Uploads a block blob: every chunk is staged as an uncommitted block and the block list, in
 * chunk order, is committed at the end. Content that fits in one chunk is sent with a single
 * Put Blob request.
 */
public final class BlockBlobUploadTarget implements BlobUploadTarget {

  public static final int MAX_BLOCKS = 50_000;

  private final BlobContainerClient client;
  private final String blobName;

  BlockBlobUploadTarget(BlobContainerClient client, String blobName) {
    this.client = requireNonNull(client, "client must not be null");
    this.blobName = requireNonNull(blobName, "blobName must not be null");
  }

  /**
   * Block ids are base64 encoded and must all have the same length within a blob.
   */
  static String blockId(int index) {
    return Base64.getEncoder().encodeToString(String.format("%08d", index).getBytes(StandardCharsets.UTF_8));
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
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletionStage<Void> uploadChunk(Chunk chunk, byte[] data, AccessToken token) {
    if (chunk.index() >= MAX_BLOCKS) {
      return CompletableFuture.failedFuture(new IllegalArgumentException(
        "A block blob holds at most " + MAX_BLOCKS + " blocks, increase the chunk size"));
    }
    var blockBlob = client.blob(blobName, token).getBlockBlobAsyncClient();
    return AzureCalls.toStage("put block " + chunk.index() + " of " + blobName,
      blockBlob.stageBlock(blockId(chunk.index()), Flux.just(ByteBuffer.wrap(data)), data.length));
  }

  @Override
  public CompletionStage<Void> commit(List<Chunk> chunks, AccessToken token) {
    var blockIds = chunks.stream().map(chunk -> blockId(chunk.index())).toList();
    var blockBlob = client.blob(blobName, token).getBlockBlobAsyncClient();
    return AzureCalls.toStage("commit block list of " + blobName, blockBlob.commitBlockList(blockIds, true).then());
  }

  @Override
  public CompletionStage<Void> uploadSingle(Chunk chunk, byte[] data, AccessToken token) {
    var blockBlob = client.blob(blobName, token).getBlockBlobAsyncClient();
    return AzureCalls.toStage("put blob " + blobName,
      blockBlob.upload(Flux.just(ByteBuffer.wrap(data)), data.length, true).then());
  }
}
