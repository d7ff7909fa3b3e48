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
package fr.aneo.imagepublisher.client.upload;

import fr.aneo.imagepublisher.client.auth.AccessToken;
import fr.aneo.imagepublisher.client.auth.TokenScope;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Destination of a chunked upload.
 * <p>
 * Each method performs a single remote attempt; the {@link ConcurrentUploader} wraps every call
 * in the request executor. The token passed to each method is {@code null} when
 * {@link #tokenScope()} is {@code null}.
 * </p>
 */
public interface BlobUploadTarget {

  String blobName();

  /**
   * @return the scope of the bearer token to authorize requests with, or {@code null} when the
   * target authorizes its requests otherwise (shared access signature)
   */
  TokenScope tokenScope();

  /**
   * Prepares the destination before any chunk is sent.
   *
   * @param totalSize size of the content to upload
   */
  CompletionStage<Void> prepare(long totalSize, AccessToken token);

  CompletionStage<Void> uploadChunk(Chunk chunk, byte[] data, AccessToken token);

  /**
   * Seals the uploaded chunks into the final blob. Only called once every chunk is committed.
   *
   * @param chunks all chunks of the upload, ordered by index
   */
  CompletionStage<Void> commit(List<Chunk> chunks, AccessToken token);

  /**
   * Uploads content that fits in a single chunk in one shot. Defaults to prepare, upload and
   * commit in sequence.
   */
  default CompletionStage<Void> uploadSingle(Chunk chunk, byte[] data, AccessToken token) {
    return prepare(chunk.length(), token)
      .thenCompose(ignored -> uploadChunk(chunk, data, token))
      .thenCompose(ignored -> commit(List.of(chunk), token));
  }
}
