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
package fr.aneo.imagepublisher.client.exception;

import fr.aneo.imagepublisher.client.upload.Chunk;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Thrown when one or more chunks of an upload failed permanently.
 * <p>
 * The remote blob is left as-is: chunks already uploaded stay on the remote side and the blob
 * is never committed. Callers may retry the whole upload or delete the blob and restart.
 * </p>
 */
public class UploadException extends ImagePublisherException {

  private final String blobName;
  private final boolean partial;
  private final List<Chunk> failedChunks;

  public UploadException(String blobName, boolean partial, List<Chunk> failedChunks) {
    super(describe(blobName, failedChunks), failedChunks.isEmpty() ? null : failedChunks.get(0).lastError());
    this.blobName = blobName;
    this.partial = partial;
    this.failedChunks = List.copyOf(failedChunks);
    failedChunks.stream().skip(1).map(Chunk::lastError).filter(e -> e != null).forEach(this::addSuppressed);
  }

  public String blobName() {
    return blobName;
  }

  /**
   * @return {@code true} when the remote blob may hold a partially uploaded, uncommitted state
   */
  public boolean partial() {
    return partial;
  }

  public List<Chunk> failedChunks() {
    return failedChunks;
  }

  private static String describe(String blobName, List<Chunk> failedChunks) {
    var indexes = failedChunks.stream().map(chunk -> String.valueOf(chunk.index())).collect(joining(", "));
    var first = failedChunks.isEmpty() || failedChunks.get(0).lastError() == null
      ? ""
      : ": " + failedChunks.get(0).lastError().getMessage();
    return "Upload of blob " + blobName + " failed for chunk(s) [" + indexes + "]" + first;
  }
}
