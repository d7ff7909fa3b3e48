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

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * One source file being uploaded to one destination blob.
 * <p>
 * The session exclusively owns its chunks. Its only state shared between concurrently running
 * chunk uploads is the in-flight counter, which bounds how many chunks are uploaded at once.
 * </p>
 */
public final class UploadSession {

  /**
   * Upper bound on concurrent chunk uploads when no limit is configured.
   */
  public static final int MAX_CONCURRENCY = 32;

  private final String blobName;
  private final long size;
  private final List<Chunk> chunks;
  private final int concurrencyLimit;
  private final int maxAttemptsPerChunk;
  private final AtomicInteger inFlight = new AtomicInteger();

  /**
   * Creates a session.
   *
   * @param blobName            destination blob
   * @param size                total number of bytes
   * @param chunks              the planned chunks, ordered by index
   * @param concurrencyLimit    maximum number of chunks in flight; {@code null} means
   *                            {@code min(chunks, MAX_CONCURRENCY)}
   * @param maxAttemptsPerChunk retry budget of each chunk
   */
  public UploadSession(String blobName, long size, List<Chunk> chunks, Integer concurrencyLimit, int maxAttemptsPerChunk) {
    this.blobName = requireNonNull(blobName, "blobName must not be null");
    this.chunks = List.copyOf(requireNonNull(chunks, "chunks must not be null"));
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0, got: " + size);
    }
    if (concurrencyLimit != null && concurrencyLimit < 1) {
      throw new IllegalArgumentException("concurrencyLimit must be >= 1, got: " + concurrencyLimit);
    }
    if (maxAttemptsPerChunk < 1) {
      throw new IllegalArgumentException("maxAttemptsPerChunk must be >= 1, got: " + maxAttemptsPerChunk);
    }
    this.size = size;
    this.concurrencyLimit = concurrencyLimit != null
      ? concurrencyLimit
      : Math.max(1, Math.min(this.chunks.size(), MAX_CONCURRENCY));
    this.maxAttemptsPerChunk = maxAttemptsPerChunk;
  }

  /**
   * Plans a session for a file of the given size.
   *
   * @see ChunkPlanner#plan(long, long)
   */
  public static UploadSession plan(String blobName, long size, long chunkSize, Integer concurrencyLimit, int maxAttemptsPerChunk) {
    return new UploadSession(blobName, size, ChunkPlanner.plan(size, chunkSize), concurrencyLimit, maxAttemptsPerChunk);
  }

  public String blobName() {
    return blobName;
  }

  public long size() {
    return size;
  }

  public List<Chunk> chunks() {
    return chunks;
  }

  public int concurrencyLimit() {
    return concurrencyLimit;
  }

  public int maxAttemptsPerChunk() {
    return maxAttemptsPerChunk;
  }

  /**
   * @return the counter of chunks currently in flight
   */
  AtomicInteger inFlight() {
    return inFlight;
  }

  public int inFlightCount() {
    return inFlight.get();
  }

  public List<Chunk> failedChunks() {
    return chunks.stream().filter(chunk -> chunk.status() == ChunkStatus.FAILED).toList();
  }

  public List<Chunk> committedChunks() {
    return chunks.stream().filter(chunk -> chunk.status() == ChunkStatus.COMMITTED).toList();
  }

  /**
   * @return {@link UploadStatus#FAILED} if any chunk failed, {@link UploadStatus#SUCCEEDED} if all
   * chunks are committed, {@link UploadStatus#IN_PROGRESS} otherwise
   */
  public UploadStatus status() {
    if (chunks.stream().anyMatch(chunk -> chunk.status() == ChunkStatus.FAILED)) return UploadStatus.FAILED;
    if (chunks.stream().allMatch(chunk -> chunk.status() == ChunkStatus.COMMITTED)) return UploadStatus.SUCCEEDED;
    return UploadStatus.IN_PROGRESS;
  }

  @Override
  public String toString() {
    return "UploadSession{blobName='" + blobName + "', size=" + size + ", chunks=" + chunks.size()
      + ", concurrencyLimit=" + concurrencyLimit + ", status=" + status() + "}";
  }
}
