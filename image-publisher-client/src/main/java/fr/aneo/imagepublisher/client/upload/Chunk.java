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

import static java.util.Objects.requireNonNull;

/**
 * An independently uploaded byte range of a file.
 * <p>
 * A chunk belongs to exactly one {@link UploadSession} and is only mutated by the upload task
 * responsible for it; fields are volatile so that other threads read a consistent status.
 * </p>
 */
public final class Chunk {

  private final int index;
  private final ByteRange range;
  private volatile ChunkStatus status = ChunkStatus.PENDING;
  private volatile int attemptCount;
  private volatile Throwable lastError;

  public Chunk(int index, ByteRange range) {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0, got: " + index);
    }
    this.index = index;
    this.range = requireNonNull(range, "range must not be null");
  }

  public int index() {
    return index;
  }

  public ByteRange range() {
    return range;
  }

  public long offset() {
    return range.offset();
  }

  public long length() {
    return range.length();
  }

  public ChunkStatus status() {
    return status;
  }

  public int attemptCount() {
    return attemptCount;
  }

  /**
   * @return the error that failed the chunk, {@code null} unless {@link ChunkStatus#FAILED}
   */
  public Throwable lastError() {
    return lastError;
  }

  void markInFlight() {
    transitionTo(ChunkStatus.IN_FLIGHT);
  }

  void markCommitted(int attempts) {
    this.attemptCount = attempts;
    transitionTo(ChunkStatus.COMMITTED);
  }

  void markFailed(int attempts, Throwable error) {
    this.attemptCount = attempts;
    this.lastError = error;
    transitionTo(ChunkStatus.FAILED);
  }

  private void transitionTo(ChunkStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException("Chunk " + index + " cannot go from " + status + " to " + next);
    }
    status = next;
  }

  @Override
  public String toString() {
    return "Chunk{index=" + index + ", offset=" + range.offset() + ", length=" + range.length() + ", status=" + status + "}";
  }
}
