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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a file into fixed-size chunks.
 * <p>
 * Chunk {@code i} covers {@code [i × chunkSize, min((i + 1) × chunkSize, fileSize))}; only the last
 * chunk may be shorter. The plan is deterministic: the same inputs always give the same chunks.
 */
public final class ChunkPlanner {

  private ChunkPlanner() {
  }

  /**
   * Plans the chunks of a file.
   *
   * @param fileSize  size of the file in bytes
   * @param chunkSize size of every chunk but the last
   * @return {@code ceil(fileSize / chunkSize)} pending chunks ordered by index; empty for an empty file
   * @throws IllegalArgumentException if {@code fileSize} is negative, {@code chunkSize} is not
   *                                  positive, or the file needs more than {@link Integer#MAX_VALUE} chunks
   */
  public static List<Chunk> plan(long fileSize, long chunkSize) {
    if (fileSize < 0) {
      throw new IllegalArgumentException("fileSize must be >= 0, got: " + fileSize);
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0, got: " + chunkSize);
    }

    var count = chunkCount(fileSize, chunkSize);
    if (count > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Too many chunks (" + count + "), increase chunkSize");
    }

    var chunks = new ArrayList<Chunk>((int) count);
    for (int index = 0; index < count; index++) {
      var offset = index * chunkSize;
      chunks.add(new Chunk(index, new ByteRange(offset, Math.min(chunkSize, fileSize - offset))));
    }
    return List.copyOf(chunks);
  }

  /**
   * @return {@code ceil(fileSize / chunkSize)}
   */
  public static long chunkCount(long fileSize, long chunkSize) {
    return fileSize / chunkSize + (fileSize % chunkSize == 0 ? 0 : 1);
  }
}
