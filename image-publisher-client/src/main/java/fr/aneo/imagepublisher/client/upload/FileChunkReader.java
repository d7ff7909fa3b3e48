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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads chunks from a file with positional reads, so that workers can read distinct ranges
 * concurrently through one channel.
 */
public final class FileChunkReader implements ChunkSource {

  private final Path path;
  private final FileChannel channel;

  public FileChunkReader(Path path) throws IOException {
    this.path = path;
    this.channel = FileChannel.open(path, StandardOpenOption.READ);
  }

  @Override
  public long size() throws IOException {
    return channel.size();
  }

  @Override
  public byte[] read(ByteRange range) throws IOException {
    if (range.length() > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Chunk of " + range.length() + " bytes does not fit in memory");
    }
    var buffer = ByteBuffer.allocate((int) range.length());
    long position = range.offset();
    while (buffer.hasRemaining()) {
      var read = channel.read(buffer, position);
      if (read < 0) {
        throw new EOFException("Unexpected end of " + path + " at offset " + position);
      }
      position += read;
    }
    return buffer.array();
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }
}
