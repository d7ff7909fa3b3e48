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

import org.tukaani.xz.SeekableFileInputStream;
import org.tukaani.xz.SeekableXZInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads chunks of the decompressed content of an xz file.
 * <p>
 * The uncompressed size comes from the xz index, so chunks can be planned before anything is
 * decompressed. Reads are served from a single decompressing stream: ranges read in increasing
 * order are decompressed once, any other range costs a seek to the start of its xz block.
 */
public final class XzChunkReader implements ChunkSource {

  private static final byte[] XZ_MAGIC = {(byte) 0xFD, '7', 'z', 'X', 'Z', 0x00};

  private final Path path;
  private final SeekableXZInputStream stream;

  public XzChunkReader(Path path) throws IOException {
    this.path = path;
    var file = new SeekableFileInputStream(path.toFile());
    try {
      this.stream = new SeekableXZInputStream(file);
    } catch (IOException | RuntimeException e) {
      file.close();
      throw e;
    }
  }

  /**
   * Tells whether a file starts with the xz magic bytes.
   */
  public static boolean isXz(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return Arrays.equals(in.readNBytes(XZ_MAGIC.length), XZ_MAGIC);
    }
  }

  /**
   * @return the uncompressed size
   */
  @Override
  public long size() {
    return stream.length();
  }

  @Override
  public synchronized byte[] read(ByteRange range) throws IOException {
    if (range.length() > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Chunk of " + range.length() + " bytes does not fit in memory");
    }
    if (stream.position() != range.offset()) {
      stream.seek(range.offset());
    }

    var data = new byte[(int) range.length()];
    var filled = 0;
    while (filled < data.length) {
      var read = stream.read(data, filled, data.length - filled);
      if (read < 0) {
        throw new EOFException("Unexpected end of decompressed " + path + " at offset " + (range.offset() + filled));
      }
      filled += read;
    }
    return data;
  }

  @Override
  public boolean sequential() {
    return true;
  }

  @Override
  public void close() throws IOException {
    stream.close();
  }
}
