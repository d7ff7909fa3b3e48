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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.XZOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XzChunkReaderTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("xz files are recognized by their magic bytes")
  void xz_files_are_recognized_by_their_magic_bytes() throws IOException {
    // Given
    var compressed = Files.write(tempDir.resolve("os.vhd.xz"), xz(content(100)));
    var raw = Files.write(tempDir.resolve("os.vhd"), content(100));
    var tiny = Files.write(tempDir.resolve("tiny"), new byte[]{(byte) 0xFD});

    // When/Then
    assertThat(XzChunkReader.isXz(compressed)).isTrue();
    assertThat(XzChunkReader.isXz(raw)).isFalse();
    assertThat(XzChunkReader.isXz(tiny)).isFalse();
  }

  @Test
  @DisplayName("reports the uncompressed size and reads decompressed ranges")
  void reports_the_uncompressed_size_and_reads_decompressed_ranges() throws IOException {
    // Given
    var content = content(5000);
    var file = Files.write(tempDir.resolve("os.vhd.xz"), xz(content));

    // When
    try (var reader = new XzChunkReader(file)) {
      var first = reader.read(new ByteRange(0, 2048));
      var second = reader.read(new ByteRange(2048, 2048));
      var last = reader.read(new ByteRange(4096, 904));

      // Then
      assertThat(reader.size()).isEqualTo(5000);
      assertThat(reader.sequential()).isTrue();
      assertThat(first).isEqualTo(Arrays.copyOfRange(content, 0, 2048));
      assertThat(second).isEqualTo(Arrays.copyOfRange(content, 2048, 4096));
      assertThat(last).isEqualTo(Arrays.copyOfRange(content, 4096, 5000));
    }
  }

  @Test
  @DisplayName("an earlier range is read again by seeking back")
  void earlier_range_is_read_again_by_seeking_back() throws IOException {
    // Given
    var content = content(3000);
    var file = Files.write(tempDir.resolve("os.vhd.xz"), xz(content));

    try (var reader = new XzChunkReader(file)) {
      reader.read(new ByteRange(0, 1000));
      reader.read(new ByteRange(2000, 1000));

      // When
      var again = reader.read(new ByteRange(500, 1000));

      // Then
      assertThat(again).isEqualTo(Arrays.copyOfRange(content, 500, 1500));
    }
  }

  @Test
  @DisplayName("a range past the end fails")
  void range_past_the_end_fails() throws IOException {
    // Given
    var file = Files.write(tempDir.resolve("os.vhd.xz"), xz(content(1000)));

    try (var reader = new XzChunkReader(file)) {
      // When/Then
      assertThatThrownBy(() -> reader.read(new ByteRange(512, 1024)))
        .isInstanceOf(EOFException.class)
        .hasMessageContaining("os.vhd.xz");
    }
  }

  private static byte[] content(int size) {
    var bytes = new byte[size];
    new Random(7).nextBytes(bytes);
    return bytes;
  }

  private static byte[] xz(byte[] content) throws IOException {
    var out = new ByteArrayOutputStream();
    try (var xz = new XZOutputStream(out, new LZMA2Options())) {
      xz.write(content);
    }
    return out.toByteArray();
  }
}
