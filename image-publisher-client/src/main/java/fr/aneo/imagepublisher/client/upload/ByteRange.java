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

/**
 * A contiguous range of bytes within a source file.
 *
 * @param offset position of the first byte
 * @param length number of bytes
 */
public record ByteRange(long offset, long length) {

  public ByteRange {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
    }
    if (length < 0) {
      throw new IllegalArgumentException("length must be >= 0, got: " + length);
    }
  }

  /**
   * @return the position just after the last byte (exclusive)
   */
  public long end() {
    return offset + length;
  }
}
