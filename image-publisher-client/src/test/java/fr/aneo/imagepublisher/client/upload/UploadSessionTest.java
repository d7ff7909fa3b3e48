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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadSessionTest {

  @Test
  @DisplayName("concurrency defaults to the chunk count capped at 32")
  void concurrency_defaults_to_chunk_count_capped() {
    assertThat(UploadSession.plan("small.vhd", 10, 4, null, 5).concurrencyLimit()).isEqualTo(3);
    assertThat(UploadSession.plan("large.vhd", 100 * 512, 512, null, 5).concurrencyLimit()).isEqualTo(UploadSession.MAX_CONCURRENCY);
    assertThat(UploadSession.plan("empty.vhd", 0, 512, null, 5).concurrencyLimit()).isEqualTo(1);
  }

  @Test
  @DisplayName("an explicit concurrency limit is kept")
  void explicit_concurrency_limit_is_kept() {
    assertThat(UploadSession.plan("image.vhd", 10, 1, 4, 5).concurrencyLimit()).isEqualTo(4);
  }

  @Test
  @DisplayName("status is derived from the chunks")
  void status_is_derived_from_the_chunks() {
    // Given
    var session = UploadSession.plan("image.vhd", 8, 4, 2, 3);
    var first = session.chunks().get(0);
    var second = session.chunks().get(1);

    // When/Then
    assertThat(session.status()).isEqualTo(UploadStatus.IN_PROGRESS);
    first.markInFlight();
    first.markCommitted(1);
    assertThat(session.status()).isEqualTo(UploadStatus.IN_PROGRESS);
    second.markInFlight();
    second.markFailed(3, new RuntimeException("boom"));
    assertThat(session.status()).isEqualTo(UploadStatus.FAILED);
    assertThat(session.failedChunks()).containsExactly(second);
    assertThat(session.committedChunks()).containsExactly(first);
  }

  @Test
  @DisplayName("invalid limits are rejected")
  void invalid_limits_are_rejected() {
    assertThatThrownBy(() -> UploadSession.plan("image.vhd", 10, 1, 0, 5)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> UploadSession.plan("image.vhd", 10, 1, 2, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
