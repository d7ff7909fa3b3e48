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
package fr.aneo.imagepublisher.client;

import fr.aneo.imagepublisher.client.exception.MissingArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImagePublisherConfigTest {

  @Test
  @DisplayName("should return the configured value")
  void should_return_the_configured_value() {
    // Given
    var config = ImagePublisherConfig.builder().withResourceGroup("images-rg").build();

    // When
    var resourceGroup = config.requireResourceGroup("create image");

    // Then
    assertThat(resourceGroup).isEqualTo("images-rg");
  }

  @Test
  @DisplayName("should name the missing field and the operation")
  void should_name_the_missing_field_and_the_operation() {
    // Given
    var config = ImagePublisherConfig.builder().build();

    // When/Then
    assertThatThrownBy(() -> config.requireStorageAccount("upload blob"))
      .isInstanceOfSatisfying(MissingArgumentException.class, error -> assertThat(error.field()).isEqualTo("storageAccount"))
      .hasMessage("storageAccount is required for upload blob");
  }

  @Test
  @DisplayName("should treat blank values as missing")
  void should_treat_blank_values_as_missing() {
    // Given
    var config = ImagePublisherConfig.builder().withPublisherId("  ").build();

    // When/Then
    assertThatThrownBy(() -> config.requirePublisherId("publish offer"))
      .isInstanceOfSatisfying(MissingArgumentException.class, error -> assertThat(error.field()).isEqualTo("publisherId"));
  }
}
