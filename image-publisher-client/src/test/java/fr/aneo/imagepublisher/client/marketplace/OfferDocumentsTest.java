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
package fr.aneo.imagepublisher.client.marketplace;

import com.google.gson.JsonObject;
import fr.aneo.imagepublisher.client.exception.CloudPartnerException;
import fr.aneo.imagepublisher.client.http.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static fr.aneo.imagepublisher.client.marketplace.OfferDocuments.VM_IMAGES_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OfferDocumentsTest {

  private static final LocalDate TODAY = LocalDate.of(2025, 3, 14);
  private static final String BLOB_URL = "https://imagestore.blob.core.windows.net/vhds/os.vhd?sig=abc";

  @Test
  @DisplayName("should add a version keyed by the date found in the image name")
  void should_add_a_version_keyed_by_the_date_found_in_the_image_name() {
    // Given
    var doc = offer();
    var image = new ImageVersion(BLOB_URL, "Monthly build", "os-20250102-x86", "OS 2025-01", "standard");

    // When
    OfferDocuments.addImageVersion(doc, image, TODAY);

    // Then
    var version = versions(doc, "standard").getAsJsonObject("2025.01.02");
    assertThat(Json.string(version, "osVhdUrl")).isEqualTo(BLOB_URL);
    assertThat(Json.string(version, "mediaName")).isEqualTo("os-20250102-x86");
    assertThat(Json.string(version, "label")).isEqualTo("OS 2025-01");
    assertThat(Json.string(version, "description")).isEqualTo("Monthly build");
    assertThat(Json.string(version, "publishedDate")).isEqualTo("01/02/2025");
    assertThat(version.get("showInGui").getAsBoolean()).isTrue();
    assertThat(version.getAsJsonArray("lunVhdDetails")).isEmpty();
  }

  @Test
  @DisplayName("should use today when the image name holds no date")
  void should_use_today_when_the_image_name_holds_no_date() {
    // Given
    var doc = offer();

    // When
    OfferDocuments.addImageVersion(doc, new ImageVersion(BLOB_URL, "d", "os-latest", "l", "standard"), TODAY);

    // Then
    assertThat(versions(doc, "standard").has("2025.03.14")).isTrue();
    assertThat(Json.string(versions(doc, "standard").getAsJsonObject("2025.03.14"), "publishedDate")).isEqualTo("03/14/2025");
  }

  @Test
  @DisplayName("should also add the version to the disk generation plan with a suffixed media name")
  void should_also_add_the_version_to_the_disk_generation_plan() {
    // Given
    var doc = offer();
    var image = new ImageVersion(BLOB_URL, "d", "os-20250102", "l", "standard", "standard-gen2", "gen2");

    // When
    OfferDocuments.addImageVersion(doc, image, TODAY);

    // Then
    assertThat(Json.string(versions(doc, "standard").getAsJsonObject("2025.01.02"), "mediaName")).isEqualTo("os-20250102");
    assertThat(Json.string(generationVersions(doc).getAsJsonObject("2025.01.02"), "mediaName")).isEqualTo("os-20250102-gen2");
  }

  @Test
  @DisplayName("should reject an unknown plan")
  void should_reject_an_unknown_plan() {
    assertThatThrownBy(() -> OfferDocuments.addImageVersion(offer(), new ImageVersion(BLOB_URL, "d", "os", "l", "premium"), TODAY))
      .isInstanceOf(CloudPartnerException.class)
      .hasMessageContaining("premium");
  }

  @Test
  @DisplayName("should remove a release from the plan and its generation plan")
  void should_remove_a_release_from_the_plan_and_its_generation_plan() {
    // Given
    var doc = offer();
    OfferDocuments.addImageVersion(doc, new ImageVersion(BLOB_URL, "d", "os-20250102", "l", "standard", "standard-gen2", null), TODAY);

    // When
    OfferDocuments.removeImageVersion(doc, "2024.12.01", "standard", "standard-gen2");

    // Then
    assertThat(versions(doc, "standard").keySet()).containsExactly("2025.01.02");
    assertThat(generationVersions(doc).keySet()).containsExactly("2025.01.02");
  }

  @Test
  @DisplayName("should refuse to remove the last version of a plan")
  void should_refuse_to_remove_the_last_version_of_a_plan() {
    // Given
    var doc = offer();

    // When/Then
    assertThatThrownBy(() -> OfferDocuments.removeImageVersion(doc, "2024.12.01", "standard", null))
      .isInstanceOf(CloudPartnerException.class)
      .hasMessageContaining("last image version");
    assertThat(versions(doc, "standard").has("2024.12.01")).isTrue();
  }

  @Test
  @DisplayName("should leave the plan untouched when the generation plan would lose its last version")
  void should_leave_the_plan_untouched_when_the_generation_plan_would_lose_its_last_version() {
    // Given
    var doc = offer();
    OfferDocuments.addImageVersion(doc, new ImageVersion(BLOB_URL, "d", "os-20250102", "l", "standard"), TODAY);

    // When/Then
    assertThatThrownBy(() -> OfferDocuments.removeImageVersion(doc, "2024.12.01", "standard", "standard-gen2"))
      .isInstanceOf(CloudPartnerException.class)
      .hasMessageContaining("standard-gen2");
    assertThat(versions(doc, "standard").has("2024.12.01")).isTrue();
  }

  @Test
  @DisplayName("should hide a deprecated image")
  void should_hide_a_deprecated_image() {
    // Given
    var doc = offer();

    // When
    OfferDocuments.deprecateImage(doc, "os-20241201", "standard");

    // Then
    assertThat(versions(doc, "standard").getAsJsonObject("2024.12.01").get("showInGui").getAsBoolean()).isFalse();
  }

  @Test
  @DisplayName("should not hide an image whose media name differs")
  void should_not_hide_an_image_whose_media_name_differs() {
    // Given
    var doc = offer();

    // When
    OfferDocuments.deprecateImage(doc, "other-20241201", "standard");

    // Then
    assertThat(versions(doc, "standard").getAsJsonObject("2024.12.01").get("showInGui").getAsBoolean()).isTrue();
  }

  @Test
  @DisplayName("should fail to deprecate a release the plan does not hold")
  void should_fail_to_deprecate_a_release_the_plan_does_not_hold() {
    assertThatThrownBy(() -> OfferDocuments.deprecateImage(offer(), "os-20230101", "standard"))
      .isInstanceOf(CloudPartnerException.class)
      .hasMessageContaining("os-20230101");
  }

  @Test
  @DisplayName("should leave the document unchanged when the deprecated image name holds no date")
  void should_leave_the_document_unchanged_when_the_image_name_holds_no_date() {
    // Given
    var doc = offer();
    var before = doc.deepCopy();

    // When
    OfferDocuments.deprecateImage(doc, "os-latest", "standard");

    // Then
    assertThat(doc).isEqualTo(before);
  }

  @Test
  @DisplayName("release date is the first valid eight-digit date of the name")
  void release_date_is_the_first_valid_eight_digit_date_of_the_name() {
    assertThat(OfferDocuments.releaseDate("os-20250102")).contains(LocalDate.of(2025, 1, 2));
    assertThat(OfferDocuments.releaseDate("os-99999999")).isEmpty();
    assertThat(OfferDocuments.releaseDate("os-2025")).isEmpty();
  }

  private static JsonObject offer() {
    return Json.parseObject("""
      {
        "definition": {
          "plans": [
            {
              "planId": "standard",
              "%s": {
                "2024.12.01": {"mediaName": "os-20241201", "showInGui": true}
              },
              "diskGenerations": [
                {
                  "planId": "standard-gen2",
                  "%s": {
                    "2024.12.01": {"mediaName": "os-20241201-gen2", "showInGui": true}
                  }
                }
              ]
            }
          ]
        }
      }
      """.formatted(VM_IMAGES_KEY, VM_IMAGES_KEY));
  }

  private static JsonObject versions(JsonObject doc, String sku) {
    for (var plan : doc.getAsJsonObject("definition").getAsJsonArray("plans")) {
      if (sku.equals(Json.string(plan.getAsJsonObject(), "planId"))) {
        return plan.getAsJsonObject().getAsJsonObject(VM_IMAGES_KEY);
      }
    }
    throw new AssertionError("no plan " + sku);
  }

  private static JsonObject generationVersions(JsonObject doc) {
    var plan = doc.getAsJsonObject("definition").getAsJsonArray("plans").get(0).getAsJsonObject();
    return plan.getAsJsonArray("diskGenerations").get(0).getAsJsonObject().getAsJsonObject(VM_IMAGES_KEY);
  }
}
