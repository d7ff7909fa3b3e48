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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import fr.aneo.imagepublisher.client.exception.CloudPartnerException;
import fr.aneo.imagepublisher.client.http.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Edits cloud partner offer documents.
 * <p>
 * Image versions of a plan live in the plan's {@value #VM_IMAGES_KEY} object, keyed by release
 * ({@code yyyy.MM.dd}). Plans are listed in {@code definition.plans}; a plan may hold disk
 * generation plans in {@code diskGenerations}, each with its own versions. All methods modify the
 * given document in place and return it.
 * </p>
 */
public final class OfferDocuments {
  private static final Logger logger = LoggerFactory.getLogger(OfferDocuments.class);

  public static final String VM_IMAGES_KEY = "microsoft-azure-corevm.vmImagesPublicAzure";

  private static final Pattern EIGHT_DIGITS = Pattern.compile("\\d{8}");
  private static final DateTimeFormatter NAME_DATE = DateTimeFormatter.ofPattern("uuuuMMdd");
  private static final DateTimeFormatter RELEASE = DateTimeFormatter.ofPattern("uuuu.MM.dd");
  private static final DateTimeFormatter PUBLISHED_DATE = DateTimeFormatter.ofPattern("MM/dd/uuuu");

  private OfferDocuments() {
  }

  /**
   * Adds an image version to a plan, and to one of its disk generation plans when
   * {@link ImageVersion#generationId()} is set.
   *
   * @param today release date used when the image name holds no date
   * @throws CloudPartnerException if the plan or the generation plan does not exist
   */
  public static JsonObject addImageVersion(JsonObject doc, ImageVersion image, LocalDate today) {
    var releaseDate = releaseDate(image.imageName()).orElse(today);
    var release = RELEASE.format(releaseDate);

    var version = new JsonObject();
    version.addProperty("osVhdUrl", image.blobUrl());
    version.addProperty("label", image.label());
    version.addProperty("mediaName", image.imageName());
    version.addProperty("publishedDate", PUBLISHED_DATE.format(releaseDate));
    version.addProperty("description", image.description());
    version.addProperty("showInGui", true);
    version.add("lunVhdDetails", new JsonArray());

    var plan = findPlan(doc, image.sku());
    versions(plan).add(release, version);

    if (image.generationId() != null) {
      var generation = findGeneration(plan, image.generationId());
      var generationVersion = version.deepCopy();
      var suffix = image.generationSuffix() != null ? image.generationSuffix() : image.generationId();
      generationVersion.addProperty("mediaName", image.imageName() + "-" + suffix);
      versions(generation).add(release, generationVersion);
    }
    return doc;
  }

  /**
   * Removes a release from a plan, and from one of its disk generation plans when
   * {@code generationId} is set.
   *
   * @throws CloudPartnerException if the plan or generation plan does not exist, or if removing
   *                               the release would leave a plan without any version
   */
  public static JsonObject removeImageVersion(JsonObject doc, String release, String sku, String generationId) {
    var plan = findPlan(doc, sku);
    JsonObject generation = generationId == null ? null : findGeneration(plan, generationId);

    checkNotLastVersion(plan, release, "plan " + sku);
    if (generation != null) {
      checkNotLastVersion(generation, release, "generation " + generationId + " of plan " + sku);
    }

    removeRelease(plan, release);
    if (generation != null) removeRelease(generation, release);
    return doc;
  }

  /**
   * Hides an image from the marketplace GUI. The release is taken from the 8-digit date in the
   * image name; a name without date leaves the document unchanged.
   *
   * @throws CloudPartnerException if the plan has no version for that release
   */
  public static JsonObject deprecateImage(JsonObject doc, String imageName, String sku) {
    var releaseDate = releaseDate(imageName);
    if (releaseDate.isEmpty()) {
      logger.atWarn()
            .addKeyValue("image", imageName)
            .log("Image name holds no date, nothing to deprecate");
      return doc;
    }

    var release = RELEASE.format(releaseDate.get());
    var plan = findPlan(doc, sku);
    var image = Json.object(Json.object(plan, VM_IMAGES_KEY), release);
    if (image == null) {
      throw new CloudPartnerException("No match found for image " + imageName + " in the SKU " + sku + ". Offer doc not updated.");
    }

    var mediaName = Json.string(image, "mediaName");
    if (imageName.equals(mediaName)) {
      image.addProperty("showInGui", false);
    } else {
      logger.atWarn()
            .addKeyValue("image", imageName)
            .addKeyValue("mediaName", mediaName)
            .log("Deprecation image name does not match the mediaName attribute, offer doc not updated");
    }
    return doc;
  }

  /**
   * @return the date of the first 8-digit {@code yyyyMMdd} group in the name, if it is a valid date
   */
  static Optional<LocalDate> releaseDate(String imageName) {
    var matcher = EIGHT_DIGITS.matcher(imageName);
    if (!matcher.find()) return Optional.empty();
    try {
      return Optional.of(LocalDate.parse(matcher.group(), NAME_DATE));
    } catch (DateTimeParseException e) {
      logger.atDebug()
            .addKeyValue("image", imageName)
            .log("Eight-digit group is not a date, using today as release date");
      return Optional.empty();
    }
  }

  private static JsonObject findPlan(JsonObject doc, String sku) {
    var definition = Json.object(doc, "definition");
    var plans = definition == null ? null : definition.getAsJsonArray("plans");
    var plan = find(plans, sku);
    if (plan == null) {
      throw new CloudPartnerException("No match found for SKU: " + sku + ". Offer doc not updated.");
    }
    return plan;
  }

  private static JsonObject findGeneration(JsonObject plan, String generationId) {
    var generation = find(plan.getAsJsonArray("diskGenerations"), generationId);
    if (generation == null) {
      throw new CloudPartnerException("No match found for generation ID: " + generationId + ". Offer doc not updated.");
    }
    return generation;
  }

  private static JsonObject find(JsonArray plans, String planId) {
    if (plans == null) return null;
    for (var element : plans) {
      if (element.isJsonObject() && planId.equals(Json.string(element.getAsJsonObject(), "planId"))) {
        return element.getAsJsonObject();
      }
    }
    return null;
  }

  private static JsonObject versions(JsonObject plan) {
    var versions = Json.object(plan, VM_IMAGES_KEY);
    if (versions == null) {
      versions = new JsonObject();
      plan.add(VM_IMAGES_KEY, versions);
    }
    return versions;
  }

  private static void checkNotLastVersion(JsonObject plan, String release, String owner) {
    var versions = Json.object(plan, VM_IMAGES_KEY);
    if (versions != null && versions.has(release) && versions.size() == 1) {
      throw new CloudPartnerException("Cannot remove " + release + ", it is the last image version of " + owner + ".");
    }
  }

  private static void removeRelease(JsonObject plan, String release) {
    var versions = Json.object(plan, VM_IMAGES_KEY);
    if (versions != null) versions.remove(release);
  }
}
