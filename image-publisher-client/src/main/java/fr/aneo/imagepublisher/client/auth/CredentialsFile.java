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
package fr.aneo.imagepublisher.client.auth;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import fr.aneo.imagepublisher.client.exception.AuthenticationException;
import fr.aneo.imagepublisher.client.http.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Service principal stored as a JSON authentication file.
 * <p>
 * The file uses the keys {@code clientId}, {@code clientSecret}, {@code tenantId},
 * {@code subscriptionId} and optionally {@code activeDirectoryEndpointUrl} and
 * {@code managementEndpointUrl} (or {@code resourceManagerEndpointUrl}). A leading {@code ~} is
 * expanded to the user home directory.
 * </p>
 *
 * @param path location of the file
 */
public record CredentialsFile(Path path) implements CredentialSource {

  public CredentialsFile {
    requireNonNull(path, "path must not be null");
  }

  /**
   * Reads the file into inline credentials.
   *
   * @return the credentials held by the file
   * @throws AuthenticationException if the file cannot be read or misses a required key
   */
  public InlineCredentials load() {
    var resolved = expandHome(path);
    try {
      var json = Json.parseObject(Files.readString(resolved, UTF_8));
      return new InlineCredentials(
        required(json, "clientId", resolved),
        required(json, "clientSecret", resolved),
        required(json, "tenantId", resolved),
        required(json, "subscriptionId", resolved),
        Json.string(json, "activeDirectoryEndpointUrl"),
        Json.string(json, "managementEndpointUrl") != null
          ? Json.string(json, "managementEndpointUrl")
          : Json.string(json, "resourceManagerEndpointUrl"));
    } catch (IOException e) {
      throw new AuthenticationException("Unable to read credentials file " + resolved, e);
    } catch (JsonParseException | IllegalStateException e) {
      throw new AuthenticationException("Credentials file " + resolved + " is not a valid JSON object", e);
    }
  }

  private static String required(JsonObject json, String key, Path file) {
    var value = Json.string(json, key);
    if (value == null) {
      throw new AuthenticationException("Credentials file " + file + " is missing " + key);
    }
    return value;
  }

  private static Path expandHome(Path path) {
    var raw = path.toString();
    if (raw.equals("~") || raw.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), raw.substring(1).replaceFirst("^/", ""));
    }
    return path;
  }
}
