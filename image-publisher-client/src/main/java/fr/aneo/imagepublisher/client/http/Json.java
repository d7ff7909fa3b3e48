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
package fr.aneo.imagepublisher.client.http;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Gson helpers for Azure REST payloads.
 */
public final class Json {

  public static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private Json() {
  }

  /**
   * Parses a JSON object.
   *
   * @param body the JSON text
   * @return the parsed object, empty when {@code body} is blank
   * @throws JsonParseException    if the text is malformed
   * @throws IllegalStateException if the text is valid JSON but not an object
   */
  public static JsonObject parseObject(String body) {
    if (body == null || body.isBlank()) return new JsonObject();
    return JsonParser.parseString(body).getAsJsonObject();
  }

  public static String toJson(JsonElement element) {
    return GSON.toJson(element);
  }

  /**
   * @return the string value of {@code key}, or {@code null} when absent or not a primitive
   */
  public static String string(JsonObject json, String key) {
    var element = json == null ? null : json.get(key);
    return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
  }

  /**
   * @return the child object at {@code key}, or {@code null} when absent or not an object
   */
  public static JsonObject object(JsonObject json, String key) {
    var element = json == null ? null : json.get(key);
    return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
  }

  /**
   * Extracts {@code error.code} from an Azure error response body.
   *
   * @param body the response body, possibly not JSON
   * @return the error code, or {@code null}
   */
  public static String errorCode(String body) {
    return errorField(body, "code");
  }

  /**
   * Extracts {@code error.message} from an Azure error response body.
   *
   * @param body the response body, possibly not JSON
   * @return the error message, or {@code null}
   */
  public static String errorMessage(String body) {
    return errorField(body, "message");
  }

  private static String errorField(String body, String field) {
    if (body == null || !body.trim().startsWith("{")) return null;
    try {
      return string(object(parseObject(body), "error"), field);
    } catch (JsonParseException | IllegalStateException e) {
      return null;
    }
  }
}
