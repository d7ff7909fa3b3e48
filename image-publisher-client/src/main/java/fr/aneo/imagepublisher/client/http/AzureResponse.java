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

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpHeaders;

import static java.util.Objects.requireNonNull;

/**
 * A fully read HTTP response.
 *
 * @param statusCode HTTP status
 * @param headers    response headers
 * @param body       response body, empty when the response has none
 */
public record AzureResponse(int statusCode, HttpHeaders headers, String body) {

  public AzureResponse {
    requireNonNull(headers, "headers must not be null");
    body = body == null ? "" : body;
  }

  /**
   * @return the value of a header, or {@code null} when absent
   */
  public String header(String name) {
    return headers.getValue(HttpHeaderName.fromString(name));
  }
}
