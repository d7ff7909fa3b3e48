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

import static java.util.Objects.requireNonNull;

/**
 * Storage shared access signature. Blob requests are authorized by appending it to the URL.
 *
 * @param token the signature query string, with or without the leading {@code ?}
 */
public record SasToken(String token) implements CredentialSource {

  public SasToken {
    requireNonNull(token, "token must not be null");
    token = token.startsWith("?") ? token.substring(1) : token;
    if (token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
  }

  @Override
  public String toString() {
    return "SasToken{***}";
  }
}
