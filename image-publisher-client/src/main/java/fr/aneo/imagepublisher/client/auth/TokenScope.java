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

/**
 * Audiences for which bearer tokens are requested.
 */
public enum TokenScope {
  MANAGEMENT("https://management.azure.com/.default"),
  STORAGE("https://storage.azure.com/.default"),
  CLOUD_PARTNER("https://cloudpartner.azure.com/.default");

  private final String scope;

  TokenScope(String scope) {
    this.scope = scope;
  }

  /**
   * @return the OAuth2 scope string sent to the identity provider
   */
  public String scope() {
    return scope;
  }
}
