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

import java.nio.file.Path;

/**
 * Where the publisher gets its identity from.
 * <p>
 * The variant is chosen once when the client is built:
 * <ul>
 *   <li>{@link InlineCredentials}: a service principal given directly</li>
 *   <li>{@link CredentialsFile}: a service principal stored in a JSON file</li>
 *   <li>{@link SasToken}: a storage shared access signature, usable for blob operations only</li>
 * </ul>
 */
public sealed interface CredentialSource permits InlineCredentials, CredentialsFile, SasToken {

  static CredentialSource file(Path path) {
    return new CredentialsFile(path);
  }

  static CredentialSource sasToken(String token) {
    return new SasToken(token);
  }
}
