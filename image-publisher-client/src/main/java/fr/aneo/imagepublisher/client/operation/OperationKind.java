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
package fr.aneo.imagepublisher.client.operation;

/**
 * Remote operations that complete asynchronously and are awaited by polling.
 */
public enum OperationKind {
  IMAGE_CREATE,
  IMAGE_DELETE,
  GALLERY_IMAGE_VERSION_CREATE,
  GALLERY_IMAGE_VERSION_DELETE,
  OFFER_PUBLISH,
  OFFER_GO_LIVE
}
