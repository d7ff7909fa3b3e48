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
package fr.aneo.imagepublisher.client.upload;

import java.time.Duration;

/**
 * Outcome of a successful upload.
 *
 * @param blobName   the committed blob
 * @param size       number of bytes uploaded
 * @param chunkCount number of chunks uploaded
 * @param elapsed    wall-clock duration of the upload
 */
public record UploadResult(String blobName, long size, int chunkCount, Duration elapsed) {
}
