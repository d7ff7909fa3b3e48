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
package fr.aneo.imagepublisher.client.exception;

import fr.aneo.imagepublisher.client.retry.Attempt;

import java.util.List;

/**
 * Thrown when a call failed with an error classified as permanent (client errors other than
 * throttling, validation errors, or a second authentication failure). No retry was attempted
 * after the classifying error.
 */
public class PermanentFailureException extends RequestFailedException {

  public PermanentFailureException(String operation, List<Attempt> attempts, Throwable cause) {
    super("Permanent failure", operation, attempts, cause);
  }
}
