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
package fr.aneo.imagepublisher.client.retry;

/**
 * Classification of a failed attempt, deciding what the request executor does next.
 */
public enum ErrorClass {
  /** Network error, timeout, throttling or server error: retried within the budget. */
  TRANSIENT,
  /** The remote side rejected the token: refreshed once, then permanent. */
  AUTHENTICATION,
  /** Client error or validation error: surfaced immediately. */
  PERMANENT
}
