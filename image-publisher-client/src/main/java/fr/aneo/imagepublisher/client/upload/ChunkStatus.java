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

/**
 * Lifecycle of a chunk within an upload session: {@code PENDING → IN_FLIGHT → COMMITTED | FAILED}.
 */
public enum ChunkStatus {
  PENDING,
  IN_FLIGHT,
  COMMITTED,
  FAILED;

  public boolean isTerminal() {
    return this == COMMITTED || this == FAILED;
  }

  boolean canTransitionTo(ChunkStatus next) {
    return switch (this) {
      case PENDING -> next == IN_FLIGHT;
      case IN_FLIGHT -> next == COMMITTED || next == FAILED;
      case COMMITTED, FAILED -> false;
    };
  }
}
