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

import java.util.Locale;

/**
 * Normalized status of an asynchronous remote operation.
 * <p>
 * Statuses only move forward: {@code PENDING} until the first probe, then {@code IN_PROGRESS}
 * for as long as the remote side reports no final state, then one terminal status that never
 * changes.
 */
public enum OperationStatus {
  PENDING,
  IN_PROGRESS,
  SUCCEEDED,
  FAILED,
  CANCELED;

  public boolean isTerminal() {
    return this != PENDING && this != IN_PROGRESS;
  }

  public boolean canTransitionTo(OperationStatus next) {
    return !isTerminal() && next != PENDING;
  }

  /**
   * Maps an Azure Resource Manager {@code provisioningState}.
   *
   * @param provisioningState the state reported by the resource, may be {@code null}
   * @return the matching terminal status, or {@link #IN_PROGRESS} for any other value
   */
  public static OperationStatus fromProvisioningState(String provisioningState) {
    if (provisioningState == null) return IN_PROGRESS;
    return switch (provisioningState.toLowerCase(Locale.ROOT)) {
      case "succeeded" -> SUCCEEDED;
      case "failed" -> FAILED;
      case "canceled", "cancelled" -> CANCELED;
      default -> IN_PROGRESS;
    };
  }
}
