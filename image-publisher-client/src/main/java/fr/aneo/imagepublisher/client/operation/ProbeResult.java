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

import static java.util.Objects.requireNonNull;

/**
 * Result of a single status probe.
 *
 * @param status  normalized status observed
 * @param payload resource or document returned by the probe, may be {@code null}
 * @param detail  human-readable detail, typically the failure reason, may be {@code null}
 * @param <T>     the payload type
 */
public record ProbeResult<T>(OperationStatus status, T payload, String detail) {

  public ProbeResult {
    requireNonNull(status, "status must not be null");
    if (status == OperationStatus.PENDING) {
      throw new IllegalArgumentException("a probe observes the operation, its status cannot be PENDING");
    }
  }

  public static <T> ProbeResult<T> inProgress() {
    return new ProbeResult<>(OperationStatus.IN_PROGRESS, null, null);
  }

  public static <T> ProbeResult<T> succeeded(T payload) {
    return new ProbeResult<>(OperationStatus.SUCCEEDED, payload, null);
  }

  public static <T> ProbeResult<T> failed(String detail) {
    return new ProbeResult<>(OperationStatus.FAILED, null, detail);
  }

  public static <T> ProbeResult<T> of(OperationStatus status, T payload) {
    return new ProbeResult<>(status, payload, null);
  }
}
