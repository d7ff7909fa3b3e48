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

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * A pending asynchronous remote operation being awaited.
 * <p>
 * The status only moves forward (see {@link OperationStatus#canTransitionTo}). An operation is
 * mutated by the single polling task that awaits it.
 * </p>
 */
public final class Operation {

  private final String handle;
  private final OperationKind kind;
  private final Duration pollInterval;
  private final Instant deadline;
  private volatile OperationStatus status = OperationStatus.PENDING;
  private volatile int probeCount;
  private volatile String lastDetail;

  public Operation(String handle, OperationKind kind, Duration pollInterval, Instant deadline) {
    this.handle = requireNonNull(handle, "handle must not be null");
    this.kind = requireNonNull(kind, "kind must not be null");
    this.pollInterval = requireNonNull(pollInterval, "pollInterval must not be null");
    this.deadline = requireNonNull(deadline, "deadline must not be null");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  public String handle() {
    return handle;
  }

  public OperationKind kind() {
    return kind;
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public Instant deadline() {
    return deadline;
  }

  public OperationStatus status() {
    return status;
  }

  public int probeCount() {
    return probeCount;
  }

  /**
   * @return the detail reported by the latest probe, e.g. a failure message, or {@code null}
   */
  public String lastDetail() {
    return lastDetail;
  }

  /**
   * Records the status reported by a probe.
   *
   * @throws IllegalStateException if the status would move backwards or leave a terminal status
   */
  void transitionTo(OperationStatus next, String detail) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(kind + " operation " + handle + " cannot go from " + status + " to " + next);
    }
    probeCount++;
    status = next;
    lastDetail = detail;
  }

  @Override
  public String toString() {
    return "Operation{kind=" + kind + ", handle='" + handle + "', status=" + status + ", probes=" + probeCount + "}";
  }
}
