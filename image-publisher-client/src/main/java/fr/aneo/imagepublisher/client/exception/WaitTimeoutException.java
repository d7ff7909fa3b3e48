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

import fr.aneo.imagepublisher.client.operation.OperationKind;
import fr.aneo.imagepublisher.client.operation.OperationStatus;

import java.time.Duration;

/**
 * Thrown when an asynchronous remote operation did not reach a terminal state before its
 * deadline. This is not a remote failure: the operation may still complete on the remote side.
 */
public class WaitTimeoutException extends ImagePublisherException {

  private final OperationKind kind;
  private final String handle;
  private final OperationStatus lastStatus;

  public WaitTimeoutException(OperationKind kind, String handle, OperationStatus lastStatus, Duration timeout) {
    super("Timed out after " + timeout + " waiting for " + kind + " operation " + handle + ", last status " + lastStatus);
    this.kind = kind;
    this.handle = handle;
    this.lastStatus = lastStatus;
  }

  public OperationKind kind() {
    return kind;
  }

  public String handle() {
    return handle;
  }

  public OperationStatus lastStatus() {
    return lastStatus;
  }
}
