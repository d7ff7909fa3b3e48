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

/**
 * Thrown when the remote side explicitly reports an asynchronous operation as failed or canceled.
 */
public class RemoteOperationFailedException extends ImagePublisherException {

  private final OperationKind kind;
  private final String handle;
  private final OperationStatus status;
  private final String detail;

  public RemoteOperationFailedException(OperationKind kind, String handle, OperationStatus status, String detail) {
    super(kind + " operation " + handle + " ended with status " + status + (detail == null ? "" : ": " + detail));
    this.kind = kind;
    this.handle = handle;
    this.status = status;
    this.detail = detail;
  }

  public OperationKind kind() {
    return kind;
  }

  public String handle() {
    return handle;
  }

  public OperationStatus status() {
    return status;
  }

  public String detail() {
    return detail;
  }
}
