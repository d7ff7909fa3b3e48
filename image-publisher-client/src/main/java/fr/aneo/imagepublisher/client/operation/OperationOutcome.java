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
 * Successful completion of an awaited operation.
 *
 * @param kind    the operation kind
 * @param handle  the operation handle
 * @param status  always {@link OperationStatus#SUCCEEDED}
 * @param payload the payload of the final probe, may be {@code null}
 * @param probes  number of probes made
 * @param <T>     the payload type
 */
public record OperationOutcome<T>(OperationKind kind, String handle, OperationStatus status, T payload, int probes) {
}
