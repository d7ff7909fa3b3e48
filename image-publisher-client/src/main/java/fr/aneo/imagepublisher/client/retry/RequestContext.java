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

import fr.aneo.imagepublisher.client.auth.TokenScope;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Per-call context handed to the {@link RequestExecutor}.
 * <p>
 * Names the operation for logs and errors, optionally selects a token scope and a retry policy
 * overriding the executor's default, and records the attempts made. A context belongs to exactly
 * one call and must not be reused.
 */
public final class RequestContext {

  private final String operation;
  private final TokenScope scope;
  private final RetryPolicy policy;
  private final List<Attempt> attempts = new CopyOnWriteArrayList<>();

  private RequestContext(String operation, TokenScope scope, RetryPolicy policy) {
    this.operation = requireNonNull(operation, "operation must not be null");
    this.scope = scope;
    this.policy = policy;
  }

  public static RequestContext of(String operation) {
    return new RequestContext(operation, null, null);
  }

  public static RequestContext of(String operation, TokenScope scope) {
    return new RequestContext(operation, scope, null);
  }

  public RequestContext withScope(TokenScope scope) {
    return new RequestContext(operation, scope, policy);
  }

  public RequestContext withPolicy(RetryPolicy policy) {
    return new RequestContext(operation, scope, policy);
  }

  public String operation() {
    return operation;
  }

  /**
   * @return the token scope, or {@code null} when the call is not authorized with a bearer token
   */
  public TokenScope scope() {
    return scope;
  }

  /**
   * @return the policy overriding the executor default, or {@code null}
   */
  public RetryPolicy policy() {
    return policy;
  }

  public List<Attempt> attempts() {
    return List.copyOf(attempts);
  }

  public int attemptCount() {
    return attempts.size();
  }

  void record(Attempt attempt) {
    attempts.add(attempt);
  }

  @Override
  public String toString() {
    return "RequestContext{operation='" + operation + "', scope=" + scope + ", attempts=" + attempts.size() + "}";
  }
}
