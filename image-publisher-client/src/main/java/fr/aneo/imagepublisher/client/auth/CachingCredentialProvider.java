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
package fr.aneo.imagepublisher.client.auth;

import fr.aneo.imagepublisher.client.exception.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * {@link CredentialProvider} that caches one token per scope and renews it shortly before it
 * expires.
 * <p>
 * Token acquisition is delegated to a {@link TokenSource}. Concurrent requests for the same
 * scope trigger a single acquisition.
 * </p>
 */
public final class CachingCredentialProvider implements CredentialProvider {
  private static final Logger logger = LoggerFactory.getLogger(CachingCredentialProvider.class);

  static final Duration RENEWAL_MARGIN = Duration.ofMinutes(5);

  private final InlineCredentials credentials;
  private final TokenSource tokenSource;
  private final Clock clock;
  private final Map<TokenScope, AccessToken> tokens = new ConcurrentHashMap<>();

  public CachingCredentialProvider(InlineCredentials credentials, TokenSource tokenSource) {
    this(credentials, tokenSource, Clock.systemUTC());
  }

  CachingCredentialProvider(InlineCredentials credentials, TokenSource tokenSource, Clock clock) {
    this.credentials = requireNonNull(credentials, "credentials must not be null");
    this.tokenSource = requireNonNull(tokenSource, "tokenSource must not be null");
    this.clock = requireNonNull(clock, "clock must not be null");
  }

  @Override
  public AccessToken getToken(TokenScope scope) {
    requireNonNull(scope, "scope must not be null");
    return tokens.compute(scope, (key, cached) -> {
      if (cached != null && !cached.expiresWithin(RENEWAL_MARGIN, clock.instant())) return cached;
      return acquire(key);
    });
  }

  @Override
  public void invalidate(TokenScope scope) {
    if (tokens.remove(scope) != null) {
      logger.atDebug().addKeyValue("scope", scope).log("Cached token invalidated");
    }
  }

  private AccessToken acquire(TokenScope scope) {
    logger.atDebug()
          .addKeyValue("scope", scope)
          .addKeyValue("clientId", credentials.clientId())
          .log("Acquiring access token");
    AccessToken token;
    try {
      token = tokenSource.acquire(credentials, scope);
    } catch (AuthenticationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new AuthenticationException("Unable to authenticate against " + scope.scope() + ": " + e.getMessage(), e);
    }
    if (token == null) {
      throw new AuthenticationException("Identity provider returned no token for " + scope.scope());
    }
    return token;
  }
}
