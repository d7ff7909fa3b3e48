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

import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.azure.core.http.HttpClient;
import com.azure.identity.ClientSecretCredentialBuilder;
import fr.aneo.imagepublisher.client.exception.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Acquires tokens from Microsoft Entra ID with the client secret of a service principal, through
 * the Azure Identity library.
 * <p>
 * A credential is created for every acquisition so that a renewal after a rejected token always
 * reaches the identity provider; tokens are cached by {@link CachingCredentialProvider}.
 * Failures surface as {@link AuthenticationException}.
 */
public final class ClientSecretTokenSource implements TokenSource {
  private static final Logger logger = LoggerFactory.getLogger(ClientSecretTokenSource.class);

  private final Function<InlineCredentials, TokenCredential> credentialFactory;

  /**
   * @param httpClient HTTP client used to reach the identity provider, shared with the Azure clients
   */
  public ClientSecretTokenSource(HttpClient httpClient) {
    this((InlineCredentials credentials) -> new ClientSecretCredentialBuilder()
      .authorityHost(credentials.activeDirectoryEndpointUrl())
      .tenantId(credentials.tenantId())
      .clientId(credentials.clientId())
      .clientSecret(credentials.clientSecret())
      .httpClient(requireNonNull(httpClient, "httpClient must not be null"))
      .build());
  }

  ClientSecretTokenSource(Function<InlineCredentials, TokenCredential> credentialFactory) {
    this.credentialFactory = requireNonNull(credentialFactory, "credentialFactory must not be null");
  }

  @Override
  public AccessToken acquire(InlineCredentials credentials, TokenScope scope) {
    requireNonNull(credentials, "credentials must not be null");
    requireNonNull(scope, "scope must not be null");

    logger.atDebug()
          .addKeyValue("clientId", credentials.clientId())
          .addKeyValue("tenantId", credentials.tenantId())
          .addKeyValue("scope", scope.scope())
          .log("Requesting access token");

    com.azure.core.credential.AccessToken token;
    try {
      token = credentialFactory.apply(credentials).getTokenSync(new TokenRequestContext().addScopes(scope.scope()));
    } catch (RuntimeException e) {
      throw new AuthenticationException("Identity provider rejected client " + credentials.clientId() + ": " + e.getMessage(), e);
    }
    if (token == null) {
      return null;
    }
    return new AccessToken(token.getToken(), token.getExpiresAt().toInstant());
  }
}
