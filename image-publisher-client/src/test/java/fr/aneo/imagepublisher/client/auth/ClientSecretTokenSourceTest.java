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
import fr.aneo.imagepublisher.client.exception.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClientSecretTokenSourceTest {

  private static final InlineCredentials CREDENTIALS = new InlineCredentials("client", "secret", "tenant", "subscription");

  private TokenCredential credential;
  private List<InlineCredentials> created;
  private ClientSecretTokenSource tokenSource;

  @BeforeEach
  void setUp() {
    credential = mock(TokenCredential.class);
    created = new ArrayList<>();
    tokenSource = new ClientSecretTokenSource((InlineCredentials credentials) -> {
      created.add(credentials);
      return credential;
    });
  }

  @Test
  @DisplayName("requests a token for the scope and keeps its expiry")
  void requests_a_token_for_the_scope_and_keeps_its_expiry() {
    // Given
    var expiresAt = OffsetDateTime.of(2025, 3, 1, 11, 0, 0, 0, ZoneOffset.ofHours(1));
    when(credential.getTokenSync(any())).thenReturn(new com.azure.core.credential.AccessToken("abc", expiresAt));

    // When
    var token = tokenSource.acquire(CREDENTIALS, TokenScope.STORAGE);

    // Then
    var context = ArgumentCaptor.forClass(TokenRequestContext.class);
    verify(credential).getTokenSync(context.capture());
    assertThat(context.getValue().getScopes()).containsExactly("https://storage.azure.com/.default");
    assertThat(token.token()).isEqualTo("abc");
    assertThat(token.expiresAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    assertThat(created).containsExactly(CREDENTIALS);
  }

  @Test
  @DisplayName("every acquisition reaches the identity provider")
  void every_acquisition_reaches_the_identity_provider() {
    // Given
    var expiresAt = OffsetDateTime.of(2025, 3, 1, 11, 0, 0, 0, ZoneOffset.UTC);
    when(credential.getTokenSync(any())).thenReturn(new com.azure.core.credential.AccessToken("abc", expiresAt));

    // When
    tokenSource.acquire(CREDENTIALS, TokenScope.MANAGEMENT);
    tokenSource.acquire(CREDENTIALS, TokenScope.MANAGEMENT);

    // Then
    assertThat(created).hasSize(2);
  }

  @Test
  @DisplayName("a rejected client surfaces as an authentication error")
  void rejected_client_surfaces_as_an_authentication_error() {
    // Given
    var rejection = new IllegalStateException("AADSTS7000215: Invalid client secret provided");
    when(credential.getTokenSync(any())).thenThrow(rejection);

    // When/Then
    assertThatThrownBy(() -> tokenSource.acquire(CREDENTIALS, TokenScope.MANAGEMENT))
      .isInstanceOf(AuthenticationException.class)
      .hasMessageContaining("client")
      .hasMessageContaining("AADSTS7000215")
      .hasCause(rejection);
  }

  @Test
  @DisplayName("no token from the identity provider yields null")
  void no_token_yields_null() {
    // Given
    when(credential.getTokenSync(any())).thenReturn(null);

    // When
    var token = tokenSource.acquire(CREDENTIALS, TokenScope.CLOUD_PARTNER);

    // Then
    assertThat(token).isNull();
  }
}
