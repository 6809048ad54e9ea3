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
package fr.aneo.fossology.client.auth;

import fr.aneo.fossology.client.transport.ConsoleTransport;
import fr.aneo.fossology.client.transport.FormData;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static fr.aneo.fossology.client.transport.ConsoleEndpoints.AUTH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class AuthenticatorTest {

  private final ConsoleTransport transport = mock(ConsoleTransport.class);
  private final Authenticator authenticator = new Authenticator(transport);

  @Test
  void should_post_credentials_to_the_login_form() {
    // When
    authenticator.login("fossy", "p@ss word");

    // Then
    var form = ArgumentCaptor.forClass(FormData.class);
    verify(transport).post(eq(AUTH), form.capture());
    assertThat(form.getValue()).isEqualTo(FormData.builder().add("username", "fossy").add("password", "p@ss word").build());
  }

  @Test
  void should_not_send_anything_without_credentials() {
    assertThatThrownBy(() -> authenticator.login(null, "pw")).isInstanceOf(NullPointerException.class);
    verifyNoInteractions(transport);
  }
}
