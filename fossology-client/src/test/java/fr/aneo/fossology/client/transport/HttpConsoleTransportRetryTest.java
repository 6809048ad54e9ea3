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
package fr.aneo.fossology.client.transport;

import fr.aneo.fossology.client.RetryPolicy;
import fr.aneo.fossology.client.exception.FossologyConnectionException;
import fr.aneo.fossology.client.exception.FossologyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.stubbing.Stubber;

import java.io.IOException;
import java.net.ConnectException;
import java.net.CookieManager;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static fr.aneo.fossology.client.transport.ConsoleEndpoints.AUTH;
import static fr.aneo.fossology.client.transport.ConsoleEndpoints.UPLOAD_FILE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpConsoleTransportRetryTest {

  private HttpClient httpClient;
  private HttpResponse<byte[]> okResponse;
  private HttpConsoleTransport transport;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    httpClient = mock(HttpClient.class);
    okResponse = mock(HttpResponse.class);
    when(okResponse.statusCode()).thenReturn(200);
    when(okResponse.body()).thenReturn("ok".getBytes(UTF_8));
    transport = new HttpConsoleTransport("http://fossology.test", httpClient, new CookieManager(), new RetryPolicy(5, Duration.ofMillis(1)), null);
  }

  @ParameterizedTest(name = "{0} refused connections")
  @ValueSource(ints = {1, 2, 3, 4})
  @DisplayName("request succeeds after fewer than five refused connections")
  void request_succeeds_after_fewer_than_five_refused_connections(int failures) throws Exception {
    // Given
    Stubber stubber = doThrow(new ConnectException("refused"));
    for (int i = 1; i < failures; i++) {
      stubber = stubber.doThrow(new ConnectException("refused"));
    }
    stubber.doReturn(okResponse).when(httpClient).send(any(HttpRequest.class), any());

    // When
    var response = transport.get(UPLOAD_FILE);

    // Then
    assertThat(response.bodyAsString()).isEqualTo("ok");
    verify(httpClient, times(failures + 1)).send(any(HttpRequest.class), any());
  }

  @Test
  @DisplayName("five refused connections exhaust the retries")
  void five_refused_connections_exhaust_the_retries() throws Exception {
    // Given
    doThrow(new ConnectException("refused")).when(httpClient).send(any(HttpRequest.class), any());

    // When / Then
    assertThatThrownBy(() -> transport.post(AUTH, FormData.empty()))
      .isInstanceOf(FossologyConnectionException.class)
      .hasCauseInstanceOf(ConnectException.class);
    verify(httpClient, times(5)).send(any(HttpRequest.class), any());
  }

  @Test
  @DisplayName("other io failures are reported after one attempt")
  void other_io_failures_are_reported_after_one_attempt() throws Exception {
    // Given
    doThrow(new IOException("malformed response")).when(httpClient).send(any(HttpRequest.class), any());

    // When / Then
    assertThatThrownBy(() -> transport.get(UPLOAD_FILE))
      .isInstanceOf(FossologyException.class)
      .isNotInstanceOf(FossologyConnectionException.class);
    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  @DisplayName("a missing request timeout leaves requests unbounded")
  void a_missing_request_timeout_leaves_requests_unbounded() throws Exception {
    // Given
    doReturn(okResponse).when(httpClient).send(any(HttpRequest.class), any());

    // When
    transport.get(UPLOAD_FILE);

    // Then
    var captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().timeout()).isEmpty();
    assertThat(captor.getValue().uri().toString()).isEqualTo("http://fossology.test" + UPLOAD_FILE);
  }
}
