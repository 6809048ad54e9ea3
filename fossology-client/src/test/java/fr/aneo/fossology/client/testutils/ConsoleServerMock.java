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
package fr.aneo.fossology.client.testutils;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Records the requests it receives and answers with canned replies keyed by method and path.
 * Unknown requests get an empty 200 response.
 */
public class ConsoleServerMock implements HttpHandler {
  public final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
  private final Map<String, Reply> replies = new ConcurrentHashMap<>();

  public void reply(String method, String pathAndQuery, int status, String body) {
    reply(method, pathAndQuery, status, body, Map.of());
  }

  public void reply(String method, String pathAndQuery, int status, String body, Map<String, String> headers) {
    replies.put(method + " " + pathAndQuery, new Reply(status, body.getBytes(UTF_8), headers));
  }

  public RecordedRequest lastRequest() {
    return requests.get(requests.size() - 1);
  }

  @Override
  public void handle(HttpExchange exchange) throws IOException {
    var uri = exchange.getRequestURI();
    var pathAndQuery = uri.getRawPath() + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());
    byte[] body;
    try (var in = exchange.getRequestBody()) {
      body = in.readAllBytes();
    }
    requests.add(new RecordedRequest(exchange.getRequestMethod(), pathAndQuery, exchange.getRequestHeaders(), body));

    var reply = replies.getOrDefault(exchange.getRequestMethod() + " " + pathAndQuery, new Reply(200, new byte[0], Map.of()));
    reply.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
    exchange.sendResponseHeaders(reply.status(), reply.body().length == 0 ? -1 : reply.body().length);
    if (reply.body().length > 0) {
      try (var out = exchange.getResponseBody()) {
        out.write(reply.body());
      }
    }
    exchange.close();
  }

  public record RecordedRequest(String method, String pathAndQuery, Headers headers, byte[] body) {
    public String bodyAsString() {
      return new String(body, UTF_8);
    }

    public String header(String name) {
      return headers.getFirst(name);
    }
  }

  private record Reply(int status, byte[] body, Map<String, String> headers) {
  }
}
