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

import com.google.common.net.HttpHeaders;
import com.google.common.net.MediaType;
import fr.aneo.fossology.client.FossologyConfig;
import fr.aneo.fossology.client.RetryPolicy;
import fr.aneo.fossology.client.internal.retry.RetryableOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * {@link ConsoleTransport} backed by a {@link HttpClient} and a private cookie jar.
 * <p>
 * Each instance owns its {@link CookieManager}, so the session established by a login on one
 * transport is never visible to another. Every request goes through
 * {@link RetryableOperation} with the configured {@link RetryPolicy}: failures to reach the
 * server are retried, HTTP statuses are not looked at.
 * <p>
 * Multipart submissions carry the header profile the console's upload handler expects from a
 * browser: no-cache directives, {@code Upgrade-Insecure-Requests} and a referer pointing at
 * the posted URL.
 */
public final class HttpConsoleTransport implements ConsoleTransport {
  private static final Logger logger = LoggerFactory.getLogger(HttpConsoleTransport.class);
  private static final String UPGRADE_INSECURE_REQUESTS = "Upgrade-Insecure-Requests";
  private static final String NO_CACHE = "no-cache";

  private final String serverUrl;
  private final HttpClient httpClient;
  private final CookieManager cookieManager;
  private final RetryPolicy retryPolicy;
  private final Duration requestTimeout;

  HttpConsoleTransport(String serverUrl,
                       HttpClient httpClient,
                       CookieManager cookieManager,
                       RetryPolicy retryPolicy,
                       Duration requestTimeout) {
    this.serverUrl = stripTrailingSlash(requireNonNull(serverUrl, "serverUrl must not be null"));
    this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
    this.cookieManager = requireNonNull(cookieManager, "cookieManager must not be null");
    this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy must not be null");
    this.requestTimeout = requestTimeout;
  }

  /**
   * Creates a transport with a fresh session for the configured server.
   *
   * @param config the client configuration
   * @return a new transport owning its own cookie jar
   * @throws NullPointerException if config is null
   */
  public static HttpConsoleTransport create(FossologyConfig config) {
    requireNonNull(config, "config must not be null");

    var cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
    var httpClient = HttpClient.newBuilder()
                               .version(HttpClient.Version.HTTP_1_1)
                               .cookieHandler(cookieManager)
                               .followRedirects(HttpClient.Redirect.NORMAL)
                               .connectTimeout(config.connectTimeout())
                               .build();

    return new HttpConsoleTransport(config.serverUrl(), httpClient, cookieManager, config.retryPolicy(), config.requestTimeout());
  }

  @Override
  public ConsoleResponse get(String path) {
    var uri = resolve(path);
    var request = requestBuilder(uri).GET().build();

    return send("GET " + uri, request);
  }

  @Override
  public ConsoleResponse post(String path, FormData form) {
    requireNonNull(form, "form must not be null");

    var uri = resolve(path);
    var request = requestBuilder(uri)
      .header(HttpHeaders.CONTENT_TYPE, MediaType.FORM_DATA.toString())
      .POST(HttpRequest.BodyPublishers.ofString(form.encode(), UTF_8))
      .build();

    return send("POST " + uri, request);
  }

  @Override
  public ConsoleResponse postMultipart(String path, List<MultipartField> fields) {
    requireNonNull(fields, "fields must not be null");

    var uri = resolve(path);
    var body = MultipartBody.encode(fields);
    var request = requestBuilder(uri)
      .header(HttpHeaders.CONTENT_TYPE, body.contentType())
      .header(HttpHeaders.PRAGMA, NO_CACHE)
      .header(HttpHeaders.CACHE_CONTROL, NO_CACHE)
      .header(UPGRADE_INSECURE_REQUESTS, "1")
      .header(HttpHeaders.REFERER, uri.toString())
      .POST(HttpRequest.BodyPublishers.ofByteArray(body.bytes()))
      .build();

    return send("POST (multipart) " + uri, request);
  }

  /**
   * Returns the cookies currently held by this transport's session.
   *
   * @return a snapshot of the session cookies
   */
  public List<HttpCookie> cookies() {
    return List.copyOf(cookieManager.getCookieStore().getCookies());
  }

  public String serverUrl() {
    return serverUrl;
  }

  private ConsoleResponse send(String description, HttpRequest request) {
    return RetryableOperation.execute(description, () -> {
      HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      logger.debug("{} -> {}", description, response.statusCode());
      return new ConsoleResponse(response.statusCode(), response.body());
    }, retryPolicy);
  }

  private HttpRequest.Builder requestBuilder(URI uri) {
    var builder = HttpRequest.newBuilder(uri);
    if (requestTimeout != null) {
      builder.timeout(requestTimeout);
    }
    return builder;
  }

  private URI resolve(String path) {
    requireNonNull(path, "path must not be null");
    return URI.create(serverUrl + path);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
