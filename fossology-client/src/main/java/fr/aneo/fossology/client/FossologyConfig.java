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
package fr.aneo.fossology.client;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import fr.aneo.fossology.client.exception.FossologyException;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration for connecting to a Fossology server.
 * <p>
 * This configuration specifies the server URL, the console credentials, and the transport
 * behaviour (retry policy, timeouts, listing page size). Create instances using the builder
 * pattern, or load them from a JSON configuration file with {@link #fromFile(Path)}.
 *
 * <pre>{@code
 * var config = FossologyConfig.builder()
 *                             .serverUrl("http://fossology.example.com:8081")
 *                             .credentials("fossy", "fossy")
 *                             .build();
 * }</pre>
 *
 * @see FossologyClient
 */
public final class FossologyConfig {
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(5);
  public static final int DEFAULT_PAGE_SIZE = 100;

  private final String serverUrl;
  private final String username;
  private final String password;
  private final RetryPolicy retryPolicy;
  private final Duration connectTimeout;
  private final Duration requestTimeout;
  private final int pageSize;

  private FossologyConfig(Builder builder) {
    this.serverUrl = builder.serverUrl;
    this.username = builder.username;
    this.password = builder.password;
    this.retryPolicy = builder.retryPolicy;
    this.connectTimeout = builder.connectTimeout;
    this.requestTimeout = builder.requestTimeout;
    this.pageSize = builder.pageSize;
  }

  /**
   * Returns the base URL of the server, without the {@code /repo} console path.
   *
   * @return the server URL (e.g., "http://fossology.example.com:8081")
   */
  public String serverUrl() {
    return serverUrl;
  }

  public String username() {
    return username;
  }

  public String password() {
    return password;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  /**
   * @return the timeout applied to each request, or null when requests may take any time
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * @return the number of entries requested per page when listing uploads
   */
  public int pageSize() {
    return pageSize;
  }

  /**
   * Creates a new builder for constructing a {@link FossologyConfig}.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads a configuration from a JSON file.
   * <p>
   * The file holds the connection data only; transport settings take their default values:
   * <pre>{@code
   * {
   *   "serverUrl": "http://localhost:8081",
   *   "username": "fossy",
   *   "password": "fossy"
   * }
   * }</pre>
   *
   * @param path path to the JSON configuration file
   * @return the loaded configuration
   * @throws FossologyException       if the file cannot be read or is not valid JSON
   * @throws IllegalArgumentException if the loaded values are invalid
   */
  public static FossologyConfig fromFile(Path path) {
    requireNonNull(path, "path must not be null");

    ConfigFile file;
    try {
      file = new Gson().fromJson(Files.readString(path, UTF_8), ConfigFile.class);
    } catch (IOException e) {
      throw new FossologyException("Unable to read configuration file " + path, e);
    } catch (JsonParseException e) {
      throw new FossologyException("Invalid configuration file " + path + ": " + e.getMessage(), e);
    }
    if (file == null) throw new FossologyException("Configuration file " + path + " is empty");

    return builder().serverUrl(file.serverUrl)
                    .credentials(file.username, file.password)
                    .build();
  }

  @Override
  public String toString() {
    return "FossologyConfig{" +
      "serverUrl='" + serverUrl + '\'' +
      ", username='" + username + '\'' +
      ", password='" + (password != null ? "***" : null) + '\'' +
      ", retryPolicy=" + retryPolicy +
      ", connectTimeout=" + connectTimeout +
      ", requestTimeout=" + requestTimeout +
      ", pageSize=" + pageSize +
      '}';
  }

  private static final class ConfigFile {
    @SerializedName("serverUrl")
    String serverUrl;
    @SerializedName("username")
    String username;
    @SerializedName("password")
    String password;
  }

  /**
   * Builder for {@link FossologyConfig}.
   * <p>
   * Use fluent methods to configure the connection parameters, then call {@link #build()}
   * to create an immutable configuration instance.
   */
  public static final class Builder {
    private String serverUrl;
    private String username;
    private String password;
    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private int pageSize = DEFAULT_PAGE_SIZE;

    private Builder() {
    }

    /**
     * Sets the server base URL (required).
     *
     * @param serverUrl an absolute http or https URL (e.g., "http://localhost:8081")
     * @return this builder
     */
    public Builder serverUrl(String serverUrl) {
      this.serverUrl = serverUrl;
      return this;
    }

    /**
     * Sets the credentials submitted to the console login form (required).
     *
     * @param username the console user name
     * @param password the console password
     * @return this builder
     */
    public Builder credentials(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    /**
     * Sets the retry policy applied to requests that fail to reach the server.
     * Defaults to {@link RetryPolicy#DEFAULT}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * Sets the timeout applied to each request; {@code null} disables it.
     *
     * @param requestTimeout the request timeout, or null
     * @return this builder
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /**
     * Builds the immutable {@link FossologyConfig} instance.
     *
     * @return a new {@link FossologyConfig} instance
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public FossologyConfig build() {
      validate();
      return new FossologyConfig(this);
    }

    private void validate() {
      if (serverUrl == null || serverUrl.isBlank())
        throw new IllegalArgumentException("serverUrl is required");

      try {
        var uri = new URI(serverUrl);
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme()))
          throw new IllegalArgumentException("serverUrl must be an http or https URL, got: " + serverUrl);
        if (uri.getHost() == null)
          throw new IllegalArgumentException("serverUrl must contain a host, got: " + serverUrl);
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("serverUrl is not a valid URL: " + serverUrl, e);
      }

      if (username == null || username.isBlank())
        throw new IllegalArgumentException("username is required");

      if (password == null)
        throw new IllegalArgumentException("password is required");

      if (retryPolicy == null)
        throw new IllegalArgumentException("retryPolicy is required");

      if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative())
        throw new IllegalArgumentException("connectTimeout must be positive");

      if (requestTimeout != null && (requestTimeout.isZero() || requestTimeout.isNegative()))
        throw new IllegalArgumentException("requestTimeout must be positive");

      if (pageSize < 1)
        throw new IllegalArgumentException("pageSize must be at least 1, got: " + pageSize);
    }
  }
}
