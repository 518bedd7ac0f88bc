/*
 * Copyright © 2025 The infinidream-batch Authors
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
package io.infinidream.batch.config;

import io.infinidream.batch.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Endpoints and credentials taken from the process environment.
 * <p>
 * This is the only place the environment is read. Recognized variables:
 * </p>
 * <ul>
 *   <li>{@value #BACKEND_URL} and {@value #API_KEY}: the collection service; both are needed
 *       for any collection to be read or written</li>
 *   <li>{@value #REDISCLOUD_URL}: the result store as a {@code redis://} URL; when absent,
 *       {@value #REDIS_HOST} (default {@code localhost}), {@value #REDIS_PORT} (default
 *       {@code 6379}) and {@value #REDIS_PASSWORD} are used</li>
 * </ul>
 */
public final class EnvironmentSettings {
  private static final Logger logger = LoggerFactory.getLogger(EnvironmentSettings.class);

  public static final String BACKEND_URL = "BACKEND_URL";
  public static final String API_KEY = "API_KEY";
  public static final String REDISCLOUD_URL = "REDISCLOUD_URL";
  public static final String REDIS_HOST = "REDIS_HOST";
  public static final String REDIS_PORT = "REDIS_PORT";
  public static final String REDIS_PASSWORD = "REDIS_PASSWORD";

  static final String DEFAULT_REDIS_HOST = "localhost";
  static final int DEFAULT_REDIS_PORT = 6379;

  private final String backendUrl;
  private final String apiKey;
  private final URI redisUrl;
  private final String redisHost;
  private final int redisPort;
  private final String redisPassword;

  private EnvironmentSettings(String backendUrl, String apiKey, URI redisUrl, String redisHost, int redisPort, String redisPassword) {
    this.backendUrl = backendUrl;
    this.apiKey = apiKey;
    this.redisUrl = redisUrl;
    this.redisHost = redisHost;
    this.redisPort = redisPort;
    this.redisPassword = redisPassword;
  }

  /**
   * Reads the settings from the environment of the current process.
   *
   * @return the settings
   * @throws ConfigException if a variable holds an invalid value
   */
  public static EnvironmentSettings fromSystem() {
    return from(System.getenv());
  }

  /**
   * Reads the settings from a map of variables. Blank values count as absent.
   *
   * @param environment the variables
   * @return the settings
   * @throws ConfigException if {@value #REDISCLOUD_URL} is not a valid URI
   */
  public static EnvironmentSettings from(Map<String, String> environment) {
    requireNonNull(environment, "environment must not be null");

    var rawRedisUrl = value(environment, REDISCLOUD_URL);
    URI redisUrl = null;
    if (rawRedisUrl != null) {
      try {
        redisUrl = new URI(rawRedisUrl);
      } catch (URISyntaxException e) {
        throw new ConfigException("Invalid " + REDISCLOUD_URL + ": " + e.getMessage(), e);
      }
    }

    var host = value(environment, REDIS_HOST);
    return new EnvironmentSettings(
      value(environment, BACKEND_URL),
      value(environment, API_KEY),
      redisUrl,
      host == null ? DEFAULT_REDIS_HOST : host,
      port(value(environment, REDIS_PORT)),
      value(environment, REDIS_PASSWORD));
  }

  /**
   * Returns whether both the backend URL and the API key are set.
   *
   * @return {@code true} if the collection service can be reached
   */
  public boolean hasCollectionService() {
    return backendUrl != null && apiKey != null;
  }

  public Optional<String> backendUrl() {
    return Optional.ofNullable(backendUrl);
  }

  public Optional<String> apiKey() {
    return Optional.ofNullable(apiKey);
  }

  public Optional<URI> redisUrl() {
    return Optional.ofNullable(redisUrl);
  }

  public String redisHost() {
    return redisHost;
  }

  public int redisPort() {
    return redisPort;
  }

  public Optional<String> redisPassword() {
    return Optional.ofNullable(redisPassword);
  }

  private static String value(Map<String, String> environment, String name) {
    var value = environment.get(name);
    return value == null || value.isBlank() ? null : value.strip();
  }

  private static int port(String value) {
    if (value == null) return DEFAULT_REDIS_PORT;
    try {
      int port = Integer.parseInt(value);
      if (port > 0 && port <= 65535) return port;
      logger.warn("Invalid {}: {} (must be between 1 and 65535). Using default: {}", REDIS_PORT, value, DEFAULT_REDIS_PORT);
    } catch (NumberFormatException e) {
      logger.warn("Invalid number format for {}: {}. Using default: {}", REDIS_PORT, value, DEFAULT_REDIS_PORT);
    }
    return DEFAULT_REDIS_PORT;
  }

  @Override
  public String toString() {
    return "EnvironmentSettings{" +
      "backendUrl='" + backendUrl + '\'' +
      ", apiKey='" + (apiKey != null ? "***" : null) + '\'' +
      ", redisUrl='" + (redisUrl != null ? maskUserInfo(redisUrl) : null) + '\'' +
      ", redisHost='" + redisHost + '\'' +
      ", redisPort=" + redisPort +
      ", redisPassword='" + (redisPassword != null ? "***" : null) + '\'' +
      '}';
  }

  private static String maskUserInfo(URI uri) {
    if (uri.getRawUserInfo() == null) return uri.toString();
    return uri.toString().replace(uri.getRawUserInfo(), "***");
  }
}
