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
package io.infinidream.batch.result;

import io.infinidream.batch.exception.TransientResultException;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * {@link ResultStore} backed by the Redis instance the queue uses, read with {@code HGETALL}.
 * <p>
 * The underlying {@link JedisPooled} client is thread-safe; this store owns it and closes it
 * in {@link #close()}.
 * </p>
 */
public final class RedisResultStore implements ResultStore, AutoCloseable {

  private final JedisPooled jedis;

  RedisResultStore(JedisPooled jedis) {
    this.jedis = requireNonNull(jedis, "jedis must not be null");
  }

  /**
   * Connects using a Redis URL such as {@code redis://:password@host:6379}.
   *
   * @param url the connection URL
   * @return the store
   */
  public static RedisResultStore connect(URI url) {
    requireNonNull(url, "url must not be null");
    return new RedisResultStore(new JedisPooled(url));
  }

  /**
   * Connects to a host and port, optionally authenticating.
   *
   * @param host     the Redis host
   * @param port     the Redis port
   * @param password the password, or {@code null} when the server has none
   * @return the store
   */
  public static RedisResultStore connect(String host, int port, String password) {
    requireNonNull(host, "host must not be null");

    var config = DefaultJedisClientConfig.builder()
                                         .password(password == null || password.isEmpty() ? null : password)
                                         .build();
    return new RedisResultStore(new JedisPooled(new HostAndPort(host, port), config));
  }

  @Override
  public Map<String, String> fieldsOf(String key) {
    requireNonNull(key, "key must not be null");

    try {
      var fields = jedis.hgetAll(key);
      return fields == null ? Map.of() : fields;
    } catch (JedisException e) {
      throw new TransientResultException("Failed to read result key " + key, e);
    }
  }

  @Override
  public void close() {
    jedis.close();
  }
}
