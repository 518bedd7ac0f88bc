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
package io.infinidream.batch.materialize;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * {@link ArtifactTransfer} streaming artifacts over HTTP(S).
 * <p>
 * The response body is copied to the target file as it arrives; artifacts are never held in
 * memory as a whole.
 * </p>
 */
public final class HttpArtifactTransfer implements ArtifactTransfer {
  private static final Logger logger = LoggerFactory.getLogger(HttpArtifactTransfer.class);

  private final OkHttpClient client;

  public HttpArtifactTransfer(OkHttpClient client) {
    this.client = requireNonNull(client, "client must not be null");
  }

  /**
   * Creates a transfer with timeouts suited to large video artifacts.
   *
   * @return the transfer
   */
  public static HttpArtifactTransfer create() {
    return new HttpArtifactTransfer(new OkHttpClient.Builder()
      .connectTimeout(Duration.ofSeconds(30))
      .readTimeout(Duration.ofMinutes(5))
      .build());
  }

  @Override
  public void download(String reference, Path target) throws IOException {
    requireNonNull(reference, "reference must not be null");
    requireNonNull(target, "target must not be null");

    var url = HttpUrl.parse(reference.strip());
    if (url == null) throw new IOException("Not an HTTP(S) artifact reference: " + reference);

    var request = new Request.Builder().url(url).get().build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new IOException("Download of " + url.encodedPath() + " failed with HTTP " + response.code());
      }
      var body = response.body();
      if (body == null) throw new IOException("Download of " + url.encodedPath() + " returned no body");

      try (var in = body.byteStream()) {
        long bytes = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        logger.debug("Downloaded {} bytes from {} to {}", bytes, url.host(), target);
      }
    }
  }
}
