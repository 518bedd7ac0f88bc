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
package io.infinidream.batch.collection;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.infinidream.batch.exception.CollectionServiceException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * {@link CollectionService} talking to the backend REST API over HTTP.
 * <p>
 * Every request carries the API key as a bearer token. Responses are JSON documents whose
 * payload is either at the top level or wrapped in a {@code data} object; both forms are
 * accepted. Collection entries that are not playable items are skipped when listing.
 * </p>
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code POST /v1/playlist}: create a collection</li>
 *   <li>{@code GET /v1/playlist/{uuid}}: fetch a collection</li>
 *   <li>{@code GET /v1/playlist/{uuid}/items?take=&skip=}: list entries</li>
 *   <li>{@code POST /v1/playlist/{uuid}/file}: upload a file as a new item (multipart)</li>
 *   <li>{@code PUT /v1/playlist/{uuid}/order}: reorder entries</li>
 *   <li>{@code GET|PUT /v1/dream/{uuid}}: fetch or update an item</li>
 *   <li>{@code POST /v1/keyframe}: register a keyframe (multipart)</li>
 * </ul>
 */
public final class HttpCollectionService implements CollectionService {
  private static final Logger logger = LoggerFactory.getLogger(HttpCollectionService.class);

  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
  private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

  private final HttpUrl baseUrl;
  private final String apiKey;
  private final OkHttpClient client;
  private final Gson gson = new Gson();

  /**
   * Creates a service for the given backend.
   *
   * @param baseUrl the backend base URL, e.g. {@code https://api.example.com}
   * @param apiKey  the API key sent as bearer token
   * @param client  the HTTP client to use
   * @throws IllegalArgumentException if {@code baseUrl} is not a valid HTTP URL
   */
  public HttpCollectionService(String baseUrl, String apiKey, OkHttpClient client) {
    requireNonNull(baseUrl, "baseUrl must not be null");
    var parsed = HttpUrl.parse(baseUrl);
    if (parsed == null) throw new IllegalArgumentException("Invalid backend URL: " + baseUrl);

    this.baseUrl = parsed;
    this.apiKey = requireNonNull(apiKey, "apiKey must not be null");
    this.client = requireNonNull(client, "client must not be null");
  }

  /**
   * Creates a service with an HTTP client configured for large uploads.
   *
   * @param baseUrl the backend base URL
   * @param apiKey  the API key sent as bearer token
   * @return the service
   */
  public static HttpCollectionService create(String baseUrl, String apiKey) {
    var client = new OkHttpClient.Builder()
      .connectTimeout(Duration.ofSeconds(30))
      .readTimeout(Duration.ofMinutes(5))
      .writeTimeout(Duration.ofMinutes(5))
      .build();
    return new HttpCollectionService(baseUrl, apiKey, client);
  }

  @Override
  public Collection createCollection(NewCollection definition) {
    requireNonNull(definition, "definition must not be null");

    var body = new LinkedHashMap<String, Object>();
    body.put("name", definition.name());
    if (definition.description() != null) body.put("description", definition.description());
    body.put("nsfw", definition.nsfw());

    var response = execute(request(url("v1", "playlist")).post(jsonBody(body)).build());
    return toCollection(unwrap(response, "playlist"));
  }

  @Override
  public Collection fetchCollection(String collectionUuid) {
    requireNonNull(collectionUuid, "collectionUuid must not be null");

    var response = execute(request(url("v1", "playlist", collectionUuid)).get().build());
    return toCollection(unwrap(response, "playlist"));
  }

  @Override
  public ItemPage listItems(String collectionUuid, int take, int skip) {
    requireNonNull(collectionUuid, "collectionUuid must not be null");

    var url = url("v1", "playlist", collectionUuid, "items").newBuilder()
                                                            .addQueryParameter("take", Integer.toString(take))
                                                            .addQueryParameter("skip", Integer.toString(skip))
                                                            .build();
    var data = unwrap(execute(request(url).get().build()), null);

    var items = new ArrayList<CollectionItem>();
    var entries = data.has("items") && data.get("items").isJsonArray() ? data.getAsJsonArray("items") : new JsonArray();
    for (JsonElement entry : entries) {
      if (!entry.isJsonObject()) continue;
      var object = entry.getAsJsonObject();
      if (!"dream".equals(string(object, "type")) || !object.has("dreamItem") || !object.get("dreamItem").isJsonObject()) {
        continue;
      }
      items.add(toItem(string(object, "id"), object.getAsJsonObject("dreamItem")));
    }

    int totalCount = data.has("totalCount") ? data.get("totalCount").getAsInt() : entries.size();
    return new ItemPage(items, entries.size(), totalCount);
  }

  @Override
  public CollectionItem addFile(String collectionUuid, Path file, String displayName) {
    requireNonNull(collectionUuid, "collectionUuid must not be null");
    requireNonNull(file, "file must not be null");

    var multipart = new MultipartBody.Builder()
      .setType(MultipartBody.FORM)
      .addFormDataPart("file", file.getFileName().toString(), RequestBody.create(file.toFile(), OCTET_STREAM));
    if (displayName != null && !displayName.isBlank()) multipart.addFormDataPart("name", displayName);

    var response = execute(request(url("v1", "playlist", collectionUuid, "file")).post(multipart.build()).build());
    return toItem(null, unwrap(response, "dream"));
  }

  @Override
  public CollectionItem fetchItem(String itemUuid) {
    requireNonNull(itemUuid, "itemUuid must not be null");

    var response = execute(request(url("v1", "dream", itemUuid)).get().build());
    return toItem(null, unwrap(response, "dream"));
  }

  @Override
  public void updateItemDescription(String itemUuid, String description) {
    requireNonNull(itemUuid, "itemUuid must not be null");

    execute(request(url("v1", "dream", itemUuid)).put(jsonBody(Map.of("description", description == null ? "" : description))).build());
  }

  @Override
  public String addKeyframe(Path file, String name) {
    requireNonNull(file, "file must not be null");

    var multipart = new MultipartBody.Builder()
      .setType(MultipartBody.FORM)
      .addFormDataPart("file", file.getFileName().toString(), RequestBody.create(file.toFile(), OCTET_STREAM))
      .addFormDataPart("name", name == null ? file.getFileName().toString() : name)
      .build();

    var keyframe = unwrap(execute(request(url("v1", "keyframe")).post(multipart).build()), "keyframe");
    var uuid = string(keyframe, "uuid");
    if (uuid == null) throw new CollectionServiceException("Keyframe response has no uuid", 0);
    return uuid;
  }

  @Override
  public void linkKeyframe(String itemUuid, String keyframeUuid) {
    requireNonNull(itemUuid, "itemUuid must not be null");
    requireNonNull(keyframeUuid, "keyframeUuid must not be null");

    execute(request(url("v1", "dream", itemUuid)).put(jsonBody(Map.of("startKeyframe", keyframeUuid))).build());
  }

  @Override
  public void reorderItems(String collectionUuid, List<String> entryIds) {
    requireNonNull(collectionUuid, "collectionUuid must not be null");
    requireNonNull(entryIds, "entryIds must not be null");

    var order = new ArrayList<Map<String, Object>>();
    for (int i = 0; i < entryIds.size(); i++) {
      var entry = new LinkedHashMap<String, Object>();
      entry.put("id", entryIds.get(i));
      entry.put("order", i);
      order.add(entry);
    }
    execute(request(url("v1", "playlist", collectionUuid, "order")).put(jsonBody(Map.of("order", order))).build());
  }

  private HttpUrl url(String... segments) {
    var builder = baseUrl.newBuilder();
    for (var segment : segments) builder.addPathSegment(segment);
    return builder.build();
  }

  private Request.Builder request(HttpUrl url) {
    return new Request.Builder().url(url)
                                .header("Authorization", "Bearer " + apiKey)
                                .header("Accept", "application/json");
  }

  private RequestBody jsonBody(Object body) {
    return RequestBody.create(gson.toJson(body), JSON);
  }

  private JsonObject execute(Request request) {
    logger.debug("{} {}", request.method(), request.url());

    try (Response response = client.newCall(request).execute()) {
      var body = response.body() == null ? "" : response.body().string();
      if (!response.isSuccessful()) {
        throw new CollectionServiceException(
          request.method() + " " + request.url().encodedPath() + " failed with HTTP " + response.code() + ": " + body,
          response.code());
      }
      if (body.isBlank()) return new JsonObject();

      var element = JsonParser.parseString(body);
      return element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
    } catch (IOException e) {
      throw new CollectionServiceException(request.method() + " " + request.url().encodedPath() + " failed", e);
    } catch (JsonParseException e) {
      throw new CollectionServiceException("Malformed response from " + request.url().encodedPath(), e);
    }
  }

  private static JsonObject unwrap(JsonObject response, String key) {
    var data = response.has("data") && response.get("data").isJsonObject() ? response.getAsJsonObject("data") : response;
    if (key != null && data.has(key) && data.get(key).isJsonObject()) return data.getAsJsonObject(key);
    return data;
  }

  private static Collection toCollection(JsonObject object) {
    var uuid = string(object, "uuid");
    if (uuid == null) throw new CollectionServiceException("Collection response has no uuid", 0);

    return new Collection(
      uuid,
      string(object, "name"),
      string(object, "description"),
      object.has("nsfw") && !object.get("nsfw").isJsonNull() && object.get("nsfw").getAsBoolean()
    );
  }

  private static CollectionItem toItem(String entryId, JsonObject object) {
    var uuid = string(object, "uuid");
    if (uuid == null) throw new CollectionServiceException("Item response has no uuid", 0);

    var video = string(object, "video");
    return new CollectionItem(
      entryId,
      uuid,
      string(object, "name"),
      string(object, "description"),
      video != null ? video : string(object, "original_video")
    );
  }

  private static String string(JsonObject object, String field) {
    var value = object.get(field);
    if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) return null;
    return value.getAsString();
  }
}
