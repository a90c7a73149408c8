package com.example.authgateway.adapter.datastore;

import com.example.authgateway.exception.ForbiddenException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgREST-style datastore client ({@code /rest/v1/<table>}).
 * Instances are cheap and bound to a single credential; the shared OkHttp client carries
 * the connection pool.
 */
@Slf4j
public class RestDataClient implements DataClient {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final HttpUrl baseUrl;
  private final String apiKey;
  private final DataCredential credential;
  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;

  public RestDataClient(HttpUrl baseUrl,
                        String apiKey,
                        DataCredential credential,
                        OkHttpClient httpClient,
                        ObjectMapper objectMapper) {
    this.baseUrl = baseUrl;
    this.apiKey = apiKey;
    this.credential = credential;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public <T> Optional<T> selectOne(String table, Map<String, String> filters, Class<T> type) {
    List<T> rows = select(table, filters, null, 1, type);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public <T> List<T> select(String table, Map<String, String> filters, String order, int limit,
                            Class<T> type) {
    HttpUrl.Builder url = tableUrl(table).addQueryParameter("select", "*");
    filters.forEach((column, value) -> url.addQueryParameter(column, "eq." + value));
    if (order != null) {
      url.addQueryParameter("order", order);
    }
    if (limit > 0) {
      url.addQueryParameter("limit", String.valueOf(limit));
    }

    Request request = baseRequest(url.build()).get().build();

    try (Response response = httpClient.newCall(request).execute()) {
      checkStatus(response, table);
      ResponseBody body = response.body();
      if (body == null) {
        return List.of();
      }
      CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
      return objectMapper.readValue(body.string(), listType);
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Datastore unreachable reading " + table, e);
    }
  }

  @Override
  public void insert(String table, Object row) {
    Request request;
    try {
      request = baseRequest(tableUrl(table).build())
          .header("Prefer", "return=minimal")
          .post(RequestBody.create(objectMapper.writeValueAsBytes(row), JSON))
          .build();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to serialize row for " + table, e);
    }

    try (Response response = httpClient.newCall(request).execute()) {
      checkStatus(response, table);
    } catch (IOException e) {
      throw new UpstreamUnavailableException("Datastore unreachable writing " + table, e);
    }
  }

  @Override
  public DataCredential credential() {
    return credential;
  }

  private HttpUrl.Builder tableUrl(String table) {
    return baseUrl.newBuilder().addPathSegments("rest/v1").addPathSegment(table);
  }

  private Request.Builder baseRequest(HttpUrl url) {
    return new Request.Builder()
        .url(url)
        .header("apikey", apiKey)
        .header("Authorization", "Bearer " + credential.bearerToken())
        .header("Accept", "application/json");
  }

  private void checkStatus(Response response, String table) {
    int code = response.code();
    if (response.isSuccessful()) {
      return;
    }
    if (code == 401) {
      throw new UnauthenticatedException("Datastore rejected the credential");
    }
    if (code == 403) {
      throw new ForbiddenException("Datastore denied access to " + table);
    }
    log.error("Datastore request on {} failed with status {} ({})", table, code, credential.kind());
    throw new UpstreamUnavailableException("Datastore request failed, status: " + code);
  }
}
