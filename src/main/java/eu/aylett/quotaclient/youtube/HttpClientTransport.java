/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.quotaclient.youtube;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.aylett.quotaclient.youtube.model.ErrorResponse;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link ApiTransport} over the JDK HTTP client.
 * <p>
 * This is where raw failures become typed: every non-success response is turned
 * into an {@link ApiHttpException} (or {@link AuthFailureException}), I/O
 * problems into {@link TransientNetworkException}, and unreadable bodies into
 * {@link MalformedResponseException}.
 * </p>
 */
public class HttpClientTransport implements ApiTransport {
  private static final Logger LOG = LoggerFactory.getLogger(HttpClientTransport.class);

  public static final URI DEFAULT_BASE_URI = URI.create("https://www.googleapis.com/youtube/v3");
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private static final int UNAUTHORIZED = 401;
  private static final int FORBIDDEN = 403;

  private final String baseUri;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final CredentialProvider credentials;
  private final Duration requestTimeout;

  /**
   * @param baseUri
   *          the API root that endpoint paths are appended to
   * @param httpClient
   *          the client to send requests with
   * @param objectMapper
   *          used to parse response bodies
   * @param credentials
   *          source of the bearer token, told when the API rejects it
   * @param requestTimeout
   *          how long to wait for each response
   */
  public HttpClientTransport(URI baseUri, HttpClient httpClient, ObjectMapper objectMapper,
      CredentialProvider credentials, Duration requestTimeout) {
    var base = baseUri.toString();
    this.baseUri = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.credentials = credentials;
    this.requestTimeout = requestTimeout;
  }

  /**
   * Transport against the public YouTube Data API v3 endpoint.
   */
  public HttpClientTransport(CredentialProvider credentials, ObjectMapper objectMapper) {
    this(DEFAULT_BASE_URI, HttpClient.newHttpClient(), objectMapper, credentials, DEFAULT_REQUEST_TIMEOUT);
  }

  @Override
  public JsonNode get(String path, Map<String, ? extends @Nullable Object> params) {
    var builder = HttpRequest.newBuilder(buildUri(path, params))
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .GET();
    var token = credentials.accessToken();
    if (token != null && !token.isEmpty()) {
      builder.header("Authorization", "Bearer " + token);
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TransientNetworkException("GET " + path + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientNetworkException("GET " + path + " was interrupted", e);
    }

    var status = response.statusCode();
    if (status >= 200 && status < 300) {
      return parseBody(path, response.body());
    }
    throw failureFor(status, response.body());
  }

  URI buildUri(String path, Map<String, ? extends @Nullable Object> params) {
    var query = new StringJoiner("&");
    params.forEach((name, value) -> {
      if (value != null) {
        query.add(encode(name) + "=" + encode(value.toString()));
      }
    });
    var uri = baseUri + (path.startsWith("/") ? path : "/" + path);
    return URI.create(query.length() == 0 ? uri : uri + "?" + query);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private JsonNode parseBody(String path, @Nullable String body) {
    try {
      var tree = body == null ? null : objectMapper.readTree(body);
      if (tree == null || tree.isMissingNode()) {
        throw new MalformedResponseException("Empty response body from " + path, null);
      }
      return tree;
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Response from " + path + " is not valid JSON", e);
    }
  }

  private ApiHttpException failureFor(int status, @Nullable String body) {
    var error = parseError(body);
    var reasons = error.reasons();
    var firstReason = reasons.isEmpty() ? null : reasons.get(0);

    var credentialRejected = status == UNAUTHORIZED
        || (status == FORBIDDEN && !QuotaErrors.QUOTA_EXCEEDED_REASON.equals(firstReason));
    if (credentialRejected) {
      var failure = new AuthFailureException(status, reasons, error.message());
      LOG.warn("YouTube API rejected the credential: HTTP {} {}", status, reasons);
      credentials.onCredentialRejected(failure);
      return failure;
    }
    return new ApiHttpException(status, reasons, error.message());
  }

  private ErrorResponse parseError(@Nullable String body) {
    if (body == null || body.isBlank()) {
      return new ErrorResponse(null);
    }
    try {
      var parsed = objectMapper.readValue(body, ErrorResponse.class);
      return parsed == null ? new ErrorResponse(null) : parsed;
    } catch (JsonProcessingException e) {
      LOG.debug("Error response body is not the documented JSON shape", e);
      return new ErrorResponse(null);
    }
  }
}
