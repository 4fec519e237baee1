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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.aylett.quotaclient.ThrottleConfig;
import eu.aylett.quotaclient.ThrottleQueue;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Throttled, typed GET access to the YouTube Data API.
 * <p>
 * Every request is charged its {@link QuotaCosts quota cost} and admitted
 * through this client's {@link ThrottleQueue}. Quota exhaustion always
 * surfaces as {@link QuotaExceededException}; every other failure propagates
 * as the transport raised it.
 * </p>
 */
public class YouTubeApiClient {
  private static final Logger LOG = LoggerFactory.getLogger(YouTubeApiClient.class);

  private final ApiTransport transport;
  private final ThrottleQueue throttle;
  private final ObjectMapper objectMapper;

  public YouTubeApiClient(ApiTransport transport, ThrottleQueue throttle, ObjectMapper objectMapper) {
    this.transport = transport;
    this.throttle = throttle;
    this.objectMapper = objectMapper;
  }

  /**
   * A client for the public API endpoint with its own throttle queue.
   */
  public static YouTubeApiClient create(CredentialProvider credentials, ThrottleConfig config) {
    var objectMapper = new ObjectMapper();
    return new YouTubeApiClient(new HttpClientTransport(credentials, objectMapper), new ThrottleQueue(config),
        objectMapper);
  }

  public <T> T get(String path, Map<String, ? extends @Nullable Object> params, Class<T> type) {
    return get(path, params, objectMapper.constructType(type));
  }

  public <T> T get(String path, Map<String, ? extends @Nullable Object> params, TypeReference<T> type) {
    return get(path, params, objectMapper.constructType(type));
  }

  private <T> T get(String path, Map<String, ? extends @Nullable Object> params, JavaType type) {
    var cost = QuotaCosts.costOf(path);
    LOG.debug("GET {} costing {} quota points", path, cost);
    try {
      return throttle.checkedExecute(cost, () -> this.<T>bind(path, transport.get(path, params), type));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientNetworkException("Interrupted waiting to send GET " + path, e);
    } catch (Exception e) {
      throw QuotaErrors.handleQuotaError(e);
    }
  }

  private <T> T bind(String path, JsonNode body, JavaType type) {
    try {
      T value = objectMapper.treeToValue(body, type);
      if (value == null) {
        throw new MalformedResponseException("Response from " + path + " was null", null);
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Response from " + path + " does not match " + type, e);
    }
  }

  /**
   * The queue this client admits its requests through.
   */
  public ThrottleQueue throttle() {
    return throttle;
  }
}
