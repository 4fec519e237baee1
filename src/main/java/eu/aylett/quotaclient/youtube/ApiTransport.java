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

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Performs one unthrottled GET against the API.
 */
public interface ApiTransport {
  /**
   * @param path
   *          the endpoint path relative to the API root, e.g.
   *          {@code /playlists}
   * @param params
   *          query parameters; null values are left out
   * @return the parsed response body
   * @throws ApiHttpException
   *           on a non-success status ({@link AuthFailureException} for
   *           credential problems)
   * @throws TransientNetworkException
   *           if no response was received
   * @throws MalformedResponseException
   *           if the response body isn't JSON
   */
  JsonNode get(String path, Map<String, ? extends @Nullable Object> params);
}
