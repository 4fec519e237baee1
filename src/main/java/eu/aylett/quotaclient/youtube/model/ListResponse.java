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

package eu.aylett.quotaclient.youtube.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import eu.aylett.quotaclient.youtube.Page;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A page of any {@code *.list} endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListResponse<T>(String kind, String etag, @Nullable String nextPageToken,
    @Nullable String prevPageToken, @Nullable PageInfo pageInfo, List<T> items) implements Page<T> {

  public ListResponse {
    // The API leaves out "items" when there are none
    items = List.copyOf(Objects.requireNonNullElse(items, List.<T>of()));
  }

  /**
   * The total the server reports across all pages, or the size of this page if
   * it didn't say.
   */
  @Override
  public int totalResults() {
    return pageInfo == null ? items.size() : pageInfo.totalResults();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PageInfo(int totalResults, int resultsPerPage) {
  }
}
