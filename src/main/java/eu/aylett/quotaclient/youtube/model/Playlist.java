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
import org.jspecify.annotations.Nullable;

/**
 * A playlist resource, as returned by {@code playlists.list}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Playlist(String kind, String etag, String id, Snippet snippet, @Nullable ContentDetails contentDetails) {

  /**
   * The item count the API reports, or zero if it wasn't requested.
   */
  public int itemCount() {
    return contentDetails == null ? 0 : contentDetails.itemCount();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Snippet(String publishedAt, String channelId, String title, String description,
      @Nullable Thumbnails thumbnails, String channelTitle, @Nullable Localized localized) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Localized(String title, String description) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ContentDetails(int itemCount) {
  }
}
