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
 * One entry of a playlist, as returned by {@code playlistItems.list}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistItem(String kind, String etag, String id, Snippet snippet,
    @Nullable ContentDetails contentDetails) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Snippet(String publishedAt, String channelId, String title, String description,
      @Nullable Thumbnails thumbnails, String channelTitle, String playlistId, int position, ResourceId resourceId,
      @Nullable String videoOwnerChannelTitle, @Nullable String videoOwnerChannelId) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ResourceId(String kind, String videoId) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ContentDetails(String videoId, @Nullable String videoPublishedAt) {
  }
}
