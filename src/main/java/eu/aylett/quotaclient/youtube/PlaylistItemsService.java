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

import com.fasterxml.jackson.core.type.TypeReference;
import eu.aylett.quotaclient.youtube.model.ListResponse;
import eu.aylett.quotaclient.youtube.model.PlaylistItem;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * The contents of a playlist.
 */
public class PlaylistItemsService {
  static final String PATH = "/playlistItems";
  static final String PARTS = "snippet,contentDetails";
  static final int MAX_RESULTS = 50;

  private static final TypeReference<ListResponse<PlaylistItem>> PAGE_TYPE = new TypeReference<>() {
  };

  private final YouTubeApiClient client;

  public PlaylistItemsService(YouTubeApiClient client) {
    this.client = client;
  }

  /**
   * One page of a playlist's items.
   *
   * @param pageToken
   *          the cursor from the previous page, or null for the first
   */
  public ListResponse<PlaylistItem> getPlaylistItemsPage(String playlistId, @Nullable String pageToken) {
    var params = new LinkedHashMap<String, @Nullable Object>();
    params.put("part", PARTS);
    params.put("playlistId", playlistId);
    params.put("maxResults", MAX_RESULTS);
    params.put("pageToken", pageToken);
    return client.get(PATH, params, PAGE_TYPE);
  }

  /**
   * Every item in the playlist, in playlist order.
   * <p>
   * If any page fails, so does the whole fetch: use {@code onProgress} to show
   * items while they load, but only the return value is complete.
   * </p>
   *
   * @param onProgress
   *          called after each page with the items so far and the reported
   *          total, or null
   * @throws QuotaExceededException
   *           if the daily quota runs out part way through
   */
  public List<PlaylistItem> getAllPlaylistItems(String playlistId,
      @Nullable ProgressListener<PlaylistItem> onProgress) {
    return Paginator.fetchAll(pageToken -> getPlaylistItemsPage(playlistId, pageToken), onProgress);
  }
}
