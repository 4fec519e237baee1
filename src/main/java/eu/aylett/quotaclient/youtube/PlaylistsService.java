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
import eu.aylett.quotaclient.youtube.model.Playlist;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * The signed-in user's playlists.
 */
public class PlaylistsService {
  static final String PATH = "/playlists";
  static final String PARTS = "snippet,contentDetails";
  static final int MAX_RESULTS = 50;

  private static final TypeReference<ListResponse<Playlist>> PAGE_TYPE = new TypeReference<>() {
  };

  private final YouTubeApiClient client;

  public PlaylistsService(YouTubeApiClient client) {
    this.client = client;
  }

  /**
   * One page of the user's own playlists.
   *
   * @param pageToken
   *          the cursor from the previous page, or null for the first
   */
  public ListResponse<Playlist> getUserPlaylists(@Nullable String pageToken) {
    var params = new LinkedHashMap<String, @Nullable Object>();
    params.put("part", PARTS);
    params.put("mine", true);
    params.put("maxResults", MAX_RESULTS);
    params.put("pageToken", pageToken);
    return client.get(PATH, params, PAGE_TYPE);
  }

  /**
   * Every playlist the user owns, across all pages.
   */
  public List<Playlist> getAllUserPlaylists() {
    return Paginator.fetchAll(this::getUserPlaylists);
  }

  /**
   * A single playlist, or empty if no playlist has that id.
   */
  public Optional<Playlist> getPlaylistById(String playlistId) {
    var params = new LinkedHashMap<String, @Nullable Object>();
    params.put("part", PARTS);
    params.put("id", playlistId);
    var response = client.get(PATH, params, PAGE_TYPE);
    return response.items().stream().findFirst();
  }
}
