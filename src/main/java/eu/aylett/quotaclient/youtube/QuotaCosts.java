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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Quota costs of the YouTube Data API v3 read endpoints.
 *
 * @see <a href="https://developers.google.com/youtube/v3/determine_quota_cost">YouTube
 *      Data API quota costs</a>
 */
public enum QuotaCosts {
  PLAYLISTS_LIST("/playlists", 1),
  PLAYLIST_ITEMS_LIST("/playlistItems", 1),
  CHANNELS_LIST("/channels", 1),
  VIDEOS_LIST("/videos", 1),
  SUBSCRIPTIONS_LIST("/subscriptions", 1),
  CAPTIONS_LIST("/captions", 50),
  SEARCH_LIST("/search", 100);

  /**
   * Charged for any path we don't recognise. Never zero, so unknown calls are
   * still throttled.
   */
  public static final int DEFAULT_COST = 1;

  // Longest first, so a child resource wins over a parent whose name it contains
  private static final List<QuotaCosts> MOST_SPECIFIC_FIRST = Arrays.stream(values())
      .sorted(Comparator.comparingInt((QuotaCosts c) -> c.path.length()).reversed())
      .toList();

  private final String path;
  private final int cost;

  QuotaCosts(String path, int cost) {
    this.path = path;
    this.cost = cost;
  }

  public String path() {
    return path;
  }

  public int cost() {
    return cost;
  }

  /**
   * The quota cost of a request to {@code endpointPath}, e.g.
   * {@code /playlistItems}.
   */
  public static int costOf(String endpointPath) {
    return endpointOf(endpointPath).map(QuotaCosts::cost).orElse(DEFAULT_COST);
  }

  /**
   * The endpoint {@code endpointPath} addresses, if it is one we know.
   */
  public static Optional<QuotaCosts> endpointOf(String endpointPath) {
    for (var candidate : MOST_SPECIFIC_FIRST) {
      if (endpointPath.contains(candidate.path)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
