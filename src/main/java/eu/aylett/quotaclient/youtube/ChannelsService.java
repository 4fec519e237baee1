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
import eu.aylett.quotaclient.youtube.model.Channel;
import eu.aylett.quotaclient.youtube.model.ListResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class ChannelsService {
  private static final Logger LOG = LoggerFactory.getLogger(ChannelsService.class);

  static final String PATH = "/channels";

  private static final TypeReference<ListResponse<Channel>> PAGE_TYPE = new TypeReference<>() {
  };

  private final YouTubeApiClient client;

  public ChannelsService(YouTubeApiClient client) {
    this.client = client;
  }

  /**
   * Whether the signed-in user has a YouTube channel. Users without one can't
   * own playlists.
   * <p>
   * Failures other than quota exhaustion are logged and answered with false.
   * </p>
   *
   * @throws QuotaExceededException
   *           if the daily quota is spent
   */
  public boolean hasChannel() {
    try {
      var response = client.get(PATH, Map.of("part", "snippet", "mine", true), PAGE_TYPE);
      return !response.items().isEmpty();
    } catch (YouTubeApiException e) {
      if (QuotaErrors.isQuotaExceeded(e)) {
        throw e;
      }
      LOG.warn("Channel lookup failed, assuming the user has no channel", e);
      return false;
    }
  }
}
