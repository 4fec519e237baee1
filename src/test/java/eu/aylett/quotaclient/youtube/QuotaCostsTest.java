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

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;

class QuotaCostsTest {
  @Test
  void knownEndpoints() {
    assertThat(QuotaCosts.costOf("/playlists"), equalTo(1));
    assertThat(QuotaCosts.costOf("/playlistItems"), equalTo(1));
    assertThat(QuotaCosts.costOf("/channels"), equalTo(1));
    assertThat(QuotaCosts.costOf("/captions"), equalTo(50));
    assertThat(QuotaCosts.costOf("/search"), equalTo(100));
  }

  @Test
  void fullUrlsResolveByTheirPath() {
    assertThat(QuotaCosts.costOf("https://www.googleapis.com/youtube/v3/search?q=cats"), equalTo(100));
  }

  @Test
  void childResourceWinsOverParent() {
    assertThat(QuotaCosts.endpointOf("/playlistItems"), equalTo(Optional.of(QuotaCosts.PLAYLIST_ITEMS_LIST)));
    assertThat(QuotaCosts.endpointOf("/playlists/PL123/playlistItems"),
        equalTo(Optional.of(QuotaCosts.PLAYLIST_ITEMS_LIST)));
    assertThat(QuotaCosts.endpointOf("/playlists?id=PL123"), equalTo(Optional.of(QuotaCosts.PLAYLISTS_LIST)));
  }

  @Test
  void unknownEndpointsCostTheNonZeroDefault() {
    assertThat(QuotaCosts.endpointOf("/activities"), equalTo(Optional.empty()));
    assertThat(QuotaCosts.costOf("/activities"), equalTo(QuotaCosts.DEFAULT_COST));
    assertThat(QuotaCosts.costOf(""), greaterThan(0));
  }

  @Test
  void everyEndpointCostsSomething() {
    for (var endpoint : QuotaCosts.values()) {
      assertThat(endpoint.name(), endpoint.cost(), greaterThan(0));
      assertThat(QuotaCosts.costOf(endpoint.path()), equalTo(endpoint.cost()));
    }
  }
}
