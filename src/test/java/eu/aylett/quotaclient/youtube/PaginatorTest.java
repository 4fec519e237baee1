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

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PaginatorTest {
  record TestPage(List<String> items, @Nullable String nextPageToken, int totalResults) implements Page<String> {
  }

  record Progress(int size, int total) {
  }

  private static List<String> items(int from, int count) {
    return IntStream.range(from, from + count).mapToObj(i -> "item-" + i).toList();
  }

  @Test
  void followsCursorsToTheEnd() {
    var requestedTokens = new ArrayList<@Nullable String>();
    var progress = new ArrayList<Progress>();

    var all = Paginator.<String>fetchAll(token -> {
      requestedTokens.add(token);
      if (token == null) {
        return new TestPage(items(0, 50), "page-2", 130);
      }
      if (token.equals("page-2")) {
        return new TestPage(items(50, 50), "page-3", 130);
      }
      return new TestPage(items(100, 30), null, 130);
    }, (soFar, total) -> progress.add(new Progress(soFar.size(), total)));

    assertThat(all, equalTo(items(0, 130)));
    assertThat(requestedTokens, contains(nullValue(), equalTo("page-2"), equalTo("page-3")));
    assertThat(progress, contains(new Progress(50, 130), new Progress(100, 130), new Progress(130, 130)));
  }

  @Test
  void progressSeesItemsInOrder() {
    var snapshots = new ArrayList<List<String>>();
    Paginator.<String>fetchAll(token -> token == null ? new TestPage(List.of("a", "b"), "next", 3)
        : new TestPage(List.of("c"), null, 3), (soFar, total) -> snapshots.add(soFar));

    assertThat(snapshots, contains(List.of("a", "b"), List.of("a", "b", "c")));
  }

  @Test
  void emptyCursorEndsTheListing() {
    var all = Paginator.<String>fetchAll(token -> new TestPage(List.of("only"), "", 1));
    assertThat(all, contains("only"));
  }

  @Test
  void emptyListing() {
    var all = Paginator.<String>fetchAll(token -> new TestPage(List.of(), null, 0));
    assertThat(all, equalTo(List.of()));
  }

  @Test
  void failureAbortsWithoutPartialResults() {
    var failure = new ApiHttpException(500, List.of("backendError"), null);
    var progress = new ArrayList<Progress>();

    var thrown = assertThrows(ApiHttpException.class, () -> Paginator.<String>fetchAll(token -> {
      if (token == null) {
        return new TestPage(items(0, 50), "page-2", 130);
      }
      throw failure;
    }, (soFar, total) -> progress.add(new Progress(soFar.size(), total))));

    assertSame(failure, thrown);
    assertThat(progress, contains(new Progress(50, 130)));
  }
}
