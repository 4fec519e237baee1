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

import java.util.ArrayList;
import java.util.List;

/**
 * Follows page cursors until a listing is exhausted.
 */
public final class Paginator {
  private Paginator() {
  }

  /**
   * Fetches one page given the cursor from the previous one (null for the
   * first page).
   */
  @FunctionalInterface
  public interface PageSource<T> {
    Page<T> fetch(@Nullable String pageToken);
  }

  /**
   * Fetch every page and return all their items in order.
   * <p>
   * Any failure stops the loop and propagates unchanged; the items already
   * fetched are dropped.
   * </p>
   *
   * @param onProgress
   *          called after each page with everything fetched so far, or null
   */
  public static <T> List<T> fetchAll(PageSource<T> source, @Nullable ProgressListener<T> onProgress) {
    var items = new ArrayList<T>();
    String pageToken = null;
    do {
      var page = source.fetch(pageToken);
      items.addAll(page.items());
      pageToken = page.nextPageToken();
      if (onProgress != null) {
        onProgress.onProgress(List.copyOf(items), page.totalResults());
      }
    } while (pageToken != null && !pageToken.isEmpty());
    return items;
  }

  public static <T> List<T> fetchAll(PageSource<T> source) {
    return fetchAll(source, null);
  }
}
