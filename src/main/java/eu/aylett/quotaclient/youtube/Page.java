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

import java.util.List;

/**
 * One page of a paginated listing.
 */
public interface Page<T> {
  /**
   * This page's items, in server order.
   */
  List<T> items();

  /**
   * The cursor for the following page, or null on the last page.
   */
  @Nullable
  String nextPageToken();

  /**
   * The server's count of items across every page.
   */
  int totalResults();
}
