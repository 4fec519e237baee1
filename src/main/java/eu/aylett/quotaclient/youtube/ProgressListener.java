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

import java.util.List;

/**
 * Told about each page as a paginated fetch progresses.
 */
@FunctionalInterface
public interface ProgressListener<T> {
  /**
   * @param itemsSoFar
   *          every item fetched so far, in order; an immutable snapshot
   * @param totalResults
   *          the server-reported total across all pages
   */
  void onProgress(List<T> itemsSoFar, int totalResults);
}
