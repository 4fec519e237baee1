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
 * The API answered with a non-success HTTP status.
 */
public class ApiHttpException extends YouTubeApiException {
  /**
   * The HTTP status code of the response.
   */
  public final int status;
  /**
   * The {@code reason} of each entry in the error body's {@code error.errors},
   * in the order the server listed them. Empty if the body had none or could
   * not be parsed.
   */
  public final List<String> reasons;

  /**
   * @param status
   *          the HTTP status code
   * @param reasons
   *          the reported error reasons, possibly empty
   * @param serverMessage
   *          the error body's {@code error.message}, if any
   */
  public ApiHttpException(int status, List<String> reasons, @Nullable String serverMessage) {
    super("YouTube API request failed with HTTP " + status + (serverMessage == null ? "" : ": " + serverMessage)
        + (reasons.isEmpty() ? "" : " " + reasons));
    this.status = status;
    this.reasons = List.copyOf(reasons);
  }

  /**
   * The first reported reason, which is the one the API documents as the cause.
   */
  public @Nullable String firstReason() {
    return reasons.isEmpty() ? null : reasons.get(0);
  }
}
