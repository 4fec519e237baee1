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

/**
 * The daily quota is spent; no call will succeed until it resets.
 */
public class QuotaExceededException extends YouTubeApiException {
  public static final String DEFAULT_MESSAGE = "YouTube API quota exceeded. Please try again tomorrow.";

  public QuotaExceededException(String message) {
    super(message);
  }

  public QuotaExceededException() {
    this(DEFAULT_MESSAGE);
  }
}
