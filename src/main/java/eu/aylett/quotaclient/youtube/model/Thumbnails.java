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

package eu.aylett.quotaclient.youtube.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Thumbnails(@JsonProperty("default") @Nullable Thumbnail defaultThumbnail, @Nullable Thumbnail medium,
    @Nullable Thumbnail high, @Nullable Thumbnail standard, @Nullable Thumbnail maxres) {

  /**
   * The largest thumbnail available, if there is any.
   */
  public @Nullable Thumbnail best() {
    if (maxres != null) {
      return maxres;
    }
    if (standard != null) {
      return standard;
    }
    if (high != null) {
      return high;
    }
    if (medium != null) {
      return medium;
    }
    return defaultThumbnail;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Thumbnail(String url, int width, int height) {
  }
}
