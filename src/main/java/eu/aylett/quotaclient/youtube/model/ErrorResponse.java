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
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The body of a non-success response: {@code {"error": {"code", "message",
 * "errors": [{"reason", ...}]}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(@Nullable Body error) {

  /**
   * The {@code reason} of each reported error, skipping entries without one.
   */
  public List<String> reasons() {
    var details = error == null ? null : error.errors();
    if (details == null) {
      return List.of();
    }
    return details.stream().map(Detail::reason).filter(Objects::nonNull).toList();
  }

  public @Nullable String message() {
    return error == null ? null : error.message();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Body(int code, @Nullable String message, @Nullable List<Detail> errors) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Detail(@Nullable String reason, @Nullable String message, @Nullable String domain) {
  }
}
