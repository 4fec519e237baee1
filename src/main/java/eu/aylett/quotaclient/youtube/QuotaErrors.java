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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

import static eu.aylett.quotaclient.SneakyThrows.sneakyThrow;

/**
 * Tells quota exhaustion apart from every other failure.
 */
public final class QuotaErrors {
  /**
   * The {@code reason} the API reports when the daily quota is spent.
   */
  public static final String QUOTA_EXCEEDED_REASON = "quotaExceeded";

  private static final int FORBIDDEN = 403;
  private static final String QUOTA_EXCEEDED_TEXT = "quota exceeded";

  private QuotaErrors() {
  }

  /**
   * Whether {@code failure} means the quota is exhausted.
   * <ol>
   * <li>A {@link QuotaExceededException} always is.</li>
   * <li>An HTTP 403 is if, and only if, its first reason is
   * {@value #QUOTA_EXCEEDED_REASON}.</li>
   * <li>Anything else is if its message mentions "quota exceeded", in any
   * case.</li>
   * </ol>
   */
  @Contract(value = "null -> false", pure = true)
  public static boolean isQuotaExceeded(@Nullable Throwable failure) {
    if (failure == null) {
      return false;
    }
    if (failure instanceof QuotaExceededException) {
      return true;
    }
    if (failure instanceof ApiHttpException http && http.status == FORBIDDEN) {
      return QUOTA_EXCEEDED_REASON.equals(http.firstReason());
    }
    var message = failure.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains(QUOTA_EXCEEDED_TEXT);
  }

  /**
   * Throw a fresh {@link QuotaExceededException} if {@code failure} means the
   * quota is exhausted, otherwise rethrow {@code failure} itself.
   * <p>
   * Declared to return so callers can write {@code throw handleQuotaError(e);}.
   * </p>
   */
  public static RuntimeException handleQuotaError(Throwable failure) {
    if (isQuotaExceeded(failure)) {
      throw new QuotaExceededException();
    }
    throw sneakyThrow(failure);
  }
}
