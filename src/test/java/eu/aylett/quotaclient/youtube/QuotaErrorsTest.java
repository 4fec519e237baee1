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

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuotaErrorsTest {
  @Test
  void alreadyClassified() {
    assertTrue(QuotaErrors.isQuotaExceeded(new QuotaExceededException()));
    assertTrue(QuotaErrors.isQuotaExceeded(new QuotaExceededException("custom")));
  }

  @Test
  void forbiddenWithQuotaReason() {
    assertTrue(QuotaErrors.isQuotaExceeded(new ApiHttpException(403, List.of("quotaExceeded"), null)));
    assertTrue(QuotaErrors.isQuotaExceeded(new ApiHttpException(403, List.of("quotaExceeded", "forbidden"), null)));
  }

  @Test
  void forbiddenWithOtherReasons() {
    assertFalse(QuotaErrors.isQuotaExceeded(new ApiHttpException(403, List.of("forbidden"), null)));
    assertFalse(QuotaErrors.isQuotaExceeded(new ApiHttpException(403, List.of("forbidden", "quotaExceeded"), null)));
    assertFalse(QuotaErrors.isQuotaExceeded(new AuthFailureException(403, List.of("forbidden"), null)));
  }

  @Test
  void forbiddenReasonTakesPriorityOverMessage() {
    assertFalse(
        QuotaErrors.isQuotaExceeded(new ApiHttpException(403, List.of("forbidden"), "Quota Exceeded, but not really")));
  }

  @Test
  void forbiddenWithNoReasons() {
    assertFalse(QuotaErrors.isQuotaExceeded(new ApiHttpException(403, List.of(), null)));
  }

  @Test
  void unauthorizedIsNotQuota() {
    assertFalse(QuotaErrors.isQuotaExceeded(new AuthFailureException(401, List.of("authError"), "Invalid Credentials")));
    assertFalse(QuotaErrors.isQuotaExceeded(new AuthFailureException(401, List.of(), null)));
  }

  @Test
  void messageMentioningQuotaExceededInAnyCase() {
    assertTrue(QuotaErrors.isQuotaExceeded(new RuntimeException("Request failed: Daily Quota Exceeded for today")));
    assertTrue(QuotaErrors.isQuotaExceeded(new IOException("QUOTA EXCEEDED")));
  }

  @Test
  void everythingElse() {
    assertFalse(QuotaErrors.isQuotaExceeded(null));
    assertFalse(QuotaErrors.isQuotaExceeded(new RuntimeException()));
    assertFalse(QuotaErrors.isQuotaExceeded(new RuntimeException("quota")));
    assertFalse(QuotaErrors.isQuotaExceeded(new ApiHttpException(500, List.of("backendError"), null)));
    assertFalse(QuotaErrors.isQuotaExceeded(new TransientNetworkException("timeout", new IOException())));
  }

  @Test
  void handleQuotaErrorReplacesQuotaFailures() {
    var original = new ApiHttpException(403, List.of("quotaExceeded"), null);
    var thrown = assertThrows(QuotaExceededException.class, () -> QuotaErrors.handleQuotaError(original));
    assertNotSame(original, thrown);
  }

  @Test
  void handleQuotaErrorRethrowsEverythingElseUnchanged() {
    var auth = new AuthFailureException(401, List.of(), null);
    assertSame(auth, assertThrows(AuthFailureException.class, () -> QuotaErrors.handleQuotaError(auth)));

    var checked = new IOException("connection reset");
    assertSame(checked, assertThrows(IOException.class, () -> QuotaErrors.handleQuotaError(checked)));
  }
}
