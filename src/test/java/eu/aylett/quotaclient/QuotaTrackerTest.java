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

package eu.aylett.quotaclient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import java.time.Instant;
import java.time.InstantSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuotaTrackerTest {
  private InstantAnswer instantAnswer;
  private QuotaTracker tracker;

  @BeforeEach
  void setUp() {
    var clock = mock(InstantSource.class);
    instantAnswer = new InstantAnswer();
    when(clock.instant()).thenAnswer(instantAnswer);
    tracker = new QuotaTracker(clock);
  }

  @Test
  void recordsInTheSameSecondAggregate() {
    tracker.record(3);
    instantAnswer.plusMillis(999);
    tracker.record(2);
    assertThat(tracker.size(), equalTo(1));
    assertThat(tracker.countWindow(), equalTo(5));
  }

  @Test
  void countsEverythingInsideTheWindow() {
    tracker.record(1);
    instantAnswer.plusSeconds(20);
    tracker.record(10);
    instantAnswer.plusSeconds(20);
    tracker.record(100);
    instantAnswer.plusSeconds(19);
    assertThat(tracker.countWindow(), equalTo(111));
    assertThat(tracker.size(), equalTo(3));
  }

  @Test
  void bucketExactlySixtySecondsOldIsExcluded() {
    tracker.record(7);
    instantAnswer.plusSeconds(59);
    assertThat(tracker.countWindow(), equalTo(7));
    instantAnswer.plusSeconds(1);
    assertThat(tracker.countWindow(), equalTo(0));
  }

  @Test
  void countWindowPurgesExpiredBuckets() {
    tracker.record(4);
    instantAnswer.plusSeconds(30);
    tracker.record(6);
    instantAnswer.plusSeconds(30);
    assertThat(tracker.size(), equalTo(2));
    assertThat(tracker.countWindow(), equalTo(6));
    assertThat(tracker.size(), equalTo(1));
  }

  @Test
  void purgeExpiredIsIdempotent() {
    tracker.record(1);
    instantAnswer.plusSeconds(40);
    tracker.record(2);
    instantAnswer.plusSeconds(30);

    tracker.purgeExpired();
    assertThat(tracker.size(), equalTo(1));
    tracker.purgeExpired();
    assertThat(tracker.size(), equalTo(1));
    assertThat(tracker.countWindow(), equalTo(2));
  }

  @Test
  void oldPointsDoNotComeBack() {
    tracker.record(50);
    instantAnswer.plusSeconds(61);
    tracker.record(1);
    assertThat(tracker.countWindow(), equalTo(1));
  }

  @Test
  void clearForgetsEverything() {
    tracker.record(5);
    instantAnswer.plusSeconds(1);
    tracker.record(5);
    tracker.clear();
    assertThat(tracker.size(), equalTo(0));
    assertThat(tracker.countWindow(), equalTo(0));
  }

  @Test
  void zeroPointsAreAllowed() {
    tracker.record(0);
    assertThat(tracker.countWindow(), equalTo(0));
  }

  @Test
  void negativePointsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> tracker.record(-1));
  }

  private static class InstantAnswer implements Answer<Instant> {
    public Instant now = Instant.parse("2024-01-01T00:00:00Z");

    public void plusSeconds(int i) {
      now = now.plusSeconds(i);
    }

    public void plusMillis(int i) {
      now = now.plusMillis(i);
    }

    @Override
    public Instant answer(InvocationOnMock invocation) {
      return now;
    }
  }
}
