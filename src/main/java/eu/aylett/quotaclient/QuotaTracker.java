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

import java.time.Clock;
import java.time.InstantSource;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Quota points spent over a sliding 60 second window, bucketed by whole second.
 * <p>
 * Not thread-safe: {@link ThrottleQueue} only touches it while holding its
 * admission lock.
 * </p>
 */
public class QuotaTracker {
  static final long WINDOW_SECONDS = 60;

  private final InstantSource clock;
  private final NavigableMap<Long, Long> pointsBySecond = new TreeMap<>();

  /**
   * @param clock
   *          the time source used to bucket and expire entries (mainly for
   *          testing)
   */
  public QuotaTracker(InstantSource clock) {
    this.clock = clock;
  }

  public QuotaTracker() {
    this(Clock.systemUTC());
  }

  /**
   * Add points to the bucket for the current second.
   */
  public void record(int points) {
    if (points < 0) {
      throw new IllegalArgumentException("points must not be negative: " + points);
    }
    pointsBySecond.merge(currentSecond(), (long) points, Long::sum);
  }

  /**
   * Total points recorded in the last 60 seconds. Expired buckets are purged
   * along the way.
   */
  public int countWindow() {
    var cutoff = currentSecond() - WINDOW_SECONDS;
    var total = 0L;
    for (var points : pointsBySecond.tailMap(cutoff, false).values()) {
      total += points;
    }
    purgeBefore(cutoff);
    return (int) Math.min(Integer.MAX_VALUE, total);
  }

  /**
   * Drop every bucket at least 60 seconds old.
   */
  public void purgeExpired() {
    purgeBefore(currentSecond() - WINDOW_SECONDS);
  }

  private void purgeBefore(long cutoff) {
    pointsBySecond.headMap(cutoff, true).clear();
  }

  /**
   * The number of buckets currently held, including any not yet purged.
   */
  public int size() {
    return pointsBySecond.size();
  }

  public void clear() {
    pointsBySecond.clear();
  }

  private long currentSecond() {
    return clock.instant().getEpochSecond();
  }
}
