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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import static eu.aylett.quotaclient.SneakyThrows.sneakyThrow;

/**
 * Admission control for quota-costed requests.
 * <p>
 * Each request reserves its cost in a {@link QuotaTracker} before it runs,
 * after waiting out any backoff the {@link ThrottleConfig} calls for. Decisions
 * are made one at a time, in arrival order, so every decision sees the
 * reservations of all the requests admitted before it. The requests themselves
 * run outside the lock and may overlap freely.
 * </p>
 * <p>
 * Requests are never retried or rejected, only delayed, and points are never
 * refunded for requests that fail.
 * </p>
 */
public class ThrottleQueue {
  private static final Logger LOG = LoggerFactory.getLogger(ThrottleQueue.class);

  /**
   * Blocks the admitting thread for the computed backoff.
   */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final ThrottleConfig config;
  private final QuotaTracker tracker;
  private final Sleeper sleeper;
  // Fair, so admission turns are granted in arrival order
  private final ReentrantLock admissionLock = new ReentrantLock(true);

  /**
   * A fully configurable throttle queue.
   *
   * @param config
   *          thresholds and maximum wait
   * @param tracker
   *          the ledger of spent points; owned by this queue from now on
   * @param sleeper
   *          how to wait out a backoff (mainly for testing)
   */
  public ThrottleQueue(ThrottleConfig config, QuotaTracker tracker, Sleeper sleeper) {
    this.config = config;
    this.tracker = tracker;
    this.sleeper = sleeper;
  }

  public ThrottleQueue(ThrottleConfig config, QuotaTracker tracker) {
    this(config, tracker, Thread::sleep);
  }

  /**
   * Throttle queue using the system clock and real sleeps.
   */
  public ThrottleQueue(ThrottleConfig config) {
    this(config, new QuotaTracker());
  }

  /**
   * Wait for admission, reserve {@code cost} points, then call the callable.
   *
   * @throws InterruptedException
   *           if interrupted while waiting for admission; nothing is reserved
   * @throws Exception
   *           anything thrown by the callable, unchanged
   */
  public <T> T checkedExecute(int cost, Callable<T> request) throws Exception {
    admit(cost);
    return request.call();
  }

  /**
   * Wait for admission, reserve {@code cost} points, then call the supplier.
   * Anything the supplier throws propagates unchanged, as does an
   * {@link InterruptedException} while waiting.
   */
  public <T> T execute(int cost, Supplier<T> request) {
    try {
      return checkedExecute(cost, request::get);
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * Wrap a Supplier so that every call is admitted through this queue.
   */
  public <T> Supplier<T> wrap(int cost, Supplier<T> supplier) {
    return () -> execute(cost, supplier);
  }

  /**
   * Wrap a Function so that every call is admitted through this queue.
   */
  public <T, R> Function<T, R> wrap(int cost, Function<T, R> function) {
    return (T t) -> execute(cost, () -> function.apply(t));
  }

  /**
   * The points spent in the trailing minute, as the next admission decision
   * would see them.
   */
  public int windowUsage() {
    admissionLock.lock();
    try {
      return tracker.countWindow();
    } finally {
      admissionLock.unlock();
    }
  }

  public ThrottleConfig config() {
    return config;
  }

  private void admit(int cost) throws InterruptedException {
    if (cost < 0) {
      throw new IllegalArgumentException("cost must not be negative: " + cost);
    }
    admissionLock.lockInterruptibly();
    try {
      var consumed = tracker.countWindow();
      var afterRequest = (int) Math.min(Integer.MAX_VALUE, (long) consumed + cost);
      var waitMs = config.waitMillisFor(afterRequest);
      if (waitMs > 0) {
        LOG.debug("Throttling request costing {} points by {}ms ({} points spent in the last 60s, threshold {})",
            cost, waitMs, consumed, config.threshold());
        sleeper.sleep(waitMs);
      }
      // Reserve before releasing the turn, so the next decision counts this request
      tracker.record(cost);
    } finally {
      admissionLock.unlock();
    }
  }
}
