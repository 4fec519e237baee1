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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for a {@link ThrottleQueue}.
 * <p>
 * Below {@code threshold} points in the trailing minute, requests are admitted
 * immediately. Above it, each admission is delayed by up to {@code maxWait},
 * scaled by how much of the reserve ({@code maxQuotaPerMinute - threshold}) the
 * request would use.
 * </p>
 */
public final class ThrottleConfig {
  private static final Logger LOG = LoggerFactory.getLogger(ThrottleConfig.class);

  public static final String THRESHOLD_KEY = "THROTTLE_THRESHOLD";
  public static final String MAX_QUOTA_PER_MINUTE_KEY = "MAX_QUOTA_PER_MINUTE";
  public static final String MAX_WAIT_MS_KEY = "THROTTLE_MAX_WAIT_MS";

  public static final int DEFAULT_THRESHOLD = 30;
  public static final int DEFAULT_MAX_QUOTA_PER_MINUTE = 90;
  public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(1);

  /**
   * Below this reserve, a fully-throttled queue admits fewer than one request
   * per second.
   */
  static final int MIN_SAFE_RESERVE = 60;

  private final int threshold;
  private final int maxQuotaPerMinute;
  private final Duration maxWait;

  /**
   * @param threshold
   *          points per trailing minute before throttling starts
   * @param maxQuotaPerMinute
   *          the ceiling the backoff curve is scaled against; must exceed
   *          {@code threshold}
   * @param maxWait
   *          the longest delay applied to a single admission
   */
  public ThrottleConfig(int threshold, int maxQuotaPerMinute, Duration maxWait) {
    if (threshold < 0) {
      throw new IllegalArgumentException("threshold must not be negative: " + threshold);
    }
    if (maxQuotaPerMinute <= threshold) {
      throw new IllegalArgumentException(
          "maxQuotaPerMinute (" + maxQuotaPerMinute + ") must be greater than threshold (" + threshold + ")");
    }
    if (maxWait.isNegative()) {
      throw new IllegalArgumentException("maxWait must not be negative: " + maxWait);
    }
    this.threshold = threshold;
    this.maxQuotaPerMinute = maxQuotaPerMinute;
    this.maxWait = maxWait;

    var reserve = reserve();
    if (reserve < MIN_SAFE_RESERVE) {
      LOG.warn("Reserve quota ({}) is less than {}. This may cause delays exceeding 1 second. "
          + "Consider increasing {} or decreasing {}.", reserve, MIN_SAFE_RESERVE, MAX_QUOTA_PER_MINUTE_KEY,
          THRESHOLD_KEY);
    }
  }

  /**
   * Threshold 30, ceiling 90, one second maximum wait.
   */
  public static ThrottleConfig defaults() {
    return new ThrottleConfig(DEFAULT_THRESHOLD, DEFAULT_MAX_QUOTA_PER_MINUTE, DEFAULT_MAX_WAIT);
  }

  /**
   * Read the configuration from environment-style variables, falling back to
   * the defaults for any that are missing or blank.
   *
   * @throws IllegalArgumentException
   *           if a value is present but not an integer, or the resulting
   *           configuration is invalid
   */
  public static ThrottleConfig fromEnvironment(Map<String, String> env) {
    var threshold = readInt(env, THRESHOLD_KEY, DEFAULT_THRESHOLD);
    var maxQuota = readInt(env, MAX_QUOTA_PER_MINUTE_KEY, DEFAULT_MAX_QUOTA_PER_MINUTE);
    var maxWaitMs = readInt(env, MAX_WAIT_MS_KEY, (int) DEFAULT_MAX_WAIT.toMillis());
    return new ThrottleConfig(threshold, maxQuota, Duration.ofMillis(maxWaitMs));
  }

  /**
   * {@link #fromEnvironment(Map)} against the process environment.
   */
  public static ThrottleConfig fromSystemEnvironment() {
    return fromEnvironment(System.getenv());
  }

  private static int readInt(Map<String, String> env, String key, int fallback) {
    var raw = env.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " is not an integer: '" + raw + "'", e);
    }
  }

  public int threshold() {
    return threshold;
  }

  public int maxQuotaPerMinute() {
    return maxQuotaPerMinute;
  }

  public int reserve() {
    return maxQuotaPerMinute - threshold;
  }

  public Duration maxWait() {
    return maxWait;
  }

  /**
   * The delay to apply before admitting a request, given the points that would
   * have been spent in the trailing minute once it is admitted.
   * <p>
   * Quadratic in the fraction of the reserve used, so mild overage costs little
   * and the full {@link #maxWait()} is only reached as the reserve runs out.
   * </p>
   */
  public long waitMillisFor(int afterRequest) {
    if (afterRequest <= threshold) {
      return 0;
    }
    var utilization = Math.max(0.0, Math.min(1.0, (double) (afterRequest - threshold) / reserve()));
    var maxWaitMs = maxWait.toMillis();
    return Math.min(maxWaitMs, Math.round(utilization * utilization * maxWaitMs));
  }

  @Override
  @Contract(value = "null -> false", pure = true)
  public boolean equals(@Nullable Object obj) {
    if (obj instanceof ThrottleConfig that) {
      return threshold == that.threshold && maxQuotaPerMinute == that.maxQuotaPerMinute
          && maxWait.equals(that.maxWait);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(threshold, maxQuotaPerMinute, maxWait);
  }

  @Override
  public String toString() {
    return "ThrottleConfig{threshold=" + threshold + ", maxQuotaPerMinute=" + maxQuotaPerMinute + ", maxWait="
        + maxWait + "}";
  }
}
