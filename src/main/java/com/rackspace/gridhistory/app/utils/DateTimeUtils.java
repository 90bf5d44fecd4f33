/*
 * Copyright 2020 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.gridhistory.app.utils;

import com.rackspace.gridhistory.app.downsample.TemporalNormalizer;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket arithmetic for the history tiers. Everything is computed on the UTC calendar.
 */
public class DateTimeUtils {

  public static final Duration FIVE_MINUTES = Duration.ofMinutes(5);
  public static final Duration HALF_HOUR = Duration.ofMinutes(30);

  private static final TemporalNormalizer FIVE_MINUTE_NORMALIZER = new TemporalNormalizer(FIVE_MINUTES);
  private static final TemporalNormalizer HALF_HOUR_NORMALIZER = new TemporalNormalizer(HALF_HOUR);

  private DateTimeUtils() {
  }

  public static Instant startOfFiveMinutes(Instant time) {
    return time.with(FIVE_MINUTE_NORMALIZER);
  }

  public static Instant startOfHalfHour(Instant time) {
    return time.with(HALF_HOUR_NORMALIZER);
  }

  public static Instant startOfDay(Instant time) {
    return time.truncatedTo(ChronoUnit.DAYS);
  }

  /**
   * @return midnight of the Monday starting the week that contains the given time
   */
  public static Instant startOfWeek(Instant time) {
    return utc(time)
        .truncatedTo(ChronoUnit.DAYS)
        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
        .toInstant();
  }

  public static Instant startOfMonth(Instant time) {
    return utc(time)
        .truncatedTo(ChronoUnit.DAYS)
        .with(TemporalAdjusters.firstDayOfMonth())
        .toInstant();
  }

  private static ZonedDateTime utc(Instant time) {
    return time.atZone(ZoneOffset.UTC);
  }
}
