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

package com.rackspace.gridhistory.app.downsample;

import java.time.Duration;
import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAdjuster;
import lombok.Getter;

/**
 * Rounds a temporal down to a multiple of a fixed width counted from the epoch. Only suitable for
 * widths that divide a day evenly, calendar buckets are handled by
 * {@link com.rackspace.gridhistory.app.utils.DateTimeUtils}.
 */
public class TemporalNormalizer implements TemporalAdjuster {

  @Getter
  final Duration rounding;

  public TemporalNormalizer(Duration rounding) {
    if (rounding.isZero() || rounding.isNegative() || rounding.getNano() != 0) {
      throw new IllegalArgumentException("Rounding must be a positive whole number of seconds: " + rounding);
    }
    this.rounding = rounding;
  }

  @Override
  public Temporal adjustInto(Temporal temporal) {
    return temporal
        .with(ChronoField.NANO_OF_SECOND, 0)
        .with(ChronoField.INSTANT_SECONDS, round(temporal.getLong(ChronoField.INSTANT_SECONDS)));
  }

  private long round(long seconds) {
    return Math.floorDiv(seconds, rounding.getSeconds()) * rounding.getSeconds();
  }
}
