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

package com.rackspace.gridhistory.app.model;

import com.rackspace.gridhistory.app.utils.DateTimeUtils;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * One resolution level of the history. Each tier is stored in its own table and aligns its rows
 * to buckets produced by {@link #bucketStart(Instant)}.
 */
public enum Tier {
  FIVE_MINUTES("past_five_minutes", DateTimeUtils::startOfFiveMinutes),
  HALF_HOURS("past_half_hours", DateTimeUtils::startOfHalfHour),
  DAYS("past_days", DateTimeUtils::startOfDay),
  WEEKS("past_weeks", DateTimeUtils::startOfWeek),
  // named for how long it spans, the buckets are calendar months
  YEARS("past_years", DateTimeUtils::startOfMonth);

  private final String tableName;
  private final UnaryOperator<Instant> bucketFunction;

  Tier(String tableName, UnaryOperator<Instant> bucketFunction) {
    this.tableName = tableName;
    this.bucketFunction = bucketFunction;
  }

  public String getTableName() {
    return tableName;
  }

  public Instant bucketStart(Instant time) {
    return bucketFunction.apply(time);
  }
}
