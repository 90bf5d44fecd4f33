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

package com.rackspace.gridhistory.app.services;

import com.rackspace.gridhistory.app.model.Datum;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.Reading;
import com.rackspace.gridhistory.app.model.SeriesRow;
import java.time.Instant;

/**
 * Test fixtures for rows and readings.
 */
final class SeriesRows {

  private SeriesRows() {
  }

  static SeriesRow row(String time, MetricColumn column, double value) {
    return new SeriesRow()
        .setTime(Instant.parse(time))
        .setValues(new Datum().put(column, value));
  }

  static SeriesRow row(String time, Datum values) {
    return new SeriesRow()
        .setTime(Instant.parse(time))
        .setValues(values);
  }

  static SeriesRow slowRow(String time, double demand, double price, double emissions) {
    return row(time, new Datum()
        .put(MetricColumn.DEMAND, demand)
        .put(MetricColumn.PRICE, price)
        .put(MetricColumn.EMISSIONS, emissions));
  }

  /**
   * @return a reading with every generation column set, wind to the given value and the others
   * to one
   */
  static Reading generation(Instant time, double wind) {
    final Datum values = new Datum();
    MetricColumn.generation().forEach(column -> values.put(column, 1.0));
    values.put(MetricColumn.WIND, wind);
    return new Reading()
        .setTime(time)
        .setValues(values);
  }

  static Reading generation(String time, double wind) {
    return generation(Instant.parse(time), wind);
  }
}
