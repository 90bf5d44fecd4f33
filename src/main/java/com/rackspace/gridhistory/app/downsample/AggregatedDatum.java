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

import com.rackspace.gridhistory.app.model.Datum;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.SeriesRow;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import lombok.Getter;

/**
 * Running sums and counts of the rows falling into one bucket.
 */
public class AggregatedDatum {

  @Getter
  private Instant bucket;
  private final EnumMap<MetricColumn, Double> sums = new EnumMap<>(MetricColumn.class);
  private final EnumMap<MetricColumn, Integer> counts = new EnumMap<>(MetricColumn.class);
  @Getter
  private int rows;
  private int visits;
  private boolean visitsSeen;

  AggregatedDatum setBucket(Instant bucket) {
    this.bucket = bucket;
    return this;
  }

  void add(SeriesRow row) {
    rows++;
    row.getValues().columns().forEach(column -> {
      final Double value = row.getValues().get(column);
      if (value != null) {
        sums.merge(column, value, Double::sum);
        counts.merge(column, 1, Integer::sum);
      }
    });
    if (row.getVisits() != null) {
      visits += row.getVisits();
      visitsSeen = true;
    }
  }

  AggregatedDatum combine(AggregatedDatum other) {
    rows += other.rows;
    other.sums.forEach((column, sum) -> sums.merge(column, sum, Double::sum));
    other.counts.forEach((column, count) -> counts.merge(column, count, Integer::sum));
    visits += other.visits;
    visitsSeen |= other.visitsSeen;
    return this;
  }

  /**
   * @return the mean of each requested column, null where no row had a value
   */
  public Datum averages(List<MetricColumn> columns) {
    final Datum datum = new Datum();
    for (MetricColumn column : columns) {
      final Integer count = counts.get(column);
      datum.put(column, count == null ? null : sums.get(column) / count);
    }
    return datum;
  }

  /**
   * @return the summed visits, or null when none of the rows counted visits
   */
  public Integer getVisits() {
    return visitsSeen ? visits : null;
  }
}
