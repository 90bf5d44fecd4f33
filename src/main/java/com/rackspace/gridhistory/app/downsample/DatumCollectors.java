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
import com.rackspace.gridhistory.app.model.Tier;
import java.util.List;
import java.util.stream.Collector;

public class DatumCollectors {

  private DatumCollectors() {
  }

  /**
   * Aggregates rows that all fall into the same bucket of the given tier.
   */
  public static Collector<SeriesRow, AggregatedDatum, AggregatedDatum> bucketCollector(Tier tier) {
    return Collector.of(
        AggregatedDatum::new,
        (agg, row) -> {
          if (agg.getBucket() == null) {
            agg.setBucket(tier.bucketStart(row.getTime()));
          }
          agg.add(row);
        },
        (lhs, rhs) -> {
          if (lhs.getBucket() == null) {
            lhs.setBucket(rhs.getBucket());
          }
          return lhs.combine(rhs);
        }
    );
  }

  /**
   * Averages each column over all rows, ignoring missing values, the way a SQL AVG would.
   */
  public static Collector<SeriesRow, AggregatedDatum, Datum> averaging(List<MetricColumn> columns) {
    return Collector.of(
        AggregatedDatum::new,
        AggregatedDatum::add,
        AggregatedDatum::combine,
        agg -> agg.averages(columns)
    );
  }
}
