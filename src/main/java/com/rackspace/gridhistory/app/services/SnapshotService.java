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
import com.rackspace.gridhistory.app.model.LatestValue;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.Reading;
import com.rackspace.gridhistory.app.repos.SnapshotRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Maintains the latest known value of every source, independent of the time series buckets.
 */
@Service
@Slf4j
public class SnapshotService {

  public static final Comparator<Reading> MOST_RECENT_FIRST =
      Comparator.comparing(Reading::getTime, Comparator.reverseOrder());

  private final SnapshotRepository snapshotRepository;

  @Autowired
  public SnapshotService(SnapshotRepository snapshotRepository) {
    this.snapshotRepository = snapshotRepository;
  }

  public Mono<Void> update(MetricColumn source, double value, Instant time) {
    return snapshotRepository.upsertAll(List.of(new LatestValue(source, value, time)));
  }

  /**
   * Stores, for each column, the value of the first reading that carries it. The readings must
   * therefore already be sorted most recent first.
   *
   * @see #MOST_RECENT_FIRST
   */
  public Mono<Void> apply(List<MetricColumn> columns, List<Reading> readingsMostRecentFirst) {
    final List<LatestValue> latest = new ArrayList<>();
    for (MetricColumn column : columns) {
      readingsMostRecentFirst.stream()
          .filter(reading -> reading.getValues().has(column))
          .findFirst()
          .ifPresent(reading ->
              latest.add(new LatestValue(column, reading.getValues().get(column), reading.getTime())));
    }
    if (latest.isEmpty()) {
      return Mono.empty();
    }
    log.trace("Updating latest values {}", latest);
    return snapshotRepository.upsertAll(latest);
  }

  public Mono<Datum> getLatest() {
    return snapshotRepository.findAll()
        .collect(Datum::new, (datum, latest) -> datum.put(latest.getSource(), latest.getValue()));
  }

  /**
   * @return the most recent observation time across all sources, empty if nothing was stored yet
   */
  public Mono<Instant> getLatestTime() {
    return snapshotRepository.findAll()
        .map(LatestValue::getTime)
        .reduce((lhs, rhs) -> lhs.isAfter(rhs) ? lhs : rhs);
  }
}
