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
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.SeriesRepository;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Carries the demand, pricing and emissions values of the newest row holding them into the rows a
 * promotion created after it.
 */
@Service
@Slf4j
public class ForwardPropagationService {

  private final SeriesRepository seriesRepository;

  @Autowired
  public ForwardPropagationService(SeriesRepository seriesRepository) {
    this.seriesRepository = seriesRepository;
  }

  public Mono<SeriesRow> capture(Tier tier) {
    return capture(tier, null);
  }

  /**
   * Rows that carry none of the slow-changing columns, such as freshly promoted generation or
   * visit counts, are passed over.
   *
   * @param cutoff when not null, rows after it are passed over too
   * @return the newest row holding demand, pricing or emissions, empty when there is none
   */
  public Mono<SeriesRow> capture(Tier tier, @Nullable Instant cutoff) {
    return seriesRepository.findAllNewestFirst(tier)
        .skipWhile(row -> cutoff != null && row.getTime().isAfter(cutoff))
        .filter(row -> !slowValues(row.getValues()).isEmpty())
        .next()
        .checkpoint();
  }

  public Mono<Integer> propagate(Tier tier, @Nullable SeriesRow previous) {
    return propagate(tier, previous, null);
  }

  /**
   * @param previous the row returned by {@link #capture(Tier, Instant)}, null when there was none
   * @param cutoff when not null, rows after it are left for a later propagation
   * @return the number of rows updated
   */
  public Mono<Integer> propagate(Tier tier, @Nullable SeriesRow previous,
                                 @Nullable Instant cutoff) {
    if (previous == null) {
      log.info("No earlier {} row with slow-changing values, leaving new rows as they are", tier);
      return Mono.just(0);
    }
    final Datum carried = slowValues(previous.getValues());
    if (carried.isEmpty()) {
      log.debug("Row {} of {} has no slow-changing values to propagate", previous.getTime(), tier);
      return Mono.just(0);
    }

    return seriesRepository.findAfter(tier, previous.getTime())
        .takeWhile(row -> cutoff == null || !row.getTime().isAfter(cutoff))
        .map(row -> new SeriesRow()
            .setTime(row.getTime())
            .setValues(carried))
        .collectList()
        .flatMap(rows -> {
          if (rows.isEmpty()) {
            return Mono.just(0);
          }
          log.debug("Propagating {} from {} into {} rows of {}",
              carried, previous.getTime(), rows.size(), tier);
          return seriesRepository.upsertAll(tier, rows).thenReturn(rows.size());
        })
        .checkpoint();
  }

  private static Datum slowValues(Datum values) {
    final List<MetricColumn> present = MetricColumn.slowChanging().stream()
        .filter(values::has)
        .collect(Collectors.toList());
    return values.select(present);
  }
}
