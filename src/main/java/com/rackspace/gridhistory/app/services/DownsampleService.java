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

import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.downsample.AggregatedDatum;
import com.rackspace.gridhistory.app.downsample.DatumCollectors;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.SeriesRepository;
import com.rackspace.gridhistory.app.utils.DateTimeUtils;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Promotes the rows of one tier into the buckets of a coarser tier. The destination buckets are a
 * pure function of the source rows, so promoting again without new source rows changes nothing.
 */
@Service
@Slf4j
public class DownsampleService {

  private final SeriesRepository seriesRepository;
  private final AppProperties appProperties;

  @Autowired
  public DownsampleService(SeriesRepository seriesRepository, AppProperties appProperties) {
    this.seriesRepository = seriesRepository;
    this.appProperties = appProperties;
  }

  /**
   * Averages the given columns of every source bucket and upserts the results into the
   * destination as one batch.
   *
   * @param cutoff when not null only buckets starting at or before it are promoted
   * @return the promoted rows, empty when nothing qualified
   */
  public Mono<List<SeriesRow>> promote(Tier source, Tier destination, List<MetricColumn> columns,
                                       boolean includeVisits, @Nullable Instant cutoff) {
    return promote(seriesRepository.findAll(source), source, destination, columns, includeVisits,
        cutoff);
  }

  /**
   * Promotes every column and the visit counts without a cutoff, as used for the day, week and
   * year tiers.
   */
  public Mono<List<SeriesRow>> promote(Tier source, Tier destination) {
    return promote(source, destination, MetricColumn.all(), true, null);
  }

  /**
   * Same as {@link #promote(Tier, Tier)} but only recomputes the destination buckets starting at
   * or after the one containing {@code since}, reading just the source rows they cover.
   */
  public Mono<List<SeriesRow>> promoteSince(Tier source, Tier destination, Instant since) {
    final Instant from = destination.bucketStart(since);
    log.debug("Promoting {} to {} from {}", source, destination, from);
    return promote(seriesRepository.findFrom(source, from), source, destination,
        MetricColumn.all(), true, null);
  }

  private Mono<List<SeriesRow>> promote(Flux<SeriesRow> sourceRows, Tier source,
                                        Tier destination, List<MetricColumn> columns,
                                        boolean includeVisits, @Nullable Instant cutoff) {
    return sourceRows
        // rows arrive in time order, so each destination bucket is a contiguous run
        .windowUntilChanged(row -> destination.bucketStart(row.getTime()))
        .concatMap(rows -> rows.collect(DatumCollectors.bucketCollector(destination)))
        .filter(agg -> agg.getRows() > 0)
        .filter(agg -> cutoff == null || !agg.getBucket().isAfter(cutoff))
        .map(agg -> toRow(agg, columns, includeVisits))
        .collectList()
        .flatMap(rows -> {
          if (rows.isEmpty()) {
            log.debug("Nothing to promote from {} to {}", source, destination);
            return Mono.just(rows);
          }
          log.debug("Promoting {} buckets from {} to {}", rows.size(), source, destination);
          return seriesRepository.upsertAll(destination, rows).thenReturn(rows);
        })
        .name("promote")
        .tag("destination", destination.name())
        .metrics()
        .checkpoint();
  }

  /**
   * A half hour is complete once the five-minute sample starting 25 minutes into it has arrived,
   * so the newest complete half hour is found by subtracting the margin from the newest sample and
   * rounding down.
   *
   * @return the start of the newest complete half hour, empty when there are no samples
   */
  public Mono<Instant> latestCompleteHalfHour() {
    return seriesRepository.findLatest(Tier.FIVE_MINUTES)
        .map(row -> DateTimeUtils.startOfHalfHour(
            row.getTime().minus(appProperties.getCompletenessMargin())));
  }

  private static SeriesRow toRow(AggregatedDatum agg, List<MetricColumn> columns,
                                 boolean includeVisits) {
    return new SeriesRow()
        .setTime(agg.getBucket())
        .setValues(agg.averages(columns))
        .setVisits(includeVisits ? agg.getVisits() : null);
  }
}
