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
import com.rackspace.gridhistory.app.model.Milestone;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.PeakRecord;
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.PeakRepository;
import com.rackspace.gridhistory.app.repos.SeriesRepository;
import java.time.Instant;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tracks the all-time maximum of combined wind generation, metered plus embedded, along with the
 * first time each whole-number threshold was reached.
 */
@Service
@Slf4j
public class PeakTracker {

  private final PeakRepository peakRepository;
  private final SeriesRepository seriesRepository;
  private final AppProperties appProperties;

  @Autowired
  public PeakTracker(PeakRepository peakRepository,
                     SeriesRepository seriesRepository,
                     AppProperties appProperties) {
    this.peakRepository = peakRepository;
    this.seriesRepository = seriesRepository;
    this.appProperties = appProperties;
  }

  public Mono<Void> updateFromLatestBucket() {
    return updateFromLatestBucket(null);
  }

  /**
   * Feeds the newest half-hour bucket holding both wind columns into
   * {@link #update(double, Instant)}.
   *
   * @param cutoff when not null, buckets after it are not considered
   */
  public Mono<Void> updateFromLatestBucket(@Nullable Instant cutoff) {
    return seriesRepository.findAllNewestFirst(Tier.HALF_HOURS)
        .skipWhile(row -> cutoff != null && row.getTime().isAfter(cutoff))
        .filter(row -> row.getValues().has(MetricColumn.WIND)
            && row.getValues().has(MetricColumn.EMBEDDED_WIND))
        .next()
        .flatMap(row -> update(trackedValue(row), row.getTime()))
        .checkpoint();
  }

  public Mono<Void> update(double value, Instant time) {
    return updateRecord(value, time)
        .then(updateMilestones(value, time));
  }

  public Mono<PeakRecord> getRecord() {
    return peakRepository.findRecord();
  }

  public Flux<Milestone> getMilestones() {
    return peakRepository.findMilestones();
  }

  private Mono<Void> updateRecord(double value, Instant time) {
    return peakRepository.findRecord()
        .map(record -> value > record.getValue())
        .defaultIfEmpty(true)
        .flatMap(exceeded -> {
          if (!exceeded) {
            return Mono.empty();
          }
          log.info("New peak record {} at {}", value, time);
          return peakRepository.saveRecord(new PeakRecord(value, time));
        });
  }

  private Mono<Void> updateMilestones(double value, Instant time) {
    final int start = appProperties.getMilestoneStart();
    final long reachedFloor = (long) Math.floor(value);
    if (reachedFloor < start) {
      return Mono.empty();
    }
    if (reachedFloor > appProperties.getMilestoneLimit()) {
      log.warn("Value {} at {} is beyond the milestone limit {}, recording milestones up to it",
          value, time, appProperties.getMilestoneLimit());
    }
    final int highest = (int) Math.min(reachedFloor, appProperties.getMilestoneLimit());
    if (highest < start) {
      return Mono.empty();
    }
    return peakRepository.findMilestones()
        .map(Milestone::getThreshold)
        .collect(Collectors.toSet())
        .flatMapMany(reached -> Flux.range(start, highest - start + 1)
            .filter(threshold -> !reached.contains(threshold)))
        .concatMap(threshold ->
            peakRepository.insertMilestone(new Milestone(threshold, value, time))
                .doOnNext(inserted -> {
                  if (inserted) {
                    log.info("Reached milestone {} with {} at {}", threshold, value, time);
                  }
                }))
        .then();
  }

  static double trackedValue(SeriesRow row) {
    return row.getValues().get(MetricColumn.WIND) + row.getValues().get(MetricColumn.EMBEDDED_WIND);
  }
}
