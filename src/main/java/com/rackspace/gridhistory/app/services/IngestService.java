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

import com.rackspace.gridhistory.app.errors.MalformedBatchException;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.Reading;
import com.rackspace.gridhistory.app.model.ReadingBatch;
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.SeriesRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point of an ingestion cycle. Each operation runs its phases strictly one after the other
 * and stops at the first failure, leaving already committed phases in place for the next cycle to
 * build upon.
 */
@Service
@Slf4j
public class IngestService {

  private final SeriesRepository seriesRepository;
  private final SnapshotService snapshotService;
  private final DownsampleService downsampleService;
  private final ForwardPropagationService forwardPropagationService;
  private final RetentionService retentionService;
  private final PeakTracker peakTracker;
  private final TimestampProvider timestampProvider;

  @Autowired
  public IngestService(SeriesRepository seriesRepository,
                       SnapshotService snapshotService,
                       DownsampleService downsampleService,
                       ForwardPropagationService forwardPropagationService,
                       RetentionService retentionService,
                       PeakTracker peakTracker,
                       TimestampProvider timestampProvider) {
    this.seriesRepository = seriesRepository;
    this.snapshotService = snapshotService;
    this.downsampleService = downsampleService;
    this.forwardPropagationService = forwardPropagationService;
    this.retentionService = retentionService;
    this.peakTracker = peakTracker;
    this.timestampProvider = timestampProvider;
  }

  /**
   * Stores five-minute generation readings and then closes any half hours they completed.
   */
  public Mono<Void> ingestGeneration(List<Reading> readings) {
    final List<MetricColumn> columns = MetricColumn.generation();
    try {
      validate(columns, readings);
    } catch (MalformedBatchException e) {
      log.warn("Rejecting generation batch: {}", e.getMessage());
      return Mono.error(e);
    }
    if (readings.isEmpty()) {
      return Mono.empty();
    }

    final List<Reading> sorted = sortMostRecentFirst(readings);
    log.debug("Ingesting {} generation readings up to {}", sorted.size(), sorted.get(0).getTime());

    return snapshotService.apply(columns, sorted)
        .then(seriesRepository.upsertAll(Tier.FIVE_MINUTES, toRows(columns, sorted)))
        .then(Mono.defer(this::closeHalfHours))
        .then(Mono.defer(() -> retentionService.trim(Tier.FIVE_MINUTES, timestampProvider.now())))
        .then()
        .name("ingestGeneration")
        .metrics()
        .checkpoint();
  }

  /**
   * Stores readings of any columns, either into the half-hour tier or the five-minute buffer.
   */
  public Mono<Void> ingest(ReadingBatch batch) {
    try {
      validate(batch.getColumns(), batch.getReadings());
    } catch (MalformedBatchException e) {
      log.warn("Rejecting batch of {}: {}", batch.getColumns(), e.getMessage());
      return Mono.error(e);
    }
    if (batch.getReadings().isEmpty()) {
      return Mono.empty();
    }

    final List<Reading> sorted = sortMostRecentFirst(batch.getReadings());
    final Tier tier = batch.isHalfHourly() ? Tier.HALF_HOURS : Tier.FIVE_MINUTES;
    log.debug("Ingesting {} readings of {} into {}", sorted.size(), batch.getColumns(), tier);

    final Mono<Void> latest = batch.isLatest()
        ? snapshotService.apply(batch.getColumns(), sorted)
        : Mono.empty();
    return latest
        .then(seriesRepository.upsertAll(tier, toRows(batch.getColumns(), sorted)))
        .name("ingest")
        .tag("tier", tier.name())
        .metrics()
        .checkpoint();
  }

  /**
   * Adds visits to the half-hour bucket containing the given time.
   */
  public Mono<Void> recordVisits(Instant time, int count) {
    if (count < 1) {
      return Mono.error(new MalformedBatchException("Visit count must be positive: " + count));
    }
    final Instant bucket = Tier.HALF_HOURS.bucketStart(time);
    return seriesRepository.find(Tier.HALF_HOURS, bucket)
        .map(row -> row.getVisits() == null ? 0 : row.getVisits())
        .defaultIfEmpty(0)
        .flatMap(visits -> seriesRepository.upsert(Tier.HALF_HOURS,
            new SeriesRow()
                .setTime(bucket)
                .setVisits(visits + count)))
        .checkpoint();
  }

  /**
   * Ends a cycle: bounds the half-hour tier and refreshes the day, week and year tiers from it.
   * Only the day, week and month buckets overlapping the retained half hours can still change, so
   * only those are recomputed.
   */
  public Mono<Void> finishUpdate() {
    return Mono.defer(() -> retentionService.trim(Tier.HALF_HOURS, timestampProvider.now()))
        .then(Mono.defer(() -> seriesRepository.findAll(Tier.HALF_HOURS).next()))
        .map(SeriesRow::getTime)
        .flatMap(oldest ->
            downsampleService.promoteSince(Tier.HALF_HOURS, Tier.DAYS, oldest)
                .then(Mono.defer(() ->
                    downsampleService.promoteSince(Tier.DAYS, Tier.WEEKS, oldest)))
                .then(Mono.defer(() ->
                    downsampleService.promoteSince(Tier.DAYS, Tier.YEARS, oldest)))
        )
        .then()
        .name("finishUpdate")
        .metrics()
        .checkpoint();
  }

  private Mono<Void> closeHalfHours() {
    return downsampleService.latestCompleteHalfHour()
        .flatMap(cutoff ->
            forwardPropagationService.capture(Tier.HALF_HOURS, cutoff)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(previous ->
                    downsampleService.promote(Tier.FIVE_MINUTES, Tier.HALF_HOURS,
                        MetricColumn.generation(), false, cutoff)
                        .then(Mono.defer(() -> forwardPropagationService.propagate(
                            Tier.HALF_HOURS, previous.orElse(null), cutoff))))
                .then(Mono.defer(() -> peakTracker.updateFromLatestBucket(cutoff))));
  }

  static void validate(List<MetricColumn> columns, List<Reading> readings) {
    if (columns == null || columns.isEmpty()) {
      throw new MalformedBatchException("Batch does not name any columns");
    }
    if (readings == null) {
      throw new MalformedBatchException("Batch has no readings");
    }
    for (Reading reading : readings) {
      if (reading == null || reading.getTime() == null) {
        throw new MalformedBatchException("Reading without a time");
      }
      for (MetricColumn column : columns) {
        final Double value = reading.getValues() == null ? null : reading.getValues().get(column);
        if (value == null) {
          throw new MalformedBatchException(
              "Reading at " + reading.getTime() + " has no value for " + column.getColumnName());
        }
        if (!Double.isFinite(value)) {
          throw new MalformedBatchException(
              "Reading at " + reading.getTime() + " has non-finite " + column.getColumnName());
        }
      }
    }
  }

  private static List<Reading> sortMostRecentFirst(List<Reading> readings) {
    final List<Reading> sorted = new ArrayList<>(readings);
    sorted.sort(SnapshotService.MOST_RECENT_FIRST);
    return sorted;
  }

  private static List<SeriesRow> toRows(List<MetricColumn> columns, List<Reading> readings) {
    return readings.stream()
        .map(reading -> new SeriesRow()
            .setTime(reading.getTime())
            .setValues(reading.getValues().select(columns)))
        .collect(Collectors.toList());
  }
}
