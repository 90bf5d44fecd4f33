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

import com.rackspace.gridhistory.app.downsample.DatumCollectors;
import com.rackspace.gridhistory.app.model.Datum;
import com.rackspace.gridhistory.app.model.GridState;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.SeriesRepository;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Assembles the reporting view of the history.
 */
@Service
@Slf4j
public class StateService {

  static final int HALF_HOURS_PER_DAY = 48;
  static final int DAYS_PER_WEEK = 7;
  static final int WEEKS_PER_YEAR = 52;

  private final SeriesRepository seriesRepository;
  private final SnapshotService snapshotService;
  private final PeakTracker peakTracker;

  @Autowired
  public StateService(SeriesRepository seriesRepository,
                      SnapshotService snapshotService,
                      PeakTracker peakTracker) {
    this.seriesRepository = seriesRepository;
    this.snapshotService = snapshotService;
    this.peakTracker = peakTracker;
  }

  public Mono<GridState> getState() {
    final GridState state = new GridState();
    return Mono.when(
        snapshotService.getLatestTime().doOnNext(state::setLatestTime),
        snapshotService.getLatest().doOnNext(state::setLatest),
        window(pastDay()).doOnNext(rows -> {
          state.setPastDay(average(rows));
          state.setDaySeries(series(rows));
        }),
        window(pastWeek()).doOnNext(rows -> {
          state.setPastWeek(average(rows));
          state.setWeekSeries(series(rows));
        }),
        window(pastYear()).doOnNext(rows -> {
          state.setPastYear(average(rows));
          state.setYearSeries(series(rows));
        }),
        seriesRepository.findAll(Tier.DAYS).collect(DatumCollectors.averaging(MetricColumn.all()))
            .doOnNext(state::setAllTime),
        window(seriesRepository.findAll(Tier.YEARS)).doOnNext(rows ->
            state.setAllTimeSeries(series(rows))),
        peakTracker.getRecord().doOnNext(state::setRecord),
        peakTracker.getMilestones().collectList().doOnNext(state::setMilestones)
    )
        .thenReturn(state)
        .checkpoint();
  }

  /**
   * @return the time of the newest half-hour bucket, empty when there is none
   */
  public Mono<Instant> getLatestBucketTime() {
    return seriesRepository.findLatest(Tier.HALF_HOURS)
        .map(SeriesRow::getTime);
  }

  private Flux<SeriesRow> pastDay() {
    return seriesRepository.findLatest(Tier.HALF_HOURS, HALF_HOURS_PER_DAY);
  }

  /**
   * The seven days before the newest, which is usually still incomplete.
   */
  private Flux<SeriesRow> pastWeek() {
    return seriesRepository.findLatest(Tier.DAYS, DAYS_PER_WEEK + 1).skip(1);
  }

  private Flux<SeriesRow> pastYear() {
    return seriesRepository.findLatest(Tier.WEEKS, WEEKS_PER_YEAR + 1).skip(1);
  }

  private static Mono<List<SeriesRow>> window(Flux<SeriesRow> rows) {
    return rows.collectList();
  }

  private static Datum average(List<SeriesRow> rows) {
    return rows.stream().collect(DatumCollectors.averaging(MetricColumn.all()));
  }

  private static SortedMap<Instant, Datum> series(List<SeriesRow> rows) {
    final SortedMap<Instant, Datum> series = new TreeMap<>();
    rows.forEach(row -> series.put(row.getTime(), row.getValues()));
    return series;
  }
}
