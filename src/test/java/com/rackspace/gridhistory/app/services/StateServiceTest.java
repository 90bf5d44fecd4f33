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

import static com.rackspace.gridhistory.app.services.SeriesRows.row;
import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.model.GridState;
import com.rackspace.gridhistory.app.model.Milestone;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.PeakRecord;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.InMemoryPeakRepository;
import com.rackspace.gridhistory.app.repos.InMemorySeriesRepository;
import com.rackspace.gridhistory.app.repos.InMemorySnapshotRepository;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class StateServiceTest {

  InMemorySeriesRepository seriesRepository;
  InMemorySnapshotRepository snapshotRepository;
  InMemoryPeakRepository peakRepository;
  SnapshotService snapshotService;
  StateService stateService;

  @BeforeEach
  void setUp() {
    seriesRepository = new InMemorySeriesRepository();
    snapshotRepository = new InMemorySnapshotRepository();
    peakRepository = new InMemoryPeakRepository();
    snapshotService = new SnapshotService(snapshotRepository);
    stateService = new StateService(seriesRepository, snapshotService,
        new PeakTracker(peakRepository, seriesRepository, new AppProperties()));
  }

  /**
   * Adds rows with wind 1, 2, 3... one step apart.
   */
  private void rows(Tier tier, String start, Duration step, int count) {
    for (int i = 0; i < count; i++) {
      seriesRepository.put(tier, row(Instant.parse(start).plus(step.multipliedBy(i)).toString(),
          MetricColumn.WIND, i + 1));
    }
  }

  @Test
  void getState() {
    // 50 half hours, the two oldest fall outside the past day
    rows(Tier.HALF_HOURS, "2024-03-09T00:00:00Z", Duration.ofMinutes(30), 50);
    // 9 days, the newest is still in progress and the oldest too far back
    rows(Tier.DAYS, "2024-03-02T00:00:00Z", Duration.ofDays(1), 9);
    // 3 weeks, the newest is still in progress
    rows(Tier.WEEKS, "2024-02-19T00:00:00Z", Duration.ofDays(7), 3);
    rows(Tier.YEARS, "2024-01-01T00:00:00Z", Duration.ofDays(31), 2);

    StepVerifier.create(
        snapshotService.update(MetricColumn.WIND, 7.5, Instant.parse("2024-03-10T00:25:00Z"))
            .then(snapshotService.update(MetricColumn.DEMAND, 30000,
                Instant.parse("2024-03-10T00:00:00Z")))
            .then(peakRepository.saveRecord(
                new PeakRecord(50.0, Instant.parse("2024-03-09T12:00:00Z"))))
            .then(peakRepository.insertMilestone(
                new Milestone(1, 50.0, Instant.parse("2024-03-09T12:00:00Z"))))
    )
        .expectNext(true)
        .verifyComplete();

    final GridState state = stateService.getState().block();
    assertThat(state).isNotNull();

    assertThat(state.getLatestTime()).isEqualTo(Instant.parse("2024-03-10T00:25:00Z"));
    assertThat(state.getLatest().get(MetricColumn.WIND)).isEqualTo(7.5);
    assertThat(state.getLatest().get(MetricColumn.DEMAND)).isEqualTo(30000);

    // mean of 3..50
    assertThat(state.getPastDay().get(MetricColumn.WIND)).isEqualTo(26.5);
    assertThat(state.getDaySeries()).hasSize(48);
    assertThat(state.getDaySeries().firstKey()).isEqualTo(Instant.parse("2024-03-09T01:00:00Z"));

    // mean of 2..8
    assertThat(state.getPastWeek().get(MetricColumn.WIND)).isEqualTo(5.0);
    assertThat(state.getWeekSeries()).hasSize(7);
    assertThat(state.getWeekSeries().lastKey()).isEqualTo(Instant.parse("2024-03-09T00:00:00Z"));

    // mean of 1..2
    assertThat(state.getPastYear().get(MetricColumn.WIND)).isEqualTo(1.5);
    assertThat(state.getYearSeries()).hasSize(2);

    // mean of 1..9
    assertThat(state.getAllTime().get(MetricColumn.WIND)).isEqualTo(5.0);
    assertThat(state.getAllTimeSeries()).containsOnlyKeys(
        Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"));

    assertThat(state.getRecord().getValue()).isEqualTo(50.0);
    assertThat(state.getMilestones()).hasSize(1);
  }

  @Test
  void getState_empty() {
    final GridState state = stateService.getState().block();
    assertThat(state).isNotNull();

    assertThat(state.getLatestTime()).isNull();
    assertThat(state.getLatest().isEmpty()).isTrue();
    assertThat(state.getPastDay().has(MetricColumn.WIND)).isFalse();
    assertThat(state.getDaySeries()).isEmpty();
    assertThat(state.getAllTimeSeries()).isEmpty();
    assertThat(state.getRecord()).isNull();
    assertThat(state.getMilestones()).isEmpty();
  }

  @Test
  void getLatestBucketTime() {
    rows(Tier.HALF_HOURS, "2024-03-09T00:00:00Z", Duration.ofMinutes(30), 3);

    StepVerifier.create(stateService.getLatestBucketTime())
        .expectNext(Instant.parse("2024-03-09T01:00:00Z"))
        .verifyComplete();
  }

  @Test
  void getLatestBucketTime_empty() {
    StepVerifier.create(stateService.getLatestBucketTime())
        .verifyComplete();
  }
}
