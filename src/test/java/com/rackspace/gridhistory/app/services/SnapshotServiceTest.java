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

import static com.rackspace.gridhistory.app.services.SeriesRows.generation;
import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.gridhistory.app.model.Datum;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.Reading;
import com.rackspace.gridhistory.app.repos.InMemorySnapshotRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class SnapshotServiceTest {

  InMemorySnapshotRepository snapshotRepository;
  SnapshotService snapshotService;

  @BeforeEach
  void setUp() {
    snapshotRepository = new InMemorySnapshotRepository();
    snapshotService = new SnapshotService(snapshotRepository);
  }

  @Test
  void apply_takesFirstReadingPerColumn() {
    final Reading newest = new Reading()
        .setTime(Instant.parse("2024-03-10T12:30:00Z"))
        .setValues(new Datum().put(MetricColumn.DEMAND, 31000.0));
    final Reading older = new Reading()
        .setTime(Instant.parse("2024-03-10T12:00:00Z"))
        .setValues(new Datum()
            .put(MetricColumn.DEMAND, 30000.0)
            .put(MetricColumn.PRICE, 75.0));

    StepVerifier.create(snapshotService.apply(
        List.of(MetricColumn.DEMAND, MetricColumn.PRICE), List.of(newest, older)))
        .verifyComplete();

    assertThat(snapshotRepository.get(MetricColumn.DEMAND).getValue()).isEqualTo(31000.0);
    assertThat(snapshotRepository.get(MetricColumn.DEMAND).getTime())
        .isEqualTo(Instant.parse("2024-03-10T12:30:00Z"));
    // the newest reading had no price, so the older one supplies it
    assertThat(snapshotRepository.get(MetricColumn.PRICE).getValue()).isEqualTo(75.0);
    assertThat(snapshotRepository.get(MetricColumn.PRICE).getTime())
        .isEqualTo(Instant.parse("2024-03-10T12:00:00Z"));
  }

  @Test
  void getLatest() {
    StepVerifier.create(
        snapshotService.update(MetricColumn.WIND, 5.5, Instant.parse("2024-03-10T12:00:00Z"))
            .then(snapshotService.update(MetricColumn.SOLAR, 0.2,
                Instant.parse("2024-03-10T12:05:00Z")))
            .then(snapshotService.update(MetricColumn.WIND, 6.5,
                Instant.parse("2024-03-10T11:55:00Z")))
            .then(snapshotService.getLatest())
    )
        .expectNext(new Datum()
            .put(MetricColumn.WIND, 6.5)
            .put(MetricColumn.SOLAR, 0.2))
        .verifyComplete();

    StepVerifier.create(snapshotService.getLatestTime())
        .expectNext(Instant.parse("2024-03-10T12:05:00Z"))
        .verifyComplete();
  }

  @Test
  void sortMostRecentFirst() {
    final List<Reading> readings = new ArrayList<>(List.of(
        generation("2024-03-10T12:00:00Z", 1),
        generation("2024-03-10T12:10:00Z", 3),
        generation("2024-03-10T12:05:00Z", 2)));

    readings.sort(SnapshotService.MOST_RECENT_FIRST);

    assertThat(readings).extracting(Reading::getTime).containsExactly(
        Instant.parse("2024-03-10T12:10:00Z"),
        Instant.parse("2024-03-10T12:05:00Z"),
        Instant.parse("2024-03-10T12:00:00Z"));
  }

  @Test
  void emptySnapshot() {
    StepVerifier.create(snapshotService.getLatestTime())
        .verifyComplete();
    StepVerifier.create(snapshotService.getLatest())
        .expectNext(new Datum())
        .verifyComplete();
  }
}
