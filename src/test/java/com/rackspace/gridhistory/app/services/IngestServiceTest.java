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
import static com.rackspace.gridhistory.app.services.SeriesRows.row;
import static com.rackspace.gridhistory.app.services.SeriesRows.slowRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.errors.MalformedBatchException;
import com.rackspace.gridhistory.app.model.Datum;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.PeakRecord;
import com.rackspace.gridhistory.app.model.Reading;
import com.rackspace.gridhistory.app.model.ReadingBatch;
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.InMemoryPeakRepository;
import com.rackspace.gridhistory.app.repos.InMemorySeriesRepository;
import com.rackspace.gridhistory.app.repos.InMemorySnapshotRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestServiceTest {

  static final Instant NOW = Instant.parse("2024-03-10T12:27:00Z");

  @Mock
  TimestampProvider timestampProvider;

  InMemorySeriesRepository seriesRepository;
  InMemorySnapshotRepository snapshotRepository;
  InMemoryPeakRepository peakRepository;
  IngestService ingestService;

  @BeforeEach
  void setUp() {
    when(timestampProvider.now()).thenReturn(NOW);

    final AppProperties appProperties = new AppProperties();
    seriesRepository = new InMemorySeriesRepository();
    snapshotRepository = new InMemorySnapshotRepository();
    peakRepository = new InMemoryPeakRepository();
    final PeakTracker peakTracker = new PeakTracker(peakRepository, seriesRepository,
        appProperties);
    ingestService = new IngestService(
        seriesRepository,
        new SnapshotService(snapshotRepository),
        new DownsampleService(seriesRepository, appProperties),
        new ForwardPropagationService(seriesRepository),
        new RetentionService(seriesRepository, appProperties),
        peakTracker,
        timestampProvider
    );
  }

  /**
   * @return generation readings every five minutes from the start, wind 1, 2, 3..., shuffled
   */
  static List<Reading> generationReadings(String start, int count) {
    final List<Reading> readings = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      readings.add(generation(Instant.parse(start).plus(Duration.ofMinutes(5L * i)), i + 1));
    }
    Collections.shuffle(readings, new Random(42));
    return readings;
  }

  @Nested
  class ingestGeneration {

    @Test
    void closesCompleteHalfHoursAndPropagates() {
      seriesRepository.put(Tier.HALF_HOURS, slowRow("2024-03-10T11:00:00Z", 30000, 60, 180));

      // 11:30 through 12:25, the latest reading closes the 12:00 half hour
      StepVerifier.create(ingestService.ingestGeneration(
          generationReadings("2024-03-10T11:30:00Z", 12)))
          .verifyComplete();

      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).hasSize(12);

      final List<SeriesRow> halfHours = seriesRepository.rows(Tier.HALF_HOURS);
      assertThat(halfHours).extracting(SeriesRow::getTime).containsExactly(
          Instant.parse("2024-03-10T11:00:00Z"),
          Instant.parse("2024-03-10T11:30:00Z"),
          Instant.parse("2024-03-10T12:00:00Z"));
      assertThat(halfHours.get(1).getValues().get(MetricColumn.WIND)).isEqualTo(3.5);
      assertThat(halfHours.get(2).getValues().get(MetricColumn.WIND)).isEqualTo(9.5);
      assertThat(halfHours.get(2).getValues().get(MetricColumn.SOLAR)).isEqualTo(1.0);
      for (SeriesRow row : halfHours.subList(1, 3)) {
        assertThat(row.getValues().get(MetricColumn.DEMAND)).isEqualTo(30000);
        assertThat(row.getValues().get(MetricColumn.PRICE)).isEqualTo(60);
        assertThat(row.getValues().get(MetricColumn.EMISSIONS)).isEqualTo(180);
      }

      // latest snapshot comes from the newest reading despite the shuffled input
      assertThat(snapshotRepository.get(MetricColumn.WIND).getValue()).isEqualTo(12.0);
      assertThat(snapshotRepository.get(MetricColumn.WIND).getTime())
          .isEqualTo(Instant.parse("2024-03-10T12:25:00Z"));

      // peak is taken from the newest half hour: wind 9.5 plus embedded wind 1
      StepVerifier.create(peakRepository.findRecord())
          .expectNext(new PeakRecord(10.5, Instant.parse("2024-03-10T12:00:00Z")))
          .verifyComplete();
      StepVerifier.create(peakRepository.findMilestones())
          .expectNextCount(10)
          .verifyComplete();
    }

    @Test
    void incompleteHalfHourIsNotPromoted() {
      StepVerifier.create(ingestService.ingestGeneration(
          generationReadings("2024-03-10T12:00:00Z", 5)))
          .verifyComplete();

      assertThat(seriesRepository.rows(Tier.HALF_HOURS)).isEmpty();
      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).hasSize(5);

      StepVerifier.create(ingestService.ingestGeneration(
          List.of(generation("2024-03-10T12:25:00Z", 6))))
          .verifyComplete();

      assertThat(seriesRepository.rows(Tier.HALF_HOURS)).extracting(SeriesRow::getTime)
          .containsExactly(Instant.parse("2024-03-10T12:00:00Z"));
    }

    @Test
    void replayingTheSameBatchChangesNothing() {
      final List<Reading> readings = generationReadings("2024-03-10T11:30:00Z", 12);
      seriesRepository.put(Tier.HALF_HOURS, slowRow("2024-03-10T11:00:00Z", 30000, 60, 180));

      StepVerifier.create(ingestService.ingestGeneration(readings)).verifyComplete();
      final List<SeriesRow> first = seriesRepository.rows(Tier.HALF_HOURS);

      StepVerifier.create(ingestService.ingestGeneration(readings)).verifyComplete();

      assertThat(seriesRepository.rows(Tier.HALF_HOURS)).isEqualTo(first);
    }

    @Test
    void trimsFiveMinuteBuffer() {
      final List<Reading> readings = new ArrayList<>();
      readings.add(generation("2024-03-09T11:55:00Z", 1));
      readings.add(generation("2024-03-09T12:00:00Z", 1));
      readings.add(generation("2024-03-10T12:25:00Z", 1));

      StepVerifier.create(ingestService.ingestGeneration(readings)).verifyComplete();

      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).extracting(SeriesRow::getTime)
          .containsExactly(Instant.parse("2024-03-09T12:00:00Z"),
              Instant.parse("2024-03-10T12:25:00Z"));
    }

    @Test
    void malformedBatchWritesNothing() {
      final List<Reading> readings = generationReadings("2024-03-10T11:30:00Z", 6);
      readings.get(3).getValues().put(MetricColumn.HYDRO, null);

      StepVerifier.create(ingestService.ingestGeneration(readings))
          .expectError(MalformedBatchException.class)
          .verify();

      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).isEmpty();
      assertThat(snapshotRepository.get(MetricColumn.WIND)).isNull();
    }

    @Test
    void nonFiniteValueIsMalformed() {
      final List<Reading> readings = List.of(generation("2024-03-10T11:30:00Z", Double.NaN));

      StepVerifier.create(ingestService.ingestGeneration(readings))
          .expectError(MalformedBatchException.class)
          .verify();
    }

    @Test
    void emptyBatchIsNoOp() {
      StepVerifier.create(ingestService.ingestGeneration(List.of()))
          .verifyComplete();

      assertThat(seriesRepository.batchesWritten(Tier.FIVE_MINUTES)).isZero();
    }
  }

  @Nested
  class ingest {

    @Test
    void halfHourlyLatest() {
      final ReadingBatch batch = new ReadingBatch()
          .setColumns(List.of(MetricColumn.DEMAND))
          .setLatest(true)
          .setHalfHourly(true)
          .setReadings(List.of(
              new Reading().setTime(Instant.parse("2024-03-10T11:30:00Z"))
                  .setValues(new Datum().put(MetricColumn.DEMAND, 29000.0)),
              new Reading().setTime(Instant.parse("2024-03-10T12:00:00Z"))
                  .setValues(new Datum()
                      .put(MetricColumn.DEMAND, 31000.0)
                      // not one of the batch columns, so ignored
                      .put(MetricColumn.PRICE, 99.0))));
      seriesRepository.put(Tier.HALF_HOURS, row("2024-03-10T12:00:00Z", MetricColumn.WIND, 4.0));

      StepVerifier.create(ingestService.ingest(batch)).verifyComplete();

      assertThat(snapshotRepository.get(MetricColumn.DEMAND).getValue()).isEqualTo(31000.0);
      assertThat(snapshotRepository.get(MetricColumn.PRICE)).isNull();
      final SeriesRow updated = seriesRepository.row(Tier.HALF_HOURS,
          Instant.parse("2024-03-10T12:00:00Z"));
      assertThat(updated.getValues().get(MetricColumn.DEMAND)).isEqualTo(31000.0);
      assertThat(updated.getValues().get(MetricColumn.WIND)).isEqualTo(4.0);
      assertThat(updated.getValues().contains(MetricColumn.PRICE)).isFalse();
      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).isEmpty();
    }

    @Test
    void fiveMinuteNotLatest() {
      final ReadingBatch batch = new ReadingBatch()
          .setColumns(List.of(MetricColumn.EMISSIONS))
          .setReadings(List.of(new Reading().setTime(Instant.parse("2024-03-10T12:05:00Z"))
              .setValues(new Datum().put(MetricColumn.EMISSIONS, 150.0))));

      StepVerifier.create(ingestService.ingest(batch)).verifyComplete();

      assertThat(snapshotRepository.get(MetricColumn.EMISSIONS)).isNull();
      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).hasSize(1);
      assertThat(seriesRepository.rows(Tier.HALF_HOURS)).isEmpty();
    }

    @Test
    void noColumnsIsMalformed() {
      final ReadingBatch batch = new ReadingBatch()
          .setReadings(List.of(new Reading().setTime(Instant.parse("2024-03-10T12:05:00Z"))));

      StepVerifier.create(ingestService.ingest(batch))
          .expectError(MalformedBatchException.class)
          .verify();
    }

    @Test
    void missingTimeIsMalformed() {
      final ReadingBatch batch = new ReadingBatch()
          .setColumns(List.of(MetricColumn.PRICE))
          .setLatest(true)
          .setReadings(List.of(
              new Reading().setTime(Instant.parse("2024-03-10T12:00:00Z"))
                  .setValues(new Datum().put(MetricColumn.PRICE, 50.0)),
              new Reading().setValues(new Datum().put(MetricColumn.PRICE, 51.0))));

      StepVerifier.create(ingestService.ingest(batch))
          .expectError(MalformedBatchException.class)
          .verify();

      assertThat(snapshotRepository.get(MetricColumn.PRICE)).isNull();
      assertThat(seriesRepository.rows(Tier.FIVE_MINUTES)).isEmpty();
    }

    @Test
    void emptyBatchIsNoOp() {
      final ReadingBatch batch = new ReadingBatch()
          .setColumns(List.of(MetricColumn.PRICE))
          .setLatest(true)
          .setHalfHourly(true);

      StepVerifier.create(ingestService.ingest(batch)).verifyComplete();

      assertThat(seriesRepository.batchesWritten(Tier.HALF_HOURS)).isZero();
    }
  }

  @Test
  void recordVisits() {
    seriesRepository.put(Tier.HALF_HOURS, row("2024-03-10T12:00:00Z", MetricColumn.WIND, 4.0));

    StepVerifier.create(
        ingestService.recordVisits(Instant.parse("2024-03-10T12:10:00Z"), 1)
            .then(ingestService.recordVisits(Instant.parse("2024-03-10T12:29:59Z"), 2))
            .then(ingestService.recordVisits(Instant.parse("2024-03-10T12:30:00Z"), 1))
    ).verifyComplete();

    final SeriesRow bucket = seriesRepository.row(Tier.HALF_HOURS,
        Instant.parse("2024-03-10T12:00:00Z"));
    assertThat(bucket.getVisits()).isEqualTo(3);
    assertThat(bucket.getValues().get(MetricColumn.WIND)).isEqualTo(4.0);
    assertThat(seriesRepository.row(Tier.HALF_HOURS, Instant.parse("2024-03-10T12:30:00Z"))
        .getVisits()).isEqualTo(1);
  }

  @Test
  void recordVisits_rejectsNonPositiveCount() {
    StepVerifier.create(ingestService.recordVisits(NOW, 0))
        .expectError(MalformedBatchException.class)
        .verify();
  }

  @Test
  void finishUpdate() {
    seriesRepository
        // older than the half-hour horizon of 2024-02-11
        .put(Tier.HALF_HOURS, slowRow("2024-02-10T23:30:00Z", 20000, 40, 100).setVisits(2))
        .put(Tier.HALF_HOURS, slowRow("2024-03-09T10:00:00Z", 30000, 50, 150).setVisits(1))
        .put(Tier.HALF_HOURS, slowRow("2024-03-09T10:30:00Z", 32000, 70, 170).setVisits(4))
        .put(Tier.HALF_HOURS, slowRow("2024-03-10T10:00:00Z", 28000, 60, 160));

    StepVerifier.create(ingestService.finishUpdate()).verifyComplete();

    assertThat(seriesRepository.rows(Tier.HALF_HOURS)).hasSize(3);

    final List<SeriesRow> days = seriesRepository.rows(Tier.DAYS);
    assertThat(days).extracting(SeriesRow::getTime).containsExactly(
        Instant.parse("2024-03-09T00:00:00Z"), Instant.parse("2024-03-10T00:00:00Z"));
    assertThat(days.get(0).getValues().get(MetricColumn.DEMAND)).isEqualTo(31000.0);
    assertThat(days.get(0).getVisits()).isEqualTo(5);

    // 2024-03-09 is a Saturday, 2024-03-10 a Sunday
    final List<SeriesRow> weeks = seriesRepository.rows(Tier.WEEKS);
    assertThat(weeks).extracting(SeriesRow::getTime)
        .containsExactly(Instant.parse("2024-03-04T00:00:00Z"));
    assertThat(weeks.get(0).getValues().get(MetricColumn.DEMAND)).isEqualTo(29500.0);
    assertThat(weeks.get(0).getVisits()).isEqualTo(5);

    final List<SeriesRow> months = seriesRepository.rows(Tier.YEARS);
    assertThat(months).extracting(SeriesRow::getTime)
        .containsExactly(Instant.parse("2024-03-01T00:00:00Z"));
    assertThat(months.get(0).getValues().get(MetricColumn.PRICE)).isEqualTo(60.0);
  }

  @Test
  void visitsInOpenHalfHourDoNotHidePropagationOrPeak() {
    seriesRepository.put(Tier.HALF_HOURS, slowRow("2024-03-10T11:00:00Z", 30000, 60, 180));

    StepVerifier.create(
        ingestService.recordVisits(Instant.parse("2024-03-10T12:31:00Z"), 1)
            .then(ingestService.ingestGeneration(generationReadings("2024-03-10T11:30:00Z", 12)))
    ).verifyComplete();

    for (String time : new String[]{"2024-03-10T11:30:00Z", "2024-03-10T12:00:00Z"}) {
      final SeriesRow row = seriesRepository.row(Tier.HALF_HOURS, Instant.parse(time));
      assertThat(row.getValues().get(MetricColumn.DEMAND)).isEqualTo(30000);
      assertThat(row.getValues().get(MetricColumn.PRICE)).isEqualTo(60);
      assertThat(row.getValues().has(MetricColumn.WIND)).isTrue();
    }
    // the open half hour only gets slow values once it is closed
    final SeriesRow open = seriesRepository.row(Tier.HALF_HOURS,
        Instant.parse("2024-03-10T12:30:00Z"));
    assertThat(open.getVisits()).isEqualTo(1);
    assertThat(open.getValues().contains(MetricColumn.DEMAND)).isFalse();

    StepVerifier.create(peakRepository.findRecord())
        .expectNext(new PeakRecord(10.5, Instant.parse("2024-03-10T12:00:00Z")))
        .verifyComplete();
  }

  @Test
  void finishUpdate_onlyRecomputesBucketsOverlappingHalfHours() {
    seriesRepository
        .put(Tier.DAYS, slowRow("2023-01-10T00:00:00Z", 10000, 10, 10).setVisits(7))
        .put(Tier.WEEKS, slowRow("2023-01-09T00:00:00Z", 10000, 10, 10).setVisits(7))
        .put(Tier.HALF_HOURS, slowRow("2024-03-10T10:00:00Z", 28000, 60, 160));

    StepVerifier.create(ingestService.finishUpdate()).verifyComplete();

    assertThat(seriesRepository.rows(Tier.WEEKS)).extracting(SeriesRow::getTime).containsExactly(
        Instant.parse("2023-01-09T00:00:00Z"), Instant.parse("2024-03-04T00:00:00Z"));
    assertThat(seriesRepository.rows(Tier.WEEKS).get(1).getValues().get(MetricColumn.DEMAND))
        .isEqualTo(28000.0);
    assertThat(seriesRepository.rows(Tier.YEARS)).extracting(SeriesRow::getTime)
        .containsExactly(Instant.parse("2024-03-01T00:00:00Z"));
  }

  @Test
  void finishUpdate_emptyHalfHoursPromotesNothing() {
    seriesRepository.put(Tier.DAYS, slowRow("2023-01-10T00:00:00Z", 10000, 10, 10));

    StepVerifier.create(ingestService.finishUpdate()).verifyComplete();

    assertThat(seriesRepository.rows(Tier.WEEKS)).isEmpty();
    assertThat(seriesRepository.rows(Tier.YEARS)).isEmpty();
  }
}
