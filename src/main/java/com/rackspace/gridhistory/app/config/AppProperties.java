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

package com.rackspace.gridhistory.app.config;

import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationFormat;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("grid-history")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * Identifies the grid whose history is stored. Every table is partitioned by this value so that
   * a tier can be scanned, batched and range-deleted within a single partition.
   */
  @NotBlank
  String grid = "national";

  /**
   * How long five-minute samples are kept. The cutoff is rounded down to the half hour so that
   * only samples of complete, already promoted half hours are removed.
   */
  @NotNull
  @DurationFormat(DurationStyle.SIMPLE)
  Duration fiveMinuteRetention = Duration.ofDays(1);

  /**
   * How long half-hour rows are kept. The cutoff is rounded down to midnight.
   */
  @NotNull
  @DurationFormat(DurationStyle.SIMPLE)
  Duration halfHourRetention = Duration.ofDays(28);

  /**
   * Subtracted from the newest five-minute sample before rounding down to the half hour. Must be
   * less than 30 minutes so that a half hour only closes once its last five-minute sample exists.
   */
  @NotNull
  @DurationFormat(DurationStyle.SIMPLE)
  Duration completenessMargin = Duration.ofMinutes(25);

  /**
   * The lowest integer threshold recorded as a milestone of the tracked peak metric.
   */
  @Min(0)
  int milestoneStart = 1;

  /**
   * The highest integer threshold recorded as a milestone. Values beyond it still update the
   * peak record.
   */
  @Min(1)
  int milestoneLimit = 1000;

  /**
   * When initially creating the Cassandra tables, this value will be used for the expired data
   * garbage collection.
   */
  @Min(60)
  int dataTableGcGraceSeconds = 86400;

  @NotNull
  @Valid
  RetrySpec retryWrite = new RetrySpec()
      .setMaxAttempts(5)
      .setMinBackoff(Duration.ofMillis(100));

  @NotNull
  @Valid
  RetrySpec retryRead = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(100));
}
