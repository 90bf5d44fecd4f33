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
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.repos.SeriesRepository;
import com.rackspace.gridhistory.app.utils.DateTimeUtils;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Bounds the two fine-grained tiers. The cutoff is rounded down to the bucket of the next tier so
 * the remaining rows always form complete buckets for the next promotion.
 */
@Service
@Slf4j
public class RetentionService {

  private final SeriesRepository seriesRepository;
  private final AppProperties appProperties;

  @Autowired
  public RetentionService(SeriesRepository seriesRepository, AppProperties appProperties) {
    this.seriesRepository = seriesRepository;
    this.appProperties = appProperties;
  }

  /**
   * @return the cutoff, rows strictly before it were deleted
   */
  public Mono<Instant> trim(Tier tier, Instant now) {
    final Instant cutoff;
    try {
      cutoff = cutoff(tier, now);
    } catch (IllegalArgumentException e) {
      return Mono.error(e);
    }
    log.debug("Trimming {} before {}", tier, cutoff);
    return seriesRepository.deleteBefore(tier, cutoff)
        .thenReturn(cutoff);
  }

  public Instant cutoff(Tier tier, Instant now) {
    switch (tier) {
      case FIVE_MINUTES:
        return DateTimeUtils.startOfHalfHour(now.minus(appProperties.getFiveMinuteRetention()));
      case HALF_HOURS:
        return DateTimeUtils.startOfDay(now.minus(appProperties.getHalfHourRetention()));
      default:
        throw new IllegalArgumentException(tier + " is kept permanently and never trimmed");
    }
  }
}
