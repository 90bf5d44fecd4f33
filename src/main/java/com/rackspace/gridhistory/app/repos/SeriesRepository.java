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

package com.rackspace.gridhistory.app.repos;

import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import java.time.Instant;
import java.util.List;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Rows of the history tiers, keyed by bucket time within a tier.
 */
public interface SeriesRepository {

  /**
   * @return every row of the tier in ascending time order
   */
  Flux<SeriesRow> findAll(Tier tier);

  /**
   * @return rows strictly after the given time in ascending time order
   */
  Flux<SeriesRow> findAfter(Tier tier, Instant time);

  /**
   * @return rows at or after the given time in ascending time order
   */
  Flux<SeriesRow> findFrom(Tier tier, Instant time);

  Mono<SeriesRow> find(Tier tier, Instant time);

  /**
   * @return up to {@code limit} rows, newest first
   */
  Flux<SeriesRow> findLatest(Tier tier, int limit);

  default Mono<SeriesRow> findLatest(Tier tier) {
    return findLatest(tier, 1).next();
  }

  /**
   * @return every row of the tier, newest first
   */
  default Flux<SeriesRow> findAllNewestFirst(Tier tier) {
    return findLatest(tier, Integer.MAX_VALUE);
  }

  /**
   * Writes the columns present in the row's values, plus its visits when not null.
   */
  Mono<Void> upsert(Tier tier, SeriesRow row);

  /**
   * Same as {@link #upsert(Tier, SeriesRow)} for many rows, applied atomically.
   */
  Mono<Void> upsertAll(Tier tier, List<SeriesRow> rows);

  /**
   * Deletes rows strictly older than the given time.
   */
  Mono<Void> deleteBefore(Tier tier, Instant time);
}
