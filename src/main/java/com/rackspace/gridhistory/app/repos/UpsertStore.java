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

import java.util.List;
import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * Insert-or-overwrite-by-key storage primitive. Every write of the history goes through it so
 * that replaying the same inputs always yields the same stored state.
 */
public interface UpsertStore {

  /**
   * Inserts a row or, when a row with the same key exists, overwrites only the given value
   * columns leaving the others untouched. A null value clears that column.
   */
  Mono<Void> upsert(String table, Map<String, Object> keyColumns, Map<String, Object> valueColumns);

  /**
   * Applies several upserts to the same table as one atomic unit.
   */
  Mono<Void> upsertAll(String table, List<UpsertRow> rows);

  /**
   * Inserts the row only if no row exists with the same key.
   *
   * @return true if the row was inserted
   */
  Mono<Boolean> insertIfAbsent(String table, Map<String, Object> keyColumns,
                               Map<String, Object> valueColumns);

  /**
   * Deletes every row whose key starts with the given columns.
   */
  Mono<Void> delete(String table, Map<String, Object> keyColumns);
}
