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

import static com.rackspace.gridhistory.app.services.DataTablesStatements.GRID;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_MILESTONES;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_PEAK_RECORDS;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.THRESHOLD;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TIMESTAMP;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.VALUE;

import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.errors.StorageUnavailableException;
import com.rackspace.gridhistory.app.model.Milestone;
import com.rackspace.gridhistory.app.model.PeakRecord;
import com.rackspace.gridhistory.app.services.DataTablesStatements;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class CassandraPeakRepository implements PeakRepository {

  private final ReactiveCqlTemplate cqlTemplate;
  private final UpsertStore upsertStore;
  private final DataTablesStatements dataTablesStatements;
  private final AppProperties appProperties;

  @Autowired
  public CassandraPeakRepository(ReactiveCqlTemplate cqlTemplate,
                                 UpsertStore upsertStore,
                                 DataTablesStatements dataTablesStatements,
                                 AppProperties appProperties) {
    this.cqlTemplate = cqlTemplate;
    this.upsertStore = upsertStore;
    this.dataTablesStatements = dataTablesStatements;
    this.appProperties = appProperties;
  }

  @Override
  public Mono<PeakRecord> findRecord() {
    return cqlTemplate.queryForRows(dataTablesStatements.peakRecordQuery(), appProperties.getGrid())
        .next()
        .map(row -> new PeakRecord(row.getDouble(VALUE), row.getInstant(TIMESTAMP)))
        .retryWhen(appProperties.getRetryRead().build())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new);
  }

  @Override
  public Mono<Void> saveRecord(PeakRecord record) {
    final Map<String, Object> columns = new LinkedHashMap<>();
    columns.put(VALUE, record.getValue());
    columns.put(TIMESTAMP, record.getTime());
    return upsertStore.upsert(TABLE_PEAK_RECORDS, Map.of(GRID, appProperties.getGrid()), columns);
  }

  @Override
  public Flux<Milestone> findMilestones() {
    return cqlTemplate.queryForRows(dataTablesStatements.milestonesQuery(), appProperties.getGrid())
        .map(row -> new Milestone(
            row.getInt(THRESHOLD), row.getDouble(VALUE), row.getInstant(TIMESTAMP)))
        .retryWhen(appProperties.getRetryRead().build())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new);
  }

  @Override
  public Mono<Boolean> insertMilestone(Milestone milestone) {
    final Map<String, Object> key = new LinkedHashMap<>();
    key.put(GRID, appProperties.getGrid());
    key.put(THRESHOLD, milestone.getThreshold());
    final Map<String, Object> columns = new LinkedHashMap<>();
    columns.put(VALUE, milestone.getValue());
    columns.put(TIMESTAMP, milestone.getTime());
    return upsertStore.insertIfAbsent(TABLE_MILESTONES, key, columns);
  }
}
