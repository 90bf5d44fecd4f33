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
import static com.rackspace.gridhistory.app.services.DataTablesStatements.SOURCE;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_LATEST;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TIMESTAMP;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.VALUE;

import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.errors.StorageUnavailableException;
import com.rackspace.gridhistory.app.model.LatestValue;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.services.DataTablesStatements;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class CassandraSnapshotRepository implements SnapshotRepository {

  private final ReactiveCqlTemplate cqlTemplate;
  private final UpsertStore upsertStore;
  private final DataTablesStatements dataTablesStatements;
  private final AppProperties appProperties;

  @Autowired
  public CassandraSnapshotRepository(ReactiveCqlTemplate cqlTemplate,
                                     UpsertStore upsertStore,
                                     DataTablesStatements dataTablesStatements,
                                     AppProperties appProperties) {
    this.cqlTemplate = cqlTemplate;
    this.upsertStore = upsertStore;
    this.dataTablesStatements = dataTablesStatements;
    this.appProperties = appProperties;
  }

  @Override
  public Flux<LatestValue> findAll() {
    return cqlTemplate.queryForRows(dataTablesStatements.latestQuery(), appProperties.getGrid())
        .map(row -> new LatestValue(
            MetricColumn.fromColumnName(row.getString(SOURCE)),
            row.getDouble(VALUE),
            row.getInstant(TIMESTAMP)))
        .retryWhen(appProperties.getRetryRead().build())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new);
  }

  @Override
  public Mono<Void> upsertAll(List<LatestValue> values) {
    return upsertStore.upsertAll(TABLE_LATEST,
        values.stream()
            .map(latest -> {
              final Map<String, Object> key = new LinkedHashMap<>();
              key.put(GRID, appProperties.getGrid());
              key.put(SOURCE, latest.getSource().getColumnName());
              final Map<String, Object> columns = new LinkedHashMap<>();
              columns.put(VALUE, latest.getValue());
              columns.put(TIMESTAMP, latest.getTime());
              return UpsertRow.of(key, columns);
            })
            .collect(Collectors.toList()));
  }
}
