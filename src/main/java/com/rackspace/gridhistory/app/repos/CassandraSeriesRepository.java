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
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TIMESTAMP;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.VISITS;

import com.datastax.oss.driver.api.core.cql.Row;
import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.errors.StorageUnavailableException;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.SeriesRow;
import com.rackspace.gridhistory.app.model.Tier;
import com.rackspace.gridhistory.app.services.DataTablesStatements;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Each tier lives in its own table with all of its rows in the configured grid's partition,
 * clustered by bucket time.
 */
@Repository
@Slf4j
public class CassandraSeriesRepository implements SeriesRepository {

  private final ReactiveCqlTemplate cqlTemplate;
  private final UpsertStore upsertStore;
  private final DataTablesStatements dataTablesStatements;
  private final AppProperties appProperties;

  @Autowired
  public CassandraSeriesRepository(ReactiveCqlTemplate cqlTemplate,
                                   UpsertStore upsertStore,
                                   DataTablesStatements dataTablesStatements,
                                   AppProperties appProperties) {
    this.cqlTemplate = cqlTemplate;
    this.upsertStore = upsertStore;
    this.dataTablesStatements = dataTablesStatements;
    this.appProperties = appProperties;
  }

  @Override
  public Flux<SeriesRow> findAll(Tier tier) {
    return query(cqlTemplate.queryForRows(dataTablesStatements.seriesQuery(tier),
        appProperties.getGrid()));
  }

  @Override
  public Flux<SeriesRow> findAfter(Tier tier, Instant time) {
    return query(cqlTemplate.queryForRows(dataTablesStatements.seriesQueryAfter(tier),
        appProperties.getGrid(), time));
  }

  @Override
  public Flux<SeriesRow> findFrom(Tier tier, Instant time) {
    return query(cqlTemplate.queryForRows(dataTablesStatements.seriesQueryFrom(tier),
        appProperties.getGrid(), time));
  }

  @Override
  public Mono<SeriesRow> find(Tier tier, Instant time) {
    return query(cqlTemplate.queryForRows(dataTablesStatements.seriesQueryAt(tier),
        appProperties.getGrid(), time))
        .next();
  }

  @Override
  public Flux<SeriesRow> findLatest(Tier tier, int limit) {
    return query(cqlTemplate.queryForRows(dataTablesStatements.seriesQueryLatest(tier),
        appProperties.getGrid(), limit));
  }

  @Override
  public Mono<Void> upsert(Tier tier, SeriesRow row) {
    return upsertStore.upsert(tier.getTableName(), key(row), values(row));
  }

  @Override
  public Mono<Void> upsertAll(Tier tier, List<SeriesRow> rows) {
    return upsertStore.upsertAll(tier.getTableName(),
        rows.stream()
            .map(row -> UpsertRow.of(key(row), values(row)))
            .collect(Collectors.toList()));
  }

  @Override
  public Mono<Void> deleteBefore(Tier tier, Instant time) {
    log.debug("Deleting {} rows before {}", tier, time);
    return cqlTemplate.execute(dataTablesStatements.seriesDeleteBefore(tier),
        appProperties.getGrid(), time)
        .retryWhen(appProperties.getRetryWrite().build())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new)
        .then();
  }

  private Flux<SeriesRow> query(Flux<Row> rows) {
    return rows
        .map(CassandraSeriesRepository::toSeriesRow)
        .retryWhen(appProperties.getRetryRead().build())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new)
        .checkpoint();
  }

  private Map<String, Object> key(SeriesRow row) {
    final Map<String, Object> key = new LinkedHashMap<>();
    key.put(GRID, appProperties.getGrid());
    key.put(TIMESTAMP, row.getTime());
    return key;
  }

  private static Map<String, Object> values(SeriesRow row) {
    final Map<String, Object> values = new LinkedHashMap<>();
    for (MetricColumn column : MetricColumn.all()) {
      if (row.getValues().contains(column)) {
        values.put(column.getColumnName(), row.getValues().get(column));
      }
    }
    if (row.getVisits() != null) {
      values.put(VISITS, row.getVisits());
    }
    return values;
  }

  static SeriesRow toSeriesRow(Row row) {
    final SeriesRow seriesRow = new SeriesRow()
        .setTime(row.getInstant(TIMESTAMP))
        .setVisits(row.isNull(VISITS) ? null : row.getInt(VISITS));
    for (MetricColumn column : MetricColumn.all()) {
      if (!row.isNull(column.getColumnName())) {
        seriesRow.getValues().put(column, row.getDouble(column.getColumnName()));
      }
    }
    return seriesRow;
  }
}
