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

import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.BatchType;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.SimpleStatementBuilder;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.errors.StorageUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Cassandra updates are upserts already: {@code UPDATE ... SET} creates the row when it is missing
 * and only touches the columns it names.
 */
@Repository
@Slf4j
public class CassandraUpsertStore implements UpsertStore {

  private final ReactiveCqlTemplate cqlTemplate;
  private final AppProperties appProperties;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public CassandraUpsertStore(ReactiveCqlTemplate cqlTemplate,
                              AppProperties appProperties,
                              MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.appProperties = appProperties;
    this.dbOperationErrorsCounter = meterRegistry.counter("grid_history.db.operation.errors",
        "type", "write");
  }

  @Override
  public Mono<Void> upsert(String table, Map<String, Object> keyColumns,
                           Map<String, Object> valueColumns) {
    return write(upsertStatement(table, keyColumns, valueColumns));
  }

  @Override
  public Mono<Void> upsertAll(String table, List<UpsertRow> rows) {
    if (rows.isEmpty()) {
      return Mono.empty();
    }
    final BatchStatementBuilder batchStatementBuilder = new BatchStatementBuilder(BatchType.LOGGED);
    rows.forEach(row ->
        batchStatementBuilder.addStatement(
            upsertStatement(table, row.getKeyColumns(), row.getValueColumns())));
    log.trace("Upserting batch of {} rows into {}", rows.size(), table);
    return write(batchStatementBuilder.build());
  }

  @Override
  public Mono<Boolean> insertIfAbsent(String table, Map<String, Object> keyColumns,
                                      Map<String, Object> valueColumns) {
    final List<String> columns = new ArrayList<>(keyColumns.keySet());
    columns.addAll(valueColumns.keySet());
    final List<Object> values = new ArrayList<>(keyColumns.values());
    values.addAll(valueColumns.values());

    final String cql = "INSERT INTO " + table + " (" + String.join(",", columns) + ")"
        + " VALUES (" + placeholders(columns.size()) + ") IF NOT EXISTS";
    return cqlTemplate.execute(cql, values.toArray())
        .retryWhen(appProperties.getRetryWrite().build())
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new)
        .checkpoint();
  }

  @Override
  public Mono<Void> delete(String table, Map<String, Object> keyColumns) {
    final String cql = "DELETE FROM " + table + " WHERE " + conditions(keyColumns);
    return write(SimpleStatement.newInstance(cql, keyColumns.values().toArray()));
  }

  SimpleStatement upsertStatement(String table, Map<String, Object> keyColumns,
                                  Map<String, Object> valueColumns) {
    if (keyColumns.isEmpty()) {
      throw new IllegalArgumentException("An upsert into " + table + " needs key columns");
    }
    final String cql;
    final List<Object> values = new ArrayList<>();
    if (valueColumns.isEmpty()) {
      // nothing to set, so make sure the key at least exists
      cql = "INSERT INTO " + table + " (" + String.join(",", keyColumns.keySet()) + ")"
          + " VALUES (" + placeholders(keyColumns.size()) + ")";
    } else {
      cql = "UPDATE " + table
          + " SET " + valueColumns.keySet().stream()
          .map(column -> column + " = ?")
          .collect(Collectors.joining(", "))
          + " WHERE " + conditions(keyColumns);
      values.addAll(valueColumns.values());
    }
    values.addAll(keyColumns.values());
    return new SimpleStatementBuilder(cql)
        .addPositionalValues(values.toArray())
        .build();
  }

  private Mono<Void> write(Statement<?> statement) {
    return cqlTemplate.execute(statement)
        .retryWhen(appProperties.getRetryWrite().build())
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new)
        .then()
        .checkpoint();
  }

  private static String conditions(Map<String, Object> keyColumns) {
    return keyColumns.keySet().stream()
        .map(column -> column + " = ?")
        .collect(Collectors.joining(" AND "));
  }

  private static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }
}
