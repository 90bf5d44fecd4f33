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

import static com.rackspace.gridhistory.app.services.DataTablesStatements.ACTION;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.ERROR;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.OCCURRENCES;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_ERRORS;

import com.rackspace.gridhistory.app.config.AppProperties;
import com.rackspace.gridhistory.app.errors.StorageUnavailableException;
import com.rackspace.gridhistory.app.services.DataTablesStatements;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Plain int columns rather than Cassandra counters, since counters cannot be reliably
 * incremented again after being deleted.
 */
@Repository
public class CassandraErrorCountRepository implements ErrorCountRepository {

  private final ReactiveCqlTemplate cqlTemplate;
  private final UpsertStore upsertStore;
  private final DataTablesStatements dataTablesStatements;
  private final AppProperties appProperties;

  @Autowired
  public CassandraErrorCountRepository(ReactiveCqlTemplate cqlTemplate,
                                       UpsertStore upsertStore,
                                       DataTablesStatements dataTablesStatements,
                                       AppProperties appProperties) {
    this.cqlTemplate = cqlTemplate;
    this.upsertStore = upsertStore;
    this.dataTablesStatements = dataTablesStatements;
    this.appProperties = appProperties;
  }

  @Override
  public Mono<Integer> findCount(String action, String error) {
    return cqlTemplate.queryForRows(dataTablesStatements.errorCountQuery(), action, error)
        .next()
        .map(row -> row.getInt(OCCURRENCES))
        .retryWhen(appProperties.getRetryRead().build())
        .onErrorMap(StorageUnavailableException::isStorageFailure, StorageUnavailableException::new);
  }

  @Override
  public Mono<Void> saveCount(String action, String error, int count) {
    final Map<String, Object> key = new LinkedHashMap<>();
    key.put(ACTION, action);
    key.put(ERROR, error);
    return upsertStore.upsert(TABLE_ERRORS, key, Map.of(OCCURRENCES, count));
  }

  @Override
  public Mono<Void> deleteAction(String action) {
    return upsertStore.delete(TABLE_ERRORS, Map.of(ACTION, action));
  }
}
