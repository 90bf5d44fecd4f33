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

import static com.rackspace.gridhistory.app.services.DataTablesStatements.ACTION;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.ERROR;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.GRID;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.OCCURRENCES;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.SOURCE;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_ERRORS;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_LATEST;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_MILESTONES;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TABLE_PEAK_RECORDS;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.THRESHOLD;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.TIMESTAMP;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.VALUE;
import static com.rackspace.gridhistory.app.services.DataTablesStatements.VISITS;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.type.DataTypes;
import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.Tier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.generator.CreateTableCqlGenerator;
import org.springframework.data.cassandra.core.cql.keyspace.CreateTableSpecification;
import org.springframework.data.cassandra.core.cql.keyspace.DefaultOption;
import org.springframework.data.cassandra.core.cql.keyspace.Option;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption.CompactionOption;
import org.springframework.data.cassandra.core.cql.session.init.KeyspacePopulator;
import org.springframework.data.cassandra.core.cql.session.init.ScriptException;
import org.springframework.stereotype.Component;

/**
 * Creates the tier tables and supporting tables. The two trimmed tiers get a time-window
 * compaction strategy sized from their retention.
 *
 * @see com.rackspace.gridhistory.app.services.DataTablesStatements
 */
@Component
@Slf4j
public class DataTablesPopulator implements KeyspacePopulator {

  private static final DefaultOption COMPACTION_WINDOW_UNIT = new DefaultOption("compaction_window_unit", String.class, true, false, true);
  /**
   * value is number of the compaction_window_unit increments.
   */
  private static final DefaultOption COMPACTION_WINDOW_SIZE = new DefaultOption("compaction_window_size", Long.class, true, false, false);

  private final AppProperties appProperties;

  @Autowired
  public DataTablesPopulator(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Override
  public void populate(CqlSession session) throws ScriptException {
    tableSpecifications().forEach(spec -> createTable(spec, session));
  }

  public List<String> render() {
    return tableSpecifications()
        .stream()
        .map(CreateTableCqlGenerator::toCql)
        .collect(Collectors.toList());
  }

  List<CreateTableSpecification> tableSpecifications() {
    final List<CreateTableSpecification> specs = new ArrayList<>();
    for (Tier tier : Tier.values()) {
      specs.add(seriesTableSpec(tier));
    }
    specs.add(latestTableSpec());
    specs.add(peakRecordsTableSpec());
    specs.add(milestonesTableSpec());
    specs.add(errorsTableSpec());
    return specs;
  }

  private void createTable(CreateTableSpecification createTableSpec, CqlSession session) {
    log.debug("Creating table {} if missing", createTableSpec.getName());
    // Cassandra doesn't like reactive version of create table
    session.execute(CreateTableCqlGenerator.toCql(createTableSpec));
  }

  private CreateTableSpecification seriesTableSpec(Tier tier) {
    CreateTableSpecification spec = CreateTableSpecification
        .createTable(tier.getTableName())
        .ifNotExists()
        .partitionKeyColumn(GRID, DataTypes.TEXT)
        .clusteredKeyColumn(TIMESTAMP, DataTypes.TIMESTAMP)
        .column(VISITS, DataTypes.INT);
    for (MetricColumn column : MetricColumn.all()) {
      spec = spec.column(column.getColumnName(), DataTypes.DOUBLE);
    }
    spec = spec.with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());

    final Duration retention = retentionOf(tier);
    if (retention != null) {
      spec = spec.with(TableOption.COMPACTION, compactionOptions(retention));
    }
    return spec;
  }

  private Duration retentionOf(Tier tier) {
    switch (tier) {
      case FIVE_MINUTES:
        return appProperties.getFiveMinuteRetention();
      case HALF_HOURS:
        return appProperties.getHalfHourRetention();
      default:
        return null;
    }
  }

  private CreateTableSpecification latestTableSpec() {
    return CreateTableSpecification
        .createTable(TABLE_LATEST)
        .ifNotExists()
        .partitionKeyColumn(GRID, DataTypes.TEXT)
        .clusteredKeyColumn(SOURCE, DataTypes.TEXT)
        .column(VALUE, DataTypes.DOUBLE)
        .column(TIMESTAMP, DataTypes.TIMESTAMP);
  }

  private CreateTableSpecification peakRecordsTableSpec() {
    return CreateTableSpecification
        .createTable(TABLE_PEAK_RECORDS)
        .ifNotExists()
        .partitionKeyColumn(GRID, DataTypes.TEXT)
        .column(VALUE, DataTypes.DOUBLE)
        .column(TIMESTAMP, DataTypes.TIMESTAMP);
  }

  private CreateTableSpecification milestonesTableSpec() {
    return CreateTableSpecification
        .createTable(TABLE_MILESTONES)
        .ifNotExists()
        .partitionKeyColumn(GRID, DataTypes.TEXT)
        .clusteredKeyColumn(THRESHOLD, DataTypes.INT)
        .column(VALUE, DataTypes.DOUBLE)
        .column(TIMESTAMP, DataTypes.TIMESTAMP);
  }

  private CreateTableSpecification errorsTableSpec() {
    return CreateTableSpecification
        .createTable(TABLE_ERRORS)
        .ifNotExists()
        .partitionKeyColumn(ACTION, DataTypes.TEXT)
        .clusteredKeyColumn(ERROR, DataTypes.TEXT)
        .column(OCCURRENCES, DataTypes.INT);
  }

  private Map<Option, Object> compactionOptions(Duration retention) {
    // Docs recommend 20 - 30 windows
    final Duration calculatedWindowSize = retention.dividedBy(30);

    // ...pick a TimeUnit that seems appropriate for scale
    final TimeUnit windowUnit;
    final long windowSize;
    if (calculatedWindowSize.compareTo(Duration.ofDays(1)) > 0) {
      windowUnit = TimeUnit.DAYS;
      windowSize = calculatedWindowSize.toDays();
    } else if (calculatedWindowSize.compareTo(Duration.ofHours(1)) > 0) {
      windowUnit = TimeUnit.HOURS;
      windowSize = calculatedWindowSize.toHours();
    } else {
      windowUnit = TimeUnit.MINUTES;
      windowSize = Math.max(1, calculatedWindowSize.toMinutes());
    }

    return Map.of(
        CompactionOption.CLASS, "TimeWindowCompactionStrategy",
        COMPACTION_WINDOW_UNIT, windowUnit,
        COMPACTION_WINDOW_SIZE, windowSize
    );
  }
}
