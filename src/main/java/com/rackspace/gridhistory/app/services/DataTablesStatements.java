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

import com.rackspace.gridhistory.app.model.MetricColumn;
import com.rackspace.gridhistory.app.model.Tier;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Provides a consolidated declaration of the table names, column names and query statements that
 * execute against the tier tables and the supporting tables.
 */
@Component
public class DataTablesStatements {

  public static final String GRID = "grid";
  public static final String TIMESTAMP = "ts";
  public static final String VISITS = "visits";
  public static final String SOURCE = "source";
  public static final String VALUE = "value";
  public static final String THRESHOLD = "threshold";
  public static final String ACTION = "action";
  public static final String ERROR = "error";
  public static final String OCCURRENCES = "occurrences";

  public static final String TABLE_LATEST = "latest";
  public static final String TABLE_PEAK_RECORDS = "peak_records";
  public static final String TABLE_MILESTONES = "milestones";
  public static final String TABLE_ERRORS = "errors";

  //CQL Queries
  private static final String SERIES_QUERY = "SELECT %s FROM %s WHERE " + GRID + " = ?";

  private static final String SERIES_QUERY_AFTER = SERIES_QUERY + " AND " + TIMESTAMP + " > ?";

  private static final String SERIES_QUERY_FROM = SERIES_QUERY + " AND " + TIMESTAMP + " >= ?";

  private static final String SERIES_QUERY_AT = SERIES_QUERY + " AND " + TIMESTAMP + " = ?";

  private static final String SERIES_QUERY_LATEST = SERIES_QUERY
      + " ORDER BY " + TIMESTAMP + " DESC LIMIT ?";

  private static final String SERIES_DELETE_BEFORE = "DELETE FROM %s WHERE " + GRID + " = ?"
      + " AND " + TIMESTAMP + " < ?";

  private final Map<Tier, String> seriesQueries = new EnumMap<>(Tier.class);
  private final Map<Tier, String> seriesQueriesAfter = new EnumMap<>(Tier.class);
  private final Map<Tier, String> seriesQueriesFrom = new EnumMap<>(Tier.class);
  private final Map<Tier, String> seriesQueriesAt = new EnumMap<>(Tier.class);
  private final Map<Tier, String> seriesQueriesLatest = new EnumMap<>(Tier.class);
  private final Map<Tier, String> seriesDeletesBefore = new EnumMap<>(Tier.class);

  private final String latestQuery = String.format(SERIES_QUERY,
      String.join(",", SOURCE, VALUE, TIMESTAMP), TABLE_LATEST);

  private final String peakRecordQuery = String.format(SERIES_QUERY,
      String.join(",", VALUE, TIMESTAMP), TABLE_PEAK_RECORDS);

  private final String milestonesQuery = String.format(SERIES_QUERY,
      String.join(",", THRESHOLD, VALUE, TIMESTAMP), TABLE_MILESTONES);

  private final String errorCountQuery = "SELECT " + OCCURRENCES + " FROM " + TABLE_ERRORS
      + " WHERE " + ACTION + " = ? AND " + ERROR + " = ?";

  public DataTablesStatements() {
    final String seriesColumns = String.join(",", seriesColumnNames());
    for (Tier tier : Tier.values()) {
      seriesQueries.put(tier, String.format(SERIES_QUERY, seriesColumns, tier.getTableName()));
      seriesQueriesAfter.put(tier,
          String.format(SERIES_QUERY_AFTER, seriesColumns, tier.getTableName()));
      seriesQueriesFrom.put(tier,
          String.format(SERIES_QUERY_FROM, seriesColumns, tier.getTableName()));
      seriesQueriesAt.put(tier,
          String.format(SERIES_QUERY_AT, seriesColumns, tier.getTableName()));
      seriesQueriesLatest.put(tier,
          String.format(SERIES_QUERY_LATEST, seriesColumns, tier.getTableName()));
      seriesDeletesBefore.put(tier, String.format(SERIES_DELETE_BEFORE, tier.getTableName()));
    }
  }

  /**
   * @return the timestamp, visits and every metric column, in that order
   */
  public static List<String> seriesColumnNames() {
    final List<String> names = new ArrayList<>();
    names.add(TIMESTAMP);
    names.add(VISITS);
    names.addAll(metricColumnNames());
    return names;
  }

  public static List<String> metricColumnNames() {
    return MetricColumn.all().stream()
        .map(MetricColumn::getColumnName)
        .collect(Collectors.toList());
  }

  /**
   * @return a SELECT CQL statement with placeholder grid, returning every row of the tier in
   * ascending time order
   */
  public String seriesQuery(Tier tier) {
    return seriesQueries.get(tier);
  }

  /**
   * @return a SELECT CQL statement with placeholders grid, exclusive lower time bound
   */
  public String seriesQueryAfter(Tier tier) {
    return seriesQueriesAfter.get(tier);
  }

  /**
   * @return a SELECT CQL statement with placeholders grid, inclusive lower time bound
   */
  public String seriesQueryFrom(Tier tier) {
    return seriesQueriesFrom.get(tier);
  }

  public String seriesQueryAt(Tier tier) {
    return seriesQueriesAt.get(tier);
  }

  /**
   * @return a SELECT CQL statement with placeholders grid, limit returning the newest rows first
   */
  public String seriesQueryLatest(Tier tier) {
    return seriesQueriesLatest.get(tier);
  }

  /**
   * @return a DELETE CQL statement with placeholders grid, exclusive upper time bound
   */
  public String seriesDeleteBefore(Tier tier) {
    return seriesDeletesBefore.get(tier);
  }

  /**
   * @return a SELECT CQL statement with placeholder grid returning source, value, timestamp
   */
  public String latestQuery() {
    return latestQuery;
  }

  /**
   * @return a SELECT CQL statement with placeholder grid returning value, timestamp
   */
  public String peakRecordQuery() {
    return peakRecordQuery;
  }

  /**
   * @return a SELECT CQL statement with placeholder grid returning threshold, value, timestamp
   * in ascending threshold order
   */
  public String milestonesQuery() {
    return milestonesQuery;
  }

  /**
   * @return a SELECT CQL statement with placeholders action, error returning the occurrences
   */
  public String errorCountQuery() {
    return errorCountQuery;
  }
}
