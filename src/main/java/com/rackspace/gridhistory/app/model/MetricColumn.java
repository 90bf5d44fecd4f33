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

package com.rackspace.gridhistory.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fixed, ordered set of numeric columns stored in every tier of the history.
 */
public enum MetricColumn {
  DEMAND("demand", Group.DEMAND),
  WIND("wind", Group.GENERATION),
  EMBEDDED_WIND("embedded_wind", Group.GENERATION),
  SOLAR("solar", Group.GENERATION),
  HYDRO("hydro", Group.GENERATION),
  NUCLEAR("nuclear", Group.GENERATION),
  BIOMASS("biomass", Group.GENERATION),
  GAS("gas", Group.GENERATION),
  COAL("coal", Group.GENERATION),
  PUMPED_STORAGE("pumped_storage", Group.GENERATION),
  INTERCONNECTORS("interconnectors", Group.GENERATION),
  PRICE("price", Group.PRICING),
  EMISSIONS("emissions", Group.EMISSIONS);

  public enum Group {
    DEMAND,
    GENERATION,
    PRICING,
    EMISSIONS
  }

  private final String columnName;
  private final Group group;

  MetricColumn(String columnName, Group group) {
    this.columnName = columnName;
    this.group = group;
  }

  @JsonValue
  public String getColumnName() {
    return columnName;
  }

  public static List<MetricColumn> all() {
    return List.of(values());
  }

  public static List<MetricColumn> generation() {
    return inGroups(EnumSet.of(Group.GENERATION));
  }

  /**
   * Demand, pricing and emissions change slowly and are carried forward into buckets that only
   * received generation data.
   */
  public static List<MetricColumn> slowChanging() {
    return inGroups(EnumSet.of(Group.DEMAND, Group.PRICING, Group.EMISSIONS));
  }

  private static List<MetricColumn> inGroups(Set<Group> groups) {
    return Arrays.stream(values())
        .filter(column -> groups.contains(column.group))
        .collect(Collectors.toList());
  }

  @JsonCreator
  public static MetricColumn fromColumnName(String columnName) {
    for (MetricColumn column : values()) {
      if (column.columnName.equals(columnName)) {
        return column;
      }
    }
    throw new IllegalArgumentException("Unknown metric column: " + columnName);
  }
}
