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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A sparse set of metric values for one bucket. A column that is present with a null value is
 * distinct from an absent column: upserting the former clears the stored value.
 */
@EqualsAndHashCode
@ToString
public class Datum {

  private final EnumMap<MetricColumn, Double> values = new EnumMap<>(MetricColumn.class);

  public static Datum of(Map<MetricColumn, Double> values) {
    final Datum datum = new Datum();
    values.forEach(datum::put);
    return datum;
  }

  public Datum put(MetricColumn column, Double value) {
    values.put(column, value);
    return this;
  }

  public Double get(MetricColumn column) {
    return values.get(column);
  }

  public boolean has(MetricColumn column) {
    return values.get(column) != null;
  }

  public boolean contains(MetricColumn column) {
    return values.containsKey(column);
  }

  public Set<MetricColumn> columns() {
    return values.keySet();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * @return a copy holding only the given columns, absent ones stay absent
   */
  public Datum select(Collection<MetricColumn> columns) {
    final Datum selected = new Datum();
    for (MetricColumn column : columns) {
      if (values.containsKey(column)) {
        selected.put(column, values.get(column));
      }
    }
    return selected;
  }

  /**
   * @return a copy of this datum with the other's columns laid over it
   */
  public Datum merge(Datum other) {
    final Datum merged = Datum.of(values);
    other.values.forEach(merged::put);
    return merged;
  }

  @JsonAnyGetter
  public Map<String, Double> toColumnMap() {
    final Map<String, Double> map = new LinkedHashMap<>();
    values.forEach((column, value) -> map.put(column.getColumnName(), value));
    return map;
  }

  @JsonAnySetter
  public void putColumn(String columnName, Double value) {
    put(MetricColumn.fromColumnName(columnName), value);
  }
}
