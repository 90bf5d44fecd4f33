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

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * A row addressed by its key columns that should have only the given value columns written.
 */
@Value
public class UpsertRow {
  Map<String, Object> keyColumns;
  Map<String, Object> valueColumns;

  public static UpsertRow of(Map<String, Object> keyColumns, Map<String, Object> valueColumns) {
    return new UpsertRow(new LinkedHashMap<>(keyColumns), new LinkedHashMap<>(valueColumns));
  }
}
