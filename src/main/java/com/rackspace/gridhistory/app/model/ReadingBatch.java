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

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ReadingBatch {

  /**
   * The columns every reading of this batch must carry.
   */
  List<MetricColumn> columns = new ArrayList<>();

  List<Reading> readings = new ArrayList<>();

  /**
   * When set, the most recent reading also replaces the latest snapshot.
   */
  boolean latest;

  /**
   * Half-hourly readings are written straight into the half-hour tier, finer ones into the
   * five-minute buffer.
   */
  boolean halfHourly;
}
