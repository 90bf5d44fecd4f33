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

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import lombok.Data;

/**
 * Everything the reporting side needs to render the current state of the grid.
 */
@Data
public class GridState {
  Instant latestTime;
  Datum latest;

  Datum pastDay;
  Datum pastWeek;
  Datum pastYear;
  Datum allTime;

  SortedMap<Instant, Datum> daySeries;
  SortedMap<Instant, Datum> weekSeries;
  SortedMap<Instant, Datum> yearSeries;
  SortedMap<Instant, Datum> allTimeSeries;

  PeakRecord record;
  List<Milestone> milestones;
}
