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

import com.rackspace.gridhistory.app.model.Milestone;
import com.rackspace.gridhistory.app.model.PeakRecord;
import java.util.ArrayList;
import java.util.NavigableMap;
import java.util.TreeMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class InMemoryPeakRepository implements PeakRepository {

  private PeakRecord record;
  private final NavigableMap<Integer, Milestone> milestones = new TreeMap<>();

  @Override
  public Mono<PeakRecord> findRecord() {
    return Mono.fromSupplier(() -> record);
  }

  @Override
  public Mono<Void> saveRecord(PeakRecord record) {
    return Mono.fromRunnable(() -> this.record = record);
  }

  @Override
  public Flux<Milestone> findMilestones() {
    return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(milestones.values())));
  }

  @Override
  public Mono<Boolean> insertMilestone(Milestone milestone) {
    return Mono.fromSupplier(() ->
        milestones.putIfAbsent(milestone.getThreshold(), milestone) == null);
  }
}
