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

package com.rackspace.gridhistory.app.web;

import com.rackspace.gridhistory.app.model.Reading;
import com.rackspace.gridhistory.app.model.ReadingBatch;
import com.rackspace.gridhistory.app.model.VisitReport;
import com.rackspace.gridhistory.app.services.IngestService;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Receives the batches the ingestion driver fetched and parsed from the upstream feeds.
 */
@RestController
@RequestMapping("/api")
public class WriteController {

  private final IngestService ingestService;

  @Autowired
  public WriteController(IngestService ingestService) {
    this.ingestService = ingestService;
  }

  @PostMapping("/generation")
  public Mono<ResponseEntity<?>> putGeneration(@RequestBody List<Reading> readings) {
    return ingestService.ingestGeneration(readings)
        .then(Mono.just(ResponseEntity.noContent().build()));
  }

  @PostMapping("/readings")
  public Mono<ResponseEntity<?>> putReadings(@RequestBody ReadingBatch batch) {
    return ingestService.ingest(batch)
        .then(Mono.just(ResponseEntity.noContent().build()));
  }

  @PostMapping("/visits")
  public Mono<ResponseEntity<?>> putVisits(@RequestBody @Validated VisitReport visits) {
    return ingestService.recordVisits(visits.getTime(), visits.getCount())
        .then(Mono.just(ResponseEntity.noContent().build()));
  }

  /**
   * Called once all batches of a cycle were delivered.
   */
  @PostMapping("/finish")
  public Mono<ResponseEntity<?>> finish() {
    return ingestService.finishUpdate()
        .then(Mono.just(ResponseEntity.noContent().build()));
  }
}
