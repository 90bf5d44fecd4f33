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

import com.rackspace.gridhistory.app.model.ErrorCount;
import com.rackspace.gridhistory.app.model.ErrorReport;
import com.rackspace.gridhistory.app.services.ErrorDeduplicationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Lets the ingestion driver find out whether a failure is new or keeps recurring.
 */
@RestController
@RequestMapping("/api/errors")
public class ErrorCountController {

  private final ErrorDeduplicationService errorDeduplicationService;

  @Autowired
  public ErrorCountController(ErrorDeduplicationService errorDeduplicationService) {
    this.errorDeduplicationService = errorDeduplicationService;
  }

  @PostMapping("/{action}")
  public Mono<ErrorCount> recordError(@PathVariable String action,
                                      @RequestBody @Validated ErrorReport report) {
    return errorDeduplicationService.record(action, report.getError())
        .map(count -> new ErrorCount(action, report.getError(), count));
  }

  @DeleteMapping("/{action}")
  public Mono<ResponseEntity<?>> clearErrors(@PathVariable String action) {
    return errorDeduplicationService.clear(action)
        .then(Mono.just(ResponseEntity.noContent().build()));
  }
}
