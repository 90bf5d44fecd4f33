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

import com.rackspace.gridhistory.app.model.GridState;
import com.rackspace.gridhistory.app.services.StateService;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/state")
public class StateController {

  private final StateService stateService;

  @Autowired
  public StateController(StateService stateService) {
    this.stateService = stateService;
  }

  @GetMapping
  public Mono<GridState> getState() {
    return stateService.getState();
  }

  @GetMapping("/latest-bucket")
  public Mono<ResponseEntity<Map<String, Instant>>> getLatestBucket() {
    return stateService.getLatestBucketTime()
        .map(time -> ResponseEntity.ok(Map.of("time", time)))
        .defaultIfEmpty(ResponseEntity.notFound().build());
  }
}
