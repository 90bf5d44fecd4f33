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

import com.rackspace.gridhistory.app.repos.ErrorCountRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Counts how often the same error occurred for an action so the caller can decide when a recurring
 * failure is worth reporting. Counts live until the action succeeds and clears them.
 */
@Service
@Slf4j
public class ErrorDeduplicationService {

  private final ErrorCountRepository errorCountRepository;

  @Autowired
  public ErrorDeduplicationService(ErrorCountRepository errorCountRepository) {
    this.errorCountRepository = errorCountRepository;
  }

  /**
   * @return the number of times the error has now been seen for the action, starting at 1
   */
  public Mono<Integer> record(String action, String error) {
    if (StringUtils.isAnyBlank(action, error)) {
      return Mono.error(new IllegalArgumentException("An error needs an action and a message"));
    }
    return errorCountRepository.findCount(action, error)
        .defaultIfEmpty(0)
        .map(count -> count + 1)
        .flatMap(count -> {
          log.debug("Error {} of {} seen {} time(s)", error, action, count);
          return errorCountRepository.saveCount(action, error, count)
              .thenReturn(count);
        });
  }

  public Mono<Void> clear(String action) {
    if (StringUtils.isBlank(action)) {
      return Mono.error(new IllegalArgumentException("An action is required"));
    }
    log.debug("Clearing errors of {}", action);
    return errorCountRepository.deleteAction(action);
  }
}
