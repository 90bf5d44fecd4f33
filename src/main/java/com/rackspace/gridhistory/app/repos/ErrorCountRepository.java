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

import reactor.core.publisher.Mono;

public interface ErrorCountRepository {

  /**
   * @return the stored count, or empty when the error was never recorded for the action
   */
  Mono<Integer> findCount(String action, String error);

  Mono<Void> saveCount(String action, String error, int count);

  Mono<Void> deleteAction(String action);
}
