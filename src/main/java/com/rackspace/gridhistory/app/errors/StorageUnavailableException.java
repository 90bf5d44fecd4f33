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

package com.rackspace.gridhistory.app.errors;

import org.springframework.dao.DataAccessResourceFailureException;

/**
 * The store could not be reached. Fatal for the current ingestion cycle, the caller is expected
 * to retry on its next cycle.
 */
public class StorageUnavailableException extends RuntimeException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public StorageUnavailableException(Throwable cause) {
    this("Storage is unavailable: " + cause.getMessage(), cause);
  }

  public static boolean isStorageFailure(Throwable throwable) {
    return throwable instanceof DataAccessResourceFailureException;
  }
}
