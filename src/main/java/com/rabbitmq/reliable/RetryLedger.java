// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.reliable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-message attempt counter, keyed by {@link Delivery#correlationKey()}.
 *
 * <p>Implementations must not block operations on different keys and must not lose increments
 * on the same key. Absent keys count as zero, operations never fail.
 */
public interface RetryLedger {

  /**
   * Increment the attempt count for the key.
   *
   * @param key correlation key
   * @return the new attempt count, 1 if the key was absent
   */
  int recordAttempt(String key);

  /**
   * Return the attempt count for the key.
   *
   * @param key correlation key
   * @return the attempt count, 0 if absent
   */
  int attemptsSoFar(String key);

  /**
   * Remove the record of the key. No-op if absent.
   *
   * @param key correlation key
   */
  void clear(String key);

  /**
   * Snapshot of the record for the key.
   *
   * @param key correlation key
   * @return the record, empty if absent
   */
  Optional<RetryRecord> record(String key);

  /**
   * Number of keys with a record.
   *
   * @return number of records
   */
  int size();

  /**
   * Remove the records first seen more than <code>maxAge</code> ago.
   *
   * @param maxAge maximum age of a record
   * @return number of removed records
   */
  int expire(Duration maxAge);

  /** Attempt record of a correlation key. */
  interface RetryRecord {

    String correlationKey();

    int attempts();

    Instant firstSeenAt();
  }
}
