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
package com.rabbitmq.reliable.impl;

import static com.rabbitmq.reliable.impl.Assert.notNull;

import com.rabbitmq.reliable.RetryLedger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RetryLedger} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Updates on a key go through {@link ConcurrentMap#compute(Object,
 * java.util.function.BiFunction)}, so they are atomic for the key and do not contend with other
 * keys.
 */
public final class InMemoryRetryLedger implements RetryLedger {

  private final ConcurrentMap<String, Record> records = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryRetryLedger() {
    this(Clock.systemUTC());
  }

  public InMemoryRetryLedger(Clock clock) {
    this.clock = notNull(clock, "Clock cannot be null");
  }

  @Override
  public int recordAttempt(String key) {
    notNull(key, "Key cannot be null");
    AtomicInteger attempts = new AtomicInteger();
    this.records.compute(
        key,
        (k, record) -> {
          Record updated =
              record == null ? new Record(k, 1, this.clock.instant()) : record.increment();
          attempts.set(updated.attempts);
          return updated;
        });
    return attempts.get();
  }

  @Override
  public int attemptsSoFar(String key) {
    Record record = key == null ? null : this.records.get(key);
    return record == null ? 0 : record.attempts;
  }

  @Override
  public void clear(String key) {
    if (key != null) {
      this.records.remove(key);
    }
  }

  @Override
  public Optional<RetryRecord> record(String key) {
    return key == null ? Optional.empty() : Optional.ofNullable(this.records.get(key));
  }

  @Override
  public int size() {
    return this.records.size();
  }

  @Override
  public int expire(Duration maxAge) {
    notNull(maxAge, "Max age cannot be null");
    Instant limit = this.clock.instant().minus(maxAge);
    AtomicInteger expired = new AtomicInteger();
    this.records.forEach(
        (key, record) -> {
          if (record.firstSeenAt.isBefore(limit) && this.records.remove(key, record)) {
            expired.incrementAndGet();
          }
        });
    return expired.get();
  }

  @Override
  public String toString() {
    return "InMemoryRetryLedger{" + "size=" + records.size() + '}';
  }

  private static final class Record implements RetryRecord {

    private final String correlationKey;
    private final int attempts;
    private final Instant firstSeenAt;

    private Record(String correlationKey, int attempts, Instant firstSeenAt) {
      this.correlationKey = correlationKey;
      this.attempts = attempts;
      this.firstSeenAt = firstSeenAt;
    }

    private Record increment() {
      return new Record(this.correlationKey, this.attempts + 1, this.firstSeenAt);
    }

    @Override
    public String correlationKey() {
      return this.correlationKey;
    }

    @Override
    public int attempts() {
      return this.attempts;
    }

    @Override
    public Instant firstSeenAt() {
      return this.firstSeenAt;
    }

    @Override
    public String toString() {
      return "RetryRecord{"
          + "correlationKey='"
          + correlationKey
          + '\''
          + ", attempts="
          + attempts
          + ", firstSeenAt="
          + firstSeenAt
          + '}';
    }
  }
}
