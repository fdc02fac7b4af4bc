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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.reliable.RetryLedger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryRetryLedgerTest {

  TestUtils.MutableClock clock;
  InMemoryRetryLedger ledger;
  ExecutorService executorService;

  @BeforeEach
  void init() {
    clock = new TestUtils.MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
    ledger = new InMemoryRetryLedger(clock);
    executorService = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  void recordAttemptShouldCountFromOne() {
    assertThat(ledger.attemptsSoFar("order-1")).isZero();
    assertThat(ledger.recordAttempt("order-1")).isEqualTo(1);
    assertThat(ledger.recordAttempt("order-1")).isEqualTo(2);
    assertThat(ledger.recordAttempt("order-1")).isEqualTo(3);
    assertThat(ledger.attemptsSoFar("order-1")).isEqualTo(3);
    assertThat(ledger.recordAttempt("order-2")).isEqualTo(1);
    assertThat(ledger.size()).isEqualTo(2);
  }

  @Test
  void recordShouldExposeFirstSeenTime() {
    ledger.recordAttempt("order-1");
    clock.advance(Duration.ofSeconds(5));
    ledger.recordAttempt("order-1");
    RetryLedger.RetryRecord record = ledger.record("order-1").get();
    assertThat(record.correlationKey()).isEqualTo("order-1");
    assertThat(record.attempts()).isEqualTo(2);
    assertThat(record.firstSeenAt()).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
    assertThat(ledger.record("unknown")).isEmpty();
  }

  @Test
  void clearShouldBeIdempotent() {
    ledger.recordAttempt("order-1");
    ledger.recordAttempt("order-1");
    ledger.clear("order-1");
    assertThat(ledger.attemptsSoFar("order-1")).isZero();
    ledger.clear("order-1");
    ledger.clear("never-seen");
    assertThat(ledger.size()).isZero();
    assertThat(ledger.recordAttempt("order-1")).isEqualTo(1);
  }

  @Test
  void concurrentAttemptsShouldNotBeLost() throws Exception {
    int tasks = 8;
    int attemptsPerTask = 1000;
    List<Callable<Void>> callables = new ArrayList<>();
    IntStream.range(0, tasks)
        .forEach(
            i ->
                callables.add(
                    () -> {
                      for (int j = 0; j < attemptsPerTask; j++) {
                        ledger.recordAttempt("shared");
                        ledger.recordAttempt("key-" + i);
                      }
                      return null;
                    }));
    for (Future<Void> future : executorService.invokeAll(callables)) {
      future.get();
    }
    assertThat(ledger.attemptsSoFar("shared")).isEqualTo(tasks * attemptsPerTask);
    IntStream.range(0, tasks)
        .forEach(i -> assertThat(ledger.attemptsSoFar("key-" + i)).isEqualTo(attemptsPerTask));
  }

  @Test
  void expireShouldEvictOldRecordsOnly() {
    ledger.recordAttempt("old");
    clock.advance(Duration.ofMinutes(10));
    ledger.recordAttempt("recent");
    ledger.recordAttempt("old");
    clock.advance(Duration.ofMinutes(1));

    assertThat(ledger.expire(Duration.ofMinutes(5))).isEqualTo(1);
    assertThat(ledger.attemptsSoFar("old")).isZero();
    assertThat(ledger.attemptsSoFar("recent")).isEqualTo(1);
    assertThat(ledger.expire(Duration.ofMinutes(5))).isZero();
  }

  @Test
  void nullKeyShouldBeRefused() {
    assertThatThrownBy(() -> ledger.recordAttempt(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(ledger.attemptsSoFar(null)).isZero();
  }
}
