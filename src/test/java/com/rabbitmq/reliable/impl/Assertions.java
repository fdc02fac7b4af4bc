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

import static org.assertj.core.api.Assertions.fail;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.assertj.core.api.AbstractObjectAssert;

final class Assertions {

  private Assertions() {}

  static CountDownLatchAssert assertThat(CountDownLatch latch) {
    return new CountDownLatchAssert(latch);
  }

  static SyncAssert assertThat(TestUtils.Sync sync) {
    return new SyncAssert(sync);
  }

  static class CountDownLatchAssert
      extends AbstractObjectAssert<CountDownLatchAssert, CountDownLatch> {

    private CountDownLatchAssert(CountDownLatch latch) {
      super(latch, CountDownLatchAssert.class);
    }

    CountDownLatchAssert completes() {
      return this.completes(TestUtils.DEFAULT_CONDITION_TIMEOUT);
    }

    CountDownLatchAssert completes(Duration timeout) {
      try {
        boolean completed = actual.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!completed) {
          fail("Latch timed out after %d ms", timeout.toMillis());
        }
      } catch (InterruptedException e) {
        Thread.interrupted();
        throw new RuntimeException(e);
      }
      return this;
    }
  }

  static class SyncAssert extends AbstractObjectAssert<SyncAssert, TestUtils.Sync> {

    private SyncAssert(TestUtils.Sync sync) {
      super(sync, SyncAssert.class);
    }

    SyncAssert completes() {
      return this.completes(TestUtils.DEFAULT_CONDITION_TIMEOUT);
    }

    SyncAssert completes(Duration timeout) {
      boolean completed = actual.await(timeout);
      if (!completed) {
        fail("Sync '%s' timed out after %d ms", this.actual.toString(), timeout.toMillis());
      }
      return this;
    }

    SyncAssert hasNotCompleted() {
      if (actual.hasCompleted()) {
        fail("Sync '%s' should not have completed", this.actual.toString());
      }
      return this;
    }
  }
}
