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

import static com.rabbitmq.reliable.impl.Assertions.assertThat;
import static com.rabbitmq.reliable.impl.TestUtils.sync;
import static com.rabbitmq.reliable.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.FlowController;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class DefaultFlowControllerTest {

  ExecutorService executorService;

  @BeforeEach
  void init() {
    executorService = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  void acquireShouldBlockWhenBudgetIsExhausted() throws Exception {
    DefaultFlowController controller = new DefaultFlowController(2);
    FlowController.Permit p1 = controller.acquire();
    FlowController.Permit p2 = controller.acquire();
    assertThat(controller.inFlight()).isEqualTo(2);
    assertThat(controller.tryAcquire(Duration.ofMillis(50))).isNull();

    TestUtils.Sync acquired = sync();
    executorService.submit(
        () -> {
          controller.acquire();
          acquired.down();
          return null;
        });
    TestUtils.simulateActivity(100);
    assertThat(acquired).hasNotCompleted();
    controller.release(p1);
    assertThat(acquired).completes();
    assertThat(controller.inFlight()).isEqualTo(2);
    controller.release(p2);
    assertThat(controller.inFlight()).isEqualTo(1);
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 5})
  void inFlightShouldNeverExceedMaximum(int maxInFlight) throws Exception {
    DefaultFlowController controller = new DefaultFlowController(maxInFlight);
    int workers = 10;
    int iterations = 200;
    AtomicInteger concurrent = new AtomicInteger(0);
    AtomicInteger maxObserved = new AtomicInteger(0);
    AtomicReference<Throwable> error = new AtomicReference<>();
    CountDownLatch done = new CountDownLatch(workers);
    for (int i = 0; i < workers; i++) {
      executorService.submit(
          () -> {
            Random random = new Random();
            try {
              for (int j = 0; j < iterations; j++) {
                FlowController.Permit permit = controller.acquire();
                int current = concurrent.incrementAndGet();
                maxObserved.accumulateAndGet(current, Math::max);
                if (controller.inFlight() > maxInFlight) {
                  error.set(new IllegalStateException("Too many in-flight permits"));
                }
                if (random.nextInt(10) == 0) {
                  Thread.sleep(1);
                }
                concurrent.decrementAndGet();
                controller.release(permit);
              }
            } catch (Throwable e) {
              error.set(e);
            } finally {
              done.countDown();
            }
          });
    }
    assertThat(done).completes(Duration.ofSeconds(30));
    assertThat(error.get()).isNull();
    assertThat(maxObserved.get()).isBetween(1, maxInFlight);
    assertThat(controller.inFlight()).isZero();
  }

  @Test
  void doubleReleaseShouldBeRefused() throws Exception {
    DefaultFlowController controller = new DefaultFlowController(3);
    FlowController.Permit permit = controller.acquire();
    controller.release(permit);
    assertThatThrownBy(() -> controller.release(permit))
        .isInstanceOf(IllegalStateException.class);
    assertThat(controller.inFlight()).isZero();
  }

  @Test
  void foreignPermitShouldBeRefused() throws Exception {
    DefaultFlowController controller = new DefaultFlowController(1);
    DefaultFlowController other = new DefaultFlowController(1);
    FlowController.Permit permit = other.acquire();
    assertThatThrownBy(() -> controller.release(permit))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> controller.release(() -> 42L))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(other.inFlight()).isEqualTo(1);
  }

  @Test
  void closeShouldFailWaitersAndNewAcquisitions() throws Exception {
    DefaultFlowController controller = new DefaultFlowController(1);
    FlowController.Permit permit = controller.acquire();
    AtomicReference<Throwable> waiterError = new AtomicReference<>();
    TestUtils.Sync waiterDone = sync();
    executorService.submit(
        () -> {
          try {
            controller.acquire();
          } catch (Throwable e) {
            waiterError.set(e);
          }
          waiterDone.down();
        });
    TestUtils.simulateActivity(50);
    controller.close();
    assertThat(waiterDone).completes();
    assertThat(waiterError.get())
        .isInstanceOf(ConsumptionException.ConsumptionClosedException.class);
    assertThatThrownBy(controller::acquire)
        .isInstanceOf(ConsumptionException.ConsumptionClosedException.class);
    assertThat(controller.isClosed()).isTrue();

    // outstanding permits can still be released
    controller.release(permit);
    assertThat(controller.inFlight()).isZero();
  }

  @Test
  void awaitDrainedShouldWaitForOutstandingPermits() throws Exception {
    DefaultFlowController controller = new DefaultFlowController(5);
    List<FlowController.Permit> permits = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      permits.add(controller.acquire());
    }
    assertThat(controller.awaitDrained(Duration.ofMillis(50))).isFalse();
    executorService.submit(
        () -> {
          permits.forEach(
              p -> {
                TestUtils.simulateActivity(20);
                controller.release(p);
              });
        });
    assertThat(controller.awaitDrained(Duration.ofSeconds(10))).isTrue();
    assertThat(controller.inFlight()).isZero();
    assertThat(new DefaultFlowController(1).awaitDrained(Duration.ofMillis(1))).isTrue();
  }

  @Test
  void acquireShouldBeInterruptible() throws Exception {
    DefaultFlowController controller = new DefaultFlowController(1);
    controller.acquire();
    AtomicReference<Throwable> error = new AtomicReference<>();
    Thread thread =
        new Thread(
            () -> {
              try {
                controller.acquire();
              } catch (Throwable e) {
                error.set(e);
              }
            });
    thread.start();
    TestUtils.simulateActivity(50);
    thread.interrupt();
    thread.join(TimeUnit.SECONDS.toMillis(10));
    waitAtMost(() -> error.get() != null);
    assertThat(error.get()).isInstanceOf(InterruptedException.class);
    assertThat(controller.inFlight()).isEqualTo(1);
  }

  @Test
  void invalidMaximumShouldBeRefused() {
    assertThatThrownBy(() -> new DefaultFlowController(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
