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

import com.rabbitmq.reliable.AckDecision;
import com.rabbitmq.reliable.Delivery;
import com.rabbitmq.reliable.DeliveryResolver;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public abstract class TestUtils {

  static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_WAIT_TIME = Duration.ofMillis(100);

  private static final AtomicLong DELIVERY_SEQUENCE = new AtomicLong(0);

  private TestUtils() {}

  @FunctionalInterface
  public interface CallableBooleanSupplier {
    boolean getAsBoolean() throws Exception;
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, DEFAULT_WAIT_TIME, condition, null);
  }

  public static Duration waitAtMost(CallableBooleanSupplier condition, Supplier<String> message) {
    return waitAtMost(DEFAULT_CONDITION_TIMEOUT, DEFAULT_WAIT_TIME, condition, message);
  }

  public static Duration waitAtMost(Duration timeout, CallableBooleanSupplier condition) {
    return waitAtMost(timeout, DEFAULT_WAIT_TIME, condition, null);
  }

  public static Duration waitAtMost(
      Duration timeout,
      Duration waitTime,
      CallableBooleanSupplier condition,
      Supplier<String> message) {
    long start = System.nanoTime();
    try {
      if (condition.getAsBoolean()) {
        return Duration.ZERO;
      }
      Duration waitedTime = Duration.ofNanos(System.nanoTime() - start);
      Exception exception = null;
      while (waitedTime.compareTo(timeout) <= 0) {
        Thread.sleep(waitTime.toMillis());
        waitedTime = waitedTime.plus(waitTime);
        start = System.nanoTime();
        try {
          if (condition.getAsBoolean()) {
            return waitedTime;
          }
          exception = null;
        } catch (Exception e) {
          exception = e;
        }
        waitedTime = waitedTime.plus(Duration.ofNanos(System.nanoTime() - start));
      }
      String msg;
      if (message == null) {
        msg = "Waited " + timeout.getSeconds() + " second(s), condition never got true";
      } else {
        msg = "Waited " + timeout.getSeconds() + " second(s), " + message.get();
      }
      if (exception == null) {
        fail(msg);
      } else {
        fail(msg, exception);
      }
      return waitedTime;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  static void simulateActivity(long timeInMs) {
    try {
      Thread.sleep(timeInMs);
    } catch (InterruptedException e) {
      throw new RuntimeException(e);
    }
  }

  static Delivery delivery(String correlationKey) {
    return Delivery.of(
        String.valueOf(DELIVERY_SEQUENCE.incrementAndGet()),
        correlationKey,
        correlationKey.getBytes(StandardCharsets.UTF_8));
  }

  static Sync sync() {
    return sync(1);
  }

  public static Sync sync(int count) {
    return new Sync(count, () -> {}, null);
  }

  static Sync sync(int count, Runnable doneCallback, String format, Object... args) {
    return new Sync(count, doneCallback, format, args);
  }

  public static class Sync {

    private final String description;
    private final AtomicReference<CountDownLatch> latch = new AtomicReference<>();
    private final AtomicReference<Runnable> doneCallback = new AtomicReference<>();

    private Sync(int count, Runnable doneCallback, String description, Object... args) {
      this.latch.set(new CountDownLatch(count));
      if (description == null) {
        this.description = "N/A";
      } else {
        this.description = String.format(description, args);
      }
      this.doneCallback.set(doneCallback);
    }

    public void down() {
      this.latch.get().countDown();
    }

    boolean await(Duration timeout) {
      try {
        return this.latch.get().await(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new RuntimeException(ie);
      } finally {
        this.doneCallback.get().run();
      }
    }

    boolean hasCompleted() {
      return this.latch.get().getCount() == 0;
    }

    @Override
    public String toString() {
      return this.description;
    }
  }

  /** {@link DeliveryResolver} that records the decisions it receives. */
  static class RecordingResolver implements DeliveryResolver {

    private final List<Resolution> resolutions = new CopyOnWriteArrayList<>();

    @Override
    public void resolve(Delivery delivery, AckDecision decision) {
      this.resolutions.add(new Resolution(delivery, decision));
    }

    List<AckDecision> decisions() {
      return this.resolutions.stream().map(r -> r.decision).collect(Collectors.toList());
    }

    List<AckDecision> decisions(String correlationKey) {
      return this.resolutions.stream()
          .filter(r -> r.delivery.correlationKey().equals(correlationKey))
          .map(r -> r.decision)
          .collect(Collectors.toList());
    }

    Map<String, Long> resolutionsPerDelivery() {
      Map<String, Long> counts = new ConcurrentHashMap<>();
      this.resolutions.forEach(r -> counts.merge(r.delivery.id(), 1L, Long::sum));
      return counts;
    }

    int count() {
      return this.resolutions.size();
    }
  }

  private static final class Resolution {

    private final Delivery delivery;
    private final AckDecision decision;

    private Resolution(Delivery delivery, AckDecision decision) {
      this.delivery = delivery;
      this.decision = decision;
    }
  }

  /** {@link Clock} tests can move forward. */
  static class MutableClock extends Clock {

    private final AtomicReference<Instant> instant;

    MutableClock(Instant start) {
      this.instant = new AtomicReference<>(start);
    }

    void advance(Duration duration) {
      this.instant.updateAndGet(i -> i.plus(duration));
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return this.instant.get();
    }
  }
}
