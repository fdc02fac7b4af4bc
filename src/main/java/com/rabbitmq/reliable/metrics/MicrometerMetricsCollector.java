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
package com.rabbitmq.reliable.metrics;

import com.rabbitmq.reliable.AckDecision;
import com.rabbitmq.reliable.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong engines;
  private final AtomicLong inFlight;
  private final Counter consume, consumeAccepted, consumeRequeued, consumeRejected;
  private final Counter deadLettered, deadLetterFailures, lost;
  private final Map<FailureKind, Counter> failures = new EnumMap<>(FailureKind.class);
  private final Timer processing;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.reliable");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.engines = registry.gauge(prefix + ".engines", tags, new AtomicLong(0));
    this.inFlight = registry.gauge(prefix + ".in_flight", tags, new AtomicLong(0));
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.consumeAccepted = registry.counter(prefix + ".consumed_accepted", tags);
    this.consumeRequeued = registry.counter(prefix + ".consumed_requeued", tags);
    this.consumeRejected = registry.counter(prefix + ".consumed_rejected", tags);
    this.deadLettered = registry.counter(prefix + ".dead_lettered", tags);
    this.deadLetterFailures = registry.counter(prefix + ".dead_letter_failures", tags);
    this.lost = registry.counter(prefix + ".lost", tags);
    for (FailureKind kind : FailureKind.values()) {
      this.failures.put(
          kind,
          Counter.builder(prefix + ".failures")
              .tags(tags)
              .tag("kind", kind.name().toLowerCase(Locale.ENGLISH))
              .register(registry));
    }
    this.processing = Timer.builder(prefix + ".processing").tags(tags).register(registry);
  }

  @Override
  public void openEngine() {
    this.engines.incrementAndGet();
  }

  @Override
  public void closeEngine() {
    this.engines.decrementAndGet();
  }

  @Override
  public void consume() {
    this.consume.increment();
  }

  @Override
  public void processed(Duration duration) {
    this.processing.record(duration);
  }

  @Override
  public void failure(FailureKind kind) {
    this.failures.get(kind).increment();
  }

  @Override
  public void consumeDisposition(AckDecision decision) {
    switch (decision) {
      case ACK:
        this.consumeAccepted.increment();
        break;
      case REQUEUE:
        this.consumeRequeued.increment();
        break;
      case REJECT:
        this.consumeRejected.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void deadLettered() {
    this.deadLettered.increment();
  }

  @Override
  public void deadLetterFailure() {
    this.deadLetterFailures.increment();
  }

  @Override
  public void lost() {
    this.lost.increment();
  }

  @Override
  public void acquire() {
    this.inFlight.incrementAndGet();
  }

  @Override
  public void release() {
    this.inFlight.decrementAndGet();
  }
}
