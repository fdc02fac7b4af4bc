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

import static com.rabbitmq.reliable.impl.Assert.atLeastOne;
import static com.rabbitmq.reliable.impl.Assert.notNull;
import static com.rabbitmq.reliable.impl.Assert.positive;

import com.rabbitmq.reliable.AckMode;
import com.rabbitmq.reliable.AcknowledgmentPolicy;
import com.rabbitmq.reliable.ConsumptionEngine;
import com.rabbitmq.reliable.ConsumptionEngineBuilder;
import com.rabbitmq.reliable.DeadLetterSink;
import com.rabbitmq.reliable.DeliveryResolver;
import com.rabbitmq.reliable.ErrorClassifier;
import com.rabbitmq.reliable.Resource;
import com.rabbitmq.reliable.RetryLedger;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import com.rabbitmq.reliable.metrics.NoOpMetricsCollector;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Builder for {@link ConsumptionEngine} instances.
 *
 * <p>Only the {@link DeliveryResolver} is mandatory, the other settings have defaults.
 */
public class DefaultConsumptionEngineBuilder implements ConsumptionEngineBuilder {

  static final int DEFAULT_MAX_ATTEMPTS = 3;
  static final int DEFAULT_MAX_IN_FLIGHT = 1;
  static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

  private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
  private int maxInFlight = DEFAULT_MAX_IN_FLIGHT;
  private ErrorClassifier classifier = ErrorClassifier.defaultClassifier();
  private AcknowledgmentPolicy policy = AcknowledgmentPolicy.standard();
  private RetryLedger retryLedger;
  private Duration retryRecordTtl;
  private DeadLetterSink deadLetterSink = DeadLetterSink.logging();
  private DeliveryResolver resolver;
  private AckMode ackMode = AckMode.MANUAL;
  private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
  private ExecutorService processingExecutor;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private Clock clock = Clock.systemUTC();

  @Override
  public DefaultConsumptionEngineBuilder maxAttempts(int maxAttempts) {
    this.maxAttempts = atLeastOne(maxAttempts, "Max attempts");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder maxInFlight(int maxInFlight) {
    this.maxInFlight = atLeastOne(maxInFlight, "Max in-flight");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder classifier(ErrorClassifier classifier) {
    this.classifier = notNull(classifier, "Error classifier cannot be null");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder policy(AcknowledgmentPolicy policy) {
    this.policy = notNull(policy, "Acknowledgment policy cannot be null");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder retryLedger(RetryLedger retryLedger) {
    this.retryLedger = notNull(retryLedger, "Retry ledger cannot be null");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder retryRecordTtl(Duration retryRecordTtl) {
    this.retryRecordTtl = positive(retryRecordTtl, "Retry record TTL");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder deadLetterSink(DeadLetterSink deadLetterSink) {
    this.deadLetterSink = notNull(deadLetterSink, "Dead-letter sink cannot be null");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder resolver(DeliveryResolver resolver) {
    this.resolver = notNull(resolver, "Resolver cannot be null");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder ackMode(AckMode ackMode) {
    this.ackMode = notNull(ackMode, "Ack mode cannot be null");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder drainTimeout(Duration drainTimeout) {
    this.drainTimeout = positive(drainTimeout, "Drain timeout");
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder processingExecutor(ExecutorService executorService) {
    this.processingExecutor = executorService;
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public DefaultConsumptionEngineBuilder clock(Clock clock) {
    this.clock = notNull(clock, "Clock cannot be null");
    return this;
  }

  @Override
  public ConsumptionEngine build() {
    if (this.resolver == null) {
      throw new IllegalArgumentException("A resolver must be specified");
    }
    if (this.retryLedger == null) {
      this.retryLedger = new InMemoryRetryLedger(this.clock);
    }
    return new DefaultConsumptionEngine(this);
  }

  int maxAttempts() {
    return this.maxAttempts;
  }

  int maxInFlight() {
    return this.maxInFlight;
  }

  ErrorClassifier classifier() {
    return this.classifier;
  }

  AcknowledgmentPolicy policy() {
    return this.policy;
  }

  RetryLedger retryLedger() {
    return this.retryLedger;
  }

  Duration retryRecordTtl() {
    return this.retryRecordTtl;
  }

  DeadLetterSink deadLetterSink() {
    return this.deadLetterSink;
  }

  DeliveryResolver resolver() {
    return this.resolver;
  }

  AckMode ackMode() {
    return this.ackMode;
  }

  Duration drainTimeout() {
    return this.drainTimeout;
  }

  ExecutorService processingExecutor() {
    return this.processingExecutor;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Clock clock() {
    return this.clock;
  }

  List<Resource.StateListener> listeners() {
    return new ArrayList<>(this.listeners);
  }
}
