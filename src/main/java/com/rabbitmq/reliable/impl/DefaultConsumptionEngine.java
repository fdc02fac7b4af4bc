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

import static com.rabbitmq.reliable.Resource.State.CLOSED;
import static com.rabbitmq.reliable.Resource.State.CLOSING;
import static com.rabbitmq.reliable.Resource.State.OPEN;
import static com.rabbitmq.reliable.impl.Assert.notNull;

import com.rabbitmq.reliable.AckDecision;
import com.rabbitmq.reliable.AckMode;
import com.rabbitmq.reliable.AcknowledgmentPolicy;
import com.rabbitmq.reliable.ConsumptionEngine;
import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.DeadLetterSink;
import com.rabbitmq.reliable.Delivery;
import com.rabbitmq.reliable.DeliveryProcessor;
import com.rabbitmq.reliable.DeliveryResolver;
import com.rabbitmq.reliable.ErrorClassifier;
import com.rabbitmq.reliable.FailureKind;
import com.rabbitmq.reliable.FlowController;
import com.rabbitmq.reliable.Outcome;
import com.rabbitmq.reliable.RetryLedger;
import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class DefaultConsumptionEngine extends ResourceBase implements ConsumptionEngine {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultConsumptionEngine.class);

  private final long id;
  private final int maxAttempts;
  private final AckMode ackMode;
  private final ErrorClassifier classifier;
  private final AcknowledgmentPolicy policy;
  private final RetryLedger retryLedger;
  private final Duration retryRecordTtl;
  private final long expiryIntervalMs;
  private final AtomicLong nextExpiry = new AtomicLong(0);
  private final Clock clock;
  private final FlowController flowController;
  private final DeadLetterSink deadLetterSink;
  private final DeliveryResolver resolver;
  private final MetricsCollector metricsCollector;
  private final ExecutorService processingExecutor;
  private final boolean shutdownProcessingExecutor;
  private final Duration drainTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final Statistics statistics = new Statistics();
  // from permit request until the resolver returns, covers the release-then-resolve window
  private final Lock unresolvedLock = new ReentrantLock();
  private final Condition allResolved = unresolvedLock.newCondition();
  private int unresolved = 0;

  DefaultConsumptionEngine(DefaultConsumptionEngineBuilder builder) {
    super(builder.listeners());
    this.id = ID_SEQUENCE.getAndIncrement();
    this.maxAttempts = builder.maxAttempts();
    this.ackMode = builder.ackMode();
    this.classifier = builder.classifier();
    this.policy = builder.policy();
    this.retryLedger = builder.retryLedger();
    this.retryRecordTtl = builder.retryRecordTtl();
    this.expiryIntervalMs =
        this.retryRecordTtl == null ? 0 : Math.max(1, this.retryRecordTtl.toMillis() / 10);
    this.clock = builder.clock();
    this.flowController = new DefaultFlowController(builder.maxInFlight());
    this.deadLetterSink = builder.deadLetterSink();
    this.resolver = builder.resolver();
    this.metricsCollector = builder.metricsCollector();
    this.drainTimeout = builder.drainTimeout();
    if (builder.processingExecutor() == null) {
      this.processingExecutor = Utils.executorService("reliable-consumer-%d-", this.id);
      this.shutdownProcessingExecutor = true;
    } else {
      this.processingExecutor = builder.processingExecutor();
      this.shutdownProcessingExecutor = false;
    }
    this.state(OPEN);
    this.metricsCollector.openEngine();
    LOGGER.debug(
        "Engine {} open (ack mode {}, max attempts {}, max in-flight {})",
        this.id,
        this.ackMode,
        this.maxAttempts,
        this.flowController.maxInFlight());
  }

  @Override
  public AckDecision submit(Delivery delivery, DeliveryProcessor processor) {
    notNull(delivery, "Delivery cannot be null");
    notNull(processor, "Processor cannot be null");
    checkOpen();
    FlowController.Permit permit = acquire();
    try {
      return handle(delivery, processor, permit);
    } finally {
      resolved();
    }
  }

  @Override
  public CompletableFuture<AckDecision> dispatch(Delivery delivery, DeliveryProcessor processor) {
    notNull(delivery, "Delivery cannot be null");
    notNull(processor, "Processor cannot be null");
    checkOpen();
    FlowController.Permit permit = acquire();
    CompletableFuture<AckDecision> result = new CompletableFuture<>();
    try {
      this.processingExecutor.execute(
          () -> {
            try {
              result.complete(handle(delivery, processor, permit));
            } catch (Throwable e) {
              result.completeExceptionally(e);
            } finally {
              resolved();
            }
          });
    } catch (RejectedExecutionException e) {
      release(permit);
      resolved();
      throw new ConsumptionException.ConsumptionClosedException(
          "Processing executor rejected delivery " + delivery.id(), e);
    }
    return result;
  }

  @Override
  public int inFlight() {
    return this.flowController.inFlight();
  }

  @Override
  public RetryLedger retryLedger() {
    return this.retryLedger;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.state(CLOSING);
      this.flowController.close();
      boolean drained = false;
      try {
        drained = awaitResolved(this.drainTimeout);
        if (this.shutdownProcessingExecutor) {
          this.processingExecutor.shutdown();
          if (!this.processingExecutor.awaitTermination(
              this.drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            this.processingExecutor.shutdownNow();
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (!drained) {
        LOGGER.warn(
            "Engine {} closed with {} unresolved delivery(ies)",
            this.id,
            unresolved());
      }
      LOGGER.info(
          "Engine {} closed: {} acknowledged, {} requeued, {} rejected, {} dead-lettered, "
              + "{} lost, {} key(s) still retrying",
          this.id,
          this.statistics.acknowledged.get(),
          this.statistics.requeued.get(),
          this.statistics.rejected.get(),
          this.statistics.deadLettered.get(),
          this.statistics.lost.get(),
          this.retryLedger.size());
      this.metricsCollector.closeEngine();
      this.state(CLOSED);
    }
  }

  // internal API

  Statistics statistics() {
    return this.statistics;
  }

  int unresolved() {
    this.unresolvedLock.lock();
    try {
      return this.unresolved;
    } finally {
      this.unresolvedLock.unlock();
    }
  }

  private FlowController.Permit acquire() {
    // counted before the permit exists, so close() cannot miss a delivery being admitted
    this.unresolvedLock.lock();
    try {
      this.unresolved++;
    } finally {
      this.unresolvedLock.unlock();
    }
    try {
      FlowController.Permit permit = this.flowController.acquire();
      this.metricsCollector.acquire();
      return permit;
    } catch (InterruptedException e) {
      resolved();
      Thread.currentThread().interrupt();
      throw new ConsumptionException("Interrupted while waiting for in-flight budget", e);
    } catch (RuntimeException e) {
      resolved();
      throw e;
    }
  }

  private void resolved() {
    this.unresolvedLock.lock();
    try {
      this.unresolved--;
      if (this.unresolved == 0) {
        this.allResolved.signalAll();
      }
    } finally {
      this.unresolvedLock.unlock();
    }
  }

  private boolean awaitResolved(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    this.unresolvedLock.lockInterruptibly();
    try {
      while (this.unresolved > 0) {
        if (remaining <= 0) {
          return false;
        }
        remaining = this.allResolved.awaitNanos(remaining);
      }
      return true;
    } finally {
      this.unresolvedLock.unlock();
    }
  }

  private void expireRetryRecords() {
    long now = this.clock.millis();
    long next = this.nextExpiry.get();
    if (now >= next && this.nextExpiry.compareAndSet(next, now + this.expiryIntervalMs)) {
      int expired = this.retryLedger.expire(this.retryRecordTtl);
      if (expired > 0) {
        LOGGER.debug("Engine {} expired {} retry record(s)", this.id, expired);
      }
    }
  }

  private void release(FlowController.Permit permit) {
    this.flowController.release(permit);
    this.metricsCollector.release();
  }

  private AckDecision handle(
      Delivery delivery, DeliveryProcessor processor, FlowController.Permit permit) {
    if (this.ackMode == AckMode.AUTO) {
      return handleAutoAck(delivery, processor, permit);
    }
    String key = delivery.correlationKey();
    int attempts = 0;
    Outcome outcome;
    AckDecision decision;
    try {
      this.metricsCollector.consume();
      if (this.retryRecordTtl != null) {
        expireRetryRecords();
      }
      attempts = this.retryLedger.recordAttempt(key);
      LOGGER.debug(
          "Processing delivery {} (key '{}', attempt {}/{}, redelivered: {})",
          delivery.id(),
          key,
          attempts,
          this.maxAttempts,
          delivery.attemptHint());
      outcome = process(delivery, processor);
      decision = this.policy.decide(outcome, attempts, this.maxAttempts);
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Unexpected error while handling delivery {}, requeuing it: {}",
          delivery.id(),
          ExceptionUtils.exceptionMessage(e));
      outcome = Outcome.failure(FailureKind.UNKNOWN, ExceptionUtils.exceptionMessage(e), e);
      decision = AckDecision.REQUEUE;
    }
    if (!outcome.isSuccess()) {
      this.metricsCollector.failure(outcome.kind());
    }
    if (decision == AckDecision.REJECT) {
      deadLetter(delivery, outcome, attempts);
    }
    return resolve(delivery, decision, permit, attempts);
  }

  private AckDecision handleAutoAck(
      Delivery delivery, DeliveryProcessor processor, FlowController.Permit permit) {
    try {
      this.metricsCollector.consume();
      try {
        this.resolver.resolve(delivery, AckDecision.ACK);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ConsumptionException.ResolutionException(delivery, AckDecision.ACK, e);
      } catch (Exception e) {
        throw new ConsumptionException.ResolutionException(delivery, AckDecision.ACK, e);
      }
      this.metricsCollector.consumeDisposition(AckDecision.ACK);
      this.statistics.record(AckDecision.ACK);
      Outcome outcome = process(delivery, processor);
      if (!outcome.isSuccess()) {
        this.metricsCollector.failure(outcome.kind());
        this.metricsCollector.lost();
        this.statistics.lost.incrementAndGet();
        LOGGER.warn(
            "Auto-acknowledged delivery {} (key '{}') failed ({}), message is lost: {}",
            delivery.id(),
            delivery.correlationKey(),
            outcome.kind(),
            outcome.detail());
      }
      return AckDecision.ACK;
    } finally {
      release(permit);
    }
  }

  private Outcome process(Delivery delivery, DeliveryProcessor processor) {
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    Outcome outcome;
    try {
      outcome = processor.process(delivery);
      if (outcome == null) {
        outcome = Outcome.failure(FailureKind.UNKNOWN, "Processor returned no outcome");
      }
    } catch (Throwable e) {
      if (ExceptionUtils.isInterruption(e)) {
        Thread.currentThread().interrupt();
      }
      outcome = this.classifier.outcome(e);
      LOGGER.debug(
          "Processing of delivery {} failed ({}): {}",
          delivery.id(),
          outcome.kind(),
          ExceptionUtils.exceptionMessage(e));
    } finally {
      this.metricsCollector.processed(stopWatch.stop());
    }
    return outcome;
  }

  private void deadLetter(Delivery delivery, Outcome outcome, int attempts) {
    try {
      this.deadLetterSink.record(delivery, outcome, attempts);
      this.metricsCollector.deadLettered();
      this.statistics.deadLettered.incrementAndGet();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      this.metricsCollector.deadLetterFailure();
      LOGGER.warn(
          "Interrupted while recording delivery {} (key '{}') in dead-letter sink",
          delivery.id(),
          delivery.correlationKey());
    } catch (Exception e) {
      this.metricsCollector.deadLetterFailure();
      LOGGER.warn(
          "Could not record delivery {} (key '{}') in dead-letter sink: {}",
          delivery.id(),
          delivery.correlationKey(),
          ExceptionUtils.exceptionMessage(e));
    }
  }

  private AckDecision resolve(
      Delivery delivery, AckDecision decision, FlowController.Permit permit, int attempts) {
    try {
      if (decision != AckDecision.REQUEUE) {
        this.retryLedger.clear(delivery.correlationKey());
      }
    } finally {
      release(permit);
    }
    try {
      this.resolver.resolve(delivery, decision);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while resolving delivery {} with {}", delivery.id(), decision);
      throw new ConsumptionException.ResolutionException(delivery, decision, e);
    } catch (Exception e) {
      LOGGER.warn(
          "Could not resolve delivery {} with {}: {}",
          delivery.id(),
          decision,
          ExceptionUtils.exceptionMessage(e));
      throw new ConsumptionException.ResolutionException(delivery, decision, e);
    }
    this.metricsCollector.consumeDisposition(decision);
    this.statistics.record(decision);
    LOGGER.debug(
        "Delivery {} (key '{}') resolved with {} after {} attempt(s)",
        delivery.id(),
        delivery.correlationKey(),
        decision,
        attempts);
    return decision;
  }

  @Override
  public String toString() {
    return "DefaultConsumptionEngine{"
        + "id="
        + id
        + ", ackMode="
        + ackMode
        + ", maxAttempts="
        + maxAttempts
        + ", maxInFlight="
        + flowController.maxInFlight()
        + '}';
  }

  static final class Statistics {

    private final AtomicLong acknowledged = new AtomicLong(0);
    private final AtomicLong requeued = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);
    private final AtomicLong deadLettered = new AtomicLong(0);
    private final AtomicLong lost = new AtomicLong(0);

    private void record(AckDecision decision) {
      switch (decision) {
        case ACK:
          this.acknowledged.incrementAndGet();
          break;
        case REQUEUE:
          this.requeued.incrementAndGet();
          break;
        case REJECT:
          this.rejected.incrementAndGet();
          break;
        default:
          break;
      }
    }

    long acknowledged() {
      return this.acknowledged.get();
    }

    long requeued() {
      return this.requeued.get();
    }

    long rejected() {
      return this.rejected.get();
    }

    long deadLettered() {
      return this.deadLettered.get();
    }

    long lost() {
      return this.lost.get();
    }
  }
}
