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

import com.rabbitmq.reliable.metrics.MetricsCollector;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/** API to configure and create a {@link ConsumptionEngine}. */
public interface ConsumptionEngineBuilder {

  /**
   * Maximum number of processing attempts for a correlation key.
   *
   * <p>Default is 3. Must be at least 1.
   *
   * @param maxAttempts maximum number of attempts
   * @return this builder instance
   */
  ConsumptionEngineBuilder maxAttempts(int maxAttempts);

  /**
   * Maximum number of deliveries held unresolved at the same time, like the AMQP prefetch count.
   *
   * <p>Default is 1. Must be at least 1. Workers with more capacity can use a higher value to get
   * proportionally more work.
   *
   * @param maxInFlight maximum number of in-flight deliveries
   * @return this builder instance
   */
  ConsumptionEngineBuilder maxInFlight(int maxInFlight);

  /**
   * Classifier for processing errors.
   *
   * <p>Default is {@link ErrorClassifier#defaultClassifier()}.
   *
   * @param classifier the error classifier
   * @return this builder instance
   * @see ErrorClassifier#builder()
   */
  ConsumptionEngineBuilder classifier(ErrorClassifier classifier);

  /**
   * Acknowledgment policy.
   *
   * <p>Default is {@link AcknowledgmentPolicy#standard()}.
   *
   * @param policy the policy
   * @return this builder instance
   */
  ConsumptionEngineBuilder policy(AcknowledgmentPolicy policy);

  /**
   * Retry ledger.
   *
   * <p>Default is an in-memory ledger owned by the engine. A ledger can be shared between engines
   * consuming from the same queue.
   *
   * @param retryLedger the retry ledger
   * @return this builder instance
   */
  ConsumptionEngineBuilder retryLedger(RetryLedger retryLedger);

  /**
   * Maximum age of a retry record.
   *
   * <p>Records older than this are evicted, which bounds the memory used by messages that never
   * come back. No expiry by default.
   *
   * @param retryRecordTtl maximum age of retry records
   * @return this builder instance
   */
  ConsumptionEngineBuilder retryRecordTtl(Duration retryRecordTtl);

  /**
   * Sink for rejected deliveries.
   *
   * <p>Default is {@link DeadLetterSink#logging()}.
   *
   * @param deadLetterSink the sink
   * @return this builder instance
   */
  ConsumptionEngineBuilder deadLetterSink(DeadLetterSink deadLetterSink);

  /**
   * Transport-side settlement of deliveries. Mandatory.
   *
   * @param resolver the resolver
   * @return this builder instance
   */
  ConsumptionEngineBuilder resolver(DeliveryResolver resolver);

  /**
   * Acknowledgment mode.
   *
   * <p>Default is {@link AckMode#MANUAL}.
   *
   * @param ackMode the acknowledgment mode
   * @return this builder instance
   * @see AckMode#AUTO
   */
  ConsumptionEngineBuilder ackMode(AckMode ackMode);

  /**
   * Time to wait for in-flight deliveries when closing the engine.
   *
   * <p>Default is 30 seconds.
   *
   * @param drainTimeout the drain timeout
   * @return this builder instance
   */
  ConsumptionEngineBuilder drainTimeout(Duration drainTimeout);

  /**
   * Executor for asynchronous processing.
   *
   * <p>The engine creates its own by default and shuts it down when closed. It is the developer's
   * responsibility to shut down an executor set here.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  ConsumptionEngineBuilder processingExecutor(ExecutorService executorService);

  /**
   * Collector for consumption metrics.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   */
  ConsumptionEngineBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Add {@link com.rabbitmq.reliable.Resource.StateListener}s to the engine.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  ConsumptionEngineBuilder listeners(Resource.StateListener... listeners);

  /**
   * Clock for the retry records.
   *
   * @param clock the clock
   * @return this builder instance
   */
  ConsumptionEngineBuilder clock(Clock clock);

  /**
   * Create the engine.
   *
   * @return the configured engine
   */
  ConsumptionEngine build();
}
