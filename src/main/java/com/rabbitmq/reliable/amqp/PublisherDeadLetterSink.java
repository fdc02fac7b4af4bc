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
package com.rabbitmq.reliable.amqp;

import com.rabbitmq.client.amqp.Message;
import com.rabbitmq.client.amqp.Publisher;
import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.DeadLetterSink;
import com.rabbitmq.reliable.Delivery;
import com.rabbitmq.reliable.Outcome;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link DeadLetterSink} that publishes rejected deliveries with a {@link Publisher}.
 *
 * <p>The message carries the payload and the properties of the delivery, with the failure
 * information as extra application properties. The sink waits for the broker to accept the
 * message.
 */
public final class PublisherDeadLetterSink implements DeadLetterSink {

  static final String FAILURE_KIND_PROPERTY = "x-failure-kind";
  static final String FAILURE_DETAIL_PROPERTY = "x-failure-detail";
  static final String ATTEMPTS_PROPERTY = "x-attempts";
  static final String CORRELATION_KEY_PROPERTY = "x-correlation-key";

  private static final Duration DEFAULT_PUBLISH_TIMEOUT = Duration.ofSeconds(10);

  private final Publisher publisher;
  private final Duration publishTimeout;

  public PublisherDeadLetterSink(Publisher publisher) {
    this(publisher, DEFAULT_PUBLISH_TIMEOUT);
  }

  public PublisherDeadLetterSink(Publisher publisher, Duration publishTimeout) {
    if (publisher == null) {
      throw new IllegalArgumentException("Publisher cannot be null");
    }
    if (publishTimeout == null || publishTimeout.isNegative() || publishTimeout.isZero()) {
      throw new IllegalArgumentException("Publish timeout must be positive");
    }
    this.publisher = publisher;
    this.publishTimeout = publishTimeout;
  }

  @Override
  public void record(Delivery delivery, Outcome outcome, int attempts)
      throws InterruptedException {
    Message message =
        this.publisher.message(delivery.payload()).messageId(delivery.correlationKey());
    delivery.properties().forEach((key, value) -> message.property(key, value));
    message
        .property(CORRELATION_KEY_PROPERTY, delivery.correlationKey())
        .property(ATTEMPTS_PROPERTY, attempts)
        .property(FAILURE_KIND_PROPERTY, outcome.isSuccess() ? "" : outcome.kind().name())
        .property(FAILURE_DETAIL_PROPERTY, outcome.detail() == null ? "" : outcome.detail());
    CountDownLatch latch = new CountDownLatch(1);
    AtomicReference<Publisher.Context> result = new AtomicReference<>();
    this.publisher.publish(
        message,
        context -> {
          result.set(context);
          latch.countDown();
        });
    if (!latch.await(this.publishTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
      throw new ConsumptionException.DeadLetterSinkUnavailableException(
          "No broker outcome for dead-lettered delivery %s after %s",
          delivery.id(),
          this.publishTimeout);
    }
    Publisher.Context context = result.get();
    if (context.status() != Publisher.Status.ACCEPTED) {
      throw new ConsumptionException.DeadLetterSinkUnavailableException(
          "Dead-lettered delivery " + delivery.id() + " not accepted: " + context.status(),
          context.failureCause());
    }
  }
}
