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

import com.rabbitmq.client.amqp.Consumer;
import com.rabbitmq.client.amqp.Message;
import com.rabbitmq.reliable.AckDecision;
import com.rabbitmq.reliable.ConsumptionEngine;
import com.rabbitmq.reliable.ConsumptionEngineBuilder;
import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.Delivery;
import com.rabbitmq.reliable.DeliveryProcessor;
import com.rabbitmq.reliable.DeliveryResolver;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Consumer.MessageHandler} that hands messages to a {@link ConsumptionEngine} and settles
 * them according to the decision of the engine.
 *
 * <p>{@link AckDecision#ACK} maps to {@link Consumer.Context#accept()}, {@link
 * AckDecision#REQUEUE} to {@link Consumer.Context#requeue()}, and {@link AckDecision#REJECT} to
 * {@link Consumer.Context#discard()}.
 *
 * <p>The correlation key of a delivery is the message ID, or the correlation ID if the message
 * has no ID, or the delivery ID if the message has neither.
 *
 * <pre>{@code
 * ReliableMessageHandler handler = ReliableMessageHandler.create(
 *     new DefaultConsumptionEngineBuilder().maxInFlight(5),
 *     delivery -> process(delivery.payload()));
 * Consumer consumer = connection.consumerBuilder()
 *     .queue("tasks")
 *     .initialCredits(5)
 *     .messageHandler(handler)
 *     .build();
 * }</pre>
 */
public final class ReliableMessageHandler
    implements Consumer.MessageHandler, DeliveryResolver, AutoCloseable {

  static final String DELIVERY_COUNT_ANNOTATION = "x-delivery-count";

  private static final Logger LOGGER = LoggerFactory.getLogger(ReliableMessageHandler.class);

  private final AtomicLong deliverySequence = new AtomicLong(0);
  private final Map<String, Consumer.Context> pending = new ConcurrentHashMap<>();
  private final DeliveryProcessor processor;
  private volatile ConsumptionEngine engine;

  private ReliableMessageHandler(DeliveryProcessor processor) {
    this.processor = processor;
  }

  /**
   * Create a handler and its engine.
   *
   * <p>The handler registers itself as the resolver of the engine.
   *
   * @param engineBuilder builder of the engine
   * @param processor processing logic
   * @return the handler
   */
  public static ReliableMessageHandler create(
      ConsumptionEngineBuilder engineBuilder, DeliveryProcessor processor) {
    if (engineBuilder == null) {
      throw new IllegalArgumentException("Engine builder cannot be null");
    }
    if (processor == null) {
      throw new IllegalArgumentException("Processor cannot be null");
    }
    ReliableMessageHandler handler = new ReliableMessageHandler(processor);
    handler.engine = engineBuilder.resolver(handler).build();
    return handler;
  }

  @Override
  public void handle(Consumer.Context context, Message message) {
    Delivery delivery = delivery(message);
    this.pending.put(delivery.id(), context);
    CompletableFuture<AckDecision> result;
    try {
      result = this.engine.dispatch(delivery, this.processor);
    } catch (ConsumptionException.ConsumptionClosedException e) {
      this.pending.remove(delivery.id());
      LOGGER.debug("Engine closed, requeuing delivery {}", delivery.id());
      context.requeue();
      return;
    } catch (ConsumptionException e) {
      this.pending.remove(delivery.id());
      LOGGER.warn(
          "Delivery {} could not be admitted, requeuing it: {}", delivery.id(), e.getMessage());
      context.requeue();
      return;
    }
    result.whenComplete(
        (decision, ex) -> {
          if (ex != null) {
            LOGGER.warn(
                "Delivery {} (key '{}') could not be settled: {}",
                delivery.id(),
                delivery.correlationKey(),
                ex.getMessage());
          }
        });
  }

  @Override
  public void resolve(Delivery delivery, AckDecision decision) {
    Consumer.Context context = this.pending.remove(delivery.id());
    if (context == null) {
      throw new IllegalStateException("No pending message for delivery " + delivery.id());
    }
    switch (decision) {
      case ACK:
        context.accept();
        break;
      case REQUEUE:
        context.requeue();
        break;
      case REJECT:
        context.discard();
        break;
      default:
        throw new IllegalArgumentException("Unsupported decision: " + decision);
    }
  }

  public ConsumptionEngine engine() {
    return this.engine;
  }

  int pendingCount() {
    return this.pending.size();
  }

  /** Close the engine, waiting for in-flight messages to be settled. */
  @Override
  public void close() {
    this.engine.close();
  }

  Delivery delivery(Message message) {
    String id = String.valueOf(this.deliverySequence.incrementAndGet());
    Delivery.Builder builder =
        Delivery.builder()
            .id(id)
            .correlationKey(correlationKey(message, id))
            .payload(message.body())
            .attemptHint(redelivered(message));
    message.forEachProperty(
        (key, value) -> {
          if (value != null) {
            builder.property(key, value.toString());
          }
        });
    return builder.build();
  }

  private static String correlationKey(Message message, String deliveryId) {
    Object messageId = message.messageId();
    if (messageId != null) {
      return messageId.toString();
    }
    Object correlationId = message.correlationId();
    if (correlationId != null) {
      return correlationId.toString();
    }
    return deliveryId;
  }

  private static boolean redelivered(Message message) {
    Object deliveryCount = message.annotation(DELIVERY_COUNT_ANNOTATION);
    return deliveryCount instanceof Number && ((Number) deliveryCount).longValue() > 0;
  }
}
