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

import java.util.concurrent.CompletableFuture;

/**
 * Decides for each delivery whether to acknowledge, requeue, or reject it.
 *
 * <p>The engine counts attempts per correlation key in a {@link RetryLedger}, classifies
 * processing errors with an {@link ErrorClassifier}, applies an {@link AcknowledgmentPolicy},
 * bounds the unresolved deliveries with a {@link FlowController}, and settles each delivery
 * exactly once through a {@link DeliveryResolver}. Rejected deliveries are handed to a {@link
 * DeadLetterSink} first.
 *
 * <p>Processing errors never escape the engine, they always end up as an {@link AckDecision}.
 * Only a failure of the {@link DeliveryResolver} propagates, as a {@link
 * ConsumptionException.ResolutionException}.
 *
 * <p>Instances are created with a {@link ConsumptionEngineBuilder}.
 *
 * @see com.rabbitmq.reliable.impl.DefaultConsumptionEngineBuilder
 */
public interface ConsumptionEngine extends AutoCloseable, Resource {

  /**
   * Process and resolve a delivery on the calling thread.
   *
   * <p>The call blocks while the in-flight budget is exhausted.
   *
   * @param delivery the delivery
   * @param processor the processing logic
   * @return the decision applied to the delivery
   * @throws ConsumptionException.ResolutionException if the transport fails to settle the
   *     delivery
   * @throws ConsumptionException.ConsumptionClosedException if the engine is closed
   */
  AckDecision submit(Delivery delivery, DeliveryProcessor processor);

  /**
   * Process and resolve a delivery asynchronously.
   *
   * <p>The in-flight permit is acquired on the calling thread, so the call blocks while the budget
   * is exhausted. Processing then happens on the processing executor of the engine, up to {@link
   * FlowController#maxInFlight()} deliveries at the same time.
   *
   * @param delivery the delivery
   * @param processor the processing logic
   * @return a future completed with the decision applied to the delivery, or completed
   *     exceptionally with a {@link ConsumptionException.ResolutionException}
   * @throws ConsumptionException.ConsumptionClosedException if the engine is closed
   */
  CompletableFuture<AckDecision> dispatch(Delivery delivery, DeliveryProcessor processor);

  /**
   * Number of deliveries currently held unresolved.
   *
   * @return in-flight delivery count
   */
  int inFlight();

  /**
   * The ledger the engine counts attempts with.
   *
   * @return the retry ledger
   */
  RetryLedger retryLedger();

  /**
   * Close the engine.
   *
   * <p>The engine stops accepting deliveries and waits for in-flight deliveries to be resolved
   * before returning.
   */
  @Override
  void close();
}
