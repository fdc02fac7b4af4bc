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

import java.time.Duration;

/**
 * Bounds the number of deliveries a worker holds unresolved, like the AMQP prefetch count.
 *
 * <p>A permit is acquired before a delivery is processed and released once it is resolved. There
 * are never more than {@link #maxInFlight()} outstanding permits.
 */
public interface FlowController extends AutoCloseable {

  /**
   * Acquire a permit, blocking while the budget is exhausted.
   *
   * @return the permit
   * @throws InterruptedException if interrupted while waiting
   * @throws ConsumptionException.ConsumptionClosedException if the controller is closed
   */
  Permit acquire() throws InterruptedException;

  /**
   * Acquire a permit, waiting at most the given timeout.
   *
   * @param timeout maximum time to wait
   * @return the permit, null if the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   * @throws ConsumptionException.ConsumptionClosedException if the controller is closed
   */
  Permit tryAcquire(Duration timeout) throws InterruptedException;

  /**
   * Release a permit. Must be called exactly once per acquired permit.
   *
   * @param permit the permit
   * @throws IllegalStateException if the permit has already been released
   */
  void release(Permit permit);

  int inFlight();

  int maxInFlight();

  /**
   * Wait until all the permits are released.
   *
   * @param timeout maximum time to wait
   * @return true if no permit is outstanding, false if the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  boolean awaitDrained(Duration timeout) throws InterruptedException;

  /** Stop handing out permits. Outstanding permits can still be released. */
  @Override
  void close();

  /** Token for a unit of in-flight budget. */
  interface Permit {

    long id();
  }
}
