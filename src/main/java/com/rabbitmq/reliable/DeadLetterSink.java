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

/**
 * Durable record of rejected deliveries.
 *
 * <p>Calls are best-effort: the engine logs a failure of the sink and resolves the delivery
 * anyway.
 */
@FunctionalInterface
public interface DeadLetterSink {

  /**
   * Record a rejected delivery.
   *
   * @param delivery the delivery
   * @param outcome the outcome that led to the rejection
   * @param attempts number of attempts made for the correlation key
   * @throws Exception if the delivery cannot be recorded
   */
  void record(Delivery delivery, Outcome outcome, int attempts) throws Exception;

  /**
   * Sink that logs rejected deliveries.
   *
   * @return the logging sink
   */
  static DeadLetterSink logging() {
    return LoggingDeadLetterSink.INSTANCE;
  }
}
