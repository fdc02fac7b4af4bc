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
import java.time.Duration;

/** Interface to collect execution data of consumption engines. */
public interface MetricsCollector {

  /** Called when a new {@link com.rabbitmq.reliable.ConsumptionEngine} is opened. */
  void openEngine();

  /** Called when a {@link com.rabbitmq.reliable.ConsumptionEngine} is closed. */
  void closeEngine();

  /** Called when a {@link com.rabbitmq.reliable.Delivery} enters processing. */
  void consume();

  /**
   * Called when a {@link com.rabbitmq.reliable.Delivery} has been processed.
   *
   * @param duration processing duration
   */
  void processed(Duration duration);

  /**
   * Called when the processing of a {@link com.rabbitmq.reliable.Delivery} fails.
   *
   * @param kind kind of failure
   */
  void failure(FailureKind kind);

  /**
   * Called when a {@link com.rabbitmq.reliable.Delivery} is resolved.
   *
   * @param decision the decision applied
   */
  void consumeDisposition(AckDecision decision);

  /** Called when a rejected delivery has been recorded by the dead-letter sink. */
  void deadLettered();

  /** Called when the dead-letter sink failed to record a rejected delivery. */
  void deadLetterFailure();

  /** Called when an auto-acknowledged delivery fails, meaning it is lost. */
  void lost();

  /** Called when an in-flight permit is acquired. */
  void acquire();

  /** Called when an in-flight permit is released. */
  void release();
}
