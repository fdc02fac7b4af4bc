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

/** Acknowledgment mode of a {@link ConsumptionEngine}. */
public enum AckMode {

  /**
   * Deliveries are resolved after processing, according to the {@link AcknowledgmentPolicy}.
   *
   * <p>This is the at-least-once mode: a delivery that fails with a retryable error is requeued
   * until its attempts are exhausted.
   */
  MANUAL,

  /**
   * Deliveries are acknowledged <b>before</b> processing, the {@link AcknowledgmentPolicy} and the
   * {@link RetryLedger} are never consulted.
   *
   * <p>This is the at-most-once mode. A processing failure after the delivery has been settled
   * means the message is lost, there is no way to recover it. Use only when losing messages is
   * acceptable.
   */
  AUTO
}
