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
 * Decides how to resolve a delivery given its processing outcome and attempt count.
 *
 * @see #standard()
 */
@FunctionalInterface
public interface AcknowledgmentPolicy {

  /**
   * Decide the resolution of a delivery.
   *
   * @param outcome processing outcome
   * @param attempts attempts made so far for the correlation key, including this one
   * @param maxAttempts maximum number of attempts, at least 1
   * @return the decision
   */
  AckDecision decide(Outcome outcome, int attempts, int maxAttempts);

  /**
   * The standard policy.
   *
   * <ul>
   *   <li>success: {@link AckDecision#ACK}
   *   <li>{@link FailureKind#PERMANENT} failure: {@link AckDecision#REJECT}, whatever the number
   *       of attempts
   *   <li>other failure with <code>attempts &lt; maxAttempts</code>: {@link AckDecision#REQUEUE}
   *   <li>other failure with <code>attempts &gt;= maxAttempts</code>: {@link AckDecision#REJECT}
   * </ul>
   *
   * @return the standard policy
   */
  static AcknowledgmentPolicy standard() {
    return StandardAcknowledgmentPolicy.INSTANCE;
  }

  final class StandardAcknowledgmentPolicy implements AcknowledgmentPolicy {

    private static final AcknowledgmentPolicy INSTANCE = new StandardAcknowledgmentPolicy();

    private StandardAcknowledgmentPolicy() {}

    @Override
    public AckDecision decide(Outcome outcome, int attempts, int maxAttempts) {
      if (outcome == null) {
        throw new IllegalArgumentException("Outcome cannot be null");
      }
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
      }
      if (outcome.isSuccess()) {
        return AckDecision.ACK;
      } else if (!outcome.kind().retryable()) {
        return AckDecision.REJECT;
      } else if (attempts < maxAttempts) {
        return AckDecision.REQUEUE;
      } else {
        return AckDecision.REJECT;
      }
    }

    @Override
    public String toString() {
      return "StandardAcknowledgmentPolicy{}";
    }
  }
}
