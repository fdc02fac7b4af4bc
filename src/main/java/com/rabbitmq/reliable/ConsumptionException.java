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

public class ConsumptionException extends RuntimeException {

  public ConsumptionException(Throwable cause) {
    super(cause);
  }

  public ConsumptionException(String format, Object... args) {
    super(String.format(format, args));
  }

  public ConsumptionException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Processing failure that may succeed if retried.
   *
   * <p>Processors can throw it to get a {@link FailureKind#TRANSIENT} classification.
   */
  public static class TransientProcessingException extends ConsumptionException {

    public TransientProcessingException(String message) {
      super(message, (Throwable) null);
    }

    public TransientProcessingException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Processing failure that will not succeed if retried.
   *
   * <p>Processors can throw it to get a {@link FailureKind#PERMANENT} classification.
   */
  public static class PermanentProcessingException extends ConsumptionException {

    public PermanentProcessingException(String message) {
      super(message, (Throwable) null);
    }

    public PermanentProcessingException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Fault that crashed the processing of a delivery. */
  public static class PoisonProcessingException extends ConsumptionException {

    public PoisonProcessingException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The dead-letter sink could not record a rejected delivery. */
  public static class DeadLetterSinkUnavailableException extends ConsumptionException {

    public DeadLetterSinkUnavailableException(String format, Object... args) {
      super(format, args);
    }

    public DeadLetterSinkUnavailableException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The decision for a delivery could not be sent to the transport. */
  public static class ResolutionException extends ConsumptionException {

    private final transient Delivery delivery;
    private final AckDecision decision;

    public ResolutionException(Delivery delivery, AckDecision decision, Throwable cause) {
      super(
          String.format("Could not resolve delivery %s with %s", delivery.id(), decision), cause);
      this.delivery = delivery;
      this.decision = decision;
    }

    public Delivery delivery() {
      return this.delivery;
    }

    public AckDecision decision() {
      return this.decision;
    }
  }

  public static class ConsumptionInvalidStateException extends ConsumptionException {

    public ConsumptionInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public ConsumptionInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class ConsumptionClosedException extends ConsumptionInvalidStateException {

    public ConsumptionClosedException(String message) {
      super(message);
    }

    public ConsumptionClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
