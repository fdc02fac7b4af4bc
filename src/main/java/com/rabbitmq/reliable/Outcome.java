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
 * Result of processing a {@link Delivery}: a success or a failure of a given {@link FailureKind}.
 */
public final class Outcome {

  private static final Outcome SUCCESS = new Outcome(null, null, null);

  private final FailureKind kind;
  private final String detail;
  private final Throwable cause;

  private Outcome(FailureKind kind, String detail, Throwable cause) {
    this.kind = kind;
    this.detail = detail;
    this.cause = cause;
  }

  public static Outcome success() {
    return SUCCESS;
  }

  public static Outcome failure(FailureKind kind, String detail) {
    return failure(kind, detail, null);
  }

  /**
   * Create a failure outcome.
   *
   * @param kind kind of failure
   * @param detail human-readable description, can be null
   * @param cause exception that caused the failure, can be null
   * @return the failure outcome
   */
  public static Outcome failure(FailureKind kind, String detail, Throwable cause) {
    if (kind == null) {
      throw new IllegalArgumentException("Failure kind cannot be null");
    }
    return new Outcome(kind, detail, cause);
  }

  public static Outcome transientFailure(String detail) {
    return failure(FailureKind.TRANSIENT, detail);
  }

  public static Outcome permanentFailure(String detail) {
    return failure(FailureKind.PERMANENT, detail);
  }

  public boolean isSuccess() {
    return this.kind == null;
  }

  /**
   * The kind of failure.
   *
   * @return the failure kind, null for a success
   */
  public FailureKind kind() {
    return this.kind;
  }

  public String detail() {
    return this.detail;
  }

  public Throwable cause() {
    return this.cause;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return "Outcome{success}";
    } else {
      return "Outcome{failure=" + kind + ", detail='" + detail + "'}";
    }
  }
}
