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

/** Kind of processing failure, as reported by a processor or an {@link ErrorClassifier}. */
public enum FailureKind {
  /** Retrying may succeed (e.g. a dependency timeout). */
  TRANSIENT,
  /** Retrying will not help (e.g. invalid payload). */
  PERMANENT,
  /** Uncaught fault during processing. */
  POISON,
  /** Error not recognized by the classifier. */
  UNKNOWN;

  /**
   * Whether a failure of this kind can be retried while attempts remain.
   *
   * @return true if the delivery can be requeued
   */
  public boolean retryable() {
    return this != PERMANENT;
  }
}
