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

import com.rabbitmq.reliable.impl.DefaultErrorClassifier;
import java.util.function.Predicate;

/**
 * Maps a processing error to a {@link FailureKind}.
 *
 * <p>Implementations must be deterministic and free of side effects. Errors they do not recognize
 * map to {@link FailureKind#UNKNOWN}.
 *
 * @see #builder()
 */
@FunctionalInterface
public interface ErrorClassifier {

  /**
   * Classify an error.
   *
   * @param error error thrown by a processor
   * @return the kind of failure
   */
  FailureKind classify(Throwable error);

  /**
   * Classify an error and wrap it in a failure outcome.
   *
   * @param error error thrown by a processor
   * @return the failure outcome
   */
  default Outcome outcome(Throwable error) {
    String detail =
        error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    return Outcome.failure(classify(error), detail, error);
  }

  /**
   * Classifier with the default rules.
   *
   * @return the default classifier
   * @see Builder#defaultRules()
   */
  static ErrorClassifier defaultClassifier() {
    return builder().defaultRules().build();
  }

  /**
   * Create a builder for a rule-based classifier.
   *
   * <p>Rules are evaluated in the order they are added, the first rule that matches the error or
   * one of its causes wins.
   *
   * @return the builder
   */
  static Builder builder() {
    return new DefaultErrorClassifier.DefaultBuilder();
  }

  /** Builder for a rule-based {@link ErrorClassifier}. */
  interface Builder {

    /**
     * Add a rule.
     *
     * @param predicate condition on the error (or one of its causes)
     * @param kind kind to return when the predicate matches
     * @return this builder instance
     */
    Builder rule(Predicate<Throwable> predicate, FailureKind kind);

    /**
     * Add a rule on the type of the error.
     *
     * @param type error type (subclasses match as well)
     * @param kind kind to return when the error is an instance of the type
     * @return this builder instance
     */
    Builder rule(Class<? extends Throwable> type, FailureKind kind);

    /**
     * Add a rule on the message of the error.
     *
     * <p>The regular expression is applied case-insensitively with {@link
     * java.util.regex.Matcher#find()}.
     *
     * @param regex regular expression to find in the message
     * @param kind kind to return when the message matches
     * @return this builder instance
     */
    Builder messageRule(String regex, FailureKind kind);

    /**
     * Add the default rules.
     *
     * <p>The default rules recognize the {@link ConsumptionException} processing subclasses,
     * timeouts and connection problems ({@link FailureKind#TRANSIENT}), validation problems
     * ({@link FailureKind#PERMANENT}), and {@link Error}s ({@link FailureKind#POISON}).
     *
     * @return this builder instance
     */
    Builder defaultRules();

    /**
     * Create the classifier.
     *
     * @return the classifier
     */
    ErrorClassifier build();
  }
}
