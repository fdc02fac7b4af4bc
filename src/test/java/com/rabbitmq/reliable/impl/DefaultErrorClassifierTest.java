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
package com.rabbitmq.reliable.impl;

import static com.rabbitmq.reliable.FailureKind.PERMANENT;
import static com.rabbitmq.reliable.FailureKind.POISON;
import static com.rabbitmq.reliable.FailureKind.TRANSIENT;
import static com.rabbitmq.reliable.FailureKind.UNKNOWN;
import static org.assertj.core.api.Assertions.assertThat;

import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.ErrorClassifier;
import com.rabbitmq.reliable.FailureKind;
import com.rabbitmq.reliable.Outcome;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class DefaultErrorClassifierTest {

  ErrorClassifier classifier = ErrorClassifier.defaultClassifier();

  static Stream<Arguments> defaultRules() {
    return Stream.of(
        Arguments.of(new ConsumptionException.TransientProcessingException("later"), TRANSIENT),
        Arguments.of(new ConsumptionException.PermanentProcessingException("never"), PERMANENT),
        Arguments.of(new ConsumptionException.PoisonProcessingException("bad", null), POISON),
        Arguments.of(new StackOverflowError(), POISON),
        Arguments.of(new TimeoutException(), TRANSIENT),
        Arguments.of(new SocketTimeoutException("read"), TRANSIENT),
        Arguments.of(new ConnectException("no route"), TRANSIENT),
        Arguments.of(new InterruptedException(), TRANSIENT),
        Arguments.of(new IOException("Connection reset by peer"), TRANSIENT),
        Arguments.of(new RuntimeException("Request timed out"), TRANSIENT),
        Arguments.of(new IllegalStateException("Service Unavailable"), TRANSIENT),
        Arguments.of(new RuntimeException("service_unavailable"), TRANSIENT),
        Arguments.of(new IOException("CONNECTION_REFUSED by broker"), TRANSIENT),
        Arguments.of(new RuntimeException("temporarily-unavailable"), TRANSIENT),
        Arguments.of(new NumberFormatException("For input string: \"abc\""), PERMANENT),
        Arguments.of(new IllegalArgumentException("nope"), PERMANENT),
        Arguments.of(new RuntimeException("Malformed JSON"), PERMANENT),
        Arguments.of(new IllegalStateException("validation failed for field"), PERMANENT),
        Arguments.of(new RuntimeException("something else"), UNKNOWN),
        Arguments.of(new NullPointerException(), UNKNOWN));
  }

  @ParameterizedTest
  @MethodSource("defaultRules")
  void defaultClassifierShouldApplyDefaultRules(Throwable error, FailureKind expected) {
    assertThat(classifier.classify(error)).isEqualTo(expected);
  }

  @Test
  void causeChainShouldBeScanned() {
    Exception wrapped =
        new RuntimeException("wrapper", new UncheckedIOException(new SocketTimeoutException()));
    assertThat(classifier.classify(wrapped)).isEqualTo(TRANSIENT);
    wrapped = new RuntimeException(new NumberFormatException());
    assertThat(classifier.classify(wrapped)).isEqualTo(PERMANENT);
  }

  @Test
  void causeCycleShouldNotLoop() {
    RuntimeException first = new RuntimeException("first");
    RuntimeException second = new RuntimeException("second", first);
    first.initCause(second);
    assertThat(classifier.classify(first)).isEqualTo(UNKNOWN);
  }

  @Test
  void firstMatchingRuleShouldWin() {
    // the message matches the transient pattern before the argument type rule
    assertThat(classifier.classify(new IllegalArgumentException("timeout value is invalid")))
        .isEqualTo(TRANSIENT);

    ErrorClassifier custom =
        ErrorClassifier.builder()
            .rule(IllegalArgumentException.class, POISON)
            .defaultRules()
            .build();
    assertThat(custom.classify(new IllegalArgumentException("timeout value is invalid")))
        .isEqualTo(POISON);
  }

  @Test
  void customRulesShouldBeApplied() {
    ErrorClassifier custom =
        ErrorClassifier.builder()
            .messageRule("quota exceeded", TRANSIENT)
            .rule(e -> e instanceof UnsupportedOperationException, PERMANENT)
            .build();
    assertThat(custom.classify(new RuntimeException("Quota Exceeded for tenant")))
        .isEqualTo(TRANSIENT);
    assertThat(custom.classify(new UnsupportedOperationException())).isEqualTo(PERMANENT);
    assertThat(custom.classify(new TimeoutException())).isEqualTo(UNKNOWN);
    assertThat(((DefaultErrorClassifier) custom).ruleCount()).isEqualTo(2);
  }

  @Test
  void nullErrorIsUnknown() {
    assertThat(classifier.classify(null)).isEqualTo(UNKNOWN);
  }

  @Test
  void outcomeShouldCarryKindDetailAndCause() {
    IllegalArgumentException error = new IllegalArgumentException("bad amount");
    Outcome outcome = classifier.outcome(error);
    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.kind()).isEqualTo(PERMANENT);
    assertThat(outcome.detail()).isEqualTo("bad amount");
    assertThat(outcome.cause()).isSameAs(error);

    outcome = classifier.outcome(new NullPointerException());
    assertThat(outcome.kind()).isEqualTo(UNKNOWN);
    assertThat(outcome.detail()).isEqualTo("NullPointerException");
  }
}
