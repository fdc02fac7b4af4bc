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

import static com.rabbitmq.reliable.impl.Assert.notNull;

import com.rabbitmq.reliable.ConsumptionException;
import com.rabbitmq.reliable.ErrorClassifier;
import com.rabbitmq.reliable.FailureKind;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Rule-based {@link ErrorClassifier}.
 *
 * <p>Each rule is tested against the error and then against its causes, the first rule that
 * matches gives the kind. Errors no rule matches are {@link FailureKind#UNKNOWN}.
 *
 * @see ErrorClassifier#builder()
 */
public final class DefaultErrorClassifier implements ErrorClassifier {

  static final String TRANSIENT_MESSAGE_PATTERN =
      "time[ _-]?out|timed[ _-]?out|connection[ _-]?refused|connection[ _-]?reset"
          + "|service[ _-]?unavailable|temporarily[ _-]?unavailable";
  static final String PERMANENT_MESSAGE_PATTERN = "invalid|malformed|validation|unparseable";

  private final List<Rule> rules;

  private DefaultErrorClassifier(List<Rule> rules) {
    this.rules = List.copyOf(rules);
  }

  @Override
  public FailureKind classify(Throwable error) {
    if (error == null) {
      return FailureKind.UNKNOWN;
    }
    for (Rule rule : this.rules) {
      if (ExceptionUtils.anyInCauseChain(error, rule.predicate)) {
        return rule.kind;
      }
    }
    return FailureKind.UNKNOWN;
  }

  int ruleCount() {
    return this.rules.size();
  }

  @Override
  public String toString() {
    return "DefaultErrorClassifier{" + "rules=" + rules + '}';
  }

  private static final class Rule {

    private final Predicate<Throwable> predicate;
    private final FailureKind kind;
    private final String description;

    private Rule(Predicate<Throwable> predicate, FailureKind kind, String description) {
      this.predicate = predicate;
      this.kind = kind;
      this.description = description;
    }

    @Override
    public String toString() {
      return description + " => " + kind;
    }
  }

  /** Builder for {@link DefaultErrorClassifier}. */
  public static final class DefaultBuilder implements ErrorClassifier.Builder {

    private final List<Rule> rules = new ArrayList<>();

    public DefaultBuilder() {}

    @Override
    public ErrorClassifier.Builder rule(Predicate<Throwable> predicate, FailureKind kind) {
      notNull(predicate, "Predicate cannot be null");
      notNull(kind, "Failure kind cannot be null");
      this.rules.add(new Rule(predicate, kind, "predicate"));
      return this;
    }

    @Override
    public ErrorClassifier.Builder rule(Class<? extends Throwable> type, FailureKind kind) {
      notNull(type, "Type cannot be null");
      notNull(kind, "Failure kind cannot be null");
      this.rules.add(new Rule(type::isInstance, kind, type.getSimpleName()));
      return this;
    }

    @Override
    public ErrorClassifier.Builder messageRule(String regex, FailureKind kind) {
      notNull(regex, "Regular expression cannot be null");
      notNull(kind, "Failure kind cannot be null");
      Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
      this.rules.add(
          new Rule(
              e -> e.getMessage() != null && pattern.matcher(e.getMessage()).find(),
              kind,
              "message ~ /" + regex + "/"));
      return this;
    }

    @Override
    public ErrorClassifier.Builder defaultRules() {
      rule(ConsumptionException.PermanentProcessingException.class, FailureKind.PERMANENT);
      rule(ConsumptionException.TransientProcessingException.class, FailureKind.TRANSIENT);
      rule(ConsumptionException.PoisonProcessingException.class, FailureKind.POISON);
      rule(Error.class, FailureKind.POISON);
      rule(InterruptedException.class, FailureKind.TRANSIENT);
      rule(TimeoutException.class, FailureKind.TRANSIENT);
      rule(SocketTimeoutException.class, FailureKind.TRANSIENT);
      rule(ConnectException.class, FailureKind.TRANSIENT);
      messageRule(TRANSIENT_MESSAGE_PATTERN, FailureKind.TRANSIENT);
      rule(IllegalArgumentException.class, FailureKind.PERMANENT);
      messageRule(PERMANENT_MESSAGE_PATTERN, FailureKind.PERMANENT);
      return this;
    }

    @Override
    public ErrorClassifier build() {
      return new DefaultErrorClassifier(this.rules);
    }
  }
}
