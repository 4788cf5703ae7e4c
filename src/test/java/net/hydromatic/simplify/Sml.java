/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.simplify;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.simplify.parse.Parser;
import net.hydromatic.simplify.parse.SimplifyParseException;
import net.hydromatic.simplify.resolve.Dependencies;
import net.hydromatic.simplify.simplify.Configuration;
import net.hydromatic.simplify.simplify.Finding;
import net.hydromatic.simplify.simplify.Fixes;
import net.hydromatic.simplify.simplify.Simplifier;
import net.hydromatic.simplify.simplify.SourceText;
import org.hamcrest.Matcher;

/** Fluent test helper.
 *
 * <p>Parses a module, runs the simplifier, and makes assertions about the
 * findings and the source after their fixes have been applied. */
class Sml {
  private final String source;
  private final Configuration configuration;
  private final Dependencies dependencies;

  Sml(String source, Configuration configuration,
      Dependencies dependencies) {
    this.source = requireNonNull(source);
    this.configuration = requireNonNull(configuration);
    this.dependencies = requireNonNull(dependencies);
  }

  /** Creates a helper for a module. */
  static Sml sml(String source) {
    return new Sml(source, Configuration.defaults(), Dependencies.core());
  }

  Sml withIgnoreCaseOfForTypes(String... typeNames) {
    return new Sml(source,
        configuration.ignoreCaseOfForTypes(ImmutableList.copyOf(typeNames)),
        dependencies);
  }

  Sml withDependencies(Dependencies dependencies) {
    return new Sml(source, configuration, dependencies);
  }

  List<Finding> findings() {
    return Simplifier.create(configuration)
        .withDependencies(dependencies)
        .simplify(source);
  }

  private static List<String> messages(List<Finding> findings) {
    final List<String> messages = new ArrayList<>();
    findings.forEach(f -> messages.add(f.message));
    return messages;
  }

  /** Checks that fixed source is still a valid module, and returns it. */
  private static String parses(String fixedSource) {
    try {
      Parser.parse(fixedSource);
    } catch (SimplifyParseException e) {
      throw new AssertionError("fixed source does not parse: "
          + e.describeTo(new StringBuilder()) + "\n" + fixedSource, e);
    }
    return fixedSource;
  }

  @CanIgnoreReturnValue
  Sml assertNoFindings() {
    assertThat(messages(findings()), is(ImmutableList.of()));
    return this;
  }

  /** Asserts that there is one finding, with the given message, and that
   * its fix gives the expected source. */
  @CanIgnoreReturnValue
  Sml assertFinding(String message, String expectedSource) {
    final List<Finding> findings = findings();
    assertThat(messages(findings), is(ImmutableList.of(message)));
    final Finding finding = findings.get(0);
    assertThat("fix", finding.fix, notNullValue());
    assertThat(parses(Fixes.apply(source, requireNonNull(finding.fix))),
        is(expectedSource));
    return this;
  }

  /** Asserts that there is one finding, with the given message, and that
   * it has no fix. */
  @CanIgnoreReturnValue
  Sml assertFindingWithoutFix(String message) {
    final List<Finding> findings = findings();
    assertThat(messages(findings), is(ImmutableList.of(message)));
    assertThat("fix", findings.get(0).fix == null, is(true));
    return this;
  }

  /** Asserts the messages of all findings, in order. */
  @CanIgnoreReturnValue
  Sml assertMessages(String... messages) {
    assertThat(messages(findings()), is(ImmutableList.copyOf(messages)));
    return this;
  }

  /** Asserts the source after the fixes of all findings are applied. */
  @CanIgnoreReturnValue
  Sml assertFixed(String expectedSource) {
    assertThat(parses(Fixes.applyAll(source, findings())),
        is(expectedSource));
    return this;
  }

  /** Asserts the text of the source that a finding's position covers. */
  @CanIgnoreReturnValue
  Sml assertFindingText(String expectedText) {
    final List<Finding> findings = findings();
    assertThat(findings.size(), is(1));
    final Finding finding = findings.get(0);
    assertThat(new SourceText(source).text(finding.pos), is(expectedText));
    return this;
  }

  @CanIgnoreReturnValue
  Sml assertFindings(Matcher<List<Finding>> matcher) {
    assertThat(findings(), matcher);
    return this;
  }

  @CanIgnoreReturnValue
  Sml withFindings(Consumer<List<Finding>> consumer) {
    consumer.accept(findings());
    return this;
  }
}

// End Sml.java
