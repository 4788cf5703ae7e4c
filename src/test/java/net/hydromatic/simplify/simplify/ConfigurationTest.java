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
package net.hydromatic.simplify.simplify;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.simplify.resolve.Dependencies;
import org.junit.jupiter.api.Test;

/** Tests for {@link Configuration}. */
public class ConfigurationTest {
  private static final Dependencies CORE = Dependencies.core();

  @Test void testDefaults() {
    final Configuration configuration = Configuration.defaults();
    assertThat(configuration.ignoreCaseOfForTypes.isEmpty(), is(true));
    assertThat(configuration.validate(CORE), nullValue());
    assertThat(configuration.ignoresType("Maybe.Maybe"), is(false));
  }

  @Test void testValidTypes() {
    final Configuration configuration =
        Configuration.defaults()
            .ignoreCaseOfForTypes(
                ImmutableList.of("Maybe.Maybe", "Json.Decode.Error"));
    assertThat(configuration.validate(CORE), nullValue());
    assertThat(configuration.ignoresType("Json.Decode.Error"), is(true));
    assertThat(configuration.ignoresType("Result.Result"), is(false));
    configuration.validateOrThrow(CORE);
  }

  @Test void testInvalidTypes() {
    final Configuration configuration =
        Configuration.defaults()
            .ignoreCaseOfForTypes(ImmutableList.of("Maybe.Perhaps", "Foo"))
            .ignoreCaseOfForTypes(
                ImmutableList.of("Maybe.Maybe", "Maybe.Perhaps", "Maybe.",
                    ".Maybe", "Maybe.Just"));
    final ConfigurationError error = configuration.validate(CORE);
    assertThat(error, notNullValue());
    assertThat(error.typeNames,
        is(ImmutableList.of("Maybe.Perhaps", "Foo", "Maybe.", ".Maybe",
            "Maybe.Just")));
    assertThat(error.message(),
        is("Could not find type names: `Maybe.Perhaps`, `Foo`, `Maybe.`, "
            + "`.Maybe`, `Maybe.Just`"));

    final Finding finding = error.toFinding();
    assertThat(finding.global, is(true));
    assertThat(finding.fix, nullValue());
    assertThat(finding.details.size(), is(2));
    assertThat(finding.toString().startsWith(error.message() + "\n  "),
        is(true));
  }

  @Test void testValidateOrThrow() {
    final Configuration configuration =
        Configuration.defaults()
            .ignoreCaseOfForTypes(ImmutableList.of("Html.Html"));
    final ConfigurationException e =
        assertThrows(ConfigurationException.class, () ->
            configuration.validateOrThrow(CORE));
    assertThat(e.error().typeNames, is(ImmutableList.of("Html.Html")));
  }
}

// End ConfigurationTest.java
