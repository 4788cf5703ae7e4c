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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for the command-line tool, {@link Main}. */
public class MainTest {
  private static final String SIMPLIFIABLE = "module A exposing (..)\n"
      + "\n"
      + "f n =\n"
      + "    n * 1\n";

  private static final String CLEAN = "module B exposing (..)\n"
      + "\n"
      + "g n =\n"
      + "    n * 2\n";

  @TempDir Path dir;

  private Path write(String name, String text) throws IOException {
    final Path path = dir.resolve(name);
    Files.write(path, text.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  private static String read(Path path) throws IOException {
    return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
  }

  @Test void testReport() throws IOException {
    final Path a = write("A.elm", SIMPLIFIABLE);
    final StringWriter sw = new StringWriter();
    final int status = new Main(ImmutableList.of(a.toString()), sw).run();
    assertThat(status, is(1));
    assertThat(sw.toString(),
        startsWith(a + ":4.5-4.10: Unnecessary multiplication by 1\n"));
    // Without --fix, the file is unchanged.
    assertThat(read(a), is(SIMPLIFIABLE));
  }

  @Test void testClean() throws IOException {
    final Path b = write("B.elm", CLEAN);
    final StringWriter sw = new StringWriter();
    final int status = new Main(ImmutableList.of(b.toString()), sw).run();
    assertThat(status, is(0));
    assertThat(sw.toString(), is(""));
  }

  @Test void testFix() throws IOException {
    final Path a = write("A.elm", SIMPLIFIABLE);
    final Path b = write("B.elm", CLEAN);
    final StringWriter sw = new StringWriter();
    final int status =
        new Main(ImmutableList.of("--fix", a.toString(), b.toString()), sw)
            .run();
    assertThat(status, is(1));
    assertThat(read(a),
        is("module A exposing (..)\n"
            + "\n"
            + "f n =\n"
            + "    n\n"));
    assertThat(read(b), is(CLEAN));
  }

  @Test void testConfigurationError() throws IOException {
    final Path b = write("B.elm", CLEAN);
    final StringWriter sw = new StringWriter();
    final int status =
        new Main(
            ImmutableList.of("--ignore-case-of-for-types=Maybe.Perhaps, Foo",
                b.toString()), sw).run();
    assertThat(status, is(1));
    assertThat(sw.toString(),
        startsWith("Could not find type names: `Maybe.Perhaps`, `Foo`\n"));
  }

  @Test void testParseError() throws IOException {
    final Path c = write("C.elm", "module C exposing (..)\n\nh = (\n");
    final Path b = write("B.elm", CLEAN);
    final StringWriter sw = new StringWriter();
    final int status =
        new Main(ImmutableList.of(c.toString(), b.toString()), sw).run();
    assertThat(status, is(1));
    assertThat(sw.toString(), startsWith(c + ":"));
  }

  @Test void testUnknownOption() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            new Main(ImmutableList.of("--frobnicate"), new StringWriter()));
    assertThat(e.getMessage(), containsString("--frobnicate"));
  }
}

// End MainTest.java
