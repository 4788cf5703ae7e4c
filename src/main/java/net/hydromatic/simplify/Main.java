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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.simplify.simplify.Configuration;
import net.hydromatic.simplify.simplify.Finding;
import net.hydromatic.simplify.simplify.Fixes;
import net.hydromatic.simplify.simplify.Simplifier;
import net.hydromatic.simplify.simplify.Tracer;
import net.hydromatic.simplify.simplify.Tracers;

/** Command-line tool that reports expressions that can be simplified.
 *
 * <p>Usage: {@code Main [--fix] [--ignore-case-of-for-types=A.B,C.D]
 * file...}. */
public class Main {
  private static final String IGNORE_OPTION = "--ignore-case-of-for-types=";

  private final List<String> files;
  private final boolean fix;
  private final Configuration configuration;
  private final PrintWriter out;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    final int status;
    try {
      status = main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(2);
      return;
    }
    System.exit(status);
  }

  /** Creates a Main. */
  public Main(List<String> args, Writer out) {
    final List<String> files = new ArrayList<>();
    boolean fix = false;
    Configuration configuration = Configuration.defaults();
    for (String arg : args) {
      if (arg.equals("--fix")) {
        fix = true;
      } else if (arg.startsWith(IGNORE_OPTION)) {
        configuration =
            configuration.ignoreCaseOfForTypes(
                Splitter.on(',').trimResults().omitEmptyStrings()
                    .splitToList(arg.substring(IGNORE_OPTION.length())));
      } else if (arg.startsWith("--")) {
        throw new IllegalArgumentException("unknown option: " + arg);
      } else {
        files.add(arg);
      }
    }
    this.files = ImmutableList.copyOf(files);
    this.fix = fix;
    this.configuration = configuration;
    this.out =
        out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
  }

  /** Checks the files; returns 1 if anything was reported, 0 otherwise. */
  public int run() {
    final Map<String, String> sources = new LinkedHashMap<>();
    for (String file : files) {
      sources.put(file, read(Paths.get(file)));
    }
    final int[] problems = {0};
    Tracer tracer =
        Tracers.withOnFinding(Tracers.empty(), finding -> {
          ++problems[0];
          print(finding);
        });
    tracer =
        Tracers.withOnParseException(tracer, e -> {
          ++problems[0];
          out.println(e.describeTo(new StringBuilder()));
        });
    final List<Finding> findings =
        Simplifier.create(configuration).withTracer(tracer).run(sources);
    if (fix) {
      sources.forEach((file, source) -> {
        final List<Finding> fileFindings = new ArrayList<>();
        for (Finding finding : findings) {
          if (!finding.global && finding.pos.file.equals(file)) {
            fileFindings.add(finding);
          }
        }
        final String fixed = Fixes.applyAll(source, fileFindings);
        if (!fixed.equals(source)) {
          write(Paths.get(file), fixed);
        }
      });
    }
    out.flush();
    return problems[0] > 0 ? 1 : 0;
  }

  private void print(Finding finding) {
    out.println(finding.describeTo(new StringBuilder()));
  }

  private static String read(Path path) {
    try {
      return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void write(Path path, String text) {
    try {
      Files.write(path, text.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

// End Main.java
