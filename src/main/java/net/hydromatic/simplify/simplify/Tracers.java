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

import java.util.function.Consumer;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.parse.SimplifyParseException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a module,
   * then calls the underlying tracer. */
  public static Tracer withOnModule(Tracer tracer,
      Consumer<Ast.Module> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onModule(Ast.Module module) {
        consumer.accept(module);
        super.onModule(module);
      }
    };
  }

  /** Returns a tracer that performs the given action on each finding,
   * then calls the underlying tracer. */
  public static Tracer withOnFinding(Tracer tracer,
      Consumer<Finding> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onFinding(Finding finding) {
        consumer.accept(finding);
        super.onFinding(finding);
      }
    };
  }

  public static Tracer withOnConfigurationError(Tracer tracer,
      Consumer<ConfigurationError> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onConfigurationError(ConfigurationError error) {
        consumer.accept(error);
        super.onConfigurationError(error);
      }
    };
  }

  public static Tracer withOnParseException(Tracer tracer,
      Consumer<SimplifyParseException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean onParseException(SimplifyParseException e) {
        consumer.accept(e);
        super.onParseException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onModule(Ast.Module module) {
    }

    @Override public void onFinding(Finding finding) {
    }

    @Override public void onConfigurationError(ConfigurationError error) {
    }

    @Override public boolean onParseException(SimplifyParseException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onModule(Ast.Module module) {
      tracer.onModule(module);
    }

    @Override public void onFinding(Finding finding) {
      tracer.onFinding(finding);
    }

    @Override public void onConfigurationError(ConfigurationError error) {
      tracer.onConfigurationError(error);
    }

    @Override public boolean onParseException(SimplifyParseException e) {
      return tracer.onParseException(e);
    }
  }
}

// End Tracers.java
