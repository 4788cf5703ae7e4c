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
package net.hydromatic.simplify.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  private static <E> void forEachIndexed(List<E> list,
      ObjIntConsumer<? super E> action) {
    for (int i = 0; i < list.size(); i++) {
      action.accept(list.get(i), i);
    }
  }

  /** Base class for a pattern.
   *
   * <p>For example, "x" in "f x = 5" is an {@link IdPat};
   * the "(x, y)" in "\(x, y) -> x" is a {@link TuplePat}. */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Pat> action) {
      // no args
    }

    /** Calls a consumer for this pattern and each of its descendants. */
    public void visit(Consumer<Pat> consumer) {
      consumer.accept(this);
      forEachArg((arg, i) -> arg.visit(consumer));
    }
  }

  /** Named pattern, the pattern analog of the {@link Id} expression.
   *
   * <p>For example, "x" in "\x -> x + 1". */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Pos pos, String name) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Wildcard pattern.
   *
   * <p>For example, "{@code _}" in "{@code \_ -> 42}". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Literal pattern, the pattern analog of the {@link Literal} expression.
   *
   * <p>For example, "0" in "case n of 0 -> 1". The unit pattern "()" is also
   * a literal pattern. */
  @SuppressWarnings("rawtypes")
  public static class LiteralPat extends Pat {
    public final Comparable value;
    /** Text of the literal as written in the source. */
    public final String text;

    LiteralPat(Pos pos, Op op, Comparable value, String text) {
      super(pos, op);
      this.value = requireNonNull(value);
      this.text = requireNonNull(text);
      checkArgument(op == Op.INT_LITERAL_PAT
          || op == Op.FLOAT_LITERAL_PAT
          || op == Op.STRING_LITERAL_PAT
          || op == Op.CHAR_LITERAL_PAT
          || op == Op.UNIT_PAT);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(text);
    }
  }

  /** Type constructor pattern, with zero or more arguments.
   *
   * <p>For example, in "case m of Nothing -> 0; Just x -> x",
   * "Just x" is a constructor pattern that binds "x",
   * and "Nothing" is a constructor pattern with no arguments. */
  public static class ConPat extends Pat {
    public final Id con;
    public final List<Pat> args;

    ConPat(Pos pos, Id con, ImmutableList<Pat> args) {
      super(pos, Op.CON_PAT);
      this.con = requireNonNull(con);
      this.args = requireNonNull(args);
      checkArgument(con.isConstructor());
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      forEachIndexed(args, action);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (args.isEmpty()) {
        return con.unparse(w, left, right);
      }
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      con.unparse(w, 0, 0);
      args.forEach(arg -> w.append(" ").append(arg, op.right, op.right));
      return w;
    }
  }

  /** Tuple pattern, the pattern analog of the {@link Tuple} expression.
   *
   * <p>For example, "(x, y)" in "\(x, y) -> x + y". */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      forEachIndexed(args, action);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "(", ", ", ")");
    }
  }

  /** List pattern, the pattern analog of the {@link ListExp} expression.
   *
   * <p>For example, "[x, y]" in "case list of [x, y] -> x + y". */
  public static class ListPat extends Pat {
    public final List<Pat> args;

    ListPat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.LIST_PAT);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      forEachIndexed(args, action);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "[", ", ", "]");
    }
  }

  /** Pattern built from the "::" operator applied to two patterns. */
  public static class ConsPat extends Pat {
    public final Pat p0;
    public final Pat p1;

    ConsPat(Pos pos, Pat p0, Pat p1) {
      super(pos, Op.CONS_PAT);
      this.p0 = requireNonNull(p0);
      this.p1 = requireNonNull(p1);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      action.accept(p0, 0);
      action.accept(p1, 1);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, p0, op, p1, right);
    }
  }

  /** Record pattern.
   *
   * <p>For example, "{ x, y }" in "\{ x, y } -> x + y". */
  public static class RecordPat extends Pat {
    public final List<IdPat> fields;

    RecordPat(Pos pos, ImmutableList<IdPat> fields) {
      super(pos, Op.RECORD_PAT);
      this.fields = requireNonNull(fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      forEachIndexed(fields, action);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return fields.isEmpty()
          ? w.append("{}")
          : w.appendAll(fields, "{ ", ", ", " }");
    }
  }

  /** Layered pattern.
   *
   * <p>For example, in "\((i, j) as h) -> h",
   * if the pattern matches, "h" is assigned the whole tuple,
   * and "i" and "j" are assigned the left and right members of the tuple. */
  public static class AsPat extends Pat {
    public final Pat pat;
    public final IdPat id;

    AsPat(Pos pos, Pat pat, IdPat id) {
      super(pos, Op.AS_PAT);
      this.pat = requireNonNull(pat);
      this.id = requireNonNull(id);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      action.accept(pat, 0);
      action.accept(id, 1);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, pat, op, id, right);
    }
  }

  /** Parenthesized pattern. */
  public static class ParensPat extends Pat {
    public final Pat pat;

    ParensPat(Pos pos, Pat pat) {
      super(pos, Op.PARENS_PAT);
      this.pat = requireNonNull(pat);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public void forEachArg(ObjIntConsumer<Pat> action) {
      action.accept(pat, 0);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(pat, 0, 0).append(")");
    }
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }
  }

  /** Parse tree node of an identifier, optionally qualified by a module
   * name.
   *
   * <p>For example, "x", "List.map", "Just" and "Basics.True". */
  public static class Id extends Exp {
    /** Module name as written, e.g. ["Json", "Decode"]; empty if the
     * identifier is not qualified. */
    public final List<String> moduleName;
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, ImmutableList<String> moduleName, String name) {
      super(pos, Op.ID);
      this.moduleName = requireNonNull(moduleName);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty());
    }

    /** Returns whether this identifier refers to a type constructor, such as
     * "Just" or "True". */
    public boolean isConstructor() {
      return Character.isUpperCase(name.charAt(0));
    }

    /** Returns the identifier as written, e.g. "List.map". */
    public String qualifiedName() {
      return new AstWriter().id(moduleName, name).toString();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(moduleName, name);
    }
  }

  /** Reference to an infix operator as a function.
   *
   * <p>For example, "(+)" in "List.foldl (+) 0 list". */
  public static class OpRef extends Exp {
    public final Op operator;

    OpRef(Pos pos, Op operator) {
      super(pos, Op.OP_REF);
      this.operator = requireNonNull(operator);
      checkArgument(operator.isInfix());
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(requireNonNull(operator.symbol))
          .append(")");
    }
  }

  /** Record access function.
   *
   * <p>For example, ".name" in "List.map .name people". */
  public static class RecordAccessFn extends Exp {
    public final String field;

    RecordAccessFn(Pos pos, String field) {
      super(pos, Op.RECORD_ACCESS_FN);
      this.field = requireNonNull(field);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(".").append(field);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value of a numeric literal is a {@link java.math.BigDecimal};
   * the value of a string or char literal is a {@link String}; the value
   * of the unit literal "()" is the string "()". */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;
    /** Text of the literal as written in the source, e.g. "0x1F". */
    public final String text;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Comparable value, String text) {
      super(pos, op);
      this.value = requireNonNull(value);
      this.text = requireNonNull(text);
      checkArgument(op == Op.INT_LITERAL
          || op == Op.FLOAT_LITERAL
          || op == Op.STRING_LITERAL
          || op == Op.CHAR_LITERAL
          || op == Op.UNIT_LITERAL);
    }

    /** Returns whether this is an integer or float literal. */
    public boolean isNumber() {
      return op == Op.INT_LITERAL || op == Op.FLOAT_LITERAL;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(text);
    }
  }

  /** Parenthesized expression. */
  public static class Parens extends Exp {
    public final Exp exp;

    Parens(Pos pos, Exp exp) {
      super(pos, Op.PARENS);
      this.exp = requireNonNull(exp);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp, 0, 0).append(")");
    }
  }

  /** Tuple. */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
      checkArgument(args.size() >= 2);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "(", ", ", ")");
    }
  }

  /** List expression. */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.LIST);
      this.args = requireNonNull(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "[", ", ", "]");
    }
  }

  /** Assignment of a value to a field, in a {@link Record} or a
   * {@link RecordUpdate}.
   *
   * <p>For example, "a = 1" in "{ a = 1 }". */
  public static class Setter extends AstNode {
    public final Id field;
    public final Exp exp;

    Setter(Pos pos, Id field, Exp exp) {
      super(pos, Op.SETTER);
      this.field = requireNonNull(field);
      this.exp = requireNonNull(exp);
    }

    /** Returns the name of the field. */
    public String name() {
      return field.name;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(field.name).append(" = ").append(exp, 0, 0);
    }
  }

  /** Record.
   *
   * <p>For example, "{ a = 1, b = 2 }". */
  public static class Record extends Exp {
    public final List<Setter> setters;

    Record(Pos pos, ImmutableList<Setter> setters) {
      super(pos, Op.RECORD);
      this.setters = requireNonNull(setters);
    }

    /** Returns the setter of a field, or null. */
    public @Nullable Setter setter(String field) {
      for (Setter setter : setters) {
        if (setter.name().equals(field)) {
          return setter;
        }
      }
      return null;
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < setters.size(); i++) {
        action.accept(setters.get(i).exp, i);
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return setters.isEmpty()
          ? w.append("{}")
          : w.appendAll(setters, "{ ", ", ", " }");
    }
  }

  /** Record update.
   *
   * <p>For example, "{ r | a = 1 }". */
  public static class RecordUpdate extends Exp {
    public final Id record;
    public final List<Setter> setters;

    RecordUpdate(Pos pos, Id record, ImmutableList<Setter> setters) {
      super(pos, Op.RECORD_UPDATE);
      this.record = requireNonNull(record);
      this.setters = requireNonNull(setters);
      checkArgument(!setters.isEmpty());
    }

    /** Returns the setter of a field, or null. */
    public @Nullable Setter setter(String field) {
      for (Setter setter : setters) {
        if (setter.name().equals(field)) {
          return setter;
        }
      }
      return null;
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < setters.size(); i++) {
        action.accept(setters.get(i).exp, i);
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{ ").append(record.name);
      return w.appendAll(setters, " | ", ", ", " }");
    }
  }

  /** Access to a field of a record.
   *
   * <p>For example, "r.a" and "(f x).a". */
  public static class RecordAccess extends Exp {
    public final Exp exp;
    public final Id field;

    RecordAccess(Pos pos, Exp exp, Id field) {
      super(pos, Op.RECORD_ACCESS);
      this.exp = requireNonNull(exp);
      this.field = requireNonNull(field);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, op.left, op.left).append(".").append(field.name);
    }
  }

  /** Application of a function to one or more arguments.
   *
   * <p>Curried application is flattened: "f a b" is one {@code Apply} with
   * two arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(fn, 0);
      for (int i = 0; i < args.size(); i++) {
        action.accept(args.get(i), i + 1);
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(fn, left, op.left);
      args.forEach(arg -> w.append(" ").append(arg, op.right, op.right));
      return w;
    }
  }

  /** Call to an infix operator.
   *
   * <p>For example, "a + b", "x |> f" and "f >> g". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;
    /** Position of the operator symbol. */
    public final Pos opPos;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1, Pos opPos) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      this.opPos = requireNonNull(opPos);
      checkArgument(op.isInfix());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Unary minus.
   *
   * <p>For example, "-x". */
  public static class Negate extends Exp {
    public final Exp exp;

    Negate(Pos pos, Exp exp) {
      super(pos, Op.NEGATE);
      this.exp = requireNonNull(exp);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, exp, right);
    }
  }

  /** Lambda expression.
   *
   * <p>For example, "\x y -> x + y". */
  public static class Fn extends Exp {
    public final List<Pat> pats;
    public final Exp exp;

    Fn(Pos pos, ImmutableList<Pat> pats, Exp exp) {
      super(pos, Op.FN);
      this.pats = requireNonNull(pats);
      this.exp = requireNonNull(exp);
      checkArgument(!pats.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("\\");
      for (int i = 0; i < pats.size(); i++) {
        w.append(i == 0 ? "" : " ").append(pats.get(i), Op.APPLY.right,
            Op.APPLY.right);
      }
      return w.append(" -> ").append(exp, 0, 0);
    }
  }

  /** "If ... then ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(condition, 0);
      action.accept(ifTrue, 1);
      action.accept(ifFalse, 2);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, 0);
    }
  }

  /** One of the arms of a {@link Case} expression.
   *
   * <p>For example, "Just x -> x". */
  public static class Match extends AstNode {
    public final Pat pat;
    public final Exp exp;

    Match(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(" -> ").append(exp, 0, 0);
    }
  }

  /** Case expression.
   *
   * <p>For example, "case m of Just x -> x; Nothing -> 0". Arms are tried
   * in order; the first that matches is taken. */
  public static class Case extends Exp {
    public final Exp exp;
    public final List<Match> matchList;

    Case(Pos pos, Exp exp, ImmutableList<Match> matchList) {
      super(pos, Op.CASE);
      this.exp = requireNonNull(exp);
      this.matchList = requireNonNull(matchList);
      checkArgument(!matchList.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
      for (int i = 0; i < matchList.size(); i++) {
        action.accept(matchList.get(i).exp, i + 1);
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("case ").append(exp, 0, 0).append(" of");
      return w.appendAll(matchList, " ", "; ", "");
    }
  }

  /** "Let" expression. */
  public static class Let extends Exp {
    public final List<Decl> decls;
    public final Exp exp;

    Let(Pos pos, ImmutableList<Decl> decls, Exp exp) {
      super(pos, Op.LET);
      this.decls = requireNonNull(decls);
      this.exp = requireNonNull(exp);
      checkArgument(!decls.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < decls.size(); i++) {
        final Decl decl = decls.get(i);
        if (decl instanceof ValueDecl) {
          action.accept(((ValueDecl) decl).exp(), i);
        }
      }
      action.accept(exp, decls.size());
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.appendAll(decls, "let ", "; ", " in ").append(exp, 0, 0);
    }
  }

  /** Base class for declarations. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Declaration that defines one or more values by evaluating an
   * expression: a {@link FunDecl} or a {@link DestructDecl}. */
  public abstract static class ValueDecl extends Decl {
    ValueDecl(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns the expression that computes the value. */
    public abstract Exp exp();
  }

  /** Declaration of a function or a value.
   *
   * <p>For example, "add a b = a + b" and "x = 5". */
  public static class FunDecl extends ValueDecl {
    public final Id name;
    public final List<Pat> pats;
    public final Exp exp;

    FunDecl(Pos pos, Id name, ImmutableList<Pat> pats, Exp exp) {
      super(pos, Op.FUN_DECL);
      this.name = requireNonNull(name);
      this.pats = requireNonNull(pats);
      this.exp = requireNonNull(exp);
    }

    @Override public Exp exp() {
      return exp;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name.name);
      pats.forEach(pat ->
          w.append(" ").append(pat, Op.APPLY.right, Op.APPLY.right));
      return w.append(" = ").append(exp, 0, 0);
    }
  }

  /** Declaration that destructures a value, in a "let".
   *
   * <p>For example, "(a, b) = pair". */
  public static class DestructDecl extends ValueDecl {
    public final Pat pat;
    public final Exp exp;

    DestructDecl(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.DESTRUCT_DECL);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override public Exp exp() {
      return exp;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(" = ").append(exp, 0, 0);
    }
  }

  /** Declaration of a custom type.
   *
   * <p>For example, "type Color = Red | Green | Blue". */
  public static class TypeDecl extends Decl {
    public final String name;
    public final List<Id> constructors;

    TypeDecl(Pos pos, String name, ImmutableList<Id> constructors) {
      super(pos, Op.TYPE_DECL);
      this.name = requireNonNull(name);
      this.constructors = requireNonNull(constructors);
      checkArgument(!constructors.isEmpty());
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("type ").append(name)
          .appendAll(constructors, " = ", " | ", "");
    }
  }

  /** Declaration of a type alias. Only the name is retained. */
  public static class AliasDecl extends Decl {
    public final String name;

    AliasDecl(Pos pos, String name) {
      super(pos, Op.ALIAS_DECL);
      this.name = requireNonNull(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("type alias ").append(name).append(" = ...");
    }
  }

  /** List of names exposed by a module, or imported from a module.
   *
   * <p>For example, "(..)" and "(map, Maybe(..), Html)". */
  public static class Exposing {
    public static final Exposing NONE =
        new Exposing(false, ImmutableList.of(), ImmutableList.of(),
            ImmutableList.of());
    public static final Exposing ALL =
        new Exposing(true, ImmutableList.of(), ImmutableList.of(),
            ImmutableList.of());

    /** Whether everything is exposed, "(..)". */
    public final boolean all;
    /** Exposed values and operators, e.g. "map", "(::)". */
    public final List<String> values;
    /** Exposed types without their constructors, e.g. "Html". */
    public final List<String> types;
    /** Exposed types with their constructors, e.g. "Maybe(..)". */
    public final List<String> openTypes;

    Exposing(boolean all, ImmutableList<String> values,
        ImmutableList<String> types, ImmutableList<String> openTypes) {
      this.all = all;
      this.values = requireNonNull(values);
      this.types = requireNonNull(types);
      this.openTypes = requireNonNull(openTypes);
    }

    @Override public String toString() {
      if (all) {
        return "(..)";
      }
      final StringBuilder b = new StringBuilder("(");
      values.forEach(v -> b.append(b.length() == 1 ? "" : ", ").append(v));
      types.forEach(t -> b.append(b.length() == 1 ? "" : ", ").append(t));
      openTypes.forEach(t ->
          b.append(b.length() == 1 ? "" : ", ").append(t).append("(..)"));
      return b.append(")").toString();
    }
  }

  /** Import of a module.
   *
   * <p>For example, "import Json.Decode as D exposing (Decoder)". */
  public static class Import extends AstNode {
    public final List<String> moduleName;
    public final @Nullable String alias;
    public final Exposing exposing;

    Import(Pos pos, ImmutableList<String> moduleName, @Nullable String alias,
        Exposing exposing) {
      super(pos, Op.IMPORT);
      this.moduleName = requireNonNull(moduleName);
      this.alias = alias;
      this.exposing = requireNonNull(exposing);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("import ").append(String.join(".", moduleName));
      if (alias != null) {
        w.append(" as ").append(alias);
      }
      if (exposing != Exposing.NONE) {
        w.append(" exposing ").append(exposing.toString());
      }
      return w;
    }
  }

  /** A module: header, imports and declarations. */
  public static class Module extends AstNode {
    public final List<String> moduleName;
    public final Exposing exposing;
    public final List<Import> imports;
    public final List<Decl> decls;

    Module(Pos pos, ImmutableList<String> moduleName, Exposing exposing,
        ImmutableList<Import> imports, ImmutableList<Decl> decls) {
      super(pos, Op.MODULE);
      this.moduleName = requireNonNull(moduleName);
      this.exposing = requireNonNull(exposing);
      this.imports = requireNonNull(imports);
      this.decls = requireNonNull(decls);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("module ").append(String.join(".", moduleName))
          .append(" exposing ").append(exposing.toString());
      imports.forEach(i -> w.append("\n").append(i, 0, 0));
      decls.forEach(d -> w.append("\n").append(d, 0, 0));
      return w;
    }
  }
}

// End Ast.java
