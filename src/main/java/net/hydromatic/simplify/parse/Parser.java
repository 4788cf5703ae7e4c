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
package net.hydromatic.simplify.parse;

import static net.hydromatic.simplify.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.simplify.ast.Ast;
import net.hydromatic.simplify.ast.Op;
import net.hydromatic.simplify.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser that converts tokens into an {@link Ast.Module}.
 *
 * <p>Layout: a token that is first on its line and whose column is at or to
 * the left of the current layout column ends the current expression. The
 * layout column is 1 for top-level declarations, the column of the first
 * declaration inside a "let", and the column of the first pattern inside a
 * "case". Inside brackets the layout column is 0.
 */
public class Parser {
  private final ImmutableList<Token> tokens;
  private final String file;
  private int i = 0;
  private int limit = 0;
  /** Index of a token that starts a layout block, and is therefore not
   * subject to the layout rule. */
  private int exempt = -1;
  private @Nullable Token previous;

  public Parser(String source, String file) {
    this.tokens = Lexer.tokenize(source, file);
    this.file = file;
  }

  /** Parses a module. */
  public static Ast.Module parse(String source) {
    return parse(source, "");
  }

  /** Parses a module, recording the file name in each position. */
  public static Ast.Module parse(String source, String file) {
    return new Parser(source, file).module();
  }

  /** Parses a single expression. */
  public static Ast.Exp parseExpression(String source) {
    final Parser parser = new Parser(source, "");
    final Ast.Exp exp = parser.expression();
    parser.expect(Token.Kind.EOF);
    return exp;
  }

  // token handling

  private Token raw() {
    return tokens.get(i);
  }

  private Token lookAhead(int n) {
    return tokens.get(Math.min(i + n, tokens.size() - 1));
  }

  /** Returns the next token, or an EOF token if the layout rule ends the
   * current block. */
  private Token peek() {
    final Token t = tokens.get(i);
    if (t.kind != Token.Kind.EOF
        && t.firstOnLine
        && t.column() <= limit
        && i != exempt) {
      return new Token(Token.Kind.EOF, "", ImmutableList.of(), "", null,
          t.pos.start(), true, true);
    }
    return t;
  }

  private Token next() {
    final Token t = tokens.get(i);
    if (t.kind != Token.Kind.EOF) {
      ++i;
    }
    previous = t;
    return t;
  }

  private Token expect(Token.Kind kind) {
    final Token t = peek();
    if (t.kind != kind) {
      throw unexpected(t, kind.name());
    }
    return next();
  }

  /** Consumes a keyword. Keywords that end a construct, such as "then" and
   * "in", are not subject to layout. */
  private Token expectKeyword(String keyword) {
    final Token t = raw();
    if (!t.isKeyword(keyword)) {
      throw unexpected(t, "'" + keyword + "'");
    }
    return next();
  }

  private SimplifyParseException unexpected(Token t, String expected) {
    final String found =
        t.kind == Token.Kind.EOF ? "end of block" : "'" + t.text + "'";
    return new SimplifyParseException(
        "expected " + expected + " but found " + found, t.pos);
  }

  /** Returns the position from a given start to the end of the most
   * recently consumed token. */
  private Pos span(Pos start) {
    final Pos end = previous == null ? start : previous.pos;
    return new Pos(file, start.startLine, start.startColumn, end.endLine,
        end.endColumn);
  }

  private void skipToLayoutEnd() {
    while (peek().kind != Token.Kind.EOF) {
      next();
    }
  }

  private static ImmutableList<String> qualifiedName(Token t) {
    return ImmutableList.<String>builder().addAll(t.moduleName).add(t.name)
        .build();
  }

  // module structure

  Ast.Module module() {
    final Pos start = raw().pos;
    List<String> moduleName = ImmutableList.of("Main");
    Ast.Exposing exposing = Ast.Exposing.ALL;
    if (raw().isKeyword("port")
        || raw().kind == Token.Kind.LOWER_ID && raw().name.equals("effect")) {
      next();
    }
    if (raw().isKeyword("module")) {
      next();
      limit = 1;
      moduleName = qualifiedName(expect(Token.Kind.UPPER_ID));
      while (!raw().isKeyword("exposing")
          && peek().kind != Token.Kind.EOF) {
        next(); // "where { command = MyCmd }" in an effect module
      }
      expectKeyword("exposing");
      exposing = exposing();
      limit = 0;
    }
    final List<Ast.Import> imports = new ArrayList<>();
    while (raw().isKeyword("import")) {
      imports.add(importDecl());
    }
    final List<Ast.Decl> decls = new ArrayList<>();
    while (raw().kind != Token.Kind.EOF) {
      final Ast.Decl decl = topDecl();
      if (decl != null) {
        decls.add(decl);
      }
    }
    return ast.module(span(start), moduleName, exposing, imports, decls);
  }

  private Ast.Exposing exposing() {
    expect(Token.Kind.LPAREN);
    final int saveLimit = limit;
    limit = 0;
    try {
      if (peek().kind == Token.Kind.DOTDOT) {
        next();
        expect(Token.Kind.RPAREN);
        return Ast.Exposing.ALL;
      }
      final List<String> values = new ArrayList<>();
      final List<String> types = new ArrayList<>();
      final List<String> openTypes = new ArrayList<>();
      for (;;) {
        final Token t = peek();
        switch (t.kind) {
          case LOWER_ID:
            values.add(next().name);
            break;
          case LPAREN:
            next();
            values.add("(" + expect(Token.Kind.OPERATOR).text + ")");
            expect(Token.Kind.RPAREN);
            break;
          case UPPER_ID:
            next();
            if (peek().kind == Token.Kind.LPAREN) {
              next();
              expect(Token.Kind.DOTDOT);
              expect(Token.Kind.RPAREN);
              openTypes.add(t.name);
            } else {
              types.add(t.name);
            }
            break;
          default:
            throw unexpected(t, "exposed name");
        }
        if (peek().kind == Token.Kind.COMMA) {
          next();
          continue;
        }
        expect(Token.Kind.RPAREN);
        return ast.exposing(false, values, types, openTypes);
      }
    } finally {
      limit = saveLimit;
    }
  }

  private Ast.Import importDecl() {
    final Token start = next();
    limit = 1;
    final Token name = expect(Token.Kind.UPPER_ID);
    @Nullable String alias = null;
    Ast.Exposing exposing = Ast.Exposing.NONE;
    if (peek().isKeyword("as")) {
      next();
      alias = expect(Token.Kind.UPPER_ID).name;
    }
    if (peek().isKeyword("exposing")) {
      next();
      exposing = exposing();
    }
    if (peek().kind != Token.Kind.EOF) {
      throw unexpected(peek(), "end of import");
    }
    limit = 0;
    return ast.import_(span(start.pos), qualifiedName(name), alias, exposing);
  }

  /** Parses a top-level declaration, or returns null if the declaration is
   * ignored (a type signature, a port, an infix declaration). */
  private Ast.@Nullable Decl topDecl() {
    final Token t = raw();
    if (t.column() != 1) {
      throw new SimplifyParseException(
          "top-level declaration must start in column 1", t.pos);
    }
    limit = 1;
    exempt = i;
    try {
      if (t.isKeyword("type")) {
        return typeDecl();
      }
      if (t.isKeyword("port")
          || t.kind == Token.Kind.LOWER_ID && t.name.equals("infix")) {
        next();
        skipToLayoutEnd();
        return null;
      }
      return valueDecl();
    } finally {
      limit = 0;
    }
  }

  private Ast.Decl typeDecl() {
    final Token start = next();
    if (peek().isKeyword("alias")) {
      next();
      final Token name = expect(Token.Kind.UPPER_ID);
      skipToLayoutEnd();
      return ast.aliasDecl(span(start.pos), name.name);
    }
    final Token name = expect(Token.Kind.UPPER_ID);
    while (peek().kind == Token.Kind.LOWER_ID) {
      next(); // type variable
    }
    expect(Token.Kind.EQUALS);
    final List<Ast.Id> constructors = new ArrayList<>();
    for (;;) {
      final Token c = expect(Token.Kind.UPPER_ID);
      constructors.add(ast.id(c.pos, c.name));
      int depth = 0;
      for (;;) {
        final Token t = peek();
        if (t.kind == Token.Kind.EOF
            || depth == 0 && t.kind == Token.Kind.BAR) {
          break;
        }
        switch (t.kind) {
          case LPAREN:
          case LBRACE:
          case LBRACKET:
            ++depth;
            break;
          case RPAREN:
          case RBRACE:
          case RBRACKET:
            --depth;
            break;
          default:
            break;
        }
        next();
      }
      if (peek().kind != Token.Kind.BAR) {
        return ast.typeDecl(span(start.pos), name.name, constructors);
      }
      next();
    }
  }

  /** Parses a function declaration, a destructuring declaration, or a
   * type signature (which returns null). */
  private Ast.@Nullable Decl valueDecl() {
    final Token t = raw();
    if (t.kind == Token.Kind.LOWER_ID
        && t.moduleName.isEmpty()
        && lookAhead(1).kind == Token.Kind.COLON) {
      next();
      skipToLayoutEnd();
      return null;
    }
    if (t.kind == Token.Kind.LOWER_ID && t.moduleName.isEmpty()) {
      next();
      final Ast.Id name = ast.id(t.pos, t.name);
      final List<Ast.Pat> pats = new ArrayList<>();
      while (peek().kind != Token.Kind.EQUALS) {
        pats.add(patternAtom());
      }
      next();
      final Ast.Exp exp = expression();
      return ast.funDecl(span(t.pos), name, pats, exp);
    }
    final Ast.Pat pat = pattern();
    expect(Token.Kind.EQUALS);
    final Ast.Exp exp = expression();
    return ast.destructDecl(span(t.pos), pat, exp);
  }

  // expressions

  /** Parses an expression, as far to the right as possible. */
  public Ast.Exp expression() {
    return binary(0);
  }

  private Ast.Exp binary(int minPrecedence) {
    Ast.Exp left = operand();
    for (;;) {
      final Token t = peek();
      if (t.kind != Token.Kind.OPERATOR) {
        return left;
      }
      final Op op = Op.BY_SYMBOL.get(t.text);
      if (op == null) {
        throw new SimplifyParseException("unknown operator '" + t.text + "'",
            t.pos);
      }
      if (op.left < minPrecedence) {
        return left;
      }
      next();
      final Ast.Exp right = binary(op.right);
      left = ast.infixCall(left.pos.plus(right.pos), op, left, right, t.pos);
    }
  }

  private Ast.Exp operand() {
    final Token t = peek();
    switch (t.kind) {
      case BACKSLASH:
        return lambda();
      case KEYWORD:
        switch (t.text) {
          case "if":
            return ifThenElse();
          case "case":
            return caseOf();
          case "let":
            return let();
          default:
            throw unexpected(t, "expression");
        }
      case OPERATOR:
        if (t.text.equals("-") && !lookAhead(1).spaceBefore) {
          next();
          final Ast.Exp exp = accessAtom();
          return ast.negate(span(t.pos), exp);
        }
        throw unexpected(t, "expression");
      default:
        return application();
    }
  }

  private Ast.Exp application() {
    Ast.Exp fn = accessAtom();
    final List<Ast.Exp> args = new ArrayList<>();
    while (startsAtom(peek())) {
      args.add(accessAtom());
    }
    return args.isEmpty() ? fn : ast.apply(span(fn.pos), fn, args);
  }

  private static boolean startsAtom(Token t) {
    switch (t.kind) {
      case LOWER_ID:
      case UPPER_ID:
      case INT:
      case FLOAT:
      case STRING:
      case CHAR:
      case LPAREN:
      case LBRACKET:
      case LBRACE:
      case ACCESS_FN:
        return true;
      default:
        return false;
    }
  }

  private Ast.Exp accessAtom() {
    Ast.Exp exp = atom();
    while (peek().kind == Token.Kind.ACCESS) {
      final Token t = next();
      exp = ast.recordAccess(span(exp.pos), exp, fieldId(t));
    }
    return exp;
  }

  /** Converts an access token ".field" to an identifier "field". */
  private Ast.Id fieldId(Token t) {
    final Pos pos = new Pos(file, t.pos.startLine, t.pos.startColumn + 1,
        t.pos.endLine, t.pos.endColumn);
    return ast.id(pos, t.name);
  }

  private Ast.Exp atom() {
    final Token t = peek();
    switch (t.kind) {
      case LOWER_ID:
      case UPPER_ID:
        next();
        return ast.id(t.pos, t.moduleName, t.name);
      case INT:
        next();
        return ast.intLiteral(t.pos, (BigDecimal) value(t), t.text);
      case FLOAT:
        next();
        return ast.floatLiteral(t.pos, (BigDecimal) value(t), t.text);
      case STRING:
        next();
        return ast.stringLiteral(t.pos, (String) value(t), t.text);
      case CHAR:
        next();
        return ast.charLiteral(t.pos, (String) value(t), t.text);
      case ACCESS_FN:
        next();
        return ast.recordAccessFn(t.pos, t.name);
      case LPAREN:
        return parenthesized();
      case LBRACKET:
        return list();
      case LBRACE:
        return record();
      default:
        throw unexpected(t, "expression");
    }
  }

  private static Object value(Token t) {
    if (t.value == null) {
      throw new SimplifyParseException("literal has no value", t.pos);
    }
    return t.value;
  }

  private Ast.Exp parenthesized() {
    final Token start = next();
    final int saveLimit = limit;
    limit = 0;
    try {
      if (peek().kind == Token.Kind.RPAREN) {
        next();
        return ast.unitLiteral(span(start.pos));
      }
      if (peek().kind == Token.Kind.OPERATOR
          && lookAhead(1).kind == Token.Kind.RPAREN) {
        final Token t = next();
        final Op op = Op.BY_SYMBOL.get(t.text);
        if (op == null) {
          throw new SimplifyParseException(
              "unknown operator '" + t.text + "'", t.pos);
        }
        next();
        return ast.opRef(span(start.pos), op);
      }
      final Ast.Exp exp = expression();
      if (peek().kind == Token.Kind.COMMA) {
        final List<Ast.Exp> args = new ArrayList<>();
        args.add(exp);
        while (peek().kind == Token.Kind.COMMA) {
          next();
          args.add(expression());
        }
        expect(Token.Kind.RPAREN);
        return ast.tuple(span(start.pos), args);
      }
      expect(Token.Kind.RPAREN);
      return ast.parens(span(start.pos), exp);
    } finally {
      limit = saveLimit;
    }
  }

  private Ast.Exp list() {
    final Token start = next();
    final int saveLimit = limit;
    limit = 0;
    try {
      final List<Ast.Exp> args = new ArrayList<>();
      if (peek().kind != Token.Kind.RBRACKET) {
        args.add(expression());
        while (peek().kind == Token.Kind.COMMA) {
          next();
          args.add(expression());
        }
      }
      expect(Token.Kind.RBRACKET);
      return ast.list(span(start.pos), args);
    } finally {
      limit = saveLimit;
    }
  }

  private Ast.Exp record() {
    final Token start = next();
    final int saveLimit = limit;
    limit = 0;
    try {
      if (peek().kind == Token.Kind.RBRACE) {
        next();
        return ast.record(span(start.pos), ImmutableList.of());
      }
      Ast.@Nullable Id base = null;
      if (peek().kind == Token.Kind.LOWER_ID
          && lookAhead(1).kind == Token.Kind.BAR) {
        final Token t = next();
        base = ast.id(t.pos, t.moduleName, t.name);
        next();
      }
      final List<Ast.Setter> setters = new ArrayList<>();
      setters.add(setter());
      while (peek().kind == Token.Kind.COMMA) {
        next();
        setters.add(setter());
      }
      expect(Token.Kind.RBRACE);
      return base == null
          ? ast.record(span(start.pos), setters)
          : ast.recordUpdate(span(start.pos), base, setters);
    } finally {
      limit = saveLimit;
    }
  }

  private Ast.Setter setter() {
    final Token field = expect(Token.Kind.LOWER_ID);
    expect(Token.Kind.EQUALS);
    final Ast.Exp exp = expression();
    return ast.setter(span(field.pos), ast.id(field.pos, field.name), exp);
  }

  private Ast.Exp lambda() {
    final Token start = next();
    final List<Ast.Pat> pats = new ArrayList<>();
    while (peek().kind != Token.Kind.ARROW) {
      pats.add(patternAtom());
    }
    next();
    final Ast.Exp exp = expression();
    return ast.fn(span(start.pos), pats, exp);
  }

  private Ast.Exp ifThenElse() {
    final Token start = next();
    final Ast.Exp condition = expression();
    expectKeyword("then");
    final Ast.Exp ifTrue = expression();
    expectKeyword("else");
    final Ast.Exp ifFalse = expression();
    return ast.ifThenElse(span(start.pos), condition, ifTrue, ifFalse);
  }

  private Ast.Exp caseOf() {
    final Token start = next();
    final Ast.Exp exp = expression();
    expectKeyword("of");
    final int saveLimit = limit;
    final int column = raw().column();
    if (raw().firstOnLine && column <= saveLimit) {
      throw unexpected(peek(), "case branch");
    }
    final List<Ast.Match> matches = new ArrayList<>();
    try {
      do {
        limit = column;
        exempt = i;
        final Token armStart = raw();
        final Ast.Pat pat = pattern();
        expect(Token.Kind.ARROW);
        final Ast.Exp body = expression();
        matches.add(ast.match(span(armStart.pos), pat, body));
      } while (raw().kind != Token.Kind.EOF
          && raw().firstOnLine
          && raw().column() == column);
    } finally {
      limit = saveLimit;
    }
    return ast.caseOf(span(start.pos), exp, matches);
  }

  private Ast.Exp let() {
    final Token start = next();
    final int saveLimit = limit;
    final int column = raw().column();
    if (raw().firstOnLine && column <= saveLimit) {
      throw unexpected(peek(), "let declaration");
    }
    final List<Ast.Decl> decls = new ArrayList<>();
    try {
      do {
        limit = column;
        exempt = i;
        final Ast.Decl decl = valueDecl();
        if (decl != null) {
          decls.add(decl);
        }
      } while (raw().kind != Token.Kind.EOF
          && !raw().isKeyword("in")
          && raw().firstOnLine
          && raw().column() == column);
    } finally {
      limit = saveLimit;
    }
    expectKeyword("in");
    final Ast.Exp exp = expression();
    if (decls.isEmpty()) {
      throw new SimplifyParseException("let has no declarations", start.pos);
    }
    return ast.let(span(start.pos), decls, exp);
  }

  // patterns

  /** Parses a pattern, including "::" and "as". */
  Ast.Pat pattern() {
    Ast.Pat pat = consPattern();
    while (peek().isKeyword("as")) {
      next();
      final Token name = expect(Token.Kind.LOWER_ID);
      pat = ast.asPat(span(pat.pos), pat, ast.idPat(name.pos, name.name));
    }
    return pat;
  }

  private Ast.Pat consPattern() {
    final Ast.Pat p0 = constructorPattern();
    if (peek().isOperator("::")) {
      next();
      final Ast.Pat p1 = consPattern();
      return ast.consPat(p0, p1);
    }
    return p0;
  }

  private Ast.Pat constructorPattern() {
    if (peek().kind != Token.Kind.UPPER_ID) {
      return patternAtom();
    }
    final Token t = next();
    final List<Ast.Pat> args = new ArrayList<>();
    while (startsPatternAtom(peek())) {
      args.add(patternAtom());
    }
    return ast.conPat(span(t.pos), ast.id(t.pos, t.moduleName, t.name),
        args);
  }

  private static boolean startsPatternAtom(Token t) {
    switch (t.kind) {
      case LOWER_ID:
        return t.moduleName.isEmpty();
      case UNDERSCORE:
      case UPPER_ID:
      case INT:
      case FLOAT:
      case STRING:
      case CHAR:
      case LPAREN:
      case LBRACKET:
      case LBRACE:
        return true;
      default:
        return false;
    }
  }

  /** Parses a pattern that needs no parentheses to be a function
   * argument. */
  private Ast.Pat patternAtom() {
    final Token t = peek();
    switch (t.kind) {
      case LOWER_ID:
        if (!t.moduleName.isEmpty()) {
          break;
        }
        next();
        return ast.idPat(t.pos, t.name);
      case UNDERSCORE:
        next();
        return ast.wildcardPat(t.pos);
      case UPPER_ID:
        next();
        return ast.conPat(t.pos, ast.id(t.pos, t.moduleName, t.name),
            ImmutableList.of());
      case INT:
      case FLOAT:
      case STRING:
      case CHAR:
        return ast.literalPat((Ast.Literal) atom());
      case OPERATOR:
        if (t.text.equals("-")
            && (lookAhead(1).kind == Token.Kind.INT
                || lookAhead(1).kind == Token.Kind.FLOAT)
            && !lookAhead(1).spaceBefore) {
          next();
          final Token n = next();
          final BigDecimal value = ((BigDecimal) value(n)).negate();
          final Ast.Literal literal = n.kind == Token.Kind.INT
              ? ast.intLiteral(span(t.pos), value, "-" + n.text)
              : ast.floatLiteral(span(t.pos), value, "-" + n.text);
          return ast.literalPat(literal);
        }
        break;
      case LPAREN:
        return parenthesizedPattern();
      case LBRACKET:
        return listPattern();
      case LBRACE:
        return recordPattern();
      default:
        break;
    }
    throw unexpected(t, "pattern");
  }

  private Ast.Pat parenthesizedPattern() {
    final Token start = next();
    final int saveLimit = limit;
    limit = 0;
    try {
      if (peek().kind == Token.Kind.RPAREN) {
        next();
        return ast.literalPat(ast.unitLiteral(span(start.pos)));
      }
      final Ast.Pat pat = pattern();
      if (peek().kind == Token.Kind.COMMA) {
        final List<Ast.Pat> args = new ArrayList<>();
        args.add(pat);
        while (peek().kind == Token.Kind.COMMA) {
          next();
          args.add(pattern());
        }
        expect(Token.Kind.RPAREN);
        return ast.tuplePat(span(start.pos), args);
      }
      expect(Token.Kind.RPAREN);
      return ast.parensPat(span(start.pos), pat);
    } finally {
      limit = saveLimit;
    }
  }

  private Ast.Pat listPattern() {
    final Token start = next();
    final int saveLimit = limit;
    limit = 0;
    try {
      final List<Ast.Pat> args = new ArrayList<>();
      if (peek().kind != Token.Kind.RBRACKET) {
        args.add(pattern());
        while (peek().kind == Token.Kind.COMMA) {
          next();
          args.add(pattern());
        }
      }
      expect(Token.Kind.RBRACKET);
      return ast.listPat(span(start.pos), args);
    } finally {
      limit = saveLimit;
    }
  }

  private Ast.Pat recordPattern() {
    final Token start = next();
    final int saveLimit = limit;
    limit = 0;
    try {
      final List<Ast.IdPat> fields = new ArrayList<>();
      if (peek().kind != Token.Kind.RBRACE) {
        do {
          if (!fields.isEmpty()) {
            next();
          }
          final Token t = expect(Token.Kind.LOWER_ID);
          fields.add(ast.idPat(t.pos, t.name));
        } while (peek().kind == Token.Kind.COMMA);
      }
      expect(Token.Kind.RBRACE);
      return ast.recordPat(span(start.pos), fields);
    } finally {
      limit = saveLimit;
    }
  }
}

// End Parser.java
