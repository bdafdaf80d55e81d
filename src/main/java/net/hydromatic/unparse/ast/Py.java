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
package net.hydromatic.unparse.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of Python syntax tree nodes.
 *
 * <p>The set of classes is closed. Each class is visited by a method of the
 * same name in {@link Visitor}; a class may serve more than one {@link Op}
 * (for instance, {@link FunctionDef} serves {@link Op#FUNCTION_DEF} and
 * {@link Op#ASYNC_FUNCTION_DEF}).
 *
 * <p>Nodes are immutable. Optional children are null; sequences of
 * children are never null, but may be empty.
 */
public class Py {
  private Py() {}

  /** Values of constants that are neither numbers nor strings. */
  public enum Singleton {
    NONE("None"),
    ELLIPSIS("...");

    public final String text;

    Singleton(String text) {
      this.text = text;
    }
  }

  /** Abstract base class of the root of a tree. */
  public abstract static class Mod extends PyNode {
    Mod(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Abstract base class of statements. */
  public abstract static class Stmt extends PyNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Abstract base class of expressions. */
  public abstract static class Exp extends PyNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  // roots

  /** A module; a sequence of statements. */
  public static class Module extends Mod {
    public final List<Stmt> body;

    Module(Pos pos, ImmutableList<Stmt> body) {
      super(pos, Op.MODULE);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Statements entered at an interactive prompt. */
  public static class Interactive extends Mod {
    public final List<Stmt> body;

    Interactive(Pos pos, ImmutableList<Stmt> body) {
      super(pos, Op.INTERACTIVE);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** A single expression, as accepted by {@code eval}. */
  public static class Expression extends Mod {
    public final Exp body;

    Expression(Pos pos, Exp body) {
      super(pos, Op.EXPRESSION);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // statements

  /** Function definition, "def f(x): ..." or "async def f(x): ...". */
  public static class FunctionDef extends Stmt {
    public final String name;
    public final Arguments args;
    public final List<Stmt> body;
    public final List<Exp> decoratorList;
    public final @Nullable Exp returns;

    FunctionDef(Pos pos, Op op, String name, Arguments args,
        ImmutableList<Stmt> body, ImmutableList<Exp> decoratorList,
        @Nullable Exp returns) {
      super(pos, op);
      checkArgument(op == Op.FUNCTION_DEF || op == Op.ASYNC_FUNCTION_DEF);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      this.body = requireNonNull(body);
      this.decoratorList = requireNonNull(decoratorList);
      this.returns = returns;
    }

    public boolean isAsync() {
      return op == Op.ASYNC_FUNCTION_DEF;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Class definition, "class C(B, metaclass=M): ...". */
  public static class ClassDef extends Stmt {
    public final String name;
    public final List<Exp> bases;
    public final List<Keyword> keywords;
    public final List<Stmt> body;
    public final List<Exp> decoratorList;

    ClassDef(Pos pos, String name, ImmutableList<Exp> bases,
        ImmutableList<Keyword> keywords, ImmutableList<Stmt> body,
        ImmutableList<Exp> decoratorList) {
      super(pos, Op.CLASS_DEF);
      this.name = requireNonNull(name);
      this.bases = requireNonNull(bases);
      this.keywords = requireNonNull(keywords);
      this.body = requireNonNull(body);
      this.decoratorList = requireNonNull(decoratorList);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "return" statement, with optional value. */
  public static class Return extends Stmt {
    public final @Nullable Exp value;

    Return(Pos pos, @Nullable Exp value) {
      super(pos, Op.RETURN);
      this.value = value;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "del" statement. */
  public static class Delete extends Stmt {
    public final List<Exp> targets;

    Delete(Pos pos, ImmutableList<Exp> targets) {
      super(pos, Op.DELETE);
      this.targets = requireNonNull(targets);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment, "a = b = value". */
  public static class Assign extends Stmt {
    public final List<Exp> targets;
    public final Exp value;

    Assign(Pos pos, ImmutableList<Exp> targets, Exp value) {
      super(pos, Op.ASSIGN);
      this.targets = requireNonNull(targets);
      this.value = requireNonNull(value);
      checkArgument(!targets.isEmpty(), "assignment must have a target");
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Augmented assignment, "x += 1". The operator is a binary operator. */
  public static class AugAssign extends Stmt {
    public final Exp target;
    public final Op operator;
    public final Exp value;

    AugAssign(Pos pos, Exp target, Op operator, Exp value) {
      super(pos, Op.AUG_ASSIGN);
      this.target = requireNonNull(target);
      this.operator = requireNonNull(operator);
      this.value = requireNonNull(value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Annotated assignment, "x: int = 1".
   *
   * <p>{@link #simple} is false if the target is a name that was written in
   * parentheses, "(x): int", which makes it an expression rather than a
   * variable declaration. */
  public static class AnnAssign extends Stmt {
    public final Exp target;
    public final Exp annotation;
    public final @Nullable Exp value;
    public final boolean simple;

    AnnAssign(Pos pos, Exp target, Exp annotation, @Nullable Exp value,
        boolean simple) {
      super(pos, Op.ANN_ASSIGN);
      this.target = requireNonNull(target);
      this.annotation = requireNonNull(annotation);
      this.value = value;
      this.simple = simple;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "for" or "async for" loop, with optional "else" block. */
  public static class For extends Stmt {
    public final Exp target;
    public final Exp iter;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    For(Pos pos, Op op, Exp target, Exp iter, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orelse) {
      super(pos, op);
      checkArgument(op == Op.FOR || op == Op.ASYNC_FOR);
      this.target = requireNonNull(target);
      this.iter = requireNonNull(iter);
      this.body = requireNonNull(body);
      this.orelse = requireNonNull(orelse);
    }

    public boolean isAsync() {
      return op == Op.ASYNC_FOR;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "while" loop, with optional "else" block. */
  public static class While extends Stmt {
    public final Exp test;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    While(Pos pos, Exp test, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orelse) {
      super(pos, Op.WHILE);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orelse = requireNonNull(orelse);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "if" statement. An "elif" is an {@code If} that is the only statement
   * of its parent's {@link #orelse}. */
  public static class If extends Stmt {
    public final Exp test;
    public final List<Stmt> body;
    public final List<Stmt> orelse;

    If(Pos pos, Exp test, ImmutableList<Stmt> body,
        ImmutableList<Stmt> orelse) {
      super(pos, Op.IF);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orelse = requireNonNull(orelse);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "with" or "async with" statement. */
  public static class With extends Stmt {
    public final List<WithItem> items;
    public final List<Stmt> body;

    With(Pos pos, Op op, ImmutableList<WithItem> items,
        ImmutableList<Stmt> body) {
      super(pos, op);
      checkArgument(op == Op.WITH || op == Op.ASYNC_WITH);
      this.items = requireNonNull(items);
      this.body = requireNonNull(body);
    }

    public boolean isAsync() {
      return op == Op.ASYNC_WITH;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "raise" statement, "raise exc from cause". */
  public static class Raise extends Stmt {
    public final @Nullable Exp exc;
    public final @Nullable Exp cause;

    Raise(Pos pos, @Nullable Exp exc, @Nullable Exp cause) {
      super(pos, Op.RAISE);
      checkArgument(cause == null || exc != null,
          "raise with a cause must have an exception");
      this.exc = exc;
      this.cause = cause;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "try" statement with handlers, "else" and "finally" blocks.
   *
   * <p>The legacy shapes {@link Op#TRY_EXCEPT} (no "finally") and
   * {@link Op#TRY_FINALLY} (no handlers or "else") use the same class. */
  public static class Try extends Stmt {
    public final List<Stmt> body;
    public final List<ExceptHandler> handlers;
    public final List<Stmt> orelse;
    public final List<Stmt> finalbody;

    Try(Pos pos, Op op, ImmutableList<Stmt> body,
        ImmutableList<ExceptHandler> handlers, ImmutableList<Stmt> orelse,
        ImmutableList<Stmt> finalbody) {
      super(pos, op);
      switch (op) {
      case TRY:
        break;
      case TRY_EXCEPT:
        checkArgument(finalbody.isEmpty(), "try-except has no finally");
        break;
      case TRY_FINALLY:
        checkArgument(handlers.isEmpty() && orelse.isEmpty(),
            "try-finally has no handlers");
        break;
      default:
        throw new AssertionError("unknown op " + op);
      }
      this.body = requireNonNull(body);
      this.handlers = requireNonNull(handlers);
      this.orelse = requireNonNull(orelse);
      this.finalbody = requireNonNull(finalbody);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "assert" statement, with optional message. */
  public static class Assert extends Stmt {
    public final Exp test;
    public final @Nullable Exp msg;

    Assert(Pos pos, Exp test, @Nullable Exp msg) {
      super(pos, Op.ASSERT);
      this.test = requireNonNull(test);
      this.msg = msg;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "import" statement. */
  public static class Import extends Stmt {
    public final List<Alias> names;

    Import(Pos pos, ImmutableList<Alias> names) {
      super(pos, Op.IMPORT);
      this.names = requireNonNull(names);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "from module import ..." statement. {@link #level} is the number of
   * leading dots of a relative import; {@link #module} is null in
   * "from . import x". */
  public static class ImportFrom extends Stmt {
    public final @Nullable String module;
    public final List<Alias> names;
    public final int level;

    ImportFrom(Pos pos, @Nullable String module, ImmutableList<Alias> names,
        int level) {
      super(pos, Op.IMPORT_FROM);
      checkArgument(level >= 0, "level must be non-negative");
      this.module = module;
      this.names = requireNonNull(names);
      this.level = level;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "global" or "nonlocal" statement. */
  public static class Global extends Stmt {
    public final List<String> names;

    Global(Pos pos, Op op, ImmutableList<String> names) {
      super(pos, op);
      checkArgument(op == Op.GLOBAL || op == Op.NONLOCAL);
      this.names = requireNonNull(names);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression used as a statement. */
  public static class Expr extends Stmt {
    public final Exp value;

    Expr(Pos pos, Exp value) {
      super(pos, Op.EXPR);
      this.value = requireNonNull(value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Statement that consists of a keyword: "pass", "break" or
   * "continue". */
  public static class Keyword0 extends Stmt {
    Keyword0(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op == Op.PASS || op == Op.BREAK || op == Op.CONTINUE);
    }

    /** Returns the keyword, e.g. "pass". */
    public String keyword() {
      return op.name().toLowerCase(Locale.ROOT);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // expressions

  /** Chain of "and" or "or", "a and b and c". */
  public static class BoolOp extends Exp {
    public final Op operator;
    public final List<Exp> values;

    BoolOp(Pos pos, Op operator, ImmutableList<Exp> values) {
      super(pos, Op.BOOL_OP);
      checkArgument(operator == Op.AND || operator == Op.OR);
      checkArgument(values.size() >= 2, "need at least two operands");
      this.operator = operator;
      this.values = values;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment expression, "(x := value)". */
  public static class NamedExpr extends Exp {
    public final Exp target;
    public final Exp value;

    NamedExpr(Pos pos, Exp target, Exp value) {
      super(pos, Op.NAMED_EXPR);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a binary operator, "a + b". */
  public static class BinOp extends Exp {
    public final Exp left;
    public final Op operator;
    public final Exp right;

    BinOp(Pos pos, Exp left, Op operator, Exp right) {
      super(pos, Op.BIN_OP);
      this.left = requireNonNull(left);
      this.operator = requireNonNull(operator);
      this.right = requireNonNull(right);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a unary operator, "-a" or "not a". */
  public static class UnaryOp extends Exp {
    public final Op operator;
    public final Exp operand;

    UnaryOp(Pos pos, Op operator, Exp operand) {
      super(pos, Op.UNARY_OP);
      checkArgument(operator == Op.NOT || operator == Op.INVERT
          || operator == Op.UADD || operator == Op.USUB);
      this.operator = operator;
      this.operand = requireNonNull(operand);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Lambda, "lambda x, y: x + y". */
  public static class Lambda extends Exp {
    public final Arguments args;
    public final Exp body;

    Lambda(Pos pos, Arguments args, Exp body) {
      super(pos, Op.LAMBDA);
      this.args = requireNonNull(args);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conditional expression, "body if test else orelse". */
  public static class IfExp extends Exp {
    public final Exp test;
    public final Exp body;
    public final Exp orelse;

    IfExp(Pos pos, Exp test, Exp body, Exp orelse) {
      super(pos, Op.IF_EXP);
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orelse = requireNonNull(orelse);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Dictionary display, "{k: v, **d}". A null key marks "**" unpacking of
   * the corresponding value. */
  public static class Dict extends Exp {
    public final List<@Nullable Exp> keys;
    public final List<Exp> values;

    Dict(Pos pos, List<@Nullable Exp> keys, ImmutableList<Exp> values) {
      super(pos, Op.DICT);
      checkArgument(keys.size() == values.size(),
          "keys and values must have the same length");
      this.keys = requireNonNull(keys);
      this.values = requireNonNull(values);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Set display, "{a, b}". */
  public static class Set extends Exp {
    public final List<Exp> elts;

    Set(Pos pos, ImmutableList<Exp> elts) {
      super(pos, Op.SET);
      this.elts = requireNonNull(elts);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List, set or generator comprehension: "[elt for ...]", "{elt for ...}"
   * or "(elt for ...)". */
  public static class Comp extends Exp {
    public final Exp elt;
    public final List<Comprehension> generators;

    Comp(Pos pos, Op op, Exp elt, ImmutableList<Comprehension> generators) {
      super(pos, op);
      checkArgument(op == Op.LIST_COMP || op == Op.SET_COMP
          || op == Op.GENERATOR_EXP);
      checkArgument(!generators.isEmpty(), "need at least one generator");
      this.elt = requireNonNull(elt);
      this.generators = generators;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Dictionary comprehension, "{k: v for ...}". */
  public static class DictComp extends Exp {
    public final Exp key;
    public final Exp value;
    public final List<Comprehension> generators;

    DictComp(Pos pos, Exp key, Exp value,
        ImmutableList<Comprehension> generators) {
      super(pos, Op.DICT_COMP);
      checkArgument(!generators.isEmpty(), "need at least one generator");
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
      this.generators = generators;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression introduced by a keyword: "await value", "yield value" or
   * "yield from value". Only "yield" allows the value to be null. */
  public static class Await extends Exp {
    public final @Nullable Exp value;

    Await(Pos pos, Op op, @Nullable Exp value) {
      super(pos, op);
      checkArgument(op == Op.AWAIT || op == Op.YIELD || op == Op.YIELD_FROM);
      checkArgument(value != null || op == Op.YIELD,
          "%s requires a value", op);
      this.value = value;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Chain of comparisons, "a < b <= c". */
  public static class Compare extends Exp {
    public final Exp left;
    public final List<Op> ops;
    public final List<Exp> comparators;

    Compare(Pos pos, Exp left, ImmutableList<Op> ops,
        ImmutableList<Exp> comparators) {
      super(pos, Op.COMPARE);
      checkArgument(!ops.isEmpty() && ops.size() == comparators.size(),
          "need one comparator per operator");
      this.left = requireNonNull(left);
      this.ops = ops;
      this.comparators = comparators;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function call, "f(a, *b, c=d, **e)". */
  public static class Call extends Exp {
    public final Exp func;
    public final List<Exp> args;
    public final List<Keyword> keywords;

    Call(Pos pos, Exp func, ImmutableList<Exp> args,
        ImmutableList<Keyword> keywords) {
      super(pos, Op.CALL);
      this.func = requireNonNull(func);
      this.args = requireNonNull(args);
      this.keywords = requireNonNull(keywords);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Interpolated value inside a {@link JoinedStr}, "{x!r:>10}".
   *
   * <p>{@link #conversion} is -1 if there is no conversion, otherwise the
   * character code of 's', 'r' or 'a'. {@link #exprText}, if not null, is
   * the source text of the expression and is written instead of it. */
  public static class FormattedValue extends Exp {
    public final Exp value;
    public final int conversion;
    public final @Nullable JoinedStr formatSpec;
    public final @Nullable String exprText;

    FormattedValue(Pos pos, Exp value, int conversion,
        @Nullable JoinedStr formatSpec, @Nullable String exprText) {
      super(pos, Op.FORMATTED_VALUE);
      checkArgument(conversion == -1 || conversion == 's'
          || conversion == 'r' || conversion == 'a',
          "invalid conversion %s", conversion);
      this.value = requireNonNull(value);
      this.conversion = conversion;
      this.formatSpec = formatSpec;
      this.exprText = exprText;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Formatted string literal, "f'a{b}c'". Each value is a
   * {@link Constant} holding a string or a {@link FormattedValue}. */
  public static class JoinedStr extends Exp {
    public final List<Exp> values;

    JoinedStr(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.JOINED_STR);
      this.values = requireNonNull(values);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Constant value.
   *
   * <p>The value is a {@link Boolean}, {@link Integer}, {@link Long},
   * {@link BigInteger}, {@link Double}, {@link Complex}, {@link String},
   * {@code byte[]} or a {@link Singleton}. A byte array must not be
   * modified after the node is created.
   *
   * <p>{@link #kind} is "u" for a string written with a "u" prefix,
   * otherwise null. */
  public static class Constant extends Exp {
    public final Object value;
    public final @Nullable String kind;

    Constant(Pos pos, Op op, Object value, @Nullable String kind) {
      super(pos, op);
      checkArgument(op == Op.CONSTANT || op == Op.NUM || op == Op.STR
          || op == Op.BYTES || op == Op.NAME_CONSTANT || op == Op.ELLIPSIS);
      this.value = requireNonNull(value);
      this.kind = kind;
      checkArgument(isValid(op, value), "invalid value %s for %s", value, op);
    }

    private static boolean isValid(Op op, Object value) {
      switch (op) {
      case NUM:
        return isNumber(value);
      case STR:
        return value instanceof String;
      case BYTES:
        return value instanceof byte[];
      case NAME_CONSTANT:
        return value instanceof Boolean || value == Singleton.NONE;
      case ELLIPSIS:
        return value == Singleton.ELLIPSIS;
      default:
        return isNumber(value)
            || value instanceof Boolean
            || value instanceof String
            || value instanceof byte[]
            || value instanceof Singleton;
      }
    }

    /** Returns whether a value is an int, float or complex number. */
    public static boolean isNumber(Object value) {
      return value instanceof Integer
          || value instanceof Long
          || value instanceof BigInteger
          || value instanceof Double
          || value instanceof Complex;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Attribute reference, "value.attr". */
  public static class Attribute extends Exp {
    public final Exp value;
    public final String attr;

    Attribute(Pos pos, Exp value, String attr) {
      super(pos, Op.ATTRIBUTE);
      this.value = requireNonNull(value);
      this.attr = requireNonNull(attr);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Subscript, "value[slice]". */
  public static class Subscript extends Exp {
    public final Exp value;
    public final Exp slice;

    Subscript(Pos pos, Exp value, Exp slice) {
      super(pos, Op.SUBSCRIPT);
      this.value = requireNonNull(value);
      this.slice = requireNonNull(slice);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Starred expression, "*value". */
  public static class Starred extends Exp {
    public final Exp value;

    Starred(Pos pos, Exp value) {
      super(pos, Op.STARRED);
      this.value = requireNonNull(value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Name, "x". */
  public static class Name extends Exp {
    public final String id;

    Name(Pos pos, String id) {
      super(pos, Op.NAME);
      this.id = requireNonNull(id);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List display "[a, b]" or tuple "(a, b)". */
  public static class Sequence extends Exp {
    public final List<Exp> elts;

    Sequence(Pos pos, Op op, ImmutableList<Exp> elts) {
      super(pos, op);
      checkArgument(op == Op.LIST || op == Op.TUPLE);
      this.elts = requireNonNull(elts);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Slice, "lower:upper:step"; each part is optional. */
  public static class Slice extends Exp {
    public final @Nullable Exp lower;
    public final @Nullable Exp upper;
    public final @Nullable Exp step;

    Slice(Pos pos, @Nullable Exp lower, @Nullable Exp upper,
        @Nullable Exp step) {
      super(pos, Op.SLICE);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Legacy wrapper around the expression of a simple subscript. */
  public static class Index extends Exp {
    public final Exp value;

    Index(Pos pos, Exp value) {
      super(pos, Op.INDEX);
      this.value = requireNonNull(value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Legacy multi-dimensional subscript, "x[a:b, c]". */
  public static class ExtSlice extends Exp {
    public final List<Exp> dims;

    ExtSlice(Pos pos, ImmutableList<Exp> dims) {
      super(pos, Op.EXT_SLICE);
      this.dims = requireNonNull(dims);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // helpers

  /** Parameters of a function or lambda.
   *
   * <p>{@link #defaults} apply to the last positional parameters (those in
   * {@link #posonlyargs} followed by those in {@link #args}).
   * {@link #kwDefaults} has one entry per keyword-only parameter, null if
   * that parameter has no default. */
  public static class Arguments extends PyNode {
    public final List<Arg> posonlyargs;
    public final List<Arg> args;
    public final @Nullable Arg vararg;
    public final List<Arg> kwonlyargs;
    public final List<@Nullable Exp> kwDefaults;
    public final @Nullable Arg kwarg;
    public final List<Exp> defaults;

    Arguments(Pos pos, ImmutableList<Arg> posonlyargs, ImmutableList<Arg> args,
        @Nullable Arg vararg, ImmutableList<Arg> kwonlyargs,
        List<@Nullable Exp> kwDefaults, @Nullable Arg kwarg,
        ImmutableList<Exp> defaults) {
      super(pos, Op.ARGUMENTS);
      checkArgument(kwDefaults.size() == kwonlyargs.size(),
          "need one keyword default per keyword-only parameter");
      checkArgument(defaults.size() <= posonlyargs.size() + args.size(),
          "too many defaults");
      this.posonlyargs = requireNonNull(posonlyargs);
      this.args = requireNonNull(args);
      this.vararg = vararg;
      this.kwonlyargs = requireNonNull(kwonlyargs);
      this.kwDefaults = requireNonNull(kwDefaults);
      this.kwarg = kwarg;
      this.defaults = requireNonNull(defaults);
    }

    /** Returns whether there are no parameters. */
    public boolean isEmpty() {
      return posonlyargs.isEmpty()
          && args.isEmpty()
          && vararg == null
          && kwonlyargs.isEmpty()
          && kwarg == null;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Parameter, with optional annotation, "x: int". */
  public static class Arg extends PyNode {
    public final String arg;
    public final @Nullable Exp annotation;

    Arg(Pos pos, String arg, @Nullable Exp annotation) {
      super(pos, Op.ARG);
      this.arg = requireNonNull(arg);
      this.annotation = annotation;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Keyword argument of a call or class definition, "arg=value"; if
   * {@link #arg} is null, "**value". */
  public static class Keyword extends PyNode {
    public final @Nullable String arg;
    public final Exp value;

    Keyword(Pos pos, @Nullable String arg, Exp value) {
      super(pos, Op.KEYWORD);
      this.arg = arg;
      this.value = requireNonNull(value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Name in an import statement, "name as asname". */
  public static class Alias extends PyNode {
    public final String name;
    public final @Nullable String asname;

    Alias(Pos pos, String name, @Nullable String asname) {
      super(pos, Op.ALIAS);
      this.name = requireNonNull(name);
      this.asname = asname;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Item of a "with" statement, "contextExpr as optionalVars". */
  public static class WithItem extends PyNode {
    public final Exp contextExpr;
    public final @Nullable Exp optionalVars;

    WithItem(Pos pos, Exp contextExpr, @Nullable Exp optionalVars) {
      super(pos, Op.WITH_ITEM);
      this.contextExpr = requireNonNull(contextExpr);
      this.optionalVars = optionalVars;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "for" clause of a comprehension, with its "if" filters,
   * "for target in iter if a if b". */
  public static class Comprehension extends PyNode {
    public final Exp target;
    public final Exp iter;
    public final List<Exp> ifs;
    public final boolean isAsync;

    Comprehension(Pos pos, Exp target, Exp iter, ImmutableList<Exp> ifs,
        boolean isAsync) {
      super(pos, Op.COMPREHENSION);
      this.target = requireNonNull(target);
      this.iter = requireNonNull(iter);
      this.ifs = requireNonNull(ifs);
      this.isAsync = isAsync;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "except" clause of a "try" statement, "except type as name: ...". */
  public static class ExceptHandler extends PyNode {
    public final @Nullable Exp type;
    public final @Nullable String name;
    public final List<Stmt> body;

    ExceptHandler(Pos pos, @Nullable Exp type, @Nullable String name,
        ImmutableList<Stmt> body) {
      super(pos, Op.EXCEPT_HANDLER);
      checkArgument(name == null || type != null,
          "handler with a name must have a type");
      this.type = type;
      this.name = name;
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Py.java
