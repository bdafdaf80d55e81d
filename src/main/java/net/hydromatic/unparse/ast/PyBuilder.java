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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds syntax tree nodes.
 *
 * <p>Every node that a builder creates has the builder's position. The
 * singleton {@link #py} builds nodes at {@link Pos#ZERO}; use {@link #at}
 * to build nodes at a particular line.
 */
public class PyBuilder {
  /**
   * The builder that creates nodes with no position. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  public static final PyBuilder py = new PyBuilder(Pos.ZERO);

  private final Pos pos;

  private PyBuilder(Pos pos) {
    this.pos = requireNonNull(pos);
  }

  /** Returns a builder that creates nodes at a given position. */
  public PyBuilder at(Pos pos) {
    return this.pos.equals(pos) ? this : new PyBuilder(pos);
  }

  /** Returns a builder that creates nodes at the start of a given line. */
  public PyBuilder at(int line) {
    return at(Pos.of(line));
  }

  private static <E> List<@Nullable E> nullableList(List<? extends E> list) {
    return Collections.unmodifiableList(new ArrayList<>(list));
  }

  // roots

  public Py.Module module(List<? extends Py.Stmt> body) {
    return new Py.Module(pos, ImmutableList.copyOf(body));
  }

  public Py.Module module(Py.Stmt... body) {
    return module(ImmutableList.copyOf(body));
  }

  public Py.Interactive interactive(List<? extends Py.Stmt> body) {
    return new Py.Interactive(pos, ImmutableList.copyOf(body));
  }

  public Py.Expression expression(Py.Exp body) {
    return new Py.Expression(pos, body);
  }

  // statements

  public Py.FunctionDef functionDef(boolean isAsync, String name,
      Py.Arguments args, List<? extends Py.Stmt> body,
      List<? extends Py.Exp> decoratorList, Py.@Nullable Exp returns) {
    return new Py.FunctionDef(pos,
        isAsync ? Op.ASYNC_FUNCTION_DEF : Op.FUNCTION_DEF, name, args,
        ImmutableList.copyOf(body), ImmutableList.copyOf(decoratorList),
        returns);
  }

  public Py.FunctionDef functionDef(String name, Py.Arguments args,
      List<? extends Py.Stmt> body) {
    return functionDef(false, name, args, body, ImmutableList.of(), null);
  }

  public Py.ClassDef classDef(String name, List<? extends Py.Exp> bases,
      List<Py.Keyword> keywords, List<? extends Py.Stmt> body,
      List<? extends Py.Exp> decoratorList) {
    return new Py.ClassDef(pos, name, ImmutableList.copyOf(bases),
        ImmutableList.copyOf(keywords), ImmutableList.copyOf(body),
        ImmutableList.copyOf(decoratorList));
  }

  public Py.Return returnStmt(Py.@Nullable Exp value) {
    return new Py.Return(pos, value);
  }

  public Py.Delete delete(List<? extends Py.Exp> targets) {
    return new Py.Delete(pos, ImmutableList.copyOf(targets));
  }

  public Py.Assign assign(List<? extends Py.Exp> targets, Py.Exp value) {
    return new Py.Assign(pos, ImmutableList.copyOf(targets), value);
  }

  public Py.Assign assign(Py.Exp target, Py.Exp value) {
    return assign(ImmutableList.of(target), value);
  }

  public Py.AugAssign augAssign(Py.Exp target, Op operator, Py.Exp value) {
    return new Py.AugAssign(pos, target, operator, value);
  }

  public Py.AnnAssign annAssign(Py.Exp target, Py.Exp annotation,
      Py.@Nullable Exp value, boolean simple) {
    return new Py.AnnAssign(pos, target, annotation, value, simple);
  }

  public Py.For forStmt(boolean isAsync, Py.Exp target, Py.Exp iter,
      List<? extends Py.Stmt> body, List<? extends Py.Stmt> orelse) {
    return new Py.For(pos, isAsync ? Op.ASYNC_FOR : Op.FOR, target, iter,
        ImmutableList.copyOf(body), ImmutableList.copyOf(orelse));
  }

  public Py.While whileStmt(Py.Exp test, List<? extends Py.Stmt> body,
      List<? extends Py.Stmt> orelse) {
    return new Py.While(pos, test, ImmutableList.copyOf(body),
        ImmutableList.copyOf(orelse));
  }

  public Py.If ifStmt(Py.Exp test, List<? extends Py.Stmt> body,
      List<? extends Py.Stmt> orelse) {
    return new Py.If(pos, test, ImmutableList.copyOf(body),
        ImmutableList.copyOf(orelse));
  }

  public Py.With with(boolean isAsync, List<Py.WithItem> items,
      List<? extends Py.Stmt> body) {
    return new Py.With(pos, isAsync ? Op.ASYNC_WITH : Op.WITH,
        ImmutableList.copyOf(items), ImmutableList.copyOf(body));
  }

  public Py.Raise raise(Py.@Nullable Exp exc, Py.@Nullable Exp cause) {
    return new Py.Raise(pos, exc, cause);
  }

  public Py.Try tryStmt(List<? extends Py.Stmt> body,
      List<Py.ExceptHandler> handlers, List<? extends Py.Stmt> orelse,
      List<? extends Py.Stmt> finalbody) {
    return new Py.Try(pos, Op.TRY, ImmutableList.copyOf(body),
        ImmutableList.copyOf(handlers), ImmutableList.copyOf(orelse),
        ImmutableList.copyOf(finalbody));
  }

  /** Creates a legacy "try" statement that has no "finally" block. */
  public Py.Try tryExcept(List<? extends Py.Stmt> body,
      List<Py.ExceptHandler> handlers, List<? extends Py.Stmt> orelse) {
    return new Py.Try(pos, Op.TRY_EXCEPT, ImmutableList.copyOf(body),
        ImmutableList.copyOf(handlers), ImmutableList.copyOf(orelse),
        ImmutableList.of());
  }

  /** Creates a legacy "try" statement that has only a "finally" block. */
  public Py.Try tryFinally(List<? extends Py.Stmt> body,
      List<? extends Py.Stmt> finalbody) {
    return new Py.Try(pos, Op.TRY_FINALLY, ImmutableList.copyOf(body),
        ImmutableList.of(), ImmutableList.of(),
        ImmutableList.copyOf(finalbody));
  }

  public Py.Assert assertStmt(Py.Exp test, Py.@Nullable Exp msg) {
    return new Py.Assert(pos, test, msg);
  }

  public Py.Import importStmt(Py.Alias... names) {
    return new Py.Import(pos, ImmutableList.copyOf(names));
  }

  public Py.ImportFrom importFrom(@Nullable String module, int level,
      Py.Alias... names) {
    return new Py.ImportFrom(pos, module, ImmutableList.copyOf(names), level);
  }

  public Py.Global global(String... names) {
    return new Py.Global(pos, Op.GLOBAL, ImmutableList.copyOf(names));
  }

  public Py.Global nonlocal(String... names) {
    return new Py.Global(pos, Op.NONLOCAL, ImmutableList.copyOf(names));
  }

  public Py.Expr expr(Py.Exp value) {
    return new Py.Expr(pos, value);
  }

  public Py.Keyword0 pass() {
    return new Py.Keyword0(pos, Op.PASS);
  }

  public Py.Keyword0 breakStmt() {
    return new Py.Keyword0(pos, Op.BREAK);
  }

  public Py.Keyword0 continueStmt() {
    return new Py.Keyword0(pos, Op.CONTINUE);
  }

  // expressions

  public Py.BoolOp boolOp(Op operator, Py.Exp... values) {
    return new Py.BoolOp(pos, operator, ImmutableList.copyOf(values));
  }

  public Py.NamedExpr namedExpr(Py.Exp target, Py.Exp value) {
    return new Py.NamedExpr(pos, target, value);
  }

  public Py.BinOp binOp(Py.Exp left, Op operator, Py.Exp right) {
    return new Py.BinOp(pos, left, operator, right);
  }

  public Py.UnaryOp unaryOp(Op operator, Py.Exp operand) {
    return new Py.UnaryOp(pos, operator, operand);
  }

  public Py.Lambda lambda(Py.Arguments args, Py.Exp body) {
    return new Py.Lambda(pos, args, body);
  }

  public Py.IfExp ifExp(Py.Exp test, Py.Exp body, Py.Exp orelse) {
    return new Py.IfExp(pos, test, body, orelse);
  }

  /** Creates a dictionary display; a null key denotes "**" unpacking. */
  public Py.Dict dict(List<? extends Py.@Nullable Exp> keys,
      List<? extends Py.Exp> values) {
    return new Py.Dict(pos, nullableList(keys), ImmutableList.copyOf(values));
  }

  public Py.Set set(Py.Exp... elts) {
    return new Py.Set(pos, ImmutableList.copyOf(elts));
  }

  public Py.Comp listComp(Py.Exp elt, Py.Comprehension... generators) {
    return new Py.Comp(pos, Op.LIST_COMP, elt,
        ImmutableList.copyOf(generators));
  }

  public Py.Comp setComp(Py.Exp elt, Py.Comprehension... generators) {
    return new Py.Comp(pos, Op.SET_COMP, elt,
        ImmutableList.copyOf(generators));
  }

  public Py.Comp generatorExp(Py.Exp elt, Py.Comprehension... generators) {
    return new Py.Comp(pos, Op.GENERATOR_EXP, elt,
        ImmutableList.copyOf(generators));
  }

  public Py.DictComp dictComp(Py.Exp key, Py.Exp value,
      Py.Comprehension... generators) {
    return new Py.DictComp(pos, key, value, ImmutableList.copyOf(generators));
  }

  public Py.Await await(Py.Exp value) {
    return new Py.Await(pos, Op.AWAIT, value);
  }

  public Py.Await yield(Py.@Nullable Exp value) {
    return new Py.Await(pos, Op.YIELD, value);
  }

  public Py.Await yieldFrom(Py.Exp value) {
    return new Py.Await(pos, Op.YIELD_FROM, value);
  }

  public Py.Compare compare(Py.Exp left, List<Op> ops,
      List<? extends Py.Exp> comparators) {
    return new Py.Compare(pos, left, ImmutableList.copyOf(ops),
        ImmutableList.copyOf(comparators));
  }

  public Py.Compare compare(Py.Exp left, Op op, Py.Exp right) {
    return compare(left, ImmutableList.of(op), ImmutableList.of(right));
  }

  public Py.Call call(Py.Exp func, List<? extends Py.Exp> args,
      List<Py.Keyword> keywords) {
    return new Py.Call(pos, func, ImmutableList.copyOf(args),
        ImmutableList.copyOf(keywords));
  }

  public Py.Call call(Py.Exp func, Py.Exp... args) {
    return call(func, ImmutableList.copyOf(args), ImmutableList.of());
  }

  public Py.FormattedValue formattedValue(Py.Exp value, int conversion,
      Py.@Nullable JoinedStr formatSpec, @Nullable String exprText) {
    return new Py.FormattedValue(pos, value, conversion, formatSpec,
        exprText);
  }

  public Py.FormattedValue formattedValue(Py.Exp value) {
    return formattedValue(value, -1, null, null);
  }

  public Py.JoinedStr joinedStr(Py.Exp... values) {
    return new Py.JoinedStr(pos, ImmutableList.copyOf(values));
  }

  public Py.Constant constant(Object value) {
    return new Py.Constant(pos, Op.CONSTANT, value, null);
  }

  /** Creates a string constant with a prefix such as "u". */
  public Py.Constant constant(String value, @Nullable String kind) {
    return new Py.Constant(pos, Op.CONSTANT, value, kind);
  }

  public Py.Constant constant(byte[] value) {
    return new Py.Constant(pos, Op.CONSTANT, value.clone(), null);
  }

  public Py.Constant none() {
    return constant(Py.Singleton.NONE);
  }

  /** Creates a legacy numeric literal. */
  public Py.Constant num(Object value) {
    return new Py.Constant(pos, Op.NUM, value, null);
  }

  /** Creates a legacy string literal. */
  public Py.Constant str(String value) {
    return new Py.Constant(pos, Op.STR, value, null);
  }

  /** Creates a legacy bytes literal. */
  public Py.Constant bytes(byte[] value) {
    return new Py.Constant(pos, Op.BYTES, value.clone(), null);
  }

  /** Creates a legacy "True", "False" or "None" literal. */
  public Py.Constant nameConstant(Object value) {
    return new Py.Constant(pos, Op.NAME_CONSTANT, value, null);
  }

  /** Creates a legacy "..." literal. */
  public Py.Constant ellipsis() {
    return new Py.Constant(pos, Op.ELLIPSIS, Py.Singleton.ELLIPSIS, null);
  }

  public Py.Attribute attribute(Py.Exp value, String attr) {
    return new Py.Attribute(pos, value, attr);
  }

  public Py.Subscript subscript(Py.Exp value, Py.Exp slice) {
    return new Py.Subscript(pos, value, slice);
  }

  public Py.Starred starred(Py.Exp value) {
    return new Py.Starred(pos, value);
  }

  public Py.Name name(String id) {
    return new Py.Name(pos, id);
  }

  public Py.Sequence list(Py.Exp... elts) {
    return new Py.Sequence(pos, Op.LIST, ImmutableList.copyOf(elts));
  }

  public Py.Sequence tuple(Py.Exp... elts) {
    return new Py.Sequence(pos, Op.TUPLE, ImmutableList.copyOf(elts));
  }

  public Py.Slice slice(Py.@Nullable Exp lower, Py.@Nullable Exp upper,
      Py.@Nullable Exp step) {
    return new Py.Slice(pos, lower, upper, step);
  }

  /** Creates a legacy simple subscript. */
  public Py.Index index(Py.Exp value) {
    return new Py.Index(pos, value);
  }

  /** Creates a legacy multi-dimensional subscript. */
  public Py.ExtSlice extSlice(Py.Exp... dims) {
    return new Py.ExtSlice(pos, ImmutableList.copyOf(dims));
  }

  // helpers

  public Py.Arguments arguments(List<Py.Arg> posonlyargs, List<Py.Arg> args,
      Py.@Nullable Arg vararg, List<Py.Arg> kwonlyargs,
      List<? extends Py.@Nullable Exp> kwDefaults, Py.@Nullable Arg kwarg,
      List<? extends Py.Exp> defaults) {
    return new Py.Arguments(pos, ImmutableList.copyOf(posonlyargs),
        ImmutableList.copyOf(args), vararg, ImmutableList.copyOf(kwonlyargs),
        nullableList(kwDefaults), kwarg, ImmutableList.copyOf(defaults));
  }

  /** Creates a parameter list of positional parameters without
   * defaults. */
  public Py.Arguments arguments(Py.Arg... args) {
    return arguments(ImmutableList.of(), ImmutableList.copyOf(args), null,
        ImmutableList.of(), ImmutableList.of(), null, ImmutableList.of());
  }

  public Py.Arg arg(String arg, Py.@Nullable Exp annotation) {
    return new Py.Arg(pos, arg, annotation);
  }

  public Py.Arg arg(String arg) {
    return arg(arg, null);
  }

  public Py.Keyword keyword(@Nullable String arg, Py.Exp value) {
    return new Py.Keyword(pos, arg, value);
  }

  public Py.Alias alias(String name, @Nullable String asname) {
    return new Py.Alias(pos, name, asname);
  }

  public Py.Alias alias(String name) {
    return alias(name, null);
  }

  public Py.WithItem withItem(Py.Exp contextExpr,
      Py.@Nullable Exp optionalVars) {
    return new Py.WithItem(pos, contextExpr, optionalVars);
  }

  public Py.Comprehension comprehension(boolean isAsync, Py.Exp target,
      Py.Exp iter, Py.Exp... ifs) {
    return new Py.Comprehension(pos, target, iter, ImmutableList.copyOf(ifs),
        isAsync);
  }

  public Py.Comprehension comprehension(Py.Exp target, Py.Exp iter,
      Py.Exp... ifs) {
    return comprehension(false, target, iter, ifs);
  }

  public Py.ExceptHandler exceptHandler(Py.@Nullable Exp type,
      @Nullable String name, List<? extends Py.Stmt> body) {
    return new Py.ExceptHandler(pos, type, name, ImmutableList.copyOf(body));
  }
}

// End PyBuilder.java
