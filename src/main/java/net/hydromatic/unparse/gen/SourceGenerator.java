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
package net.hydromatic.unparse.gen;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.unparse.ast.Op;
import net.hydromatic.unparse.ast.Py;
import net.hydromatic.unparse.ast.PyNode;
import net.hydromatic.unparse.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a syntax tree into Python source code.
 *
 * <p>Each node is written with as few parentheses as will preserve its
 * meaning. Before visiting a child, the visitor of the parent records the
 * precedence that the child's context requires; the child wraps itself in
 * a {@link Delimiter} whose parentheses are discarded if the child binds
 * at least that tightly.
 *
 * <p>Sub-classes may override the {@code visit} methods to change how
 * particular kinds of node are written; see
 * {@link UnparseConfig#generatorClass()}.
 */
public class SourceGenerator extends Visitor {
  protected final UnparseConfig config;
  protected final SourceWriter w;

  /** Precedence required of each node by its context. An entry is removed
   * when the node reads it; a node with no entry gets {@link Op#HIGHEST}. */
  private final Map<PyNode, Integer> requiredPrecedences =
      new IdentityHashMap<>();

  /** Operator of the unary expression that contains a node. */
  private final Map<PyNode, Op> parentOps = new IdentityHashMap<>();

  private boolean usingUnicodeLiterals;
  private int depth;

  public SourceGenerator(UnparseConfig config) {
    this.config = requireNonNull(config);
    this.w = new SourceWriter(config.indentWith());
  }

  /** Writes a tree, and returns the fragments of source code. */
  public List<String> generate(PyNode node) {
    accept(node);
    return w.finish();
  }

  @Override protected void accept(@Nullable PyNode node) {
    if (node == null) {
      return;
    }
    if (depth >= config.maxDepth()) {
      throw new IllegalStateException("syntax tree is nested more than "
          + config.maxDepth() + " levels deep");
    }
    ++depth;
    try {
      node.accept(this);
    } finally {
      --depth;
    }
  }

  // utilities

  @CanIgnoreReturnValue
  protected SourceGenerator write(String s) {
    w.write(s);
    return this;
  }

  @CanIgnoreReturnValue
  protected SourceGenerator write(PyNode node) {
    accept(node);
    return this;
  }

  /** Writes a prefix and a node if the node is not null; returns whether it
   * wrote anything. */
  @CanIgnoreReturnValue
  protected boolean conditionalWrite(String prefix, @Nullable PyNode node) {
    if (node == null) {
      return false;
    }
    write(prefix).write(node);
    return true;
  }

  /** Writes a prefix and a string if the string is not null. */
  @CanIgnoreReturnValue
  protected boolean conditionalWrite(String prefix, @Nullable String s) {
    if (s == null) {
      return false;
    }
    write(prefix).write(s);
    return true;
  }

  /** Starts a new line for a statement, preceded by a line-number comment
   * if so configured. */
  @CanIgnoreReturnValue
  protected SourceGenerator statement(PyNode node) {
    newline(node, 0);
    return this;
  }

  protected void newline(@Nullable PyNode node, int extra) {
    w.newline(extra);
    if (node != null && config.addLineInformation()) {
      write("# line: " + node.pos.startLine);
      w.setNewLines(1);
    }
  }

  /** Writes an indented block of statements. */
  protected void body(List<? extends PyNode> statements) {
    w.indent();
    try {
      acceptAll(statements);
    } finally {
      w.dedent();
    }
  }

  protected void elseBody(List<Py.Stmt> orelse) {
    if (!orelse.isEmpty()) {
      newline(null, 0);
      write("else:");
      body(orelse);
    }
  }

  protected void commaList(List<? extends PyNode> items, boolean trailing) {
    setPrecedence(Op.COMMA.precedence, items);
    for (int i = 0; i < items.size(); i++) {
      write(i > 0 ? ", " : "").write(items.get(i));
    }
    if (trailing) {
      write(",");
    }
  }

  protected void decorators(List<Py.Exp> decoratorList, int extra) {
    newline(null, extra);
    for (Py.Exp decorator : decoratorList) {
      statement(decorator).write("@").write(decorator);
    }
  }

  /** Records the precedence that the context of some nodes requires. */
  protected void setPrecedence(int precedence, @Nullable PyNode... nodes) {
    setPrecedence(precedence, Arrays.asList(nodes));
  }

  protected void setPrecedence(int precedence,
      List<? extends @Nullable PyNode> nodes) {
    for (PyNode node : nodes) {
      if (node != null) {
        requiredPrecedences.put(node, precedence);
      }
    }
  }

  /** Returns and forgets the precedence that a node's context requires. */
  protected int requiredPrecedence(PyNode node) {
    final Integer precedence = requiredPrecedences.remove(node);
    return precedence == null ? Op.HIGHEST : precedence;
  }

  protected static int precedenceOf(PyNode node) {
    return node.op.precedence();
  }

  /** Opens a scope that writes parentheses around a node if the node's
   * precedence is less than its context requires. */
  protected Delimiter delimit(PyNode node) {
    return delimit(node, node.op);
  }

  /** As {@link #delimit(PyNode)}, but the precedence comes from an
   * operator. */
  protected Delimiter delimit(PyNode node, Op op) {
    return w.delimit("(", ")", op.precedence(), requiredPrecedence(node));
  }

  /** Opens a scope that always writes a pair of delimiters, such as
   * "[]". */
  protected Delimiter delimit(String delimiters) {
    return w.delimit(delimiters.substring(0, 1), delimiters.substring(1));
  }

  // statements

  @Override protected void visit(Py.FunctionDef node) {
    decorators(node.decoratorList, w.indentation() > 0 ? 1 : 2);
    statement(node)
        .write((node.isAsync() ? "async " : "") + "def " + node.name)
        .write("(")
        .write(node.args)
        .write(")");
    conditionalWrite(" -> ", node.returns);
    write(":");
    body(node.body);
    if (w.indentation() == 0) {
      newline(null, 2);
    }
  }

  @Override protected void visit(Py.ClassDef node) {
    decorators(node.decoratorList, 2);
    statement(node).write("class " + node.name);
    int n = 0;
    for (Py.Exp base : node.bases) {
      write(n++ == 0 ? "(" : ", ").write(base);
    }
    for (Py.Keyword keyword : node.keywords) {
      write(n++ == 0 ? "(" : ", ").write(keyword);
    }
    write(n > 0 ? "):" : ":");
    body(node.body);
    if (w.indentation() == 0) {
      newline(null, 2);
    }
  }

  @Override protected void visit(Py.Return node) {
    setPrecedence(precedenceOf(node), node.value);
    statement(node).write("return");
    conditionalWrite(" ", node.value);
  }

  @Override protected void visit(Py.Delete node) {
    statement(node).write("del ");
    commaList(node.targets, false);
  }

  @Override protected void visit(Py.Assign node) {
    setPrecedence(precedenceOf(node), node.value);
    setPrecedence(precedenceOf(node), node.targets);
    statement(node);
    for (Py.Exp target : node.targets) {
      write(target).write(" = ");
    }
    write(node.value);
  }

  @Override protected void visit(Py.AugAssign node) {
    setPrecedence(precedenceOf(node), node.value, node.target);
    statement(node)
        .write(node.target)
        .write(" " + node.operator.symbol + "= ")
        .write(node.value);
  }

  @Override protected void visit(Py.AnnAssign node) {
    setPrecedence(precedenceOf(node), node.target, node.annotation);
    setPrecedence(Op.COMMA.precedence, node.value);
    final boolean parens = node.target instanceof Py.Name && !node.simple;
    statement(node)
        .write(parens ? "(" : "")
        .write(node.target)
        .write(parens ? ")" : "")
        .write(": ")
        .write(node.annotation);
    conditionalWrite(" = ", node.value);
  }

  @Override protected void visit(Py.For node) {
    setPrecedence(precedenceOf(node), node.target);
    statement(node)
        .write(node.op == Op.ASYNC_FOR ? "async for " : "for ")
        .write(node.target)
        .write(" in ")
        .write(node.iter)
        .write(":");
    body(node.body);
    elseBody(node.orelse);
  }

  @Override protected void visit(Py.While node) {
    setPrecedence(precedenceOf(node), node.test);
    statement(node).write("while ").write(node.test).write(":");
    body(node.body);
    elseBody(node.orelse);
  }

  @Override protected void visit(Py.If node) {
    setPrecedence(precedenceOf(node), node.test);
    statement(node).write("if ").write(node.test).write(":");
    body(node.body);
    Py.If anIf = node;
    for (;;) {
      final List<Py.Stmt> orelse = anIf.orelse;
      if (orelse.size() == 1 && orelse.get(0) instanceof Py.If) {
        anIf = (Py.If) orelse.get(0);
        setPrecedence(precedenceOf(anIf), anIf.test);
        newline(null, 0);
        write("elif ").write(anIf.test).write(":");
        body(anIf.body);
      } else {
        elseBody(orelse);
        break;
      }
    }
  }

  @Override protected void visit(Py.With node) {
    statement(node).write(node.op == Op.ASYNC_WITH ? "async with " : "with ");
    commaList(node.items, false);
    write(":");
    body(node.body);
  }

  @Override protected void visit(Py.Raise node) {
    statement(node).write("raise");
    if (conditionalWrite(" ", node.exc)) {
      conditionalWrite(" from ", node.cause);
    }
  }

  /** Writes a {@code try} statement; also the legacy "try-except" and
   * "try-finally" forms, which have no handlers or no "finally" block. */
  @Override protected void visit(Py.Try node) {
    statement(node).write("try:");
    body(node.body);
    acceptAll(node.handlers);
    elseBody(node.orelse);
    if (!node.finalbody.isEmpty()) {
      statement(node).write("finally:");
      body(node.finalbody);
    }
  }

  @Override protected void visit(Py.Assert node) {
    setPrecedence(precedenceOf(node), node.test, node.msg);
    statement(node).write("assert ").write(node.test);
    conditionalWrite(", ", node.msg);
  }

  @Override protected void visit(Py.Import node) {
    statement(node).write("import ");
    commaList(node.names, false);
  }

  @Override protected void visit(Py.ImportFrom node) {
    statement(node)
        .write("from ")
        .write(Strings.repeat(".", node.level))
        .write(Strings.nullToEmpty(node.module))
        .write(" import ");
    commaList(node.names, false);
    if ("__future__".equals(node.module)
        && node.names.stream()
            .anyMatch(alias -> alias.name.equals("unicode_literals"))) {
      usingUnicodeLiterals = true;
    }
  }

  @Override protected void visit(Py.Global node) {
    statement(node)
        .write(node.op == Op.NONLOCAL ? "nonlocal " : "global ")
        .write(String.join(", ", node.names));
  }

  @Override protected void visit(Py.Expr node) {
    setPrecedence(precedenceOf(node), node.value);
    statement(node).write(node.value);
  }

  @Override protected void visit(Py.Keyword0 node) {
    statement(node).write(node.keyword());
  }

  // expressions

  @Override protected void visit(Py.BoolOp node) {
    try (Delimiter d = delimit(node, node.operator)) {
      setPrecedence(d.precedence + 1, node.values);
      for (int i = 0; i < node.values.size(); i++) {
        write(i > 0 ? requireNonNull(node.operator.padded) : "")
            .write(node.values.get(i));
      }
    }
  }

  /** Writes an assignment expression. Python requires parentheses around
   * most uses of ":=", so they are always written. */
  @Override protected void visit(Py.NamedExpr node) {
    try (Delimiter d = delimit(node)) {
      setPrecedence(d.precedence, node.target);
      setPrecedence(d.precedence + 1, node.value);
      d.setDiscard(false);
      write(node.target).write(" := ").write(node.value);
    }
  }

  @Override protected void visit(Py.BinOp node) {
    try (Delimiter d = delimit(node, node.operator)) {
      if (node.operator == Op.POW) {
        setPrecedence(Op.POW.precedence + 1, node.left);
        setPrecedence(Op.POW_RHS.precedence, node.right);
      } else {
        setPrecedence(d.precedence, node.left);
        setPrecedence(d.precedence + 1, node.right);
      }
      write(node.left)
          .write(requireNonNull(node.operator.padded))
          .write(node.right);
    }
  }

  @Override protected void visit(Py.UnaryOp node) {
    try (Delimiter d = delimit(node, node.operator)) {
      setPrecedence(d.precedence, node.operand);
      parentOps.put(node.operand, node.operator);
      write(requireNonNull(node.operator.symbol))
          .write(node.operator.isAlpha() ? " " : "")
          .write(node.operand);
    }
  }

  @Override protected void visit(Py.Lambda node) {
    try (Delimiter d = delimit(node)) {
      setPrecedence(d.precedence, node.body);
      write(node.args.isEmpty() ? "lambda" : "lambda ")
          .write(node.args)
          .write(": ")
          .write(node.body);
    }
  }

  @Override protected void visit(Py.IfExp node) {
    try (Delimiter d = delimit(node)) {
      setPrecedence(d.precedence + 1, node.body, node.test);
      setPrecedence(d.precedence, node.orelse);
      write(node.body)
          .write(" if ")
          .write(node.test)
          .write(" else ")
          .write(node.orelse);
    }
  }

  /** Writes a dict display. A value unpacked with "**" must bind at least
   * as tightly as "|". */
  @Override protected void visit(Py.Dict node) {
    try (Delimiter d = delimit("{}")) {
      for (int i = 0; i < node.keys.size(); i++) {
        final Py.Exp key = node.keys.get(i);
        write(i > 0 ? ", " : "");
        if (key != null) {
          setPrecedence(Op.COMMA.precedence, node.values.get(i));
          write(key).write(": ");
        } else {
          setPrecedence(Op.BIT_OR.precedence, node.values.get(i));
          write("**");
        }
        write(node.values.get(i));
      }
    }
  }

  /** Writes a set display. There is no literal for an empty set ("{}" is
   * an empty dict) and the name "set" may be rebound, so an empty set is
   * written as the class of a non-empty set, called. */
  @Override protected void visit(Py.Set node) {
    if (node.elts.isEmpty()) {
      write("{1}.__class__()");
      return;
    }
    try (Delimiter d = delimit("{}")) {
      commaList(node.elts, false);
    }
  }

  @Override protected void visit(Py.Comp node) {
    switch (node.op) {
    case LIST_COMP:
      try (Delimiter d = delimit("[]")) {
        write(node.elt);
        acceptAll(node.generators);
      }
      break;
    case SET_COMP:
      try (Delimiter d = delimit("{}")) {
        write(node.elt);
        acceptAll(node.generators);
      }
      break;
    case GENERATOR_EXP:
      try (Delimiter d = delimit(node)) {
        if (d.requiredPrecedence == Op.CALL_ONE_ARG.precedence) {
          // the sole argument of a call shares the call's parentheses
          d.setDiscard(true);
        }
        setPrecedence(Op.COMMA.precedence, node.elt);
        write(node.elt);
        acceptAll(node.generators);
      }
      break;
    default:
      throw new AssertionError("unknown op " + node.op);
    }
  }

  @Override protected void visit(Py.DictComp node) {
    try (Delimiter d = delimit("{}")) {
      write(node.key).write(": ").write(node.value);
      acceptAll(node.generators);
    }
  }

  @Override protected void visit(Py.Await node) {
    try (Delimiter d = delimit(node)) {
      switch (node.op) {
      case AWAIT:
        write("await ").write(requireNonNull(node.value));
        break;
      case YIELD:
        setPrecedence(d.precedence + 1, node.value);
        write("yield");
        conditionalWrite(" ", node.value);
        break;
      case YIELD_FROM:
        write("yield from ").write(requireNonNull(node.value));
        break;
      default:
        throw new AssertionError("unknown op " + node.op);
      }
    }
  }

  @Override protected void visit(Py.Compare node) {
    try (Delimiter d = delimit(node, node.ops.get(0))) {
      setPrecedence(d.precedence + 1, node.left);
      setPrecedence(d.precedence + 1, node.comparators);
      write(node.left);
      for (int i = 0; i < node.ops.size(); i++) {
        write(requireNonNull(node.ops.get(i).padded))
            .write(node.comparators.get(i));
      }
    }
  }

  @Override protected void visit(Py.Call node) {
    final int argCount = node.args.size() + node.keywords.size();
    setPrecedence(argCount > 1 ? Op.COMMA.precedence
        : Op.CALL_ONE_ARG.precedence, node.args);
    write(node.func).write("(");
    int n = 0;
    for (Py.Exp arg : node.args) {
      write(n++ > 0 ? ", " : "").write(arg);
    }
    for (Py.Keyword keyword : node.keywords) {
      setPrecedence(Op.COMMA.precedence, keyword.value);
      write(n++ > 0 ? ", " : "").write(keyword);
    }
    write(")");
  }

  /** Writes a formatted value that is not inside a formatted string, as if
   * it were the only value of one. */
  @Override protected void visit(Py.FormattedValue node) {
    stringConstant(node, null, ImmutableList.of(node));
  }

  @Override protected void visit(Py.JoinedStr node) {
    stringConstant(node, null, node.values);
  }

  @Override protected void visit(Py.Constant node) {
    final Object value = node.value;
    switch (node.op) {
    case NUM:
      numericConstant(node);
      return;
    case STR:
      stringConstant(node, (String) value, null);
      return;
    case BYTES:
    case NAME_CONSTANT:
    case ELLIPSIS:
      write(repr(value));
      return;
    case CONSTANT:
      if (Py.Constant.isNumber(value)) {
        numericConstant(node);
      } else if (value instanceof String) {
        stringConstant(node, (String) value, null);
      } else {
        write(repr(value));
      }
      return;
    default:
      throw new AssertionError("unknown op " + node.op);
    }
  }

  @Override protected void visit(Py.Attribute node) {
    write(node.value).write(".").write(node.attr);
  }

  @Override protected void visit(Py.Subscript node) {
    setPrecedence(precedenceOf(node), node.slice);
    write(node.value).write("[").write(node.slice).write("]");
  }

  @Override protected void visit(Py.Starred node) {
    write("*").write(node.value);
  }

  @Override protected void visit(Py.Name node) {
    write(node.id);
  }

  @Override protected void visit(Py.Sequence node) {
    switch (node.op) {
    case LIST:
      try (Delimiter d = delimit("[]")) {
        commaList(node.elts, false);
      }
      break;
    case TUPLE:
      try (Delimiter d = delimit(node)) {
        if (node.elts.isEmpty()) {
          d.setDiscard(false);
        }
        commaList(node.elts, node.elts.size() == 1);
      }
      break;
    default:
      throw new AssertionError("unknown op " + node.op);
    }
  }

  @Override protected void visit(Py.Slice node) {
    setPrecedence(precedenceOf(node), node.lower, node.upper, node.step);
    if (node.lower != null) {
      write(node.lower);
    }
    write(":");
    if (node.upper != null) {
      write(node.upper);
    }
    if (node.step != null) {
      write(":");
      if (!(node.step instanceof Py.Name
          && ((Py.Name) node.step).id.equals("None"))) {
        write(node.step);
      }
    }
  }

  @Override protected void visit(Py.Index node) {
    try (Delimiter d = delimit(node)) {
      setPrecedence(d.precedence, node.value);
      write(node.value);
    }
  }

  @Override protected void visit(Py.ExtSlice node) {
    setPrecedence(precedenceOf(node), node.dims);
    commaList(node.dims, node.dims.size() == 1);
  }

  // helpers

  @Override protected void visit(Py.Arguments node) {
    final int[] count = {0};
    final Runnable comma = () -> {
      if (count[0]++ > 0) {
        write(", ");
      }
    };
    final int positionalDefaults =
        Math.max(0, node.defaults.size() - node.args.size());
    if (!node.posonlyargs.isEmpty()) {
      arguments(comma, node.posonlyargs,
          node.defaults.subList(0, positionalDefaults));
      comma.run();
      write("/");
    }
    arguments(comma, node.args,
        node.defaults.subList(positionalDefaults, node.defaults.size()));
    if (node.vararg != null) {
      comma.run();
      write("*").write(node.vararg);
    }
    if (!node.kwonlyargs.isEmpty()) {
      if (node.vararg == null) {
        comma.run();
        write("*");
      }
      arguments(comma, node.kwonlyargs, node.kwDefaults);
    }
    if (node.kwarg != null) {
      comma.run();
      write("**").write(node.kwarg);
    }
  }

  /** Writes a list of arguments; the last of them have default values. */
  private void arguments(Runnable comma, List<Py.Arg> args,
      List<? extends Py.@Nullable Exp> defaults) {
    setPrecedence(Op.COMMA.precedence, defaults);
    final int padding = args.size() - defaults.size();
    for (int i = 0; i < args.size(); i++) {
      comma.run();
      write(args.get(i));
      if (i >= padding) {
        conditionalWrite("=", defaults.get(i - padding));
      }
    }
  }

  @Override protected void visit(Py.Arg node) {
    write(node.arg);
    conditionalWrite(": ", node.annotation);
  }

  @Override protected void visit(Py.Keyword node) {
    write(node.arg == null ? "**" : node.arg + "=").write(node.value);
  }

  @Override protected void visit(Py.Alias node) {
    write(node.name);
    conditionalWrite(" as ", node.asname);
  }

  @Override protected void visit(Py.WithItem node) {
    write(node.contextExpr);
    conditionalWrite(" as ", node.optionalVars);
  }

  @Override protected void visit(Py.Comprehension node) {
    setPrecedence(precedenceOf(node), node.iter);
    setPrecedence(precedenceOf(node), node.ifs);
    setPrecedence(Op.COMPREHENSION_TARGET.precedence, node.target);
    write(node.isAsync ? " async for " : " for ")
        .write(node.target)
        .write(" in ")
        .write(node.iter);
    for (Py.Exp anIf : node.ifs) {
      write(" if ").write(anIf);
    }
  }

  @Override protected void visit(Py.ExceptHandler node) {
    statement(node).write("except");
    if (conditionalWrite(" ", node.type)) {
      conditionalWrite(" as ", node.name);
    }
    write(":");
    body(node.body);
  }

  // literals

  /** Writes an int, float or complex constant.
   *
   * <p>A negative number is parenthesized as if it were a unary minus
   * expression, so that it is not taken as the base of a power.
   *
   * <p>If {@link UnparseConfig#mergedUnaryMinus()}, a legacy number node
   * that is the operand of a unary minus keeps its parentheses. */
  protected void numericConstant(Py.Constant node) {
    final String text = Numbers.toPython(node.value);
    final Op op = text.startsWith("-") ? Op.USUB : node.op;
    try (Delimiter d = delimit(node, op)) {
      write(text);
      if (node.op == Op.NUM
          && config.mergedUnaryMinus()
          && d.isDiscard()
          && !Numbers.isNegative(node.value)) {
        d.setDiscard(parentOps.get(node) != Op.USUB);
      }
    }
  }

  /** Writes a string constant or a formatted string.
   *
   * @param node Node
   * @param value Value of a string constant, or null
   * @param values Values of a formatted string, or null
   */
  protected void stringConstant(Py.Exp node, @Nullable String value,
      @Nullable List<Py.Exp> values) {
    final int embedded = embeddingLevel(requiredPrecedence(node));

    // flush pending newlines, so that the current line is the one the
    // literal will be written on
    write("");
    final String currentLine = w.currentLine();

    final String s;
    final boolean unicodeLiterals;
    if (values != null) {
      final SourceWriter.Region region = w.startRegion();
      joinedValues(values);
      write("");
      s = w.cut(region);
      unicodeLiterals = false;
    } else {
      s = requireNonNull(value, "value");
      unicodeLiterals = usingUnicodeLiterals;
    }

    final String literal =
        config.stringFormatter().format(s, embedded, currentLine,
            unicodeLiterals);
    if (values != null) {
      write("f" + literal);
    } else if (node instanceof Py.Constant
        && ((Py.Constant) node).kind != null) {
      write(((Py.Constant) node).kind + literal);
    } else {
      write(literal);
    }
  }

  /** Writes the body of a formatted string. Braces in literal text are
   * doubled; each formatted value is written between braces, followed by
   * its conversion and format specification.
   *
   * <p>A value that starts with a brace is padded with spaces, so that its
   * brace is not read as an escaped one. A lambda or conditional
   * expression is parenthesized, so that its colon does not start the
   * format specification. */
  private void joinedValues(List<Py.Exp> values) {
    for (Py.Exp value : values) {
      if (value instanceof Py.Constant
          && ((Py.Constant) value).value instanceof String) {
        final String text = (String) ((Py.Constant) value).value;
        write(text.replace("{", "{{").replace("}", "}}"));
      } else if (value instanceof Py.FormattedValue) {
        final Py.FormattedValue formattedValue = (Py.FormattedValue) value;
        try (Delimiter d = delimit("{}")) {
          if (!Strings.isNullOrEmpty(formattedValue.exprText)) {
            write(formattedValue.exprText);
          } else {
            setPrecedence(
                Math.max(precedenceOf(formattedValue),
                    Op.LAMBDA.precedence + 1),
                formattedValue.value);
            final SourceWriter.Region region = w.startRegion();
            write(formattedValue.value);
            write("");
            final String text = w.cut(region);
            write(text.startsWith("{") ? " " + text + " " : text);
          }
          if (formattedValue.conversion != -1) {
            write("!" + (char) formattedValue.conversion);
          }
          if (formattedValue.formatSpec != null) {
            write(":");
            joinedValues(formattedValue.formatSpec.values);
          }
        }
      } else {
        throw new AssertionError("Invalid node " + value.op
            + " inside JoinedStr");
      }
    }
  }

  /** Returns how deeply a string literal is embedded in its statement:
   * 0 for an expression statement, 2 for the value of an assignment, and
   * 1 for anything else. */
  static int embeddingLevel(int requiredPrecedence) {
    if (requiredPrecedence == Op.ASSIGN.precedence) {
      return 2;
    }
    if (requiredPrecedence <= Op.EXPR.precedence) {
      return 0;
    }
    return 1;
  }

  /** Converts a constant that is not a number or a text string to Python
   * source. */
  static String repr(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value ? "True" : "False";
    }
    if (value instanceof Py.Singleton) {
      return ((Py.Singleton) value).text;
    }
    if (value instanceof byte[]) {
      return PrettyString.repr((byte[]) value);
    }
    if (value instanceof String) {
      return PrettyString.repr((String) value);
    }
    throw new AssertionError("unknown constant " + value);
  }
}

// End SourceGenerator.java
