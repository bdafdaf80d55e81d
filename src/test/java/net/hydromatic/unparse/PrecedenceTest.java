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
package net.hydromatic.unparse;

import static net.hydromatic.unparse.Fixture.assignX;
import static net.hydromatic.unparse.Fixture.expr;
import static net.hydromatic.unparse.ast.PyBuilder.py;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import net.hydromatic.unparse.ast.Op;
import net.hydromatic.unparse.ast.Py;
import org.junit.jupiter.api.Test;

/** Tests that expressions are written with the parentheses that they need,
 * and no others. */
public class PrecedenceTest {
  private static final Py.Name A = py.name("a");
  private static final Py.Name B = py.name("b");
  private static final Py.Name C = py.name("c");

  @Test void testBinaryOperators() {
    expr(py.binOp(py.binOp(A, Op.ADD, B), Op.MULT, C))
        .assertLine("(a + b) * c");
    expr(py.binOp(A, Op.ADD, py.binOp(B, Op.MULT, C)))
        .assertLine("a + b * c");
    expr(py.binOp(py.binOp(A, Op.MULT, B), Op.ADD, C))
        .assertLine("a * b + c");
  }

  /** Left-associative operators need parentheses on the right but not on
   * the left. */
  @Test void testAssociativity() {
    expr(py.binOp(py.binOp(A, Op.SUB, B), Op.SUB, C))
        .assertLine("a - b - c");
    expr(py.binOp(A, Op.SUB, py.binOp(B, Op.SUB, C)))
        .assertLine("a - (b - c)");
    expr(py.binOp(A, Op.DIV, py.binOp(B, Op.MULT, C)))
        .assertLine("a / (b * c)");
    expr(py.binOp(py.binOp(A, Op.L_SHIFT, B), Op.BIT_OR, C))
        .assertLine("a << b | c");
    expr(py.binOp(A, Op.BIT_AND, py.binOp(B, Op.BIT_XOR, C)))
        .assertLine("a & (b ^ c)");
  }

  /** Power is right-associative, and binds tighter than a unary operator
   * on its left but looser than one on its right. */
  @Test void testPower() {
    final Py.Constant two = py.constant(2);
    final Py.Constant three = py.constant(3);
    expr(py.binOp(two, Op.POW, py.binOp(three, Op.POW, A)))
        .assertLine("2 ** 3 ** a");
    expr(py.binOp(py.binOp(two, Op.POW, three), Op.POW, A))
        .assertLine("(2 ** 3) ** a");
    expr(py.unaryOp(Op.USUB, py.binOp(A, Op.POW, two)))
        .assertLine("-a ** 2");
    expr(py.binOp(py.unaryOp(Op.USUB, A), Op.POW, two))
        .assertLine("(-a) ** 2");
    expr(py.binOp(two, Op.POW, py.unaryOp(Op.USUB, A)))
        .assertLine("2 ** -a");
    expr(py.binOp(py.constant(-1), Op.POW, two))
        .assertLine("(-1) ** 2");
    expr(py.binOp(two, Op.POW, py.constant(-1)))
        .assertLine("2 ** -1");
  }

  @Test void testUnaryOperators() {
    expr(py.unaryOp(Op.NOT, A)).assertLine("not a");
    expr(py.unaryOp(Op.INVERT, A)).assertLine("~a");
    expr(py.unaryOp(Op.USUB, py.unaryOp(Op.USUB, A))).assertLine("--a");
    expr(py.unaryOp(Op.NOT, py.compare(A, Op.EQ, B)))
        .assertLine("not a == b");
    expr(py.compare(py.unaryOp(Op.NOT, A), Op.EQ, B))
        .assertLine("(not a) == b");
    expr(py.unaryOp(Op.USUB, py.binOp(A, Op.ADD, B)))
        .assertLine("-(a + b)");
    expr(py.unaryOp(Op.USUB, py.constant(-1))).assertLine("--1");
  }

  @Test void testBooleanOperators() {
    expr(py.boolOp(Op.AND, py.boolOp(Op.OR, A, B), C))
        .assertLine("(a or b) and c");
    expr(py.boolOp(Op.OR, py.boolOp(Op.AND, A, B), C))
        .assertLine("a and b or c");
    expr(py.boolOp(Op.OR, A, B, C)).assertLine("a or b or c");
    expr(py.boolOp(Op.OR, A, py.boolOp(Op.OR, B, C)))
        .assertLine("a or (b or c)");
  }

  @Test void testCompare() {
    expr(py.compare(A, ImmutableList.of(Op.LT, Op.LT_E),
        ImmutableList.of(B, C)))
        .assertLine("a < b <= c");
    expr(py.compare(A, Op.NOT_IN, B)).assertLine("a not in b");
    expr(py.compare(A, Op.IS_NOT, py.none())).assertLine("a is not None");
    expr(py.compare(py.compare(A, Op.LT, B), Op.EQ, C))
        .assertLine("(a < b) == c");
    expr(py.compare(py.binOp(A, Op.BIT_OR, B), Op.IN, C))
        .assertLine("a | b in c");
  }

  @Test void testTuple() {
    expr(py.tuple(A, B)).assertLine("a, b");
    expr(py.tuple(A)).assertLine("a,");
    expr(py.tuple()).assertLine("()");
    expr(py.list(py.tuple(A, B), C)).assertLine("[(a, b), c]");
    assignX(py.tuple(A, B)).assertLine("x = a, b");
    expr(py.call(py.name("f"), py.tuple(A, B))).assertLine("f((a, b))");
    expr(py.subscript(A, py.tuple(B, C))).assertLine("a[b, c]");
  }

  @Test void testLiteralOperands() {
    final Py.Constant one = py.constant(1);
    final Py.Constant two = py.constant(2);
    final Py.Constant three = py.constant(3);
    expr(py.binOp(one, Op.ADD, py.binOp(two, Op.MULT, three)))
        .assertLine("1 + 2 * 3");
    expr(py.binOp(py.binOp(one, Op.ADD, two), Op.MULT, three))
        .assertLine("(1 + 2) * 3");
    expr(py.tuple(one, two)).assertLine("1, 2");
    expr(py.call(py.name("f"), py.tuple(one))).assertLine("f((1,))");
  }

  @Test void testConditionalExpression() {
    expr(py.ifExp(B, A, C)).assertLine("a if b else c");
    expr(py.ifExp(C, A, py.ifExp(py.name("d"), B, py.name("e"))))
        .assertLine("a if c else b if d else e");
    expr(py.ifExp(C, py.ifExp(B, A, py.name("d")), py.name("e")))
        .assertLine("(a if b else d) if c else e");
    expr(py.binOp(py.ifExp(B, A, C), Op.ADD, py.constant(1)))
        .assertLine("(a if b else c) + 1");
  }

  @Test void testLambda() {
    expr(py.lambda(py.arguments(), A)).assertLine("lambda: a");
    expr(py.lambda(py.arguments(py.arg("x"), py.arg("y")),
        py.binOp(py.name("x"), Op.ADD, py.name("y"))))
        .assertLine("lambda x, y: x + y");
    expr(py.call(py.name("f"), py.lambda(py.arguments(), A)))
        .assertLine("f(lambda: a)");
    expr(py.binOp(py.lambda(py.arguments(), A), Op.ADD, B))
        .assertLine("(lambda: a) + b");
    expr(py.lambda(py.arguments(), py.lambda(py.arguments(), A)))
        .assertLine("lambda: lambda: a");
  }

  /** An assignment expression is always parenthesized, even where the
   * grammar would allow it bare. */
  @Test void testNamedExpr() {
    expr(py.namedExpr(py.name("x"), py.constant(1))).assertLine("(x := 1)");
    expr(py.call(py.name("f"), py.namedExpr(py.name("x"), A)))
        .assertLine("f((x := a))");
    expr(py.namedExpr(py.name("x"), py.tuple(A, B)))
        .assertLine("(x := (a, b))");
  }

  @Test void testGeneratorExpression() {
    final Py.Name x = py.name("x");
    final Py.Comp gen = py.generatorExp(x, py.comprehension(x, A));
    expr(gen).assertLine("(x for x in a)");
    expr(py.call(py.name("f"), gen)).assertLine("f(x for x in a)");
    expr(py.call(py.name("f"), gen, B)).assertLine("f((x for x in a), b)");
    assignX(gen).assertLine("x = (x for x in a)");
  }

  @Test void testComprehensions() {
    final Py.Name x = py.name("x");
    final Py.Name y = py.name("y");
    expr(py.listComp(x, py.comprehension(x, A, py.compare(x, Op.GT, B))))
        .assertLine("[x for x in a if x > b]");
    expr(py.setComp(x, py.comprehension(py.tuple(x, y), A)))
        .assertLine("{x for x, y in a}");
    expr(py.dictComp(x, y, py.comprehension(true, x, A),
        py.comprehension(y, B)))
        .assertLine("{x: y async for x in a for y in b}");
    expr(py.listComp(x,
        py.comprehension(x, A, py.ifExp(B, x, C))))
        .assertLine("[x for x in a if (x if b else c)]");
    expr(py.listComp(x,
        py.comprehension(x, py.lambda(py.arguments(), A))))
        .assertLine("[x for x in (lambda: a)]");
  }

  @Test void testYieldAndAwait() {
    expr(py.yield(null)).assertLine("yield");
    expr(py.yield(A)).assertLine("yield a");
    assignX(py.yield(A)).assertLine("x = yield a");
    expr(py.call(py.name("f"), py.yield(A))).assertLine("f((yield a))");
    expr(py.yield(py.tuple(A, B))).assertLine("yield a, b");
    expr(py.yieldFrom(A)).assertLine("yield from a");
    expr(py.await(A)).assertLine("await a");
    expr(py.await(py.binOp(A, Op.ADD, B))).assertLine("await (a + b)");
    expr(py.binOp(py.await(A), Op.POW, B)).assertLine("await a ** b");
  }

  @Test void testAtoms() {
    expr(py.attribute(py.binOp(A, Op.ADD, B), "c")).assertLine("(a + b).c");
    expr(py.attribute(py.constant(1), "real")).assertLine("(1).real");
    expr(py.attribute(py.attribute(A, "b"), "c")).assertLine("a.b.c");
    expr(py.subscript(py.binOp(A, Op.ADD, B), C)).assertLine("(a + b)[c]");
    expr(py.call(py.attribute(A, "f"), B)).assertLine("a.f(b)");
    expr(py.starred(A)).assertLine("*a");
  }

  @Test void testSlices() {
    expr(py.subscript(A, py.slice(py.constant(1), py.constant(2), null)))
        .assertLine("a[1:2]");
    expr(py.subscript(A, py.slice(null, null, py.constant(2))))
        .assertLine("a[::2]");
    expr(py.subscript(A, py.slice(null, null, null))).assertLine("a[:]");
    expr(py.subscript(A, py.slice(B, null, py.name("None"))))
        .assertLine("a[b::]");
    expr(py.subscript(A, py.index(B))).assertLine("a[b]");
    expr(py.subscript(A,
        py.extSlice(py.slice(null, B, null), py.slice(C, null, null))))
        .assertLine("a[:b, c:]");
    expr(py.subscript(A, py.extSlice(py.slice(B, null, null))))
        .assertLine("a[b:,]");
  }

  @Test void testCall() {
    final Py.Name f = py.name("f");
    expr(py.call(f)).assertLine("f()");
    expr(py.call(f, ImmutableList.of(A, py.starred(B)),
        ImmutableList.of(py.keyword("k", py.constant(1)),
            py.keyword(null, C))))
        .assertLine("f(a, *b, k=1, **c)");
    expr(py.call(f, ImmutableList.of(),
        ImmutableList.of(py.keyword("k", py.tuple(A, B)))))
        .assertLine("f(k=(a, b))");
    expr(py.call(py.call(f, A), B)).assertLine("f(a)(b)");
  }

  @Test void testDisplays() {
    expr(py.list()).assertLine("[]");
    expr(py.set(A, B)).assertLine("{a, b}");
    expr(py.set()).assertLine("{1}.__class__()");
    expr(py.dict(ImmutableList.of(), ImmutableList.of())).assertLine("{}");
    expr(py.dict(Arrays.asList(A, null),
        ImmutableList.of(py.constant(1), B)))
        .assertLine("{a: 1, **b}");
    expr(py.dict(ImmutableList.of(A),
        ImmutableList.of(py.lambda(py.arguments(), B))))
        .assertLine("{a: lambda: b}");
  }

  /** A value unpacked into a dict binds at least as tightly as "|". */
  @Test void testDictUnpacking() {
    expr(py.dict(Arrays.asList((Py.Exp) null),
        ImmutableList.of(py.boolOp(Op.OR, A, B))))
        .assertLine("{**(a or b)}");
    expr(py.dict(Arrays.asList((Py.Exp) null),
        ImmutableList.of(py.compare(A, Op.EQ, B))))
        .assertLine("{**(a == b)}");
    expr(py.dict(Arrays.asList((Py.Exp) null),
        ImmutableList.of(py.ifExp(C, A, B))))
        .assertLine("{**(a if c else b)}");
    expr(py.dict(Arrays.asList((Py.Exp) null),
        ImmutableList.of(py.binOp(A, Op.BIT_OR, B))))
        .assertLine("{**a | b}");
    expr(py.dict(Arrays.asList(C, null),
        ImmutableList.of(py.boolOp(Op.OR, A, B), py.binOp(A, Op.ADD, B))))
        .assertLine("{c: a or b, **a + b}");
  }

  /** A statement's own precedence governs its child expressions. */
  @Test void testStatementContext() {
    Fixture.stmt(py.returnStmt(py.tuple(A, B))).assertLine("return a, b");
    Fixture.stmt(py.forStmt(false, py.tuple(A, B), C,
        ImmutableList.of(py.pass()), ImmutableList.of()))
        .assertSource("for a, b in c:\n    pass\n");
    Fixture.stmt(py.augAssign(py.name("x"), Op.ADD, py.tuple(A, B)))
        .assertLine("x += a, b");
    Fixture.stmt(py.assertStmt(A, py.tuple(B, C)))
        .assertLine("assert a, (b, c)");
  }
}

// End PrecedenceTest.java
